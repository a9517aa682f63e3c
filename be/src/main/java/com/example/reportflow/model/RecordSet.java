package com.example.reportflow.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Canonical envelope every record-processing node accepts and emits.
 * <p>
 * {@code records} is always present; the optional parts are attached by the nodes that
 * compute them and carried along by later nodes.
 * </p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecordSet(
        List<InvoiceRecord> records,
        List<RecordGroup> groups,
        Summary summary,
        Totals totals,
        DuplicateReport duplicates
) {

    private static final RecordSet EMPTY = new RecordSet(List.of(), null, null, null, null);

    public RecordSet {
        records = records != null ? List.copyOf(records) : List.of();
        groups = groups != null ? List.copyOf(groups) : null;
    }

    public static RecordSet empty() {
        return EMPTY;
    }

    public static RecordSet of(List<InvoiceRecord> records) {
        return new RecordSet(records, null, null, null, null);
    }

    public boolean isGrouped() {
        return groups != null;
    }

    public RecordSet withRecords(List<InvoiceRecord> newRecords) {
        return new RecordSet(newRecords, groups, summary, totals, duplicates);
    }

    public RecordSet withGroups(List<RecordGroup> newGroups) {
        return new RecordSet(records, newGroups, summary, totals, duplicates);
    }

    public RecordSet withSummary(Summary newSummary) {
        return new RecordSet(records, groups, newSummary, totals, duplicates);
    }

    public RecordSet withTotals(Totals newTotals) {
        return new RecordSet(records, groups, summary, newTotals, duplicates);
    }

    public RecordSet withDuplicates(DuplicateReport newDuplicates) {
        return new RecordSet(records, groups, summary, totals, newDuplicates);
    }
}
