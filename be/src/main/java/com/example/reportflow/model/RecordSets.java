package com.example.reportflow.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Coerces a node input into the {@link RecordSet} envelope.
 * <p>
 * Accepted shapes: an envelope, a collection of records or of key/value maps, or a map
 * carrying the records under {@code records} (or {@code invoices}). Fan-in input is rejected;
 * it has to go through a merging node first.
 * </p>
 */
public final class RecordSets {

    private RecordSets() {
    }

    public static RecordSet from(Object input) {
        if (input == null) {
            return RecordSet.empty();
        }
        if (input instanceof RecordSet recordSet) {
            return recordSet;
        }
        if (input instanceof FanInInput fanIn) {
            throw new IllegalArgumentException("Input merges " + fanIn.size() + " predecessors " + fanIn.outputsBySource().keySet()
                    + "; combine them with RecordMergeNode first");
        }
        if (input instanceof Collection<?> items) {
            return RecordSet.of(toRecords(items));
        }
        if (input instanceof Map<?, ?> map) {
            if (map.isEmpty()) {
                return RecordSet.empty();
            }
            if (!map.containsKey("records") && !map.containsKey("invoices")) {
                throw new IllegalArgumentException("Expected 'records' in input map with keys " + map.keySet());
            }
            Object records = map.containsKey("records") ? map.get("records") : map.get("invoices");
            if (records == null) {
                return RecordSet.empty();
            }
            if (records instanceof Collection<?> items) {
                return RecordSet.of(toRecords(items));
            }
            throw new IllegalArgumentException("Expected a list of records but got " + records.getClass().getSimpleName());
        }
        throw new IllegalArgumentException("Unsupported node input type: " + input.getClass().getSimpleName());
    }

    @SuppressWarnings("unchecked")
    private static List<InvoiceRecord> toRecords(Collection<?> items) {
        List<InvoiceRecord> records = new ArrayList<>(items.size());
        for (Object item : items) {
            if (item instanceof InvoiceRecord record) {
                records.add(record);
            } else if (item instanceof Map<?, ?> map) {
                records.add(InvoiceRecord.fromMap((Map<String, ?>) map));
            } else {
                throw new IllegalArgumentException("Unsupported record type: " + (item != null ? item.getClass().getSimpleName() : "null"));
            }
        }
        return records;
    }
}
