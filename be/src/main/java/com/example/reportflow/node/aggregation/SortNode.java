package com.example.reportflow.node.aggregation;

import com.example.reportflow.model.InvoiceRecord;
import com.example.reportflow.model.RecordSet;
import com.example.reportflow.node.AbstractRecordNode;
import com.example.reportflow.node.NodeCategory;
import com.example.reportflow.node.NodeMetadata;
import com.example.reportflow.node.NodeParameters;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Multi-key stable sort. Keys are applied last to first so the first declared key dominates.
 * Without {@code sort_by} records are sorted by invoice date, newest first.
 */
public class SortNode extends AbstractRecordNode {

    public static final String TYPE = "SortNode";
    public static final String SORT_BY = "sort_by";

    static final List<SortKey> DEFAULT_KEYS = List.of(new SortKey(InvoiceRecord.INVOICE_DATE, true));

    private static final NodeMetadata METADATA = new NodeMetadata(
            TYPE,
            "Sort",
            NodeCategory.AGGREGATION,
            "Sorts records by one or more fields",
            Map.of("records", "records", SORT_BY, "list of {field, order}"),
            Map.of("records", "sorted records")
    );

    @Override
    public NodeMetadata metadata() {
        return METADATA;
    }

    @Override
    protected RecordSet apply(RecordSet input, NodeParameters parameters) {
        List<SortKey> keys = parameters.has(SORT_BY)
                ? parameters.getObjectList(SORT_BY).stream().map(SortKey::fromMap).toList()
                : DEFAULT_KEYS;
        List<InvoiceRecord> sorted = new ArrayList<>(input.records());
        for (int i = keys.size() - 1; i >= 0; i--) {
            // List.sort is a stable merge sort
            sorted.sort(keys.get(i).comparator());
        }
        return input.withRecords(sorted);
    }
}
