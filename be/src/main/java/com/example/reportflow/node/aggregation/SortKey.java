package com.example.reportflow.node.aggregation;

import com.example.reportflow.model.FieldValues;
import com.example.reportflow.model.InvoiceRecord;

import java.util.Comparator;
import java.util.Map;
import java.util.Objects;

/**
 * One {@code {field, order}} key of a {@link SortNode}. Missing values sort first in ascending
 * order and last in descending order.
 */
public record SortKey(String field, boolean descending) {

    public SortKey {
        Objects.requireNonNull(field, "field");
    }

    public static SortKey fromMap(Map<String, Object> source) {
        Object field = source.get("field");
        if (field == null || field.toString().isBlank()) {
            throw new IllegalArgumentException("Sort key is missing 'field': " + source);
        }
        Object order = source.getOrDefault("order", "asc");
        String normalized = String.valueOf(order).trim().toLowerCase();
        if (!normalized.equals("asc") && !normalized.equals("desc")) {
            throw new IllegalArgumentException("Sort order must be 'asc' or 'desc' but was: " + order);
        }
        return new SortKey(field.toString(), normalized.equals("desc"));
    }

    public Comparator<InvoiceRecord> comparator() {
        Comparator<InvoiceRecord> ascending = Comparator.comparing(record -> record.field(field), FieldValues.NULLS_FIRST);
        return descending ? ascending.reversed() : ascending;
    }
}
