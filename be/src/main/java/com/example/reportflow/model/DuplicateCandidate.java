package com.example.reportflow.model;

import java.util.List;
import java.util.Objects;

/**
 * A pair of records that are likely the same invoice. The first record is the one seen earlier.
 */
public record DuplicateCandidate(List<InvoiceRecord> group, int confidence, DuplicateType type, String reason) {

    public DuplicateCandidate {
        Objects.requireNonNull(type, "type");
        group = List.copyOf(group);
    }

    public static DuplicateCandidate of(DuplicateType type, InvoiceRecord first, InvoiceRecord second, String reason) {
        return new DuplicateCandidate(List.of(first, second), type.confidence(), type, reason);
    }
}
