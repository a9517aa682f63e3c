package com.example.reportflow.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Records sharing one value of the grouping field, with their subtotals.
 */
public record RecordGroup(
        @JsonProperty("group_name") String groupName,
        List<InvoiceRecord> records,
        int count,
        @JsonProperty("total_amount") BigDecimal totalAmount,
        @JsonProperty("total_outstanding") BigDecimal totalOutstanding
) {
    public RecordGroup {
        Objects.requireNonNull(groupName, "groupName");
        records = records != null ? List.copyOf(records) : List.of();
        totalAmount = Amounts.orZero(totalAmount);
        totalOutstanding = Amounts.orZero(totalOutstanding);
    }
}
