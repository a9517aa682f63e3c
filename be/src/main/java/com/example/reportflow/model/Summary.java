package com.example.reportflow.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Summary statistics over a record set or over precomputed group subtotals.
 * Minimum and maximum are only present when raw records were scanned.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Summary(
        @JsonProperty("total_records") long totalRecords,
        @JsonProperty("total_amount") BigDecimal totalAmount,
        @JsonProperty("total_outstanding") BigDecimal totalOutstanding,
        @JsonProperty("average_amount") BigDecimal averageAmount,
        @JsonProperty("min_amount") BigDecimal minAmount,
        @JsonProperty("max_amount") BigDecimal maxAmount,
        @JsonProperty("average_outstanding") BigDecimal averageOutstanding,
        @JsonProperty("total_groups") Integer totalGroups
) {
}
