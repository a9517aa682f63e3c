package com.example.reportflow.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Report totals. {@code invoice_amt} is the subtotal before tax and {@code net_amt} the invoice
 * total including tax, the field names reporting consumers already read.
 */
public record Totals(
        @JsonProperty("invoice_amt") BigDecimal invoiceAmount,
        @JsonProperty("tax_amt") BigDecimal taxAmount,
        @JsonProperty("net_amt") BigDecimal netAmount,
        @JsonProperty("paid_amt") BigDecimal paidAmount,
        @JsonProperty("outstanding") BigDecimal outstanding
) {
    public static Totals zero() {
        BigDecimal zero = Amounts.round(BigDecimal.ZERO);
        return new Totals(zero, zero, zero, zero, zero);
    }
}
