package com.example.reportflow.model;

public final class PaymentStatus {

    public static final String PAID = "Paid";
    public static final String UNPAID = "Unpaid";
    public static final String PARTIALLY_PAID = "Partially Paid";

    private PaymentStatus() {
    }
}
