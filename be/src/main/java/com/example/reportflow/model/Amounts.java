package com.example.reportflow.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Monetary value helpers. Amounts are held as {@link BigDecimal} and rounded half-up
 * to two decimals only where a node calculates them.
 */
public final class Amounts {

    public static final int SCALE = 2;

    private Amounts() {
    }

    /**
     * Converts a raw value (number or numeric string) to a decimal; returns {@code null}
     * for null, blank or non-numeric values.
     */
    public static BigDecimal toDecimal(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    public static BigDecimal round(BigDecimal value) {
        return orZero(value).setScale(SCALE, RoundingMode.HALF_UP);
    }
}
