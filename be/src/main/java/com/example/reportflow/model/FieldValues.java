package com.example.reportflow.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * Type-aware comparison of record field values. Numbers compare numerically, dates
 * chronologically, booleans by value and everything else as text. Values of different kinds
 * order by kind: numbers, then dates, then booleans, then text.
 */
public final class FieldValues {

    /** Natural order over field values with {@code null} first. */
    public static final Comparator<Object> NULLS_FIRST = Comparator.nullsFirst(FieldValues::compareValues);

    private FieldValues() {
    }

    /**
     * Compares two non-null field values. The order is total, so mixed-type fields sort safely.
     */
    public static int compareValues(Object left, Object right) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        int byKind = Integer.compare(kindOf(left), kindOf(right));
        if (byKind != 0) {
            return byKind;
        }
        if (left instanceof Number) {
            return Amounts.toDecimal(left).compareTo(Amounts.toDecimal(right));
        }
        if (left instanceof LocalDate leftDate) {
            return leftDate.compareTo((LocalDate) right);
        }
        if (left instanceof Boolean leftFlag) {
            return Boolean.compare(leftFlag, (Boolean) right);
        }
        return text(left).compareTo(text(right));
    }

    private static int kindOf(Object value) {
        if (value instanceof Number) {
            return 0;
        }
        if (value instanceof LocalDate) {
            return 1;
        }
        if (value instanceof Boolean) {
            return 2;
        }
        return 3;
    }

    /**
     * Compares a record value with a condition operand, converting the operand to the record
     * value's type. Empty when the operand cannot be converted (the comparison then fails).
     */
    public static Optional<Integer> compareWithOperand(Object recordValue, Object operand) {
        if (recordValue == null || operand == null) {
            return Optional.empty();
        }
        if (recordValue instanceof Number) {
            BigDecimal expected = Amounts.toDecimal(operand);
            if (expected == null) {
                return Optional.empty();
            }
            return Optional.of(Amounts.toDecimal(recordValue).compareTo(expected));
        }
        if (recordValue instanceof LocalDate date) {
            return DateValues.parse(operand).map(date::compareTo);
        }
        if (recordValue instanceof Boolean flag) {
            if (operand instanceof Boolean expected) {
                return Optional.of(Boolean.compare(flag, expected));
            }
            String text = operand.toString().trim();
            if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
                return Optional.of(Boolean.compare(flag, Boolean.parseBoolean(text)));
            }
            return Optional.empty();
        }
        return Optional.of(text(recordValue).compareTo(text(operand)));
    }

    /**
     * Text form used for grouping keys and text comparison.
     */
    public static String text(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return String.valueOf(value);
    }
}
