package com.example.reportflow.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("FieldValues")
class FieldValuesTest {

    @Test
    @DisplayName("compares numbers numerically regardless of type")
    void comparesNumbers() {
        assertThat(FieldValues.compareValues(new BigDecimal("10.0"), 9)).isPositive();
        assertEquals(0, FieldValues.compareValues(new BigDecimal("10.00"), 10L));
    }

    @Test
    @DisplayName("orders values of different kinds by kind so the order stays transitive")
    void ordersKindsConsistently() {
        assertThat(FieldValues.compareValues(9.5, 10)).isNegative();
        assertThat(FieldValues.compareValues(10, "9")).isNegative();
        assertThat(FieldValues.compareValues(9.5, "9")).isNegative();
        assertThat(FieldValues.compareValues(LocalDate.of(2025, 1, 1), 1)).isPositive();
        assertThat(FieldValues.compareValues(true, LocalDate.of(2025, 1, 1))).isPositive();
        assertThat(FieldValues.compareValues("false", true)).isPositive();
    }

    @Test
    @DisplayName("coerces the operand to the record value type")
    void coercesOperand() {
        assertEquals(Optional.of(0), FieldValues.compareWithOperand(new BigDecimal("100"), "100.00"));
        assertThat(FieldValues.compareWithOperand(LocalDate.of(2025, 1, 10), "2025-01-01").orElseThrow()).isPositive();
        assertEquals(Optional.of(0), FieldValues.compareWithOperand(true, "true"));
    }

    @Test
    @DisplayName("is empty when the operand cannot be converted")
    void emptyWhenNotConvertible() {
        assertThat(FieldValues.compareWithOperand(new BigDecimal("1"), "abc")).isEmpty();
        assertThat(FieldValues.compareWithOperand(LocalDate.of(2025, 1, 1), "soon")).isEmpty();
        assertThat(FieldValues.compareWithOperand(null, 1)).isEmpty();
    }

    @Test
    @DisplayName("sorts nulls first")
    void nullsFirst() {
        assertThat(FieldValues.NULLS_FIRST.compare(null, "a")).isNegative();
    }
}
