package com.example.reportflow.node.aggregation;

import com.example.reportflow.model.InvoiceRecord;
import com.example.reportflow.model.RecordSet;
import com.example.reportflow.node.NodeParameters;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("FilterNode")
class FilterNodeTest {

    private final FilterNode node = new FilterNode();

    private static final List<Map<String, Object>> RECORDS = List.of(
            Map.of("id", "a", "counterparty", "Acme", "total_amount", 100, "invoice_date", "2025-01-01", "status", "Paid"),
            Map.of("id", "b", "counterparty", "Globex", "total_amount", 250, "invoice_date", "2025-01-15", "status", "Unpaid"),
            Map.of("id", "c", "counterparty", "Acme", "total_amount", 400, "status", "Partially Paid")
    );

    private List<String> filter(Map<String, Object>... conditions) {
        RecordSet result = (RecordSet) node.run(RECORDS, NodeParameters.of(Map.of("conditions", List.of(conditions))));
        return result.records().stream().map(InvoiceRecord::id).toList();
    }

    private static Map<String, Object> condition(String field, String operator, Object value) {
        return Map.of("field", field, "operator", operator, "value", value);
    }

    @Nested
    @DisplayName("operators")
    class Operators {

        @Test
        @DisplayName("= and == compare for equality")
        void equality() {
            assertEquals(List.of("a", "c"), filter(condition("counterparty", "=", "Acme")));
            assertEquals(List.of("a", "c"), filter(condition("counterparty", "==", "Acme")));
            assertEquals(List.of("b"), filter(condition("total_amount", "=", "250.00")));
        }

        @Test
        @DisplayName("!= excludes equal values")
        void notEqual() {
            assertEquals(List.of("b"), filter(condition("counterparty", "!=", "Acme")));
        }

        @Test
        @DisplayName("numeric comparisons")
        void numeric() {
            assertEquals(List.of("c"), filter(condition("total_amount", ">", 250)));
            assertEquals(List.of("b", "c"), filter(condition("total_amount", ">=", 250)));
            assertEquals(List.of("a"), filter(condition("total_amount", "<", 250)));
            assertEquals(List.of("a", "b"), filter(condition("total_amount", "<=", 250)));
        }

        @Test
        @DisplayName("date comparisons")
        void dates() {
            assertEquals(List.of("b"), filter(condition("invoice_date", ">", "2025-01-10")));
        }

        @Test
        @DisplayName("in matches any listed value")
        void in() {
            assertEquals(List.of("b", "c"), filter(condition("status", "in", List.of("Unpaid", "Partially Paid"))));
        }
    }

    @Test
    @DisplayName("conditions are combined with AND")
    void and() {
        assertEquals(List.of("c"), filter(condition("counterparty", "=", "Acme"), condition("total_amount", ">", 100)));
    }

    @Test
    @DisplayName("a missing field fails every operator")
    void missingField() {
        assertEquals(List.of(), filter(condition("region", "!=", "North")));
        assertEquals(List.of("a", "b"), filter(condition("invoice_date", "<=", "2030-01-01")));
    }

    @Test
    @DisplayName("no conditions keeps every record")
    void noConditions() {
        RecordSet result = (RecordSet) node.run(RECORDS, NodeParameters.empty());
        assertEquals(3, result.records().size());
    }

    @Test
    @DisplayName("rejects unsupported operators and malformed conditions")
    void rejectsInvalid() {
        assertThatThrownBy(() -> filter(condition("total_amount", "like", 1))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> filter(Map.of("operator", "="))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> filter(condition("status", "in", "Paid"))).isInstanceOf(IllegalArgumentException.class);
    }
}
