package com.example.reportflow.node.calculation;

import com.example.reportflow.model.AgingBucket;
import com.example.reportflow.model.InvoiceRecord;
import com.example.reportflow.model.RecordSet;
import com.example.reportflow.node.NodeParameters;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("AgingCalculatorNode")
class AgingCalculatorNodeTest {

    private static final LocalDate AS_OF = LocalDate.of(2025, 1, 30);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC);

    private final AgingCalculatorNode node = new AgingCalculatorNode(CLOCK);

    private static NodeParameters asOf(LocalDate date) {
        return NodeParameters.of(Map.of("as_of_date", date.toString()));
    }

    private InvoiceRecord age(InvoiceRecord record, NodeParameters parameters) {
        RecordSet result = (RecordSet) node.run(RecordSet.of(List.of(record)), parameters);
        return result.records().get(0);
    }

    @Nested
    @DisplayName("bucket boundaries")
    class Boundaries {

        @ParameterizedTest(name = "{0} days -> {1}")
        @CsvSource({
                "0, 0-30",
                "30, 0-30",
                "31, 31-60",
                "60, 31-60",
                "61, 61-90",
                "90, 61-90",
                "91, 90+",
                "400, 90+"
        })
        void bucketForAge(int days, String bucket) {
            InvoiceRecord aged = age(InvoiceRecord.builder().invoiceDate(AS_OF.minusDays(days)).build(), asOf(AS_OF));

            assertEquals(days, aged.agingDays());
            assertEquals(bucket, aged.agingBucket().label());
        }
    }

    @Test
    @DisplayName("calculates overdue days from the due date")
    void overdueDays() {
        InvoiceRecord aged = age(InvoiceRecord.builder()
                .invoiceDate(LocalDate.of(2024, 12, 1))
                .dueDate(LocalDate.of(2024, 12, 31))
                .build(), asOf(AS_OF));

        assertEquals(60, aged.agingDays());
        assertEquals(30, aged.overdueDays());
    }

    @Test
    @DisplayName("a due date in the future gives negative overdue days")
    void notYetDue() {
        InvoiceRecord aged = age(InvoiceRecord.builder()
                .invoiceDate(LocalDate.of(2025, 1, 20))
                .dueDate(LocalDate.of(2025, 2, 4))
                .build(), asOf(AS_OF));

        assertEquals(-5, aged.overdueDays());
    }

    @Test
    @DisplayName("a record without invoice date gets zero days and the Unknown bucket")
    void missingDate() {
        RecordSet result = (RecordSet) node.run(List.of(
                Map.of("invoice_number", "A", "invoice_date", "garbage"),
                Map.of("invoice_number", "B", "invoice_date", "2025-01-29")
        ), asOf(AS_OF));

        assertEquals(0, result.records().get(0).agingDays());
        assertEquals(AgingBucket.UNKNOWN, result.records().get(0).agingBucket());
        assertEquals(1, result.records().get(1).agingDays());
    }

    @Test
    @DisplayName("ages from the clock when as_of_date is omitted")
    void defaultsToClock() {
        InvoiceRecord aged = age(InvoiceRecord.builder().invoiceDate(LocalDate.of(2025, 2, 1)).build(), NodeParameters.empty());

        assertEquals(28, aged.agingDays());
    }

    @Test
    @DisplayName("fails on an unparseable as_of_date")
    void badAsOfDate() {
        assertThatThrownBy(() -> node.run(List.of(), NodeParameters.of(Map.of("as_of_date", "tomorrow"))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("returns identical output for identical input")
    void deterministic() {
        List<Map<String, Object>> input = List.of(Map.of("invoice_date", "2024-11-15", "total_amount", 10));
        assertEquals(node.run(input, asOf(AS_OF)), node.run(input, asOf(AS_OF)));
    }
}
