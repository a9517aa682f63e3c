package com.example.reportflow.node.calculation;

import com.example.reportflow.model.InvoiceRecord;
import com.example.reportflow.model.RecordSet;
import com.example.reportflow.model.SlaSeverity;
import com.example.reportflow.node.NodeParameters;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("SlaCheckerNode")
class SlaCheckerNodeTest {

    private static final LocalDate AS_OF = LocalDate.of(2025, 3, 31);

    private final SlaCheckerNode node = new SlaCheckerNode(Clock.fixed(Instant.parse("2025-03-31T00:00:00Z"), ZoneOffset.UTC));

    private InvoiceRecord check(LocalDate dueDate, Map<String, Object> parameters) {
        RecordSet result = (RecordSet) node.run(RecordSet.of(List.of(InvoiceRecord.builder().dueDate(dueDate).build())),
                NodeParameters.of(parameters));
        return result.records().get(0);
    }

    @ParameterizedTest(name = "{0} days past deadline -> {1}")
    @CsvSource({
            "1, Low",
            "7, Low",
            "8, Medium",
            "14, Medium",
            "15, High",
            "30, High",
            "31, Critical"
    })
    void severity(int breachDays, String severity) {
        LocalDate due = AS_OF.minusDays(30L + breachDays);

        InvoiceRecord record = check(due, Map.of("sla_days", 30, "as_of_date", AS_OF.toString()));

        assertTrue(record.slaBreach());
        assertEquals(breachDays, record.breachDays());
        assertEquals(severity, record.slaSeverity().label());
        assertEquals(due.plusDays(30), record.slaDeadline());
    }

    @Test
    @DisplayName("evaluation on the deadline itself is not a breach")
    void onDeadline() {
        InvoiceRecord record = check(AS_OF.minusDays(10), Map.of("sla_days", 10, "as_of_date", AS_OF.toString()));

        assertFalse(record.slaBreach());
        assertEquals(0, record.breachDays());
        assertEquals(SlaSeverity.NONE, record.slaSeverity());
    }

    @Test
    @DisplayName("a record without due date is never in breach")
    void noDueDate() {
        InvoiceRecord record = check(null, Map.of());

        assertFalse(record.slaBreach());
        assertEquals(SlaSeverity.NONE, record.slaSeverity());
        assertNull(record.slaDeadline());
    }

    @Test
    @DisplayName("defaults to 30 SLA days and the clock date")
    void defaults() {
        InvoiceRecord record = check(AS_OF.minusDays(31), Map.of());

        assertTrue(record.slaBreach());
        assertEquals(1, record.breachDays());
    }
}
