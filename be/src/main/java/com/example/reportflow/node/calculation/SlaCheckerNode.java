package com.example.reportflow.node.calculation;

import com.example.reportflow.model.InvoiceRecord;
import com.example.reportflow.model.RecordSet;
import com.example.reportflow.model.SlaSeverity;
import com.example.reportflow.node.AbstractRecordNode;
import com.example.reportflow.node.NodeCategory;
import com.example.reportflow.node.NodeMetadata;
import com.example.reportflow.node.NodeParameters;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Flags records whose due date plus {@code sla_days} lies before {@code as_of_date} and grades
 * the breach. Records without a due date are never in breach.
 */
public class SlaCheckerNode extends AbstractRecordNode {

    public static final String TYPE = "SLACheckerNode";
    public static final String SLA_DAYS = "sla_days";
    public static final String AS_OF_DATE = "as_of_date";
    public static final int DEFAULT_SLA_DAYS = 30;

    private static final Logger log = LoggerFactory.getLogger(SlaCheckerNode.class);

    private static final NodeMetadata METADATA = new NodeMetadata(
            TYPE,
            "SLA Checker",
            NodeCategory.CALCULATION,
            "Checks SLA breaches and calculates severity",
            Map.of("records", "invoices with due_date", SLA_DAYS, "SLA threshold in days", AS_OF_DATE, "evaluation date, defaults to today"),
            Map.of("records", "invoices with sla_deadline, sla_breach, breach_days and sla_severity")
    );

    private final Clock clock;

    public SlaCheckerNode(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public NodeMetadata metadata() {
        return METADATA;
    }

    @Override
    protected RecordSet apply(RecordSet input, NodeParameters parameters) {
        int slaDays = parameters.getInt(SLA_DAYS, DEFAULT_SLA_DAYS);
        LocalDate asOf = parameters.getDate(AS_OF_DATE).orElseGet(() -> LocalDate.now(clock));
        List<InvoiceRecord> checked = input.records().stream()
                .map(record -> check(record, slaDays, asOf))
                .toList();
        long breaches = checked.stream().filter(r -> Boolean.TRUE.equals(r.slaBreach())).count();
        log.debug("Checked SLA for {} records: slaDays={} asOf={} breaches={}", checked.size(), slaDays, asOf, breaches);
        return input.withRecords(checked);
    }

    private static InvoiceRecord check(InvoiceRecord record, int slaDays, LocalDate asOf) {
        if (record.dueDate() == null) {
            return record.toBuilder()
                    .slaBreach(false)
                    .breachDays(0)
                    .slaSeverity(SlaSeverity.NONE)
                    .build();
        }
        LocalDate deadline = record.dueDate().plusDays(slaDays);
        if (!asOf.isAfter(deadline)) {
            return record.toBuilder()
                    .slaDeadline(deadline)
                    .slaBreach(false)
                    .breachDays(0)
                    .slaSeverity(SlaSeverity.NONE)
                    .build();
        }
        long breachDays = ChronoUnit.DAYS.between(deadline, asOf);
        return record.toBuilder()
                .slaDeadline(deadline)
                .slaBreach(true)
                .breachDays(Math.toIntExact(breachDays))
                .slaSeverity(SlaSeverity.forBreachDays(breachDays))
                .build();
    }
}
