package com.example.reportflow.node.calculation;

import com.example.reportflow.model.AgingBucket;
import com.example.reportflow.model.InvoiceRecord;
import com.example.reportflow.model.RecordSet;
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
 * Adds {@code aging_days}, {@code overdue_days} and {@code aging_bucket} to every record.
 * <p>
 * A record without a usable invoice date gets zero days and the {@code Unknown} bucket instead
 * of failing the batch.
 * </p>
 */
public class AgingCalculatorNode extends AbstractRecordNode {

    public static final String TYPE = "AgingCalculatorNode";
    public static final String AS_OF_DATE = "as_of_date";

    private static final Logger log = LoggerFactory.getLogger(AgingCalculatorNode.class);

    private static final NodeMetadata METADATA = new NodeMetadata(
            TYPE,
            "Aging Calculator",
            NodeCategory.CALCULATION,
            "Calculates aging days and assigns buckets (0-30, 31-60, 61-90, 90+)",
            Map.of("records", "invoices with invoice_date and optional due_date", AS_OF_DATE, "date to age from, defaults to today"),
            Map.of("records", "invoices with aging_days, overdue_days and aging_bucket")
    );

    private final Clock clock;

    public AgingCalculatorNode(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public NodeMetadata metadata() {
        return METADATA;
    }

    @Override
    protected RecordSet apply(RecordSet input, NodeParameters parameters) {
        LocalDate asOf = parameters.getDate(AS_OF_DATE).orElseGet(() -> LocalDate.now(clock));
        List<InvoiceRecord> aged = input.records().stream()
                .map(record -> age(record, asOf))
                .toList();
        log.debug("Calculated aging for {} records as of {}", aged.size(), asOf);
        return input.withRecords(aged);
    }

    private InvoiceRecord age(InvoiceRecord record, LocalDate asOf) {
        if (record.invoiceDate() == null) {
            log.warn("Record {} has no usable invoice date, assigning bucket {}", describe(record), AgingBucket.UNKNOWN.label());
            return record.toBuilder()
                    .agingDays(0)
                    .overdueDays(0)
                    .agingBucket(AgingBucket.UNKNOWN)
                    .build();
        }
        long agingDays = ChronoUnit.DAYS.between(record.invoiceDate(), asOf);
        long overdueDays = record.dueDate() != null ? ChronoUnit.DAYS.between(record.dueDate(), asOf) : 0;
        return record.toBuilder()
                .agingDays(Math.toIntExact(agingDays))
                .overdueDays(Math.toIntExact(overdueDays))
                .agingBucket(AgingBucket.forDays(agingDays))
                .build();
    }

    private static String describe(InvoiceRecord record) {
        if (record.invoiceNumber() != null) {
            return record.invoiceNumber();
        }
        return record.id() != null ? record.id() : "unknown";
    }
}
