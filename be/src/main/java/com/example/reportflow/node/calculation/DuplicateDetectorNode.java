package com.example.reportflow.node.calculation;

import com.example.reportflow.model.Amounts;
import com.example.reportflow.model.DuplicateCandidate;
import com.example.reportflow.model.DuplicateReport;
import com.example.reportflow.model.DuplicateType;
import com.example.reportflow.model.InvoiceRecord;
import com.example.reportflow.model.RecordSet;
import com.example.reportflow.node.AbstractRecordNode;
import com.example.reportflow.node.NodeCategory;
import com.example.reportflow.node.NodeMetadata;
import com.example.reportflow.node.NodeParameters;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Finds likely duplicate invoices.
 * <ul>
 *     <li>exact: same counterparty and invoice number (confidence 100)</li>
 *     <li>fuzzy: same counterparty and invoice date, amounts within {@code tolerance},
 *     different invoice numbers (confidence 75)</li>
 * </ul>
 * Records are passed through; the candidates are attached as {@code duplicates}.
 */
public class DuplicateDetectorNode extends AbstractRecordNode {

    public static final String TYPE = "DuplicateDetectorNode";
    public static final String TOLERANCE = "tolerance";
    public static final BigDecimal DEFAULT_TOLERANCE = new BigDecimal("0.01");

    static final String EXACT_REASON = "Same counterparty and invoice number";
    static final String FUZZY_REASON = "Same counterparty, amount, and date but different invoice number";

    private static final Logger log = LoggerFactory.getLogger(DuplicateDetectorNode.class);

    private static final NodeMetadata METADATA = new NodeMetadata(
            TYPE,
            "Duplicate Detector",
            NodeCategory.CALCULATION,
            "Detects exact and fuzzy duplicate invoices",
            Map.of("records", "invoices", TOLERANCE, "absolute amount difference allowed for fuzzy matches"),
            Map.of("duplicates", "exact and fuzzy duplicate candidates")
    );

    private record ExactKey(String counterparty, String invoiceNumber) {
    }

    private record FuzzyKey(String counterparty, LocalDate invoiceDate) {
    }

    @Override
    public NodeMetadata metadata() {
        return METADATA;
    }

    @Override
    protected RecordSet apply(RecordSet input, NodeParameters parameters) {
        BigDecimal tolerance = parameters.getDecimal(TOLERANCE, DEFAULT_TOLERANCE);
        if (tolerance.signum() < 0) {
            throw new IllegalArgumentException("Parameter 'tolerance' must not be negative: " + tolerance);
        }
        List<DuplicateCandidate> exact = new ArrayList<>();
        List<DuplicateCandidate> fuzzy = new ArrayList<>();
        Map<ExactKey, InvoiceRecord> exactIndex = new HashMap<>();
        Map<FuzzyKey, List<InvoiceRecord>> fuzzyIndex = new HashMap<>();

        for (InvoiceRecord record : input.records()) {
            if (record.counterparty() == null) {
                continue;
            }
            if (record.invoiceNumber() != null) {
                ExactKey key = new ExactKey(record.counterparty(), record.invoiceNumber());
                InvoiceRecord existing = exactIndex.putIfAbsent(key, record);
                if (existing != null) {
                    exact.add(DuplicateCandidate.of(DuplicateType.EXACT, existing, record, EXACT_REASON));
                }
            }
            if (record.invoiceDate() != null) {
                FuzzyKey key = new FuzzyKey(record.counterparty(), record.invoiceDate());
                List<InvoiceRecord> sameDay = fuzzyIndex.computeIfAbsent(key, k -> new ArrayList<>());
                BigDecimal amount = Amounts.orZero(record.totalAmount());
                for (InvoiceRecord existing : sameDay) {
                    BigDecimal diff = amount.subtract(Amounts.orZero(existing.totalAmount())).abs();
                    if (diff.compareTo(tolerance) <= 0 && !Objects.equals(record.invoiceNumber(), existing.invoiceNumber())) {
                        fuzzy.add(DuplicateCandidate.of(DuplicateType.FUZZY, existing, record, FUZZY_REASON));
                    }
                }
                sameDay.add(record);
            }
        }
        log.debug("Detected {} exact and {} fuzzy duplicates in {} records", exact.size(), fuzzy.size(), input.records().size());
        return input.withDuplicates(new DuplicateReport(exact, fuzzy));
    }
}
