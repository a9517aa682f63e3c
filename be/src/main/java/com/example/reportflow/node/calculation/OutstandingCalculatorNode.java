package com.example.reportflow.node.calculation;

import com.example.reportflow.model.Amounts;
import com.example.reportflow.model.InvoiceRecord;
import com.example.reportflow.model.PaymentStatus;
import com.example.reportflow.model.RecordSet;
import com.example.reportflow.node.AbstractRecordNode;
import com.example.reportflow.node.NodeCategory;
import com.example.reportflow.node.NodeMetadata;
import com.example.reportflow.node.NodeParameters;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Calculates {@code outstanding = total - paid}, {@code gross = total - tax} and the payment
 * status. Amounts are expected in the base currency already.
 */
public class OutstandingCalculatorNode extends AbstractRecordNode {

    public static final String TYPE = "OutstandingCalculatorNode";

    private static final Logger log = LoggerFactory.getLogger(OutstandingCalculatorNode.class);

    private static final NodeMetadata METADATA = new NodeMetadata(
            TYPE,
            "Outstanding Calculator",
            NodeCategory.CALCULATION,
            "Calculates outstanding amount and invoice status",
            Map.of("records", "invoices with total_amount, paid_amount and tax_amount"),
            Map.of("records", "invoices with outstanding, gross_amount and status")
    );

    @Override
    public NodeMetadata metadata() {
        return METADATA;
    }

    @Override
    protected RecordSet apply(RecordSet input, NodeParameters parameters) {
        List<InvoiceRecord> calculated = input.records().stream()
                .map(OutstandingCalculatorNode::calculate)
                .toList();
        log.debug("Calculated outstanding for {} records", calculated.size());
        return input.withRecords(calculated);
    }

    private static InvoiceRecord calculate(InvoiceRecord record) {
        BigDecimal total = Amounts.orZero(record.totalAmount());
        BigDecimal paid = Amounts.orZero(record.paidAmount());
        BigDecimal tax = Amounts.orZero(record.taxAmount());
        return record.toBuilder()
                .outstanding(Amounts.round(total.subtract(paid)))
                .grossAmount(Amounts.round(total.subtract(tax)))
                .status(status(total, paid))
                .build();
    }

    static String status(BigDecimal total, BigDecimal paid) {
        if (paid.compareTo(total) >= 0) {
            return PaymentStatus.PAID;
        }
        if (paid.signum() <= 0) {
            return PaymentStatus.UNPAID;
        }
        return PaymentStatus.PARTIALLY_PAID;
    }
}
