package com.example.reportflow.node.calculation;

import com.example.reportflow.model.Amounts;
import com.example.reportflow.model.InvoiceRecord;
import com.example.reportflow.model.RecordSet;
import com.example.reportflow.model.Totals;
import com.example.reportflow.node.AbstractRecordNode;
import com.example.reportflow.node.NodeCategory;
import com.example.reportflow.node.NodeMetadata;
import com.example.reportflow.node.NodeParameters;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Report totals over all records. {@code invoice_amt} is the subtotal net of tax and
 * {@code net_amt} the invoice total including tax. A record that has not been through the
 * outstanding calculation counts {@code total - paid} as outstanding.
 */
public class TotalsCalculationNode extends AbstractRecordNode {

    public static final String TYPE = "TotalsCalculationNode";

    private static final NodeMetadata METADATA = new NodeMetadata(
            TYPE,
            "Totals Calculator",
            NodeCategory.CALCULATION,
            "Calculates totals and summary figures for invoices",
            Map.of("records", "invoices"),
            Map.of("totals", "invoice_amt, tax_amt, net_amt, paid_amt and outstanding")
    );

    @Override
    public NodeMetadata metadata() {
        return METADATA;
    }

    @Override
    protected RecordSet apply(RecordSet input, NodeParameters parameters) {
        if (input.records().isEmpty()) {
            return input.withTotals(Totals.zero());
        }
        BigDecimal gross = BigDecimal.ZERO;
        BigDecimal tax = BigDecimal.ZERO;
        BigDecimal paid = BigDecimal.ZERO;
        BigDecimal outstanding = BigDecimal.ZERO;
        for (InvoiceRecord record : input.records()) {
            BigDecimal total = Amounts.orZero(record.totalAmount());
            BigDecimal recordOutstanding = record.outstanding() != null
                    ? record.outstanding()
                    : total.subtract(Amounts.orZero(record.paidAmount()));
            gross = gross.add(total);
            tax = tax.add(Amounts.orZero(record.taxAmount()));
            paid = paid.add(total.subtract(recordOutstanding));
            outstanding = outstanding.add(recordOutstanding);
        }
        return input.withTotals(new Totals(
                Amounts.round(gross.subtract(tax)),
                Amounts.round(tax),
                Amounts.round(gross),
                Amounts.round(paid),
                Amounts.round(outstanding)
        ));
    }
}
