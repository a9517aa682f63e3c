package com.example.reportflow.node.aggregation;

import com.example.reportflow.model.Amounts;
import com.example.reportflow.model.InvoiceRecord;
import com.example.reportflow.model.RecordGroup;
import com.example.reportflow.model.RecordSet;
import com.example.reportflow.model.Summary;
import com.example.reportflow.node.AbstractRecordNode;
import com.example.reportflow.node.NodeCategory;
import com.example.reportflow.node.NodeMetadata;
import com.example.reportflow.node.NodeParameters;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Count, sum, average, min and max of {@code amount_field} plus total outstanding.
 * <p>
 * Grouped input is summarized from the group subtotals; min and max are left out in that
 * case.
 * </p>
 */
public class SummaryNode extends AbstractRecordNode {

    public static final String TYPE = "SummaryNode";
    public static final String AMOUNT_FIELD = "amount_field";

    private static final NodeMetadata METADATA = new NodeMetadata(
            TYPE,
            "Summary",
            NodeCategory.AGGREGATION,
            "Computes count, sum, average, min and max over an amount field",
            Map.of("records", "records or groups", AMOUNT_FIELD, "amount field, defaults to total_amount"),
            Map.of("summary", "total_records, total_amount, total_outstanding, average_amount, min_amount, max_amount")
    );

    @Override
    public NodeMetadata metadata() {
        return METADATA;
    }

    @Override
    protected RecordSet apply(RecordSet input, NodeParameters parameters) {
        if (input.isGrouped()) {
            return input.withSummary(fromGroups(input));
        }
        String amountField = parameters.getString(AMOUNT_FIELD, InvoiceRecord.TOTAL_AMOUNT);
        return input.withSummary(fromRecords(input, amountField));
    }

    private static Summary fromGroups(RecordSet input) {
        long count = 0;
        BigDecimal total = BigDecimal.ZERO;
        BigDecimal outstanding = BigDecimal.ZERO;
        for (RecordGroup group : input.groups()) {
            count += group.count();
            total = total.add(group.totalAmount());
            outstanding = outstanding.add(group.totalOutstanding());
        }
        return new Summary(
                count,
                Amounts.round(total),
                Amounts.round(outstanding),
                average(total, count),
                null,
                null,
                average(outstanding, count),
                input.groups().size()
        );
    }

    private static Summary fromRecords(RecordSet input, String amountField) {
        long count = input.records().size();
        BigDecimal total = BigDecimal.ZERO;
        BigDecimal outstanding = BigDecimal.ZERO;
        BigDecimal min = null;
        BigDecimal max = null;
        for (InvoiceRecord record : input.records()) {
            BigDecimal amount = Amounts.orZero(Amounts.toDecimal(record.field(amountField)));
            total = total.add(amount);
            outstanding = outstanding.add(Amounts.orZero(record.outstanding()));
            min = min == null || amount.compareTo(min) < 0 ? amount : min;
            max = max == null || amount.compareTo(max) > 0 ? amount : max;
        }
        return new Summary(
                count,
                Amounts.round(total),
                Amounts.round(outstanding),
                average(total, count),
                Amounts.round(Amounts.orZero(min)),
                Amounts.round(Amounts.orZero(max)),
                average(outstanding, count),
                null
        );
    }

    private static BigDecimal average(BigDecimal sum, long count) {
        if (count == 0) {
            return Amounts.round(BigDecimal.ZERO);
        }
        return sum.divide(BigDecimal.valueOf(count), Amounts.SCALE, RoundingMode.HALF_UP);
    }
}
