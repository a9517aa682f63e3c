package com.example.reportflow.node.aggregation;

import com.example.reportflow.model.AgingBucket;
import com.example.reportflow.model.Amounts;
import com.example.reportflow.model.FieldValues;
import com.example.reportflow.model.InvoiceRecord;
import com.example.reportflow.model.RecordGroup;
import com.example.reportflow.model.RecordSet;
import com.example.reportflow.node.AbstractRecordNode;
import com.example.reportflow.node.NodeCategory;
import com.example.reportflow.node.NodeMetadata;
import com.example.reportflow.node.NodeParameters;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partitions records by the value of {@code group_by} (default {@code aging_bucket}).
 * <p>
 * Aging buckets come out in display order ({@code 0-30, 31-60, 61-90, 90+, Unknown}); any other
 * field is ordered lexically by key. Records missing the field land in {@code Unknown}. Within a
 * group records keep their input order.
 * </p>
 */
public class GroupingNode extends AbstractRecordNode {

    public static final String TYPE = "GroupingNode";
    public static final String GROUP_BY = "group_by";
    public static final String UNKNOWN_GROUP = "Unknown";

    private static final Logger log = LoggerFactory.getLogger(GroupingNode.class);

    private static final NodeMetadata METADATA = new NodeMetadata(
            TYPE,
            "Grouping",
            NodeCategory.AGGREGATION,
            "Groups records by a field (default aging_bucket) with subtotals",
            Map.of("records", "records", GROUP_BY, "field to group by"),
            Map.of("groups", "group_name, records, count, total_amount, total_outstanding")
    );

    @Override
    public NodeMetadata metadata() {
        return METADATA;
    }

    @Override
    protected RecordSet apply(RecordSet input, NodeParameters parameters) {
        String field = parameters.getString(GROUP_BY, InvoiceRecord.AGING_BUCKET);
        Map<String, List<InvoiceRecord>> partitions = new LinkedHashMap<>();
        for (InvoiceRecord record : input.records()) {
            Object value = record.field(field);
            String key = value != null ? FieldValues.text(value) : UNKNOWN_GROUP;
            partitions.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
        }

        List<String> keys = new ArrayList<>(partitions.keySet());
        keys.sort(keyOrder(field));

        List<RecordGroup> groups = new ArrayList<>(keys.size());
        for (String key : keys) {
            groups.add(toGroup(key, partitions.get(key)));
        }
        log.debug("Grouped {} records by {} into {} groups", input.records().size(), field, groups.size());
        return input.withGroups(groups);
    }

    private static Comparator<String> keyOrder(String field) {
        if (InvoiceRecord.AGING_BUCKET.equals(field)) {
            return Comparator.comparingInt(AgingBucket::displayRank).thenComparing(Comparator.naturalOrder());
        }
        return Comparator.naturalOrder();
    }

    private static RecordGroup toGroup(String name, List<InvoiceRecord> records) {
        BigDecimal total = BigDecimal.ZERO;
        BigDecimal outstanding = BigDecimal.ZERO;
        for (InvoiceRecord record : records) {
            total = total.add(Amounts.orZero(record.totalAmount()));
            outstanding = outstanding.add(Amounts.orZero(record.outstanding()));
        }
        return new RecordGroup(name, records, records.size(), Amounts.round(total), Amounts.round(outstanding));
    }
}
