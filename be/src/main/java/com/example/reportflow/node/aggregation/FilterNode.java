package com.example.reportflow.node.aggregation;

import com.example.reportflow.model.InvoiceRecord;
import com.example.reportflow.model.RecordSet;
import com.example.reportflow.node.AbstractRecordNode;
import com.example.reportflow.node.NodeCategory;
import com.example.reportflow.node.NodeMetadata;
import com.example.reportflow.node.NodeParameters;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Keeps the records that satisfy every condition in {@code conditions}. Groups, if present,
 * are dropped because they no longer describe the remaining records.
 */
public class FilterNode extends AbstractRecordNode {

    public static final String TYPE = "FilterNode";
    public static final String CONDITIONS = "conditions";

    private static final Logger log = LoggerFactory.getLogger(FilterNode.class);

    private static final NodeMetadata METADATA = new NodeMetadata(
            TYPE,
            "Filter",
            NodeCategory.AGGREGATION,
            "Filters records by conditions (=, !=, >, <, >=, <=, in)",
            Map.of("records", "records", CONDITIONS, "list of {field, operator, value}"),
            Map.of("records", "records matching all conditions")
    );

    @Override
    public NodeMetadata metadata() {
        return METADATA;
    }

    @Override
    protected RecordSet apply(RecordSet input, NodeParameters parameters) {
        List<FilterCondition> conditions = parameters.getObjectList(CONDITIONS).stream()
                .map(FilterCondition::fromMap)
                .toList();
        if (conditions.isEmpty()) {
            return input;
        }
        List<InvoiceRecord> kept = input.records().stream()
                .filter(record -> conditions.stream().allMatch(condition -> condition.matches(record)))
                .toList();
        log.debug("Filter kept {} of {} records", kept.size(), input.records().size());
        return input.withRecords(kept).withGroups(null);
    }
}
