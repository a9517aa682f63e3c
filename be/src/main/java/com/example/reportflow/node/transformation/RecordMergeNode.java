package com.example.reportflow.node.transformation;

import com.example.reportflow.model.FanInInput;
import com.example.reportflow.model.InvoiceRecord;
import com.example.reportflow.model.RecordSet;
import com.example.reportflow.model.RecordSets;
import com.example.reportflow.node.NodeCategory;
import com.example.reportflow.node.NodeMetadata;
import com.example.reportflow.node.NodeParameters;
import com.example.reportflow.node.WorkflowNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Combines the outputs of several predecessors into one record set by concatenating their
 * records in predecessor order. {@code sources} restricts and reorders the predecessors taken.
 * A single record set passes through unchanged; for fan-in input only the records are kept.
 */
public class RecordMergeNode implements WorkflowNode {

    public static final String TYPE = "RecordMergeNode";
    public static final String SOURCES = "sources";

    private static final Logger log = LoggerFactory.getLogger(RecordMergeNode.class);

    private static final NodeMetadata METADATA = new NodeMetadata(
            TYPE,
            "Record Merge",
            NodeCategory.TRANSFORMATION,
            "Concatenates the records of several predecessor nodes",
            Map.of("inputs", "output of each predecessor keyed by node id", SOURCES, "optional predecessor ids to take, in order"),
            Map.of("records", "concatenated records")
    );

    @Override
    public NodeMetadata metadata() {
        return METADATA;
    }

    @Override
    public Object run(Object input, NodeParameters parameters) {
        if (!(input instanceof FanInInput fanIn)) {
            return RecordSets.from(input);
        }
        NodeParameters params = parameters != null ? parameters : NodeParameters.empty();
        List<String> sources = params.has(SOURCES)
                ? params.getStringList(SOURCES)
                : List.copyOf(fanIn.outputsBySource().keySet());

        List<InvoiceRecord> merged = new ArrayList<>();
        for (String source : sources) {
            if (!fanIn.outputsBySource().containsKey(source)) {
                throw new IllegalArgumentException("'" + source + "' is not a predecessor of this node; predecessors are "
                        + fanIn.outputsBySource().keySet());
            }
            merged.addAll(RecordSets.from(fanIn.outputOf(source)).records());
        }
        log.debug("Merged {} records from {}", merged.size(), sources);
        return RecordSet.of(merged);
    }
}
