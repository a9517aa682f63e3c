package com.example.reportflow.node;

import com.example.reportflow.model.RecordSet;
import com.example.reportflow.model.RecordSets;

/**
 * Base for nodes that consume and produce the {@link RecordSet} envelope.
 */
public abstract class AbstractRecordNode implements WorkflowNode {

    @Override
    public final Object run(Object input, NodeParameters parameters) {
        return apply(RecordSets.from(input), parameters != null ? parameters : NodeParameters.empty());
    }

    protected abstract RecordSet apply(RecordSet input, NodeParameters parameters);
}
