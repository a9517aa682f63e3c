package com.example.reportflow.registry;

import com.example.reportflow.node.aggregation.FilterNode;
import com.example.reportflow.node.aggregation.GroupingNode;
import com.example.reportflow.node.aggregation.SortNode;
import com.example.reportflow.node.aggregation.SummaryNode;
import com.example.reportflow.node.calculation.AgingCalculatorNode;
import com.example.reportflow.node.calculation.DuplicateDetectorNode;
import com.example.reportflow.node.calculation.OutstandingCalculatorNode;
import com.example.reportflow.node.calculation.SlaCheckerNode;
import com.example.reportflow.node.calculation.TotalsCalculationNode;
import com.example.reportflow.node.transformation.RecordMergeNode;

import java.time.Clock;
import java.util.Objects;

/**
 * Registers the calculation, aggregation and transformation nodes shipped with the application.
 */
public class BuiltInNodes implements NodeRegistrar {

    private final Clock clock;

    public BuiltInNodes(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void registerNodes(NodeRegistry registry) {
        registry.register(AgingCalculatorNode.TYPE, () -> new AgingCalculatorNode(clock));
        registry.register(OutstandingCalculatorNode.TYPE, OutstandingCalculatorNode::new);
        registry.register(SlaCheckerNode.TYPE, () -> new SlaCheckerNode(clock));
        registry.register(DuplicateDetectorNode.TYPE, DuplicateDetectorNode::new);
        registry.register(TotalsCalculationNode.TYPE, TotalsCalculationNode::new);
        registry.register(GroupingNode.TYPE, GroupingNode::new);
        registry.register(FilterNode.TYPE, FilterNode::new);
        registry.register(SortNode.TYPE, SortNode::new);
        registry.register(SummaryNode.TYPE, SummaryNode::new);
        registry.register(RecordMergeNode.TYPE, RecordMergeNode::new);
    }

    /**
     * A registry holding only the built-in nodes.
     */
    public static NodeRegistry registry(Clock clock) {
        NodeRegistry registry = new DefaultNodeRegistry();
        new BuiltInNodes(clock).registerNodes(registry);
        return registry;
    }
}
