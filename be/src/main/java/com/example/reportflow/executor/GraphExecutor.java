package com.example.reportflow.executor;

import com.example.reportflow.model.FanInInput;
import com.example.reportflow.node.NodeParameters;
import com.example.reportflow.node.WorkflowNode;
import com.example.reportflow.registry.NodeRegistry;
import com.example.reportflow.validation.ValidationError;
import com.example.reportflow.validation.WorkflowGraphValidator;
import com.example.reportflow.validation.WorkflowStructureException;
import com.example.reportflow.workflow.GraphDefinition;
import com.example.reportflow.workflow.NodeDefinition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Runs a node/edge workflow in topological order.
 * <p>
 * A node without incoming edges receives the workflow input, a node with one predecessor that
 * predecessor's output, and a node with several a {@link FanInInput}. With a worker pool the
 * nodes of each ready set run concurrently; results and trace are the same as in sequential
 * mode. Structural errors and unknown node types are reported before any node runs.
 * </p>
 */
public class GraphExecutor {

    private static final Logger log = LoggerFactory.getLogger(GraphExecutor.class);

    private final NodeRegistry registry;
    private final ExecutorService workers;

    public GraphExecutor(NodeRegistry registry) {
        this(registry, null);
    }

    /**
     * @param workers pool for ready-set parallel execution, or {@code null} to run sequentially
     */
    public GraphExecutor(NodeRegistry registry, ExecutorService workers) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.workers = workers;
    }

    public boolean isParallel() {
        return workers != null;
    }

    public GraphRun run(GraphDefinition graph, Object input) {
        return run(graph, input, ExecutionOptions.defaults());
    }

    /**
     * Validates and runs the graph.
     *
     * @throws WorkflowStructureException if the graph is invalid or cyclic
     * @throws com.example.reportflow.registry.NodeNotFoundException if a node type is not registered
     * @throws NodeExecutionException if a node fails
     * @throws WorkflowTimeoutException if the deadline passes
     */
    public GraphRun run(GraphDefinition graph, Object input, ExecutionOptions options) {
        ExecutionOptions runOptions = options != null ? options : ExecutionOptions.defaults();
        WorkflowGraphValidator.validateGraph(graph, registry);
        ExecutionPlan plan = ExecutionPlan.of(graph);
        String terminalNodeId = terminalNodeId(plan, runOptions);
        warnUnknownOverrides(graph, runOptions);

        log.info("Running graph workflow name={} nodes={} edges={} parallel={}", graph.name(), plan.size(), graph.edges().size(), isParallel());
        Deadline deadline = Deadline.after(runOptions.timeout());
        NodeOutputs outputs = new NodeOutputs(plan);
        if (isParallel()) {
            runWaves(plan, input, runOptions, deadline, outputs);
        } else {
            runSequentially(plan, input, runOptions, deadline, outputs);
        }

        Map<String, Object> nodeOutputs = outputs.outputsInOrder();
        log.info("Graph workflow completed name={} terminalNode={}", graph.name(), terminalNodeId);
        return new GraphRun(graph.name(), terminalNodeId, nodeOutputs.get(terminalNodeId), nodeOutputs,
                outputs.traceInOrder(), plan.executionOrder());
    }

    private void runSequentially(ExecutionPlan plan, Object input, ExecutionOptions options, Deadline deadline, NodeOutputs outputs) {
        for (int index : plan.order()) {
            checkDeadline(deadline, outputs);
            runAndRecord(plan, index, input, options, outputs);
        }
    }

    private void runWaves(ExecutionPlan plan, Object input, ExecutionOptions options, Deadline deadline, NodeOutputs outputs) {
        for (int[] wave : plan.waves()) {
            checkDeadline(deadline, outputs);
            log.debug("Launching ready set of {} node(s)", wave.length);
            List<Future<NodeRunner.Outcome>> futures = new ArrayList<>(wave.length);
            for (int index : wave) {
                futures.add(workers.submit(() -> invoke(plan, index, input, options, outputs)));
            }
            awaitWave(plan, wave, futures, input, options, deadline, outputs);
        }
    }

    /**
     * Waits for every node of the ready set before reporting a failure, so the reported trace
     * does not depend on which sibling finished first.
     */
    private void awaitWave(ExecutionPlan plan, int[] wave, List<Future<NodeRunner.Outcome>> futures,
                           Object input, ExecutionOptions options, Deadline deadline, NodeOutputs outputs) {
        int failedIndex = -1;
        RuntimeException failure = null;
        for (int i = 0; i < wave.length; i++) {
            Future<NodeRunner.Outcome> future = futures.get(i);
            try {
                NodeRunner.Outcome outcome = future.get(Math.max(deadline.remainingNanos(), 0), deadline.unit());
                outputs.record(wave[i], outcome.output(), outcome.traceEntry());
            } catch (TimeoutException e) {
                futures.forEach(f -> f.cancel(true));
                throw new WorkflowTimeoutException(deadline.timeout(), outputs.traceInOrder(), outputs.outputsInOrder());
            } catch (ExecutionException | CancellationException e) {
                // a ready set is in rank order, so the first failure seen is the lowest-ranked one
                if (failure == null) {
                    failedIndex = wave[i];
                    failure = causeOf(e);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new IllegalStateException("Interrupted while running node '" + plan.node(wave[i]).id() + "'", e);
            }
        }
        if (failure != null) {
            runRankedBefore(plan, plan.rank(failedIndex), input, options, deadline, outputs);
            throw failed(plan, failedIndex, failure, outputs);
        }
    }

    /**
     * Runs, on the calling thread, the nodes of later ready sets that rank before a failed node.
     * Sequential execution would have run them before reaching the failure.
     */
    private void runRankedBefore(ExecutionPlan plan, int rank, Object input, ExecutionOptions options, Deadline deadline, NodeOutputs outputs) {
        int[] order = plan.order();
        for (int r = 0; r < rank; r++) {
            if (!outputs.isRecorded(order[r])) {
                checkDeadline(deadline, outputs);
                runAndRecord(plan, order[r], input, options, outputs);
            }
        }
    }

    private void runAndRecord(ExecutionPlan plan, int index, Object input, ExecutionOptions options, NodeOutputs outputs) {
        NodeRunner.Outcome outcome;
        try {
            outcome = invoke(plan, index, input, options, outputs);
        } catch (RuntimeException e) {
            throw failed(plan, index, e, outputs);
        }
        outputs.record(index, outcome.output(), outcome.traceEntry());
    }

    private NodeRunner.Outcome invoke(ExecutionPlan plan, int index, Object workflowInput, ExecutionOptions options, NodeOutputs outputs) {
        NodeDefinition definition = plan.node(index);
        Object input = routeInput(plan, index, workflowInput, outputs);
        NodeParameters parameters = options.parametersFor(definition.id(), definition);
        WorkflowNode node = registry.resolve(definition.type());
        return NodeRunner.run(definition.id(), definition.type(), node, input, parameters);
    }

    private static NodeExecutionException failed(ExecutionPlan plan, int index, RuntimeException cause, NodeOutputs outputs) {
        NodeDefinition definition = plan.node(index);
        log.warn("Node id={} type={} failed: {}", definition.id(), definition.type(), cause.getMessage());
        int rank = plan.rank(index);
        return new NodeExecutionException(definition.id(), definition.type(), outputs.traceBefore(rank), outputs.outputsBefore(rank), cause);
    }

    private static RuntimeException causeOf(Exception e) {
        if (e instanceof CancellationException cancelled) {
            return cancelled;
        }
        Throwable cause = e.getCause();
        return cause instanceof RuntimeException runtime ? runtime : new IllegalStateException(cause);
    }

    private static Object routeInput(ExecutionPlan plan, int index, Object workflowInput, NodeOutputs outputs) {
        int[] predecessors = plan.predecessors(index);
        if (predecessors.length == 0) {
            return workflowInput;
        }
        if (predecessors.length == 1) {
            return outputs.outputOf(predecessors[0]);
        }
        Map<String, Object> bySource = new LinkedHashMap<>();
        for (int predecessor : predecessors) {
            bySource.put(plan.node(predecessor).id(), outputs.outputOf(predecessor));
        }
        return new FanInInput(bySource);
    }

    private static void checkDeadline(Deadline deadline, NodeOutputs outputs) {
        if (deadline.isExpired()) {
            throw new WorkflowTimeoutException(deadline.timeout(), outputs.traceInOrder(), outputs.outputsInOrder());
        }
    }

    private static String terminalNodeId(ExecutionPlan plan, ExecutionOptions options) {
        String requested = options.terminalNodeId();
        if (requested == null || requested.isBlank()) {
            return plan.lastNodeId();
        }
        if (!plan.contains(requested)) {
            throw new WorkflowStructureException(List.of(
                    new ValidationError("terminal_node_id", "terminal_node_id must reference an existing node id: " + requested)));
        }
        return requested;
    }

    private static void warnUnknownOverrides(GraphDefinition graph, ExecutionOptions options) {
        Set<String> nodeIds = graph.nodes().stream().map(NodeDefinition::id).collect(Collectors.toSet());
        List<String> unknown = WorkflowGraphValidator.unknownOverrideIds(options.overrides(), nodeIds);
        if (!unknown.isEmpty()) {
            log.warn("Ignoring overrides for unknown node ids {}", unknown);
        }
    }
}
