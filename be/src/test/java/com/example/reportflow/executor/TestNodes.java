package com.example.reportflow.executor;

import com.example.reportflow.node.NodeCategory;
import com.example.reportflow.node.NodeMetadata;
import com.example.reportflow.node.NodeParameters;
import com.example.reportflow.node.WorkflowNode;
import com.example.reportflow.registry.DefaultNodeRegistry;
import com.example.reportflow.registry.NodeRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Small nodes for executor tests. {@link #invocations} records the {@code label} parameter of
 * every node that ran, in start order.
 */
final class TestNodes {

    static final String TAG = "TagNode";
    static final String FAIL = "FailNode";
    static final String SLOW = "SlowNode";
    static final String CAPTURE = "CaptureNode";

    final List<String> invocations = new CopyOnWriteArrayList<>();
    final List<Object> capturedInputs = new CopyOnWriteArrayList<>();

    NodeRegistry registry() {
        NodeRegistry registry = new DefaultNodeRegistry();
        registry.register(TAG, () -> new Node(TAG) {
            @Override
            public Object run(Object input, NodeParameters parameters) {
                String label = start(parameters);
                List<Object> out = new ArrayList<>();
                if (input instanceof List<?> items) {
                    out.addAll(items);
                }
                out.add(label);
                return out;
            }
        });
        registry.register(FAIL, () -> new Node(FAIL) {
            @Override
            public Object run(Object input, NodeParameters parameters) {
                start(parameters);
                throw new IllegalStateException(parameters.getString("message", "boom"));
            }
        });
        registry.register(SLOW, () -> new Node(SLOW) {
            @Override
            public Object run(Object input, NodeParameters parameters) {
                String label = start(parameters);
                try {
                    Thread.sleep(parameters.getInt("sleep_ms", 200));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("interrupted", e);
                }
                return List.of(label);
            }
        });
        registry.register(CAPTURE, () -> new Node(CAPTURE) {
            @Override
            public Object run(Object input, NodeParameters parameters) {
                start(parameters);
                capturedInputs.add(input);
                return input;
            }
        });
        return registry;
    }

    static Map<String, Object> label(String label) {
        return Map.of("label", label);
    }

    private abstract class Node implements WorkflowNode {

        private final NodeMetadata metadata;

        Node(String type) {
            this.metadata = new NodeMetadata(type, null, NodeCategory.TRANSFORMATION, null, null, null);
        }

        String start(NodeParameters parameters) {
            String label = parameters.getString("label", "?");
            invocations.add(label);
            return label;
        }

        @Override
        public NodeMetadata metadata() {
            return metadata;
        }
    }
}
