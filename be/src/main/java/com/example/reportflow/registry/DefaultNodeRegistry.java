package com.example.reportflow.registry;

import com.example.reportflow.node.NodeCategory;
import com.example.reportflow.node.NodeMetadata;
import com.example.reportflow.node.WorkflowNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Default implementation of {@link NodeRegistry}. Registration is expected at start-up;
 * lookups are safe from any thread.
 */
public class DefaultNodeRegistry implements NodeRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultNodeRegistry.class);

    private record Registration(Supplier<? extends WorkflowNode> factory, NodeMetadata metadata) {
    }

    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();

    @Override
    public void register(String type, Supplier<? extends WorkflowNode> factory) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Node type must not be blank");
        }
        Objects.requireNonNull(factory, "factory");
        WorkflowNode sample = Objects.requireNonNull(factory.get(), () -> "Factory for " + type + " returned null");
        Registration previous = registrations.putIfAbsent(type, new Registration(factory, sample.metadata()));
        if (previous != null) {
            throw new DuplicateNodeTypeException(type);
        }
        log.debug("Registered node type {}", type);
    }

    @Override
    public WorkflowNode resolve(String type) {
        Registration registration = type != null ? registrations.get(type) : null;
        if (registration == null) {
            throw new NodeNotFoundException(type);
        }
        return registration.factory().get();
    }

    @Override
    public boolean isRegistered(String type) {
        return type != null && registrations.containsKey(type);
    }

    @Override
    public Set<String> registeredTypes() {
        return Collections.unmodifiableSet(new TreeSet<>(registrations.keySet()));
    }

    @Override
    public List<NodeMetadata> catalog() {
        return registrations.values().stream()
                .map(Registration::metadata)
                .sorted(Comparator.comparing(NodeMetadata::type))
                .toList();
    }

    @Override
    public Map<NodeCategory, List<NodeMetadata>> catalogByCategory() {
        return catalog().stream()
                .collect(Collectors.groupingBy(NodeMetadata::category, () -> new EnumMap<>(NodeCategory.class), Collectors.toList()));
    }
}
