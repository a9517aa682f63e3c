package com.example.reportflow.api.v1;

import com.example.reportflow.node.NodeMetadata;
import com.example.reportflow.registry.NodeRegistry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for discovering the registered node types.
 */
@RestController
@RequestMapping("/api/v1/nodes")
@RequiredArgsConstructor
@Slf4j
public class NodesController {

    private final NodeRegistry nodeRegistry;

    @GetMapping
    public List<NodeMetadata> list() {
        List<NodeMetadata> catalog = nodeRegistry.catalog();
        log.debug("Listing node types count={}", catalog.size());
        return catalog;
    }

    @GetMapping("/categories")
    public Map<String, List<NodeMetadata>> byCategory() {
        Map<String, List<NodeMetadata>> byLabel = new LinkedHashMap<>();
        nodeRegistry.catalogByCategory().forEach((category, nodes) -> byLabel.put(category.label(), nodes));
        return byLabel;
    }
}
