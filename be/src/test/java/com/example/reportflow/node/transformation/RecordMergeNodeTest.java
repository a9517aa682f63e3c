package com.example.reportflow.node.transformation;

import com.example.reportflow.model.FanInInput;
import com.example.reportflow.model.InvoiceRecord;
import com.example.reportflow.model.RecordSet;
import com.example.reportflow.node.NodeParameters;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("RecordMergeNode")
class RecordMergeNodeTest {

    private final RecordMergeNode node = new RecordMergeNode();

    private static FanInInput fanIn() {
        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("left", List.of(Map.of("id", "l1"), Map.of("id", "l2")));
        outputs.put("right", RecordSet.of(List.of(InvoiceRecord.builder().id("r1").build())));
        return new FanInInput(outputs);
    }

    private static List<String> ids(Object output) {
        return ((RecordSet) output).records().stream().map(InvoiceRecord::id).toList();
    }

    @Test
    @DisplayName("concatenates predecessor records in predecessor order")
    void concatenates() {
        assertEquals(List.of("l1", "l2", "r1"), ids(node.run(fanIn(), NodeParameters.empty())));
    }

    @Test
    @DisplayName("sources restricts and reorders the predecessors")
    void sources() {
        assertEquals(List.of("r1", "l1", "l2"), ids(node.run(fanIn(), NodeParameters.of(Map.of("sources", List.of("right", "left"))))));
        assertEquals(List.of("r1"), ids(node.run(fanIn(), NodeParameters.of(Map.of("sources", List.of("right"))))));
    }

    @Test
    @DisplayName("rejects a source that is not a predecessor")
    void unknownSource() {
        assertThatThrownBy(() -> node.run(fanIn(), NodeParameters.of(Map.of("sources", List.of("middle")))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("middle");
    }

    @Test
    @DisplayName("passes a single record set through")
    void single() {
        assertEquals(List.of("x"), ids(node.run(List.of(Map.of("id", "x")), NodeParameters.empty())));
    }
}
