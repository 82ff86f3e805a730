package com.runtimehub.runtime_engine.plugin.bundled;

import com.runtimehub.runtime_engine.model.NodeDefinition;
import com.runtimehub.runtime_engine.model.WorkflowRun;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DataTransformPluginTest {

    private final DataTransformPlugin.DataTransformExecutor executor = new DataTransformPlugin.DataTransformExecutor();

    private Map<String, Object> run(Map<String, Object> config, Map<String, Object> inputs) {
        NodeDefinition node = NodeDefinition.of("dt", "Data Transform", config);
        return executor.execute(node, new WorkflowRun("r", List.of(node), List.of()), List.of(), inputs).outputs();
    }

    @Test
    void shouldUppercaseInput() {
        assertThat(run(Map.of("operation", "uppercase"), Map.of("input", "hello")))
                .containsEntry("output", "HELLO")
                .containsEntry("success", true);
    }

    @Test
    void shouldParseNumbersAndJson() {
        assertThat(run(Map.of("operation", "parse-as-number"), Map.of("input", " 42 "))).containsEntry("output", 42.0);
        assertThat(run(Map.of("operation", "parse-as-json"), Map.of("input", "{\"a\":1}")))
                .containsEntry("output", Map.of("a", 1));
    }

    @Test
    void shouldFallBackToDefaultValueForMissingInput() {
        assertThat(run(Map.of("operation", "trim", "defaultValue", "  padded  "), Map.of()))
                .containsEntry("output", "padded");
    }

    @Test
    void shouldReportFailuresAsData() {
        Map<String, Object> badNumber = run(Map.of("operation", "parse-as-number"), Map.of("input", "abc"));
        Map<String, Object> unknown = run(Map.of("operation", "reverse"), Map.of("input", "abc"));

        assertThat(badNumber).containsEntry("success", false).containsEntry("original", "abc");
        assertThat(unknown).containsEntry("error", "Unknown operation: reverse");
    }
}
