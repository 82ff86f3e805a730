package com.runtimehub.runtime_engine.port;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PortRegistryTest {

    private final PortRegistry registry = new PortRegistry();

    @Test
    void shouldSeedBuiltInTypes() {
        assertThat(registry.all()).hasSize(16);
        assertThat(registry.outputName("Condition", 1)).isEqualTo("false");
        assertThat(registry.inputName("HTTP Request", 2)).isEqualTo("body");
    }

    @Test
    void shouldFallBackToIndexedNames() {
        assertThat(registry.outputName("Unknown", 3)).isEqualTo("output_3");
        assertThat(registry.inputName("Start", 0)).isEqualTo("input_0");
        assertThat(registry.portsFor("Unknown")).isNull();
    }

    @Test
    void shouldNeverReplaceExistingEntry() {
        PortMap custom = PortMap.of(List.of("a"), List.of("b"));

        assertThat(registry.register("Custom", custom)).isTrue();
        assertThat(registry.register("Custom", PortMap.of(List.of(), List.of()))).isFalse();
        assertThat(registry.register("Start", custom)).isFalse();

        assertThat(registry.portsFor("Custom")).isEqualTo(custom);
        assertThat(registry.outputName("Start", 0)).isEqualTo("main");
    }

    @Test
    void shouldFlagControlFlowPorts() {
        assertThat(PortRegistry.isControlFlowOutput("loop_complete")).isTrue();
        assertThat(PortRegistry.isControlFlowOutput("result")).isFalse();
    }
}
