package com.runtimehub.runtime_engine.executor;

import com.runtimehub.runtime_engine.engine.exception.ValidationException;
import com.runtimehub.runtime_engine.port.PortRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeExecutorRegistryTest {

    private final NodeExecutorRegistry registry = new NodeExecutorRegistry(BuiltinExecutors.controlFlow(new PortRegistry()));

    @Test
    void shouldKeepRegistrationOrder() {
        assertThat(registry.types()).containsExactly("Start", "End", "Condition", "Delay", "Wait", "Loop");
    }

    @Test
    void shouldRejectUnknownType() {
        assertThat(registry.find("Teleport")).isEmpty();
        assertThatThrownBy(() -> registry.get("Teleport"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Unknown node type: Teleport");
    }

    @Test
    void shouldReplaceOnExplicitRegister() {
        ConditionExecutor replacement = new ConditionExecutor();

        registry.register("Start", replacement);

        assertThat(registry.get("Start")).isSameAs(replacement);
    }
}
