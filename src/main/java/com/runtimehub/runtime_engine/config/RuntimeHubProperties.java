package com.runtimehub.runtime_engine.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Engine settings bound from the {@code runtime-hub} prefix.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "runtime-hub")
public class RuntimeHubProperties {

    @Valid
    private final Workflow workflow = new Workflow();
    @Valid
    private final Workspace workspace = new Workspace();
    @Valid
    private final Plugins plugins = new Plugins();
    @Valid
    private final Events events = new Events();
    @Valid
    private final Python python = new Python();
    @Valid
    private final Cors cors = new Cors();

    @Getter
    @Setter
    public static class Workflow {
        @Min(1)
        @Max(50)
        private int maxConcurrentWorkflows = 5;

        @NotNull
        private Duration defaultTimeout = Duration.ofSeconds(60);

        /**
         * Ceiling for a single subprocess or HTTP call. Traversal itself has no per-node timeout.
         */
        @NotNull
        private Duration maxNodeExecutionTime = Duration.ofSeconds(30);

        @Min(1)
        private int maxNodeExecutions = 5000;

        /** Multiplied by the attempt number between retries. */
        @NotNull
        private Duration retryBackoff = Duration.ofSeconds(1);

        private boolean queueEnabled = false;

        @Min(1)
        private int historySize = 1000;

        private boolean enableDebugLogging = false;
    }

    @Getter
    @Setter
    public static class Workspace {
        @NotNull
        private Path baseDir = Path.of(System.getProperty("java.io.tmpdir"), "runtime-hub", "runs");

        @NotNull
        private Duration retention = Duration.ofHours(24);

        @NotNull
        private Duration cleanupInterval = Duration.ofHours(1);
    }

    @Getter
    @Setter
    public static class Plugins {
        private boolean enabled = true;

        @NotBlank
        private String directory = "plugins";
    }

    @Getter
    @Setter
    public static class Events {
        private final Redis redis = new Redis();

        @Getter
        @Setter
        public static class Redis {
            private boolean enabled = false;
            private String channel = "runtime-hub:websocket:topic";
        }
    }

    @Getter
    @Setter
    public static class Python {
        @NotBlank
        private String interpreter = "python3";
    }

    @Getter
    @Setter
    public static class Cors {
        private List<String> allowedOrigins = List.of("http://localhost:3000");
    }
}
