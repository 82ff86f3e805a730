package com.runtimehub.runtime_engine.executor;

import com.runtimehub.runtime_engine.engine.ExecutionEventPublisher;
import com.runtimehub.runtime_engine.model.Connection;
import com.runtimehub.runtime_engine.model.NodeDefinition;
import com.runtimehub.runtime_engine.model.WorkflowRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Appends {@code [timestamp] [LEVEL] message} to a log file and mirrors the line to the
 * log_entry stream. The file defaults to {@code workflow.log} in the run workspace.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WriteLogExecutor implements NodeExecutor {

    private final ExecutionEventPublisher eventPublisher;

    @Override
    public String supportedType() {
        return "Write Log";
    }

    @Override
    public NodeOutcome execute(NodeDefinition node, WorkflowRun run, List<Connection> connections,
                               Map<String, Object> inputs) throws IOException {
        String message = NodeConfig.string(node, inputs, "message", "");
        String level = NodeConfig.string(node, inputs, "level", "info");
        Path logFile = resolveLogFile(node, run);
        String timestamp = Instant.now().toString();

        if (logFile.getParent() != null) {
            Files.createDirectories(logFile.getParent());
        }
        Files.writeString(logFile, "[" + timestamp + "] [" + level.toUpperCase() + "] " + message + System.lineSeparator(),
                StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);

        switch (level.toLowerCase()) {
            case "error" -> log.error("[{}] {}", run.getId(), message);
            case "warn", "warning" -> log.warn("[{}] {}", run.getId(), message);
            case "debug" -> log.debug("[{}] {}", run.getId(), message);
            default -> log.info("[{}] {}", run.getId(), message);
        }
        eventPublisher.logEntry("WriteLog", level, message,
                Map.of("workflowId", run.getId(), "logFile", logFile.toString()));

        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("success", true);
        outputs.put("level", level);
        outputs.put("message", message);
        outputs.put("logFile", logFile.toString());
        outputs.put("timestamp", timestamp);
        outputs.put("logged", true);
        return NodeOutcome.next(outputs);
    }

    private static Path resolveLogFile(NodeDefinition node, WorkflowRun run) {
        String configured = NodeConfig.string(node, "logFile", null);
        if (configured != null && !configured.isBlank()) {
            return Path.of(configured);
        }
        Path assets = run.getContext().getAssetsDir();
        return assets != null ? assets.resolve("workflow.log") : Path.of("logs", "workflow.log");
    }
}
