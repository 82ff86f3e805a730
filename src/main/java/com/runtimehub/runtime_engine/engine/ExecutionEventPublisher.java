package com.runtimehub.runtime_engine.engine;

import com.runtimehub.runtime_engine.model.NodeStatus;
import com.runtimehub.runtime_engine.model.WorkflowRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fire-and-forget broadcaster for run, node, log and notification events.
 */
@Slf4j
@Component
public class ExecutionEventPublisher {

    public static final String WORKFLOW_UPDATE = "workflow_update";
    public static final String NODE_UPDATE = "node_update";
    public static final String LOG_ENTRY = "log_entry";
    public static final String NOTIFICATION = "notification";

    private final EventSink sink;

    public ExecutionEventPublisher(EventSink sink) {
        this.sink = sink;
    }

    public void workflowUpdate(WorkflowRun run, String status) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("startTime", run.getStartTime());
        data.put("endTime", run.getEndTime());
        data.put("duration", run.getDuration());
        data.put("error", run.getError());
        data.put("nodeCount", run.getNodes().size());
        data.put("completedNodeCount", run.getCompletedNodeCount());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("workflowId", run.getId());
        payload.put("status", status);
        payload.put("data", data);
        payload.put("timestamp", System.currentTimeMillis());
        publish(WORKFLOW_UPDATE, payload);
    }

    public void nodeUpdate(String workflowId, String nodeId, NodeStatus status, Map<String, Object> data) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("workflowId", workflowId);
        payload.put("nodeId", nodeId);
        payload.put("status", status.value());
        payload.put("data", data != null ? data : Map.of());
        payload.put("timestamp", System.currentTimeMillis());
        publish(NODE_UPDATE, payload);
    }

    public void logEntry(String source, String level, String message, Map<String, Object> data) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("source", source);
        payload.put("level", level);
        payload.put("message", message);
        payload.put("data", data != null ? data : Map.of());
        publish(LOG_ENTRY, payload);
    }

    public void notification(String title, String message, String type) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", title);
        payload.put("message", message);
        payload.put("type", type);
        payload.put("timestamp", System.currentTimeMillis());
        publish(NOTIFICATION, payload);
    }

    private void publish(String event, Map<String, Object> payload) {
        try {
            sink.send(event, payload);
        } catch (RuntimeException e) {
            log.warn("Dropping {} event: {}", event, e.getMessage());
        }
    }
}
