package com.runtimehub.runtime_engine.controller;

import com.runtimehub.runtime_engine.engine.WorkflowEngine;
import com.runtimehub.runtime_engine.model.Connection;
import com.runtimehub.runtime_engine.model.HistoryEntry;
import com.runtimehub.runtime_engine.model.MetricsSnapshot;
import com.runtimehub.runtime_engine.model.NodeDefinition;
import com.runtimehub.runtime_engine.model.WorkflowRun;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/workflows")
@RequiredArgsConstructor
public class WorkflowController {

    private final WorkflowEngine engine;

    // POST /api/workflows/{id}/execute: admit a run; ?wait=true blocks until it is terminal
    @PostMapping("/{workflowId}/execute")
    public ResponseEntity<WorkflowRun> execute(@PathVariable String workflowId,
                                               @RequestBody ExecuteRequest request,
                                               @RequestParam(defaultValue = "false") boolean wait) {
        CompletableFuture<WorkflowRun> future = engine.executeWorkflow(workflowId, request.nodes(), request.connections());
        if (wait) {
            return ResponseEntity.ok(future.join());
        }
        // not active any more means it already finished
        WorkflowRun run = engine.getStatus(workflowId).orElseGet(future::join);
        return ResponseEntity.accepted().body(run);
    }

    // POST /api/workflows/{id}/stop
    @PostMapping("/{workflowId}/stop")
    public ResponseEntity<Map<String, Object>> stop(@PathVariable String workflowId) {
        if (!engine.stopWorkflow(workflowId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("stopped", true, "workflowId", workflowId));
    }

    // GET /api/workflows/{id}: live run if active, otherwise its latest history entry
    @GetMapping("/{workflowId}")
    public ResponseEntity<Object> status(@PathVariable String workflowId) {
        Optional<WorkflowRun> active = engine.getStatus(workflowId);
        if (active.isPresent()) {
            return ResponseEntity.ok(active.get());
        }
        Optional<HistoryEntry> finished = engine.getLatestHistory(workflowId);
        if (finished.isPresent()) {
            return ResponseEntity.ok(finished.get());
        }
        return ResponseEntity.notFound().build();
    }

    @GetMapping("/running")
    public List<WorkflowRun> running() {
        return engine.getRunningWorkflows();
    }

    @GetMapping("/queued")
    public List<WorkflowRun> queued() {
        return engine.getQueuedWorkflows();
    }

    @GetMapping("/metrics")
    public MetricsSnapshot metrics() {
        return engine.getMetrics();
    }

    @GetMapping("/history")
    public List<HistoryEntry> history(@RequestParam(defaultValue = "50") int limit) {
        return engine.getHistory(limit);
    }

    // ── DTOs ─────────────────────────────────────────────────────────────────

    public record ExecuteRequest(List<NodeDefinition> nodes, List<Connection> connections) {}
}
