package com.runtimehub.runtime_engine.plugin.bundled;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded in-memory store of Logger node entries, shared across runs. The oldest entries are
 * dropped beyond {@link #CAPACITY}.
 */
public final class PluginLogStore {

    public static final int CAPACITY = 1000;

    private static final PluginLogStore SHARED = new PluginLogStore(CAPACITY);

    private final int capacity;
    private final Deque<Entry> entries = new ArrayDeque<>();

    PluginLogStore(int capacity) {
        this.capacity = capacity;
    }

    public static PluginLogStore shared() {
        return SHARED;
    }

    public synchronized void append(Entry entry) {
        entries.addLast(entry);
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
    }

    /**
     * Most recent entries matching every non-null filter, oldest first.
     */
    public synchronized List<Entry> query(String level, String workflowId, String nodeId, int limit) {
        List<Entry> matching = new ArrayList<>();
        for (Entry entry : entries) {
            if (level != null && !entry.level().equalsIgnoreCase(level)) {
                continue;
            }
            if (workflowId != null && !workflowId.equals(entry.workflowId())) {
                continue;
            }
            if (nodeId != null && !nodeId.equals(entry.nodeId())) {
                continue;
            }
            matching.add(entry);
        }
        int from = Math.max(0, matching.size() - Math.max(0, limit));
        return new ArrayList<>(matching.subList(from, matching.size()));
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Entry(String timestamp, String level, String prefix, String workflowId, String nodeId,
                        Object data, String message) {}
}
