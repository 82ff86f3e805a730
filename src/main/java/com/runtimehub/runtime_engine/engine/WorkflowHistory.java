package com.runtimehub.runtime_engine.engine;

import com.runtimehub.runtime_engine.config.RuntimeHubProperties;
import com.runtimehub.runtime_engine.model.HistoryEntry;
import com.runtimehub.runtime_engine.model.WorkflowRun;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Bounded FIFO of finished runs; the oldest entry is evicted once the cap is reached.
 */
@Component
public class WorkflowHistory {

    private final int capacity;
    private final Deque<HistoryEntry> entries = new ArrayDeque<>();

    public WorkflowHistory(RuntimeHubProperties properties) {
        this.capacity = properties.getWorkflow().getHistorySize();
    }

    public synchronized void append(WorkflowRun run) {
        entries.addLast(HistoryEntry.from(run));
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
    }

    /** The most recent {@code limit} entries, oldest first. */
    public synchronized List<HistoryEntry> recent(int limit) {
        int skip = Math.max(0, entries.size() - Math.max(0, limit));
        List<HistoryEntry> result = new ArrayList<>(entries.size() - skip);
        Iterator<HistoryEntry> it = entries.iterator();
        for (int i = 0; it.hasNext(); i++) {
            HistoryEntry entry = it.next();
            if (i >= skip) {
                result.add(entry);
            }
        }
        return result;
    }

    public synchronized Optional<HistoryEntry> latest(String workflowId) {
        Iterator<HistoryEntry> it = entries.descendingIterator();
        while (it.hasNext()) {
            HistoryEntry entry = it.next();
            if (entry.id().equals(workflowId)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    public synchronized int size() {
        return entries.size();
    }
}
