package com.runtimehub.runtime_engine.engine;

import com.runtimehub.runtime_engine.engine.exception.WorkflowCancelledException;
import com.runtimehub.runtime_engine.engine.exception.WorkflowTimeoutException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation shared by one run and every executor invoked for it.
 * Set once by stop or timeout; never reset.
 */
@Slf4j
public class CancellationToken {

    private final CountDownLatch signal = new CountDownLatch(1);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private volatile String reason;
    private volatile boolean expired;

    public boolean cancel(String reason) {
        return cancel(reason, false);
    }

    /** Cancels because the deadline passed; waiters then see {@link WorkflowTimeoutException}. */
    public boolean expire(String reason) {
        return cancel(reason, true);
    }

    private boolean cancel(String reason, boolean timedOut) {
        synchronized (this) {
            if (isCancelled()) {
                return false;
            }
            this.reason = reason;
            this.expired = timedOut;
            signal.countDown();
        }
        for (Runnable listener : listeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation listener failed: {}", e.getMessage());
            }
        }
        return true;
    }

    public boolean isCancelled() {
        return signal.getCount() == 0;
    }

    public String getReason() {
        return reason;
    }

    public boolean isExpired() {
        return expired;
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            String message = reason != null ? reason : "Workflow cancelled";
            throw expired ? new WorkflowTimeoutException(message) : new WorkflowCancelledException(message);
        }
    }

    /**
     * Sleeps for the given time, returning early with {@link WorkflowCancelledException}
     * once the token is cancelled or the thread is interrupted.
     */
    public void sleep(long millis) {
        if (millis <= 0) {
            throwIfCancelled();
            return;
        }
        try {
            if (signal.await(millis, TimeUnit.MILLISECONDS)) {
                throwIfCancelled();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            String message = reason != null ? reason : "Interrupted while waiting";
            throw expired ? new WorkflowTimeoutException(message) : new WorkflowCancelledException(message);
        }
    }

    /**
     * Registers a callback run on cancellation, immediately if already cancelled.
     * The returned handle deregisters it.
     */
    public Runnable onCancel(Runnable listener) {
        listeners.add(listener);
        if (isCancelled()) {
            listener.run();
        }
        return () -> listeners.remove(listener);
    }
}
