package com.runtimehub.runtime_engine.engine;

import com.runtimehub.runtime_engine.engine.exception.WorkflowCancelledException;
import com.runtimehub.runtime_engine.engine.exception.WorkflowTimeoutException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CancellationTokenTest {

    private final CancellationToken token = new CancellationToken();

    @Test
    void shouldCancelOnlyOnce() {
        assertThat(token.cancel("first")).isTrue();
        assertThat(token.cancel("second")).isFalse();

        assertThat(token.isCancelled()).isTrue();
        assertThat(token.getReason()).isEqualTo("first");
        assertThatThrownBy(token::throwIfCancelled)
                .isInstanceOf(WorkflowCancelledException.class)
                .hasMessage("first");
    }

    @Test
    void shouldSignalTimeoutWhenExpired() {
        assertThat(token.expire("Workflow execution timeout")).isTrue();

        assertThat(token.isExpired()).isTrue();
        assertThatThrownBy(() -> token.sleep(1_000))
                .isInstanceOf(WorkflowTimeoutException.class)
                .hasMessage("Workflow execution timeout");
    }

    @Test
    void shouldWakeSleeperOnCancel() throws Exception {
        CompletableFuture<Long> sleeper = CompletableFuture.supplyAsync(() -> {
            long began = System.nanoTime();
            try {
                token.sleep(10_000);
            } catch (WorkflowCancelledException e) {
                return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - began);
            }
            return -1L;
        });

        Thread.sleep(50);
        token.cancel("stop");

        assertThat(sleeper.get(5, TimeUnit.SECONDS)).isBetween(0L, 5_000L);
    }

    @Test
    void shouldSleepFullDurationWhenNotCancelled() {
        long began = System.nanoTime();

        token.sleep(50);

        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - began)).isGreaterThanOrEqualTo(50L);
    }

    @Test
    void shouldRunListenersAndSurviveTheirFailures() {
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(() -> {
            throw new IllegalStateException("listener blew up");
        });
        token.onCancel(calls::incrementAndGet);
        Runnable removed = token.onCancel(calls::incrementAndGet);
        removed.run();

        token.cancel("stop");

        assertThat(calls).hasValue(1);
    }

    @Test
    void shouldRunLateListenerImmediately() {
        token.cancel("done");
        AtomicInteger calls = new AtomicInteger();

        token.onCancel(calls::incrementAndGet);

        assertThat(calls).hasValue(1);
    }
}
