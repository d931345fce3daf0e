package com.ledger.shared.support;

import com.ledger.shared.eventstore.ConcurrencyConflictException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit Tests — DeadlineExecutor
 */
class DeadlineExecutorTest {

    private final ExecutorService workers = Executors.newCachedThreadPool();
    private final DeadlineExecutor deadlines = new DeadlineExecutor(workers, Duration.ofSeconds(2));

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    @Test
    @DisplayName("completes within the deadline — returns the action's result")
    void call_withinDeadline_shouldReturnResult() {
        assertThat(deadlines.call("read", () -> 42)).isEqualTo(42);
        assertThat(deadlines.defaultTimeout()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("exceeds the deadline — OperationTimeoutException naming the operation")
    void call_pastDeadline_shouldTimeOut() {
        CountDownLatch never = new CountDownLatch(1);

        assertThatThrownBy(() -> deadlines.call("slowAppend", Duration.ofMillis(50), () -> {
            try {
                never.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }))
                .isInstanceOfSatisfying(OperationTimeoutException.class, e -> {
                    assertThat(e.getOperation()).isEqualTo("slowAppend");
                    assertThat(e.getTimeout()).isEqualTo(Duration.ofMillis(50));
                });
    }

    @Test
    @DisplayName("action throws — the original exception type reaches the caller")
    void call_actionFails_shouldRethrowUnchanged() {
        assertThatThrownBy(() -> deadlines.call("append", () -> {
            throw new ConcurrencyConflictException("agg-1", 1, 2);
        }))
                .isInstanceOf(ConcurrencyConflictException.class)
                .hasMessageContaining("expected version 1");
    }

    @Test
    @DisplayName("run — executes a void action under the deadline")
    void run_shouldExecuteAction() {
        int[] calls = {0};
        deadlines.run("touch", Duration.ofSeconds(1), () -> calls[0]++);
        assertThat(calls[0]).isEqualTo(1);
    }
}
