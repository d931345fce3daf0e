package com.ledger.shared.support;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs store and bus I/O under a caller-supplied deadline.
 *
 * The action runs on a worker pool and is bounded by a Resilience4j {@link TimeLimiter}.
 * Exceeding the deadline surfaces as {@link OperationTimeoutException}; exceptions thrown by
 * the action itself are rethrown unchanged so that conflicts and domain errors keep their type.
 */
@Slf4j
public class DeadlineExecutor {

    private final ExecutorService workers;
    private final Duration defaultTimeout;

    public DeadlineExecutor(ExecutorService workers, Duration defaultTimeout) {
        this.workers = workers;
        this.defaultTimeout = defaultTimeout;
    }

    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    public <T> T call(String operation, Supplier<T> action) {
        return call(operation, defaultTimeout, action);
    }

    public <T> T call(String operation, Duration timeout, Supplier<T> action) {
        TimeLimiter limiter = TimeLimiter.of(operation, TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());
        try {
            return limiter.executeFutureSupplier(() -> CompletableFuture.supplyAsync(action, workers));
        } catch (TimeoutException e) {
            log.warn("Deadline exceeded: operation={}, timeoutMs={}", operation, timeout.toMillis());
            throw new OperationTimeoutException(operation, timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationTimeoutException(operation, timeout, e);
        } catch (ExecutionException e) {
            throw rethrow(operation, e.getCause());
        } catch (Exception e) {
            throw rethrow(operation, e);
        }
    }

    public void run(String operation, Duration timeout, Runnable action) {
        call(operation, timeout, () -> {
            action.run();
            return null;
        });
    }

    private RuntimeException rethrow(String operation, Throwable cause) {
        if (cause instanceof CompletionException && cause.getCause() != null) {
            return rethrow(operation, cause.getCause());
        }
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new StorageUnavailableException("Operation '" + operation + "' failed", cause);
    }
}
