package com.newsvault.backend.persistence;

import java.time.Duration;
import java.util.function.IntFunction;
import java.util.function.Predicate;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded retry with a backoff schedule and a retryable-error predicate.
 * <p>
 * The backoff function maps the attempt number (1-based) to the delay taken before that attempt,
 * so {@link #exponential} yields 0, base, 2*base, ...
 */
@Slf4j
public final class RetryPolicy {

    /** Sleeps between attempts; replaced in tests. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final int maxAttempts;
    private final IntFunction<Duration> backoff;
    private final Predicate<Throwable> retryable;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, IntFunction<Duration> backoff, Predicate<Throwable> retryable, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.retryable = retryable;
        this.sleeper = sleeper;
    }

    public static RetryPolicy exponential(int maxAttempts, Duration baseDelay, Predicate<Throwable> retryable) {
        return new RetryPolicy(maxAttempts, attempt -> exponentialDelay(attempt, baseDelay), retryable,
                duration -> Thread.sleep(duration.toMillis()));
    }

    static Duration exponentialDelay(int attempt, Duration baseDelay) {
        if (attempt <= 1) return Duration.ZERO;
        return baseDelay.multipliedBy(1L << (attempt - 2));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration delayBefore(int attempt) {
        return backoff.apply(attempt);
    }

    /**
     * Runs {@code operation} until it succeeds, fails with a non-retryable error, or attempts run out.
     * The last failure is rethrown unchanged.
     */
    public <T> T execute(String operationName, Supplier<T> operation) {
        RuntimeException lastException = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Duration delay = backoff.apply(attempt);
            if (!delay.isZero()) {
                log.warn("{} retrying in {}ms (attempt {}/{})", operationName, delay.toMillis(), attempt, maxAttempts);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Retry interrupted", interrupted);
                }
            }

            try {
                return operation.get();
            } catch (RuntimeException exception) {
                lastException = exception;
                if (!retryable.test(exception)) {
                    log.warn("{} failed with non-retryable error on attempt {}/{}, not retrying: {}",
                            operationName, attempt, maxAttempts, exception.getMessage());
                    throw exception;
                }
                log.warn("{} failed on attempt {}/{}: {}", operationName, attempt, maxAttempts, exception.getMessage());
            }
        }

        log.error("{} failed after {} attempts, giving up", operationName, maxAttempts);
        throw lastException;
    }

    public void run(String operationName, Runnable operation) {
        execute(operationName, () -> {
            operation.run();
            return null;
        });
    }
}
