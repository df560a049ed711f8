package com.example.compliance.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Wraps an external call with bounded exponential-backoff retry.
 * <p>
 * Attempt {@code n} (0-based) that fails is followed by a pause of
 * {@code baseDelay * 2^n} before the next attempt. After the last attempt the
 * final failure is rethrown unchanged. No jitter and no circuit breaker: the
 * caller's thread is blocked for the whole backoff.
 */
public class ResilientCaller {

    private static final Logger log = LoggerFactory.getLogger(ResilientCaller.class);

    /** Blocking pause between attempts; replaced in tests. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Sleeper sleeper;

    public ResilientCaller(int maxAttempts, Duration baseDelay) {
        this(maxAttempts, baseDelay, duration -> Thread.sleep(duration.toMillis()));
    }

    public ResilientCaller(int maxAttempts, Duration baseDelay, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.sleeper = sleeper;
    }

    /**
     * Runs {@code operation}, retrying on any {@link RuntimeException}.
     *
     * @param operationName name used in log lines
     * @param operation     the external call
     * @param <T>           result type
     * @return the first successful result
     * @throws RuntimeException the last attempt's exception, unchanged
     */
    public <T> T call(String operationName, Supplier<T> operation) {
        RuntimeException lastError = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                return operation.get();
            } catch (RuntimeException e) {
                lastError = e;
                if (attempt == maxAttempts - 1) {
                    break;
                }
                Duration delay = delayFor(attempt);
                log.warn("{}: attempt {}/{} failed ({}), retrying in {}ms...",
                        operationName, attempt + 1, maxAttempts, rootCauseMessage(e), delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        log.error("{}: giving up after {} attempt(s)", operationName, maxAttempts);
        throw lastError;
    }

    /** Pause after the failed attempt {@code attempt} (0-based). */
    Duration delayFor(int attempt) {
        return baseDelay.multipliedBy(1L << attempt);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    private static String rootCauseMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        String msg = cause.getMessage();
        return msg != null && msg.length() > 150 ? msg.substring(0, 150) + "..." : msg;
    }
}
