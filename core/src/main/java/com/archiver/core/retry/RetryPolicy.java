package com.archiver.core.retry;

import com.archiver.core.error.MalformedResponseException;
import com.archiver.core.error.RetryExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-invokes a failing operation immediately until it succeeds or the attempt ceiling is hit.
 * Malformed responses and interrupts are passed through on the first occurrence.
 */
public class RetryPolicy {
    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 5;

    private final int maxAttempts;

    public RetryPolicy() {
        this(DEFAULT_MAX_ATTEMPTS);
    }

    public RetryPolicy(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Returns an operation that behaves like {@code operation} with retries added.
     */
    public <T> FallibleOperation<T> wrap(String operationName, FallibleOperation<T> operation) {
        return () -> execute(operationName, operation);
    }

    /**
     * Runs {@code operation} with retries.
     *
     * @throws RetryExhaustedException     after {@code maxAttempts} failed attempts, caused by the last error
     * @throws MalformedResponseException  as soon as the operation reports one
     * @throws InterruptedException        as soon as the operation reports one
     */
    public <T> T execute(String operationName, FallibleOperation<T> operation) throws Exception {
        Exception lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return operation.call();
            } catch (MalformedResponseException e) {
                logger.warn("{} returned a malformed response, not retrying: {}", operationName, e.getMessage());
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            } catch (Exception e) {
                lastError = e;
                logger.warn("{} failed (attempt {}/{}): {}", operationName, attempt, maxAttempts, e.toString());
            }
        }
        throw new RetryExhaustedException(operationName, maxAttempts, lastError);
    }
}
