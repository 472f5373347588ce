package com.archiver.core.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wrapper that logs the final failure of an operation and rethrows it unchanged.
 */
public final class ErrorLogging {
    private static final Logger logger = LoggerFactory.getLogger(ErrorLogging.class);

    private ErrorLogging() {}

    public static <T> FallibleOperation<T> logged(String operationName, FallibleOperation<T> operation) {
        return () -> {
            try {
                return operation.call();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            } catch (Exception e) {
                logger.error("❌ {}: {}", operationName, e.getMessage());
                throw e;
            }
        };
    }
}
