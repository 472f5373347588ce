package com.archiver.core.retry;

/**
 * A unit of work that may fail with any exception, e.g. one HTTP request.
 */
@FunctionalInterface
public interface FallibleOperation<T> {
    T call() throws Exception;
}
