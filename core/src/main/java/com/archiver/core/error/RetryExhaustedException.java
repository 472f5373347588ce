package com.archiver.core.error;

/**
 * Raised once an operation has failed on every allowed attempt. The cause is the last error.
 */
public class RetryExhaustedException extends ArchiveException {
    private final String operation;
    private final int attempts;

    public RetryExhaustedException(String operation, int attempts, Throwable lastError) {
        super(operation + " failed after " + attempts + " attempt(s): " + lastError.getMessage(), lastError);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String getOperation() {
        return operation;
    }

    public int getAttempts() {
        return attempts;
    }
}
