package com.archiver.core.error;

/**
 * A response body was missing a required field or had the wrong shape.
 * Deterministic, so it is never retried.
 */
public class MalformedResponseException extends ArchiveException {
    private final String field;

    public MalformedResponseException(String field, String message) {
        super(message);
        this.field = field;
    }

    public MalformedResponseException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    /**
     * Path of the offending field, e.g. {@code previews[1].path}, or {@code $} for the whole body.
     */
    public String getField() {
        return field;
    }
}
