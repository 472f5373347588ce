package com.archiver.core.error;

/**
 * Base of the checked failures raised while resolving posts.
 */
public class ArchiveException extends Exception {

    public ArchiveException(String message) {
        super(message);
    }

    public ArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
