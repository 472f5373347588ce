package com.archiver.core.error;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writing a downloaded attachment to local storage failed.
 */
public class DownloadIOException extends IOException {
    private final transient Path path;

    public DownloadIOException(Path path, Throwable cause) {
        super("Cannot write " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
