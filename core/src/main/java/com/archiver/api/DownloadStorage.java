package com.archiver.api;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Where downloaded attachments end up.
 */
public interface DownloadStorage {

    /**
     * Creates the directory and its parents. An existing directory is not an error.
     */
    void createDirectories(Path dir) throws IOException;

    /**
     * Writes the whole stream to {@code target}, replacing any existing file.
     *
     * @return number of bytes written
     */
    long write(Path target, InputStream content) throws IOException;
}
