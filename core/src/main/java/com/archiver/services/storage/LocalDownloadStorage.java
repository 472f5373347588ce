package com.archiver.services.storage;

import com.archiver.api.DownloadStorage;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes straight to the target path. An interrupted write leaves a truncated file behind.
 */
public class LocalDownloadStorage implements DownloadStorage {

    @Override
    public void createDirectories(Path dir) throws IOException {
        Files.createDirectories(dir);
    }

    @Override
    public long write(Path target, InputStream content) throws IOException {
        return Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
    }
}
