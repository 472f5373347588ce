package com.archiver.common.model;

import java.nio.file.Path;

/**
 * A single downloadable file of a post. The destination folder belongs to the post.
 */
public record Attachment(
        String remoteServer,
        String remotePath,
        String localFilename,
        Path destinationFolder
) {
    public String downloadUrl() {
        return remoteServer + "/data" + remotePath;
    }

    public Path localPath() {
        return destinationFolder.resolve(localFilename);
    }
}
