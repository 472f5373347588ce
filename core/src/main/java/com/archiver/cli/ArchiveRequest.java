package com.archiver.cli;

import java.util.List;

/**
 * Parsed command line.
 */
public record ArchiveRequest(
    List<String> urls,
    String downloadDir,     // null = keep configured value
    Integer workers,        // null = keep configured value
    Integer retries,        // null = keep configured value
    String configDir,       // null = working directory
    boolean metadataOnly
) {
    public ArchiveRequest {
        urls = List.copyOf(urls);
    }
}
