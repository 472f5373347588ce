package com.archiver.api;

import java.io.IOException;
import java.io.InputStream;

/**
 * Raw file download. The caller closes the stream.
 */
public interface BinaryClient {
    /**
     * @throws com.archiver.core.error.TransientNetworkException on a non-success status or connection failure
     */
    InputStream open(String url) throws IOException;
}
