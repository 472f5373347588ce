package com.archiver.core.error;

import java.io.IOException;

/**
 * Connection failure or non-success HTTP status. Worth another attempt.
 */
public class TransientNetworkException extends IOException {
    private final int statusCode;
    private final String url;

    public TransientNetworkException(int statusCode, String url) {
        super("HTTP " + statusCode + " for " + url);
        this.statusCode = statusCode;
        this.url = url;
    }

    public TransientNetworkException(String url, Throwable cause) {
        super("Request failed for " + url + ": " + cause.getMessage(), cause);
        this.statusCode = -1;
        this.url = url;
    }

    /**
     * HTTP status, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public String getUrl() {
        return url;
    }
}
