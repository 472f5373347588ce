package com.archiver.common.util;

import java.util.Map;

/**
 * Per-client connection settings.
 */
public record HttpSettings(
        int connectTimeoutMs,
        int readTimeoutMs,
        String userAgent,
        Map<String, String> headers  // extra request headers, e.g. Referer
) {
    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) PostArchiver/1.0";

    public HttpSettings {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static HttpSettings defaults() {
        return new HttpSettings(15000, 30000, DEFAULT_USER_AGENT, Map.of());
    }

    public HttpSettings withHeaders(Map<String, String> extra) {
        return new HttpSettings(connectTimeoutMs, readTimeoutMs, userAgent, extra);
    }
}
