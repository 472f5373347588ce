package com.archiver.common.util;

import com.archiver.core.error.TransientNetworkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPInputStream;

public class HttpUtils {
    private static final Logger logger = LoggerFactory.getLogger(HttpUtils.class);

    private HttpUtils() {}

    /**
     * Issues a GET and returns the response body stream of a 2xx response.
     * Any other status, or no response at all, is reported as a {@link TransientNetworkException}.
     */
    public static InputStream openGet(String urlStr, HttpSettings settings) throws IOException {
        HttpURLConnection conn;
        int code;
        try {
            conn = (HttpURLConnection) URI.create(urlStr).toURL().openConnection();
            conn.setRequestMethod("GET");
            conn.setConnectTimeout(settings.connectTimeoutMs());
            conn.setReadTimeout(settings.readTimeoutMs());
            conn.setInstanceFollowRedirects(true);
            conn.setRequestProperty("User-Agent", settings.userAgent());
            settings.headers().forEach(conn::setRequestProperty);

            code = conn.getResponseCode();
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid URL: " + urlStr, e);
        } catch (IOException e) {
            throw new TransientNetworkException(urlStr, e);
        }

        if (code < 200 || code >= 300) {
            drainError(conn, urlStr, code);
            conn.disconnect();
            throw new TransientNetworkException(code, urlStr);
        }

        InputStream in = conn.getInputStream();
        if ("gzip".equalsIgnoreCase(conn.getContentEncoding())) {
            try {
                in = new GZIPInputStream(in);
            } catch (IOException e) {
                closeQuietly(in, urlStr);
                conn.disconnect();
                throw new TransientNetworkException(urlStr, e);
            }
        }
        return in;
    }

    /**
     * GET returning the whole body decoded as UTF-8.
     */
    public static String getString(String urlStr, HttpSettings settings) throws IOException {
        try (InputStream in = openGet(urlStr, settings)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static void closeQuietly(InputStream in, String urlStr) {
        try {
            in.close();
        } catch (IOException e) {
            logger.debug("Could not close response of {}: {}", urlStr, e.getMessage());
        }
    }

    private static void drainError(HttpURLConnection conn, String urlStr, int code) {
        try (InputStream es = conn.getErrorStream()) {
            if (es != null) {
                String body = new String(es.readAllBytes(), StandardCharsets.UTF_8);
                logger.debug("HTTP {} for {}: {}", code, urlStr, body.length() > 200 ? body.substring(0, 200) : body);
            }
        } catch (IOException e) {
            logger.debug("Could not read error body of {}: {}", urlStr, e.getMessage());
        }
    }
}
