package com.plugins.kemono.internal;

import com.archiver.common.model.PostRef;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits {@code https://{host}/{service}/user/{creatorId}/post/{postId}} into its parts.
 * Query string and fragment are ignored.
 */
public class PostUrlParser {

    private final Set<String> hosts;

    public PostUrlParser(Set<String> hosts) {
        this.hosts = Set.copyOf(hosts);
    }

    public boolean matchesHost(String url) {
        String host = hostOf(url);
        if (host == null) return false;
        for (String h : hosts) {
            if (host.equals(h) || host.endsWith("." + h)) return true;
        }
        return false;
    }

    public PostRef parse(String sourceName, String url) {
        if (!matchesHost(url)) {
            throw new IllegalArgumentException("Not a " + sourceName + " URL: " + url);
        }

        List<String> segments = new ArrayList<>();
        for (String s : URI.create(url.trim()).getPath().split("/")) {
            if (!s.isEmpty()) segments.add(s);
        }

        if (segments.size() < 5 || !segments.get(1).equals("user") || !segments.get(3).equals("post")) {
            throw new IllegalArgumentException(
                    "Expected /{service}/user/{creator}/post/{post} but got: " + url);
        }
        return new PostRef(sourceName, segments.get(0), segments.get(2), segments.get(4));
    }

    private static String hostOf(String url) {
        try {
            String host = new URI(url.trim()).getHost();
            return host != null ? host.toLowerCase(Locale.ROOT) : null;
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
