package com.plugins.kemono.internal;

import com.archiver.api.MetadataClient;
import com.archiver.api.PostSource;
import com.archiver.common.model.PostRef;
import com.archiver.common.util.HttpSettings;
import com.archiver.services.http.HttpMetadataClient;

import java.util.Map;
import java.util.Set;

/**
 * One kemono-style site: its hosts and the API root its metadata is read from.
 */
public class SiteSource implements PostSource {
    private final String name;
    private final PostUrlParser parser;
    private final HttpMetadataClient client;

    public SiteSource(String name, Set<String> hosts, String apiRoot, String referer, HttpSettings settings) {
        this.name = name;
        this.parser = new PostUrlParser(hosts);
        // The API answers JSON only when asked for text/css
        this.client = new HttpMetadataClient(apiRoot, settings.withHeaders(Map.of(
                "Referer", referer,
                "Accept", "text/css")));
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean supports(String url) {
        return parser.matchesHost(url);
    }

    @Override
    public PostRef parse(String url) {
        return parser.parse(name, url);
    }

    @Override
    public MetadataClient getMetadataClient() {
        return client;
    }

    public String getApiRoot() {
        return client.getApiRoot();
    }
}
