package com.archiver.services.http;

import com.archiver.api.MetadataClient;
import com.archiver.common.util.HttpSettings;
import com.archiver.common.util.HttpUtils;
import com.archiver.core.error.MalformedResponseException;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * {@link MetadataClient} for the kemono-style v1 API below {@code apiRoot}
 * (e.g. {@code https://kemono.su/api/v1}).
 */
public class HttpMetadataClient implements MetadataClient {
    private static final Logger logger = LoggerFactory.getLogger(HttpMetadataClient.class);

    private final String apiRoot;
    private final HttpSettings settings;

    public HttpMetadataClient(String apiRoot, HttpSettings settings) {
        this.apiRoot = apiRoot.endsWith("/") ? apiRoot.substring(0, apiRoot.length() - 1) : apiRoot;
        this.settings = settings;
    }

    public String getApiRoot() {
        return apiRoot;
    }

    @Override
    public JsonElement fetchProfile(String service, String creatorId) throws IOException, MalformedResponseException {
        return getJson(String.format("%s/%s/user/%s/profile", apiRoot, encode(service), encode(creatorId)));
    }

    @Override
    public JsonElement fetchPost(String service, String creatorId, String postId) throws IOException, MalformedResponseException {
        return getJson(String.format("%s/%s/user/%s/post/%s", apiRoot, encode(service), encode(creatorId), encode(postId)));
    }

    private JsonElement getJson(String url) throws IOException, MalformedResponseException {
        logger.debug("GET {}", url);
        String body = HttpUtils.getString(url, settings);
        try {
            return JsonParser.parseString(body);
        } catch (JsonParseException e) {
            throw new MalformedResponseException("$", "Response of " + url + " is not valid JSON", e);
        }
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
