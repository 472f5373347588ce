package com.archiver.api;

import com.archiver.core.error.MalformedResponseException;
import com.google.gson.JsonElement;

import java.io.IOException;

/**
 * Read access to a site's JSON API.
 */
public interface MetadataClient {

    /**
     * GET {@code {apiRoot}/{service}/user/{creatorId}/profile}.
     */
    JsonElement fetchProfile(String service, String creatorId) throws IOException, MalformedResponseException;

    /**
     * GET {@code {apiRoot}/{service}/user/{creatorId}/post/{postId}}.
     */
    JsonElement fetchPost(String service, String creatorId, String postId) throws IOException, MalformedResponseException;
}
