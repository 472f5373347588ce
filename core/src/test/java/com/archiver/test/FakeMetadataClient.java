package com.archiver.test;

import com.archiver.api.MetadataClient;
import com.archiver.core.error.TransientNetworkException;
import com.google.gson.JsonElement;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory API with per-endpoint call counters. Unknown endpoints answer HTTP 404.
 */
public class FakeMetadataClient implements MetadataClient {
    private final Map<String, JsonElement> profiles = new ConcurrentHashMap<>();
    private final Map<String, JsonElement> posts = new ConcurrentHashMap<>();
    private final Map<String, Integer> failuresBeforeSuccess = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private volatile CountDownLatch profileGate;

    public FakeMetadataClient addProfile(String service, String id, JsonElement json) {
        profiles.put(profileKey(service, id), json);
        return this;
    }

    public FakeMetadataClient addPost(String service, String creatorId, String postId, JsonElement json) {
        posts.put(postKey(service, creatorId, postId), json);
        return this;
    }

    /**
     * The next {@code count} calls to the post endpoint answer HTTP 503.
     */
    public FakeMetadataClient failPost(String service, String creatorId, String postId, int count) {
        failuresBeforeSuccess.put(postKey(service, creatorId, postId), count);
        return this;
    }

    public FakeMetadataClient failProfile(String service, String id, int count) {
        failuresBeforeSuccess.put(profileKey(service, id), count);
        return this;
    }

    /**
     * Profile requests block until the latch opens.
     */
    public void gateProfiles(CountDownLatch gate) {
        this.profileGate = gate;
    }

    public int profileCalls(String service, String id) {
        return count(profileKey(service, id));
    }

    public int postCalls(String service, String creatorId, String postId) {
        return count(postKey(service, creatorId, postId));
    }

    @Override
    public JsonElement fetchProfile(String service, String creatorId) throws TransientNetworkException {
        String key = profileKey(service, creatorId);
        calls.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();

        CountDownLatch gate = profileGate;
        if (gate != null) {
            try {
                if (!gate.await(10, TimeUnit.SECONDS)) throw new IllegalStateException("profile gate never opened");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        }
        return answer(key, profiles);
    }

    @Override
    public JsonElement fetchPost(String service, String creatorId, String postId) throws TransientNetworkException {
        String key = postKey(service, creatorId, postId);
        calls.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
        return answer(key, posts);
    }

    private JsonElement answer(String key, Map<String, JsonElement> table) throws TransientNetworkException {
        Integer remaining = failuresBeforeSuccess.computeIfPresent(key, (k, n) -> n - 1);
        if (remaining != null && remaining >= 0) {
            throw new TransientNetworkException(503, "fake://" + key);
        }
        JsonElement json = table.get(key);
        if (json == null) throw new TransientNetworkException(404, "fake://" + key);
        return json;
    }

    private int count(String key) {
        AtomicInteger n = calls.get(key);
        return n == null ? 0 : n.get();
    }

    private static String profileKey(String service, String id) {
        return service + "/user/" + id + "/profile";
    }

    private static String postKey(String service, String creatorId, String postId) {
        return service + "/user/" + creatorId + "/post/" + postId;
    }
}
