package com.archiver.core.metadata;

import com.archiver.common.model.Creator;
import com.archiver.common.model.PostPayload;
import com.archiver.common.model.RemoteFile;
import com.archiver.core.error.MalformedResponseException;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns API responses into typed entities. Every required field must be present with the
 * expected type; nothing is defaulted.
 *
 * <p>Post response shape:</p>
 * <pre>
 * {
 *   "post":        { "id": "...", "title": "...", "user": "...", "service": "..." },
 *   "previews":    [ { "name": "...", "path": "...", "server": "..." } ],
 *   "attachments": [ { "name": "...", "path": "...", "server": "..." } ]
 * }
 * </pre>
 */
public final class MetadataDecoder {

    private MetadataDecoder() {}

    public static Creator decodeCreator(JsonElement json) throws MalformedResponseException {
        JsonObject root = asObject(json, "$");
        return new Creator(
                requireString(root, "service", "$"),
                requireString(root, "id", "$"),
                requireString(root, "name", "$"));
    }

    public static PostPayload decodePost(JsonElement json) throws MalformedResponseException {
        JsonObject root = asObject(json, "$");
        JsonObject post = asObject(root.get("post"), "post");

        return new PostPayload(
                requireString(post, "id", "post"),
                requireString(post, "title", "post"),
                requireString(post, "service", "post"),
                requireString(post, "user", "post"),
                decodeFiles(root, "previews"),
                decodeFiles(root, "attachments"));
    }

    /**
     * Inverse of {@link #decodePost(JsonElement)} for the fields the decoder reads.
     */
    public static JsonObject encodePost(PostPayload payload) {
        JsonObject post = new JsonObject();
        post.addProperty("id", payload.id());
        post.addProperty("title", payload.title());
        post.addProperty("user", payload.creatorId());
        post.addProperty("service", payload.service());

        JsonObject root = new JsonObject();
        root.add("post", post);
        root.add("previews", encodeFiles(payload.previews()));
        root.add("attachments", encodeFiles(payload.attachments()));
        return root;
    }

    /**
     * Name for the n-th preview picture: {@code "{index}.{ext}"}, where ext is whatever follows
     * the last dot of the path's final segment. A path without one yields {@code "{index}."}.
     */
    public static String previewFilename(int oneBasedIndex, String remotePath) {
        String lastSegment = remotePath.substring(remotePath.lastIndexOf('/') + 1);
        int dot = lastSegment.lastIndexOf('.');
        String extension = dot >= 0 ? lastSegment.substring(dot + 1) : "";
        return oneBasedIndex + "." + extension;
    }

    // --- Helpers ---

    private static List<RemoteFile> decodeFiles(JsonObject root, String arrayName) throws MalformedResponseException {
        JsonElement element = root.get(arrayName);
        if (element == null || element.isJsonNull()) {
            throw new MalformedResponseException(arrayName, "Missing array '" + arrayName + "'");
        }
        if (!element.isJsonArray()) {
            throw new MalformedResponseException(arrayName, "'" + arrayName + "' is not an array");
        }

        JsonArray array = element.getAsJsonArray();
        List<RemoteFile> files = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            String path = arrayName + "[" + i + "]";
            JsonObject entry = asObject(array.get(i), path);
            files.add(new RemoteFile(
                    requireString(entry, "name", path),
                    requireString(entry, "path", path),
                    requireString(entry, "server", path)));
        }
        return files;
    }

    private static JsonArray encodeFiles(List<RemoteFile> files) {
        JsonArray array = new JsonArray();
        for (RemoteFile f : files) {
            JsonObject o = new JsonObject();
            o.addProperty("name", f.name());
            o.addProperty("path", f.path());
            o.addProperty("server", f.server());
            array.add(o);
        }
        return array;
    }

    private static JsonObject asObject(JsonElement element, String path) throws MalformedResponseException {
        if (element == null || element.isJsonNull()) {
            throw new MalformedResponseException(path, "Missing object '" + path + "'");
        }
        if (!element.isJsonObject()) {
            throw new MalformedResponseException(path, "'" + path + "' is not an object");
        }
        return element.getAsJsonObject();
    }

    // ids are sometimes sent as numbers; both are accepted, everything else is rejected
    private static String requireString(JsonObject obj, String name, String parentPath) throws MalformedResponseException {
        String path = parentPath.equals("$") ? name : parentPath + "." + name;
        JsonElement value = obj.get(name);
        if (value == null || value.isJsonNull()) {
            throw new MalformedResponseException(path, "Missing field '" + path + "'");
        }
        if (!value.isJsonPrimitive()) {
            throw new MalformedResponseException(path, "Field '" + path + "' is not a string");
        }
        JsonPrimitive primitive = value.getAsJsonPrimitive();
        if (!primitive.isString() && !primitive.isNumber()) {
            throw new MalformedResponseException(path, "Field '" + path + "' is not a string");
        }
        return primitive.getAsString();
    }
}
