package com.archiver.core.metadata;

import com.archiver.common.model.Creator;
import com.archiver.common.model.PostPayload;
import com.archiver.core.error.MalformedResponseException;
import com.archiver.test.TestBase;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import static com.archiver.test.TestData.*;
import static org.junit.jupiter.api.Assertions.*;

class MetadataDecoderTest extends TestBase {

    @Test
    void testDecodeCreator() throws Exception {
        Creator creator = MetadataDecoder.decodeCreator(profile("patreon", "123", "Alice"));

        assertEquals(new Creator("patreon", "123", "Alice"), creator);
    }

    @Test
    void testDecodeCreatorMissingName() {
        JsonObject json = profile("patreon", "123", "Alice");
        json.remove("name");

        MalformedResponseException e = assertThrows(MalformedResponseException.class,
                () -> MetadataDecoder.decodeCreator(json));
        assertEquals("name", e.getField());
    }

    @Test
    void testDecodePost() throws Exception {
        JsonObject json = post("fanbox", "77", "9001", "Sketches",
                files(file("a.jpg", "/aa/bb/hash1.jpg"), file("b.png", "/cc/dd/hash2.png")),
                files(file("source.zip", "/ee/ff/hash3.zip")));

        PostPayload payload = MetadataDecoder.decodePost(json);

        assertEquals("9001", payload.id());
        assertEquals("Sketches", payload.title());
        assertEquals("fanbox", payload.service());
        assertEquals("77", payload.creatorId());
        assertEquals(2, payload.previews().size());
        assertEquals("/cc/dd/hash2.png", payload.previews().get(1).path());
        assertEquals("source.zip", payload.attachments().get(0).name());
    }

    @Test
    void testNumericIdsAreAccepted() throws Exception {
        JsonObject json = post("patreon", "1", "2", "t", files(), files());
        json.getAsJsonObject("post").addProperty("id", 2);

        assertEquals("2", MetadataDecoder.decodePost(json).id());
    }

    @Test
    void testMissingPreviewPathNamesTheField() {
        JsonObject broken = file("a.jpg", "/x.jpg");
        broken.remove("path");
        JsonObject json = post("patreon", "1", "2", "t", files(file("ok.jpg", "/ok.jpg"), broken), files());

        MalformedResponseException e = assertThrows(MalformedResponseException.class,
                () -> MetadataDecoder.decodePost(json));
        assertEquals("previews[1].path", e.getField());
    }

    @Test
    void testNullTitleIsRejected() {
        JsonObject json = post("patreon", "1", "2", "t", files(), files());
        json.getAsJsonObject("post").add("title", null);

        MalformedResponseException e = assertThrows(MalformedResponseException.class,
                () -> MetadataDecoder.decodePost(json));
        assertEquals("post.title", e.getField());
    }

    @Test
    void testAttachmentsMustBeAnArray() {
        JsonObject json = post("patreon", "1", "2", "t", files(), files());
        json.addProperty("attachments", "none");

        MalformedResponseException e = assertThrows(MalformedResponseException.class,
                () -> MetadataDecoder.decodePost(json));
        assertEquals("attachments", e.getField());
    }

    @Test
    void testMissingPostObject() {
        assertThrows(MalformedResponseException.class,
                () -> MetadataDecoder.decodePost(JsonParser.parseString("{\"previews\":[],\"attachments\":[]}")));
        assertThrows(MalformedResponseException.class,
                () -> MetadataDecoder.decodePost(new JsonArray()));
    }

    @Test
    void testPreviewFilename() {
        assertEquals("1.jpg", MetadataDecoder.previewFilename(1, "/aa/bb/hash.jpg"));
        assertEquals("12.png", MetadataDecoder.previewFilename(12, "/aa/bb/hash.tar.png"));
        assertEquals("3.", MetadataDecoder.previewFilename(3, "/aa/bb/hash"));
        // dots in directory names do not count
        assertEquals("2.", MetadataDecoder.previewFilename(2, "/a.b/hash"));
    }

    @Test
    void testEncodeThenDecodeKeepsStructure() throws Exception {
        PostPayload original = MetadataDecoder.decodePost(post("patreon", "5", "6", "Title",
                files(file("a.jpg", "/a.jpg"), file("b.gif", "/b.gif")),
                files(file("c.zip", "/c.zip"))));

        PostPayload copy = MetadataDecoder.decodePost(MetadataDecoder.encodePost(original));

        assertEquals(original.id(), copy.id());
        assertEquals(original.title(), copy.title());
        assertEquals(original.previews().size(), copy.previews().size());
        assertEquals(original.attachments().size(), copy.attachments().size());
        assertEquals(original, copy);
    }
}
