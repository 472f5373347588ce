package com.archiver.core.metadata;

import com.archiver.api.MetadataClient;
import com.archiver.common.model.Attachment;
import com.archiver.common.model.Creator;
import com.archiver.common.model.Post;
import com.archiver.common.model.PostPayload;
import com.archiver.common.model.PostRef;
import com.archiver.common.model.RemoteFile;
import com.archiver.common.util.FileNames;
import com.archiver.core.cache.CreatorCache;
import com.archiver.core.cache.CreatorKey;
import com.archiver.core.error.ArchiveException;
import com.archiver.core.error.MalformedResponseException;
import com.archiver.core.error.MetadataFetchException;
import com.archiver.core.error.RetryExhaustedException;
import com.archiver.core.retry.RetryPolicy;
import com.google.gson.JsonElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static com.archiver.core.retry.ErrorLogging.logged;

/**
 * Fetches posts of one site and attaches their creator, looked up through a shared cache.
 * Network calls are retried; decoding is not.
 */
public class MetadataResolver {
    private static final Logger logger = LoggerFactory.getLogger(MetadataResolver.class);

    private final MetadataClient client;
    private final RetryPolicy retryPolicy;
    private final CreatorCache creatorCache;
    private final Path downloadRoot;

    public MetadataResolver(MetadataClient client, RetryPolicy retryPolicy, Path downloadRoot) {
        this.client = client;
        this.retryPolicy = retryPolicy;
        this.downloadRoot = downloadRoot;
        this.creatorCache = new CreatorCache(this::loadCreator);
    }

    public Post fetchPost(PostRef ref) throws ArchiveException {
        String operation = "GET post " + ref;
        JsonElement json;
        try {
            json = logged(operation, retryPolicy.wrap(operation,
                    () -> client.fetchPost(ref.service(), ref.creatorId(), ref.postId()))).call();
        } catch (MalformedResponseException e) {
            throw e;
        } catch (Exception e) {
            throw new MetadataFetchException(ref, e);
        }

        PostPayload payload = MetadataDecoder.decodePost(json);
        if (!payload.service().equals(ref.service()) || !payload.creatorId().equals(ref.creatorId())) {
            logger.debug("Post {} belongs to {}/{} according to the response", ref, payload.service(), payload.creatorId());
        }

        Creator creator;
        try {
            creator = creatorCache.resolve(payload.service(), payload.creatorId());
        } catch (RetryExhaustedException e) {
            throw new MetadataFetchException(ref, e);
        }

        Post post = buildPost(payload, creator);
        logger.info("📄 Post resolved: '{}' by {} ({} pictures, {} files)",
                post.title(), creator.name(), post.pictures().size(), post.fileAttachments().size());
        return post;
    }

    /**
     * Looks a creator up through the cache, fetching the profile on a miss.
     */
    public Creator fetchCreator(String service, String creatorId) throws ArchiveException {
        return creatorCache.resolve(service, creatorId);
    }

    public CreatorCache getCreatorCache() {
        return creatorCache;
    }

    private Creator loadCreator(CreatorKey key) throws ArchiveException {
        String operation = "GET profile " + key;
        JsonElement json;
        try {
            json = logged(operation, retryPolicy.wrap(operation,
                    () -> client.fetchProfile(key.service(), key.creatorId()))).call();
        } catch (ArchiveException e) {
            throw e;
        } catch (Exception e) {
            throw new ArchiveException(operation + " aborted: " + e, e);
        }
        return MetadataDecoder.decodeCreator(json);
    }

    private Post buildPost(PostPayload payload, Creator creator) {
        Path folder = downloadRoot.resolve(FileNames.postFolderName(creator.name(), payload.title(), payload.id()));

        List<Attachment> pictures = new ArrayList<>(payload.previews().size());
        int index = 1;
        for (RemoteFile preview : payload.previews()) {
            pictures.add(new Attachment(preview.server(), preview.path(),
                    MetadataDecoder.previewFilename(index++, preview.path()), folder));
        }

        List<Attachment> files = new ArrayList<>(payload.attachments().size());
        for (RemoteFile file : payload.attachments()) {
            files.add(new Attachment(file.server(), file.path(), FileNames.sanitize(file.name()), folder));
        }

        return new Post(payload.id(), payload.title(), pictures, files, creator, folder);
    }
}
