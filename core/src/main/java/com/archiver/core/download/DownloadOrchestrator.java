package com.archiver.core.download;

import com.archiver.api.ArchiveListener;
import com.archiver.common.model.Attachment;
import com.archiver.common.model.Post;
import com.archiver.common.model.PostRef;
import com.archiver.core.metadata.MetadataResolver;
import com.archiver.core.queue.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Runs post resolution and attachment downloads on a bounded worker pool.
 *
 * <p>Every job ends in a value: a failed post becomes a {@link PostFailure}, a failed
 * attachment a {@link DownloadTask} in state FAILED. Siblings are never cancelled, and both
 * stages return their results in input order regardless of completion order.</p>
 */
public class DownloadOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(DownloadOrchestrator.class);

    private final AttachmentDownloader downloader;
    private final WorkerPool pool;
    private final ArchiveListener listener;

    public DownloadOrchestrator(AttachmentDownloader downloader, int concurrency, ArchiveListener listener) {
        this.downloader = downloader;
        this.pool = new WorkerPool(concurrency, "archiver-worker");
        this.listener = listener != null ? listener : ArchiveListener.NONE;
    }

    public DownloadOrchestrator(AttachmentDownloader downloader, int concurrency) {
        this(downloader, concurrency, ArchiveListener.NONE);
    }

    /**
     * Resolves every ref in parallel. {@code resolvers} picks the resolver of a ref's site.
     */
    public List<PostResolution> resolveAll(List<PostRef> refs, Function<PostRef, MetadataResolver> resolvers) {
        logger.info("🔎 Resolving {} post(s) with {} worker(s)", refs.size(), pool.getConcurrency());
        return pool.runAll(refs, ref -> {
            PostResolution resolution;
            try {
                MetadataResolver resolver = resolvers.apply(ref);
                if (resolver == null) {
                    throw new IllegalStateException("No resolver for source '" + ref.source() + "'");
                }
                resolution = PostResolution.resolved(ref, resolver.fetchPost(ref));
            } catch (Exception e) {
                logger.error("❌ Post {} failed: {}", ref, e.getMessage());
                resolution = PostResolution.failed(ref, e);
            }
            notifyResolution(resolution);
            return resolution;
        }, (ref, error) -> PostResolution.failed(ref, error));
    }

    /**
     * Downloads every attachment of every post: per post pictures first, then files.
     * Blocks until all downloads have succeeded or failed.
     */
    public List<DownloadTask> downloadAll(List<Post> posts) {
        List<DownloadTask> tasks = new ArrayList<>();
        for (Post post : posts) {
            for (Attachment attachment : post.allAttachments()) {
                tasks.add(new DownloadTask(tasks.size() + 1, attachment));
            }
        }

        logger.info("⬇️ Downloading {} attachment(s) from {} post(s) with {} worker(s)",
                tasks.size(), posts.size(), pool.getConcurrency());
        for (DownloadTask task : tasks) {
            listener.onSubmitted(task);
        }

        return pool.runAll(tasks, this::runTask, (task, error) -> {
            if (task.getStatus() == DownloadTask.Status.PENDING) {
                task.markFailed(error);
            }
            return task;
        });
    }

    private DownloadTask runTask(DownloadTask task) {
        try {
            task.markSucceeded(downloader.fetch(task.getAttachment()));
        } catch (Exception e) {
            task.markFailed(e);
        }

        try {
            if (task.isSucceeded()) {
                listener.onSucceeded(task);
            } else {
                listener.onFailed(task);
            }
        } catch (RuntimeException e) {
            logger.warn("Listener failed for task {}", task.getSequence(), e);
        }
        return task;
    }

    private void notifyResolution(PostResolution resolution) {
        try {
            if (resolution.isResolved()) {
                listener.onPostResolved(resolution.post());
            } else {
                listener.onPostFailed(resolution.failure());
            }
        } catch (RuntimeException e) {
            logger.warn("Listener failed for post {}", resolution.ref(), e);
        }
    }
}
