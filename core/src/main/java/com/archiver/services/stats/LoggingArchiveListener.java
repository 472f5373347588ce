package com.archiver.services.stats;

import com.archiver.api.ArchiveListener;
import com.archiver.common.model.Post;
import com.archiver.core.download.DownloadTask;
import com.archiver.core.download.PostFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Default reporter: writes every archive event to the log.
 */
public class LoggingArchiveListener implements ArchiveListener {
    private static final Logger logger = LoggerFactory.getLogger(LoggingArchiveListener.class);

    @Override
    public void onPostResolved(Post post) {
        logger.info("Creator: {} ({}/{})", post.creator().name(), post.creator().service(), post.creator().id());
        logger.info("Post: {} '{}' -> {}", post.id(), post.title(), post.destinationFolder());
    }

    @Override
    public void onPostFailed(PostFailure failure) {
        logger.error("❌ Post {} skipped: {}", failure.ref(), failure.error().getMessage());
    }

    @Override
    public void onSubmitted(DownloadTask task) {
        logger.debug("Queued #{} {}", task.getSequence(), task.getAttachment().downloadUrl());
    }

    @Override
    public void onSucceeded(DownloadTask task) {
        logger.info("✅ #{} {} ({})", task.getSequence(), task.getLocalPath(), formatBytes(task.getByteSize()));
    }

    @Override
    public void onFailed(DownloadTask task) {
        logger.error("❌ #{} {} failed: {}", task.getSequence(), task.getAttachment().downloadUrl(),
                task.getError() != null ? task.getError().getMessage() : "unknown error");
    }

    @Override
    public void onSummary(Summary summary) {
        logger.info("📋 Downloaded {}/{} attachment(s), {}",
                summary.succeededCount(), summary.submittedCount(), formatBytes(summary.totalBytes()));
        if (!summary.isClean()) {
            logger.warn("⚠️ {} failure(s):", summary.failures().size());
            for (FailureRecord failure : summary.failures()) {
                logger.warn("  - {}", failure);
            }
        }
    }

    static String formatBytes(long bytes) {
        if (bytes < 1024) return bytes + " B";
        if (bytes < 1024 * 1024) return String.format(Locale.ROOT, "%.1f KB", bytes / 1024.0);
        if (bytes < 1024L * 1024 * 1024) return String.format(Locale.ROOT, "%.1f MB", bytes / (1024.0 * 1024));
        return String.format(Locale.ROOT, "%.2f GB", bytes / (1024.0 * 1024 * 1024));
    }
}
