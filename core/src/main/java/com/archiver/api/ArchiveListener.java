package com.archiver.api;

import com.archiver.core.download.DownloadTask;
import com.archiver.core.download.PostFailure;
import com.archiver.common.model.Post;
import com.archiver.services.stats.Summary;

/**
 * Receives progress events of an archive run. Callbacks for downloads arrive on worker threads.
 */
public interface ArchiveListener {

    default void onPostResolved(Post post) {}

    default void onPostFailed(PostFailure failure) {}

    default void onSubmitted(DownloadTask task) {}

    default void onSucceeded(DownloadTask task) {}

    default void onFailed(DownloadTask task) {}

    default void onSummary(Summary summary) {}

    ArchiveListener NONE = new ArchiveListener() {};
}
