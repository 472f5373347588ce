package com.archiver.services.stats;

import com.archiver.core.download.DownloadTask;
import com.archiver.core.download.PostFailure;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Folds finished downloads into a {@link Summary}. Pure: no logging, no I/O.
 */
public final class SummaryReporter {

    private SummaryReporter() {}

    public static Summary summarize(List<DownloadTask> outcomes) {
        return summarize(outcomes, List.of());
    }

    public static Summary summarize(List<DownloadTask> outcomes, List<PostFailure> postFailures) {
        return summarize(outcomes, postFailures, List.of());
    }

    /**
     * @param outcomes     finished download tasks, in any order
     * @param postFailures posts that never got as far as scheduling downloads
     * @param rejected     inputs that were refused before resolution, e.g. unsupported URLs
     */
    public static Summary summarize(List<DownloadTask> outcomes, List<PostFailure> postFailures,
                                    List<FailureRecord> rejected) {
        List<DownloadTask> ordered = new ArrayList<>(outcomes);
        ordered.sort(Comparator.comparingInt(DownloadTask::getSequence));

        int succeeded = 0;
        long bytes = 0;
        List<FailureRecord> failures = new ArrayList<>();

        for (DownloadTask task : ordered) {
            if (task.isSucceeded()) {
                succeeded++;
                bytes += task.getByteSize();
            } else {
                String target = task.getAttachment().downloadUrl() + " (" + task.getAttachment().localPath() + ")";
                failures.add(new FailureRecord(target, describe(task.getError())));
            }
        }
        for (PostFailure failure : postFailures) {
            failures.add(new FailureRecord("post " + failure.ref(), describe(failure.error())));
        }
        failures.addAll(rejected);

        return new Summary(ordered.size(), succeeded, bytes, failures);
    }

    private static String describe(Throwable error) {
        if (error == null) return "unfinished";
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
