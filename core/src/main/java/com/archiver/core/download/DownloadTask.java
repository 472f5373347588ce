package com.archiver.core.download;

import com.archiver.common.model.Attachment;

import java.nio.file.Path;

/**
 * One scheduled attachment download and its outcome. Finalized exactly once by the worker
 * that ran it; read by the orchestrator after the worker's future completed.
 */
public class DownloadTask {
    public enum Status { PENDING, SUCCEEDED, FAILED }

    private final int sequence;
    private final Attachment attachment;
    private Status status = Status.PENDING;
    private Path localPath;
    private long byteSize;
    private Throwable error;

    public DownloadTask(int sequence, Attachment attachment) {
        this.sequence = sequence;
        this.attachment = attachment;
    }

    public void markSucceeded(DownloadResult result) {
        requirePending();
        this.localPath = result.localPath();
        this.byteSize = result.byteSize();
        this.status = Status.SUCCEEDED;
    }

    public void markFailed(Throwable error) {
        requirePending();
        this.error = error;
        this.status = Status.FAILED;
    }

    private void requirePending() {
        if (status != Status.PENDING) {
            throw new IllegalStateException("Task " + sequence + " already finished as " + status);
        }
    }

    public boolean isSucceeded() { return status == Status.SUCCEEDED; }
    public boolean isFailed() { return status == Status.FAILED; }

    // Getters
    public int getSequence() { return sequence; }
    public Attachment getAttachment() { return attachment; }
    public Status getStatus() { return status; }
    public Path getLocalPath() { return localPath; }
    public long getByteSize() { return byteSize; }
    public Throwable getError() { return error; }

    @Override
    public String toString() {
        return "#" + sequence + " " + attachment.downloadUrl() + " -> " + attachment.localPath() + " [" + status + "]";
    }
}
