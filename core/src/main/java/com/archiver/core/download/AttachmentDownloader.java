package com.archiver.core.download;

import com.archiver.api.BinaryClient;
import com.archiver.api.DownloadStorage;
import com.archiver.common.model.Attachment;
import com.archiver.core.error.ArchiveException;
import com.archiver.core.error.DownloadIOException;
import com.archiver.core.error.TransientNetworkException;
import com.archiver.core.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

import static com.archiver.core.retry.ErrorLogging.logged;

/**
 * Downloads a single attachment into its post folder. Each attempt covers the whole
 * fetch-and-write, so a failed write is retried together with a fresh request.
 */
public class AttachmentDownloader {
    private static final Logger logger = LoggerFactory.getLogger(AttachmentDownloader.class);

    private final BinaryClient client;
    private final DownloadStorage storage;
    private final RetryPolicy retryPolicy;

    public AttachmentDownloader(BinaryClient client, DownloadStorage storage, RetryPolicy retryPolicy) {
        this.client = client;
        this.storage = storage;
        this.retryPolicy = retryPolicy;
    }

    public DownloadResult fetch(Attachment attachment) throws ArchiveException {
        String operation = "Download " + attachment.downloadUrl() + " -> " + attachment.localFilename();

        Path folder = attachment.destinationFolder().normalize();
        Path target = attachment.localPath().normalize();
        if (!target.startsWith(folder) || target.equals(folder)) {
            logger.error("❌ {}: target {} is outside of {}", operation, target, folder);
            throw new ArchiveException("Refusing to write " + attachment.localFilename() + " outside of " + folder);
        }

        try {
            return logged(operation, retryPolicy.wrap(operation, () -> attempt(attachment))).call();
        } catch (ArchiveException e) {
            throw e;
        } catch (Exception e) {
            throw new ArchiveException(operation + " aborted: " + e, e);
        }
    }

    private DownloadResult attempt(Attachment attachment) throws IOException {
        Path folder = attachment.destinationFolder();
        Path target = attachment.localPath();
        String url = attachment.downloadUrl();

        try {
            storage.createDirectories(folder);
        } catch (IOException e) {
            throw new DownloadIOException(folder, e);
        }

        try (InputStream in = new NetworkInputStream(client.open(url), url)) {
            long bytes;
            try {
                bytes = storage.write(target, in);
            } catch (TransientNetworkException | DownloadIOException e) {
                throw e;
            } catch (IOException e) {
                throw new DownloadIOException(target, e);
            }
            logger.debug("Wrote {} bytes to {}", bytes, target);
            return new DownloadResult(target, bytes);
        }
    }

    // Reports read failures of the response body as network errors, not as write errors
    private static class NetworkInputStream extends FilterInputStream {
        private final String url;

        NetworkInputStream(InputStream in, String url) {
            super(in);
            this.url = url;
        }

        @Override
        public int read() throws IOException {
            try {
                return super.read();
            } catch (TransientNetworkException e) {
                throw e;
            } catch (IOException e) {
                throw new TransientNetworkException(url, e);
            }
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            try {
                return super.read(b, off, len);
            } catch (TransientNetworkException e) {
                throw e;
            } catch (IOException e) {
                throw new TransientNetworkException(url, e);
            }
        }
    }
}
