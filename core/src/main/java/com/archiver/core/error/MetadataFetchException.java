package com.archiver.core.error;

import com.archiver.common.model.PostRef;

/**
 * The post endpoint kept failing until the retry budget ran out.
 */
public class MetadataFetchException extends ArchiveException {
    private final PostRef ref;

    public MetadataFetchException(PostRef ref, Throwable cause) {
        super("Cannot fetch post " + ref + ": " + cause.getMessage(), cause);
        this.ref = ref;
    }

    public PostRef getRef() {
        return ref;
    }
}
