package com.archiver.core.download;

import com.archiver.common.model.Post;
import com.archiver.common.model.PostRef;

/**
 * Outcome of resolving one post: exactly one of {@code post} and {@code failure} is set.
 */
public record PostResolution(PostRef ref, Post post, PostFailure failure) {

    public static PostResolution resolved(PostRef ref, Post post) {
        return new PostResolution(ref, post, null);
    }

    public static PostResolution failed(PostRef ref, Throwable error) {
        return new PostResolution(ref, null, new PostFailure(ref, error));
    }

    public boolean isResolved() {
        return post != null;
    }
}
