package com.archiver.common.model;

/**
 * Identifies a post to fetch: the site it lives on plus the three URL segments.
 */
public record PostRef(
        String source,    // name of the PostSource, e.g. "kemono"
        String service,
        String creatorId,
        String postId
) {
    @Override
    public String toString() {
        return source + ":" + service + "/" + creatorId + "/" + postId;
    }
}
