package com.archiver.common.model;

import java.util.List;

/**
 * Decoded post response before the owning creator has been resolved.
 * The service and creator id come from the response body, not from the requested URL.
 */
public record PostPayload(
        String id,
        String title,
        String service,
        String creatorId,
        List<RemoteFile> previews,
        List<RemoteFile> attachments
) {
    public PostPayload {
        previews = List.copyOf(previews);
        attachments = List.copyOf(attachments);
    }
}
