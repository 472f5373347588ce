package com.archiver.common.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * A resolved post: metadata, owning creator and the attachments to download.
 * Pictures are renumbered 1..N, file attachments keep their original names.
 */
public record Post(
        String id,
        String title,
        List<Attachment> pictures,
        List<Attachment> fileAttachments,
        Creator creator,
        Path destinationFolder
) {
    public Post {
        pictures = List.copyOf(pictures);
        fileAttachments = List.copyOf(fileAttachments);
    }

    /**
     * Pictures first, then file attachments, each in response order.
     */
    public List<Attachment> allAttachments() {
        List<Attachment> all = new ArrayList<>(pictures.size() + fileAttachments.size());
        all.addAll(pictures);
        all.addAll(fileAttachments);
        return all;
    }
}
