package com.archiver.common.model;

/**
 * One entry of a post response's "previews" or "attachments" array.
 */
public record RemoteFile(
        String name,      // original file name
        String path,      // e.g. "/ab/cd/abcd1234.jpg"
        String server     // e.g. "https://n1.kemono.su"
) {}
