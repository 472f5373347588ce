package com.archiver.common.util;

/**
 * File and folder name helpers.
 */
public final class FileNames {

    private FileNames() {}

    /**
     * Replaces characters that are illegal in file names on Windows or POSIX with '_'.
     * Brackets and parentheses are kept, trailing dots and surrounding whitespace are dropped.
     */
    public static String sanitize(String name) {
        String cleaned = name.replaceAll("[<>:\"/\\\\|?*\\p{Cntrl}]", "_").strip();
        while (cleaned.endsWith(".")) {
            cleaned = cleaned.substring(0, cleaned.length() - 1).stripTrailing();
        }
        return cleaned.isEmpty() ? "_" : cleaned;
    }

    /**
     * Folder name of a post: {@code "[creator] title (id)"}, sanitized.
     */
    public static String postFolderName(String creatorName, String title, String postId) {
        return sanitize("[" + creatorName + "] " + title + " (" + postId + ")");
    }
}
