package com.archiver.services.stats;

/**
 * One entry of the summary's failure list.
 *
 * @param target what failed: a download URL with its local file, or a post reference
 * @param error  message of the final error
 */
public record FailureRecord(String target, String error) {
    @Override
    public String toString() {
        return target + " -> " + error;
    }
}
