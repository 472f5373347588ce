package com.archiver.core.download;

import com.archiver.common.model.PostRef;

/**
 * A post whose metadata could not be resolved. None of its attachments were scheduled.
 */
public record PostFailure(PostRef ref, Throwable error) {}
