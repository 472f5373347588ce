package com.archiver.core.cache;

import com.archiver.common.model.Creator;
import com.archiver.core.error.ArchiveException;

/**
 * Fetches a creator that is not cached yet.
 */
@FunctionalInterface
public interface CreatorLoader {
    Creator load(CreatorKey key) throws ArchiveException;
}
