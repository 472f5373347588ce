package com.archiver.core.cache;

import com.archiver.common.model.Creator;
import com.archiver.core.error.ArchiveException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Process-wide memo of creators keyed by (service, creator id).
 *
 * <p>Each key maps to a future. The first caller that misses installs the future and runs the
 * loader on its own thread; concurrent callers for the same key wait on that future instead of
 * loading again. Different keys never wait on each other. Completed entries are returned without
 * blocking. A failed load is removed again so a later lookup can retry it, and every caller that
 * was waiting on it receives the same failure.</p>
 */
public class CreatorCache {
    private static final Logger logger = LoggerFactory.getLogger(CreatorCache.class);

    private final Map<CreatorKey, CompletableFuture<Creator>> entries = new ConcurrentHashMap<>();
    private final CreatorLoader loader;

    public CreatorCache(CreatorLoader loader) {
        this.loader = loader;
    }

    public Creator resolve(String service, String creatorId) throws ArchiveException {
        CreatorKey key = new CreatorKey(service, creatorId);

        CompletableFuture<Creator> existing = entries.get(key);
        if (existing == null) {
            CompletableFuture<Creator> mine = new CompletableFuture<>();
            existing = entries.putIfAbsent(key, mine);
            if (existing == null) {
                return load(key, mine);
            }
        }
        return await(key, existing);
    }

    public boolean contains(String service, String creatorId) {
        CompletableFuture<Creator> f = entries.get(new CreatorKey(service, creatorId));
        return f != null && f.isDone() && !f.isCompletedExceptionally();
    }

    public int size() {
        return entries.size();
    }

    private Creator load(CreatorKey key, CompletableFuture<Creator> mine) throws ArchiveException {
        logger.debug("Creator cache miss: {}", key);
        try {
            Creator creator = loader.load(key);
            mine.complete(creator);
            logger.info("👤 Creator resolved: {} ({})", creator.name(), key);
            return creator;
        } catch (ArchiveException | RuntimeException e) {
            fail(key, mine, e);
            throw e;
        } catch (Error e) {
            fail(key, mine, e);
            throw e;
        }
    }

    // Waiters must never be left on a future that nobody completes
    private void fail(CreatorKey key, CompletableFuture<Creator> mine, Throwable error) {
        entries.remove(key, mine);
        mine.completeExceptionally(error);
    }

    private Creator await(CreatorKey key, CompletableFuture<Creator> pending) throws ArchiveException {
        if (!pending.isDone()) {
            logger.debug("Waiting for in-flight creator lookup: {}", key);
        }
        try {
            return pending.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ArchiveException("Interrupted while waiting for creator " + key, e);
        } catch (CancellationException e) {
            throw new ArchiveException("Creator lookup cancelled: " + key, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ArchiveException) throw (ArchiveException) cause;
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            throw new ArchiveException("Creator lookup failed: " + key, cause);
        }
    }
}
