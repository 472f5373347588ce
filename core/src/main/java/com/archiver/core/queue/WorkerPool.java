package com.archiver.core.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Fixed-width pool that runs a batch of independent jobs and hands back one result per job in
 * submission order. Jobs are expected to turn their own failures into result values; anything
 * that still escapes is logged and mapped through the fallback so the batch stays complete.
 */
public class WorkerPool {
    private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

    public static final int DEFAULT_CONCURRENCY = 5;

    private final int concurrency;
    private final String threadPrefix;

    public WorkerPool(int concurrency, String threadPrefix) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be positive, got " + concurrency);
        }
        this.concurrency = concurrency;
        this.threadPrefix = threadPrefix;
    }

    public int getConcurrency() {
        return concurrency;
    }

    /**
     * Runs {@code job} for every input and blocks until all of them have finished.
     *
     * @param fallback result used for an input whose job threw
     * @throws IllegalStateException if the calling thread is interrupted while waiting
     */
    public <I, O> List<O> runAll(List<I> inputs, Function<I, O> job, Fallback<I, O> fallback) {
        if (inputs.isEmpty()) return new ArrayList<>();

        ExecutorService executor = newExecutor(Math.min(concurrency, inputs.size()));
        try {
            List<Future<O>> futures = new ArrayList<>(inputs.size());
            for (I input : inputs) {
                futures.add(executor.submit(() -> job.apply(input)));
            }

            List<O> results = new ArrayList<>(inputs.size());
            for (int i = 0; i < futures.size(); i++) {
                I input = inputs.get(i);
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    logger.error("Worker crashed on {}", input, e.getCause());
                    results.add(fallback.apply(input, e.getCause()));
                }
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
            throw new IllegalStateException("Interrupted while waiting for workers", e);
        } finally {
            executor.shutdown();
        }
    }

    private ExecutorService newExecutor(int size) {
        AtomicInteger index = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(threadPrefix + "-" + index.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
        return new ThreadPoolExecutor(size, size, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), factory);
    }

    @FunctionalInterface
    public interface Fallback<I, O> {
        O apply(I input, Throwable error);
    }
}
