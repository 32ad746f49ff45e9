package com.entity.linker.parallel;

import com.entity.linker.core.exception.LinkerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Fixed-size pool for the embarrassingly parallel stages (blocking, extraction, scoring).
 *
 * <p>{@link #map} splits the input into contiguous chunks, runs them concurrently and
 * reassembles the results in input order, so callers get a deterministic result no matter
 * in which order chunks complete. A pool of parallelism 1 runs everything on the calling thread.</p>
 */
public class WorkerPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private static final int CHUNKS_PER_WORKER = 4;

    private final int parallelism;
    private final ExecutorService executor;

    public WorkerPool(int parallelism) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be > 0");
        }
        this.parallelism = parallelism;
        this.executor = parallelism == 1 ? null : Executors.newFixedThreadPool(parallelism, new WorkerThreadFactory());
        log.debug("worker.pool.created parallelism={}", parallelism);
    }

    public static WorkerPool sequential() {
        return new WorkerPool(1);
    }

    public int getParallelism() {
        return parallelism;
    }

    /**
     * Applies {@code fn} to every item and returns the results in input order.
     * The first exception thrown by {@code fn} is rethrown once all chunks have finished.
     */
    public <T, R> List<R> map(List<T> items, Function<? super T, ? extends R> fn) {
        if (executor == null || items.size() < 2) {
            List<R> results = new ArrayList<>(items.size());
            for (T item : items) {
                results.add(fn.apply(item));
            }
            return results;
        }

        int chunkSize = Math.max(1, (int) Math.ceil((double) items.size() / (parallelism * CHUNKS_PER_WORKER)));
        List<CompletableFuture<List<R>>> futures = new ArrayList<>();
        for (int from = 0; from < items.size(); from += chunkSize) {
            List<T> chunk = items.subList(from, Math.min(items.size(), from + chunkSize));
            futures.add(CompletableFuture.supplyAsync(() -> {
                List<R> out = new ArrayList<>(chunk.size());
                for (T item : chunk) {
                    out.add(fn.apply(item));
                }
                return out;
            }, executor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            throw unwrap(e);
        }
        List<R> results = new ArrayList<>(items.size());
        for (CompletableFuture<List<R>> future : futures) {
            results.addAll(future.join());
        }
        return results;
    }

    private static RuntimeException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException re) {
            return re;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new LinkerException("Worker task failed", cause);
    }

    @Override
    public void close() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

        private final int poolId = POOL_COUNTER.incrementAndGet();
        private final AtomicInteger threadCounter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "linker-" + poolId + "-worker-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
