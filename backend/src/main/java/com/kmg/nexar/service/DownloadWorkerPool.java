package com.kmg.nexar.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of transfer threads. The queue manager never leases more slots than there are
 * threads, so a dispatched unit starts right away.
 */
public class DownloadWorkerPool {
    private static final Logger log = LoggerFactory.getLogger(DownloadWorkerPool.class);

    private static final Duration DEFAULT_GRACE = Duration.ofSeconds(10);

    private final int size;
    private final ExecutorService executor;

    public DownloadWorkerPool(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Worker pool size must be at least 1");
        }
        this.size = size;
        this.executor = Executors.newFixedThreadPool(size, new WorkerThreadFactory());
    }

    public int size() {
        return size;
    }

    public void dispatch(Runnable unit) {
        executor.execute(unit);
    }

    public void shutdown() {
        shutdown(DEFAULT_GRACE);
    }

    /**
     * Stops accepting units and waits for running ones to reach a chunk boundary. Units still
     * running after {@code grace} are interrupted.
     */
    public void shutdown(Duration grace) {
        if (executor.isShutdown()) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Transfers still running after {} ms; interrupting", grace.toMillis());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "download-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
