package com.kmg.nexar.service;

import com.kmg.nexar.model.DownloadPriority;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BandwidthAllocatorTest {
    private static final Duration POLL = Duration.ofMillis(10);

    @Test
    void unlimitedRateGrantsImmediately() throws Exception {
        BandwidthAllocator allocator = new BandwidthAllocator(0, 1024, FairnessPolicy.WEIGHTED, POLL);

        long started = System.nanoTime();
        for (int i = 0; i < 100; i++) {
            assertTrue(allocator.acquire("job", DownloadPriority.LOW, 1_000_000, () -> false));
        }

        assertTrue(System.nanoTime() - started < TimeUnit.SECONDS.toNanos(1));
    }

    @Test
    void throttlesToConfiguredRate() throws Exception {
        BandwidthAllocator allocator = new BandwidthAllocator(10_000, 1_000, FairnessPolicy.WEIGHTED, POLL);

        long started = System.nanoTime();
        for (int i = 0; i < 5; i++) {
            assertTrue(allocator.acquire("job", DownloadPriority.NORMAL, 1_000, () -> false));
        }
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        // The first 1000 bytes come from the initial burst, the other 4000 need 400 ms at 10 kB/s.
        assertTrue(elapsedMillis >= 350, "elapsed " + elapsedMillis + " ms");
    }

    @Test
    void servesHighPriorityWaiterBeforeEarlierLowPriorityWaiter() throws Exception {
        BandwidthAllocator allocator = new BandwidthAllocator(1_000, 100, FairnessPolicy.WEIGHTED, POLL);
        assertTrue(allocator.acquire("warmup", DownloadPriority.NORMAL, 100, () -> false));
        allocator.release("warmup");

        List<String> grants = new CopyOnWriteArrayList<>();
        Thread low = new Thread(() -> acquireAndRecord(allocator, "low", DownloadPriority.LOW, grants));
        Thread high = new Thread(() -> acquireAndRecord(allocator, "high", DownloadPriority.HIGH, grants));
        low.start();
        awaitWaiting(allocator, 1);
        high.start();
        awaitWaiting(allocator, 2);
        low.join(5_000);
        high.join(5_000);

        assertEquals(List.of("high", "low"), grants);
    }

    @Test
    void lowPriorityKeepsProportionalShare() throws Exception {
        BandwidthAllocator allocator = new BandwidthAllocator(40_000, 500, FairnessPolicy.WEIGHTED, POLL);
        AtomicLong highBytes = new AtomicLong();
        AtomicLong lowBytes = new AtomicLong();
        AtomicBoolean stop = new AtomicBoolean();
        CountDownLatch ready = new CountDownLatch(2);

        Thread high = new Thread(() -> pump(allocator, "high", DownloadPriority.HIGH, highBytes, stop, ready));
        Thread low = new Thread(() -> pump(allocator, "low", DownloadPriority.LOW, lowBytes, stop, ready));
        high.start();
        low.start();
        Thread.sleep(1_000);
        stop.set(true);
        high.join(5_000);
        low.join(5_000);

        assertTrue(lowBytes.get() > 0, "low priority job was starved");
        assertTrue(highBytes.get() >= 2 * lowBytes.get(),
                "high " + highBytes.get() + " vs low " + lowBytes.get());
    }

    @Test
    void roundRobinIgnoresPriority() {
        assertEquals(1, FairnessPolicy.ROUND_ROBIN.weightOf(DownloadPriority.HIGH));
        assertEquals(4, FairnessPolicy.WEIGHTED.weightOf(DownloadPriority.HIGH));
        assertEquals(1, FairnessPolicy.WEIGHTED.weightOf(DownloadPriority.LOW));
    }

    @Test
    void stopRequestAbandonsWait() throws Exception {
        BandwidthAllocator allocator = new BandwidthAllocator(1, 10, FairnessPolicy.WEIGHTED, POLL);
        assertTrue(allocator.acquire("job", DownloadPriority.NORMAL, 10, () -> false));

        AtomicBoolean stop = new AtomicBoolean();
        AtomicReference<Boolean> result = new AtomicReference<>();
        Thread waiter = new Thread(() -> {
            try {
                result.set(allocator.acquire("job", DownloadPriority.NORMAL, 10, stop::get));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        waiter.start();
        awaitWaiting(allocator, 1);
        stop.set(true);
        waiter.join(2_000);

        assertFalse(waiter.isAlive());
        assertEquals(Boolean.FALSE, result.get());
        assertEquals(0, allocator.waitingCount());
    }

    @Test
    void liftingTheLimitReleasesWaiters() throws Exception {
        BandwidthAllocator allocator = new BandwidthAllocator(1, 10, FairnessPolicy.WEIGHTED, POLL);
        assertTrue(allocator.acquire("job", DownloadPriority.NORMAL, 10, () -> false));

        AtomicReference<Boolean> result = new AtomicReference<>();
        Thread waiter = new Thread(() -> {
            try {
                result.set(allocator.acquire("job", DownloadPriority.NORMAL, 10, () -> false));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        waiter.start();
        awaitWaiting(allocator, 1);
        allocator.setBytesPerSecond(0);
        waiter.join(2_000);

        assertEquals(Boolean.TRUE, result.get());
        assertEquals(0, allocator.getBytesPerSecond());
    }

    private static void acquireAndRecord(BandwidthAllocator allocator, String jobId, DownloadPriority priority,
                                         List<String> grants) {
        try {
            if (allocator.acquire(jobId, priority, 100, () -> false)) {
                grants.add(jobId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void pump(BandwidthAllocator allocator, String jobId, DownloadPriority priority, AtomicLong bytes,
                             AtomicBoolean stop, CountDownLatch ready) {
        ready.countDown();
        try {
            ready.await();
            while (!stop.get()) {
                if (allocator.acquire(jobId, priority, 500, stop::get)) {
                    bytes.addAndGet(500);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void awaitWaiting(BandwidthAllocator allocator, int count) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (allocator.waitingCount() < count && System.nanoTime() < deadline) {
            Thread.sleep(1);
        }
        assertEquals(count, allocator.waitingCount());
    }
}
