package com.kmg.nexar.service;

import com.kmg.nexar.model.DownloadPriority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.function.LongSupplier;

/**
 * Token bucket shared by every active transfer.
 *
 * <p>Waiting requests are ordered by weighted fair queueing: a request for {@code n} bytes gets the
 * virtual finish tag {@code max(virtualClock, lastFinish[job]) + n / weight}, and the smallest tag
 * is served first. A high-priority job therefore overtakes the waiting queue, while a low-priority
 * job that keeps asking still receives its proportional share of the rate.
 */
public class BandwidthAllocator {
    private static final Logger log = LoggerFactory.getLogger(BandwidthAllocator.class);

    private static final Comparator<Waiter> ORDER = Comparator
            .comparingDouble(Waiter::finishTag)
            .thenComparing(Waiter::priority)
            .thenComparingLong(Waiter::arrival);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final PriorityQueue<Waiter> waiters = new PriorityQueue<>(ORDER);
    private final Map<String, Double> lastFinish = new HashMap<>();
    private final FairnessPolicy fairness;
    private final long pollNanos;
    private final LongSupplier nanoClock;

    private long bytesPerSecond;
    private final long burstBytes;
    private double tokens;
    private long lastRefillNanos;
    private double virtualClock;
    private long arrivals;

    public BandwidthAllocator(long bytesPerSecond, long burstBytes, FairnessPolicy fairness, Duration pollInterval) {
        this(bytesPerSecond, burstBytes, fairness, pollInterval, System::nanoTime);
    }

    BandwidthAllocator(long bytesPerSecond, long burstBytes, FairnessPolicy fairness, Duration pollInterval,
                       LongSupplier nanoClock) {
        if (burstBytes <= 0) {
            throw new IllegalArgumentException("burstBytes must be positive");
        }
        this.bytesPerSecond = Math.max(0, bytesPerSecond);
        this.burstBytes = burstBytes;
        this.fairness = fairness;
        this.pollNanos = Math.max(1, pollInterval.toNanos());
        this.nanoClock = nanoClock;
        this.tokens = burstBytes;
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    /**
     * Blocks until {@code bytes} may be transferred for the job or until {@code stopRequested}
     * reports true. The stop signal is polled at least once per poll interval.
     *
     * @return {@code true} when granted, {@code false} when the wait was abandoned for a stop
     */
    public boolean acquire(String jobId, DownloadPriority priority, long bytes, BooleanSupplier stopRequested)
            throws InterruptedException {
        lock.lockInterruptibly();
        try {
            if (bytesPerSecond <= 0) {
                return !stopRequested.getAsBoolean();
            }
            double previousFinish = lastFinish.getOrDefault(jobId, 0.0);
            double start = Math.max(virtualClock, previousFinish);
            Waiter waiter = new Waiter(jobId, start, start + (double) bytes / fairness.weightOf(priority),
                    priority, arrivals++);
            lastFinish.put(jobId, waiter.finishTag());
            waiters.add(waiter);

            boolean granted = false;
            try {
                while (true) {
                    if (stopRequested.getAsBoolean()) {
                        return false;
                    }
                    if (bytesPerSecond <= 0) {
                        granted = true;
                        return true;
                    }
                    refill();
                    long needed = Math.min(bytes, burstBytes);
                    boolean atHead = waiters.peek() == waiter;
                    if (atHead && tokens >= needed) {
                        tokens -= bytes;
                        virtualClock = Math.max(virtualClock, waiter.startTag());
                        granted = true;
                        return true;
                    }
                    long waitNanos = pollNanos;
                    if (atHead) {
                        long untilReady = (long) Math.ceil((needed - tokens) * TimeUnit.SECONDS.toNanos(1) / bytesPerSecond);
                        waitNanos = Math.max(1, Math.min(pollNanos, untilReady));
                    }
                    changed.awaitNanos(waitNanos);
                }
            } finally {
                waiters.remove(waiter);
                Double currentFinish = lastFinish.get(jobId);
                if (!granted && currentFinish != null && currentFinish == waiter.finishTag()) {
                    lastFinish.put(jobId, previousFinish);
                }
                changed.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forgets the fairness history of a job whose transfer has ended.
     */
    public void release(String jobId) {
        lock.lock();
        try {
            lastFinish.remove(jobId);
        } finally {
            lock.unlock();
        }
    }

    public void setBytesPerSecond(long newRate) {
        lock.lock();
        try {
            refill();
            long previous = bytesPerSecond;
            bytesPerSecond = Math.max(0, newRate);
            if (previous <= 0 && bytesPerSecond > 0) {
                tokens = burstBytes;
                lastRefillNanos = nanoClock.getAsLong();
            }
            log.info("Bandwidth limit changed from {} to {} bytes/s", previous, bytesPerSecond);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public long getBytesPerSecond() {
        lock.lock();
        try {
            return bytesPerSecond;
        } finally {
            lock.unlock();
        }
    }

    int waitingCount() {
        lock.lock();
        try {
            return waiters.size();
        } finally {
            lock.unlock();
        }
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0) {
            return;
        }
        lastRefillNanos = now;
        if (bytesPerSecond > 0) {
            tokens = Math.min(burstBytes, tokens + elapsed * (double) bytesPerSecond / TimeUnit.SECONDS.toNanos(1));
        }
    }

    private record Waiter(String jobId, double startTag, double finishTag, DownloadPriority priority, long arrival) {
    }
}
