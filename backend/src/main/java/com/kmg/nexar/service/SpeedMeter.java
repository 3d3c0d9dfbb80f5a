package com.kmg.nexar.service;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Exponentially weighted transfer rate of one job.
 */
public class SpeedMeter {
    private static final double ALPHA = 0.3;

    private final LongSupplier nanoClock;
    private long lastSampleNanos;
    private double bytesPerSecond;
    private boolean started;

    public SpeedMeter() {
        this(System::nanoTime);
    }

    SpeedMeter(LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
    }

    public synchronized void start() {
        lastSampleNanos = nanoClock.getAsLong();
        bytesPerSecond = 0;
        started = true;
    }

    public synchronized void record(long bytes) {
        long now = nanoClock.getAsLong();
        if (!started) {
            lastSampleNanos = now;
            started = true;
            return;
        }
        long elapsed = Math.max(1, now - lastSampleNanos);
        lastSampleNanos = now;
        double sample = bytes * (double) TimeUnit.SECONDS.toNanos(1) / elapsed;
        bytesPerSecond = bytesPerSecond == 0 ? sample : ALPHA * sample + (1 - ALPHA) * bytesPerSecond;
    }

    public synchronized long bytesPerSecond() {
        return Math.round(bytesPerSecond);
    }
}
