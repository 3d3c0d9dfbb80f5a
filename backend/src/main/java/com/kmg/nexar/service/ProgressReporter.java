package com.kmg.nexar.service;

import com.kmg.nexar.model.DownloadStatus;
import com.kmg.nexar.model.ProgressEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Thins the per-chunk event stream down to what observers need and hands it to listeners on a
 * single dispatcher thread.
 *
 * <p>An event passes when its status differs from the last emitted one, when the status is final,
 * when {@code minInterval} has elapsed since the last emission for the job, or when the percentage
 * moved by at least {@code minPercentDelta}.
 */
public class ProgressReporter {
    private static final Logger log = LoggerFactory.getLogger(ProgressReporter.class);

    private final Duration minInterval;
    private final double minPercentDelta;
    private final Clock clock;
    private final Executor dispatcher;
    private final ExecutorService ownedDispatcher;
    private final List<ProgressListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, Emission> lastEmissions = new HashMap<>();

    public ProgressReporter(Duration minInterval, double minPercentDelta, List<ProgressListener> listeners) {
        this(minInterval, minPercentDelta, Clock.systemUTC(), Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "progress-dispatcher");
            thread.setDaemon(true);
            return thread;
        }), listeners);
    }

    ProgressReporter(Duration minInterval, double minPercentDelta, Clock clock, Executor dispatcher,
                     List<ProgressListener> listeners) {
        this.minInterval = minInterval;
        this.minPercentDelta = minPercentDelta;
        this.clock = clock;
        this.dispatcher = dispatcher;
        this.ownedDispatcher = dispatcher instanceof ExecutorService service ? service : null;
        this.listeners.addAll(listeners);
    }

    /**
     * Offers one internal event. Callers must offer the events of a job in order.
     *
     * @return whether the event was forwarded to listeners
     */
    public boolean report(ProgressEvent event) {
        long now = clock.millis();
        synchronized (lastEmissions) {
            Emission last = lastEmissions.get(event.jobId());
            if (!shouldEmit(last, event, now)) {
                return false;
            }
            if (event.status().isFinal()) {
                lastEmissions.remove(event.jobId());
            } else {
                lastEmissions.put(event.jobId(), new Emission(event.status(), event.percent(), now));
            }
        }
        try {
            dispatcher.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            log.debug("Dropping progress event for {} after shutdown", event.jobId());
            return false;
        }
        return true;
    }

    public void shutdown() {
        if (ownedDispatcher == null) {
            return;
        }
        ownedDispatcher.shutdown();
        try {
            ownedDispatcher.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private boolean shouldEmit(Emission last, ProgressEvent event, long now) {
        if (last == null || last.status() != event.status() || event.status().isFinal()) {
            return true;
        }
        if (now - last.emittedAtMillis() >= minInterval.toMillis()) {
            return true;
        }
        Double percent = event.percent();
        return percent != null && last.percent() != null
                && Math.abs(percent - last.percent()) >= minPercentDelta;
    }

    private void deliver(ProgressEvent event) {
        for (ProgressListener listener : listeners) {
            try {
                listener.onProgress(event);
            } catch (RuntimeException e) {
                log.warn("Progress listener {} failed for {}: {}",
                        listener.getClass().getSimpleName(), event.jobId(), e.getMessage());
            }
        }
    }

    private record Emission(DownloadStatus status, Double percent, long emittedAtMillis) {
    }
}
