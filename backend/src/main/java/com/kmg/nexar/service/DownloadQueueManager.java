package com.kmg.nexar.service;

import com.kmg.nexar.config.DownloadProperties;
import com.kmg.nexar.dto.DownloadSummary;
import com.kmg.nexar.dto.DownloadView;
import com.kmg.nexar.exception.DownloadNotFoundException;
import com.kmg.nexar.model.DownloadJob;
import com.kmg.nexar.model.DownloadPriority;
import com.kmg.nexar.model.DownloadStatus;
import com.kmg.nexar.model.ProgressEvent;
import com.kmg.nexar.model.TransferOutcome;
import com.kmg.nexar.repo.DownloadLedgerRepository;
import com.kmg.nexar.repo.SqlTime;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns every download job. All state changes run under one lock and are written to the ledger
 * before the in-memory copy is swapped; readers get an immutable snapshot without locking.
 *
 * <p>Jobs wait in an admission queue ordered by priority, then creation time, then submission
 * sequence, and are promoted whenever a transfer slot frees up. Running transfers are never
 * preempted.
 */
@Service
public class DownloadQueueManager implements TransferListener {
    private static final Logger log = LoggerFactory.getLogger(DownloadQueueManager.class);
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(10);

    private static final Comparator<AdmissionKey> ADMISSION_ORDER = Comparator
            .comparing(AdmissionKey::priority)
            .thenComparing(AdmissionKey::createdAt)
            .thenComparingLong(AdmissionKey::queueSeq);

    private final DownloadLedgerRepository ledger;
    private final SourceResolver sourceResolver;
    private final TransferUnitFactory unitFactory;
    private final DownloadWorkerPool workerPool;
    private final BandwidthAllocator bandwidthAllocator;
    private final ProgressReporter progressReporter;
    private final Path downloadDir;
    private final int maxConcurrency;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, DownloadJob> jobs = new LinkedHashMap<>();
    private final NavigableSet<AdmissionKey> admission = new TreeSet<>(ADMISSION_ORDER);
    private final Map<String, TransferControl> active = new HashMap<>();
    private final AtomicLong queueSeq = new AtomicLong();
    private volatile List<JobEntry> snapshot = List.of();
    private boolean started;
    private boolean shuttingDown;

    public DownloadQueueManager(
            DownloadLedgerRepository ledger,
            SourceResolver sourceResolver,
            TransferUnitFactory unitFactory,
            DownloadWorkerPool workerPool,
            BandwidthAllocator bandwidthAllocator,
            ProgressReporter progressReporter,
            DownloadProperties properties
    ) {
        this.ledger = ledger;
        this.sourceResolver = sourceResolver;
        this.unitFactory = unitFactory;
        this.workerPool = workerPool;
        this.bandwidthAllocator = bandwidthAllocator;
        this.progressReporter = progressReporter;
        this.downloadDir = properties.downloadDirPath();
        this.maxConcurrency = Math.min(properties.getMaxConcurrency(), workerPool.size());
    }

    /**
     * Loads unfinished jobs from the ledger and starts admitting them. Submissions made before
     * this call are queued but not started.
     */
    public void start() {
        lock.lock();
        try {
            if (started) {
                return;
            }
            queueSeq.set(Math.max(queueSeq.get(), ledger.maxQueueSeq()));
            for (DownloadJob stored : ledger.findAll()) {
                if (jobs.containsKey(stored.id())) {
                    continue;
                }
                DownloadJob job = stored;
                if (job.status() == DownloadStatus.DOWNLOADING) {
                    log.warn("Download {} was still marked as downloading; pausing it", job.id());
                    job = persist(job.withStatus(DownloadStatus.PAUSED, SqlTime.now()));
                }
                jobs.put(job.id(), job);
                if (job.status() == DownloadStatus.QUEUED) {
                    admission.add(AdmissionKey.of(job));
                }
            }
            started = true;
            log.info("Download queue started with {} jobs ({} queued), max concurrency {}",
                    jobs.size(), admission.size(), maxConcurrency);
            pump();
            publishSnapshot();
        } finally {
            lock.unlock();
        }
    }

    public String submit(String sourceRef, DownloadPriority priority, String title) {
        URI uri = sourceResolver.parse(sourceRef);
        DownloadPriority effectivePriority = priority == null ? DownloadPriority.NORMAL : priority;
        String effectiveTitle = title == null || title.isBlank() ? defaultTitle(uri, sourceRef) : title.trim();

        lock.lock();
        try {
            if (shuttingDown) {
                throw new IllegalStateException("Download engine is shutting down.");
            }
            OffsetDateTime now = SqlTime.now();
            DownloadJob job = new DownloadJob(
                    UUID.randomUUID().toString(),
                    sourceRef.trim(),
                    effectiveTitle,
                    effectivePriority,
                    DownloadStatus.QUEUED,
                    DownloadJob.UNKNOWN_SIZE,
                    0,
                    null,
                    0,
                    queueSeq.incrementAndGet(),
                    null,
                    now,
                    now,
                    null
            );
            ledger.insert(job);
            jobs.put(job.id(), job);
            admission.add(AdmissionKey.of(job));
            log.info("Queued download {} ({}, {})", job.id(), effectivePriority, job.sourceRef());
            report(job, null);
            pump();
            publishSnapshot();
            return job.id();
        } finally {
            lock.unlock();
        }
    }

    public void pause(String jobId) {
        lock.lock();
        try {
            Optional<DownloadJob> found = lookup(jobId);
            if (found.isEmpty()) {
                return;
            }
            pauseLocked(found.get());
            publishSnapshot();
        } finally {
            lock.unlock();
        }
    }

    public void resume(String jobId) {
        lock.lock();
        try {
            Optional<DownloadJob> found = lookup(jobId);
            if (found.isEmpty()) {
                return;
            }
            resumeLocked(found.get());
            pump();
            publishSnapshot();
        } finally {
            lock.unlock();
        }
    }

    public void cancel(String jobId) {
        lock.lock();
        try {
            Optional<DownloadJob> found = lookup(jobId);
            if (found.isEmpty()) {
                return;
            }
            DownloadJob job = found.get();
            switch (job.status()) {
                case QUEUED, PAUSED, FAILED -> {
                    admission.remove(AdmissionKey.of(job));
                    DownloadJob cancelled = persist(job.withStatus(DownloadStatus.CANCELLED, SqlTime.now()));
                    deletePartFile(jobId);
                    log.info("Cancelled download {}", jobId);
                    report(cancelled, null);
                }
                case DOWNLOADING -> {
                    TransferControl control = active.get(jobId);
                    if (control != null) {
                        control.request(TransferControl.StopRequest.CANCEL);
                        log.info("Cancellation requested for download {}", jobId);
                    }
                }
                default -> {
                    // Already terminal.
                }
            }
            pump();
            publishSnapshot();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Puts a failed job back into the admission queue. It resumes from its last verified offset.
     */
    public void retry(String jobId) {
        lock.lock();
        try {
            Optional<DownloadJob> found = lookup(jobId);
            if (found.isEmpty() || found.get().status() != DownloadStatus.FAILED) {
                return;
            }
            DownloadJob retried = persist(found.get().retried(SqlTime.now()));
            admission.add(AdmissionKey.of(retried));
            log.info("Retrying download {} (attempt {})", jobId, retried.attempt());
            report(retried, null);
            pump();
            publishSnapshot();
        } finally {
            lock.unlock();
        }
    }

    public void pauseAll() {
        lock.lock();
        try {
            for (DownloadJob job : new ArrayList<>(jobs.values())) {
                if (job.status() == DownloadStatus.QUEUED || job.status() == DownloadStatus.DOWNLOADING) {
                    pauseLocked(job);
                }
            }
            publishSnapshot();
        } finally {
            lock.unlock();
        }
    }

    public void resumeAll() {
        lock.lock();
        try {
            for (DownloadJob job : new ArrayList<>(jobs.values())) {
                if (job.status() == DownloadStatus.PAUSED || job.status() == DownloadStatus.DOWNLOADING) {
                    resumeLocked(job);
                }
            }
            pump();
            publishSnapshot();
        } finally {
            lock.unlock();
        }
    }

    public List<DownloadView> list() {
        List<DownloadView> views = new ArrayList<>();
        for (JobEntry entry : snapshot) {
            if (entry.job().status() != DownloadStatus.CANCELLED) {
                views.add(toView(entry.job(), entry.control()));
            }
        }
        return views;
    }

    public DownloadView get(String jobId) {
        for (JobEntry entry : snapshot) {
            if (entry.job().id().equals(jobId)) {
                return toView(entry.job(), entry.control());
            }
        }
        return ledger.findById(jobId)
                .map(job -> toView(job, null))
                .orElseThrow(() -> new DownloadNotFoundException(jobId));
    }

    public DownloadSummary summary() {
        int active = 0;
        int queued = 0;
        int completed = 0;
        int failed = 0;
        for (JobEntry entry : snapshot) {
            switch (entry.job().status()) {
                case DOWNLOADING, PAUSED -> active++;
                case QUEUED -> queued++;
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                default -> {
                }
            }
        }
        return new DownloadSummary(active, queued, completed, failed);
    }

    public void setBandwidthLimit(long bytesPerSecond) {
        if (bytesPerSecond < 0) {
            throw new IllegalArgumentException("bytesPerSecond must not be negative.");
        }
        bandwidthAllocator.setBytesPerSecond(bytesPerSecond);
    }

    public long getBandwidthLimit() {
        return bandwidthAllocator.getBytesPerSecond();
    }

    /**
     * Drops completed and cancelled jobs last updated before {@code cutoff} from the live list.
     * Their ledger records stay.
     */
    public int purgeFinishedBefore(OffsetDateTime cutoff) {
        lock.lock();
        try {
            int before = jobs.size();
            jobs.values().removeIf(job -> job.status().isTerminal()
                    && job.updatedAt() != null
                    && job.updatedAt().isBefore(cutoff));
            int removed = before - jobs.size();
            if (removed > 0) {
                publishSnapshot();
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Asks every running transfer to stop at its next chunk boundary and waits for them. Ledger
     * statuses are left as they are so the next start recovers them.
     */
    @PreDestroy
    public void shutdown() {
        lock.lock();
        try {
            if (shuttingDown) {
                return;
            }
            shuttingDown = true;
            active.values().forEach(control -> control.request(TransferControl.StopRequest.SHUTDOWN));
            log.info("Stopping {} active downloads", active.size());
        } finally {
            lock.unlock();
        }
        workerPool.shutdown(SHUTDOWN_GRACE);
    }

    @Override
    public boolean onStarted(TransferControl control, long startOffset, long totalBytes, String prefixSha256) {
        lock.lock();
        try {
            if (active.get(control.jobId()) != control) {
                return false;
            }
            DownloadJob job = jobs.get(control.jobId());
            if (job.downloadedBytes() != startOffset || job.totalBytes() != totalBytes) {
                if (startOffset < job.downloadedBytes()) {
                    log.warn("Download {} resumes at {} instead of {} after verification",
                            job.id(), startOffset, job.downloadedBytes());
                }
                tryPersist(job.withProgress(startOffset, totalBytes, prefixSha256, SqlTime.now()));
            }
            report(jobs.get(control.jobId()), control);
            publishSnapshot();
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onChunkCommitted(TransferControl control, long downloadedBytes, long totalBytes, String prefixSha256) {
        lock.lock();
        try {
            if (active.get(control.jobId()) != control) {
                return;
            }
            DownloadJob job = jobs.get(control.jobId());
            if (downloadedBytes < job.downloadedBytes()) {
                log.warn("Ignoring out-of-order progress {} < {} for download {}",
                        downloadedBytes, job.downloadedBytes(), job.id());
                return;
            }
            DownloadJob updated = tryPersist(job.withProgress(downloadedBytes, totalBytes, prefixSha256, SqlTime.now()));
            report(updated, control);
            publishSnapshot();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean onFinalizing(TransferControl control, String filePath) {
        lock.lock();
        try {
            if (active.get(control.jobId()) != control) {
                return false;
            }
            persist(jobs.get(control.jobId()).withFilePath(filePath, SqlTime.now()));
            return true;
        } catch (DataAccessException | IllegalStateException e) {
            log.error("Failed to record final path of download {}: {}", control.jobId(), e.getMessage());
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onFinished(TransferControl control, TransferOutcome outcome) {
        lock.lock();
        try {
            String jobId = control.jobId();
            if (!active.remove(jobId, control)) {
                return;
            }
            DownloadJob job = jobs.get(jobId);
            if (job == null) {
                return;
            }
            OffsetDateTime now = SqlTime.now();
            TransferControl.StopRequest request = control.request();
            switch (outcome.kind()) {
                case COMPLETED -> {
                    DownloadJob sized = job.sizeKnown()
                            ? job
                            : job.withProgress(job.downloadedBytes(), job.downloadedBytes(), job.prefixSha256(), now);
                    DownloadJob completed = forcePersist(sized.completed(outcome.filePath(), now));
                    log.info("Download {} completed ({} bytes)", jobId, completed.downloadedBytes());
                    report(completed, null);
                }
                case FAILED -> {
                    if (request == TransferControl.StopRequest.CANCEL) {
                        finishCancelled(job, now);
                    } else {
                        DownloadJob failed = job.failed(outcome.errorText(), now);
                        if (outcome.discardPartial()) {
                            failed = failed.withProgress(0, failed.totalBytes(), null, now);
                        }
                        failed = forcePersist(failed);
                        report(failed, null);
                    }
                }
                case STOPPED -> {
                    switch (request) {
                        case CANCEL -> finishCancelled(job, now);
                        case PAUSE -> {
                            DownloadJob paused = forcePersist(job.withStatus(DownloadStatus.PAUSED, now));
                            log.info("Paused download {} at {} bytes", jobId, paused.downloadedBytes());
                            report(paused, null);
                        }
                        case SHUTDOWN -> log.info("Download {} stopped for shutdown at {} bytes",
                                jobId, job.downloadedBytes());
                        case NONE -> {
                            DownloadJob requeued = forcePersist(job.withStatus(DownloadStatus.QUEUED, now));
                            admission.add(AdmissionKey.of(requeued));
                            report(requeued, null);
                        }
                    }
                }
            }
            pump();
            publishSnapshot();
        } finally {
            lock.unlock();
        }
    }

    private void pauseLocked(DownloadJob job) {
        switch (job.status()) {
            case QUEUED -> {
                admission.remove(AdmissionKey.of(job));
                DownloadJob paused = persist(job.withStatus(DownloadStatus.PAUSED, SqlTime.now()));
                log.info("Paused queued download {}", job.id());
                report(paused, null);
            }
            case DOWNLOADING -> {
                TransferControl control = active.get(job.id());
                if (control != null && control.request() == TransferControl.StopRequest.NONE) {
                    control.request(TransferControl.StopRequest.PAUSE);
                    log.info("Pause requested for download {}", job.id());
                }
            }
            default -> {
                // Nothing to pause.
            }
        }
    }

    private void resumeLocked(DownloadJob job) {
        if (job.status() == DownloadStatus.PAUSED) {
            DownloadJob queued = persist(job.withStatus(DownloadStatus.QUEUED, SqlTime.now()));
            admission.add(AdmissionKey.of(queued));
            log.info("Resumed download {} at {} bytes", job.id(), queued.downloadedBytes());
            report(queued, null);
        } else if (job.status() == DownloadStatus.DOWNLOADING) {
            TransferControl control = active.get(job.id());
            if (control != null) {
                control.clearPause();
            }
        }
    }

    private void finishCancelled(DownloadJob job, OffsetDateTime now) {
        DownloadJob cancelled = forcePersist(job.withStatus(DownloadStatus.CANCELLED, now));
        deletePartFile(job.id());
        log.info("Cancelled download {}", job.id());
        report(cancelled, null);
    }

    private void pump() {
        if (!started || shuttingDown) {
            return;
        }
        while (active.size() < maxConcurrency && !admission.isEmpty()) {
            AdmissionKey key = admission.pollFirst();
            DownloadJob job = jobs.get(key.jobId());
            if (job == null || job.status() != DownloadStatus.QUEUED) {
                continue;
            }
            DownloadJob downloading;
            try {
                downloading = persist(job.withStatus(DownloadStatus.DOWNLOADING, SqlTime.now()));
            } catch (DataAccessException e) {
                log.error("Failed to admit download {}: {}", job.id(), e.getMessage());
                admission.add(key);
                return;
            }
            TransferControl control = new TransferControl(downloading.id());
            active.put(downloading.id(), control);
            try {
                workerPool.dispatch(unitFactory.create(downloading, control, this));
            } catch (RejectedExecutionException e) {
                log.warn("Worker pool rejected download {}: {}", downloading.id(), e.getMessage());
                active.remove(downloading.id());
                DownloadJob requeued = persist(downloading.withStatus(DownloadStatus.QUEUED, SqlTime.now()));
                admission.add(AdmissionKey.of(requeued));
                return;
            }
            log.info("Started download {} ({} active)", downloading.id(), active.size());
            report(downloading, control);
        }
    }

    private Optional<DownloadJob> lookup(String jobId) {
        DownloadJob job = jobs.get(jobId);
        if (job != null) {
            return Optional.of(job);
        }
        if (ledger.findById(jobId).isPresent()) {
            // Purged from memory after completion; nothing left to control.
            return Optional.empty();
        }
        throw new DownloadNotFoundException(jobId);
    }

    private DownloadJob persist(DownloadJob next) {
        ledger.save(next);
        jobs.put(next.id(), next);
        return next;
    }

    private DownloadJob tryPersist(DownloadJob next) {
        try {
            return persist(next);
        } catch (DataAccessException | IllegalStateException e) {
            log.warn("Failed to record progress of download {}: {}", next.id(), e.getMessage());
            return jobs.get(next.id());
        }
    }

    /**
     * Applies a transfer result even when the ledger write fails, so the job never stays marked
     * as running without a transfer. Startup recovery repairs the ledger in that case.
     */
    private DownloadJob forcePersist(DownloadJob next) {
        try {
            ledger.save(next);
        } catch (DataAccessException | IllegalStateException e) {
            log.error("Failed to record {} for download {}: {}", next.status(), next.id(), e.getMessage());
        }
        jobs.put(next.id(), next);
        return next;
    }

    private void deletePartFile(String jobId) {
        try {
            Files.deleteIfExists(TransferUnit.partFileOf(downloadDir, jobId));
        } catch (IOException e) {
            log.warn("Failed to delete partial file of download {}: {}", jobId, e.getMessage());
        }
    }

    private void report(DownloadJob job, TransferControl control) {
        long speed = speedOf(job, control);
        progressReporter.report(new ProgressEvent(
                job.id(),
                job.status(),
                job.downloadedBytes(),
                job.totalBytes(),
                speed,
                etaSeconds(job, speed),
                job.lastError(),
                SqlTime.now()
        ));
    }

    private void publishSnapshot() {
        List<JobEntry> entries = new ArrayList<>(jobs.size());
        for (DownloadJob job : jobs.values()) {
            entries.add(new JobEntry(job, active.get(job.id())));
        }
        snapshot = List.copyOf(entries);
    }

    private DownloadView toView(DownloadJob job, TransferControl control) {
        long speed = speedOf(job, control);
        Double percent = null;
        if (job.sizeKnown() && job.totalBytes() > 0) {
            percent = Math.min(100.0, job.downloadedBytes() * 100.0 / job.totalBytes());
        } else if (job.status() == DownloadStatus.COMPLETED) {
            percent = 100.0;
        }
        return new DownloadView(
                job.id(),
                job.title(),
                job.sourceRef(),
                job.priority(),
                job.status(),
                job.downloadedBytes(),
                job.totalBytes(),
                percent,
                speed,
                etaSeconds(job, speed),
                job.attempt(),
                job.lastError(),
                job.filePath(),
                SqlTime.toText(job.createdAt()),
                SqlTime.toText(job.updatedAt())
        );
    }

    private long speedOf(DownloadJob job, TransferControl control) {
        if (control == null || job.status() != DownloadStatus.DOWNLOADING) {
            return 0;
        }
        return control.speedMeter().bytesPerSecond();
    }

    private Long etaSeconds(DownloadJob job, long speed) {
        if (job.status() != DownloadStatus.DOWNLOADING || !job.sizeKnown() || speed <= 0) {
            return null;
        }
        long remaining = Math.max(0, job.totalBytes() - job.downloadedBytes());
        return (remaining + speed - 1) / speed;
    }

    private String defaultTitle(URI uri, String sourceRef) {
        String path = uri.getPath();
        if (path != null) {
            String name = path.substring(path.lastIndexOf('/') + 1);
            if (!name.isBlank()) {
                return name;
            }
        }
        return sourceRef.trim();
    }

    private record AdmissionKey(String jobId, DownloadPriority priority, OffsetDateTime createdAt, long queueSeq) {
        static AdmissionKey of(DownloadJob job) {
            return new AdmissionKey(job.id(), job.priority(), job.createdAt(), job.queueSeq());
        }
    }

    private record JobEntry(DownloadJob job, TransferControl control) {
    }
}
