package com.kmg.nexar.service;

import com.kmg.nexar.dto.DownloadSummary;
import com.kmg.nexar.dto.DownloadView;
import com.kmg.nexar.exception.DownloadNotFoundException;
import com.kmg.nexar.exception.InvalidSourceRefException;
import com.kmg.nexar.model.DownloadJob;
import com.kmg.nexar.model.DownloadPriority;
import com.kmg.nexar.model.DownloadStatus;
import com.kmg.nexar.model.ProgressEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DownloadQueueManagerTest {

    @TempDir
    Path tempDir;

    private EngineHarness engine;

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.close();
        }
    }

    @Test
    void admitsHigherPriorityFirstWithSingleSlot() throws Exception {
        engine = new EngineHarness(tempDir, 1, 1024);
        engine.source.put("a.bin", MemoryContentSource.sampleBytes(3000));
        engine.source.put("b.bin", MemoryContentSource.sampleBytes(3000));
        engine.source.put("c.bin", MemoryContentSource.sampleBytes(3000));

        String low = engine.queueManager.submit(MemoryContentSource.ref("a.bin"), DownloadPriority.LOW, null);
        String normal = engine.queueManager.submit(MemoryContentSource.ref("b.bin"), DownloadPriority.NORMAL, null);
        String high = engine.queueManager.submit(MemoryContentSource.ref("c.bin"), DownloadPriority.HIGH, null);
        engine.queueManager.start();

        engine.awaitStatus(low, DownloadStatus.COMPLETED);
        engine.awaitStatus(normal, DownloadStatus.COMPLETED);
        engine.awaitStatus(high, DownloadStatus.COMPLETED);

        assertEquals(List.of(high, normal, low), engine.progress.admissionOrder());
        assertEquals(1, engine.progress.maxDownloading());
    }

    @Test
    void retriesTransientFailureInsideChunkAndCompletes() throws Exception {
        engine = new EngineHarness(tempDir, 1, 100);
        byte[] content = MemoryContentSource.sampleBytes(1000);
        engine.source.put("doc.pdf", content);
        engine.source.failAt("doc.pdf", 400, 2);
        engine.queueManager.start();

        String jobId = engine.queueManager.submit(MemoryContentSource.ref("doc.pdf"), DownloadPriority.NORMAL, "Doc");
        DownloadView done = engine.awaitStatus(jobId, DownloadStatus.COMPLETED);

        assertEquals(1000, done.downloadedBytes());
        assertEquals(1000, done.totalBytes());
        assertEquals(0, done.attempt());
        assertNull(done.lastError());
        assertEquals(3, engine.source.readOffsets("doc.pdf").stream().filter(offset -> offset == 400L).count());
        assertArrayEquals(content, Files.readAllBytes(Path.of(done.filePath())));
        assertEquals("doc.pdf", Path.of(done.filePath()).getFileName().toString());
        assertFalse(Files.exists(engine.partFile(jobId)));
        assertMonotonic(engine.progress.eventsFor(jobId));
    }

    @Test
    void pauseAllLeavesNothingDownloading() throws Exception {
        engine = new EngineHarness(tempDir, 2, 100);
        engine.source.setReadDelayMillis(10);
        for (String name : List.of("one", "two", "three")) {
            engine.source.put(name, MemoryContentSource.sampleBytes(20_000));
        }
        engine.queueManager.start();
        String one = engine.queueManager.submit(MemoryContentSource.ref("one"), DownloadPriority.NORMAL, null);
        String two = engine.queueManager.submit(MemoryContentSource.ref("two"), DownloadPriority.NORMAL, null);
        String three = engine.queueManager.submit(MemoryContentSource.ref("three"), DownloadPriority.NORMAL, null);
        engine.await(one, view -> view.downloadedBytes() > 0, "first bytes");

        engine.queueManager.pauseAll();

        for (String jobId : List.of(one, two, three)) {
            engine.awaitStatus(jobId, DownloadStatus.PAUSED);
        }
        assertTrue(engine.queueManager.list().stream().noneMatch(view -> view.status() == DownloadStatus.DOWNLOADING));
        DownloadSummary summary = engine.queueManager.summary();
        assertEquals(3, summary.active());
        assertEquals(0, summary.queued());

        engine.queueManager.resumeAll();
        for (String jobId : List.of(one, two, three)) {
            engine.awaitStatus(jobId, DownloadStatus.COMPLETED);
        }
        assertEquals(2, engine.progress.maxDownloading());
    }

    @Test
    void pauseThenResumeContinuesFromCommittedOffset() throws Exception {
        engine = new EngineHarness(tempDir, 1, 100);
        byte[] content = MemoryContentSource.sampleBytes(10_000);
        engine.source.put("video.mp4", content);
        engine.source.setReadDelayMillis(5);
        engine.queueManager.start();
        String jobId = engine.queueManager.submit(MemoryContentSource.ref("video.mp4"), DownloadPriority.HIGH, null);
        engine.await(jobId, view -> view.downloadedBytes() >= 1000, "1000 bytes");

        engine.queueManager.pause(jobId);
        DownloadView paused = engine.awaitStatus(jobId, DownloadStatus.PAUSED);
        long committed = paused.downloadedBytes();
        assertTrue(committed >= 1000);
        assertEquals(committed, Files.size(engine.partFile(jobId)));
        assertEquals(committed, engine.ledger.findById(jobId).orElseThrow().downloadedBytes());

        engine.queueManager.resume(jobId);
        DownloadView done = engine.awaitStatus(jobId, DownloadStatus.COMPLETED);

        assertArrayEquals(content, Files.readAllBytes(Path.of(done.filePath())));
        assertMonotonic(engine.progress.eventsFor(jobId));
        long reReads = engine.source.readOffsets("video.mp4").stream().filter(offset -> offset < committed).count();
        assertEquals(committed / 100, reReads);
    }

    @Test
    void cancelRemovesPartialFileAndHidesJobFromList() throws Exception {
        engine = new EngineHarness(tempDir, 1, 100);
        engine.source.put("big.iso", MemoryContentSource.sampleBytes(50_000));
        engine.source.setReadDelayMillis(5);
        engine.queueManager.start();
        String jobId = engine.queueManager.submit(MemoryContentSource.ref("big.iso"), DownloadPriority.NORMAL, null);
        engine.await(jobId, view -> view.downloadedBytes() >= 500, "500 bytes");

        engine.queueManager.cancel(jobId);
        engine.awaitStatus(jobId, DownloadStatus.CANCELLED);

        assertFalse(Files.exists(engine.partFile(jobId)));
        assertTrue(engine.queueManager.list().stream().noneMatch(view -> view.id().equals(jobId)));
        assertEquals(DownloadStatus.CANCELLED, engine.ledger.findById(jobId).orElseThrow().status());

        engine.queueManager.cancel(jobId);
        assertEquals(DownloadStatus.CANCELLED, engine.queueManager.get(jobId).status());
    }

    @Test
    void pauseIsIdempotent() throws Exception {
        engine = new EngineHarness(tempDir, 1, 1024);
        engine.source.put("notes.txt", MemoryContentSource.sampleBytes(2048));
        String jobId = engine.queueManager.submit(MemoryContentSource.ref("notes.txt"), DownloadPriority.LOW, null);

        engine.queueManager.pause(jobId);
        DownloadJob first = engine.ledger.findById(jobId).orElseThrow();
        engine.queueManager.pause(jobId);
        DownloadJob second = engine.ledger.findById(jobId).orElseThrow();

        assertEquals(DownloadStatus.PAUSED, first.status());
        assertEquals(first, second);

        engine.queueManager.start();
        assertEquals(DownloadStatus.PAUSED, engine.queueManager.get(jobId).status());
        engine.queueManager.resume(jobId);
        engine.awaitStatus(jobId, DownloadStatus.COMPLETED);
        engine.queueManager.pause(jobId);
        assertEquals(DownloadStatus.COMPLETED, engine.queueManager.get(jobId).status());
    }

    @Test
    void neverRunsMoreThanMaxConcurrency() throws Exception {
        engine = new EngineHarness(tempDir, 2, 256);
        engine.source.setReadDelayMillis(2);
        engine.queueManager.start();
        String[] ids = new String[6];
        for (int i = 0; i < ids.length; i++) {
            engine.source.put("file-" + i, MemoryContentSource.sampleBytes(4096));
            ids[i] = engine.queueManager.submit(MemoryContentSource.ref("file-" + i), DownloadPriority.NORMAL, null);
        }

        for (String jobId : ids) {
            engine.awaitStatus(jobId, DownloadStatus.COMPLETED);
        }

        assertEquals(2, engine.progress.maxDownloading());
        assertEquals(6, engine.queueManager.summary().completed());
    }

    @Test
    void wholeFileChecksumMismatchFailsAndResetsProgress() throws Exception {
        engine = new EngineHarness(tempDir, 1, 256);
        engine.source.putWithSha("tampered.bin", MemoryContentSource.sampleBytes(1000), "00".repeat(32));
        engine.queueManager.start();

        String jobId = engine.queueManager.submit(MemoryContentSource.ref("tampered.bin"), DownloadPriority.NORMAL, null);
        DownloadView failed = engine.awaitStatus(jobId, DownloadStatus.FAILED);

        assertTrue(failed.lastError().startsWith("CHECKSUM_MISMATCH"));
        assertEquals(0, failed.downloadedBytes());
        assertFalse(Files.exists(engine.partFile(jobId)));
        assertEquals(1, engine.queueManager.summary().failed());
        assertTrue(engine.queueManager.list().stream().anyMatch(view -> view.id().equals(jobId)));

        engine.queueManager.resume(jobId);
        assertEquals(DownloadStatus.FAILED, engine.queueManager.get(jobId).status());

        engine.queueManager.retry(jobId);
        DownloadView failedAgain = engine.await(jobId,
                view -> view.status() == DownloadStatus.FAILED && view.attempt() == 1, "second failure");
        assertTrue(failedAgain.lastError().startsWith("CHECKSUM_MISMATCH"));
    }

    @Test
    void exhaustedRetriesFailWithTransferError() throws Exception {
        engine = new EngineHarness(tempDir, 1, 100);
        engine.source.put("flaky.bin", MemoryContentSource.sampleBytes(500));
        engine.source.failAt("flaky.bin", 200, 100);
        engine.queueManager.start();

        String jobId = engine.queueManager.submit(MemoryContentSource.ref("flaky.bin"), DownloadPriority.NORMAL, null);
        DownloadView failed = engine.awaitStatus(jobId, DownloadStatus.FAILED);

        assertTrue(failed.lastError().startsWith("TRANSFER_ERROR"));
        assertEquals(200, failed.downloadedBytes());
        assertEquals(200, Files.size(engine.partFile(jobId)));
        List<ProgressEvent> events = engine.progress.eventsFor(jobId);
        assertEquals(DownloadStatus.FAILED, events.get(events.size() - 1).status());
    }

    @Test
    void missingFileSourceFailsWithoutRetry() throws Exception {
        engine = new EngineHarness(tempDir, 1, 1024);
        engine.queueManager.start();
        String ref = tempDir.resolve("absent.bin").toUri().toString();

        String jobId = engine.queueManager.submit(ref, null, null);
        DownloadView failed = engine.awaitStatus(jobId, DownloadStatus.FAILED);

        assertTrue(failed.lastError().startsWith("SOURCE_UNAVAILABLE"));
        assertEquals(DownloadPriority.NORMAL, failed.priority());
        assertEquals("absent.bin", failed.title());
    }

    @Test
    void rejectsMalformedSourceRefs() {
        engine = new EngineHarness(tempDir, 1, 1024);

        assertThrows(InvalidSourceRefException.class, () -> engine.queueManager.submit("not a uri", null, null));
        assertThrows(InvalidSourceRefException.class, () -> engine.queueManager.submit("relative/path", null, null));
        assertThrows(InvalidSourceRefException.class, () -> engine.queueManager.submit("ftp://host/file", null, null));
        assertThrows(InvalidSourceRefException.class, () -> engine.queueManager.submit(" ", null, null));
        assertThrows(InvalidSourceRefException.class,
                () -> engine.queueManager.submit("file://fileserver/share/game.bin", null, null));
        assertThrows(InvalidSourceRefException.class,
                () -> engine.queueManager.submit(tempDir.resolve("game.bin").toUri() + "?v=1", null, null));
        assertTrue(engine.ledger.findAll().isEmpty());
    }

    @Test
    void unknownJobIdsAreReported() {
        engine = new EngineHarness(tempDir, 1, 1024);

        assertThrows(DownloadNotFoundException.class, () -> engine.queueManager.pause("missing"));
        assertThrows(DownloadNotFoundException.class, () -> engine.queueManager.resume("missing"));
        assertThrows(DownloadNotFoundException.class, () -> engine.queueManager.cancel("missing"));
        assertThrows(DownloadNotFoundException.class, () -> engine.queueManager.get("missing"));
    }

    @Test
    void pauseOfDownloadingJobCanBeWithdrawnByResume() throws Exception {
        engine = new EngineHarness(tempDir, 1, 100);
        engine.source.put("slow.bin", MemoryContentSource.sampleBytes(3000));
        engine.source.setReadDelayMillis(20);
        engine.queueManager.start();
        String jobId = engine.queueManager.submit(MemoryContentSource.ref("slow.bin"), DownloadPriority.NORMAL, null);
        engine.awaitStatus(jobId, DownloadStatus.DOWNLOADING);

        engine.queueManager.pause(jobId);
        engine.queueManager.resume(jobId);

        DownloadView done = engine.awaitStatus(jobId, DownloadStatus.COMPLETED);
        assertEquals(3000, done.downloadedBytes());
    }

    @Test
    void unknownSizeCompletesAtEndOfContent() throws Exception {
        engine = new EngineHarness(tempDir, 1, 300);
        byte[] content = MemoryContentSource.sampleBytes(1000);
        engine.source.putUnknownSize("stream.bin", content);
        engine.queueManager.start();

        String jobId = engine.queueManager.submit(MemoryContentSource.ref("stream.bin"), DownloadPriority.NORMAL, null);
        DownloadView done = engine.awaitStatus(jobId, DownloadStatus.COMPLETED);

        assertEquals(1000, done.totalBytes());
        assertEquals(100.0, done.progressPercent());
        assertArrayEquals(content, Files.readAllBytes(Path.of(done.filePath())));
    }

    @Test
    void purgeDropsOldFinishedJobsFromLiveListOnly() throws Exception {
        engine = new EngineHarness(tempDir, 1, 1024);
        engine.source.put("old.bin", MemoryContentSource.sampleBytes(100));
        engine.queueManager.start();
        String jobId = engine.queueManager.submit(MemoryContentSource.ref("old.bin"), DownloadPriority.NORMAL, null);
        engine.awaitStatus(jobId, DownloadStatus.COMPLETED);

        int removed = engine.queueManager.purgeFinishedBefore(OffsetDateTime.now().plusMinutes(1));

        assertEquals(1, removed);
        assertTrue(engine.queueManager.list().isEmpty());
        DownloadView fromLedger = engine.queueManager.get(jobId);
        assertEquals(DownloadStatus.COMPLETED, fromLedger.status());
        assertNotNull(fromLedger.filePath());
        engine.queueManager.pause(jobId);
    }

    @Test
    void setBandwidthLimitRejectsNegativeRates() {
        engine = new EngineHarness(tempDir, 1, 1024);

        engine.queueManager.setBandwidthLimit(5000);
        assertEquals(5000, engine.queueManager.getBandwidthLimit());
        assertThrows(IllegalArgumentException.class, () -> engine.queueManager.setBandwidthLimit(-1));
        assertEquals(5000, engine.queueManager.getBandwidthLimit());
    }

    @Test
    void resumesAfterShutdownFromVerifiedOffset() throws Exception {
        MemoryContentSource source = new MemoryContentSource();
        byte[] content = MemoryContentSource.sampleBytes(20_000);
        source.put("archive.zip", content);
        source.setReadDelayMillis(5);

        engine = new EngineHarness(tempDir, 1, 100, source);
        engine.queueManager.start();
        String jobId = engine.queueManager.submit(MemoryContentSource.ref("archive.zip"), DownloadPriority.NORMAL, null);
        engine.await(jobId, view -> view.downloadedBytes() >= 2000, "2000 bytes");
        engine.close();
        engine = null;

        engine = new EngineHarness(tempDir, 1, 100, source);
        DownloadJob interrupted = engine.ledger.findById(jobId).orElseThrow();
        assertEquals(DownloadStatus.DOWNLOADING, interrupted.status());
        long committed = interrupted.downloadedBytes();
        assertTrue(committed >= 2000);

        DownloadRecoveryService recovery = new DownloadRecoveryService(engine.ledger, engine.verifier, engine.properties);
        assertEquals(1, recovery.recoverInterruptedDownloads());
        engine.queueManager.start();
        DownloadView paused = engine.queueManager.get(jobId);
        assertEquals(DownloadStatus.PAUSED, paused.status());
        assertEquals(committed, paused.downloadedBytes());

        source.setReadDelayMillis(0);
        engine.queueManager.resume(jobId);
        DownloadView done = engine.awaitStatus(jobId, DownloadStatus.COMPLETED);

        assertArrayEquals(content, Files.readAllBytes(Path.of(done.filePath())));
        assertMonotonic(engine.progress.eventsFor(jobId));
    }

    private static void assertMonotonic(List<ProgressEvent> events) {
        long previous = -1;
        for (ProgressEvent event : events) {
            assertTrue(event.downloadedBytes() >= previous,
                    "downloadedBytes went from " + previous + " to " + event.downloadedBytes());
            previous = event.downloadedBytes();
        }
    }
}
