package com.kmg.nexar.repo;

import com.kmg.nexar.model.DownloadJob;
import com.kmg.nexar.model.DownloadPriority;
import com.kmg.nexar.model.DownloadStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DownloadLedgerRepositoryTest {

    @TempDir
    Path tempDir;

    private SingleConnectionDataSource dataSource;
    private DownloadLedgerRepository repository;

    @BeforeEach
    void setUp() {
        dataSource = new SingleConnectionDataSource("jdbc:sqlite:" + tempDir.resolve("ledger.db"), true);
        repository = new DownloadLedgerRepository(new JdbcTemplate(dataSource));
        repository.initializeSchema();
        repository.initializeSchema();
    }

    @AfterEach
    void tearDown() {
        dataSource.destroy();
    }

    @Test
    void storesAndReloadsJob() {
        DownloadJob job = job("a", DownloadStatus.QUEUED, 1, SqlTime.now());

        repository.insert(job);

        assertEquals(job, repository.findById("a").orElseThrow());
        assertTrue(repository.findById("missing").isEmpty());
    }

    @Test
    void saveOverwritesMutableColumns() {
        OffsetDateTime created = SqlTime.now();
        DownloadJob job = job("a", DownloadStatus.DOWNLOADING, 1, created);
        repository.insert(job);

        DownloadJob progressed = job.withProgress(4096, 8192, "ff".repeat(32), created.plusSeconds(1));
        repository.save(progressed);
        DownloadJob failed = progressed.failed("TRANSFER_ERROR: timeout", created.plusSeconds(2));
        repository.save(failed);

        DownloadJob stored = repository.findById("a").orElseThrow();
        assertEquals(DownloadStatus.FAILED, stored.status());
        assertEquals(4096, stored.downloadedBytes());
        assertEquals(8192, stored.totalBytes());
        assertEquals("ff".repeat(32), stored.prefixSha256());
        assertEquals("TRANSFER_ERROR: timeout", stored.lastError());

        repository.save(failed.retried(created.plusSeconds(3)));
        DownloadJob retried = repository.findById("a").orElseThrow();
        assertEquals(1, retried.attempt());
        assertNull(retried.lastError());
    }

    @Test
    void saveOfUnknownJobFails() {
        assertThrows(IllegalStateException.class,
                () -> repository.save(job("ghost", DownloadStatus.QUEUED, 1, SqlTime.now())));
    }

    @Test
    void listsByStatusInCreationOrder() {
        OffsetDateTime base = SqlTime.now();
        repository.insert(job("late", DownloadStatus.DOWNLOADING, 3, base.plusSeconds(5)));
        repository.insert(job("early", DownloadStatus.DOWNLOADING, 2, base));
        repository.insert(job("done", DownloadStatus.COMPLETED, 1, base.minusSeconds(5)));

        List<DownloadJob> downloading = repository.findByStatus(DownloadStatus.DOWNLOADING);

        assertEquals(List.of("early", "late"), downloading.stream().map(DownloadJob::id).toList());
        assertEquals(List.of("done", "early", "late"), repository.findAll().stream().map(DownloadJob::id).toList());
        assertEquals(3, repository.maxQueueSeq());
    }

    @Test
    void maxQueueSeqOfEmptyLedgerIsZero() {
        assertEquals(0, repository.maxQueueSeq());
    }

    private static DownloadJob job(String id, DownloadStatus status, long seq, OffsetDateTime created) {
        return new DownloadJob(id, "mem:///" + id, id, DownloadPriority.HIGH, status, DownloadJob.UNKNOWN_SIZE, 0,
                null, 0, seq, null, created, created, null);
    }
}
