package com.kmg.nexar.service;

import com.kmg.nexar.config.DownloadProperties;
import com.kmg.nexar.model.DownloadJob;
import com.kmg.nexar.model.DownloadStatus;
import com.kmg.nexar.repo.DownloadLedgerRepository;
import com.kmg.nexar.repo.SqlTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Brings the ledger back to a consistent state after a crash or shutdown. Jobs recorded as
 * downloading are paused at the longest prefix of their part file that still matches the ledger,
 * or marked completed when their part file was already moved to its recorded final path.
 */
@Service
public class DownloadRecoveryService {
    private static final Logger log = LoggerFactory.getLogger(DownloadRecoveryService.class);

    private final DownloadLedgerRepository ledger;
    private final PartialFileVerifier verifier;
    private final Path downloadDir;

    public DownloadRecoveryService(
            DownloadLedgerRepository ledger,
            PartialFileVerifier verifier,
            DownloadProperties properties
    ) {
        this.ledger = ledger;
        this.verifier = verifier;
        this.downloadDir = properties.downloadDirPath();
    }

    public int recoverInterruptedDownloads() {
        List<DownloadJob> interrupted = ledger.findByStatus(DownloadStatus.DOWNLOADING);
        for (DownloadJob job : interrupted) {
            OffsetDateTime now = SqlTime.now();
            Path partFile = TransferUnit.partFileOf(downloadDir, job.id());
            if (finishedBeforeInterrupt(job, partFile)) {
                markCompleted(job, now);
                continue;
            }
            long offset;
            String prefixSha256;
            try {
                PartialFileVerifier.ResumePoint resume = verifier.resume(partFile, job.downloadedBytes(), job.prefixSha256());
                offset = resume.offset();
                prefixSha256 = offset == 0 ? null : verifier.hex(resume.digest());
            } catch (IOException e) {
                log.warn("Cannot verify partial file of download {}: {}", job.id(), e.getMessage());
                offset = 0;
                prefixSha256 = null;
            }
            DownloadJob recovered = job
                    .withProgress(offset, job.totalBytes(), prefixSha256, now)
                    .withStatus(DownloadStatus.PAUSED, now);
            ledger.save(recovered);
            log.info("Recovered interrupted download {} as paused at {} of {} bytes",
                    job.id(), offset, job.totalBytes());
        }
        return interrupted.size();
    }

    private boolean finishedBeforeInterrupt(DownloadJob job, Path partFile) {
        return job.filePath() != null
                && !Files.exists(partFile)
                && Files.isRegularFile(Path.of(job.filePath()));
    }

    private void markCompleted(DownloadJob job, OffsetDateTime now) {
        long size;
        try {
            size = Files.size(Path.of(job.filePath()));
        } catch (IOException e) {
            size = job.downloadedBytes();
        }
        DownloadJob completed = job
                .withProgress(size, size, job.prefixSha256(), now)
                .completed(job.filePath(), now);
        ledger.save(completed);
        log.info("Recovered download {} as completed: {}", job.id(), job.filePath());
    }
}
