package com.kmg.nexar.model;

import java.time.OffsetDateTime;

public record DownloadJob(
        String id,
        String sourceRef,
        String title,
        DownloadPriority priority,
        DownloadStatus status,
        long totalBytes,
        long downloadedBytes,
        String prefixSha256,
        int attempt,
        long queueSeq,
        String filePath,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        String lastError
) {
    public static final long UNKNOWN_SIZE = -1L;

    public boolean sizeKnown() {
        return totalBytes >= 0;
    }

    public DownloadJob withStatus(DownloadStatus nextStatus, OffsetDateTime now) {
        return new DownloadJob(id, sourceRef, title, priority, nextStatus, totalBytes, downloadedBytes,
                prefixSha256, attempt, queueSeq, filePath, createdAt, now, lastError);
    }

    public DownloadJob withProgress(long nextDownloaded, long nextTotal, String nextPrefixSha256, OffsetDateTime now) {
        return new DownloadJob(id, sourceRef, title, priority, status, nextTotal, nextDownloaded,
                nextPrefixSha256, attempt, queueSeq, filePath, createdAt, now, lastError);
    }

    public DownloadJob withFilePath(String nextFilePath, OffsetDateTime now) {
        return new DownloadJob(id, sourceRef, title, priority, status, totalBytes, downloadedBytes,
                prefixSha256, attempt, queueSeq, nextFilePath, createdAt, now, lastError);
    }

    public DownloadJob completed(String completedPath, OffsetDateTime now) {
        return new DownloadJob(id, sourceRef, title, priority, DownloadStatus.COMPLETED, totalBytes, downloadedBytes,
                prefixSha256, attempt, queueSeq, completedPath, createdAt, now, null);
    }

    public DownloadJob failed(String error, OffsetDateTime now) {
        return new DownloadJob(id, sourceRef, title, priority, DownloadStatus.FAILED, totalBytes, downloadedBytes,
                prefixSha256, attempt, queueSeq, filePath, createdAt, now, error);
    }

    public DownloadJob retried(OffsetDateTime now) {
        return new DownloadJob(id, sourceRef, title, priority, DownloadStatus.QUEUED, totalBytes, downloadedBytes,
                prefixSha256, attempt + 1, queueSeq, null, createdAt, now, null);
    }
}
