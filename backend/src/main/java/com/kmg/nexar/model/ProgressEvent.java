package com.kmg.nexar.model;

import java.time.OffsetDateTime;

public record ProgressEvent(
        String jobId,
        DownloadStatus status,
        long downloadedBytes,
        long totalBytes,
        long speedEstimateBps,
        Long etaSeconds,
        String lastError,
        OffsetDateTime emittedAt
) {
    public Double percent() {
        if (totalBytes <= 0) {
            return totalBytes == 0 && status == DownloadStatus.COMPLETED ? 100.0 : null;
        }
        return Math.min(100.0, downloadedBytes * 100.0 / totalBytes);
    }
}
