package com.kmg.nexar.dto;

import com.kmg.nexar.model.DownloadPriority;
import com.kmg.nexar.model.DownloadStatus;

public record DownloadView(
        String id,
        String title,
        String sourceRef,
        DownloadPriority priority,
        DownloadStatus status,
        long downloadedBytes,
        long totalBytes,
        Double progressPercent,
        long speedEstimateBps,
        Long etaSeconds,
        int attempt,
        String lastError,
        String filePath,
        String createdAt,
        String updatedAt
) {
}
