package com.kmg.nexar.dto;

public record DownloadSummary(
        int active,
        int queued,
        int completed,
        int failed
) {
}
