package com.kmg.nexar.dto;

public record SubmitDownloadResponse(String jobId) {
}
