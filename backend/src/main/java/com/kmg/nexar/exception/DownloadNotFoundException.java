package com.kmg.nexar.exception;

public class DownloadNotFoundException extends RuntimeException {
    public DownloadNotFoundException(String jobId) {
        super("Download not found: " + jobId);
    }
}
