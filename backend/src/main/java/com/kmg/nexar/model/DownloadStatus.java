package com.kmg.nexar.model;

public enum DownloadStatus {
    QUEUED,
    DOWNLOADING,
    PAUSED,
    COMPLETED,
    CANCELLED,
    FAILED;

    /**
     * States that end a transfer run and are always reported to progress consumers.
     * {@link #FAILED} is included even though a failed job can still be retried.
     */
    public boolean isFinal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
