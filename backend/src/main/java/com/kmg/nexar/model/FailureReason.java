package com.kmg.nexar.model;

public enum FailureReason {
    TRANSFER_ERROR,
    CHECKSUM_MISMATCH,
    DISK_EXHAUSTED,
    SOURCE_UNAVAILABLE,
    IO_ERROR;

    public String describe(String message) {
        return message == null || message.isBlank() ? name() : name() + ": " + message;
    }
}
