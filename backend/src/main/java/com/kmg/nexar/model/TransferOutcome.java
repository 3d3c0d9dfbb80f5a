package com.kmg.nexar.model;

/**
 * Result a transfer unit hands back to the queue manager once it has released the part file.
 */
public record TransferOutcome(
        Kind kind,
        String filePath,
        FailureReason reason,
        String message,
        boolean discardPartial
) {
    public enum Kind {
        COMPLETED,
        STOPPED,
        FAILED
    }

    public static TransferOutcome completed(String filePath) {
        return new TransferOutcome(Kind.COMPLETED, filePath, null, null, false);
    }

    public static TransferOutcome stopped() {
        return new TransferOutcome(Kind.STOPPED, null, null, null, false);
    }

    public static TransferOutcome failed(FailureReason reason, String message) {
        return new TransferOutcome(Kind.FAILED, null, reason, message, false);
    }

    public static TransferOutcome failedDiscarding(FailureReason reason, String message) {
        return new TransferOutcome(Kind.FAILED, null, reason, message, true);
    }

    public String errorText() {
        return reason == null ? message : reason.describe(message);
    }
}
