package com.kmg.nexar.service;

import com.kmg.nexar.model.TransferOutcome;

/**
 * Channel from a transfer unit back to the queue manager, which owns all job state.
 */
public interface TransferListener {

    /**
     * First report of a run: the verified resume offset, which may be lower than the committed
     * offset when the part file could not be verified.
     *
     * @return {@code false} when the lease is no longer valid and the unit must stop
     */
    boolean onStarted(TransferControl control, long startOffset, long totalBytes, String prefixSha256);

    void onChunkCommitted(TransferControl control, long downloadedBytes, long totalBytes, String prefixSha256);

    /**
     * Announces the final path before the part file is moved there, so that a move which outlives
     * the process can still be recognised on the next start.
     *
     * @return {@code false} when the path could not be recorded and the part file must stay put
     */
    boolean onFinalizing(TransferControl control, String filePath);

    /**
     * Called exactly once per run, after the unit has closed the part file.
     */
    void onFinished(TransferControl control, TransferOutcome outcome);
}
