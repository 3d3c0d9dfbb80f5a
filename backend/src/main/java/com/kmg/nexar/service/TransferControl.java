package com.kmg.nexar.service;

/**
 * Cooperative stop signal and live stats shared between the queue manager and the transfer unit
 * of one leased slot. The unit polls {@link #stopRequested()} at chunk boundaries and while it
 * waits for bandwidth or backs off.
 */
public class TransferControl {

    public enum StopRequest {
        NONE,
        PAUSE,
        CANCEL,
        SHUTDOWN
    }

    private final String jobId;
    private final SpeedMeter speedMeter = new SpeedMeter();
    private volatile StopRequest request = StopRequest.NONE;

    public TransferControl(String jobId) {
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }

    public SpeedMeter speedMeter() {
        return speedMeter;
    }

    public StopRequest request() {
        return request;
    }

    public void request(StopRequest next) {
        if (request == StopRequest.CANCEL || request == StopRequest.SHUTDOWN) {
            return;
        }
        request = next;
    }

    public void clearPause() {
        if (request == StopRequest.PAUSE) {
            request = StopRequest.NONE;
        }
    }

    public boolean stopRequested() {
        return request != StopRequest.NONE;
    }
}
