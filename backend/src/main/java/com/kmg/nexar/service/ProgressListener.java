package com.kmg.nexar.service;

import com.kmg.nexar.model.ProgressEvent;

/**
 * Consumer of the rate-limited progress stream. Calls arrive on the reporter's dispatcher thread,
 * in order per job.
 */
public interface ProgressListener {
    void onProgress(ProgressEvent event);
}
