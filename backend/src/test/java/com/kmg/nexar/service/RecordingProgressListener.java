package com.kmg.nexar.service;

import com.kmg.nexar.model.DownloadStatus;
import com.kmg.nexar.model.ProgressEvent;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

class RecordingProgressListener implements ProgressListener {
    private final List<ProgressEvent> events = new CopyOnWriteArrayList<>();
    private final Set<String> downloading = new HashSet<>();
    private int maxDownloading;

    @Override
    public synchronized void onProgress(ProgressEvent event) {
        events.add(event);
        if (event.status() == DownloadStatus.DOWNLOADING) {
            downloading.add(event.jobId());
        } else {
            downloading.remove(event.jobId());
        }
        maxDownloading = Math.max(maxDownloading, downloading.size());
    }

    List<ProgressEvent> events() {
        return List.copyOf(events);
    }

    List<ProgressEvent> eventsFor(String jobId) {
        return events.stream().filter(event -> event.jobId().equals(jobId)).toList();
    }

    /**
     * Job ids in the order they were first reported as downloading.
     */
    List<String> admissionOrder() {
        return events.stream()
                .filter(event -> event.status() == DownloadStatus.DOWNLOADING)
                .map(ProgressEvent::jobId)
                .distinct()
                .toList();
    }

    synchronized int maxDownloading() {
        return maxDownloading;
    }
}
