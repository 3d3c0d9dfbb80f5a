package com.kmg.nexar.api;

import com.kmg.nexar.dto.BandwidthRequest;
import com.kmg.nexar.dto.DownloadSummary;
import com.kmg.nexar.dto.DownloadView;
import com.kmg.nexar.dto.SubmitDownloadRequest;
import com.kmg.nexar.dto.SubmitDownloadResponse;
import com.kmg.nexar.service.DownloadQueueManager;
import com.kmg.nexar.service.EventService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/downloads")
public class DownloadController {
    private final DownloadQueueManager queueManager;
    private final EventService eventService;

    public DownloadController(DownloadQueueManager queueManager, EventService eventService) {
        this.queueManager = queueManager;
        this.eventService = eventService;
    }

    @PostMapping
    public SubmitDownloadResponse submit(@Valid @RequestBody SubmitDownloadRequest request) {
        return new SubmitDownloadResponse(queueManager.submit(request.sourceRef(), request.priority(), request.title()));
    }

    @GetMapping
    public List<DownloadView> listDownloads() {
        return queueManager.list();
    }

    @GetMapping("/summary")
    public DownloadSummary summary() {
        return queueManager.summary();
    }

    @GetMapping(path = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events() {
        return eventService.subscribe();
    }

    @GetMapping("/{id}")
    public DownloadView getDownload(@PathVariable String id) {
        return queueManager.get(id);
    }

    @PostMapping("/{id}/pause")
    public ResponseEntity<Void> pause(@PathVariable String id) {
        queueManager.pause(id);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/{id}/resume")
    public ResponseEntity<Void> resume(@PathVariable String id) {
        queueManager.resume(id);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<Void> cancel(@PathVariable String id) {
        queueManager.cancel(id);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<Void> retry(@PathVariable String id) {
        queueManager.retry(id);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/pause-all")
    public ResponseEntity<Void> pauseAll() {
        queueManager.pauseAll();
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/resume-all")
    public ResponseEntity<Void> resumeAll() {
        queueManager.resumeAll();
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/bandwidth")
    public Map<String, Long> bandwidth() {
        return Map.of("bytesPerSecond", queueManager.getBandwidthLimit());
    }

    @PutMapping("/bandwidth")
    public Map<String, Long> setBandwidth(@Valid @RequestBody BandwidthRequest request) {
        queueManager.setBandwidthLimit(request.bytesPerSecond());
        return Map.of("bytesPerSecond", queueManager.getBandwidthLimit());
    }
}
