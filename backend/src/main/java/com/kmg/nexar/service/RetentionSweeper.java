package com.kmg.nexar.service;

import com.kmg.nexar.config.DownloadProperties;
import com.kmg.nexar.repo.SqlTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class RetentionSweeper {
    private static final Logger log = LoggerFactory.getLogger(RetentionSweeper.class);

    private final DownloadQueueManager queueManager;
    private final DownloadProperties properties;

    public RetentionSweeper(DownloadQueueManager queueManager, DownloadProperties properties) {
        this.queueManager = queueManager;
        this.properties = properties;
    }

    @Scheduled(
            initialDelayString = "${downloads.retention.sweep-interval-ms:600000}",
            fixedDelayString = "${downloads.retention.sweep-interval-ms:600000}"
    )
    public void sweep() {
        Duration retention = properties.getRetention().getCompleted();
        if (retention == null) {
            return;
        }
        int removed = queueManager.purgeFinishedBefore(SqlTime.now().minus(retention));
        if (removed > 0) {
            log.info("Removed {} finished downloads from the live list", removed);
        }
    }
}
