package com.kmg.nexar.config;

import com.kmg.nexar.repo.DownloadLedgerRepository;
import com.kmg.nexar.service.DownloadQueueManager;
import com.kmg.nexar.service.DownloadRecoveryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class StartupInitializer implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StartupInitializer.class);

    private final DownloadProperties properties;
    private final JdbcTemplate jdbcTemplate;
    private final DownloadLedgerRepository ledger;
    private final DownloadRecoveryService recoveryService;
    private final DownloadQueueManager queueManager;

    public StartupInitializer(
            DownloadProperties properties,
            JdbcTemplate jdbcTemplate,
            DownloadLedgerRepository ledger,
            DownloadRecoveryService recoveryService,
            DownloadQueueManager queueManager
    ) {
        this.properties = properties;
        this.jdbcTemplate = jdbcTemplate;
        this.ledger = ledger;
        this.recoveryService = recoveryService;
        this.queueManager = queueManager;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        createDirectories();
        configureSqlitePragmas();
        ledger.initializeSchema();
        int recovered = recoveryService.recoverInterruptedDownloads();
        if (recovered > 0) {
            log.info("Recovered {} interrupted downloads", recovered);
        }
        queueManager.start();
    }

    private void createDirectories() throws IOException {
        Files.createDirectories(Path.of(properties.getBaseDir()));
        Files.createDirectories(properties.downloadDirPath());
        Files.createDirectories(Path.of(properties.getLogs().getDir()));
        Path dbPath = Path.of(properties.getState().getDbPath());
        if (dbPath.getParent() != null) {
            Files.createDirectories(dbPath.getParent());
        }
    }

    private void configureSqlitePragmas() {
        try {
            jdbcTemplate.queryForObject("PRAGMA journal_mode=WAL", String.class);
            jdbcTemplate.execute("PRAGMA synchronous=NORMAL");
            jdbcTemplate.execute("PRAGMA busy_timeout=30000");
        } catch (Exception e) {
            log.warn("Failed to configure SQLite pragmas: {}", e.getMessage());
        }
    }
}
