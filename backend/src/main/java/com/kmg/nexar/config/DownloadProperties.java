package com.kmg.nexar.config;

import com.kmg.nexar.service.FairnessPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "downloads")
public class DownloadProperties {
    @NotBlank
    private String baseDir;
    @NotBlank
    private String dir;
    @Min(1)
    private int maxConcurrency = 3;
    @Min(1024)
    private int chunkSize = 1024 * 1024;
    @Min(0)
    private long diskReserveBytes = 64L * 1024 * 1024;
    @Valid
    @NotNull
    private State state = new State();
    @Valid
    @NotNull
    private Logs logs = new Logs();
    @Valid
    @NotNull
    private Bandwidth bandwidth = new Bandwidth();
    @Valid
    @NotNull
    private Retry retry = new Retry();
    @Valid
    @NotNull
    private Progress progress = new Progress();
    @Valid
    @NotNull
    private Retention retention = new Retention();
    @Valid
    @NotNull
    private Http http = new Http();

    public String getBaseDir() {
        return baseDir;
    }

    public void setBaseDir(String baseDir) {
        this.baseDir = baseDir;
    }

    public String getDir() {
        return dir;
    }

    public void setDir(String dir) {
        this.dir = dir;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public long getDiskReserveBytes() {
        return diskReserveBytes;
    }

    public void setDiskReserveBytes(long diskReserveBytes) {
        this.diskReserveBytes = diskReserveBytes;
    }

    public State getState() {
        return state;
    }

    public void setState(State state) {
        this.state = state;
    }

    public Logs getLogs() {
        return logs;
    }

    public void setLogs(Logs logs) {
        this.logs = logs;
    }

    public Bandwidth getBandwidth() {
        return bandwidth;
    }

    public void setBandwidth(Bandwidth bandwidth) {
        this.bandwidth = bandwidth;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Progress getProgress() {
        return progress;
    }

    public void setProgress(Progress progress) {
        this.progress = progress;
    }

    public Retention getRetention() {
        return retention;
    }

    public void setRetention(Retention retention) {
        this.retention = retention;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Path downloadDirPath() {
        return Path.of(dir);
    }

    public static class State {
        @NotBlank
        private String dbPath;

        public String getDbPath() {
            return dbPath;
        }

        public void setDbPath(String dbPath) {
            this.dbPath = dbPath;
        }
    }

    public static class Logs {
        @NotBlank
        private String dir;

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }
    }

    public static class Bandwidth {
        /**
         * Shared transfer rate for all active downloads. 0 disables throttling.
         */
        @Min(0)
        private long bytesPerSecond = 0;
        @Min(1)
        private long burstBytes = 4L * 1024 * 1024;
        @NotNull
        private FairnessPolicy fairness = FairnessPolicy.WEIGHTED;
        @NotNull
        private Duration pollInterval = Duration.ofMillis(100);

        public long getBytesPerSecond() {
            return bytesPerSecond;
        }

        public void setBytesPerSecond(long bytesPerSecond) {
            this.bytesPerSecond = bytesPerSecond;
        }

        public long getBurstBytes() {
            return burstBytes;
        }

        public void setBurstBytes(long burstBytes) {
            this.burstBytes = burstBytes;
        }

        public FairnessPolicy getFairness() {
            return fairness;
        }

        public void setFairness(FairnessPolicy fairness) {
            this.fairness = fairness;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }
    }

    public static class Retry {
        @Min(1)
        private int maxAttempts = 5;
        @NotNull
        private Duration baseDelay = Duration.ofMillis(500);
        @NotNull
        private Duration maxDelay = Duration.ofSeconds(30);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }
    }

    public static class Progress {
        @NotNull
        private Duration minInterval = Duration.ofMillis(500);
        private double minPercentDelta = 1.0;

        public Duration getMinInterval() {
            return minInterval;
        }

        public void setMinInterval(Duration minInterval) {
            this.minInterval = minInterval;
        }

        public double getMinPercentDelta() {
            return minPercentDelta;
        }

        public void setMinPercentDelta(double minPercentDelta) {
            this.minPercentDelta = minPercentDelta;
        }
    }

    public static class Retention {
        /**
         * How long completed downloads stay in the live list. {@code null} keeps them forever.
         */
        private Duration completed;
        private long sweepIntervalMs = 600_000;

        public Duration getCompleted() {
            return completed;
        }

        public void setCompleted(Duration completed) {
            this.completed = completed;
        }

        public long getSweepIntervalMs() {
            return sweepIntervalMs;
        }

        public void setSweepIntervalMs(long sweepIntervalMs) {
            this.sweepIntervalMs = sweepIntervalMs;
        }
    }

    public static class Http {
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration readTimeout = Duration.ofSeconds(20);

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }
}
