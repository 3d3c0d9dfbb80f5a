package com.kmg.nexar.config;

import com.kmg.nexar.service.BandwidthAllocator;
import com.kmg.nexar.service.DownloadWorkerPool;
import com.kmg.nexar.service.ProgressListener;
import com.kmg.nexar.service.ProgressReporter;
import com.kmg.nexar.service.RetryPolicy;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class EngineConfig {

    @Bean
    public OkHttpClient downloadHttpClient(DownloadProperties properties) {
        DownloadProperties.Http http = properties.getHttp();
        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout())
                .readTimeout(http.getReadTimeout())
                .retryOnConnectionFailure(false)
                .followRedirects(true)
                .build();
    }

    @Bean
    public BandwidthAllocator bandwidthAllocator(DownloadProperties properties) {
        DownloadProperties.Bandwidth bandwidth = properties.getBandwidth();
        return new BandwidthAllocator(
                bandwidth.getBytesPerSecond(),
                bandwidth.getBurstBytes(),
                bandwidth.getFairness(),
                bandwidth.getPollInterval()
        );
    }

    @Bean
    public RetryPolicy retryPolicy(DownloadProperties properties) {
        DownloadProperties.Retry retry = properties.getRetry();
        return new RetryPolicy(retry.getMaxAttempts(), retry.getBaseDelay(), retry.getMaxDelay());
    }

    @Bean
    public DownloadWorkerPool downloadWorkerPool(DownloadProperties properties) {
        return new DownloadWorkerPool(properties.getMaxConcurrency());
    }

    @Bean
    public ProgressReporter progressReporter(DownloadProperties properties, List<ProgressListener> listeners) {
        DownloadProperties.Progress progress = properties.getProgress();
        return new ProgressReporter(progress.getMinInterval(), progress.getMinPercentDelta(), listeners);
    }
}
