package com.kmg.nexar;

import com.kmg.nexar.config.DownloadProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(DownloadProperties.class)
public class NexarDownloadsApplication {
    public static void main(String[] args) {
        SpringApplication.run(NexarDownloadsApplication.class, args);
    }
}
