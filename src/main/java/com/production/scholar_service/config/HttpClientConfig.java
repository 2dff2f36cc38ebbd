package com.production.scholar_service.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Shared clients for the bibliographic sources and format detection.
 * Both are thread-safe and live for the lifetime of the context.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean
    public HttpClient metadataHttpClient(AppConfig appConfig) {
        int connectTimeout = appConfig.getMetadata().getConnectTimeoutSeconds();
        log.info("Metadata HttpClient initialized - connectTimeout={}s, maxRetries={}",
                connectTimeout, appConfig.getMetadata().getMaxRetries());
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(connectTimeout))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    public Tika tika() {
        return new Tika();
    }
}
