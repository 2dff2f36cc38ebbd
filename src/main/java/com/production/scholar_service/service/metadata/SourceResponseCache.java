package com.production.scholar_service.service.metadata;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.production.scholar_service.config.AppConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Response bodies of successful source requests, keyed by request URL, kept for a configurable TTL.
 * Lets reprocessing and bursts of similar uploads stay within the sources' rate limits.
 */
@Component
public class SourceResponseCache {

    static final long MAX_ENTRIES = 10_000;

    private final Cache<String, String> responses;
    private final boolean enabled;

    @Autowired
    public SourceResponseCache(AppConfig appConfig) {
        this(Duration.ofMinutes(appConfig.getMetadata().getCacheTtlMinutes()), MAX_ENTRIES, Ticker.systemTicker());
    }

    SourceResponseCache(Duration ttl, long maxEntries, Ticker ticker) {
        this.enabled = !ttl.isZero() && !ttl.isNegative();
        this.responses = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfterWrite(enabled ? ttl : Duration.ofNanos(1))
                .ticker(ticker)
                .build();
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(responses.getIfPresent(key));
    }

    public void put(String key, String body) {
        if (enabled) {
            responses.put(key, body);
        }
    }

    public long size() {
        responses.cleanUp();
        return responses.estimatedSize();
    }
}
