package com.production.scholar_service.service.metadata;

import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class SourceResponseCacheTest {

    private final FakeTicker ticker = new FakeTicker();

    @Test
    @DisplayName("should serve cached bodies until the TTL runs out")
    void shouldExpireAfterTtl() {
        SourceResponseCache cache = new SourceResponseCache(Duration.ofMinutes(10), 100, ticker);
        cache.put("https://api.crossref.org/works/10.1/x", "{}");

        ticker.advance(Duration.ofMinutes(9));
        assertEquals("{}", cache.get("https://api.crossref.org/works/10.1/x").orElseThrow());

        ticker.advance(Duration.ofMinutes(2));
        assertTrue(cache.get("https://api.crossref.org/works/10.1/x").isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    @DisplayName("should not store anything when the TTL is zero")
    void shouldBeDisabledWithZeroTtl() {
        SourceResponseCache cache = new SourceResponseCache(Duration.ZERO, 100, ticker);
        cache.put("key", "body");

        assertTrue(cache.get("key").isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    @DisplayName("should evict down to the size bound instead of dropping every entry")
    void shouldBoundSizeWithoutClearing() {
        SourceResponseCache cache = new SourceResponseCache(Duration.ofMinutes(10), 3, ticker);
        for (int i = 0; i < 10; i++) {
            cache.put("https://openlibrary.org/search.json?q=" + i, "{\"n\":" + i + "}");
        }

        assertEquals(3, cache.size());
    }

    private static final class FakeTicker implements Ticker {

        private final AtomicLong nanos = new AtomicLong();

        void advance(Duration duration) {
            nanos.addAndGet(duration.toNanos());
        }

        @Override
        public long read() {
            return nanos.get();
        }
    }
}
