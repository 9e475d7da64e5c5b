package net.linkpreview.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import net.linkpreview.service.PreviewOutcome;
import net.linkpreview.service.cache.CaffeinePreviewCache;
import net.linkpreview.service.cache.PreviewCache;
import net.linkpreview.util.ApplicationConstants;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Builds the process-wide preview cache.
 * Entries expire a fixed time after they are written; there is no size bound.
 */
@Configuration
public class CacheConfig {

    /**
     * Create a cache with TTL only (no size limit).
     */
    public static <K, V> Cache<K, V> createCacheWithTtl(Duration ttl, Ticker ticker) {
        return Caffeine.newBuilder()
            .expireAfterWrite(ttl)
            .ticker(ticker)
            .recordStats()
            .build();
    }

    @Bean
    public Ticker cacheTicker() {
        return Ticker.systemTicker();
    }

    @Bean
    public PreviewCache previewCache(Ticker cacheTicker) {
        Cache<String, PreviewOutcome> store = createCacheWithTtl(ApplicationConstants.Cache.MAX_AGE, cacheTicker);
        return new CaffeinePreviewCache(store);
    }
}
