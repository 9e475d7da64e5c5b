package net.linkpreview.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import net.linkpreview.service.PreviewOutcome;

import java.util.Objects;
import java.util.Optional;

/**
 * {@link PreviewCache} backed by a Caffeine cache configured with expire-after-write.
 */
public class CaffeinePreviewCache implements PreviewCache {

    private final Cache<String, PreviewOutcome> store;

    public CaffeinePreviewCache(Cache<String, PreviewOutcome> store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    @Override
    public Optional<PreviewOutcome> get(String url) {
        if (url == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(store.getIfPresent(url));
    }

    @Override
    public void insert(String url, PreviewOutcome outcome) {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(outcome, "outcome");
        store.put(url, outcome);
    }

    public long estimatedSize() {
        return store.estimatedSize();
    }

    public CacheStats stats() {
        return store.stats();
    }
}
