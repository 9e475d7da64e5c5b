package net.linkpreview.service.cache;

import net.linkpreview.service.PreviewOutcome;

import java.util.Optional;

/**
 * Concurrency-safe store of preview outcomes keyed by the raw request URL.
 *
 * <p>Keys are compared exactly as given: no normalization of case, trailing slashes or
 * query order. Entries older than the time-to-live are reported as absent even if they
 * have not been purged yet. Implementations must allow concurrent {@code get} and
 * {@code insert} without external locking.</p>
 */
public interface PreviewCache {

    /**
     * @param url raw request URL
     * @return the live outcome stored for {@code url}, or empty on a miss or after expiry
     */
    Optional<PreviewOutcome> get(String url);

    /**
     * Stores {@code outcome} under {@code url}, replacing any previous entry and restarting its time-to-live.
     */
    void insert(String url, PreviewOutcome outcome);
}
