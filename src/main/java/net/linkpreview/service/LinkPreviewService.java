/**
 * Link preview lookup with a TTL cache in front of fetch and parse
 *
 * Features:
 * - Serves live cache entries without touching the network
 * - On a miss, fetches the page under the byte budget, parses it and caches the outcome
 * - Caches failures exactly like successes (negative caching) for the full TTL
 * - Never errors: every failure is reported as a {@link PreviewOutcome.Failure}
 */
package net.linkpreview.service;

import lombok.extern.slf4j.Slf4j;
import net.linkpreview.exception.LinkPreviewException;
import net.linkpreview.exception.MetadataParseException;
import net.linkpreview.model.MetaData;
import net.linkpreview.parser.MetadataParser;
import net.linkpreview.service.cache.PreviewCache;
import net.linkpreview.service.fetch.BoundedPageFetcher;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Optional;

/**
 * Concurrent misses on the same URL are not coalesced: each one fetches independently
 * and the last insert wins.
 */
@Service
@Slf4j
public class LinkPreviewService {

    private final PreviewCache previewCache;
    private final BoundedPageFetcher pageFetcher;
    private final MetadataParser metadataParser;

    public LinkPreviewService(PreviewCache previewCache,
                              BoundedPageFetcher pageFetcher,
                              MetadataParser metadataParser) {
        this.previewCache = previewCache;
        this.pageFetcher = pageFetcher;
        this.metadataParser = metadataParser;
    }

    /**
     * Returns the preview outcome for {@code url}, computing and caching it on a miss.
     *
     * @param url raw request URL; also the cache key, used without normalization.
     *            A {@code null} URL yields a failure that is not cached
     * @return a Mono that always completes with exactly one outcome
     */
    public Mono<PreviewOutcome> getPreview(String url) {
        return Mono.defer(() -> {
            Optional<PreviewOutcome> cached = previewCache.get(url);
            if (cached.isPresent()) {
                log.debug("Preview cache hit for {}", url);
                return Mono.just(cached.get());
            }
            log.debug("Preview cache miss for {}", url);
            return computePreview(url)
                .doOnNext(outcome -> store(url, outcome));
        });
    }

    /**
     * Fetch then parse, collapsing any failure to its message.
     */
    Mono<PreviewOutcome> computePreview(String url) {
        return pageFetcher.fetch(url)
            .publishOn(Schedulers.boundedElastic())
            .map(fetched -> parseMetadata(url, fetched.text()))
            .map(PreviewOutcome::success)
            .onErrorResume(error -> Mono.just(PreviewOutcome.failure(toErrorText(url, error))));
    }

    private MetaData parseMetadata(String url, String text) {
        try {
            return metadataParser.parse(text).metadata();
        } catch (MetadataParseException e) {
            throw e.getUrl() == null ? e.forUrl(url) : e;
        }
    }

    private void store(String url, PreviewOutcome outcome) {
        if (url == null) {
            return;
        }
        if (outcome instanceof PreviewOutcome.Failure failure) {
            log.warn("Caching failed preview for {}: {}", url, failure.errorText());
        }
        previewCache.insert(url, outcome);
    }

    private static String toErrorText(String url, Throwable error) {
        if (error instanceof LinkPreviewException) {
            return error.getMessage();
        }
        log.error("Unexpected failure building preview for {}", url, error);
        String detail = StringUtils.hasText(error.getMessage()) ? error.getMessage() : error.getClass().getSimpleName();
        return "error building preview for " + url + ": " + detail;
    }
}
