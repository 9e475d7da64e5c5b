/**
 * Streams a page body under a fixed byte budget
 *
 * Features:
 * - Issues a single GET through the shared WebClient
 * - Consumes the body chunk by chunk and never buffers more than the budget
 * - Cancels the exchange once the budget is spent instead of reading to the end
 * - Returns boundary-safe UTF-8 text; any transport failure fails the whole fetch
 */
package net.linkpreview.service.fetch;

import lombok.extern.slf4j.Slf4j;
import net.linkpreview.exception.LinkPreviewException;
import net.linkpreview.exception.PageFetchException;
import net.linkpreview.util.ApplicationConstants;
import net.linkpreview.util.OutboundFetchLogger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.CharacterCodingException;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

@Component
@Slf4j
public class BoundedPageFetcher {

    private static final String HTTP_SCHEME = "http";
    private static final String HTTPS_SCHEME = "https";

    private final WebClient webClient;
    private final int maxBytes;
    private final Duration requestTimeout;

    @Autowired
    public BoundedPageFetcher(WebClient pageFetchWebClient) {
        this(pageFetchWebClient, ApplicationConstants.Fetch.MAX_SIZE, ApplicationConstants.Fetch.REQUEST_TIMEOUT);
    }

    BoundedPageFetcher(WebClient webClient, int maxBytes, Duration requestTimeout) {
        this.webClient = webClient;
        this.maxBytes = maxBytes;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Fetches {@code url} and returns at most the byte budget of its body as text.
     *
     * @param url absolute http(s) URL, used as given
     * @return the boundary-safe body text, or an error carrying a {@link PageFetchException}
     */
    public Mono<FetchedText> fetch(String url) {
        URI uri;
        try {
            uri = toRequestUri(url);
        } catch (PageFetchException invalid) {
            OutboundFetchLogger.logFailure(log, url, invalid.getMessage());
            return Mono.error(invalid);
        }

        return Mono.defer(() -> {
                OutboundFetchLogger.logAttempt(log, url);
                return webClient.get()
                    .uri(uri)
                    .exchangeToMono(response -> readBounded(response, url));
            })
            .timeout(requestTimeout)
            .onErrorMap(error -> !(error instanceof LinkPreviewException), error -> toFetchException(url, error))
            .doOnNext(fetched -> OutboundFetchLogger.logSuccess(log, url, fetched.bytesRead(), fetched.truncated()))
            .doOnError(error -> OutboundFetchLogger.logFailure(log, url, error.getMessage()));
    }

    private Mono<FetchedText> readBounded(ClientResponse response, String url) {
        if (!response.statusCode().is2xxSuccessful()) {
            log.debug("GET {} answered {}; reading body anyway", url, response.statusCode().value());
        }
        BoundedTextAccumulator accumulator = new BoundedTextAccumulator(maxBytes);
        return response.bodyToFlux(DataBuffer.class)
            .map(BoundedPageFetcher::drain)
            .takeWhile(accumulator::append)
            .then(Mono.fromCallable(() -> decode(accumulator, url)));
    }

    private static FetchedText decode(BoundedTextAccumulator accumulator, String url) {
        try {
            return accumulator.finish();
        } catch (CharacterCodingException e) {
            throw PageFetchException.undecodable(url, e);
        }
    }

    private static byte[] drain(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }

    static URI toRequestUri(String url) {
        if (!StringUtils.hasText(url)) {
            throw PageFetchException.invalidUrl(url, "empty URL");
        }
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw PageFetchException.invalidUrl(url, "invalid URL: " + e.getReason());
        }
        if (uri.getScheme() == null) {
            throw PageFetchException.invalidUrl(url, "relative URL without a base");
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (!HTTP_SCHEME.equals(scheme) && !HTTPS_SCHEME.equals(scheme)) {
            throw PageFetchException.invalidUrl(url, "unsupported URL scheme '" + uri.getScheme() + "'");
        }
        if (!StringUtils.hasText(uri.getHost())) {
            throw PageFetchException.invalidUrl(url, "URL has no host");
        }
        return uri;
    }

    private PageFetchException toFetchException(String url, Throwable error) {
        if (error instanceof TimeoutException) {
            return PageFetchException.transport(url, "request timed out after " + requestTimeout.toMillis() + " ms", error);
        }
        if (error instanceof WebClientRequestException requestException) {
            Throwable root = requestException.getMostSpecificCause();
            String detail = StringUtils.hasText(root.getMessage()) ? root.getMessage() : root.getClass().getSimpleName();
            return PageFetchException.transport(url, "error sending request: " + detail, error);
        }
        String detail = StringUtils.hasText(error.getMessage()) ? error.getMessage() : error.getClass().getSimpleName();
        return PageFetchException.transport(url, detail, error);
    }
}
