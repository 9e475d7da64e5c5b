/**
 * HTTP entry point for link previews
 *
 * Features:
 * - GET /link_preview?url=... returns the page metadata as JSON
 * - Successful previews carry a Cache-Control max-age equal to the cache TTL
 * - Failed previews return 500 with the (cached) error text as a plain-text body
 */
package net.linkpreview.controller;

import lombok.extern.slf4j.Slf4j;
import net.linkpreview.service.LinkPreviewService;
import net.linkpreview.service.PreviewOutcome;
import net.linkpreview.util.ApplicationConstants;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

@RestController
@Slf4j
public class LinkPreviewController {

    private static final MediaType TEXT_PLAIN_UTF8 = new MediaType("text", "plain", StandardCharsets.UTF_8);

    private final LinkPreviewService linkPreviewService;

    public LinkPreviewController(LinkPreviewService linkPreviewService) {
        this.linkPreviewService = linkPreviewService;
    }

    /**
     * Resolves the preview for a URL.
     *
     * @param url page to preview, used verbatim as the cache key
     * @return 200 with metadata JSON, or 500 with the error text
     */
    @GetMapping(ApplicationConstants.Paths.LINK_PREVIEW)
    public Mono<ResponseEntity<Object>> linkPreview(@RequestParam("url") String url) {
        return linkPreviewService.getPreview(url)
            .map(LinkPreviewController::toResponse);
    }

    static ResponseEntity<Object> toResponse(PreviewOutcome outcome) {
        if (outcome instanceof PreviewOutcome.Success success) {
            return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(ApplicationConstants.Cache.MAX_AGE))
                .contentType(MediaType.APPLICATION_JSON)
                .body(success.metadata());
        }
        PreviewOutcome.Failure failure = (PreviewOutcome.Failure) outcome;
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .contentType(TEXT_PLAIN_UTF8)
            .body(failure.errorText());
    }
}
