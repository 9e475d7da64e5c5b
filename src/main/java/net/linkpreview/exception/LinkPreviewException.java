package net.linkpreview.exception;

/**
 * Base exception for link preview failures.
 * Subclasses indicate the stage that failed; callers only ever see {@link #getMessage()},
 * which is cached and returned verbatim.
 */
public abstract class LinkPreviewException extends RuntimeException {
    private final String url;
    private final FailureKind kind;

    protected LinkPreviewException(String message, String url, FailureKind kind, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.kind = kind;
    }

    public String getUrl() {
        return url;
    }

    public FailureKind getKind() {
        return kind;
    }

    /**
     * Stage of the preview pipeline that produced the failure.
     */
    public enum FailureKind {
        /** The URL was rejected or the body could not be turned into text. */
        FETCH,
        /** Connection, timeout or other network-level failure. */
        TRANSPORT,
        /** The parser could not interpret the fetched text. */
        PARSE
    }
}
