package net.linkpreview.exception;

/**
 * The metadata parser could not interpret the fetched text.
 */
public class MetadataParseException extends LinkPreviewException {

    private final String reason;

    public MetadataParseException(String reason, Throwable cause) {
        this(null, reason, cause);
    }

    public MetadataParseException(String url, String reason, Throwable cause) {
        super(url == null ? "error parsing page: " + reason : "error parsing " + url + ": " + reason,
              url, FailureKind.PARSE, cause);
        this.reason = reason;
    }

    /**
     * Same failure, attributed to the page it came from.
     */
    public MetadataParseException forUrl(String url) {
        return new MetadataParseException(url, reason, getCause());
    }
}
