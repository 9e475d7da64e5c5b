package net.linkpreview.exception;

/**
 * Fetching the page body failed (bad URL, network error, timeout, undecodable bytes).
 * No partial body is ever returned alongside this exception.
 */
public class PageFetchException extends LinkPreviewException {

    private PageFetchException(String url, String reason, FailureKind kind, Throwable cause) {
        super("error fetching " + url + ": " + reason, url, kind, cause);
    }

    /** The URL itself cannot be requested. */
    public static PageFetchException invalidUrl(String url, String reason) {
        return new PageFetchException(url, reason, FailureKind.FETCH, null);
    }

    /** The body was received but is not valid UTF-8 text. */
    public static PageFetchException undecodable(String url, Throwable cause) {
        return new PageFetchException(url, "response body is not valid UTF-8", FailureKind.FETCH, cause);
    }

    /** Connection, timeout or protocol failure while talking to the remote host. */
    public static PageFetchException transport(String url, String reason, Throwable cause) {
        return new PageFetchException(url, reason, FailureKind.TRANSPORT, cause);
    }
}
