package net.linkpreview.util;

import org.slf4j.Logger;

/**
 * Centralized logging for outbound page fetches.
 *
 * One line per attempt, success and failure, all sharing the same prefix so a single
 * request can be followed through the log.
 */
public final class OutboundFetchLogger {

    private static final String PREFIX = "[OUTBOUND-FETCH]";

    private OutboundFetchLogger() {
    }

    /**
     * Log an outbound fetch attempt
     */
    public static void logAttempt(Logger log, String url) {
        log.info("{} ATTEMPT: GET {}", PREFIX, url);
    }

    /**
     * Log a completed fetch, noting whether the body was cut at the byte budget
     */
    public static void logSuccess(Logger log, String url, int bytesRead, boolean truncated) {
        if (truncated) {
            log.info("{} SUCCESS: GET {} read {} byte(s), truncated at budget", PREFIX, url, bytesRead);
        } else {
            log.info("{} SUCCESS: GET {} read {} byte(s)", PREFIX, url, bytesRead);
        }
    }

    /**
     * Log a failed fetch
     */
    public static void logFailure(Logger log, String url, String reason) {
        log.warn("{} FAILURE: GET {} - {}", PREFIX, url, reason);
    }
}
