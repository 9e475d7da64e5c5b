package net.linkpreview.util;

import java.time.Duration;

/**
 * Central repository for shared literal values to reduce duplication.
 */
public final class ApplicationConstants {
    private ApplicationConstants() {
    }

    public static final class Cache {
        /** Lifetime of a cached preview outcome, in seconds (one day). */
        public static final long MAX_AGE_SECONDS = 86_400L;
        public static final Duration MAX_AGE = Duration.ofSeconds(MAX_AGE_SECONDS);

        private Cache() {
        }
    }

    public static final class Fetch {
        /** Hard cap on the number of body bytes ever handed to the parser (1 MiB). */
        public static final int MAX_SIZE = 1024 * 1024;
        public static final int INITIAL_BUFFER_SIZE = Math.min(8192, MAX_SIZE);
        public static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);
        public static final String CONNECTION_POOL_NAME = "link-preview-fetch";
        public static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/137.0.0.0 Safari/537.36";

        private Fetch() {
        }
    }

    public static final class Paths {
        public static final String LINK_PREVIEW = "/link_preview";

        private Paths() {
        }
    }
}
