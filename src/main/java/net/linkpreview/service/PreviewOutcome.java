package net.linkpreview.service;

import net.linkpreview.model.MetaData;

import java.util.Objects;

/**
 * Result of one fetch-and-parse attempt, as stored in the preview cache.
 * Failures are kept as flat text: the same string is cached and returned to callers.
 */
public sealed interface PreviewOutcome permits PreviewOutcome.Success, PreviewOutcome.Failure {

    static PreviewOutcome success(MetaData metadata) {
        return new Success(metadata);
    }

    static PreviewOutcome failure(String errorText) {
        return new Failure(errorText);
    }

    record Success(MetaData metadata) implements PreviewOutcome {
        public Success {
            Objects.requireNonNull(metadata, "metadata");
        }
    }

    record Failure(String errorText) implements PreviewOutcome {
        public Failure {
            Objects.requireNonNull(errorText, "errorText");
        }
    }
}
