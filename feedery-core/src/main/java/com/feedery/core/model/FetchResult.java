package com.feedery.core.model;

/**
 * Outcome of one retrieval attempt for a source. Transient, consumed immediately by the parser.
 */
public sealed interface FetchResult {

    /** Server answered 304 Not Modified. */
    record Unchanged() implements FetchResult {}

    /**
     * Body retrieved.
     *
     * @param finalUrl         URL the body came from after redirects
     * @param movedPermanently whether a 301/308 was followed to reach {@code finalUrl}
     */
    record Fetched(
        byte[] body,
        String contentType,
        ConditionalMetadata metadata,
        int status,
        String finalUrl,
        boolean movedPermanently
    ) implements FetchResult {}

    /** Retrieval failed; {@code httpStatus} is 0 when no response was received. */
    record Failed(FailureKind kind, int httpStatus, String detail) implements FetchResult {

        public static Failed of(FailureKind kind, String detail) {
            return new Failed(kind, 0, detail);
        }

        public static Failed http(int status) {
            return new Failed(FailureKind.HTTP_ERROR, status, "HTTP " + status);
        }

        public boolean isTransient() {
            return kind.isTransient(httpStatus);
        }

        public String reason() {
            return switch (kind) {
                case TIMEOUT -> "timeout";
                case CONNECTION_ERROR -> "connection-error";
                case HTTP_ERROR -> "http-error(" + httpStatus + ")";
                case TOO_LARGE -> "too-large";
                case PARSE_ERROR -> "parse-error";
            };
        }
    }
}
