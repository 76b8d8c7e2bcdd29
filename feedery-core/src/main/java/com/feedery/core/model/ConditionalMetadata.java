package com.feedery.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * Conditional-fetch state for one source. Replaced only after a successful {@link FetchResult.Fetched}.
 */
public record ConditionalMetadata(
    String etag,            // last ETag header, verbatim
    String lastModified,    // last Last-Modified header, verbatim
    Instant lastFetchedAt   // last successful full fetch
) {
    private static final ConditionalMetadata NONE = new ConditionalMetadata(null, null, null);

    public static ConditionalMetadata none() {
        return NONE;
    }

    /** Whether a conditional request can be issued with this metadata. */
    @JsonIgnore
    public boolean isConditional() {
        return (etag != null && !etag.isBlank()) || (lastModified != null && !lastModified.isBlank());
    }
}
