package com.feedery.core.model;

import java.util.List;

/**
 * Durable per-source state: conditional metadata, check status and the bounded entry window
 * (newest first). Read and replaced wholesale.
 */
public record CacheRecord(
    String sourceUrl,
    ConditionalMetadata metadata,
    SourceStatus status,
    List<Entry> entries
) {
    public CacheRecord {
        metadata = metadata != null ? metadata : ConditionalMetadata.none();
        status = status != null ? status : SourceStatus.initial();
        entries = entries != null ? List.copyOf(entries) : List.of();
    }

    public static CacheRecord empty(String sourceUrl) {
        return new CacheRecord(sourceUrl, ConditionalMetadata.none(), SourceStatus.initial(), List.of());
    }

    public CacheRecord withStatus(SourceStatus status) {
        return new CacheRecord(sourceUrl, metadata, status, entries);
    }

    public CacheRecord withEntries(List<Entry> entries) {
        return new CacheRecord(sourceUrl, metadata, status, entries);
    }

    /** Whether the source has ever been fetched successfully. */
    public boolean hasBeenFetched() {
        return metadata.lastFetchedAt() != null;
    }
}
