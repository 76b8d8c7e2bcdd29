package com.feedery.core.fetch;

import com.feedery.core.model.ConditionalMetadata;
import com.feedery.core.model.FetchResult;

/**
 * Retrieves raw feed bytes for one source. Implementations never throw for per-source
 * problems; they report them as {@link FetchResult.Failed}.
 */
public interface FeedFetcher extends AutoCloseable {

    /**
     * Fetch {@code url}, conditionally when {@code prior} carries an ETag or Last-Modified value.
     */
    FetchResult fetch(String url, ConditionalMetadata prior);

    /**
     * Abort every in-flight fetch. Aborted fetches report {@code Failed(TIMEOUT)}.
     */
    default void cancelAll() {}

    @Override
    default void close() {}
}
