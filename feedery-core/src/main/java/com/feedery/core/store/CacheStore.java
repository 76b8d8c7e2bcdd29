package com.feedery.core.store;

import com.feedery.core.model.CacheRecord;

import java.util.List;
import java.util.Optional;

/**
 * Durable per-source cache records keyed by configured feed URL.
 * <p>
 * {@link #save} replaces a source's record wholesale: a later {@link #load} sees either the
 * complete new record or the complete old one. Different sources may be loaded and saved
 * concurrently; one source is never accessed by two threads at once.
 */
public interface CacheStore extends AutoCloseable {

    /** Stored record, or empty when none exists or the stored one is unreadable. */
    Optional<CacheRecord> load(String sourceUrl);

    void save(CacheRecord record);

    /** Source URLs with a stored record. */
    List<String> sourceUrls();

    /** Fail with {@link CacheStoreException} when the store cannot be written at all. */
    void verifyWritable();

    @Override
    void close();
}
