package com.feedery.core.store;

import com.feedery.core.model.CacheRecord;
import com.feedery.core.model.ConditionalMetadata;
import com.feedery.core.model.Entry;
import com.feedery.core.model.FetchResult;
import com.feedery.core.model.SourceStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * How a source's cache record evolves for each per-source outcome.
 * <ul>
 *   <li>Fetched: new metadata, entry window = union of fresh and retained entries by id,
 *       newest first, capped at the window size</li>
 *   <li>Unchanged: only the check bookkeeping moves</li>
 *   <li>Failed: metadata and entries untouched, failure counter and backoff advance</li>
 * </ul>
 */
public class CachePolicy {

    /** Newest first, then by id so equal timestamps still order deterministically. */
    public static final Comparator<Entry> NEWEST_FIRST = Comparator
        .comparing(Entry::publishedAt, Comparator.reverseOrder())
        .thenComparing(Entry::id);

    private final int windowSize;
    private final int newFeedItems;
    private final Duration failureBackoff;

    public CachePolicy(int windowSize, int newFeedItems, Duration failureBackoff) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be positive");
        }
        this.windowSize = windowSize;
        this.newFeedItems = newFeedItems;
        this.failureBackoff = failureBackoff;
    }

    public CacheRecord fetched(CacheRecord prior, FetchResult.Fetched fetched, List<Entry> fresh, Instant now) {
        boolean firstFetch = !prior.hasBeenFetched();
        List<Entry> window = mergeWindow(prior.entries(), fresh, firstFetch);

        SourceStatus status = prior.status().succeeded(now, fetched.status());
        if (fetched.movedPermanently() && fetched.finalUrl() != null) {
            status = status.movedTo(fetched.finalUrl());
        }
        ConditionalMetadata metadata = new ConditionalMetadata(
            fetched.metadata().etag(), fetched.metadata().lastModified(), now);
        return new CacheRecord(prior.sourceUrl(), metadata, status, window);
    }

    public CacheRecord unchanged(CacheRecord prior, Instant now) {
        return prior.withStatus(prior.status().succeeded(now, 304));
    }

    public CacheRecord failed(CacheRecord prior, FetchResult.Failed failed, Instant now) {
        int status = switch (failed.kind()) {
            case HTTP_ERROR -> failed.httpStatus();
            case TIMEOUT -> 408;
            default -> 500;
        };
        return prior.withStatus(prior.status().failed(now, status, failed.reason() + ": " + failed.detail(), failureBackoff));
    }

    /**
     * Union fresh and retained entries by id. Fresh entries win but keep the first-seen time,
     * visibility and (when their own date was inferred or clamped) the timestamp already stored.
     * On a source's first fetch only the first {@code newFeedItems} entries in feed order are visible.
     */
    public List<Entry> mergeWindow(List<Entry> retained, List<Entry> fresh, boolean firstFetch) {
        Map<String, Entry> retainedById = new HashMap<>();
        for (Entry entry : retained) {
            retainedById.putIfAbsent(entry.id(), entry);
        }

        List<Entry> merged = new ArrayList<>(fresh.size() + retained.size());
        Set<String> ids = new HashSet<>();
        int position = 0;
        for (Entry entry : fresh) {
            boolean hide = firstFetch && newFeedItems > 0 && position >= newFeedItems;
            position++;
            if (ids.add(entry.id())) {
                merged.add(carryOver(entry, retainedById.get(entry.id()), hide));
            }
        }
        for (Entry entry : retained) {
            if (ids.add(entry.id())) {
                merged.add(entry);
            }
        }

        merged.sort(NEWEST_FIRST);
        if (merged.size() > windowSize) {
            return List.copyOf(merged.subList(0, windowSize));
        }
        return List.copyOf(merged);
    }

    private static Entry carryOver(Entry fresh, Entry known, boolean hide) {
        if (known == null) {
            return hide ? fresh.withHidden(true) : fresh;
        }
        Entry.Builder builder = fresh.toBuilder()
            .firstSeenAt(known.firstSeenAt())
            .hidden(known.hidden());
        if (fresh.dateInferred()) {
            builder.publishedAt(known.publishedAt()).dateInferred(known.dateInferred());
        }
        return builder.build();
    }
}
