package com.feedery.core.run;

import com.feedery.core.fetch.FeedFetcher;
import com.feedery.core.model.CacheRecord;
import com.feedery.core.model.FailureKind;
import com.feedery.core.model.FetchResult;
import com.feedery.core.model.ParseResult;
import com.feedery.core.model.Source;
import com.feedery.core.parse.FeedParser;
import com.feedery.core.store.CachePolicy;
import com.feedery.core.store.CacheStore;
import com.feedery.core.store.CacheStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * Fetch, parse and cache one source. Reads its record once at the start and writes it once at the end.
 */
public class SourcePipeline {

    private static final Logger log = LoggerFactory.getLogger(SourcePipeline.class);

    private final CacheStore store;
    private final FeedFetcher fetcher;
    private final FeedParser parser;
    private final CachePolicy policy;

    public SourcePipeline(CacheStore store, FeedFetcher fetcher, FeedParser parser, CachePolicy policy) {
        this.store = store;
        this.fetcher = fetcher;
        this.parser = parser;
        this.policy = policy;
    }

    public SourceOutcome process(Source source, Instant now) {
        String url = source.url();

        CacheRecord prior;
        try {
            prior = store.load(url).orElseGet(() -> CacheRecord.empty(url));
        } catch (CacheStoreException e) {
            log.error("Cannot read cache for <{}>, skipping this run: {}", url, e.getMessage());
            return SourceOutcome.skipped(url, SourceOutcome.Kind.FAILED, "cache read: " + e.getMessage());
        }

        if (prior.status().gone()) {
            log.debug("Skipping <{}>: feed is gone", url);
            return SourceOutcome.skipped(url, SourceOutcome.Kind.SKIPPED_GONE, "410: gone");
        }
        if (prior.status().isBackingOff(now)) {
            log.debug("Skipping <{}> until {}", url, prior.status().retryAfter());
            return SourceOutcome.skipped(url, SourceOutcome.Kind.SKIPPED_BACKOFF,
                "retry after " + prior.status().retryAfter());
        }

        String fetchUrl = prior.status().fetchUrl(url);
        FetchResult result = fetcher.fetch(fetchUrl, prior.metadata());

        CacheRecord next;
        SourceOutcome.Kind kind;
        String detail = null;
        RunPhase stage = RunPhase.FETCHING;
        int parsed = 0;

        if (result instanceof FetchResult.Unchanged) {
            log.info("Feed unchanged <{}>", url);
            next = policy.unchanged(prior, now);
            kind = SourceOutcome.Kind.UNCHANGED;

        } else if (result instanceof FetchResult.Fetched fetched) {
            stage = RunPhase.PARSING;
            ParseResult parseResult = parser.parse(
                fetched.body(), fetched.contentType(), source, fetched.finalUrl(), now);

            if (parseResult instanceof ParseResult.Failed failedParse) {
                FetchResult.Failed failure = FetchResult.Failed.of(FailureKind.PARSE_ERROR, failedParse.reason());
                log.error("Cannot parse <{}>: {}", url, failedParse.reason());
                next = policy.failed(prior, failure, now);
                kind = SourceOutcome.Kind.FAILED;
                detail = failure.reason() + ": " + failure.detail();
            } else {
                if (parseResult instanceof ParseResult.PartialOk partial) {
                    for (String warning : partial.warnings()) {
                        log.warn("<{}>: {}", url, warning);
                    }
                    kind = SourceOutcome.Kind.PARTIAL;
                    detail = partial.warnings().size() + " warnings";
                } else {
                    kind = SourceOutcome.Kind.FETCHED;
                }
                parsed = parseResult.entries().size();
                if (fetched.movedPermanently() && !fetchUrl.equals(fetched.finalUrl())) {
                    log.warn("Feed has moved from <{}> to <{}>", url, fetched.finalUrl());
                }
                next = policy.fetched(prior, fetched, parseResult.entries(), now);
                log.info("Fetched <{}>: {} entries", url, parsed);
            }

        } else {
            FetchResult.Failed failed = (FetchResult.Failed) result;
            if (failed.httpStatus() == 410) {
                log.error("Feed is gone <{}>, skipping until revived", url);
            } else {
                log.error("Error fetching <{}>: {} {}", url, failed.reason(), failed.detail());
            }
            next = policy.failed(prior, failed, now);
            kind = SourceOutcome.Kind.FAILED;
            detail = failed.reason();
        }

        if (Thread.currentThread().isInterrupted()) {
            log.warn("Run cancelled before caching <{}>, keeping prior record", url);
            return new SourceOutcome(url, SourceOutcome.Kind.TIMED_OUT, "run timeout", stage, parsed, false);
        }

        boolean saved = save(next);
        int count = saved ? next.entries().size() : parsed;
        return new SourceOutcome(url, kind, detail, RunPhase.CACHING, count, saved);
    }

    private boolean save(CacheRecord record) {
        try {
            store.save(record);
            return true;
        } catch (CacheStoreException e) {
            log.error("Cannot save cache for <{}>: {}", record.sourceUrl(), e.getMessage());
            return false;
        }
    }

    /** Current cached record for a source, empty when absent or unreadable. */
    Optional<CacheRecord> snapshot(String url) {
        try {
            return store.load(url);
        } catch (CacheStoreException e) {
            log.error("Cannot read cache for <{}> during merge: {}", url, e.getMessage());
            return Optional.empty();
        }
    }
}
