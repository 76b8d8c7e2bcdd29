package com.feedery.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Per-source check bookkeeping: last status, failure backoff, redirect and gone markers.
 * Unlike {@link ConditionalMetadata} this is refreshed on every terminal outcome.
 */
public record SourceStatus(
    Instant lastCheckedAt,      // last time the source answered (200 or 304)
    int lastStatus,             // last HTTP status, 408 for timeouts, 0 if never checked
    int consecutiveFailures,
    Instant retryAfter,         // no fetch before this instant, null when not backing off
    String lastError,
    boolean gone,               // 410 seen, skipped until revived
    String resolvedUrl          // target of a permanent redirect, null if none
) {
    static final Duration MAX_BACKOFF = Duration.ofHours(24);

    private static final SourceStatus INITIAL = new SourceStatus(null, 0, 0, null, null, false, null);

    public static SourceStatus initial() {
        return INITIAL;
    }

    public boolean isBackingOff(Instant now) {
        return retryAfter != null && now.isBefore(retryAfter);
    }

    /** URL to fetch: the redirect target when known, else the configured one. */
    public String fetchUrl(String configuredUrl) {
        return resolvedUrl != null && !resolvedUrl.isBlank() ? resolvedUrl : configuredUrl;
    }

    public SourceStatus succeeded(Instant now, int status) {
        return new SourceStatus(now, status, 0, null, null, false, resolvedUrl);
    }

    public SourceStatus movedTo(String url) {
        return new SourceStatus(lastCheckedAt, lastStatus, consecutiveFailures, retryAfter, lastError, gone, url);
    }

    /**
     * Record a failure and schedule the next attempt at {@code now + base * 2^(failures-1)}, capped at 24h.
     */
    public SourceStatus failed(Instant now, int status, String error, Duration backoffBase) {
        int failures = consecutiveFailures + 1;
        Instant next = null;
        if (backoffBase != null && !backoffBase.isZero()) {
            long factor = 1L << Math.min(failures - 1, 16);
            Duration delay = backoffBase.multipliedBy(factor);
            if (delay.compareTo(MAX_BACKOFF) > 0) {
                delay = MAX_BACKOFF;
            }
            next = now.plus(delay);
        }
        return new SourceStatus(lastCheckedAt, status, failures, next, error, status == 410, resolvedUrl);
    }

    public SourceStatus revived() {
        return new SourceStatus(lastCheckedAt, lastStatus, 0, null, null, false, resolvedUrl);
    }

    /** Human readable channel message for renderers, null when healthy. */
    public String message() {
        if (lastStatus < 400) return null;
        return switch (lastStatus) {
            case 403 -> "403: forbidden";
            case 404 -> "404: not found";
            case 408 -> "408: request timeout";
            case 410 -> "410: gone";
            case 500 -> "internal server error";
            default -> "http status " + lastStatus;
        };
    }
}
