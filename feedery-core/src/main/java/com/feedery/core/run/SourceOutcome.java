package com.feedery.core.run;

/**
 * Terminal per-source result of one run.
 *
 * @param stage      last pipeline stage the source reached
 * @param entryCount entries in the saved window, or parsed entries when nothing was saved
 * @param saved      whether a new cache record was written
 */
public record SourceOutcome(
    String url,
    Kind kind,
    String detail,
    RunPhase stage,
    int entryCount,
    boolean saved
) {

    public enum Kind {
        FETCHED,
        PARTIAL,
        UNCHANGED,
        FAILED,
        SKIPPED_BACKOFF,
        SKIPPED_GONE,
        OFFLINE,
        TIMED_OUT;

        public boolean isFailure() {
            return this == FAILED || this == TIMED_OUT;
        }
    }

    public static SourceOutcome skipped(String url, Kind kind, String detail) {
        return new SourceOutcome(url, kind, detail, RunPhase.IDLE, 0, false);
    }

    public static SourceOutcome timedOut(String url) {
        return new SourceOutcome(url, Kind.TIMED_OUT, "run timeout", RunPhase.FETCHING, 0, false);
    }
}
