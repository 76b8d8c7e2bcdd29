package com.feedery.core.run;

/**
 * Aggregation run state machine. {@link #PARSING} is reached per source inside a worker,
 * the coordinator itself moves straight from {@link #FETCHING} to {@link #CACHING}.
 */
public enum RunPhase {
    IDLE,
    FETCHING,
    PARSING,
    CACHING,
    MERGING,
    DONE
}
