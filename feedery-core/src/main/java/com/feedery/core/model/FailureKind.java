package com.feedery.core.model;

/**
 * Classification of a per-source failure. All kinds are recoverable for the run.
 */
public enum FailureKind {
    TIMEOUT,
    CONNECTION_ERROR,
    HTTP_ERROR,
    TOO_LARGE,
    PARSE_ERROR;

    /** Transient kinds are worth an in-run retry. HTTP errors are transient only for 5xx. */
    public boolean isTransient(int httpStatus) {
        return switch (this) {
            case TIMEOUT, CONNECTION_ERROR -> true;
            case HTTP_ERROR -> httpStatus >= 500;
            case TOO_LARGE, PARSE_ERROR -> false;
        };
    }
}
