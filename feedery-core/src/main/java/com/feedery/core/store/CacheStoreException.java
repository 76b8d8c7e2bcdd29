package com.feedery.core.store;

/**
 * Cache persistence failure. Recoverable when it concerns one source's save,
 * fatal when the store as a whole is unavailable.
 */
public class CacheStoreException extends RuntimeException {

    public CacheStoreException(String message) {
        super(message);
    }

    public CacheStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
