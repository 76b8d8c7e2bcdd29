package com.feedery.core.store;

import com.feedery.core.config.AggregatorConfig;

import java.nio.file.Path;

/**
 * Opens the configured cache backend.
 */
public final class CacheStores {

    private CacheStores() {
    }

    public static CacheStore open(AggregatorConfig.CacheBackend backend, Path cacheDirectory) {
        return switch (backend) {
            case JSON -> new JsonCacheStore(cacheDirectory);
            case SQLITE -> new SqliteCacheStore(cacheDirectory.resolve("cache.db"));
        };
    }
}
