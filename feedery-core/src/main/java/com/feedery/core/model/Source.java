package com.feedery.core.model;

/**
 * One configured feed. The feed URL is the stable key for cache and dedup purposes.
 */
public record Source(
    String url,             // configured feed URL, cache key
    String name,            // display name
    String category,        // optional categorization tag
    String filter,          // optional include regex
    String exclude,         // optional exclude regex
    boolean hidden          // fetched and cached but never merged
) {
    public Source {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Source url is required");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Source name is required for " + url);
        }
    }

    public static Source of(String url, String name) {
        return new Source(url, name, null, null, null, false);
    }
}
