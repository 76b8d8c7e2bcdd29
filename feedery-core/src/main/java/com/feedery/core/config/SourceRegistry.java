package com.feedery.core.config;

import com.feedery.core.model.Source;

import java.util.*;

/**
 * Ordered, immutable set of configured sources. Order is the registry order used for
 * cross-source dedup and merge tie-breaks.
 */
public final class SourceRegistry {

    private final List<Source> sources;

    public SourceRegistry(List<Source> sources) {
        Set<String> urls = new HashSet<>();
        List<Source> ordered = new ArrayList<>();
        for (Source source : sources) {
            if (urls.add(source.url())) {
                ordered.add(source);
            }
        }
        this.sources = List.copyOf(ordered);
    }

    public static SourceRegistry of(Source... sources) {
        return new SourceRegistry(List.of(sources));
    }

    public List<Source> sources() {
        return sources;
    }

    public int size() {
        return sources.size();
    }

    public boolean isEmpty() {
        return sources.isEmpty();
    }
}
