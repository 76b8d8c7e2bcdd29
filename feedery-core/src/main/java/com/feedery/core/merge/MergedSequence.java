package com.feedery.core.merge;

import com.feedery.core.model.Entry;

import java.util.List;

/**
 * The run's output: deduplicated entries, newest first, capped. Recomputed every run, never persisted.
 */
public record MergedSequence(List<Entry> entries) {

    public MergedSequence {
        entries = List.copyOf(entries);
    }

    public static MergedSequence empty() {
        return new MergedSequence(List.of());
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
