package com.feedery.core.render;

import com.feedery.core.merge.MergedSequence;

import java.util.List;

/**
 * Everything a renderer receives: planet identity, the merged entries and per-source channel summaries
 * in registry order.
 */
public record RenderModel(
    String name,
    String link,
    MergedSequence entries,
    List<ChannelSummary> channels
) {
    public RenderModel {
        entries = entries != null ? entries : MergedSequence.empty();
        channels = channels != null ? List.copyOf(channels) : List.of();
    }
}
