package com.feedery.core.merge;

import com.feedery.core.config.AggregatorConfig;

/**
 * Merge limits and global filters.
 *
 * @param maxItems cap on the merged sequence, 0 for no cap
 * @param maxDays  drop entries older than the newest by this many days, 0 to keep all
 * @param filter   case-insensitive include regex over title and content, or null
 * @param exclude  case-insensitive exclude regex over title and content, or null
 */
public record MergeOptions(int maxItems, int maxDays, String filter, String exclude) {

    public static MergeOptions of(int maxItems) {
        return new MergeOptions(maxItems, 0, null, null);
    }

    public static MergeOptions from(AggregatorConfig config) {
        return new MergeOptions(config.getMaxItems(), config.getMaxDays(), config.getFilter(), config.getExclude());
    }
}
