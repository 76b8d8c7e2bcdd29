package com.feedery.core.render;

import com.feedery.core.model.CacheRecord;
import com.feedery.core.model.Entry;
import com.feedery.core.model.Source;

import java.time.Duration;
import java.time.Instant;

/**
 * One source as renderers see it: display name, cached entry count and a status message
 * ({@code null} when the source is healthy).
 */
public record ChannelSummary(
    String url,
    String name,
    String category,
    boolean hidden,
    int entryCount,
    String message
) {

    public static ChannelSummary of(Source source, CacheRecord record, int activityThresholdDays, Instant now) {
        if (record == null) {
            record = CacheRecord.empty(source.url());
        }
        String message = record.status().message();
        if (message == null && activityThresholdDays > 0 && isInactive(record, activityThresholdDays, now)) {
            message = "no activity in " + activityThresholdDays + " days";
        }
        return new ChannelSummary(
            source.url(),
            source.name(),
            source.category(),
            source.hidden(),
            record.entries().size(),
            message
        );
    }

    private static boolean isInactive(CacheRecord record, int thresholdDays, Instant now) {
        if (record.entries().isEmpty()) {
            return record.hasBeenFetched();
        }
        Instant horizon = now.minus(Duration.ofDays(thresholdDays));
        Instant newest = record.entries().stream()
            .map(Entry::publishedAt)
            .max(Instant::compareTo)
            .orElse(Instant.MIN);
        return newest.isBefore(horizon);
    }

    public boolean healthy() {
        return message == null;
    }
}
