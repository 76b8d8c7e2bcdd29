package com.feedery.core.render;

import com.feedery.core.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChannelSummaryTest {

    private static final Instant NOW = Instant.parse("2021-09-10T00:00:00Z");
    private static final Source A = Source.of("https://a.example.com/feed", "A");

    private static CacheRecord recordWithEntryAt(Instant published) {
        Entry entry = Entry.builder().id("e").publishedAt(published).sourceUrl(A.url()).build();
        return new CacheRecord(A.url(), new ConditionalMetadata(null, null, NOW), SourceStatus.initial().succeeded(NOW, 200),
            List.of(entry));
    }

    @Test
    @DisplayName("Should be healthy for a recently active source")
    void healthy() {
        ChannelSummary summary = ChannelSummary.of(A, recordWithEntryAt(NOW.minus(Duration.ofDays(1))), 7, NOW);

        assertTrue(summary.healthy());
        assertEquals(1, summary.entryCount());
    }

    @Test
    @DisplayName("Should report inactivity past the threshold")
    void inactive() {
        ChannelSummary summary = ChannelSummary.of(A, recordWithEntryAt(NOW.minus(Duration.ofDays(30))), 7, NOW);

        assertEquals("no activity in 7 days", summary.message());
    }

    @Test
    @DisplayName("Should prefer the HTTP status message and tolerate a missing record")
    void statusMessage() {
        CacheRecord failing = CacheRecord.empty(A.url())
            .withStatus(SourceStatus.initial().failed(NOW, 403, "forbidden", null));

        assertEquals("403: forbidden", ChannelSummary.of(A, failing, 7, NOW).message());
        assertTrue(ChannelSummary.of(A, null, 7, NOW).healthy());
    }
}
