package com.feedery.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SourceStatusTest {

    private static final Instant NOW = Instant.parse("2021-09-10T00:00:00Z");

    @Test
    @DisplayName("Should double the backoff per failure and cap it at a day")
    void backoffDoublesAndCaps() {
        // Given
        SourceStatus status = SourceStatus.initial();
        Duration base = Duration.ofHours(1);

        // When
        for (int i = 0; i < 10; i++) {
            status = status.failed(NOW, 500, "boom", base);
        }

        // Then
        assertEquals(10, status.consecutiveFailures());
        assertEquals(NOW.plus(SourceStatus.MAX_BACKOFF), status.retryAfter());
        assertTrue(status.isBackingOff(NOW.plusSeconds(60)));
        assertFalse(status.isBackingOff(NOW.plus(Duration.ofHours(25))));
    }

    @Test
    @DisplayName("Should clear failures and the gone flag on revive while keeping the redirect")
    void reviveKeepsRedirect() {
        // Given
        SourceStatus gone = SourceStatus.initial()
            .movedTo("https://new.example.com/feed")
            .failed(NOW, 410, "gone", Duration.ofMinutes(5));

        // When
        SourceStatus revived = gone.revived();

        // Then
        assertTrue(gone.gone());
        assertFalse(revived.gone());
        assertNull(revived.retryAfter());
        assertEquals("https://new.example.com/feed", revived.fetchUrl("https://old.example.com/feed"));
    }

    @Test
    @DisplayName("Should describe error statuses")
    void messages() {
        assertNull(SourceStatus.initial().succeeded(NOW, 200).message());
        assertEquals("404: not found", SourceStatus.initial().failed(NOW, 404, "x", null).message());
        assertEquals("http status 502", SourceStatus.initial().failed(NOW, 502, "x", null).message());
    }
}
