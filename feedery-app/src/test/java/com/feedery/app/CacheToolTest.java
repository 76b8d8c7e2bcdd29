package com.feedery.app;

import com.feedery.core.model.*;
import com.feedery.core.store.CacheStore;
import com.feedery.core.store.JsonCacheStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CacheToolTest {

    private static final String URL = "https://a.example.com/feed";
    private static final Instant NOW = Instant.parse("2021-09-10T00:00:00Z");

    @TempDir
    Path dir;

    private Path config;
    private CacheStore store;
    private ByteArrayOutputStream captured;
    private CacheTool tool;

    @BeforeEach
    void setUp() throws IOException {
        config = dir.resolve("feedery.yaml");
        Files.writeString(config, """
            planet:
              cacheDirectory: cache
            feeds:
              "%s":
                name: A
            """.formatted(URL));

        store = new JsonCacheStore(dir.resolve("cache"));
        SourceStatus gone = SourceStatus.initial().failed(NOW, 410, "http-error(410): HTTP 410", Duration.ofMinutes(30));
        store.save(new CacheRecord(URL, new ConditionalMetadata("\"etag\"", null, NOW), gone, List.of(
            entry("first", 2),
            entry("second", 1))));

        captured = new ByteArrayOutputStream();
        tool = new CacheTool(new PrintStream(captured, true, StandardCharsets.UTF_8));
    }

    private static Entry entry(String id, long minutes) {
        return Entry.builder()
            .id(id)
            .title("Title " + id)
            .publishedAt(NOW.minus(Duration.ofMinutes(minutes)))
            .sourceUrl(URL)
            .sourceName("A")
            .build();
    }

    private int run(String... args) {
        String[] full = new String[args.length + 2];
        full[0] = "-c";
        full[1] = config.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        return tool.run(full);
    }

    private String output() {
        return captured.toString(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("Inspection")
    class InspectionTests {

        @Test
        @DisplayName("Should print the channel status")
        void channel() {
            assertEquals(FeederyApp.EXIT_OK, run("--channel", URL));
            assertTrue(output().contains("\"etag\""));
            assertTrue(output().contains("410: gone"));
        }

        @Test
        @DisplayName("Should list cached entries newest first")
        void list() {
            assertEquals(FeederyApp.EXIT_OK, run("--list", URL));
            assertTrue(output().indexOf("first") < output().indexOf("second"));
        }

        @Test
        @DisplayName("Should print requested items and flag unknown ones")
        void items() {
            assertEquals(FeederyApp.EXIT_FATAL, run("--item", URL, "second", "missing"));
            assertTrue(output().contains("Title second"));
        }
    }

    @Nested
    @DisplayName("Editing")
    class EditingTests {

        @Test
        @DisplayName("Should hide and unhide entries")
        void hideAndUnhide() {
            // When
            assertEquals(FeederyApp.EXIT_OK, run("--hide", URL, "first"));

            // Then
            List<Entry> entries = store.load(URL).orElseThrow().entries();
            assertTrue(entries.get(0).hidden());
            assertFalse(entries.get(1).hidden());

            // When
            assertEquals(FeederyApp.EXIT_OK, run("--unhide", URL, "first"));

            // Then
            assertFalse(store.load(URL).orElseThrow().entries().get(0).hidden());
        }

        @Test
        @DisplayName("Should revive a gone source")
        void revive() {
            // When
            assertEquals(FeederyApp.EXIT_OK, run("--revive", URL));

            // Then
            SourceStatus status = store.load(URL).orElseThrow().status();
            assertFalse(status.gone());
            assertNull(status.retryAfter());
            assertEquals(2, store.load(URL).orElseThrow().entries().size());
        }
    }

    @Nested
    @DisplayName("Errors")
    class ErrorTests {

        @Test
        @DisplayName("Should exit 1 for a source with no cached record")
        void unknownSource() {
            assertEquals(FeederyApp.EXIT_FATAL, run("--list", "https://other.example.com/feed"));
        }

        @Test
        @DisplayName("Should exit 2 on bad usage")
        void usage() {
            assertEquals(FeederyApp.EXIT_USAGE, run("--explode", URL));
            assertEquals(FeederyApp.EXIT_USAGE, run("--hide", URL));
            assertEquals(FeederyApp.EXIT_USAGE, tool.run(new String[]{"-c"}));
        }
    }
}
