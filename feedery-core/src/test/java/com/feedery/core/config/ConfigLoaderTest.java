package com.feedery.core.config;

import com.feedery.core.model.Source;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path dir;

    private Path write(String yaml) throws IOException {
        Path file = dir.resolve("feedery.yaml");
        Files.writeString(file, yaml);
        return file;
    }

    @Nested
    @DisplayName("Settings")
    class SettingsTests {

        @Test
        @DisplayName("Should read planet settings and resolve directories against the config file")
        void readsSettings() throws IOException {
            // Given
            Path file = write("""
                planet:
                  name: Planet Test
                  link: https://planet.example.org/
                  cacheDirectory: state
                  cacheBackend: sqlite
                  workers: 3
                  maxItems: 25
                  windowSize: 40
                  someFutureKey: ignored
                feeds:
                  "https://a.example.com/feed":
                    name: A
                """);

            // When
            FeederyConfig config = ConfigLoader.load(file);

            // Then
            AggregatorConfig settings = config.settings();
            assertEquals("Planet Test", settings.getName());
            assertEquals(AggregatorConfig.CacheBackend.SQLITE, settings.getCacheBackend());
            assertEquals(3, settings.getWorkers());
            assertEquals(25, settings.getMaxItems());
            assertEquals(40, settings.getWindowSize());
            assertEquals(dir.toAbsolutePath().resolve("state"), config.cachePath());
            assertTrue(settings.getUserAgent().contains("Feedery/" + AggregatorConfig.VERSION));
        }

        @Test
        @DisplayName("Should fall back to defaults without a planet section")
        void defaultsWithoutPlanet() throws IOException {
            // Given
            Path file = write("""
                feeds:
                  "https://a.example.com/feed":
                    name: A
                """);

            // When
            AggregatorConfig settings = ConfigLoader.load(file).settings();

            // Then
            assertEquals(AggregatorConfig.CacheBackend.JSON, settings.getCacheBackend());
            assertEquals(8, settings.getWorkers());
            assertEquals(100, settings.getWindowSize());
        }
    }

    @Nested
    @DisplayName("Feeds")
    class FeedTests {

        @Test
        @DisplayName("Should keep file order and skip malformed entries")
        void keepsOrderAndSkipsMalformed() throws IOException {
            // Given
            Path file = write("""
                feeds:
                  "https://c.example.com/feed":
                    name: C
                    category: news
                  "ftp://b.example.com/feed":
                    name: Not http
                  "https://nameless.example.com/feed":
                    category: x
                  "https://scalar.example.com/feed": just a string
                  "https://regex.example.com/feed":
                    name: Bad regex
                    filter: "(unclosed"
                  "https://a.example.com/feed":
                    name: A
                    exclude: sponsored
                    hidden: true
                """);

            // When
            SourceRegistry registry = ConfigLoader.load(file).registry();

            // Then
            List<String> urls = registry.sources().stream().map(Source::url).toList();
            assertEquals(List.of("https://c.example.com/feed", "https://a.example.com/feed"), urls);

            Source a = registry.sources().get(1);
            assertEquals("sponsored", a.exclude());
            assertTrue(a.hidden());
            assertEquals("news", registry.sources().get(0).category());
        }
    }

    @Nested
    @DisplayName("Fatal errors")
    class FatalTests {

        @Test
        @DisplayName("Should fail when the file is missing")
        void missingFile() {
            assertThrows(RegistryException.class, () -> ConfigLoader.load(dir.resolve("absent.yaml")));
        }

        @Test
        @DisplayName("Should fail without a feeds mapping")
        void missingFeeds() throws IOException {
            Path file = write("planet:\n  name: Empty\n");
            assertThrows(RegistryException.class, () -> ConfigLoader.load(file));
        }

        @Test
        @DisplayName("Should fail on invalid YAML")
        void invalidYaml() throws IOException {
            Path file = write("feeds: [unclosed\n  - : :\n");
            assertThrows(RegistryException.class, () -> ConfigLoader.load(file));
        }
    }

    @Test
    @DisplayName("Should drop duplicate URLs keeping the first")
    void registryDropsDuplicates() {
        // When
        SourceRegistry registry = SourceRegistry.of(
            Source.of("https://a.example.com/feed", "First"),
            Source.of("https://a.example.com/feed", "Second"));

        // Then
        assertEquals(1, registry.size());
        assertEquals("First", registry.sources().get(0).name());
    }
}
