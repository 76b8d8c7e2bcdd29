package com.feedery.core.store;

import com.feedery.core.model.CacheRecord;
import com.feedery.core.model.ConditionalMetadata;
import com.feedery.core.model.SourceStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

class JsonCacheStoreTest extends AbstractCacheStoreContract {

    @Override
    CacheStore open(Path dir) {
        return new JsonCacheStore(dir.resolve("cache"));
    }

    @Override
    CacheRecord failingReplacement(CacheRecord prior) {
        Path directory = json().directory();
        assertTrue(directory.toFile().setWritable(false));
        assumeFalse(Files.isWritable(directory), "permissions are not enforced for this user");
        return new CacheRecord(prior.sourceUrl(), ConditionalMetadata.none(), SourceStatus.initial(),
            List.of(entry(prior.sourceUrl(), "three", T0)));
    }

    @AfterEach
    void restoreWritable() {
        json().directory().toFile().setWritable(true);
    }

    private JsonCacheStore json() {
        return (JsonCacheStore) store;
    }

    @Test
    @DisplayName("Should treat an undecodable record as absent")
    void corruptRecordIsAbsent() throws IOException {
        // Given
        store.save(sampleRecord(URL));
        Files.writeString(json().fileFor(URL), "{\"sourceUrl\": \"" + URL + "\", \"entries\": [ {broken");

        // When
        Optional<CacheRecord> loaded = store.load(URL);

        // Then
        assertTrue(loaded.isEmpty());
    }

    @Test
    @DisplayName("Should leave no temporary files behind after saving")
    void noTempFilesLeft() throws IOException {
        // When
        store.save(sampleRecord(URL));
        store.save(sampleRecord(URL));

        // Then
        try (Stream<Path> files = Files.list(json().directory())) {
            assertEquals(1, files.count());
        }
    }

    @Test
    @DisplayName("Should give distinct URLs distinct files")
    void distinctFileNames() {
        assertNotEquals(
            JsonCacheStore.fileName("https://a.example.com/feed?x=1"),
            JsonCacheStore.fileName("https://a.example.com/feed?x=2"));
        assertTrue(JsonCacheStore.fileName(URL).startsWith("a.example.com_feed-"));
    }

    @Test
    @DisplayName("Should fail the writability check when the cache path is a file")
    void unwritableDirectory() throws IOException {
        // Given
        Path blocker = dir.resolve("blocker");
        Files.writeString(blocker, "not a directory");
        JsonCacheStore blocked = new JsonCacheStore(blocker);

        // Then
        assertThrows(CacheStoreException.class, blocked::verifyWritable);
        assertThrows(CacheStoreException.class, () -> blocked.save(sampleRecord(URL)));
    }
}
