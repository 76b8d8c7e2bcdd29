package com.feedery.core.store;

import com.feedery.core.config.AggregatorConfig;
import com.feedery.core.model.CacheRecord;
import com.feedery.core.model.ConditionalMetadata;
import com.feedery.core.model.SourceStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqliteCacheStoreTest extends AbstractCacheStoreContract {

    @Override
    CacheStore open(Path dir) {
        return CacheStores.open(AggregatorConfig.CacheBackend.SQLITE, dir.resolve("cache"));
    }

    /** Duplicate entry ids violate the entries primary key inside the replace transaction. */
    @Override
    CacheRecord failingReplacement(CacheRecord prior) {
        String url = prior.sourceUrl();
        return new CacheRecord(url, ConditionalMetadata.none(), SourceStatus.initial(),
            List.of(entry(url, "three", T0), entry(url, "three", T0.minusSeconds(1))));
    }

    @Test
    @DisplayName("Should persist records across reopening the database")
    void survivesReopen() {
        // Given
        store.save(sampleRecord(URL));
        store.close();

        // When
        store = open(dir);

        // Then
        assertEquals(sampleRecord(URL), store.load(URL).orElseThrow());
    }
}
