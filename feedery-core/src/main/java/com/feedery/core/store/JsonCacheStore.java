package com.feedery.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.feedery.core.model.CacheRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * One JSON file per source. Saves write a temp file in the same directory, force it to disk
 * and atomically move it over the old record, so a crash leaves either version intact.
 */
public class JsonCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(JsonCacheStore.class);

    static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path directory;

    public JsonCacheStore(Path directory) {
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }

    @Override
    public Optional<CacheRecord> load(String sourceUrl) {
        Path file = fileFor(sourceUrl);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            CacheRecord record = MAPPER.readValue(file.toFile(), CacheRecord.class);
            if (!sourceUrl.equals(record.sourceUrl())) {
                log.warn("Cache file {} belongs to <{}>, not <{}>; ignoring", file, record.sourceUrl(), sourceUrl);
                return Optional.empty();
            }
            return Optional.of(record);
        } catch (JsonProcessingException e) {
            log.error("Corrupt cache record for <{}> at {}; refetching: {}", sourceUrl, file, e.getOriginalMessage());
            return Optional.empty();
        } catch (IOException e) {
            throw new CacheStoreException("Failed to read cache record " + file, e);
        }
    }

    @Override
    public void save(CacheRecord record) {
        Path target = fileFor(record.sourceUrl());
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, ".record-", ".tmp");
            Files.write(temp, MAPPER.writeValueAsBytes(record));
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE)) {
                channel.force(true);
            }
            moveIntoPlace(temp, target);
            temp = null;
        } catch (IOException e) {
            throw new CacheStoreException("Failed to save cache record for <" + record.sourceUrl() + ">", e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    @Override
    public List<String> sourceUrls() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<String> urls = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : files.filter(f -> f.getFileName().toString().endsWith(".json")).sorted().toList()) {
                try {
                    urls.add(MAPPER.readValue(file.toFile(), CacheRecord.class).sourceUrl());
                } catch (IOException e) {
                    log.warn("Skipping unreadable cache file {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new CacheStoreException("Failed to list cache directory " + directory, e);
        }
        return urls;
    }

    @Override
    public void verifyWritable() {
        try {
            Files.createDirectories(directory);
            Path probe = Files.createTempFile(directory, ".probe-", ".tmp");
            Files.delete(probe);
        } catch (IOException | SecurityException e) {
            throw new CacheStoreException("Cache directory " + directory + " is not writable", e);
        }
    }

    @Override
    public void close() {
        // Nothing held open between calls
    }

    Path fileFor(String sourceUrl) {
        return directory.resolve(fileName(sourceUrl));
    }

    /** Readable slug of the URL plus a hash, so distinct URLs never share a file. */
    static String fileName(String sourceUrl) {
        String slug = sourceUrl.replaceFirst("^[A-Za-z][A-Za-z0-9+.-]*://", "")
            .replaceAll("[^A-Za-z0-9._-]+", "_");
        if (slug.length() > 80) {
            slug = slug.substring(0, 80);
        }
        return slug + "-" + hash(sourceUrl) + ".json";
    }

    private static String hash(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8))).substring(0, 12);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not remove temp file {}: {}", file, e.getMessage());
        }
    }
}
