package com.feedery.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.feedery.core.config.AggregatorConfig;
import com.feedery.core.model.Entry;
import com.feedery.core.render.ChannelSummary;
import com.feedery.core.render.EntryRenderer;
import com.feedery.core.render.RenderModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Writes the merged entries to {@code entries.json} in the output directory.
 * The document carries no generation time, so an unchanged cache renders byte-identical output.
 */
public class JsonFeedRenderer implements EntryRenderer {

    private static final Logger log = LoggerFactory.getLogger(JsonFeedRenderer.class);

    static final String FILE_NAME = "entries.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path outputDirectory;

    public JsonFeedRenderer(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    public Path outputFile() {
        return outputDirectory.resolve(FILE_NAME);
    }

    @Override
    public void render(RenderModel model) throws IOException {
        FeedDocument document = new FeedDocument(
            model.name(),
            model.link(),
            "Feedery/" + AggregatorConfig.VERSION,
            model.entries().entries(),
            model.channels()
        );

        Files.createDirectories(outputDirectory);
        Path temp = Files.createTempFile(outputDirectory, ".entries-", ".tmp");
        try {
            MAPPER.writeValue(temp.toFile(), document);
            try {
                Files.move(temp, outputFile(), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, outputFile(), StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        log.info("Wrote {} entries to {}", document.entries().size(), outputFile());
    }

    record FeedDocument(
        String name,
        String link,
        String generator,
        List<Entry> entries,
        List<ChannelSummary> channels
    ) {}
}
