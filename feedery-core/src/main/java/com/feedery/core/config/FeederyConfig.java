package com.feedery.core.config;

import java.nio.file.Path;

/**
 * A loaded configuration file: run settings, the source registry, and the directory
 * relative paths resolve against.
 */
public record FeederyConfig(AggregatorConfig settings, SourceRegistry registry, Path baseDir) {

    public Path cachePath() {
        return settings.cachePath(baseDir);
    }

    public Path outputPath() {
        return settings.outputPath(baseDir);
    }
}
