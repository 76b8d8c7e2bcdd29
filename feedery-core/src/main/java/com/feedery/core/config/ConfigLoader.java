package com.feedery.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.feedery.core.model.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Loads the YAML configuration file: the {@code planet} settings section and the ordered
 * {@code feeds} mapping from feed URL to {@code {name, category, ...}}.
 * Malformed feed entries are skipped with a warning; a missing or unparseable file is fatal.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    public static FeederyConfig load(Path configFile) {
        if (!Files.isRegularFile(configFile)) {
            throw new RegistryException("Configuration file not found: " + configFile);
        }

        JsonNode root;
        try {
            root = YAML.readTree(configFile.toFile());
        } catch (IOException e) {
            throw new RegistryException("Failed to read configuration " + configFile + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new RegistryException("Configuration " + configFile + " is not a mapping");
        }

        AggregatorConfig settings = readSettings(root.get("planet"));
        settings.applyOverrides();

        JsonNode feeds = root.get("feeds");
        if (feeds == null || !feeds.isObject()) {
            throw new RegistryException("Configuration " + configFile + " has no 'feeds' mapping");
        }

        SourceRegistry registry = readSources(feeds);
        log.info("Loaded {} feeds from {}", registry.size(), configFile);

        Path baseDir = configFile.toAbsolutePath().getParent();
        return new FeederyConfig(settings, registry, baseDir);
    }

    private static AggregatorConfig readSettings(JsonNode planet) {
        if (planet == null || planet.isNull()) {
            return new AggregatorConfig();
        }
        try {
            return YAML.treeToValue(planet, AggregatorConfig.class);
        } catch (JsonProcessingException e) {
            throw new RegistryException("Invalid 'planet' section: " + e.getOriginalMessage(), e);
        }
    }

    static SourceRegistry readSources(JsonNode feeds) {
        List<Source> sources = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = feeds.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String url = field.getKey().trim();
            JsonNode value = field.getValue();

            String problem = validate(url, value);
            if (problem != null) {
                log.warn("Skipping feed <{}>: {}", url, problem);
                continue;
            }

            sources.add(new Source(
                url,
                value.get("name").asText().trim(),
                text(value, "category"),
                text(value, "filter"),
                text(value, "exclude"),
                value.path("hidden").asBoolean(false)
            ));
        }
        return new SourceRegistry(sources);
    }

    private static String validate(String url, JsonNode value) {
        if (!isHttpUrl(url)) {
            return "not an http(s) URL";
        }
        if (value == null || !value.isObject()) {
            return "entry is not a mapping";
        }
        JsonNode name = value.get("name");
        if (name == null || !name.isValueNode() || name.asText().isBlank()) {
            return "missing name";
        }
        for (String key : List.of("filter", "exclude")) {
            String regex = text(value, key);
            if (regex != null) {
                try {
                    Pattern.compile(regex);
                } catch (PatternSyntaxException e) {
                    return "invalid " + key + " regex: " + e.getDescription();
                }
            }
        }
        return null;
    }

    private static boolean isHttpUrl(String url) {
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            return uri.getHost() != null
                && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static String text(JsonNode node, String key) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) return null;
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
