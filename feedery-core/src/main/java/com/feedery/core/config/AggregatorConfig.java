package com.feedery.core.config;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Run-wide settings, the {@code planet} section of the configuration file.
 * Populated by Jackson; every value has a default.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AggregatorConfig {

    public static final String VERSION = "1.0";

    public enum CacheBackend { JSON, SQLITE }

    // Identity
    private String name = "Unconfigured Planet";
    private String link = "";
    private String userAgent;

    // Locations, relative to the configuration file
    private String cacheDirectory = "cache";
    private String outputDirectory = "output";
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_CASE_INSENSITIVE_VALUES)
    private CacheBackend cacheBackend = CacheBackend.JSON;

    // Fetching
    private int workers = 8;
    private int feedTimeoutSeconds = 20;
    private int runTimeoutSeconds = 300;
    private long maxResponseBytes = 5L * 1024 * 1024;
    private int retries = 1;
    private long retryBackoffMillis = 500;
    private int failureBackoffMinutes = 30;

    // Caching and merging
    private int windowSize = 100;
    private int maxItems = 60;
    private int maxDays = 0;
    private int newFeedItems = 10;
    private int activityThresholdDays = 0;
    private String filter;
    private String exclude;

    public AggregatorConfig() {
        // Default constructor for YAML
    }

    // ==================== Identity ====================

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getLink() { return link; }
    public void setLink(String link) { this.link = link; }

    /** Explicit user agent, or {@code <name> +<link> Feedery/<version>}. */
    public String getUserAgent() {
        if (userAgent != null && !userAgent.isBlank()) return userAgent;
        return name + " +" + link + " Feedery/" + VERSION;
    }
    public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

    // ==================== Locations ====================

    public String getCacheDirectory() { return cacheDirectory; }
    public void setCacheDirectory(String cacheDirectory) { this.cacheDirectory = cacheDirectory; }

    public String getOutputDirectory() { return outputDirectory; }
    public void setOutputDirectory(String outputDirectory) { this.outputDirectory = outputDirectory; }

    public CacheBackend getCacheBackend() { return cacheBackend; }
    public void setCacheBackend(CacheBackend cacheBackend) {
        this.cacheBackend = cacheBackend != null ? cacheBackend : CacheBackend.JSON;
    }

    @JsonIgnore
    public Path cachePath(Path baseDir) {
        return baseDir.resolve(cacheDirectory).normalize();
    }

    @JsonIgnore
    public Path outputPath(Path baseDir) {
        return baseDir.resolve(outputDirectory).normalize();
    }

    // ==================== Fetching ====================

    public int getWorkers() { return workers; }
    public void setWorkers(int workers) { this.workers = Math.max(1, workers); }

    public int getFeedTimeoutSeconds() { return feedTimeoutSeconds; }
    public void setFeedTimeoutSeconds(int feedTimeoutSeconds) { this.feedTimeoutSeconds = feedTimeoutSeconds; }

    public int getRunTimeoutSeconds() { return runTimeoutSeconds; }
    public void setRunTimeoutSeconds(int runTimeoutSeconds) { this.runTimeoutSeconds = runTimeoutSeconds; }

    public long getMaxResponseBytes() { return maxResponseBytes; }
    public void setMaxResponseBytes(long maxResponseBytes) { this.maxResponseBytes = maxResponseBytes; }

    public int getRetries() { return retries; }
    public void setRetries(int retries) { this.retries = Math.max(0, retries); }

    public long getRetryBackoffMillis() { return retryBackoffMillis; }
    public void setRetryBackoffMillis(long retryBackoffMillis) { this.retryBackoffMillis = retryBackoffMillis; }

    public int getFailureBackoffMinutes() { return failureBackoffMinutes; }
    public void setFailureBackoffMinutes(int failureBackoffMinutes) { this.failureBackoffMinutes = failureBackoffMinutes; }

    @JsonIgnore
    public Duration feedTimeout() { return Duration.ofSeconds(feedTimeoutSeconds); }

    @JsonIgnore
    public Duration runTimeout() { return Duration.ofSeconds(runTimeoutSeconds); }

    @JsonIgnore
    public Duration failureBackoff() { return Duration.ofMinutes(failureBackoffMinutes); }

    // ==================== Caching and merging ====================

    public int getWindowSize() { return windowSize; }
    public void setWindowSize(int windowSize) { this.windowSize = Math.max(1, windowSize); }

    public int getMaxItems() { return maxItems; }
    public void setMaxItems(int maxItems) { this.maxItems = maxItems; }

    public int getMaxDays() { return maxDays; }
    public void setMaxDays(int maxDays) { this.maxDays = maxDays; }

    public int getNewFeedItems() { return newFeedItems; }
    public void setNewFeedItems(int newFeedItems) { this.newFeedItems = newFeedItems; }

    public int getActivityThresholdDays() { return activityThresholdDays; }
    public void setActivityThresholdDays(int activityThresholdDays) { this.activityThresholdDays = activityThresholdDays; }

    public String getFilter() { return filter; }
    public void setFilter(String filter) { this.filter = filter; }

    public String getExclude() { return exclude; }
    public void setExclude(String exclude) { this.exclude = exclude; }

    // ==================== Overrides ====================

    /**
     * Apply {@code feedery.workers} and {@code feedery.cache.dir} system properties,
     * falling back to the {@code FEEDERY_WORKERS} / {@code FEEDERY_CACHE_DIR} environment.
     */
    public AggregatorConfig applyOverrides() {
        String workersValue = System.getProperty("feedery.workers", System.getenv("FEEDERY_WORKERS"));
        if (workersValue != null && !workersValue.isBlank()) {
            try {
                setWorkers(Integer.parseInt(workersValue.trim()));
            } catch (NumberFormatException e) {
                throw new RegistryException("Invalid worker count override: " + workersValue, e);
            }
        }
        String cacheDir = System.getProperty("feedery.cache.dir", System.getenv("FEEDERY_CACHE_DIR"));
        if (cacheDir != null && !cacheDir.isBlank()) {
            setCacheDirectory(cacheDir);
        }
        return this;
    }
}
