package com.feedery.app;

import com.feedery.core.config.ConfigLoader;
import com.feedery.core.config.FeederyConfig;
import com.feedery.core.config.RegistryException;
import com.feedery.core.fetch.HttpFeedFetcher;
import com.feedery.core.run.AggregationCoordinator;
import com.feedery.core.run.RunReport;
import com.feedery.core.store.CacheStore;
import com.feedery.core.store.CacheStoreException;
import com.feedery.core.store.CacheStores;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Runs one aggregation over the feeds listed in a YAML configuration file.
 * <pre>
 *   feedery [-v|--verbose] [-o|--offline] [config.yaml]
 * </pre>
 * Exit codes: 0 when the run completes (even if some feeds failed), 1 on a fatal error,
 * 2 on a usage error.
 */
public class FeederyApp {

    private static final Logger log = LoggerFactory.getLogger(FeederyApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;

    static final String DEFAULT_CONFIG = "feedery.yaml";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (hasArg(args, "-h") || hasArg(args, "--help")) {
            printUsage();
            return EXIT_OK;
        }

        String configArg = null;
        for (String arg : args) {
            switch (arg) {
                case "-v", "--verbose", "-o", "--offline" -> { }
                default -> {
                    if (arg.startsWith("-") || configArg != null) {
                        System.err.println("Unexpected argument: " + arg);
                        printUsage();
                        return EXIT_USAGE;
                    }
                    configArg = arg;
                }
            }
        }

        if (hasArg(args, "-v") || hasArg(args, "--verbose")) {
            Configurator.setRootLevel(Level.DEBUG);
        }
        boolean offline = hasArg(args, "-o") || hasArg(args, "--offline");
        Path configFile = Path.of(configArg != null ? configArg : DEFAULT_CONFIG);

        try {
            FeederyConfig config = ConfigLoader.load(configFile);
            return aggregate(config, offline);
        } catch (RegistryException e) {
            log.error("Cannot load feeds: {}", e.getMessage());
        } catch (CacheStoreException e) {
            log.error("Cache unavailable: {}", e.getMessage());
        } catch (UncheckedIOException e) {
            log.error("Cannot write output: {}", e.getCause().getMessage());
        }
        return EXIT_FATAL;
    }

    private static int aggregate(FeederyConfig config, boolean offline) {
        try (CacheStore store = CacheStores.open(config.settings().getCacheBackend(), config.cachePath());
             HttpFeedFetcher fetcher = new HttpFeedFetcher(config.settings())) {

            RunReport report = new AggregationCoordinator(config.settings(), store, fetcher)
                .withOffline(offline)
                .withRenderer(new JsonFeedRenderer(config.outputPath()))
                .run(config.registry());

            if (report.failures() > 0) {
                log.warn("{} of {} feeds failed this run, cached entries were kept",
                    report.failures(), report.outcomes().size());
            }
            return report.isDone() ? EXIT_OK : EXIT_FATAL;
        }
    }

    private static void printUsage() {
        System.err.println("Usage: feedery [-v|--verbose] [-o|--offline] [config.yaml]");
        System.err.println("  -v, --verbose   log at DEBUG level");
        System.err.println("  -o, --offline   merge and render from the cache only");
        System.err.println("  config.yaml     configuration file (default: " + DEFAULT_CONFIG + ")");
    }

    static boolean hasArg(String[] args, String flag) {
        for (String arg : args) {
            if (arg.equals(flag)) return true;
        }
        return false;
    }
}
