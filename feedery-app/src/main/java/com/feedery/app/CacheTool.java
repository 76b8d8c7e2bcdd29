package com.feedery.app;

import com.feedery.core.config.ConfigLoader;
import com.feedery.core.config.FeederyConfig;
import com.feedery.core.config.RegistryException;
import com.feedery.core.model.CacheRecord;
import com.feedery.core.model.ConditionalMetadata;
import com.feedery.core.model.Entry;
import com.feedery.core.model.SourceStatus;
import com.feedery.core.store.CacheStore;
import com.feedery.core.store.CacheStoreException;
import com.feedery.core.store.CacheStores;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.*;

/**
 * Inspects and edits cached source records.
 * <pre>
 *   cachetool [-c config.yaml] --channel URL         source metadata and status
 *   cachetool [-c config.yaml] --list URL            cached entries
 *   cachetool [-c config.yaml] --item URL ID...      entry details
 *   cachetool [-c config.yaml] --hide URL ID...      hide entries from the merged output
 *   cachetool [-c config.yaml] --unhide URL ID...    show hidden entries again
 *   cachetool [-c config.yaml] --revive URL          clear the gone flag and failure backoff
 * </pre>
 */
public class CacheTool {

    private static final Set<String> COMMANDS = Set.of(
        "--channel", "--list", "--item", "--hide", "--unhide", "--revive");

    private final PrintStream out;

    CacheTool(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(new CacheTool(System.out).run(args));
    }

    int run(String[] args) {
        List<String> rest = new ArrayList<>(Arrays.asList(args));
        String configArg = FeederyApp.DEFAULT_CONFIG;
        int c = rest.indexOf("-c");
        if (c >= 0) {
            if (c + 1 >= rest.size()) return usage();
            configArg = rest.get(c + 1);
            rest.remove(c + 1);
            rest.remove(c);
        }
        if (rest.size() < 2 || !COMMANDS.contains(rest.get(0))) {
            return usage();
        }

        String command = rest.get(0);
        String url = rest.get(1);
        List<String> ids = rest.subList(2, rest.size());
        if (ids.isEmpty() && (command.equals("--item") || command.equals("--hide") || command.equals("--unhide"))) {
            return usage();
        }

        try {
            FeederyConfig config = ConfigLoader.load(Path.of(configArg));
            try (CacheStore store = CacheStores.open(config.settings().getCacheBackend(), config.cachePath())) {
                Optional<CacheRecord> found = store.load(url);
                if (found.isEmpty()) {
                    System.err.println("No cached record for " + url);
                    return FeederyApp.EXIT_FATAL;
                }
                CacheRecord record = found.get();
                return switch (command) {
                    case "--channel" -> channel(record);
                    case "--list" -> list(record);
                    case "--item" -> items(record, ids);
                    case "--hide" -> setHidden(store, record, ids, true);
                    case "--unhide" -> setHidden(store, record, ids, false);
                    default -> revive(store, record);
                };
            }
        } catch (RegistryException | CacheStoreException e) {
            System.err.println(e.getMessage());
            return FeederyApp.EXIT_FATAL;
        }
    }

    private int channel(CacheRecord record) {
        ConditionalMetadata metadata = record.metadata();
        SourceStatus status = record.status();
        out.println("url:            " + record.sourceUrl());
        out.println("etag:           " + orDash(metadata.etag()));
        out.println("last-modified:  " + orDash(metadata.lastModified()));
        out.println("last fetched:   " + orDash(metadata.lastFetchedAt()));
        out.println("last checked:   " + orDash(status.lastCheckedAt()));
        out.println("last status:    " + status.lastStatus());
        out.println("failures:       " + status.consecutiveFailures());
        out.println("retry after:    " + orDash(status.retryAfter()));
        out.println("last error:     " + orDash(status.lastError()));
        out.println("gone:           " + status.gone());
        out.println("moved to:       " + orDash(status.resolvedUrl()));
        out.println("message:        " + orDash(status.message()));
        out.println("entries:        " + record.entries().size());
        return FeederyApp.EXIT_OK;
    }

    private int list(CacheRecord record) {
        for (Entry entry : record.entries()) {
            out.printf("%s  %s%s  %s%n",
                entry.publishedAt(),
                entry.hidden() ? "(hidden) " : "",
                entry.id(),
                entry.title());
        }
        return FeederyApp.EXIT_OK;
    }

    private int items(CacheRecord record, List<String> ids) {
        int exit = FeederyApp.EXIT_OK;
        for (String id : ids) {
            Optional<Entry> entry = find(record, id);
            if (entry.isEmpty()) {
                System.err.println("No such item: " + id);
                exit = FeederyApp.EXIT_FATAL;
                continue;
            }
            Entry e = entry.get();
            out.println("id:         " + e.id());
            out.println("title:      " + e.title());
            out.println("link:       " + orDash(e.link()));
            out.println("author:     " + orDash(e.author()));
            out.println("published:  " + e.publishedAt() + (e.dateInferred() ? " (inferred)" : ""));
            out.println("first seen: " + e.firstSeenAt());
            out.println("hidden:     " + e.hidden());
            out.println("summary:    " + e.summary());
            out.println();
        }
        return exit;
    }

    private int setHidden(CacheStore store, CacheRecord record, List<String> ids, boolean hidden) {
        Set<String> wanted = new HashSet<>(ids);
        Set<String> matched = new HashSet<>();
        List<Entry> updated = new ArrayList<>(record.entries().size());
        for (Entry entry : record.entries()) {
            if (wanted.contains(entry.id())) {
                matched.add(entry.id());
                updated.add(entry.withHidden(hidden));
            } else {
                updated.add(entry);
            }
        }
        for (String id : ids) {
            if (!matched.contains(id)) {
                System.err.println("No such item: " + id);
            }
        }
        if (matched.isEmpty()) {
            return FeederyApp.EXIT_FATAL;
        }
        store.save(record.withEntries(updated));
        out.println((hidden ? "Hid " : "Unhid ") + matched.size() + " item(s)");
        return FeederyApp.EXIT_OK;
    }

    private int revive(CacheStore store, CacheRecord record) {
        store.save(record.withStatus(record.status().revived()));
        out.println("Revived " + record.sourceUrl());
        return FeederyApp.EXIT_OK;
    }

    private static Optional<Entry> find(CacheRecord record, String id) {
        return record.entries().stream().filter(e -> e.id().equals(id)).findFirst();
    }

    private static String orDash(Object value) {
        return value != null ? value.toString() : "-";
    }

    private static int usage() {
        System.err.println("Usage: cachetool [-c config.yaml] --channel|--list|--revive URL");
        System.err.println("       cachetool [-c config.yaml] --item|--hide|--unhide URL ID...");
        return FeederyApp.EXIT_USAGE;
    }
}
