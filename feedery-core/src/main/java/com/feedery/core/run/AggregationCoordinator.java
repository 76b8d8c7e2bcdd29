package com.feedery.core.run;

import com.feedery.core.config.AggregatorConfig;
import com.feedery.core.config.SourceRegistry;
import com.feedery.core.fetch.FeedFetcher;
import com.feedery.core.merge.MergeOptions;
import com.feedery.core.merge.MergedSequence;
import com.feedery.core.merge.Merger;
import com.feedery.core.model.CacheRecord;
import com.feedery.core.model.Source;
import com.feedery.core.parse.FeedParser;
import com.feedery.core.render.ChannelSummary;
import com.feedery.core.render.EntryRenderer;
import com.feedery.core.render.RenderModel;
import com.feedery.core.store.CachePolicy;
import com.feedery.core.store.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives one aggregation run: every source through its fetch, parse and cache pipeline on a bounded
 * worker pool, then one merge over a snapshot of the cache taken after all workers have finished.
 * <p>
 * Per-source failures never abort the run. Only an unwritable cache store (checked up front) or a
 * renderer I/O failure propagate to the caller.
 */
public class AggregationCoordinator {

    private static final Logger log = LoggerFactory.getLogger(AggregationCoordinator.class);

    private static final Duration WORKER_DRAIN = Duration.ofSeconds(5);

    private final AggregatorConfig config;
    private final CacheStore store;
    private final FeedFetcher fetcher;
    private final FeedParser parser;

    private EntryRenderer renderer;
    private Clock clock = Clock.systemUTC();
    private boolean offline = false;

    public AggregationCoordinator(AggregatorConfig config, CacheStore store, FeedFetcher fetcher) {
        this.config = config;
        this.store = store;
        this.fetcher = fetcher;
        this.parser = new FeedParser();
    }

    /**
     * Renderer that receives the merged output (default: none).
     */
    public AggregationCoordinator withRenderer(EntryRenderer renderer) {
        this.renderer = renderer;
        return this;
    }

    public AggregationCoordinator withClock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /**
     * Merge and render from the cache only, without touching the network.
     */
    public AggregationCoordinator withOffline(boolean offline) {
        this.offline = offline;
        return this;
    }

    /**
     * Run one aggregation cycle over the given sources.
     *
     * @throws com.feedery.core.store.CacheStoreException if the cache store is not writable
     * @throws UncheckedIOException if the renderer fails
     */
    public RunReport run(SourceRegistry registry) {
        long started = System.nanoTime();
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);

        List<SourceOutcome> outcomes;
        if (offline) {
            log.info("Offline mode: using cached state for {} sources", registry.size());
            outcomes = new ArrayList<>();
            for (Source source : registry.sources()) {
                outcomes.add(SourceOutcome.skipped(source.url(), SourceOutcome.Kind.OFFLINE, null));
            }
        } else {
            store.verifyWritable();
            log.debug("Phase {}", RunPhase.FETCHING);
            outcomes = fetchAll(registry, now);
        }

        log.debug("Phase {}", RunPhase.CACHING);
        SourcePipeline reader = pipeline();
        Map<String, CacheRecord> snapshot = new LinkedHashMap<>();
        for (Source source : registry.sources()) {
            reader.snapshot(source.url()).ifPresent(record -> snapshot.put(source.url(), record));
        }

        log.debug("Phase {}", RunPhase.MERGING);
        MergedSequence merged = new Merger(MergeOptions.from(config)).merge(registry, snapshot);
        if (renderer != null) {
            List<ChannelSummary> channels = new ArrayList<>();
            for (Source source : registry.sources()) {
                channels.add(ChannelSummary.of(source, snapshot.get(source.url()),
                    config.getActivityThresholdDays(), now));
            }
            try {
                renderer.render(new RenderModel(config.getName(), config.getLink(), merged, channels));
            } catch (IOException e) {
                throw new UncheckedIOException("Rendering failed", e);
            }
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        RunReport report = new RunReport(RunPhase.DONE, outcomes, merged, elapsed);
        log.info("Run done in {}ms: {} sources, {} failed, {} unchanged, {} merged entries",
            elapsed.toMillis(), outcomes.size(), report.failures(),
            report.count(SourceOutcome.Kind.UNCHANGED), merged.size());
        return report;
    }

    private List<SourceOutcome> fetchAll(SourceRegistry registry, Instant now) {
        List<Source> sources = registry.sources();
        if (sources.isEmpty()) {
            return List.of();
        }

        SourcePipeline pipeline = pipeline();
        List<Callable<SourceOutcome>> tasks = new ArrayList<>(sources.size());
        for (Source source : sources) {
            tasks.add(() -> pipeline.process(source, now));
        }

        int workers = Math.min(config.getWorkers(), sources.size());
        AtomicInteger threadCount = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "feedery-worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        List<Future<SourceOutcome>> futures;
        try {
            futures = pool.invokeAll(tasks, config.runTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures = List.of();
        } finally {
            pool.shutdownNow();
        }

        List<SourceOutcome> outcomes = new ArrayList<>(sources.size());
        boolean timedOut = false;
        for (int i = 0; i < sources.size(); i++) {
            String url = sources.get(i).url();
            Future<SourceOutcome> future = i < futures.size() ? futures.get(i) : null;
            if (future == null || future.isCancelled()) {
                timedOut = true;
                log.error("Error fetching <{}>: timeout (run limit of {}s reached)", url, config.getRunTimeoutSeconds());
                outcomes.add(SourceOutcome.timedOut(url));
                continue;
            }
            try {
                outcomes.add(future.get());
            } catch (ExecutionException e) {
                log.error("Unexpected failure processing <{}>", url, e.getCause());
                outcomes.add(new SourceOutcome(url, SourceOutcome.Kind.FAILED,
                    String.valueOf(e.getCause()), RunPhase.FETCHING, 0, false));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcomes.add(SourceOutcome.timedOut(url));
            }
        }

        if (timedOut) {
            fetcher.cancelAll();
        }
        awaitWorkers(pool);
        return outcomes;
    }

    private void awaitWorkers(ExecutorService pool) {
        try {
            if (!pool.awaitTermination(WORKER_DRAIN.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Workers still running after {}s, merging without them", WORKER_DRAIN.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private SourcePipeline pipeline() {
        CachePolicy policy = new CachePolicy(
            config.getWindowSize(), config.getNewFeedItems(), config.failureBackoff());
        return new SourcePipeline(store, fetcher, parser, policy);
    }
}
