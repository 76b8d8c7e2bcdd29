package com.feedery.core.merge;

import com.feedery.core.config.SourceRegistry;
import com.feedery.core.model.CacheRecord;
import com.feedery.core.model.Entry;
import com.feedery.core.model.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Combines every source's cached window into the Merged Sequence.
 * <p>
 * Sources are walked in registry order so the first source to report an identity keeps it.
 * Ordering is timestamp descending, then registry position, then identity: a strict total
 * order over distinct entries, so identical snapshots always produce identical output.
 */
public class Merger {

    private static final Logger log = LoggerFactory.getLogger(Merger.class);

    private final MergeOptions options;

    public Merger(MergeOptions options) {
        this.options = options;
    }

    public MergedSequence merge(SourceRegistry registry, Map<String, CacheRecord> records) {
        EntryFilter global = EntryFilter.of(options.filter(), options.exclude());

        List<Ranked> candidates = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int duplicates = 0;

        List<Source> sources = registry.sources();
        for (int index = 0; index < sources.size(); index++) {
            Source source = sources.get(index);
            if (source.hidden()) continue;

            CacheRecord record = records.get(source.url());
            if (record == null) continue;

            EntryFilter local = EntryFilter.of(source.filter(), source.exclude());
            for (Entry entry : record.entries()) {
                if (entry.hidden()) continue;
                if (!global.accepts(entry) || !local.accepts(entry)) continue;
                if (seen.add(entry.id())) {
                    candidates.add(new Ranked(entry, index));
                } else {
                    duplicates++;
                }
            }
        }

        candidates.sort(ORDER);

        List<Entry> entries = new ArrayList<>(candidates.size());
        for (Ranked ranked : candidates) {
            entries.add(ranked.entry());
        }
        entries = applyLimits(entries);

        log.debug("Merged {} entries from {} sources ({} cross-source duplicates dropped)",
            entries.size(), sources.size(), duplicates);
        return new MergedSequence(entries);
    }

    private List<Entry> applyLimits(List<Entry> entries) {
        if (options.maxItems() > 0 && entries.size() > options.maxItems()) {
            entries = entries.subList(0, options.maxItems());
        }
        if (options.maxDays() > 0 && !entries.isEmpty()) {
            Instant horizon = entries.get(0).publishedAt().minus(Duration.ofDays(options.maxDays()));
            int keep = 0;
            while (keep < entries.size() && entries.get(keep).publishedAt().isAfter(horizon)) {
                keep++;
            }
            entries = entries.subList(0, keep);
        }
        return entries;
    }

    private record Ranked(Entry entry, int sourceIndex) {}

    private static final Comparator<Ranked> ORDER = Comparator
        .comparing((Ranked r) -> r.entry().publishedAt(), Comparator.reverseOrder())
        .thenComparingInt(Ranked::sourceIndex)
        .thenComparing(r -> r.entry().id());
}
