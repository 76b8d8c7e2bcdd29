package com.feedery.core.model;

import java.util.List;

/**
 * Outcome of parsing one feed document.
 */
public sealed interface ParseResult {

    /** Parsed entries, empty for {@link Failed}. */
    List<Entry> entries();

    record Ok(FeedFormat format, List<Entry> entries) implements ParseResult {
        public Ok {
            entries = List.copyOf(entries);
        }
    }

    /** Recoverable malformation: entries are usable, warnings describe what was coerced or dropped. */
    record PartialOk(FeedFormat format, List<Entry> entries, List<String> warnings) implements ParseResult {
        public PartialOk {
            entries = List.copyOf(entries);
            warnings = List.copyOf(warnings);
        }
    }

    /** Unrecoverable: not XML at all, or no recognizable feed root. */
    record Failed(String reason) implements ParseResult {
        @Override
        public List<Entry> entries() {
            return List.of();
        }
    }
}
