package com.feedery.core.model;

import java.time.Instant;

/**
 * Canonical syndication item. Immutable once parsed; equality for dedup is by {@link #id()} only,
 * callers compare ids rather than relying on record equality.
 */
public record Entry(
    // === IDENTITY ===
    String id,                      // feed-provided id, else fingerprint

    // === CONTENT ===
    String title,
    String link,
    String author,
    String summary,                 // sanitized HTML
    String content,                 // sanitized HTML, may equal summary

    // === TIME ===
    Instant publishedAt,            // updated/published, clamped or first-seen
    boolean dateInferred,           // true when the feed gave no usable timestamp
    Instant firstSeenAt,            // first observation, never changes

    // === SOURCE ===
    String sourceUrl,               // back-reference to the owning Source
    String sourceName,

    // === VISIBILITY ===
    boolean hidden
) {
    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id).title(title).link(link).author(author)
            .summary(summary).content(content)
            .publishedAt(publishedAt).dateInferred(dateInferred).firstSeenAt(firstSeenAt)
            .sourceUrl(sourceUrl).sourceName(sourceName)
            .hidden(hidden);
    }

    public Entry withHidden(boolean hidden) {
        return toBuilder().hidden(hidden).build();
    }

    /** Text used by include/exclude filters. */
    public String filterText() {
        String body = content != null && !content.isEmpty() ? content : summary;
        return (title != null ? title : "") + "\n" + (body != null ? body : "");
    }

    public static class Builder {
        private String id;
        private String title = "";
        private String link;
        private String author;
        private String summary = "";
        private String content = "";
        private Instant publishedAt;
        private boolean dateInferred;
        private Instant firstSeenAt;
        private String sourceUrl;
        private String sourceName;
        private boolean hidden;

        public Builder id(String id) { this.id = id; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder link(String link) { this.link = link; return this; }
        public Builder author(String author) { this.author = author; return this; }
        public Builder summary(String summary) { this.summary = summary; return this; }
        public Builder content(String content) { this.content = content; return this; }
        public Builder publishedAt(Instant publishedAt) { this.publishedAt = publishedAt; return this; }
        public Builder dateInferred(boolean dateInferred) { this.dateInferred = dateInferred; return this; }
        public Builder firstSeenAt(Instant firstSeenAt) { this.firstSeenAt = firstSeenAt; return this; }
        public Builder sourceUrl(String sourceUrl) { this.sourceUrl = sourceUrl; return this; }
        public Builder sourceName(String sourceName) { this.sourceName = sourceName; return this; }
        public Builder hidden(boolean hidden) { this.hidden = hidden; return this; }

        public Entry build() {
            if (id == null || id.isEmpty()) {
                throw new IllegalStateException("Entry id is required");
            }
            if (publishedAt == null) {
                throw new IllegalStateException("Entry publishedAt is required for " + id);
            }
            return new Entry(id, title, link, author, summary, content,
                publishedAt, dateInferred, firstSeenAt != null ? firstSeenAt : publishedAt,
                sourceUrl, sourceName, hidden);
        }
    }
}
