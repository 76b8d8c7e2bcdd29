package com.feedery.core.model;

/**
 * Feed document variant, selected by the document root element.
 */
public enum FeedFormat {
    RSS1,       // rdf:RDF root (RSS 0.90 / 1.0)
    RSS2,       // rss root (0.91 - 2.0)
    ATOM,       // feed root (0.3 / 1.0)
    UNKNOWN;

    /** Map a ROME wire feed type such as {@code rss_2.0} or {@code atom_1.0}. */
    public static FeedFormat fromFeedType(String feedType) {
        if (feedType == null) return UNKNOWN;
        if (feedType.equals("rss_1.0") || feedType.equals("rss_0.9")) return RSS1;
        if (feedType.startsWith("rss_")) return RSS2;
        if (feedType.startsWith("atom_")) return ATOM;
        return UNKNOWN;
    }
}
