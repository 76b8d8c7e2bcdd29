package com.feedery.core.parse;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Entities;
import org.jsoup.safety.Safelist;

/**
 * Cleans feed-supplied markup with jsoup so broken or unsafe HTML is repaired rather than rejected.
 */
public final class HtmlSanitizer {

    private static final Safelist SAFELIST = Safelist.relaxed()
        .addProtocols("a", "href", "http", "https", "mailto")
        .addProtocols("img", "src", "http", "https");

    private static final Document.OutputSettings OUTPUT = new Document.OutputSettings()
        .prettyPrint(false)
        .charset("UTF-8");

    private HtmlSanitizer() {
    }

    /** Whether the markup is well formed and uses only allowed tags and attributes. */
    public static boolean isClean(String html) {
        return html == null || html.isEmpty() || Jsoup.isValid(html, SAFELIST);
    }

    public static String clean(String html) {
        if (html == null || html.isEmpty()) return "";
        return Jsoup.clean(html, "", SAFELIST, OUTPUT).trim();
    }

    /** Plain text of a markup fragment, whitespace collapsed. */
    public static String toText(String html) {
        if (html == null || html.isEmpty()) return "";
        return Jsoup.parse(html).text().trim();
    }

    /** Escape plain text so it can sit alongside HTML content. */
    public static String escape(String text) {
        if (text == null || text.isEmpty()) return "";
        return Entities.escape(text);
    }
}
