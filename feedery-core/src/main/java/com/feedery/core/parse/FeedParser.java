package com.feedery.core.parse;

import com.feedery.core.model.Entry;
import com.feedery.core.model.FeedFormat;
import com.feedery.core.model.ParseResult;
import com.feedery.core.model.Source;
import com.rometools.rome.feed.WireFeed;
import com.rometools.rome.feed.rss.Guid;
import com.rometools.rome.feed.rss.Item;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.feed.synd.SyndFeedImpl;
import com.rometools.rome.feed.synd.SyndLink;
import com.rometools.rome.feed.synd.SyndPerson;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.ParsingFeedException;
import com.rometools.rome.io.WireFeedInput;
import com.rometools.rome.io.XmlReader;
import com.rometools.rome.io.XmlReaderException;
import okhttp3.MediaType;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.net.URI;
import java.nio.charset.Charset;
import java.time.Instant;
import java.util.*;

/**
 * Converts raw RSS 1.0 / RSS 2.0 / Atom bytes into canonical {@link Entry} records.
 * <p>
 * ROME sniffs the root element and picks the wire format; every variant then goes through
 * one extraction routine. Recoverable problems (encoding coercion, repaired XML, missing
 * optional elements, sanitized markup) yield {@link ParseResult.PartialOk}; a document that
 * is not XML or has no feed root yields {@link ParseResult.Failed}.
 */
public class FeedParser {

    private static final Logger log = LoggerFactory.getLogger(FeedParser.class);

    public ParseResult parse(byte[] body, String contentType, Source source, Instant fetchTime) {
        return parse(body, contentType, source, source.url(), fetchTime);
    }

    /**
     * @param documentUrl URL the bytes were served from, used to resolve relative links
     * @param fetchTime   stands in for missing timestamps and bounds future-dated ones
     */
    public ParseResult parse(byte[] body, String contentType, Source source, String documentUrl, Instant fetchTime) {
        if (body == null || body.length == 0) {
            return new ParseResult.Failed("empty document");
        }

        List<String> warnings = new ArrayList<>();
        String text;
        try {
            text = decode(body, contentType, warnings);
        } catch (IOException e) {
            return new ParseResult.Failed("undecodable document: " + e.getMessage());
        }

        WireFeed wireFeed;
        try {
            wireFeed = build(text);
        } catch (ParsingFeedException e) {
            String repaired = repair(text);
            try {
                wireFeed = build(repaired);
                warnings.add("repaired malformed XML: " + e.getMessage());
            } catch (ParsingFeedException retry) {
                return new ParseResult.Failed("not valid XML: " + e.getMessage());
            } catch (IllegalArgumentException | FeedException retry) {
                return new ParseResult.Failed("no recognizable feed root element");
            }
        } catch (IllegalArgumentException e) {
            return new ParseResult.Failed("no recognizable feed root element");
        } catch (FeedException e) {
            return new ParseResult.Failed("unreadable feed: " + e.getMessage());
        }

        FeedFormat format = FeedFormat.fromFeedType(wireFeed.getFeedType());
        if (format == FeedFormat.UNKNOWN) {
            return new ParseResult.Failed("unsupported feed type " + wireFeed.getFeedType());
        }

        SyndFeed feed = new SyndFeedImpl(wireFeed, true);
        URI base = baseUri(documentUrl);

        List<Entry> entries = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int position = 0;
        for (SyndEntry syndEntry : feed.getEntries()) {
            position++;
            Entry entry = extract(syndEntry, format, source, base, fetchTime, position, warnings);
            if (entry == null) continue;
            if (!seen.add(entry.id())) {
                warnings.add("item " + position + ": duplicate id " + entry.id() + " ignored");
                continue;
            }
            entries.add(entry);
        }

        log.debug("Parsed {} entries ({}) from <{}>", entries.size(), format, source.url());

        if (warnings.isEmpty()) {
            return new ParseResult.Ok(format, entries);
        }
        return new ParseResult.PartialOk(format, entries, warnings);
    }

    // ==================== Shared extraction ====================

    private Entry extract(SyndEntry syndEntry, FeedFormat format, Source source, URI base,
                          Instant fetchTime, int position, List<String> warnings) {
        String title = HtmlSanitizer.toText(syndEntry.getTitle());
        String link = resolveLink(base, firstLink(syndEntry));

        String summary = markup(syndEntry.getDescription(), position, warnings);
        String content = contents(syndEntry.getContents(), position, warnings);

        // Ordering follows the latest revision; identity must not move when an entry is edited
        Date published = syndEntry.getPublishedDate();
        Date updated = syndEntry.getUpdatedDate();
        Date feedDate = updated != null ? updated : published;
        Date identityDate = published != null ? published : updated;
        String rawTimestamp = identityDate != null ? identityDate.toInstant().toString() : null;

        String id = EntryIdentity.resolve(
            explicitId(format, syndEntry.getWireEntry()),
            link,
            title,
            rawTimestamp,
            HtmlSanitizer.toText(summary.isEmpty() ? content : summary)
        );
        if (id == null) {
            warnings.add("item " + position + ": no id, link, title or summary, ignored");
            return null;
        }

        if (title.isEmpty()) {
            warnings.add("item " + position + ": missing title");
        }

        Instant publishedAt;
        boolean inferred;
        if (feedDate == null) {
            warnings.add("item " + position + ": missing date, using first-seen time");
            publishedAt = fetchTime;
            inferred = true;
        } else if (feedDate.toInstant().isAfter(fetchTime)) {
            publishedAt = fetchTime;
            inferred = true;
        } else {
            publishedAt = feedDate.toInstant();
            inferred = false;
        }

        return Entry.builder()
            .id(id)
            .title(title)
            .link(link)
            .author(author(syndEntry))
            .summary(summary)
            .content(content)
            .publishedAt(publishedAt)
            .dateInferred(inferred)
            .firstSeenAt(fetchTime)
            .sourceUrl(source.url())
            .sourceName(source.name())
            .build();
    }

    /** The id the feed itself declares: RSS guid, RSS 1.0 rdf:about, or atom:id. */
    static String explicitId(FeedFormat format, Object wireEntry) {
        if (format == FeedFormat.ATOM && wireEntry instanceof com.rometools.rome.feed.atom.Entry atomEntry) {
            return atomEntry.getId();
        }
        if (wireEntry instanceof Item item) {
            if (format == FeedFormat.RSS1) {
                return item.getUri();
            }
            Guid guid = item.getGuid();
            return guid != null ? guid.getValue() : null;
        }
        return null;
    }

    private String markup(SyndContent content, int position, List<String> warnings) {
        if (content == null || content.getValue() == null || content.getValue().isBlank()) {
            return "";
        }
        String value = content.getValue();
        String type = content.getType();
        if ("text".equals(type) || "text/plain".equals(type)) {
            return HtmlSanitizer.escape(value.trim());
        }
        if (!HtmlSanitizer.isClean(value)) {
            warnings.add("item " + position + ": sanitized markup");
        }
        return HtmlSanitizer.clean(value);
    }

    private String contents(List<SyndContent> contents, int position, List<String> warnings) {
        if (contents == null || contents.isEmpty()) return "";
        StringBuilder sb = new StringBuilder();
        for (SyndContent content : contents) {
            sb.append(markup(content, position, warnings));
        }
        return sb.toString();
    }

    private static String firstLink(SyndEntry entry) {
        if (entry.getLink() != null && !entry.getLink().isBlank()) {
            return entry.getLink().trim();
        }
        List<SyndLink> links = entry.getLinks();
        if (links != null) {
            for (SyndLink link : links) {
                if (link.getHref() != null && !link.getHref().isBlank()) {
                    return link.getHref().trim();
                }
            }
        }
        return null;
    }

    private static String resolveLink(URI base, String link) {
        if (link == null) return null;
        if (base == null) return link;
        try {
            return base.resolve(link).toString();
        } catch (IllegalArgumentException e) {
            return link;
        }
    }

    private static String author(SyndEntry entry) {
        String author = entry.getAuthor();
        if (author != null && !author.isBlank()) {
            return author.trim();
        }
        List<SyndPerson> authors = entry.getAuthors();
        if (authors != null) {
            for (SyndPerson person : authors) {
                if (person.getName() != null && !person.getName().isBlank()) {
                    return person.getName().trim();
                }
            }
        }
        return null;
    }

    // ==================== Document handling ====================

    private static WireFeed build(String xml) throws FeedException {
        WireFeedInput input = new WireFeedInput(false, Locale.US);
        input.setXmlHealerOn(true);
        input.setAllowDoctypes(true);
        return input.build(new StringReader(xml));
    }

    /** Re-serialize through jsoup's lenient XML parser, closing unbalanced tags. */
    private static String repair(String xml) {
        Document doc = Jsoup.parse(xml, "", Parser.xmlParser());
        doc.outputSettings().prettyPrint(false).charset("UTF-8");
        return doc.outerHtml();
    }

    /**
     * Decodes through ROME's {@link XmlReader} (BOM, XML prolog and HTTP charset per RFC 3023).
     * A document that only decodes in lenient mode, or whose prolog overrides the HTTP charset,
     * is reported as an encoding coercion.
     */
    private static String decode(byte[] body, String contentType, List<String> warnings) throws IOException {
        try {
            open(body, contentType, false).close();
        } catch (XmlReaderException e) {
            warnings.add("encoding coercion: " + e.getMessage());
        }

        try (XmlReader reader = open(body, contentType, true)) {
            String encoding = reader.getEncoding();
            Charset declared = httpCharset(contentType);
            if (declared != null && Charset.isSupported(encoding) && !declared.equals(Charset.forName(encoding))) {
                warnings.add("encoding coercion: HTTP charset " + declared.name() + ", decoded as " + encoding);
            }

            StringWriter out = new StringWriter();
            reader.transferTo(out);
            String text = out.toString();
            if (text.indexOf('\uFFFD') >= 0) {
                warnings.add("invalid " + encoding + " byte sequences replaced");
            }
            return text;
        }
    }

    private static XmlReader open(byte[] body, String contentType, boolean lenient) throws IOException {
        InputStream in = new ByteArrayInputStream(body);
        return contentType == null ? new XmlReader(in, lenient) : new XmlReader(in, contentType, lenient);
    }

    private static Charset httpCharset(String contentType) {
        if (contentType == null) return null;
        MediaType mediaType = MediaType.parse(contentType);
        return mediaType != null ? mediaType.charset() : null;
    }

    private static URI baseUri(String documentUrl) {
        if (documentUrl == null) return null;
        try {
            return URI.create(documentUrl);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
