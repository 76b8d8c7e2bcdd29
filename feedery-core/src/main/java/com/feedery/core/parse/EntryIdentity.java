package com.feedery.core.parse;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.Normalizer;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Entry identity policy, in priority order:
 * <ol>
 *   <li>the feed-provided unique id (guid, atom:id, rdf:about)</li>
 *   <li>a fingerprint of the normalized link and normalized title</li>
 *   <li>a fingerprint of the normalized title and the publish timestamp</li>
 *   <li>a fingerprint of the summary text</li>
 * </ol>
 * Fingerprints never include the feed URL, so the same item cross-posted to two feeds collides.
 */
public final class EntryIdentity {

    private EntryIdentity() {
    }

    /**
     * @param rawTimestamp the publish timestamp as the feed supplied it (ISO form), updated only when unpublished, or null
     * @return the identity, or null when nothing usable is present
     */
    public static String resolve(String explicitId, String link, String title, String rawTimestamp, String summary) {
        if (explicitId != null && !explicitId.isBlank()) {
            return explicitId.trim();
        }
        String normTitle = normalizeTitle(title);
        if (link != null && !link.isBlank()) {
            return fingerprint("link", normalizeLink(link), normTitle);
        }
        if (!normTitle.isEmpty()) {
            return fingerprint("title", normTitle, rawTimestamp != null ? rawTimestamp : "");
        }
        String normSummary = normalizeTitle(summary);
        if (!normSummary.isEmpty()) {
            return fingerprint("summary", normSummary);
        }
        return null;
    }

    /**
     * Lowercase scheme and host, drop default ports and fragments, and give an empty path "/".
     */
    public static String normalizeLink(String link) {
        String trimmed = link.trim();
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                return trimmed;
            }
            String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
            String host = uri.getHost().toLowerCase(Locale.ROOT);
            int port = uri.getPort();
            if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
                port = -1;
            }
            String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
            StringBuilder sb = new StringBuilder(scheme).append("://").append(host);
            if (port != -1) sb.append(':').append(port);
            sb.append(path);
            if (uri.getRawQuery() != null) sb.append('?').append(uri.getRawQuery());
            return sb.toString();
        } catch (URISyntaxException e) {
            return trimmed;
        }
    }

    /** NFKC, collapsed whitespace, lowercase. */
    public static String normalizeTitle(String title) {
        if (title == null) return "";
        String text = Normalizer.normalize(title, Normalizer.Form.NFKC);
        return text.replaceAll("\\s+", " ").trim().toLowerCase(Locale.ROOT);
    }

    static String fingerprint(String kind, String... parts) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(kind.getBytes(StandardCharsets.UTF_8));
            for (String part : parts) {
                digest.update((byte) 0);
                digest.update(part.getBytes(StandardCharsets.UTF_8));
            }
            return "urn:feedery:" + HexFormat.of().formatHex(digest.digest()).substring(0, 32);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
