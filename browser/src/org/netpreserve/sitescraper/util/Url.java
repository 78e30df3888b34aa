package org.netpreserve.sitescraper.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.netpreserve.urlcanon.Canonicalizer;
import org.netpreserve.urlcanon.ParsedUrl;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * URL type which caches parsing.
 */
public class Url {
    private static final String URI_CHARS = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789" +
                                            "-._~:/?#[]@!$&'()*+,;=%";
    private final String url;
    private URI uri;
    private ParsedUrl parsedUrl;

    @JsonCreator
    public Url(String url) {
        this.url = url;
    }

    private Url(ParsedUrl parsedUrl) {
        this(parsedUrl.toString());
        this.parsedUrl = parsedUrl;
    }

    /**
     * Converts to a {@link URI}, percent-encoding characters such as spaces, '|' or '{' which browsers accept in
     * URLs but {@link URI} does not.
     */
    public synchronized URI toURI() throws URISyntaxException {
        if (uri == null) {
            try {
                uri = new URI(url);
            } catch (URISyntaxException e) {
                uri = new URI(escapeForUri(url));
            }
        }
        return uri;
    }

    static String escapeForUri(String url) {
        var builder = new StringBuilder(url.length() + 16);
        url.codePoints().forEach(codePoint -> {
            if (codePoint < 128 && URI_CHARS.indexOf(codePoint) != -1) {
                builder.appendCodePoint(codePoint);
                return;
            }
            for (byte b : new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8)) {
                builder.append('%').append(String.format("%02X", b & 0xff));
            }
        });
        return builder.toString();
    }

    private ParsedUrl parse() {
        if (parsedUrl == null) {
            parsedUrl = ParsedUrl.parseUrl(url);
        }
        return parsedUrl;
    }

    public String scheme() {
        return parse().getScheme().toLowerCase(Locale.ROOT);
    }

    public String host() {
        return parse().getHost().toLowerCase(Locale.ROOT);
    }

    /**
     * Scheme, host and explicit port, e.g. "https://example.org:8443".
     */
    public String origin() {
        ParsedUrl parsed = parse();
        return scheme() + "://" + host() + parsed.getColonBeforePort() + parsed.getPort();
    }

    public static String reverseHost(String host) {
        if (host == null) return null;
        if (host.startsWith("[")) return host;
        var builder = new StringBuilder();
        String[] segments = host.split("\\.");
        for (int i = segments.length - 1; i >= 0; i--) {
            builder.append(segments[i]);
            builder.append(",");
        }
        return builder.toString();
    }

    @JsonValue
    public String toString() {
        return url;
    }

    private static boolean startsWithIgnoreCase(String str, String prefix) {
        return str.regionMatches(true, 0, prefix, 0, prefix.length());
    }

    public boolean isHttp() {
        return startsWithIgnoreCase(url, "http:") ||
               startsWithIgnoreCase(url, "https:");
    }

    public Url withPath(String path) {
        ParsedUrl parsed = parse();
        return new Url(parsed.getScheme() + parsed.getColonAfterScheme() + parsed.getSlashes() +
                       parsed.getHost() + parsed.getColonBeforePort() + parsed.getPort() + path);
    }

    /**
     * Resolves a possibly relative reference against this URL.
     */
    public Url resolve(String reference) {
        return new Url(parse().resolve(ParsedUrl.parseUrl(reference)));
    }

    /**
     * Canonical form as a browser would request it: lowercase scheme and host, default port removed, empty path
     * replaced by '/', dot segments resolved and unsafe characters percent-encoded.
     */
    public Url whatwg() {
        ParsedUrl copy = new ParsedUrl(parse());
        Canonicalizer.WHATWG.canonicalize(copy);
        copy.setHost(copy.getHost().toLowerCase(Locale.ROOT));
        return new Url(copy);
    }

    /**
     * Returns a copy with the fragment removed and the query replaced. An empty query removes the '?' as well.
     */
    public Url withQueryWithoutFragment(String query) {
        ParsedUrl copy = new ParsedUrl(parse());
        copy.setHashSign("");
        copy.setFragment("");
        copy.setQuestionMark(query.isEmpty() ? "" : "?");
        copy.setQuery(query);
        return new Url(copy);
    }

    public String query() {
        return parse().getQuery();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Url url1 = (Url) o;
        return url.equals(url1.url);
    }

    @Override
    public int hashCode() {
        return url.hashCode();
    }
}
