package org.netpreserve.sitescraper;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitescraper.util.Url;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Turns links found in pages into canonical, fetchable addresses.
 * <p>
 * A link is resolved against the address of the page it was found on and brought into WHATWG canonical form, so
 * host case, default ports and empty paths don't produce duplicates. Its fragment is dropped and any well-known
 * tracking parameters are removed from the query. The remaining query parameters keep their original order and
 * encoding. Normalizing an already normalized address returns it unchanged.
 */
public final class UrlNormalizer {
    static final Set<String> TRACKING_PARAMS = Set.of(
            "utm_source",
            "utm_medium",
            "utm_campaign",
            "utm_term",
            "utm_content",
            "gclid",
            "fbclid",
            "mc_eid");

    private static final Pattern UNFETCHABLE_SCHEME = Pattern.compile("^\\s*(javascript|mailto|tel|data):",
            Pattern.CASE_INSENSITIVE);

    private UrlNormalizer() {
    }

    /**
     * Returns the canonical form of {@code href} relative to {@code base}, or null if it has no fetchable form.
     */
    public static @Nullable Url normalize(Url base, @Nullable String href) {
        if (href == null) return null;
        href = href.trim();
        if (href.isEmpty() || UNFETCHABLE_SCHEME.matcher(href).find()) return null;

        Url absolute;
        try {
            absolute = base.whatwg().resolve(href).whatwg();
        } catch (IllegalArgumentException e) {
            // malformed internationalized host name
            return null;
        }
        if (!absolute.isHttp() || absolute.host().isEmpty()) return null;
        return absolute.withQueryWithoutFragment(stripTrackingParams(absolute.query()));
    }

    public static @Nullable Url normalize(String url) {
        return normalize(new Url(url), url);
    }

    static String stripTrackingParams(@Nullable String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) return "";
        var joiner = new StringJoiner("&");
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) continue;
            int equals = pair.indexOf('=');
            String rawName = equals == -1 ? pair : pair.substring(0, equals);
            if (rawName.isEmpty()) continue;
            String name = decode(rawName).toLowerCase(Locale.ROOT);
            if (TRACKING_PARAMS.contains(name)) continue;
            joiner.add(equals == -1 ? pair + "=" : pair);
        }
        return joiner.toString();
    }

    private static String decode(String component) {
        try {
            return URLDecoder.decode(component, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return component;
        }
    }
}
