package org.netpreserve.sitescraper;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Guesses whether a document is an empty shell that scripts fill in on the client.
 */
public final class RenderHeuristic {
    static final int MIN_TEXT_LENGTH = 400;
    static final int MIN_SCRIPTS = 5;
    static final List<String> SPA_MARKERS = List.of(
            "id=\"__next\"",
            "data-reactroot",
            "ng-version",
            "id=\"app\"",
            "id=\"root\"");

    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SCRIPT_OPEN = Pattern.compile("<script[\\s>]", Pattern.CASE_INSENSITIVE);

    private RenderHeuristic() {
    }

    /**
     * True if the page has little text but many scripts, or carries the root element of a known client-side
     * framework.
     */
    public static boolean looksClientRendered(String html) {
        if (html == null) return true;
        for (String marker : SPA_MARKERS) {
            if (html.contains(marker)) return true;
        }
        int textLength = WHITESPACE.matcher(TAG.matcher(html).replaceAll("")).replaceAll("").length();
        return textLength < MIN_TEXT_LENGTH && countScripts(html) >= MIN_SCRIPTS;
    }

    static int countScripts(String html) {
        Matcher matcher = SCRIPT_OPEN.matcher(html);
        int count = 0;
        while (matcher.find()) count++;
        return count;
    }
}
