package org.netpreserve.sitescraper;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * When a fetched document should be re-obtained through the browser.
 */
public enum RenderPolicy {
    /**
     * Use the raw HTTP response as-is.
     */
    NEVER,
    /**
     * Always render and prefer the browser's output.
     */
    ALWAYS,
    /**
     * Render only when the raw response is missing or looks client-rendered.
     */
    AUTO;

    @JsonCreator
    public static RenderPolicy fromString(String value) {
        return value == null ? null : valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
