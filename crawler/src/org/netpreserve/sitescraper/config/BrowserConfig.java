package org.netpreserve.sitescraper.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.sitescraper.util.jackson.DurationDeserializer;
import org.netpreserve.sitescraper.util.jackson.OptionListDeserializer;

import java.time.Duration;
import java.util.List;

/**
 * Configuration for the rendering browser.
 *
 * @param executable binary to invoke (e.g. "google-chrome-stable"), null to let the driver find one
 * @param options    command-line options
 * @param windows    number of pages that may be rendered simultaneously
 * @param timeout    navigation timeout for a single render
 */
public record BrowserConfig(
        String executable,
        @JsonDeserialize(using = OptionListDeserializer.class)
        List<String> options,
        int windows,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration timeout
) {
    public BrowserConfig {
        if (options == null) options = List.of("--headless=new", "--disable-gpu");
        if (windows < 1) windows = 1;
        if (timeout == null) timeout = Duration.ofSeconds(30);
    }
}
