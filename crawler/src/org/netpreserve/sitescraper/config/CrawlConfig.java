package org.netpreserve.sitescraper.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.sitescraper.RenderPolicy;
import org.netpreserve.sitescraper.util.jackson.DurationDeserializer;

import java.time.Duration;
import java.util.List;

/**
 * Configuration for how the crawl should behave.
 *
 * @param userAgent        User-Agent string to identify as to servers
 * @param robotsUserAgents product tokens matched against robots.txt User-agent lines
 * @param robots           whether to obey robots.txt
 * @param render           when to render pages in the browser
 * @param downloadImages   whether to save the images a page references
 * @param delay            pause before each page fetch, taken while holding the origin's permit
 * @param timeout          HTTP request and browser navigation timeout
 * @param imageConcurrency maximum number of image downloads in flight
 */
public record CrawlConfig(
        String userAgent,
        List<String> robotsUserAgents,
        boolean robots,
        RenderPolicy render,
        boolean downloadImages,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration delay,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration timeout,
        int imageConcurrency
) {
    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (compatible; SiteScraper/1.0; +https://example.com/bot)";

    public CrawlConfig {
        if (userAgent == null || userAgent.isBlank()) userAgent = DEFAULT_USER_AGENT;
        if (robotsUserAgents == null) robotsUserAgents = List.of();
        if (render == null) render = RenderPolicy.AUTO;
        if (delay == null) delay = Duration.ZERO;
        if (timeout == null) timeout = Duration.ofSeconds(20);
        if (imageConcurrency < 1) imageConcurrency = 8;
    }
}
