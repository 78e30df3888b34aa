package org.netpreserve.sitescraper.config;

/**
 * Global crawl limits.
 *
 * @param pages       maximum number of pages to process
 * @param depth       maximum link distance from any seed
 * @param concurrency maximum number of fetches in flight across all origins
 * @param perOrigin   maximum number of fetches in flight against a single origin
 */
public record LimitsConfig(
        long pages,
        int depth,
        int concurrency,
        int perOrigin
) {
}
