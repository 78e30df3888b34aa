package org.netpreserve.sitescraper;

import org.netpreserve.sitescraper.util.Url;

/**
 * An address waiting in the frontier together with its link distance from the nearest seed.
 */
public record CrawlTask(Url url, int depth) {
}
