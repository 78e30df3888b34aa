package org.netpreserve.sitescraper;

/**
 * The crawl cannot start with the given configuration.
 */
public class CrawlConfigException extends Exception {
    public CrawlConfigException(String message) {
        super(message);
    }

    public CrawlConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
