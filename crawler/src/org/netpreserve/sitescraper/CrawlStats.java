package org.netpreserve.sitescraper;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Running counters for a crawl, logged as a summary at the end.
 */
public class CrawlStats {
    final AtomicLong discovered = new AtomicLong();
    final AtomicLong processed = new AtomicLong();
    final AtomicLong failed = new AtomicLong();
    final AtomicLong robotsExcluded = new AtomicLong();
    final AtomicLong outOfScope = new AtomicLong();
    final AtomicLong tooDeep = new AtomicLong();
    final AtomicLong rendered = new AtomicLong();
    final AtomicLong images = new AtomicLong();

    public Snapshot snapshot() {
        return new Snapshot(discovered.get(), processed.get(), failed.get(), robotsExcluded.get(),
                outOfScope.get(), tooDeep.get(), rendered.get(), images.get());
    }

    public record Snapshot(long discovered, long processed, long failed, long robotsExcluded, long outOfScope,
                           long tooDeep, long rendered, long images) {
    }
}
