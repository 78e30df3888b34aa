package org.netpreserve.sitescraper;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitescraper.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;

/**
 * Takes tasks from the frontier and runs each through the admission checks, the fetcher and the page processor.
 */
public class Worker {
    private static final Logger log = LoggerFactory.getLogger(Worker.class);
    final String id;
    private final Frontier frontier;
    private final PageBudget budget;
    private final ConcurrencyGovernor governor;
    private final DomainAllowlist allowlist;
    private final @Nullable RobotsTxtChecker robotsTxtChecker;
    private final Fetcher fetcher;
    private final PageProcessor processor;
    private final CrawlStats stats;
    private final int maxDepth;
    private final Duration delay;
    private final Duration pollTimeout;
    private Thread thread;
    private volatile boolean closed = false;
    private volatile Info info;

    /**
     * @param robotsTxtChecker null when robots.txt is not consulted
     */
    public Worker(String id, Frontier frontier, PageBudget budget, ConcurrencyGovernor governor,
                  DomainAllowlist allowlist, @Nullable RobotsTxtChecker robotsTxtChecker, Fetcher fetcher,
                  PageProcessor processor, CrawlStats stats, int maxDepth, Duration delay, Duration pollTimeout) {
        this.id = id;
        this.frontier = frontier;
        this.budget = budget;
        this.governor = governor;
        this.allowlist = allowlist;
        this.robotsTxtChecker = robotsTxtChecker;
        this.fetcher = fetcher;
        this.processor = processor;
        this.stats = stats;
        this.maxDepth = maxDepth;
        this.delay = delay;
        this.pollTimeout = pollTimeout;
        info = new Info(id, null, Instant.now());
    }

    void closeAsync() {
        closed = true;
        if (thread != null) thread.interrupt();
    }

    void close() {
        closeAsync();
        if (thread == null) return;
        try {
            thread.join(10000);
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for worker {} to finish", id);
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) log.warn("Worker {} did not finish in time", id);
    }

    void run() throws InterruptedException {
        while (!closed) {
            CrawlTask task = frontier.poll(pollTimeout);
            if (task == null) {
                if (budget.exhausted()) {
                    log.debug("Page budget exhausted and no work available, worker {} exiting", id);
                    return;
                }
                continue;
            }
            updateInfo(new Info(id, task.url(), Instant.now()));
            try {
                handle(task);
            } catch (RuntimeException e) {
                stats.failed.incrementAndGet();
                log.atError().addKeyValue("url", task.url()).log("Unexpected error processing page", e);
            } finally {
                frontier.taskDone();
                updateInfo(new Info(id, null, Instant.now()));
            }
        }
    }

    /**
     * Runs one task. Checks happen in a fixed order: budget, visited, depth, scope, robots.txt.
     */
    void handle(CrawlTask task) throws InterruptedException {
        Url url = task.url();
        if (budget.exhausted()) return;
        if (frontier.isVisited(url)) return;
        if (task.depth() > maxDepth) {
            stats.tooDeep.incrementAndGet();
            log.atDebug().addKeyValue("url", url).addKeyValue("depth", task.depth()).log("Too deep");
            return;
        }
        if (!allowlist.test(url)) {
            stats.outOfScope.incrementAndGet();
            log.atDebug().addKeyValue("url", url).log("Out of scope");
            return;
        }
        if (robotsTxtChecker != null && !robotsTxtChecker.allowed(url)) {
            stats.robotsExcluded.incrementAndGet();
            log.atInfo().addKeyValue("url", url).log("Excluded by robots.txt");
            return;
        }
        if (!budget.reserve()) return;

        boolean committed = false;
        try {
            if (!frontier.markVisited(url)) return;
            try (var permit = governor.acquire(url)) {
                if (!delay.isZero()) Thread.sleep(delay.toMillis());
                log.atDebug().addKeyValue("url", url).addKeyValue("origin", permit.origin()).log("Fetching");
                FetchResult result = fetcher.fetch(url);
                if (result instanceof FetchResult.NotFetched notFetched) {
                    stats.failed.incrementAndGet();
                    log.atWarn().addKeyValue("url", url).log("Not fetched: {}", notFetched.reason());
                    return;
                }
                var fetched = (FetchResult.Fetched) result;
                processor.process(task, fetched);
                budget.commit();
                committed = true;
                stats.processed.incrementAndGet();
                if (fetched.rendered()) stats.rendered.incrementAndGet();
            }
        } catch (IOException e) {
            stats.failed.incrementAndGet();
            log.atError().addKeyValue("url", url).log("Failed to process page", e);
        } finally {
            if (!committed) budget.cancel();
        }
    }

    private void updateInfo(Info info) {
        this.info = info;
    }

    public synchronized void start() {
        log.info("Starting worker {}", id);
        thread = new Thread(() -> {
            try {
                run();
            } catch (InterruptedException e) {
                log.debug("Worker {} interrupted", id);
            } catch (Exception e) {
                log.error("Worker crashed", e);
            }
        }, "Worker-" + id);
        thread.start();
    }

    public record Info(
            String id,
            @Nullable Url url,
            Instant updateTime) {
    }

    public Info info() {
        return info;
    }
}
