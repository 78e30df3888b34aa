package org.netpreserve.sitescraper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitescraper.browser.ChromeRenderer;
import org.netpreserve.sitescraper.browser.RenderException;
import org.netpreserve.sitescraper.browser.Renderer;
import org.netpreserve.sitescraper.config.BrowserConfig;
import org.netpreserve.sitescraper.config.JobConfig;
import org.netpreserve.sitescraper.config.LimitsConfig;
import org.netpreserve.sitescraper.extract.HtmlExtractor;
import org.netpreserve.sitescraper.util.NamedThreadFactory;
import org.netpreserve.sitescraper.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A single crawl: owns the frontier, the workers and every shared resource they use.
 * <p>
 * Typical use is {@code try (var crawl = new Crawl(config)) { crawl.run(); }}.
 */
public class Crawl implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Crawl.class);
    static final int MIN_WORKERS = 2;
    static final int MAX_WORKERS = 32;
    static final Duration POLL_TIMEOUT = Duration.ofMillis(1500);
    private static final Duration PROGRESS_INTERVAL = Duration.ofSeconds(30);

    private final JobConfig config;
    private final Frontier frontier = new Frontier();
    private final CrawlStats stats = new CrawlStats();
    private final PageBudget budget;
    private final ConcurrencyGovernor governor;
    private final DomainAllowlist allowlist;
    private final @Nullable RobotsTxtChecker robotsTxtChecker;
    private final @Nullable Renderer renderer;
    private final Fetcher fetcher;
    private final PageProcessor processor;
    private final Storage storage;
    private final ExecutorService httpExecutor;
    private final HttpClient httpClient;
    private final @Nullable ExecutorService imageExecutor;
    private final ScheduledExecutorService progressScheduler;
    private final List<Worker> workers = new ArrayList<>();
    private final Lock startStopLock = new ReentrantLock();
    private volatile State state = State.NEW;

    public enum State {
        NEW, RUNNING, STOPPING, CLOSED
    }

    public Crawl(JobConfig config) throws IOException, CrawlConfigException {
        this(config, newRenderer(config));
    }

    /**
     * @param renderer browser used when the render policy asks for one, ignored for {@link RenderPolicy#NEVER}
     */
    public Crawl(JobConfig config, @Nullable Renderer renderer) throws IOException, CrawlConfigException {
        validate(config);
        this.config = config;
        var crawlConfig = config.crawl();
        var limits = config.limits();
        this.renderer = crawlConfig.render() == RenderPolicy.NEVER ? null : renderer;

        ObjectMapper mapper = newJsonMapper();
        this.storage = new Storage(config.output(), mapper);
        this.httpExecutor = Executors.newCachedThreadPool(new NamedThreadFactory("http"));
        this.httpClient = HttpClient.newBuilder()
                .executor(httpExecutor)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(crawlConfig.timeout())
                .build();
        this.imageExecutor = crawlConfig.downloadImages()
                ? Executors.newFixedThreadPool(crawlConfig.imageConcurrency(), new NamedThreadFactory("image"))
                : null;
        this.progressScheduler = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("progress"));

        this.budget = new PageBudget(limits.pages());
        this.governor = new ConcurrencyGovernor(limits.concurrency(), limits.perOrigin());
        this.allowlist = new DomainAllowlist(config.scope().allowedDomains());
        this.robotsTxtChecker = crawlConfig.robots()
                ? new RobotsTxtChecker(httpClient, crawlConfig.robotsUserAgents(), crawlConfig.userAgent(),
                crawlConfig.timeout())
                : null;
        this.fetcher = new Fetcher(httpClient, crawlConfig.userAgent(), crawlConfig.timeout(), crawlConfig.render(),
                this.renderer, config.browser().timeout());
        this.processor = new PageProcessor(new HtmlExtractor(mapper), storage, frontier, allowlist, httpClient,
                imageExecutor, crawlConfig.userAgent(), crawlConfig.timeout(), stats);
    }

    private static @Nullable Renderer newRenderer(JobConfig config) {
        if (config.crawl().render() == RenderPolicy.NEVER) return null;
        BrowserConfig browser = config.browser();
        return new ChromeRenderer(browser.executable(), browser.options(), browser.windows());
    }

    static void validate(JobConfig config) throws CrawlConfigException {
        LimitsConfig limits = config.limits();
        if (limits.pages() < 0) throw new CrawlConfigException("max pages must not be negative: " + limits.pages());
        if (limits.depth() < 0) throw new CrawlConfigException("max depth must not be negative: " + limits.depth());
        if (limits.concurrency() < 1) {
            throw new CrawlConfigException("concurrency must be at least 1: " + limits.concurrency());
        }
        if (limits.perOrigin() < 1) {
            throw new CrawlConfigException("per-host concurrency must be at least 1: " + limits.perOrigin());
        }
        if (config.crawl().timeout().isNegative() || config.crawl().timeout().isZero()) {
            throw new CrawlConfigException("timeout must be positive: " + config.crawl().timeout());
        }
        if (config.crawl().delay().isNegative()) {
            throw new CrawlConfigException("delay must not be negative: " + config.crawl().delay());
        }
    }

    public static ObjectMapper newJsonMapper() {
        return new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    static int workerCount(int concurrency) {
        return Math.max(MIN_WORKERS, Math.min(MAX_WORKERS, concurrency));
    }

    /**
     * Normalizes the given addresses and queues them at depth zero. Addresses that do not normalize are skipped.
     *
     * @return the number of addresses queued
     */
    public int seed(Collection<Url> seeds) {
        int queued = 0;
        for (Url seed : seeds) {
            Url url = UrlNormalizer.normalize(seed.toString());
            if (url == null) {
                log.atWarn().addKeyValue("url", seed).log("Skipping invalid seed");
                continue;
            }
            if (frontier.offer(url, 0)) {
                stats.discovered.incrementAndGet();
                queued++;
            }
        }
        return queued;
    }

    /**
     * Queues the configured seeds and starts the workers.
     *
     * @throws CrawlConfigException if no seed is usable or the browser required by the render policy cannot start
     */
    public void start() throws CrawlConfigException {
        startStopLock.lock();
        try {
            if (state != State.NEW) throw new IllegalStateException("Can only start a NEW crawl, not " + state);
            if (config.crawl().render() == RenderPolicy.ALWAYS) {
                if (renderer == null) throw new CrawlConfigException("Render policy 'always' requires a browser");
                try {
                    renderer.ensure();
                } catch (RenderException e) {
                    throw new CrawlConfigException("Browser could not be started: " + e.getMessage(), e);
                }
            }
            seed(config.seeds());
            if (frontier.unfinished() == 0) throw new CrawlConfigException("No valid seed URLs");

            int workerCount = workerCount(config.limits().concurrency());
            for (int i = 0; i < workerCount; i++) {
                workers.add(new Worker(String.valueOf(i), frontier, budget, governor, allowlist, robotsTxtChecker,
                        fetcher, processor, stats, config.limits().depth(), config.crawl().delay(), POLL_TIMEOUT));
            }
            for (Worker worker : workers) {
                worker.start();
            }
            progressScheduler.scheduleAtFixedRate(this::logProgress, PROGRESS_INTERVAL.toMillis(),
                    PROGRESS_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
            state = State.RUNNING;
            log.atInfo().addKeyValue("seeds", frontier.enqueuedCount())
                    .addKeyValue("workers", workerCount)
                    .addKeyValue("maxPages", budget.limit())
                    .addKeyValue("render", config.crawl().render())
                    .log("Crawl started");
        } finally {
            startStopLock.unlock();
        }
    }

    /**
     * Blocks until every queued task has been handled or the crawl is closed.
     *
     * @return true if the frontier drained, false if the crawl was closed first
     */
    public boolean awaitCompletion() throws InterruptedException {
        while (state == State.RUNNING) {
            if (frontier.awaitDrained(Duration.ofSeconds(1))) return true;
        }
        return false;
    }

    /**
     * Starts the crawl and waits for it to finish. The caller still closes the crawl.
     */
    public CrawlStats.Snapshot run() throws CrawlConfigException, InterruptedException {
        start();
        awaitCompletion();
        return stats.snapshot();
    }

    private void logProgress() {
        long active = workerInfo().stream().filter(info -> info.url() != null).count();
        log.atInfo().addKeyValue("processed", budget.processed())
                .addKeyValue("queued", frontier.size())
                .addKeyValue("visited", frontier.visitedCount())
                .addKeyValue("activeWorkers", active)
                .log("Progress");
    }

    @Override
    public void close() {
        startStopLock.lock();
        try {
            if (state == State.CLOSED) return;
            boolean started = state != State.NEW;
            state = State.STOPPING;
            for (Worker worker : workers) {
                worker.closeAsync();
            }
            for (Worker worker : workers) {
                worker.close();
            }
            workers.clear();
            progressScheduler.shutdownNow();
            if (imageExecutor != null) imageExecutor.shutdownNow();
            if (renderer != null) {
                try {
                    renderer.close();
                } catch (RuntimeException e) {
                    log.error("Failed to close renderer", e);
                }
            }
            try {
                storage.close();
            } catch (IOException e) {
                log.error("Failed to close storage", e);
            }
            httpExecutor.shutdownNow();
            state = State.CLOSED;
            if (started) logSummary();
        } finally {
            startStopLock.unlock();
        }
    }

    private void logSummary() {
        var snapshot = stats.snapshot();
        log.atInfo().addKeyValue("processed", snapshot.processed())
                .addKeyValue("failed", snapshot.failed())
                .addKeyValue("discovered", snapshot.discovered())
                .addKeyValue("robotsExcluded", snapshot.robotsExcluded())
                .addKeyValue("outOfScope", snapshot.outOfScope())
                .addKeyValue("tooDeep", snapshot.tooDeep())
                .addKeyValue("rendered", snapshot.rendered())
                .addKeyValue("images", snapshot.images())
                .addKeyValue("output", config.output())
                .log("Crawl finished");
    }

    public Frontier frontier() {
        return frontier;
    }

    public CrawlStats.Snapshot stats() {
        return stats.snapshot();
    }

    public Storage storage() {
        return storage;
    }

    public JobConfig config() {
        return config;
    }

    public State state() {
        return state;
    }

    public List<Worker.Info> workerInfo() {
        List<Worker> workers;
        startStopLock.lock();
        try {
            workers = new ArrayList<>(this.workers);
        } finally {
            startStopLock.unlock();
        }
        List<Worker.Info> infoList = new ArrayList<>(workers.size());
        for (var worker : workers) {
            infoList.add(worker.info());
        }
        return infoList;
    }
}
