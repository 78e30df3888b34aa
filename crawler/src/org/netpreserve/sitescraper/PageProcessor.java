package org.netpreserve.sitescraper;

import com.fasterxml.uuid.Generators;
import com.fasterxml.uuid.impl.TimeBasedEpochGenerator;
import org.jetbrains.annotations.Nullable;
import org.jsoup.nodes.Document;
import org.netpreserve.sitescraper.extract.HtmlExtractor;
import org.netpreserve.sitescraper.util.Filenames;
import org.netpreserve.sitescraper.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Extracts and stores a fetched page and feeds the links it contains back into the frontier.
 */
public class PageProcessor {
    private static final Logger log = LoggerFactory.getLogger(PageProcessor.class);
    private final HtmlExtractor extractor;
    private final Storage storage;
    private final Frontier frontier;
    private final DomainAllowlist allowlist;
    private final HttpClient httpClient;
    private final @Nullable ExecutorService imageExecutor;
    private final String userAgent;
    private final Duration timeout;
    private final CrawlStats stats;
    private final TimeBasedEpochGenerator uuidGenerator = Generators.timeBasedEpochGenerator();

    /**
     * @param imageExecutor pool that bounds concurrent image downloads, or null to skip images entirely
     */
    public PageProcessor(HtmlExtractor extractor, Storage storage, Frontier frontier, DomainAllowlist allowlist,
                         HttpClient httpClient, @Nullable ExecutorService imageExecutor, String userAgent,
                         Duration timeout, CrawlStats stats) {
        this.extractor = extractor;
        this.storage = storage;
        this.frontier = frontier;
        this.allowlist = allowlist;
        this.httpClient = httpClient;
        this.imageExecutor = imageExecutor;
        this.userAgent = userAgent;
        this.timeout = timeout;
        this.stats = stats;
    }

    public PageRecord process(CrawlTask task, FetchResult.Fetched fetched) throws IOException, InterruptedException {
        Url url = task.url();
        String html = fetched.content();
        Document doc = extractor.parse(html, url);
        var metadata = extractor.metadata(doc);
        String text = extractor.text(doc);
        var structuredData = extractor.structuredData(doc);
        List<String> links = extractor.links(doc);
        List<String> nextLinks = extractor.paginationHints(doc);
        List<String> imageSources = imageExecutor == null ? List.of() : extractor.imageSources(doc);

        Path htmlPath = storage.saveDocument(url, html);
        List<PageRecord.Image> images = downloadImages(imageSources, fetched.contentDisposition());

        var record = new PageRecord(uuidGenerator.generate(), url, task.depth(), fetched.rendered(), Instant.now(),
                htmlPath.toString(), metadata, structuredData, text, links, nextLinks, images);
        storage.appendRecord(record);

        var discovered = new ArrayList<String>(links.size() + nextLinks.size());
        discovered.addAll(links);
        discovered.addAll(nextLinks);
        int queued = enqueueLinks(url, task.depth() + 1, discovered);

        log.atInfo().addKeyValue("url", url)
                .addKeyValue("depth", task.depth())
                .addKeyValue("rendered", fetched.rendered())
                .addKeyValue("links", discovered.size())
                .addKeyValue("queued", queued)
                .addKeyValue("images", images.size())
                .log("Processed page");
        return record;
    }

    /**
     * Normalizes each link and queues those that are new and within the allowed domains.
     *
     * @return the number of links queued
     */
    int enqueueLinks(Url page, int depth, List<String> hrefs) {
        int queued = 0;
        for (String href : hrefs) {
            Url link = UrlNormalizer.normalize(page, href);
            if (link == null) continue;
            if (frontier.isVisited(link) || frontier.isEnqueued(link)) continue;
            if (!allowlist.test(link)) {
                stats.outOfScope.incrementAndGet();
                continue;
            }
            if (frontier.offer(link, depth)) {
                stats.discovered.incrementAndGet();
                queued++;
            }
        }
        return queued;
    }

    private List<PageRecord.Image> downloadImages(List<String> sources, @Nullable String pageContentDisposition)
            throws InterruptedException {
        if (sources.isEmpty() || imageExecutor == null) return List.of();
        var downloads = new ArrayList<Callable<PageRecord.Image>>(sources.size());
        for (String source : sources) {
            downloads.add(() -> new PageRecord.Image(source, downloadImage(source, pageContentDisposition)));
        }
        var images = new ArrayList<PageRecord.Image>(sources.size());
        List<Future<PageRecord.Image>> futures = imageExecutor.invokeAll(downloads);
        for (int i = 0; i < futures.size(); i++) {
            try {
                images.add(futures.get(i).get());
            } catch (ExecutionException e) {
                log.atWarn().addKeyValue("url", sources.get(i)).log("Image download failed", e.getCause());
                images.add(new PageRecord.Image(sources.get(i), null));
            }
        }
        return images;
    }

    private @Nullable String downloadImage(String source, @Nullable String pageContentDisposition)
            throws InterruptedException {
        Url url = new Url(source);
        try {
            var response = httpClient.send(HttpRequest.newBuilder(url.toURI())
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .build(), BodyHandlers.ofByteArray());
            if (response.statusCode() != 200 || response.body().length == 0) {
                log.atDebug().addKeyValue("url", url).addKeyValue("status", response.statusCode()).log("Image not saved");
                return null;
            }
            String contentDisposition = response.headers().firstValue("Content-Disposition")
                    .orElse(pageContentDisposition);
            Path path = storage.saveBinary(url, response.body(), Filenames.guess(url, contentDisposition));
            stats.images.incrementAndGet();
            return path.toString();
        } catch (URISyntaxException | IllegalArgumentException e) {
            log.atDebug().addKeyValue("url", source).log("Invalid image URL");
            return null;
        } catch (IOException e) {
            log.atDebug().addKeyValue("url", url).log("Image download failed: {}", e.toString());
            return null;
        }
    }
}
