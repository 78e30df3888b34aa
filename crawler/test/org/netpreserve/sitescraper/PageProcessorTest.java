package org.netpreserve.sitescraper;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.netpreserve.sitescraper.extract.HtmlExtractor;
import org.netpreserve.sitescraper.util.NamedThreadFactory;
import org.netpreserve.sitescraper.util.Url;

import java.nio.file.Files;
import java.nio.file.Path;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class PageProcessorTest {
    @TempDir
    Path tempDir;
    private TestSite site;
    private Storage storage;
    private ExecutorService imageExecutor;
    private final Frontier frontier = new Frontier();
    private final CrawlStats stats = new CrawlStats();
    private final HttpClient httpClient = HttpClient.newHttpClient();

    @BeforeEach
    void setUp() throws Exception {
        site = new TestSite()
                .respond("/img/logo.png", 200, "image/png", new byte[]{9, 8, 7}, Map.of())
                .respond("/img/empty.png", 200, "image/png", new byte[0], Map.of());
        storage = new Storage(tempDir, Crawl.newJsonMapper());
        imageExecutor = Executors.newFixedThreadPool(2, new NamedThreadFactory("image"));
    }

    @AfterEach
    void tearDown() throws Exception {
        imageExecutor.shutdownNow();
        storage.close();
        site.close();
    }

    private PageProcessor processor(ExecutorService images) {
        return new PageProcessor(new HtmlExtractor(Crawl.newJsonMapper()), storage, frontier,
                new DomainAllowlist(List.of(site.host())), httpClient, images, "test-agent", Duration.ofSeconds(5),
                stats);
    }

    private String page() {
        return "<html><head><title>Home</title></head><body>"
               + "<a href=\"/a?utm_source=feed#top\">A</a>"
               + "<a href=\"/a\">A again</a>"
               + "<a href=\"/b\">B</a>"
               + "<a href=\"/seen\">Seen</a>"
               + "<a href=\"http://elsewhere.example/x\">External</a>"
               + "<a href=\"javascript:void(0)\">Script</a>"
               + "<a href=\"/older\">Older posts</a>"
               + "<img src=\"/img/logo.png\"><img src=\"/img/missing.png\"><img src=\"/img/empty.png\">"
               + "</body></html>";
    }

    @Test
    public void testProcess() throws Exception {
        frontier.markVisited(site.url("/seen"));
        Url pageUrl = site.url("/");
        var record = processor(imageExecutor).process(new CrawlTask(pageUrl, 2),
                new FetchResult.Fetched(page(), null, false));

        assertEquals(pageUrl, record.url());
        assertEquals(2, record.depth());
        assertEquals("Home", record.metadata().get("title"));
        assertEquals(List.of(site.base() + "/older"), record.paginationNextLinks());
        assertTrue(Files.exists(Path.of(record.htmlPath())));

        // /a, /b and /older are new and in scope
        assertEquals(3, frontier.enqueuedCount());
        assertTrue(frontier.isEnqueued(site.url("/a")));
        assertTrue(frontier.isEnqueued(site.url("/b")));
        assertTrue(frontier.isEnqueued(site.url("/older")));
        assertFalse(frontier.isEnqueued(site.url("/seen")));
        CrawlTask task = frontier.poll(Duration.ofMillis(10));
        assertEquals(3, task.depth());
        assertEquals(3, stats.discovered.get());
        assertEquals(1, stats.outOfScope.get());

        assertEquals(3, record.images().size());
        var logo = record.images().get(0);
        assertEquals(site.base() + "/img/logo.png", logo.src());
        assertNotNull(logo.savedPath());
        assertArrayEquals(new byte[]{9, 8, 7}, Files.readAllBytes(Path.of(logo.savedPath())));
        assertTrue(logo.savedPath().endsWith("-logo.png"));
        assertNull(record.images().get(1).savedPath());
        assertNull(record.images().get(2).savedPath());
        assertEquals(1, stats.images.get());

        assertEquals(1, Files.readAllLines(storage.recordsFile()).size());
    }

    @Test
    public void testImagesDisabled() throws Exception {
        var record = processor(null).process(new CrawlTask(site.url("/"), 0),
                new FetchResult.Fetched(page(), null, true));
        assertTrue(record.images().isEmpty());
        assertTrue(record.rendered());
        assertEquals(0, site.hits("/img/logo.png"));
    }

    @Test
    public void testEnqueueLinksSkipsQueued() {
        var processor = processor(null);
        Url page = site.url("/");
        assertEquals(1, processor.enqueueLinks(page, 1, List.of("/x", "/x#frag", "mailto:a@b.c")));
        assertEquals(0, processor.enqueueLinks(page, 1, List.of("/x?utm_medium=email")));
    }

    @Test
    public void testEnqueueLinksWithUnescapedCharacters() {
        var processor = processor(null);
        Url page = site.url("/");
        assertEquals(3, processor.enqueueLinks(page, 1, List.of("/my page.html", "/s?q=a|b", "/p?x={1}")));
        assertTrue(frontier.isEnqueued(site.url("/my%20page.html")));
        assertTrue(frontier.isEnqueued(site.url("/s?q=a|b")));
        assertEquals(0, processor.enqueueLinks(page, 1, List.of(site.base().toUpperCase(java.util.Locale.ROOT) + "/s?q=a|b")));
    }
}
