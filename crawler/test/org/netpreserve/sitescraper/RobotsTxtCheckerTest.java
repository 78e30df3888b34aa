package org.netpreserve.sitescraper;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.netpreserve.sitescraper.util.Url;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RobotsTxtCheckerTest {
    private TestSite site;
    private final HttpClient httpClient = HttpClient.newHttpClient();

    @BeforeEach
    void setUp() throws Exception {
        site = new TestSite();
    }

    @AfterEach
    void tearDown() {
        site.close();
    }

    private RobotsTxtChecker checker() {
        return new RobotsTxtChecker(httpClient, List.of("SiteScraper"), "SiteScraper/1.0", Duration.ofSeconds(5));
    }

    @Test
    public void testDisallowedPath() throws InterruptedException {
        site.text("/robots.txt", "User-agent: *\nDisallow: /private/\n");
        var checker = checker();
        assertFalse(checker.allowed(site.url("/private/x")));
        assertTrue(checker.allowed(site.url("/public")));
        assertEquals(1, site.hits("/robots.txt"));
        assertEquals(1, checker.cachedOrigins());
    }

    @Test
    public void testRulesForOurAgent() throws InterruptedException {
        site.text("/robots.txt", "User-agent: sitescraper\nDisallow: /\n\nUser-agent: *\nAllow: /\n");
        assertFalse(checker().allowed(site.url("/anything")));
    }

    @Test
    public void testMissingRobotsAllowsAll() throws InterruptedException {
        var checker = checker();
        assertTrue(checker.allowed(site.url("/private/x")));
        assertTrue(checker.allowed(site.url("/public")));
        assertEquals(1, site.hits("/robots.txt"));
    }

    @Test
    public void testServerErrorAllowsAll() throws InterruptedException {
        site.respond("/robots.txt", 500, "text/plain", "oops".getBytes(), java.util.Map.of());
        assertTrue(checker().allowed(site.url("/private/x")));
    }

    @Test
    public void testUnreachableAllowsAll() throws Exception {
        String base = site.base();
        site.close();
        var checker = checker();
        assertTrue(checker.allowed(new Url(base + "/private/x")));
        assertTrue(checker.allowed(new Url(base + "/public")));
        site = new TestSite();
    }

    @Test
    public void testFetchedOncePerOriginUnderConcurrency() throws Exception {
        site.text("/robots.txt", "User-agent: *\nDisallow: /private/\n");
        var checker = checker();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                Url url = site.url(i % 2 == 0 ? "/private/" + i : "/public/" + i);
                results.add(executor.submit(() -> checker.allowed(url)));
            }
            for (int i = 0; i < results.size(); i++) {
                assertEquals(i % 2 != 0, results.get(i).get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, site.hits("/robots.txt"));
    }
}
