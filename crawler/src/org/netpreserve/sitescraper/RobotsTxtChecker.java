package org.netpreserve.sitescraper;

import crawlercommons.robots.BaseRobotRules;
import crawlercommons.robots.SimpleRobotRules;
import crawlercommons.robots.SimpleRobotRulesParser;
import org.netpreserve.sitescraper.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;

/**
 * Checks addresses against their origin's robots.txt.
 * <p>
 * Each origin's robots.txt is fetched once, on the first check for that origin, and kept for the rest of the crawl.
 * Concurrent first checks for the same origin wait for a single fetch. Any failure to fetch or parse the file
 * (network error, timeout, a status other than 200) caches rules that allow everything.
 */
public class RobotsTxtChecker {
    private static final Logger log = LoggerFactory.getLogger(RobotsTxtChecker.class);
    static final BaseRobotRules ALLOW_ALL = new SimpleRobotRules(SimpleRobotRules.RobotRulesMode.ALLOW_ALL);
    private final ConcurrentMap<String, CompletableFuture<BaseRobotRules>> rulesByOrigin = new ConcurrentHashMap<>();
    private final HttpClient httpClient;
    private final List<String> robotNames;
    private final String fetchUserAgent;
    private final Duration timeout;

    public RobotsTxtChecker(HttpClient httpClient, List<String> robotNames, String fetchUserAgent, Duration timeout) {
        this.httpClient = httpClient;
        this.robotNames = robotNames.isEmpty() ? List.of("sitescraper") :
                robotNames.stream().map(name -> name.toLowerCase(Locale.ROOT)).toList();
        this.fetchUserAgent = fetchUserAgent;
        this.timeout = timeout;
    }

    public boolean allowed(Url url) throws InterruptedException {
        return rules(url).isAllowed(url.toString());
    }

    BaseRobotRules rules(Url url) throws InterruptedException {
        String origin = url.origin();
        var future = rulesByOrigin.get(origin);
        if (future == null) {
            var ours = new CompletableFuture<BaseRobotRules>();
            future = rulesByOrigin.putIfAbsent(origin, ours);
            if (future == null) {
                future = ours;
                try {
                    ours.complete(fetch(url.withPath("/robots.txt")));
                } catch (InterruptedException e) {
                    // let a later check try again, but don't leave concurrent waiters hanging
                    rulesByOrigin.remove(origin, ours);
                    ours.complete(ALLOW_ALL);
                    throw e;
                }
            }
        }
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.warn("Unexpected error loading robots.txt for {}", origin, e.getCause());
            return ALLOW_ALL;
        }
    }

    private BaseRobotRules fetch(Url robotsUrl) throws InterruptedException {
        URI robotsUri;
        try {
            robotsUri = robotsUrl.toURI();
        } catch (URISyntaxException e) {
            log.debug("Error parsing robots.txt URL: {}", robotsUrl, e);
            return ALLOW_ALL;
        }
        try {
            var response = httpClient.send(HttpRequest.newBuilder(robotsUri)
                    .timeout(timeout)
                    .header("User-Agent", fetchUserAgent)
                    .build(), BodyHandlers.ofByteArray());
            if (response.statusCode() != 200) {
                log.atDebug().addKeyValue("url", robotsUrl).addKeyValue("status", response.statusCode())
                        .log("No usable robots.txt, allowing all");
                return ALLOW_ALL;
            }
            String contentType = response.headers().firstValue("Content-Type").orElse("text/plain");
            var rules = new SimpleRobotRulesParser().parseContent(robotsUrl.toString(), response.body(),
                    contentType, robotNames);
            log.atDebug().addKeyValue("url", robotsUrl).log("Loaded robots.txt");
            return rules;
        } catch (IOException | IllegalArgumentException e) {
            log.atDebug().addKeyValue("url", robotsUrl).log("Failed to fetch robots.txt, allowing all: {}", e.toString());
            return ALLOW_ALL;
        } catch (RuntimeException e) {
            log.warn("Failed to parse {}, allowing all", robotsUrl, e);
            return ALLOW_ALL;
        }
    }

    int cachedOrigins() {
        return rulesByOrigin.size();
    }
}
