package org.netpreserve.sitescraper.config;

import org.netpreserve.sitescraper.util.Url;

import java.nio.file.Path;
import java.util.List;

/**
 * Root configuration for a crawl.
 *
 * @param seeds   addresses the crawl starts from
 * @param output  directory that receives the record log, saved pages and assets
 * @param scope   which addresses may be crawled
 * @param limits  how much and how widely to crawl
 * @param crawl   how to behave towards servers
 * @param browser the browser used for rendering
 */
public record JobConfig(
        List<Url> seeds,
        Path output,
        ScopeConfig scope,
        LimitsConfig limits,
        CrawlConfig crawl,
        BrowserConfig browser
) {
    public JobConfig {
        seeds = seeds == null ? List.of() : List.copyOf(seeds);
        if (output == null) output = Path.of("scrape_output");
        if (scope == null) scope = new ScopeConfig(List.of());
        if (limits == null) limits = new LimitsConfig(200, 5, 8, 4);
        if (crawl == null) crawl = new CrawlConfig(null, null, true, null, true, null, null, 0);
        if (browser == null) browser = new BrowserConfig(null, null, 1, null);
    }
}
