package org.netpreserve.sitescraper.config;

import java.util.List;

/**
 * Crawl scope configuration.
 *
 * @param allowedDomains domains (including their subdomains) that may be crawled, empty allows every domain
 */
public record ScopeConfig(List<String> allowedDomains) {
    public ScopeConfig {
        allowedDomains = allowedDomains == null ? List.of() : List.copyOf(allowedDomains);
    }
}
