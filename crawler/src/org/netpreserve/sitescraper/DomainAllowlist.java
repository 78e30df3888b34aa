package org.netpreserve.sitescraper;

import org.apache.commons.lang3.StringUtils;
import org.netpreserve.sitescraper.util.Url;

import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Matches addresses whose host is one of the allowed domains or a subdomain of one. An empty allowlist matches
 * everything.
 */
public class DomainAllowlist implements Predicate<Url> {
    private final Set<String> hosts = new HashSet<>();
    private final NavigableSet<String> reversedDomainPrefixes = new TreeSet<>();

    public DomainAllowlist(Collection<String> domains) {
        for (String domain : domains) {
            String normalized = StringUtils.stripStart(domain.trim().toLowerCase(Locale.ROOT), ".");
            if (normalized.isEmpty()) continue;
            hosts.add(normalized);
            reversedDomainPrefixes.add(Url.reverseHost(normalized));
        }
    }

    public boolean isEmpty() {
        return hosts.isEmpty();
    }

    @Override
    public boolean test(Url url) {
        if (hosts.isEmpty()) return true;
        String host = url.host();
        if (host.isEmpty()) return false;
        if (hosts.contains(host)) return true;
        return containsPrefixOf(reversedDomainPrefixes, Url.reverseHost(host));
    }

    /**
     * Returns true if the set contains a string that is a prefix of the given string.
     */
    static boolean containsPrefixOf(NavigableSet<String> set, String s) {
        String candidate = set.floor(s);
        while (candidate != null) {
            if (s.startsWith(candidate)) {
                return true;
            }
            candidate = set.lower(candidate);
        }
        return false;
    }
}
