package org.netpreserve.sitescraper;

import org.junit.jupiter.api.Test;
import org.netpreserve.sitescraper.util.Url;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UrlNormalizerTest {
    private static Url normalize(String base, String href) {
        return UrlNormalizer.normalize(new Url(base), href);
    }

    @Test
    public void testResolvesAndStripsTrackingAndFragment() {
        assertEquals(new Url("http://x.com/b"), normalize("http://x.com/a", "/b?utm_source=x#frag"));
    }

    @Test
    public void testKeepsOtherParamsInOrder() {
        assertEquals(new Url("http://x.com/p?b=2&a=1"), normalize("http://x.com/", "/p?b=2&utm_medium=m&a=1&gclid=abc"));
        assertEquals(new Url("http://x.com/p?q=a%20b"), normalize("http://x.com/", "/p?q=a%20b&FBCLID=1"));
        assertEquals(new Url("http://x.com/p?flag="), normalize("http://x.com/", "/p?flag"));
        assertEquals(new Url("http://x.com/p"), normalize("http://x.com/", "/p?utm_campaign=c"));
    }

    @Test
    public void testRelativeForms() {
        assertEquals(new Url("http://x.com/a/c"), normalize("http://x.com/a/b/", "../c"));
        assertEquals(new Url("http://x.com/page"), normalize("http://x.com", "page"));
        assertEquals(new Url("http://x.com/dir/page?y=2"), normalize("http://x.com/dir/page?x=1", "?y=2"));
        assertEquals(new Url("https://cdn.x.com/img.png"), normalize("https://x.com/a", "//cdn.x.com/img.png"));
        assertEquals(new Url("http://x.com/a"), normalize("HTTP://x.com/", "HTTP://x.com/a"));
    }

    @Test
    public void testRejectsUnfetchable() {
        assertNull(normalize("http://x.com/", "javascript:void(0)"));
        assertNull(normalize("http://x.com/", "mailto:someone@x.com"));
        assertNull(normalize("http://x.com/", "tel:+123456"));
        assertNull(normalize("http://x.com/", "data:image/png;base64,AAAA"));
        assertNull(normalize("http://x.com/", "ftp://x.com/file"));
        assertNull(normalize("http://x.com/", "   "));
        assertNull(normalize("http://x.com/", null));
        assertNull(UrlNormalizer.normalize("not a url"));
    }

    @Test
    public void testKeepsLinksWithCharactersBrowsersAccept() {
        assertEquals(new Url("http://x.com/my%20page.html"), normalize("http://x.com/", "/my page.html"));
        assertEquals(new Url("http://x.com/s?q=a|b"), normalize("http://x.com/", "/s?q=a|b"));
        assertEquals(new Url("http://x.com/p?x={1}"), normalize("http://x.com/", "/p?x={1}"));
        assertEquals(new Url("http://x.com/%7Bid%7D/view"), normalize("http://x.com/", "/{id}/view"));
        assertEquals(new Url("http://x.com/bad%20path"), normalize("http://x.com/", "http://x.com/bad path"));
    }

    @Test
    public void testCanonicalizesHostPortAndEmptyPath() {
        assertEquals(new Url("http://x.com/b"), normalize("http://x.com/a", "http://X.COM/b"));
        assertEquals(normalize("http://x.com/a", "/b"), normalize("http://x.com/a", "http://X.COM/b"));
        assertEquals(new Url("http://x.com/"), normalize("http://x.com/a", "http://x.com"));
        assertEquals(new Url("http://x.com/"), UrlNormalizer.normalize("http://x.com"));
        assertEquals(new Url("http://x.com/a"), normalize("http://x.com/", "http://x.com:80/a"));
        assertEquals(new Url("https://x.com:8443/a"), normalize("http://x.com/", "https://x.com:8443/a"));
        assertEquals(new Url("http://x.com/a/c"), normalize("http://x.com/", "/a/./b/../c"));
    }

    @Test
    public void testIdempotent() {
        for (String href : List.of("/b?utm_source=x#frag", "../c?z=1&y=2", "?q", "https://y.org/p?a=1&utm_term=t",
                "page.html#section", "/my page.html", "/s?q=a|b", "HTTP://X.COM")) {
            Url once = normalize("http://x.com/a/b/", href);
            assertNotNull(once, href);
            assertEquals(once, UrlNormalizer.normalize(once.toString()), href);
            assertEquals(once, UrlNormalizer.normalize(once, once.toString()), href);
        }
    }
}
