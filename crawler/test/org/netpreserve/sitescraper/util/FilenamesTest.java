package org.netpreserve.sitescraper.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FilenamesTest {

    @Test
    public void testSanitize() {
        assertEquals("my_photo_1_.jpg", Filenames.sanitize("my photo (1).jpg"));
        assertEquals("file", Filenames.sanitize(""));
        assertEquals(Filenames.MAX_LENGTH, Filenames.sanitize("a".repeat(500)).length());
    }

    @Test
    public void testGuessFromContentDisposition() {
        var url = new Url("http://example.com/download?id=7");
        assertEquals("report.pdf", Filenames.guess(url, "attachment; filename=\"report.pdf\""));
        assertEquals("na_ve.png", Filenames.guess(url, "attachment; filename*=UTF-8''na%C3%AFve.png"));
    }

    @Test
    public void testGuessFromPath() {
        assertEquals("logo.png", Filenames.guess(new Url("http://example.com/img/logo.png?v=2"), null));
        assertEquals("index.html", Filenames.guess(new Url("http://example.com/img/"), null));
        assertEquals("index.html", Filenames.guess(new Url("http://example.com"), "inline"));
    }

    @Test
    public void testSha1() {
        assertEquals("a9993e364706816aba3e25717850c26c9cd0d89d", Filenames.sha1Hex("abc"));
    }
}
