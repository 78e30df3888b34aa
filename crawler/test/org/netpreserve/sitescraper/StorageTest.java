package org.netpreserve.sitescraper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.netpreserve.sitescraper.util.Filenames;
import org.netpreserve.sitescraper.util.Url;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class StorageTest {
    private final ObjectMapper mapper = Crawl.newJsonMapper();

    private static PageRecord record(String url) {
        return new PageRecord(UUID.randomUUID(), new Url(url), 1, false, Instant.parse("2024-05-01T10:15:30Z"),
                "pages/x.html", Map.of("title", "T"), Map.of("json-ld", List.of()), "text",
                List.of("http://example.com/a"), List.of(), List.of(new PageRecord.Image("http://example.com/i.png", null)));
    }

    @Test
    public void testLayout(@TempDir Path tempDir) throws IOException {
        try (var storage = new Storage(tempDir, mapper)) {
            assertTrue(Files.isDirectory(tempDir.resolve("pages")));
            assertTrue(Files.isDirectory(tempDir.resolve("assets").resolve("images")));

            Url url = new Url("http://example.com/page");
            Path html = storage.saveDocument(url, "<p>héllo</p>");
            assertEquals(tempDir.resolve("pages").resolve(Filenames.sha1Hex("http://example.com/page") + ".html"), html);
            assertEquals("<p>héllo</p>", Files.readString(html, StandardCharsets.UTF_8));
        }
    }

    @Test
    public void testSaveBinaryNames(@TempDir Path tempDir) throws IOException {
        try (var storage = new Storage(tempDir, mapper)) {
            byte[] data = {1, 2, 3};
            Path a = storage.saveBinary(new Url("http://example.com/a/logo.png"), data, "logo.png");
            Path b = storage.saveBinary(new Url("http://example.com/b/logo.png"), data, "logo.png");
            assertNotEquals(a, b);
            assertTrue(a.getFileName().toString().endsWith("-logo.png"));
            assertEquals(Filenames.sha1Hex("http://example.com/a/logo.png").substring(0, 10) + "-logo.png",
                    a.getFileName().toString());

            Path unnamed = storage.saveBinary(new Url("http://example.com/c"), data, null);
            assertEquals(Filenames.sha1Hex(data), unnamed.getFileName().toString());
            assertArrayEquals(data, Files.readAllBytes(unnamed));
        }
    }

    @Test
    public void testRecordShape(@TempDir Path tempDir) throws IOException {
        try (var storage = new Storage(tempDir, mapper)) {
            storage.appendRecord(record("http://example.com/"));
        }
        List<String> lines = Files.readAllLines(tempDir.resolve("data.jsonl"));
        assertEquals(1, lines.size());
        JsonNode json = new ObjectMapper().readTree(lines.get(0));
        assertEquals("http://example.com/", json.get("url").asText());
        assertEquals(1, json.get("depth").asInt());
        assertFalse(json.get("rendered").asBoolean());
        assertEquals("2024-05-01T10:15:30Z", json.get("fetched_at").asText());
        assertEquals("pages/x.html", json.get("html_path").asText());
        assertEquals("T", json.get("metadata").get("title").asText());
        assertTrue(json.get("structured_data").get("json-ld").isArray());
        assertTrue(json.get("pagination_next_links").isArray());
        assertTrue(json.get("images").get(0).has("saved_path"));
        assertTrue(json.get("images").get(0).get("saved_path").isNull());
        assertEquals(36, json.get("id").asText().length());
    }

    @Test
    public void testConcurrentAppendsKeepLinesIntact(@TempDir Path tempDir) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try (var storage = new Storage(tempDir, mapper)) {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                String url = "http://example.com/" + i;
                futures.add(executor.submit(() -> {
                    storage.appendRecord(record(url));
                    return null;
                }));
            }
            for (var future : futures) future.get();
        } finally {
            executor.shutdownNow();
        }
        List<String> lines = Files.readAllLines(tempDir.resolve("data.jsonl"));
        assertEquals(100, lines.size());
        for (String line : lines) {
            assertTrue(new ObjectMapper().readTree(line).has("url"));
        }
    }

    @Test
    public void testAppendsAcrossReopen(@TempDir Path tempDir) throws IOException {
        try (var storage = new Storage(tempDir, mapper)) {
            storage.appendRecord(record("http://example.com/1"));
        }
        try (var storage = new Storage(tempDir, mapper)) {
            storage.appendRecord(record("http://example.com/2"));
            assertEquals(tempDir.resolve("data.jsonl"), storage.recordsFile());
        }
        assertEquals(2, Files.readAllLines(tempDir.resolve("data.jsonl")).size());
    }
}
