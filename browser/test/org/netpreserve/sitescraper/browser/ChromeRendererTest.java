package org.netpreserve.sitescraper.browser;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfSystemProperty;
import org.netpreserve.sitescraper.util.Url;
import org.openqa.selenium.WebDriverException;

import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChromeRendererTest {
    @Test
    public void testClosedRendererRejectsRenders() {
        var renderer = new ChromeRenderer(null, List.of("--headless=new"), 1);
        renderer.close();
        renderer.close(); // idempotent
        var e = assertThrows(RenderException.class,
                () -> renderer.render(new Url("http://127.0.0.1/"), Duration.ofSeconds(1)));
        assertTrue(e.getMessage().contains("closed"));
        assertThrows(RenderException.class, renderer::ensure);
    }

    @Test
    public void testWindowsMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new ChromeRenderer(null, List.of(), 0));
    }

    @Test
    public void testNetworkErrorsAreNavigationErrors() {
        assertTrue(ChromeRenderer.isNavigationError(new WebDriverException(
                "unknown error: net::ERR_CONNECTION_REFUSED\n  (Session info: chrome=129.0.6668.58)")));
        assertTrue(ChromeRenderer.isNavigationError(new WebDriverException(
                "unknown error: net::ERR_NAME_NOT_RESOLVED")));
        assertFalse(ChromeRenderer.isNavigationError(new WebDriverException(
                "chrome not reachable")));
        assertFalse(ChromeRenderer.isNavigationError(new WebDriverException((String) null)));
    }

    @Test
    @EnabledIfSystemProperty(named = "sitescraper.browserTests", matches = "true")
    public void testUnreachableAddressKeepsWindow() throws Exception {
        int port;
        try (var socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        try (var renderer = new ChromeRenderer()) {
            renderer.ensure();
            assertEquals(1, renderer.windowCount());
            var url = new Url("http://127.0.0.1:" + port + "/");
            var e = assertThrows(RenderException.class, () -> renderer.render(url, Duration.ofSeconds(10)));
            assertTrue(e.getMessage().contains("ERR_CONNECTION_REFUSED"), e.getMessage());
            assertThrows(RenderException.class, () -> renderer.render(url, Duration.ofSeconds(10)));
            assertEquals(1, renderer.windowCount());
        }
    }

    @Test
    @EnabledIfSystemProperty(named = "sitescraper.browserTests", matches = "true")
    public void testRenderRunsScripts() throws Exception {
        var httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        httpServer.createContext("/", exchange -> {
            byte[] body = """
                    <!doctype html><html><body><div id="root"></div>
                    <script>document.getElementById('root').textContent = 'hello from script';</script>
                    </body></html>""".getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
            exchange.sendResponseHeaders(200, body.length);
            exchange.getResponseBody().write(body);
            exchange.close();
        });
        httpServer.start();
        try (var renderer = new ChromeRenderer()) {
            renderer.ensure();
            String html = renderer.render(new Url("http://127.0.0.1:" + httpServer.getAddress().getPort() + "/"),
                    Duration.ofSeconds(30));
            assertTrue(html.contains("hello from script"), html);
        } finally {
            httpServer.stop(0);
        }
    }
}
