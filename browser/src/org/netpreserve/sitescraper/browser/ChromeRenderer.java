package org.netpreserve.sitescraper.browser;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitescraper.util.Url;
import org.openqa.selenium.NoSuchSessionException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.Semaphore;
import java.util.logging.Level;

/**
 * Renders pages in headless Chrome windows driven by Selenium.
 * <p>
 * Windows are started on demand up to a fixed limit and reused between pages. A window which fails with anything
 * other than a navigation timeout or a network error is discarded and replaced by a fresh one the next time it's
 * needed. If Chrome
 * can't be started at all the renderer remembers the failure and rejects later renders immediately.
 */
public class ChromeRenderer implements Renderer {
    private static final Logger log = LoggerFactory.getLogger(ChromeRenderer.class);
    private final String executable;
    private final List<String> options;
    private final BlockingDeque<ChromeDriver> idleWindows = new LinkedBlockingDeque<>();
    private final Set<ChromeDriver> liveWindows = ConcurrentHashMap.newKeySet();
    private final Semaphore windowPermits;
    private volatile boolean closed = false;
    private volatile String unavailableReason;

    static {
        // suppress noisy selenium logging
        java.util.logging.Logger.getLogger("org.openqa.selenium").setLevel(Level.WARNING);
    }

    public ChromeRenderer() {
        this(null, List.of("--headless=new", "--disable-gpu"), 1);
    }

    /**
     * @param executable path to the Chrome binary, or null to let Selenium locate one
     * @param options    command-line options passed to Chrome
     * @param windows    maximum number of pages rendered at the same time
     */
    public ChromeRenderer(@Nullable String executable, List<String> options, int windows) {
        if (windows < 1) throw new IllegalArgumentException("windows must be at least 1");
        this.executable = executable;
        this.options = options == null ? List.of() : List.copyOf(options);
        this.windowPermits = new Semaphore(windows, true);
    }

    @Override
    public synchronized void ensure() throws RenderException {
        checkUsable();
        if (!liveWindows.isEmpty()) return;
        idleWindows.addFirst(launch());
    }

    @Override
    public String render(Url url, Duration timeout) throws RenderException, InterruptedException {
        checkUsable();
        windowPermits.acquire();
        ChromeDriver window = null;
        boolean healthy = true;
        try {
            window = idleWindows.pollFirst();
            if (window == null) {
                window = launch();
            }
            window.manage().timeouts().pageLoadTimeout(timeout);
            log.debug("Rendering {}", url);
            window.navigate().to(url.toString());
            return window.getPageSource();
        } catch (TimeoutException e) {
            throw new RenderException("Timed out after " + timeout.toMillis() + "ms rendering " + url, e);
        } catch (WebDriverException e) {
            if (isNavigationError(e)) {
                throw new RenderException("Navigation to " + url + " failed: " + e.getRawMessage(), e);
            }
            healthy = false;
            throw new RenderException("Browser failed rendering " + url + ": " + e.getMessage(), e);
        } finally {
            if (window != null) {
                release(window, healthy);
            }
            windowPermits.release();
        }
    }

    /**
     * Chrome reports unreachable hosts and refused connections as net::ERR_* errors. The window itself is fine.
     */
    static boolean isNavigationError(WebDriverException e) {
        String message = e.getRawMessage();
        return message != null && message.contains("net::ERR_");
    }

    private void release(ChromeDriver window, boolean healthy) {
        if (healthy && !closed) {
            // put it back at the front so the fewest windows stay active
            idleWindows.addFirst(window);
        } else {
            if (!healthy) log.warn("Discarding browser window after error, a new one will be started");
            quit(window);
        }
    }

    private void checkUsable() throws RenderException {
        if (closed) throw new RenderException("Renderer is closed");
        String reason = unavailableReason;
        if (reason != null) throw new RenderException("Browser unavailable: " + reason);
    }

    private ChromeDriver launch() throws RenderException {
        var chromeOptions = new ChromeOptions();
        chromeOptions.addArguments(options);
        if (executable != null) chromeOptions.setBinary(new File(executable));
        try {
            var window = new ChromeDriver(chromeOptions);
            liveWindows.add(window);
            log.info("Started browser window ({} running)", windowCount());
            return window;
        } catch (WebDriverException e) {
            unavailableReason = e.getMessage();
            log.error("Unable to start browser", e);
            throw new RenderException("Unable to start browser", e);
        }
    }

    private void quit(ChromeDriver window) {
        liveWindows.remove(window);
        try {
            window.quit();
        } catch (NoSuchSessionException e) {
            log.debug("Browser window already gone");
        } catch (WebDriverException e) {
            log.warn("Error closing browser window", e);
        }
    }

    int windowCount() {
        return liveWindows.size();
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        log.debug("Closing {} browser windows", windowCount());
        for (var window : List.copyOf(liveWindows)) {
            quit(window);
        }
        idleWindows.clear();
    }
}
