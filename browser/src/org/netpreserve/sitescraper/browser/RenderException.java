package org.netpreserve.sitescraper.browser;

/**
 * The browser could not produce a rendered document, either because it is unavailable or because navigation
 * failed or timed out.
 */
public class RenderException extends Exception {
    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
