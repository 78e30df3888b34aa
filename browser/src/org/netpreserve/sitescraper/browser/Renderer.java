package org.netpreserve.sitescraper.browser;

import org.netpreserve.sitescraper.util.Url;

import java.io.Closeable;
import java.time.Duration;

/**
 * Produces the DOM of a page after its scripts have run.
 * <p>
 * Implementations are shared by all workers of a crawl, start lazily and are closed once at the end of the crawl.
 */
public interface Renderer extends Closeable {

    /**
     * Starts the underlying engine if it isn't running yet.
     *
     * @throws RenderException if the engine can't be started
     */
    void ensure() throws RenderException;

    /**
     * Loads the url and returns the serialized document once the page has loaded.
     */
    String render(Url url, Duration timeout) throws RenderException, InterruptedException;

    @Override
    void close();
}
