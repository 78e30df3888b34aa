package org.netpreserve.sitescraper;

import org.jetbrains.annotations.Nullable;

/**
 * Final outcome of fetching one address: either a document to process or the reason there is none.
 */
public sealed interface FetchResult permits FetchResult.Fetched, FetchResult.NotFetched {

    /**
     * @param content            the HTML document
     * @param contentDisposition the Content-Disposition header of the raw response, if any
     * @param rendered           whether the content came from the browser
     */
    record Fetched(String content, @Nullable String contentDisposition, boolean rendered) implements FetchResult {
    }

    record NotFetched(String reason) implements FetchResult {
    }
}
