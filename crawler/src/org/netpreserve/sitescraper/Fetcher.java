package org.netpreserve.sitescraper;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitescraper.browser.RenderException;
import org.netpreserve.sitescraper.browser.Renderer;
import org.netpreserve.sitescraper.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Retrieves a page over HTTP and, depending on the render policy, through the browser.
 * <p>
 * Only a 200 response with an HTML content type counts as content. Everything else (error statuses, other
 * content types, transport errors and timeouts) is reported as {@link FetchResult.NotFetched} rather than thrown.
 * When the policy asks for rendering, successful browser output replaces the raw document and a failed render
 * falls back to whatever the plain request returned.
 */
public class Fetcher {
    private static final Logger log = LoggerFactory.getLogger(Fetcher.class);
    private static final Pattern CHARSET = Pattern.compile("charset\\s*=\\s*\"?([^\";\\s]+)", Pattern.CASE_INSENSITIVE);
    private final HttpClient httpClient;
    private final String userAgent;
    private final Duration timeout;
    private final RenderPolicy renderPolicy;
    private final @Nullable Renderer renderer;
    private final Duration renderTimeout;

    public Fetcher(HttpClient httpClient, String userAgent, Duration timeout, RenderPolicy renderPolicy,
                   @Nullable Renderer renderer, Duration renderTimeout) {
        this.httpClient = httpClient;
        this.userAgent = userAgent;
        this.timeout = timeout;
        this.renderPolicy = renderPolicy;
        this.renderer = renderPolicy == RenderPolicy.NEVER ? null : renderer;
        this.renderTimeout = renderTimeout;
    }

    public FetchResult fetch(Url url) throws InterruptedException {
        FetchResult raw = fetchRaw(url);
        String rawContent = raw instanceof FetchResult.Fetched fetched ? fetched.content() : null;
        if (!needsRender(rawContent)) return raw;

        if (renderer == null) {
            log.atDebug().addKeyValue("url", url).log("Render wanted but no renderer configured");
            return raw;
        }
        try {
            String rendered = renderer.render(url, renderTimeout);
            if (rendered != null && !rendered.isEmpty()) {
                String contentDisposition = raw instanceof FetchResult.Fetched fetched ? fetched.contentDisposition() : null;
                return new FetchResult.Fetched(rendered, contentDisposition, true);
            }
        } catch (RenderException e) {
            log.atWarn().addKeyValue("url", url).log("Render failed, using raw response: {}", e.getMessage());
        }
        return raw;
    }

    boolean needsRender(@Nullable String rawContent) {
        return switch (renderPolicy) {
            case ALWAYS -> true;
            case AUTO -> rawContent == null || RenderHeuristic.looksClientRendered(rawContent);
            case NEVER -> false;
        };
    }

    FetchResult fetchRaw(Url url) throws InterruptedException {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(url.toURI())
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .GET()
                    .build();
        } catch (URISyntaxException | IllegalArgumentException e) {
            return new FetchResult.NotFetched("invalid url: " + e.getMessage());
        }

        HttpResponse<String> response;
        try {
            // don't bother downloading bodies we'd discard
            response = httpClient.send(request, responseInfo -> {
                String contentType = responseInfo.headers().firstValue("Content-Type").orElse("");
                if (responseInfo.statusCode() == 200 && isHtml(contentType)) {
                    return HttpResponse.BodySubscribers.ofString(charsetOf(contentType));
                }
                return HttpResponse.BodySubscribers.<String>replacing(null);
            });
        } catch (IOException e) {
            log.atInfo().addKeyValue("url", url).log("Fetch failed: {}", e.toString());
            return new FetchResult.NotFetched("transport error: " + e);
        }

        String contentType = response.headers().firstValue("Content-Type").orElse("");
        if (response.statusCode() != 200) {
            log.atInfo().addKeyValue("url", url).addKeyValue("status", response.statusCode()).log("Fetch returned error status");
            return new FetchResult.NotFetched("status " + response.statusCode());
        }
        if (!isHtml(contentType) || response.body() == null) {
            log.atDebug().addKeyValue("url", url).addKeyValue("contentType", contentType).log("Not HTML");
            return new FetchResult.NotFetched("not html: " + contentType);
        }
        return new FetchResult.Fetched(response.body(),
                response.headers().firstValue("Content-Disposition").orElse(null), false);
    }

    static boolean isHtml(String contentType) {
        String lower = contentType.toLowerCase(Locale.ROOT);
        return lower.contains("text/html") || lower.trim().startsWith("application/xhtml");
    }

    static Charset charsetOf(String contentType) {
        Matcher matcher = CHARSET.matcher(contentType);
        if (matcher.find()) {
            try {
                return Charset.forName(matcher.group(1));
            } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                log.debug("Unknown charset in {}, decoding as UTF-8", contentType);
            }
        }
        return StandardCharsets.UTF_8;
    }
}
