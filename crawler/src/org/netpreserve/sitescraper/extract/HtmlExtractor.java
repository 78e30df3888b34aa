package org.netpreserve.sitescraper.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.netpreserve.sitescraper.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Pulls metadata, text, structured data, links and image sources out of an HTML document.
 * <p>
 * All methods are pure functions of the parsed document. Addresses are resolved against the document's base URL,
 * which honours a {@code <base href>} element.
 */
public class HtmlExtractor {
    private static final Logger log = LoggerFactory.getLogger(HtmlExtractor.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final List<String> IMAGE_ATTRIBUTES = List.of("src", "data-src", "data-original", "data-lazy-src");
    private static final List<String> PAGINATION_WORDS = List.of("next", "older", "more");
    private final ObjectMapper mapper;

    public HtmlExtractor(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Document parse(String html, Url url) {
        return Jsoup.parse(html, url.toString());
    }

    /**
     * Title, description, keywords, basic OpenGraph fields and the canonical link. The title key is always
     * present, the others only when the page provides a non-empty value.
     */
    public Map<String, String> metadata(Document doc) {
        var metadata = new LinkedHashMap<String, String>();
        Element title = doc.selectFirst("title");
        metadata.put("title", title == null || title.text().isBlank() ? null : title.text().trim());
        putContent(metadata, "meta_description", doc.selectFirst("meta[name=description]"));
        putContent(metadata, "meta_keywords", doc.selectFirst("meta[name=keywords]"));
        putContent(metadata, "og_title", doc.selectFirst("meta[property=og:title]"));
        putContent(metadata, "og_description", doc.selectFirst("meta[property=og:description]"));
        putContent(metadata, "og_type", doc.selectFirst("meta[property=og:type]"));
        putContent(metadata, "og_url", doc.selectFirst("meta[property=og:url]"));
        for (Element link : doc.select("link[rel][href]")) {
            if (hasToken(link.attr("rel"), "canonical") && !link.attr("href").isBlank()) {
                metadata.put("canonical", link.attr("href").trim());
                break;
            }
        }
        return metadata;
    }

    private static void putContent(Map<String, String> metadata, String key, Element meta) {
        if (meta == null) return;
        String content = meta.attr("content").trim();
        if (!content.isEmpty()) metadata.put(key, content);
    }

    /**
     * Visible text with scripts and styles removed, one whitespace-collapsed line per line of source text.
     */
    public String text(Document doc) {
        Document copy = doc.clone();
        copy.select("script, style, noscript").remove();
        var lines = new ArrayList<String>();
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof TextNode textNode) {
                for (String line : textNode.getWholeText().split("\\R")) {
                    String collapsed = collapseWhitespace(line);
                    if (!collapsed.isEmpty()) lines.add(collapsed);
                }
            }
        }, copy);
        return String.join("\n", lines);
    }

    /**
     * JSON-LD objects keyed under "json-ld". Blocks that aren't valid JSON are skipped.
     */
    public Map<String, List<JsonNode>> structuredData(Document doc) {
        var objects = new ArrayList<JsonNode>();
        for (Element script : doc.select("script[type*=ld+json]")) {
            JsonNode node;
            try {
                node = mapper.readTree(script.data());
            } catch (JsonProcessingException e) {
                log.atDebug().addKeyValue("url", doc.location()).log("Skipping malformed JSON-LD: {}", e.getOriginalMessage());
                continue;
            }
            if (node == null) continue;
            if (node.isObject()) {
                objects.add(node);
            } else if (node.isArray()) {
                for (JsonNode element : node) {
                    if (element.isObject()) objects.add(element);
                }
            }
        }
        var structured = new LinkedHashMap<String, List<JsonNode>>();
        structured.put("json-ld", objects);
        return structured;
    }

    /**
     * Absolute targets of every anchor in document order.
     */
    public List<String> links(Document doc) {
        var links = new ArrayList<String>();
        for (Element a : doc.select("a[href]")) {
            String href = a.absUrl("href");
            if (!href.isEmpty()) links.add(href);
        }
        return links;
    }

    /**
     * Links that look like they lead to the next page of a listing: {@code <link rel=next>} plus anchors
     * labelled next, older or more.
     */
    public List<String> paginationHints(Document doc) {
        Set<String> candidates = new LinkedHashSet<>();
        for (Element link : doc.select("link[rel][href]")) {
            if (hasToken(link.attr("rel"), "next")) addAbsolute(candidates, link, "href");
        }
        for (Element a : doc.select("a[href]")) {
            String text = collapseWhitespace(a.text());
            if (text.length() > 100) text = text.substring(0, 100);
            text = text.toLowerCase(Locale.ROOT);
            String aria = a.attr("aria-label").toLowerCase(Locale.ROOT);
            boolean hinted = hasToken(a.attr("rel"), "next") || aria.contains("next");
            for (String word : PAGINATION_WORDS) {
                if (text.contains(word)) {
                    hinted = true;
                    break;
                }
            }
            if (hinted) addAbsolute(candidates, a, "href");
        }
        return new ArrayList<>(candidates);
    }

    /**
     * Image addresses, taking the first of src or a common lazy-loading attribute on each img element.
     */
    public List<String> imageSources(Document doc) {
        Set<String> sources = new LinkedHashSet<>();
        for (Element img : doc.select("img")) {
            for (String attribute : IMAGE_ATTRIBUTES) {
                if (!img.attr(attribute).isBlank()) {
                    addAbsolute(sources, img, attribute);
                    break;
                }
            }
        }
        return new ArrayList<>(sources);
    }

    private static void addAbsolute(Set<String> set, Element element, String attribute) {
        String url = element.absUrl(attribute);
        if (!url.isEmpty()) set.add(url);
    }

    private static boolean hasToken(String tokens, String token) {
        for (String candidate : WHITESPACE.split(tokens.trim())) {
            if (candidate.equalsIgnoreCase(token)) return true;
        }
        return false;
    }

    static String collapseWhitespace(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}
