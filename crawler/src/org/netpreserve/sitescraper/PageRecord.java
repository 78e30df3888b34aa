package org.netpreserve.sitescraper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitescraper.util.Url;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One line of the record log: everything extracted from a single processed page.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PageRecord(
        UUID id,
        Url url,
        int depth,
        boolean rendered,
        Instant fetchedAt,
        String htmlPath,
        Map<String, String> metadata,
        Map<String, List<JsonNode>> structuredData,
        String text,
        List<String> links,
        List<String> paginationNextLinks,
        List<Image> images) {

    public PageRecord {
        links = List.copyOf(links);
        paginationNextLinks = List.copyOf(paginationNextLinks);
        images = List.copyOf(images);
    }

    /**
     * @param src       address of the image
     * @param savedPath where it was saved, null if the download failed
     */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Image(String src, @Nullable String savedPath) {
    }
}
