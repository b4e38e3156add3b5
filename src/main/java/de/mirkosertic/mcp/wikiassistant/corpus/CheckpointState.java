package de.mirkosertic.mcp.wikiassistant.corpus;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * In-progress state of a random discovery crawl.
 * <p>
 * Every URL of {@link #scrapedData()} appears exactly once in {@link #scrapedUrls()}. The file is
 * deleted once the target page count is reached.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"scraped_data", "scraped_urls", "last_saved", "total_pages_scraped"})
public record CheckpointState(
        @JsonProperty("scraped_data") List<Page> scrapedData,
        @JsonProperty("scraped_urls") List<String> scrapedUrls,
        @JsonProperty("last_saved") double lastSaved,
        @JsonProperty("total_pages_scraped") int totalPagesScraped
) {
    public CheckpointState {
        scrapedData = scrapedData != null ? List.copyOf(scrapedData) : List.of();
        scrapedUrls = scrapedUrls != null ? List.copyOf(scrapedUrls) : List.of();
    }
}
