package de.mirkosertic.mcp.wikiassistant.corpus;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Final artifact of a random discovery crawl that reached its target.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"scraped_at", "total_pages", "pages"})
public record CompletedCorpus(
        @JsonProperty("scraped_at") double scrapedAt,
        @JsonProperty("total_pages") int totalPages,
        List<Page> pages
) {
    public CompletedCorpus {
        pages = pages != null ? List.copyOf(pages) : List.of();
    }
}
