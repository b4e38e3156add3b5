package de.mirkosertic.mcp.wikiassistant.corpus;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Persisted form of a systematic (oldid range) crawl, stored in the corpus file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"pages", "total_pages", "last_updated", "last_oldid"})
public record CorpusState(
        List<Page> pages,
        /** Number of pages, always {@code pages.size()} when written. */
        @JsonProperty("total_pages") int totalPages,
        /** Epoch seconds of the last write. */
        @JsonProperty("last_updated") double lastUpdated,
        /** Last processed revision id; 0 when nothing has been processed yet. */
        @JsonProperty("last_oldid") long lastOldid
) {
    public CorpusState {
        pages = pages != null ? List.copyOf(pages) : List.of();
    }

    public static CorpusState empty() {
        return new CorpusState(List.of(), 0, Page.nowEpochSeconds(), 0);
    }
}
