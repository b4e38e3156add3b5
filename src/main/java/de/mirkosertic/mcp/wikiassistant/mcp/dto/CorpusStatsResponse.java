package de.mirkosertic.mcp.wikiassistant.mcp.dto;

import de.mirkosertic.mcp.wikiassistant.mcp.ToolResponse;
import org.jspecify.annotations.Nullable;

/**
 * Response DTO for the getCorpusStats tool.
 *
 * @param lastOldid highest revision id among the loaded pages, absent for corpora built by random discovery
 */
public record CorpusStatsResponse(
        boolean success,
        String corpusFile,
        int pageCount,
        long totalWords,
        @Nullable Long lastOldid,
        String error
) implements ToolResponse {

    public static CorpusStatsResponse success(final String corpusFile, final int pageCount, final long totalWords,
                                              @Nullable final Long lastOldid) {
        return new CorpusStatsResponse(true, corpusFile, pageCount, totalWords, lastOldid, null);
    }

    public static CorpusStatsResponse error(final String errorMessage) {
        return new CorpusStatsResponse(false, null, 0, 0, null, errorMessage);
    }
}
