package de.mirkosertic.mcp.wikiassistant.mcp.dto;

import de.mirkosertic.mcp.wikiassistant.mcp.ToolResponse;
import de.mirkosertic.mcp.wikiassistant.search.SearchOutcome;

import java.util.List;

/**
 * Response DTO for the searchPages tool.
 */
public record SearchPagesResponse(
        boolean success,
        List<KeywordWeight> keywords,
        List<PageMatch> matches,
        int corpusSize,
        String error
) implements ToolResponse {

    public static SearchPagesResponse success(final SearchOutcome outcome, final int corpusSize) {
        return new SearchPagesResponse(true,
                KeywordWeight.fromKeywords(outcome.keywords()),
                PageMatch.fromMatches(outcome.matches()),
                corpusSize,
                null);
    }

    public static SearchPagesResponse error(final String errorMessage) {
        return new SearchPagesResponse(false, List.of(), List.of(), 0, errorMessage);
    }
}
