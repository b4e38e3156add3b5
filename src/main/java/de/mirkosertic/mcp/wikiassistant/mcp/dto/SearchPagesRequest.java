package de.mirkosertic.mcp.wikiassistant.mcp.dto;

import de.mirkosertic.mcp.wikiassistant.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the searchPages tool.
 */
public record SearchPagesRequest(
        @Description("Question or search phrase; it is turned into weighted keywords before ranking")
        String question,

        @Nullable
        @Description("Maximum number of pages to return. Default is the configured top-pages value, maximum is 50.")
        Integer topN
) {
    static final int MAX_TOP_N = 50;

    public static SearchPagesRequest fromMap(final Map<String, Object> args) {
        return new SearchPagesRequest(
                (String) args.get("question"),
                args.get("topN") != null ? ((Number) args.get("topN")).intValue() : null);
    }

    public int effectiveTopN(final int defaultTopN) {
        return (topN != null && topN > 0) ? Math.min(topN, MAX_TOP_N) : defaultTopN;
    }
}
