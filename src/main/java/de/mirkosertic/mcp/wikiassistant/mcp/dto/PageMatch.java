package de.mirkosertic.mcp.wikiassistant.mcp.dto;

import de.mirkosertic.mcp.wikiassistant.search.MatchResult;

import java.util.ArrayList;
import java.util.List;

/**
 * A ranked page without its content.
 */
public record PageMatch(
        String id,
        String title,
        String url,
        List<String> categories,
        int wordCount,
        double score
) {
    public static List<PageMatch> fromMatches(final List<MatchResult> matches) {
        final List<PageMatch> result = new ArrayList<>(matches.size());
        for (final MatchResult match : matches) {
            result.add(new PageMatch(
                    match.page().id(),
                    match.page().title(),
                    match.page().url(),
                    match.page().categories(),
                    match.page().wordCount(),
                    match.score()));
        }
        return result;
    }
}
