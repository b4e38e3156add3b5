package de.mirkosertic.mcp.wikiassistant.mcp.dto;

import de.mirkosertic.mcp.wikiassistant.search.WeightedKeyword;

import java.util.ArrayList;
import java.util.List;

/**
 * A search keyword and its importance (1-10) as reported to the client.
 */
public record KeywordWeight(String term, double weight) {

    public static List<KeywordWeight> fromKeywords(final List<WeightedKeyword> keywords) {
        final List<KeywordWeight> result = new ArrayList<>(keywords.size());
        for (final WeightedKeyword keyword : keywords) {
            result.add(new KeywordWeight(keyword.term(), keyword.weight()));
        }
        return result;
    }
}
