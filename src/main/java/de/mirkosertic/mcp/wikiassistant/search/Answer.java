package de.mirkosertic.mcp.wikiassistant.search;

import java.util.List;

/**
 * Result of answering a question, with the keywords and pages that shaped the answer.
 *
 * @param generationFailed true if {@code text} is an {@code AI Error: ...} message instead of an answer
 */
public record Answer(
        String question,
        String text,
        List<WeightedKeyword> keywords,
        List<MatchResult> contextPages,
        boolean generationFailed
) {
}
