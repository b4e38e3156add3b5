package de.mirkosertic.mcp.wikiassistant.search;

import java.util.List;

/**
 * Keywords derived from a question and the pages they matched, best first.
 */
public record SearchOutcome(List<WeightedKeyword> keywords, List<MatchResult> matches) {
}
