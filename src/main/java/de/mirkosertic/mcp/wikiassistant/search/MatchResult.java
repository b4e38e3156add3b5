package de.mirkosertic.mcp.wikiassistant.search;

import de.mirkosertic.mcp.wikiassistant.corpus.Page;

/**
 * A page together with its relevance score for one query.
 */
public record MatchResult(Page page, double score) {
}
