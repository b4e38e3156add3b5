package de.mirkosertic.mcp.wikiassistant.crawler;

/**
 * Notified on the crawl thread after a run has persisted its final state.
 */
@FunctionalInterface
public interface CrawlCompletionListener {

    void onCrawlFinished(CrawlRunSummary summary);
}
