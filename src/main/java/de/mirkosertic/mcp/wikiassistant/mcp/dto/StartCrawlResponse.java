package de.mirkosertic.mcp.wikiassistant.mcp.dto;

import de.mirkosertic.mcp.wikiassistant.mcp.ToolResponse;
import de.mirkosertic.mcp.wikiassistant.crawler.CrawlMode;

/**
 * Response DTO for the startCrawl tool.
 */
public record StartCrawlResponse(
        boolean success,
        String mode,
        Integer targetPages,
        String message,
        String error
) implements ToolResponse {

    public static StartCrawlResponse success(final CrawlMode mode, final Integer targetPages) {
        return new StartCrawlResponse(true, mode.name(), targetPages,
                "Crawl started. Use getCrawlerStats to follow its progress.", null);
    }

    public static StartCrawlResponse alreadyRunning() {
        return new StartCrawlResponse(false, null, null, null,
                "A crawl is already in progress. Use stopCrawler first or wait until it finishes.");
    }

    public static StartCrawlResponse error(final String errorMessage) {
        return new StartCrawlResponse(false, null, null, null, errorMessage);
    }
}
