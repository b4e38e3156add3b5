package de.mirkosertic.mcp.wikiassistant.mcp.dto;

import de.mirkosertic.mcp.wikiassistant.crawler.CrawlRunSummary;
import de.mirkosertic.mcp.wikiassistant.crawler.WikiCrawlerService;
import de.mirkosertic.mcp.wikiassistant.mcp.ToolResponse;
import org.jspecify.annotations.Nullable;

/**
 * Response DTO for the getCrawlerStatus tool. The last run fields stay empty until a crawl has finished.
 */
public record CrawlerStatusResponse(
        boolean success,
        String state,
        String lastRunMode,
        String lastRunOutcome,
        String lastRunMessage,
        String error
) implements ToolResponse {

    public static CrawlerStatusResponse success(final WikiCrawlerService.CrawlerState state,
                                                final @Nullable CrawlRunSummary lastRun) {
        return new CrawlerStatusResponse(true,
                state.name(),
                lastRun != null ? lastRun.mode().name() : null,
                lastRun != null ? lastRun.outcome().name() : null,
                lastRun != null ? lastRun.message() : null,
                null);
    }
}
