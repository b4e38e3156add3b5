package de.mirkosertic.mcp.wikiassistant.mcp.dto;

import de.mirkosertic.mcp.wikiassistant.mcp.ToolResponse;
import de.mirkosertic.mcp.wikiassistant.crawler.CrawlRunSummary;
import de.mirkosertic.mcp.wikiassistant.crawler.CrawlStatistics;
import de.mirkosertic.mcp.wikiassistant.crawler.FetchError;
import org.jspecify.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response DTO for the getCrawlerStats tool.
 */
public record CrawlerStatsResponse(
        boolean success,
        @Nullable String mode,
        long pagesAccepted,
        long duplicatesSkipped,
        long emptyPages,
        long pagesFailed,
        Map<String, Long> failuresByType,
        long persists,
        long persistFailures,
        long corpusSize,
        long cursor,
        long goal,
        double progressPercent,
        double pagesPerSecond,
        long elapsedTimeMs,
        @Nullable String lastRunOutcome,
        @Nullable String lastRunMessage,
        @Nullable String lastRunCorpusFile,
        String error
) implements ToolResponse {

    public static CrawlerStatsResponse success(final CrawlStatistics stats, @Nullable final CrawlRunSummary lastRun) {
        final Map<String, Long> failures = new LinkedHashMap<>();
        for (final Map.Entry<FetchError, Long> entry : stats.failuresByType().entrySet()) {
            failures.put(entry.getKey().name(), entry.getValue());
        }
        return new CrawlerStatsResponse(
                true,
                stats.mode() != null ? stats.mode().name() : null,
                stats.pagesAccepted(),
                stats.duplicatesSkipped(),
                stats.emptyPages(),
                stats.pagesFailed(),
                failures,
                stats.persists(),
                stats.persistFailures(),
                stats.corpusSize(),
                stats.cursor(),
                stats.goal(),
                stats.progressPercent(),
                stats.pagesPerSecond(),
                stats.elapsedTimeMs(),
                lastRun != null ? lastRun.outcome().name() : null,
                lastRun != null ? lastRun.message() : null,
                lastRun != null ? lastRun.corpusFile().toString() : null,
                null
        );
    }

    public static CrawlerStatsResponse error(final String errorMessage) {
        return new CrawlerStatsResponse(false, null, 0, 0, 0, 0, Map.of(), 0, 0, 0, 0, 0, 0, 0, 0,
                null, null, null, errorMessage);
    }
}
