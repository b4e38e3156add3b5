package de.mirkosertic.mcp.wikiassistant.crawler;

import org.jspecify.annotations.Nullable;

import java.util.Map;

public record CrawlStatistics(
        /** Mode of the current or last run, {@code null} before the first run. */
        @Nullable CrawlMode mode,
        /** Pages added to the corpus during this run. */
        long pagesAccepted,
        /** Random draws that resolved to an already known URL. */
        long duplicatesSkipped,
        /** Fetches that returned a document without a title container. */
        long emptyPages,
        Map<FetchError, Long> failuresByType,
        /** Successful writes of the corpus or checkpoint file. */
        long persists,
        /** Failed writes; each one means data at risk until the next successful write. */
        long persistFailures,
        /** Pages held in memory, including the ones loaded at start. */
        long corpusSize,
        /** Last processed oldid in systematic mode, 0 otherwise. */
        long cursor,
        /** Range end (systematic) or target page count (random). */
        long goal,
        long startTimeMs,
        long endTimeMs
) {
    public long pagesFailed() {
        long total = 0;
        for (final Long count : failuresByType.values()) {
            total += count;
        }
        return total;
    }

    public double pagesPerSecond() {
        final long elapsedMs = endTimeMs - startTimeMs;
        if (elapsedMs <= 0) return 0;
        return pagesAccepted / (elapsedMs / 1000.0);
    }

    public long elapsedTimeMs() {
        return endTimeMs - startTimeMs;
    }

    /**
     * Percentage of the goal reached: share of the oldid range walked, or share of the target
     * page count collected.
     */
    public double progressPercent() {
        if (goal <= 0) return 0;
        final long done = mode == CrawlMode.SYSTEMATIC ? cursor : corpusSize;
        return Math.min(100.0, done * 100.0 / goal);
    }
}
