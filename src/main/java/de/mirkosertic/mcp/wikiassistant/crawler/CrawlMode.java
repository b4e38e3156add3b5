package de.mirkosertic.mcp.wikiassistant.crawler;

import java.util.Locale;

/**
 * The two ways of building a corpus.
 */
public enum CrawlMode {
    /** Walk a contiguous revision id range, resumable via the persisted cursor. */
    SYSTEMATIC,
    /** Draw pages from the random page endpoint until a target count is reached. */
    RANDOM;

    /**
     * Parse a mode name, case-insensitive.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static CrawlMode parse(final String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Crawl mode must not be empty");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown crawl mode '" + value + "', expected systematic or random", e);
        }
    }
}
