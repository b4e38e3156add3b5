package de.mirkosertic.mcp.wikiassistant.mcp.dto;

import de.mirkosertic.mcp.wikiassistant.mcp.Description;
import de.mirkosertic.mcp.wikiassistant.crawler.CrawlMode;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the startCrawl tool.
 */
public record StartCrawlRequest(
        @Nullable
        @Description("'systematic' walks the configured oldid range, 'random' follows the random-page "
                + "endpoint until targetPages distinct pages are collected. Default is 'systematic'.")
        String mode,

        @Nullable
        @Description("Random mode only: total number of distinct pages to collect. Default is the configured target.")
        Integer targetPages
) {
    public static StartCrawlRequest fromMap(final Map<String, Object> args) {
        return new StartCrawlRequest(
                (String) args.get("mode"),
                args.get("targetPages") != null ? ((Number) args.get("targetPages")).intValue() : null);
    }

    /**
     * @throws IllegalArgumentException if the mode is not recognized
     */
    public CrawlMode effectiveMode() {
        return mode == null || mode.isBlank() ? CrawlMode.SYSTEMATIC : CrawlMode.parse(mode);
    }
}
