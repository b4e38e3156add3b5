package de.mirkosertic.mcp.wikiassistant.mcp.dto;

import de.mirkosertic.mcp.wikiassistant.mcp.ToolResponse;

/**
 * Response DTO for tools that only report an outcome: stopCrawler, pauseCrawler, resumeCrawler.
 */
public record SimpleMessageResponse(
        boolean success,
        String message,
        String error
) implements ToolResponse {
    public static SimpleMessageResponse success(final String message) {
        return new SimpleMessageResponse(true, message, null);
    }

    public static SimpleMessageResponse error(final String errorMessage) {
        return new SimpleMessageResponse(false, null, errorMessage);
    }
}
