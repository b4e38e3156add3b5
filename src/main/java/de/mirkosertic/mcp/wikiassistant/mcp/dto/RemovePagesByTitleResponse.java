package de.mirkosertic.mcp.wikiassistant.mcp.dto;

import de.mirkosertic.mcp.wikiassistant.mcp.ToolResponse;

/**
 * Response DTO for the removePagesByTitle tool.
 */
public record RemovePagesByTitleResponse(
        boolean success,
        Integer pagesRemoved,
        Integer pagesRemaining,
        String message,
        String error
) implements ToolResponse {

    public static RemovePagesByTitleResponse success(final int pagesRemoved, final int pagesRemaining) {
        return new RemovePagesByTitleResponse(true, pagesRemoved, pagesRemaining,
                "Removed " + pagesRemoved + " page(s), " + pagesRemaining + " remaining", null);
    }

    public static RemovePagesByTitleResponse notConfirmed() {
        return new RemovePagesByTitleResponse(false, null, null, null,
                "Operation not confirmed. Set confirm=true to proceed. "
                        + "WARNING: matching pages are deleted from the corpus file.");
    }

    public static RemovePagesByTitleResponse crawlRunning() {
        return new RemovePagesByTitleResponse(false, null, null, null,
                "A crawl is in progress and would overwrite the corpus. Stop it first.");
    }

    public static RemovePagesByTitleResponse error(final String errorMessage) {
        return new RemovePagesByTitleResponse(false, null, null, null, errorMessage);
    }
}
