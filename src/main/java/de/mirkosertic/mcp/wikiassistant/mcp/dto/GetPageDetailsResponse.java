package de.mirkosertic.mcp.wikiassistant.mcp.dto;

import de.mirkosertic.mcp.wikiassistant.mcp.ToolResponse;
import de.mirkosertic.mcp.wikiassistant.corpus.Page;

import java.util.List;

/**
 * Response DTO for the getPageDetails tool.
 */
public record GetPageDetailsResponse(
        boolean success,
        String id,
        Long oldid,
        String title,
        String url,
        List<String> categories,
        Integer wordCount,
        Double scrapedAt,
        String content,
        String error
) implements ToolResponse {

    public static GetPageDetailsResponse success(final Page page) {
        return new GetPageDetailsResponse(true, page.id(), page.oldid(), page.title(), page.url(),
                page.categories(), page.wordCount(), page.scrapedAt(), page.content(), null);
    }

    public static GetPageDetailsResponse notFound(final String idOrTitle) {
        return error("Page not found in corpus: " + idOrTitle);
    }

    public static GetPageDetailsResponse error(final String errorMessage) {
        return new GetPageDetailsResponse(false, null, null, null, null, null, null, null, null, errorMessage);
    }
}
