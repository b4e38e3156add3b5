package de.mirkosertic.mcp.wikiassistant.mcp.dto;

import de.mirkosertic.mcp.wikiassistant.mcp.Description;

import java.util.Map;

/**
 * Request DTO for the getPageDetails tool.
 */
public record GetPageDetailsRequest(
        @Description("Page id (the oldid, or the URL for randomly discovered pages) or exact page title, case-insensitive")
        String page
) {
    public static GetPageDetailsRequest fromMap(final Map<String, Object> args) {
        return new GetPageDetailsRequest((String) args.get("page"));
    }
}
