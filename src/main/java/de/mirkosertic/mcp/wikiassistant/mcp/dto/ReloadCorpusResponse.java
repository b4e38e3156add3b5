package de.mirkosertic.mcp.wikiassistant.mcp.dto;

import de.mirkosertic.mcp.wikiassistant.mcp.ToolResponse;

/**
 * Response DTO for the reloadCorpus tool.
 */
public record ReloadCorpusResponse(
        boolean success,
        String corpusFile,
        Integer pageCount,
        String error
) implements ToolResponse {

    public static ReloadCorpusResponse success(final String corpusFile, final int pageCount) {
        return new ReloadCorpusResponse(true, corpusFile, pageCount, null);
    }

    public static ReloadCorpusResponse error(final String errorMessage) {
        return new ReloadCorpusResponse(false, null, null, errorMessage);
    }
}
