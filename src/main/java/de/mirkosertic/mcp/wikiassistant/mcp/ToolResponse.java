package de.mirkosertic.mcp.wikiassistant.mcp;

/**
 * Common shape of all tool response DTOs: {@code success=false} marks a failed tool call.
 * Records with a {@code boolean success} component implement this without further code.
 */
public interface ToolResponse {

    boolean success();
}
