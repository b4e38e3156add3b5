package de.mirkosertic.mcp.wikiassistant.mcp.dto;

import de.mirkosertic.mcp.wikiassistant.mcp.Description;

import java.util.Map;

/**
 * Request DTO for the askQuestion tool.
 */
public record AskQuestionRequest(
        @Description(value = "Natural-language question about the wiki's content",
                examples = {"How do I install Docker?", "What is the FOSSCELL mentorship program?"})
        String question
) {
    public static AskQuestionRequest fromMap(final Map<String, Object> args) {
        return new AskQuestionRequest((String) args.get("question"));
    }
}
