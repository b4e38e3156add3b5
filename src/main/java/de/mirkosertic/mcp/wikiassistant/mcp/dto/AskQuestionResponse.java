package de.mirkosertic.mcp.wikiassistant.mcp.dto;

import de.mirkosertic.mcp.wikiassistant.mcp.ToolResponse;
import de.mirkosertic.mcp.wikiassistant.search.Answer;

import java.util.List;

/**
 * Response DTO for the askQuestion tool.
 * <p>
 * A failing text generator still yields {@code success=true}: the answer then starts with
 * {@code AI Error:} and {@code generationFailed} is set.
 */
public record AskQuestionResponse(
        boolean success,
        String question,
        String answer,
        boolean generationFailed,
        List<KeywordWeight> keywords,
        List<PageMatch> contextPages,
        String error
) implements ToolResponse {

    public static AskQuestionResponse success(final Answer answer) {
        return new AskQuestionResponse(true,
                answer.question(),
                answer.text(),
                answer.generationFailed(),
                KeywordWeight.fromKeywords(answer.keywords()),
                PageMatch.fromMatches(answer.contextPages()),
                null);
    }

    public static AskQuestionResponse error(final String errorMessage) {
        return new AskQuestionResponse(false, null, null, false, List.of(), List.of(), errorMessage);
    }
}
