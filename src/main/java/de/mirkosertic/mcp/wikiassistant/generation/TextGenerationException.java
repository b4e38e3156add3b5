package de.mirkosertic.mcp.wikiassistant.generation;

/**
 * The text generation backend failed to produce an answer.
 */
public class TextGenerationException extends Exception {

    public TextGenerationException(final String message) {
        super(message);
    }

    public TextGenerationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
