package de.mirkosertic.mcp.wikiassistant.generation;

/**
 * Black-box text generation capability used for keyword weighting and answering.
 */
@FunctionalInterface
public interface TextGenerator {

    /**
     * Generate a completion for the given prompt.
     *
     * @throws TextGenerationException if the backend is unreachable or answers with something unusable
     */
    String generate(String prompt) throws TextGenerationException;
}
