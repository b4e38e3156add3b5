package de.mirkosertic.mcp.wikiassistant.search;

import de.mirkosertic.mcp.wikiassistant.corpus.Page;

import java.util.List;

/**
 * Builds the prompts sent to the text generator.
 */
public class PromptBuilder {

    static final String NO_PAGES_CONTEXT = "No relevant wiki pages found.";

    private final String siteName;
    private final String siteDescription;

    /**
     * @param siteName        short name of the wiki's organisation, for example {@code FOSSCELL}
     * @param siteDescription expansion of the name, may be empty
     */
    public PromptBuilder(final String siteName, final String siteDescription) {
        this.siteName = siteName;
        this.siteDescription = siteDescription != null ? siteDescription : "";
    }

    /**
     * Prompt asking for {@code keyword:weight} lines.
     */
    public String keywordPrompt(final String question) {
        return """
                Extract keywords with importance weights from this question for searching a technical wiki database.

                Question: %s

                Instructions:
                - Extract 5-15 keywords with their importance weights (1-10, where 10 is most important)
                - Include exact terms from the question with highest weights
                - Format as: keyword:weight (one per line)
                - No explanations, just keyword:weight pairs
                - Only generate necessary keywords
                - Don't assume keywords, just generate based on the question.
                - Ignore common words like "the", "is", "in", "what", "how", "why", "an", "a", "and", "or", "but", "if", "then", "else", "there", "here", "now", etc.

                Example format:
                docker:10
                container:9
                deployment:2
                devops:1

                Keywords with weights:""".formatted(question);
    }

    /**
     * Render the selected pages as numbered context blocks.
     */
    public String formatContext(final List<Page> pages) {
        if (pages.isEmpty()) {
            return NO_PAGES_CONTEXT;
        }
        final StringBuilder context = new StringBuilder();
        context.append("Relevant ").append(siteName).append(" Wiki Pages:\n\n");
        int index = 1;
        for (final Page page : pages) {
            context.append("=== Page ").append(index++).append(": ").append(page.title()).append(" ===\n");
            if (!page.categories().isEmpty()) {
                context.append("Categories: ").append(String.join(", ", page.categories())).append('\n');
            }
            context.append("URL: ").append(page.url()).append('\n');
            context.append("Content: ").append(page.content()).append("\n\n");
        }
        return context.toString();
    }

    /**
     * The answering prompt with the wiki context embedded.
     */
    public String answerPrompt(final String question, final String wikiContext) {
        final String assistantFor = siteDescription.isBlank() ? siteName : siteName + " (" + siteDescription + ")";
        return """
                You are a helpful AI assistant for %s.

                I have selected the most relevant pages from the %s wiki database based on your question:

                %s

                User Question: %s

                Instructions:
                - Use the %s wiki information above to answer the user's question
                - Reference specific pages, tutorials, or resources when relevant
                - If the question is not fully covered in the wiki, provide helpful general information
                - Be friendly and informative
                - Mention page titles when referencing specific information
                - Keep answers comprehensive but well-organized

                Answer:""".formatted(assistantFor, siteName, wikiContext, question, siteName);
    }
}
