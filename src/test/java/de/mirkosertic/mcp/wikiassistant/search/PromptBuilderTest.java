package de.mirkosertic.mcp.wikiassistant.search;

import de.mirkosertic.mcp.wikiassistant.corpus.Page;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PromptBuilder Tests")
class PromptBuilderTest {

    private final PromptBuilder builder = new PromptBuilder("FOSSCELL", "Free and Open Source Software Cell");

    @Test
    @DisplayName("Context blocks are numbered and list categories only when present")
    void formatsContext() {
        final List<Page> pages = List.of(
                Page.forRevision(1, "Docker", "https://wiki.example.org/index.php?oldid=1", "About docker",
                        List.of("DevOps", "Tools"), 0),
                Page.forUrl("https://wiki.example.org/index.php/Git", "Git", "About git", List.of(), 0));

        final String context = builder.formatContext(pages);

        assertThat(context).startsWith("Relevant FOSSCELL Wiki Pages:");
        assertThat(context).contains("=== Page 1: Docker ===\nCategories: DevOps, Tools\n"
                + "URL: https://wiki.example.org/index.php?oldid=1\nContent: About docker");
        assertThat(context).contains("=== Page 2: Git ===\nURL: https://wiki.example.org/index.php/Git");
    }

    @Test
    @DisplayName("An empty selection gives the no-pages notice")
    void emptyContext() {
        assertThat(builder.formatContext(List.of())).isEqualTo(PromptBuilder.NO_PAGES_CONTEXT);
    }

    @Test
    @DisplayName("The answer prompt leaves out an empty site description")
    void answerPromptWithoutDescription() {
        final String prompt = new PromptBuilder("ACME", "").answerPrompt("Why?", "ctx");

        assertThat(prompt).startsWith("You are a helpful AI assistant for ACME.");
        assertThat(prompt).contains("ctx").contains("User Question: Why?").endsWith("Answer:");
    }
}
