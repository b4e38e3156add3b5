package de.mirkosertic.mcp.wikiassistant.search;

import de.mirkosertic.mcp.wikiassistant.corpus.CorpusRepository;
import de.mirkosertic.mcp.wikiassistant.corpus.Page;
import de.mirkosertic.mcp.wikiassistant.crawler.CrawlCompletionListener;
import de.mirkosertic.mcp.wikiassistant.crawler.CrawlRunSummary;
import de.mirkosertic.mcp.wikiassistant.generation.TextGenerationException;
import de.mirkosertic.mcp.wikiassistant.generation.TextGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Answers questions from the persisted corpus.
 * <p>
 * The corpus is read once and cached; it is reloaded when a crawl that wrote the same file
 * finishes, or on request. Queries only ever read the cached list.
 */
public class WikiQuestionService implements CrawlCompletionListener {

    private static final Logger logger = LoggerFactory.getLogger(WikiQuestionService.class);

    static final String EMPTY_QUESTION_ANSWER = "Please ask me something!";
    static final String GENERATION_ERROR_PREFIX = "AI Error: ";

    private final CorpusRepository repository;
    private final Path corpusFile;
    private final KeywordExtractor keywordExtractor;
    private final RelevanceScorer scorer;
    private final PromptBuilder promptBuilder;
    private final TextGenerator generator;
    private final int topPages;

    private volatile List<Page> pages = List.of();

    public WikiQuestionService(
            final CorpusRepository repository,
            final Path corpusFile,
            final KeywordExtractor keywordExtractor,
            final RelevanceScorer scorer,
            final PromptBuilder promptBuilder,
            final TextGenerator generator,
            final int topPages) {
        if (topPages < 1) {
            throw new IllegalArgumentException("topPages must be positive, was " + topPages);
        }
        this.repository = repository;
        this.corpusFile = corpusFile;
        this.keywordExtractor = keywordExtractor;
        this.scorer = scorer;
        this.promptBuilder = promptBuilder;
        this.generator = generator;
        this.topPages = topPages;
    }

    /**
     * Load the corpus, logging instead of failing when it is missing or unreadable.
     */
    public void init() {
        try {
            reload();
        } catch (final IOException e) {
            logger.error("Failed to load corpus {}, answering without wiki context", corpusFile, e);
        }
    }

    /**
     * Re-read the corpus file. The previous pages stay in use if reading fails.
     *
     * @return number of pages now loaded
     */
    public int reload() throws IOException {
        final List<Page> loaded = repository.loadPages(corpusFile);
        pages = List.copyOf(loaded);
        logger.info("Loaded {} wiki pages from {}", loaded.size(), corpusFile);
        return loaded.size();
    }

    @Override
    public void onCrawlFinished(final CrawlRunSummary summary) {
        if (!summary.corpusFile().toAbsolutePath().normalize().equals(corpusFile.toAbsolutePath().normalize())) {
            return;
        }
        logger.info("Crawl wrote {}, reloading corpus", corpusFile);
        init();
    }

    /**
     * Answer a question with the most relevant pages as context.
     * Generator failures are returned as an {@code AI Error: ...} answer, never thrown.
     */
    public Answer answer(final String question) {
        if (question == null || question.isBlank()) {
            return new Answer("", EMPTY_QUESTION_ANSWER, List.of(), List.of(), false);
        }

        logger.info("Processing question: {}", question);
        final SearchOutcome outcome = search(question, topPages);
        final List<Page> contextPages = new ArrayList<>(outcome.matches().size());
        for (final MatchResult match : outcome.matches()) {
            contextPages.add(match.page());
        }

        final String prompt = promptBuilder.answerPrompt(question, promptBuilder.formatContext(contextPages));
        try {
            final String text = generator.generate(prompt);
            return new Answer(question, text, outcome.keywords(), outcome.matches(), false);
        } catch (final TextGenerationException e) {
            logger.warn("Answer generation failed: {}", e.getMessage());
            return new Answer(question, GENERATION_ERROR_PREFIX + e.getMessage(),
                    outcome.keywords(), outcome.matches(), true);
        }
    }

    /**
     * Keywords for the question and the best matching pages, without generating an answer.
     */
    public SearchOutcome search(final String question, final int topN) {
        final List<Page> corpus = pages;
        if (corpus.isEmpty()) {
            logger.warn("No wiki pages loaded, nothing to search");
            return new SearchOutcome(List.of(), List.of());
        }
        final List<WeightedKeyword> keywords = keywordExtractor.extract(question);
        final List<MatchResult> matches = scorer.rankWithScores(corpus, keywords, topN);
        logger.info("Using top {} of the matching pages for '{}'", matches.size(), question);
        if (!matches.isEmpty()) {
            final List<String> titles = new ArrayList<>();
            for (final MatchResult match : matches.subList(0, Math.min(5, matches.size()))) {
                titles.add(match.page().title());
            }
            logger.debug("Top pages: {}", String.join(", ", titles));
        }
        return new SearchOutcome(keywords, matches);
    }

    /**
     * Find a page by id, or failing that by exact (case-insensitive) title.
     */
    public Optional<Page> findPage(final String idOrTitle) {
        final List<Page> corpus = pages;
        for (final Page page : corpus) {
            if (page.id().equals(idOrTitle)) {
                return Optional.of(page);
            }
        }
        for (final Page page : corpus) {
            if (page.title().equalsIgnoreCase(idOrTitle)) {
                return Optional.of(page);
            }
        }
        return Optional.empty();
    }

    public List<Page> getPages() {
        return pages;
    }

    public Path getCorpusFile() {
        return corpusFile;
    }

    public int getTopPages() {
        return topPages;
    }
}
