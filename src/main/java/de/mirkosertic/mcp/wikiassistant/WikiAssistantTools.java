package de.mirkosertic.mcp.wikiassistant;

import de.mirkosertic.mcp.wikiassistant.corpus.CorpusRepository;
import de.mirkosertic.mcp.wikiassistant.corpus.Page;
import de.mirkosertic.mcp.wikiassistant.crawler.CrawlMode;
import de.mirkosertic.mcp.wikiassistant.crawler.CrawlStatistics;
import de.mirkosertic.mcp.wikiassistant.crawler.WikiCrawlerService;
import de.mirkosertic.mcp.wikiassistant.mcp.SchemaGenerator;
import de.mirkosertic.mcp.wikiassistant.mcp.ToolResultHelper;
import de.mirkosertic.mcp.wikiassistant.mcp.dto.AskQuestionRequest;
import de.mirkosertic.mcp.wikiassistant.mcp.dto.AskQuestionResponse;
import de.mirkosertic.mcp.wikiassistant.mcp.dto.CorpusStatsResponse;
import de.mirkosertic.mcp.wikiassistant.mcp.dto.CrawlerStatsResponse;
import de.mirkosertic.mcp.wikiassistant.mcp.dto.CrawlerStatusResponse;
import de.mirkosertic.mcp.wikiassistant.mcp.dto.GetPageDetailsRequest;
import de.mirkosertic.mcp.wikiassistant.mcp.dto.GetPageDetailsResponse;
import de.mirkosertic.mcp.wikiassistant.mcp.dto.ReloadCorpusResponse;
import de.mirkosertic.mcp.wikiassistant.mcp.dto.RemovePagesByTitleRequest;
import de.mirkosertic.mcp.wikiassistant.mcp.dto.RemovePagesByTitleResponse;
import de.mirkosertic.mcp.wikiassistant.mcp.dto.SearchPagesRequest;
import de.mirkosertic.mcp.wikiassistant.mcp.dto.SearchPagesResponse;
import de.mirkosertic.mcp.wikiassistant.mcp.dto.SimpleMessageResponse;
import de.mirkosertic.mcp.wikiassistant.mcp.dto.StartCrawlRequest;
import de.mirkosertic.mcp.wikiassistant.mcp.dto.StartCrawlResponse;
import de.mirkosertic.mcp.wikiassistant.search.Answer;
import de.mirkosertic.mcp.wikiassistant.search.SearchOutcome;
import de.mirkosertic.mcp.wikiassistant.search.WikiQuestionService;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * MCP tools for asking questions against the wiki corpus and for driving the crawler.
 */
public class WikiAssistantTools {

    private static final Logger logger = LoggerFactory.getLogger(WikiAssistantTools.class);

    private static final String ASK_DESCRIPTION = """
            Answer a question using the crawled wiki as context. \
            The question is turned into weighted keywords, the best matching wiki pages are selected \
            and handed to the text generator together with the question. \
            Returns the answer, the keywords with their weights and the pages used as context (with scores). \
            If the generator fails, the answer starts with 'AI Error:'.""";

    private static final String SEARCH_DESCRIPTION = """
            Rank wiki pages for a question without generating an answer. \
            Scoring is lexical and case-insensitive: exact and partial title matches weigh most, \
            then category matches, then occurrences in the page content. \
            Pages that match no keyword are not returned.""";

    private final WikiQuestionService questionService;
    private final WikiCrawlerService crawlerService;
    private final CorpusRepository repository;

    public WikiAssistantTools(final WikiQuestionService questionService,
                              final WikiCrawlerService crawlerService,
                              final CorpusRepository repository) {
        this.questionService = questionService;
        this.crawlerService = crawlerService;
        this.repository = repository;
    }

    public List<McpServerFeatures.SyncToolSpecification> getToolSpecifications() {
        final List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();

        tools.add(tool("askQuestion", ASK_DESCRIPTION,
                SchemaGenerator.generateSchema(AskQuestionRequest.class), this::askQuestion));

        tools.add(tool("searchPages", SEARCH_DESCRIPTION,
                SchemaGenerator.generateSchema(SearchPagesRequest.class), this::searchPages));

        tools.add(tool("startCrawl",
                "Start crawling the wiki in the background. 'systematic' resumes the oldid range walk where the "
                        + "last run stopped; 'random' resumes from the checkpoint and collects distinct pages "
                        + "until targetPages is reached. Progress is saved periodically, so a stopped crawl loses little.",
                SchemaGenerator.generateSchema(StartCrawlRequest.class), this::startCrawl));

        tools.add(tool("stopCrawler",
                "Stop the running crawl. The crawler saves its progress before it ends; startCrawl continues from there.",
                SchemaGenerator.emptySchema(), args -> stopCrawler()));

        tools.add(tool("pauseCrawler",
                "Pause an ongoing crawl after the current batch. The crawler can be resumed later.",
                SchemaGenerator.emptySchema(), args -> pauseCrawler()));

        tools.add(tool("resumeCrawler",
                "Resume a paused crawl.",
                SchemaGenerator.emptySchema(), args -> resumeCrawler()));

        tools.add(tool("getCrawlerStatus",
                "Get the crawler state (IDLE, CRAWLING, PAUSED or STOPPING) and the outcome of the last finished crawl.",
                SchemaGenerator.emptySchema(), args -> getCrawlerStatus()));

        tools.add(tool("getCrawlerStats",
                "Get statistics of the current or last crawl: pages accepted, duplicates, empty pages, "
                        + "failures by type, saves, progress and throughput.",
                SchemaGenerator.emptySchema(), args -> getCrawlerStats()));

        tools.add(tool("getCorpusStats",
                "Get statistics about the corpus used for answering: file, page count, total words and last oldid.",
                SchemaGenerator.emptySchema(), args -> getCorpusStats()));

        tools.add(tool("getPageDetails",
                "Get one page of the corpus including its full text, by id or exact title.",
                SchemaGenerator.generateSchema(GetPageDetailsRequest.class), this::getPageDetails));

        tools.add(tool("removePagesByTitle",
                "Remove every page whose title contains the given text from the corpus file, for example "
                        + "error pages or login walls that slipped into the crawl. Requires confirm=true.",
                SchemaGenerator.generateSchema(RemovePagesByTitleRequest.class), this::removePagesByTitle));

        tools.add(tool("reloadCorpus",
                "Re-read the corpus file from disk, for example after it was edited or replaced.",
                SchemaGenerator.emptySchema(), args -> reloadCorpus()));

        return tools;
    }

    private static McpServerFeatures.SyncToolSpecification tool(
            final String name,
            final String description,
            final McpSchema.JsonSchema inputSchema,
            final Function<Map<String, Object>, McpSchema.CallToolResult> handler) {
        return McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name(name)
                        .description(description)
                        .inputSchema(inputSchema)
                        .build())
                .callHandler((exchange, request) -> handler.apply(
                        request.arguments() != null ? request.arguments() : Map.of()))
                .build();
    }

    // Tool implementation methods
    McpSchema.CallToolResult askQuestion(final Map<String, Object> args) {
        final AskQuestionRequest request = AskQuestionRequest.fromMap(args);

        logger.info("Ask question request: question='{}'", request.question());

        try {
            final long startTime = System.nanoTime();
            final Answer answer = questionService.answer(request.question());
            final long durationMs = (System.nanoTime() - startTime) / 1_000_000;

            logger.info("Question answered in {}ms using {} context page(s), generationFailed={}",
                    durationMs, answer.contextPages().size(), answer.generationFailed());

            return ToolResultHelper.createResult(AskQuestionResponse.success(answer));

        } catch (final RuntimeException e) {
            logger.error("Error answering question", e);
            return ToolResultHelper.createResult(AskQuestionResponse.error("Error answering question: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult searchPages(final Map<String, Object> args) {
        final SearchPagesRequest request = SearchPagesRequest.fromMap(args);

        logger.info("Search pages request: question='{}', topN={}", request.question(), request.topN());

        if (request.question() == null || request.question().isBlank()) {
            return ToolResultHelper.createResult(SearchPagesResponse.error("Question must not be empty"));
        }

        try {
            final SearchOutcome outcome = questionService.search(
                    request.question(), request.effectiveTopN(questionService.getTopPages()));

            logger.info("Search returned {} page(s)", outcome.matches().size());

            return ToolResultHelper.createResult(
                    SearchPagesResponse.success(outcome, questionService.getPages().size()));

        } catch (final RuntimeException e) {
            logger.error("Search error", e);
            return ToolResultHelper.createResult(SearchPagesResponse.error("Search error: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult startCrawl(final Map<String, Object> args) {
        final StartCrawlRequest request = StartCrawlRequest.fromMap(args);

        logger.info("Start crawl request: mode={}, targetPages={}", request.mode(), request.targetPages());

        try {
            final CrawlMode mode = request.effectiveMode();
            if (!crawlerService.startCrawl(mode, request.targetPages())) {
                return ToolResultHelper.createResult(StartCrawlResponse.alreadyRunning());
            }
            final Integer target = mode == CrawlMode.RANDOM
                    ? (request.targetPages() != null ? request.targetPages() : crawlerService.getSettings().targetPages())
                    : null;
            logger.info("Crawl started: mode={}, targetPages={}", mode, target);

            return ToolResultHelper.createResult(StartCrawlResponse.success(mode, target));

        } catch (final IllegalArgumentException e) {
            logger.warn("Invalid crawl request: {}", e.getMessage());
            return ToolResultHelper.createResult(StartCrawlResponse.error(e.getMessage()));
        }
    }

    private McpSchema.CallToolResult stopCrawler() {
        logger.info("Stop crawler request");

        if (!crawlerService.stopCrawler()) {
            return ToolResultHelper.createResult(SimpleMessageResponse.error("No crawl is running"));
        }
        return ToolResultHelper.createResult(
                SimpleMessageResponse.success("Stop requested, the crawler saves its progress before it ends"));
    }

    private McpSchema.CallToolResult pauseCrawler() {
        logger.info("Pause crawler request");

        if (!crawlerService.isCrawling()) {
            return ToolResultHelper.createResult(SimpleMessageResponse.error("No crawl is running"));
        }
        crawlerService.pauseCrawler();
        return ToolResultHelper.createResult(SimpleMessageResponse.success("Crawler paused"));
    }

    private McpSchema.CallToolResult resumeCrawler() {
        logger.info("Resume crawler request");

        if (!crawlerService.isCrawling()) {
            return ToolResultHelper.createResult(SimpleMessageResponse.error("No crawl is running"));
        }
        crawlerService.resumeCrawler();
        return ToolResultHelper.createResult(SimpleMessageResponse.success("Crawler resumed"));
    }

    private McpSchema.CallToolResult getCrawlerStatus() {
        final WikiCrawlerService.CrawlerState state = crawlerService.getState();

        logger.info("Crawler state: {}", state);

        return ToolResultHelper.createResult(CrawlerStatusResponse.success(state, crawlerService.getLastRun()));
    }

    private McpSchema.CallToolResult getCrawlerStats() {
        logger.info("Crawler stats request");

        final CrawlStatistics stats = crawlerService.getStatistics();

        logger.info("Crawler stats: accepted={}, duplicates={}, failed={}",
                stats.pagesAccepted(), stats.duplicatesSkipped(), stats.pagesFailed());

        return ToolResultHelper.createResult(CrawlerStatsResponse.success(stats, crawlerService.getLastRun()));
    }

    private McpSchema.CallToolResult getCorpusStats() {
        logger.info("Corpus stats request");

        final List<Page> pages = questionService.getPages();
        long totalWords = 0;
        Long lastOldid = null;
        for (final Page page : pages) {
            totalWords += page.wordCount();
            if (page.oldid() != null && (lastOldid == null || page.oldid() > lastOldid)) {
                lastOldid = page.oldid();
            }
        }

        logger.info("Corpus stats: {} pages, {} words", pages.size(), totalWords);

        return ToolResultHelper.createResult(CorpusStatsResponse.success(
                questionService.getCorpusFile().toString(), pages.size(), totalWords, lastOldid));
    }

    McpSchema.CallToolResult getPageDetails(final Map<String, Object> args) {
        final GetPageDetailsRequest request = GetPageDetailsRequest.fromMap(args);

        logger.info("Get page details request: page='{}'", request.page());

        if (request.page() == null || request.page().isBlank()) {
            return ToolResultHelper.createResult(GetPageDetailsResponse.error("Page id or title must not be empty"));
        }

        final Optional<Page> page = questionService.findPage(request.page().trim());
        return ToolResultHelper.createResult(page
                .map(GetPageDetailsResponse::success)
                .orElseGet(() -> GetPageDetailsResponse.notFound(request.page())));
    }

    McpSchema.CallToolResult removePagesByTitle(final Map<String, Object> args) {
        final RemovePagesByTitleRequest request = RemovePagesByTitleRequest.fromMap(args);

        logger.info("Remove pages by title request: titleContains='{}', confirm={}",
                request.titleContains(), request.confirm());

        if (request.titleContains() == null || request.titleContains().isEmpty()) {
            return ToolResultHelper.createResult(RemovePagesByTitleResponse.error("titleContains must not be empty"));
        }
        if (!request.effectiveConfirm()) {
            return ToolResultHelper.createResult(RemovePagesByTitleResponse.notConfirmed());
        }

        try {
            final Optional<Integer> removed = crawlerService.tryExclusive(
                    () -> repository.removePagesByTitle(questionService.getCorpusFile(), request.titleContains()));
            if (removed.isEmpty()) {
                return ToolResultHelper.createResult(RemovePagesByTitleResponse.crawlRunning());
            }
            final int remaining = questionService.reload();

            logger.info("Removed {} page(s) whose title contains '{}', {} remaining",
                    removed.get(), request.titleContains(), remaining);

            return ToolResultHelper.createResult(RemovePagesByTitleResponse.success(removed.get(), remaining));

        } catch (final IOException e) {
            logger.error("Error removing pages from {}", questionService.getCorpusFile(), e);
            return ToolResultHelper.createResult(
                    RemovePagesByTitleResponse.error("Error removing pages: " + e.getMessage()));
        }
    }

    private McpSchema.CallToolResult reloadCorpus() {
        logger.info("Reload corpus request");

        try {
            final int pageCount = questionService.reload();
            return ToolResultHelper.createResult(
                    ReloadCorpusResponse.success(questionService.getCorpusFile().toString(), pageCount));

        } catch (final IOException e) {
            logger.error("Error reloading corpus", e);
            return ToolResultHelper.createResult(ReloadCorpusResponse.error("Error reloading corpus: " + e.getMessage()));
        }
    }
}
