package de.mirkosertic.mcp.wikiassistant;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.wikiassistant.config.ApplicationConfig;
import de.mirkosertic.mcp.wikiassistant.config.BuildInfo;
import de.mirkosertic.mcp.wikiassistant.config.LoggingConfigurator;
import de.mirkosertic.mcp.wikiassistant.corpus.CorpusRepository;
import de.mirkosertic.mcp.wikiassistant.crawler.CrawlExecutorService;
import de.mirkosertic.mcp.wikiassistant.crawler.CrawlMode;
import de.mirkosertic.mcp.wikiassistant.crawler.CrawlStatisticsTracker;
import de.mirkosertic.mcp.wikiassistant.crawler.CrawlerSettings;
import de.mirkosertic.mcp.wikiassistant.crawler.JsoupPageFetcher;
import de.mirkosertic.mcp.wikiassistant.crawler.WikiCrawlerService;
import de.mirkosertic.mcp.wikiassistant.crawler.WikiPageExtractor;
import de.mirkosertic.mcp.wikiassistant.generation.HttpTextGenerator;
import de.mirkosertic.mcp.wikiassistant.generation.TextGenerator;
import de.mirkosertic.mcp.wikiassistant.mcp.LatestProtocolStdioServerTransportProvider;
import de.mirkosertic.mcp.wikiassistant.search.KeywordExtractor;
import de.mirkosertic.mcp.wikiassistant.search.PromptBuilder;
import de.mirkosertic.mcp.wikiassistant.search.RelevanceScorer;
import de.mirkosertic.mcp.wikiassistant.search.WikiQuestionService;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.time.Duration;

/**
 * Main entry point for the MCP Wiki Assistant.
 * Wires crawler and question answering and serves them as MCP tools over STDIO.
 */
public class WikiAssistantApplication {

    private static final Logger logger = LoggerFactory.getLogger(WikiAssistantApplication.class);

    private final ApplicationConfig config;
    private final CrawlExecutorService crawlExecutor;
    private final WikiCrawlerService crawlerService;
    private final WikiQuestionService questionService;
    private final WikiAssistantTools tools;
    private McpSyncServer mcpServer;

    public WikiAssistantApplication(final ApplicationConfig config) {
        this.config = config;

        final CrawlerSettings settings = config.toCrawlerSettings();
        final CorpusRepository repository = new CorpusRepository();

        this.crawlExecutor = new CrawlExecutorService(settings.maxConcurrent());

        this.crawlerService = new WikiCrawlerService(
                settings,
                new JsoupPageFetcher(settings, new WikiPageExtractor()),
                repository,
                crawlExecutor,
                new CrawlStatisticsTracker()
        );

        final TextGenerator generator = new HttpTextGenerator(
                URI.create(config.getGeneratorUrl()),
                Duration.ofMillis(config.getGeneratorTimeoutMs()),
                config.getGeneratorResponseField());
        final PromptBuilder promptBuilder = new PromptBuilder(config.getSiteName(), config.getSiteDescription());

        this.questionService = new WikiQuestionService(
                repository,
                config.getQueryCorpusFile(),
                new KeywordExtractor(generator, promptBuilder),
                new RelevanceScorer(),
                promptBuilder,
                generator,
                config.getTopPages()
        );

        // Answer from fresh pages once a crawl rewrote the query corpus
        crawlerService.addCompletionListener(questionService);

        this.tools = new WikiAssistantTools(questionService, crawlerService, repository);
    }

    /**
     * Initialize all services.
     */
    public void init() throws IOException {
        logger.info("Initializing MCP Wiki Assistant...");

        Files.createDirectories(config.getDataDirectory());

        if (Files.exists(questionService.getCorpusFile())) {
            questionService.init();
        } else {
            logger.info("No corpus at {} yet, run startCrawl to build one", questionService.getCorpusFile());
        }

        if (config.isCrawlOnStartup()) {
            final CrawlMode mode = config.getStartupMode();
            logger.info("Starting {} crawl on startup", mode);
            crawlerService.startCrawl(mode, null);
        }

        logger.info("All services initialized successfully");
    }

    /**
     * Start the MCP server.
     */
    public void start() {
        logger.info("Starting MCP server with STDIO transport...");

        final McpSchema.ServerCapabilities capabilities = McpSchema.ServerCapabilities.builder()
                .tools(true)
                .build();

        final McpSchema.Implementation serverInfo = new McpSchema.Implementation(
                "MCP Wiki Assistant",
                BuildInfo.current().version()
        );

        final JacksonMcpJsonMapper jsonMapper = new JacksonMcpJsonMapper(new ObjectMapper());

        final LatestProtocolStdioServerTransportProvider transportProvider =
                new LatestProtocolStdioServerTransportProvider(jsonMapper);

        mcpServer = McpServer.sync(transportProvider)
                .serverInfo(serverInfo)
                .capabilities(capabilities)
                .tools(tools.getToolSpecifications())
                .build();

        logger.info("MCP server started successfully");

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));

        // Block main thread - the STDIO transport handles communication
        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }

        logger.info("Main thread finished, shutting down...");
    }

    /**
     * Shutdown all services gracefully. A running crawl persists its state before the executor goes away.
     */
    public void shutdown() {
        logger.info("Shutting down MCP Wiki Assistant...");

        try {
            if (mcpServer != null) {
                mcpServer.close();
            }
        } catch (final Exception e) {
            logger.error("Error closing MCP server", e);
        }

        try {
            crawlerService.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down crawler service", e);
        }

        try {
            crawlExecutor.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down crawl executor", e);
        }

        logger.info("MCP Wiki Assistant shutdown complete");
    }

    public static void main(final String[] args) {
        try {
            // Configure logging FIRST, before any other code that might log
            final boolean deployedMode = ApplicationConfig.isDeployedProfile();
            LoggingConfigurator.configure(deployedMode);

            final ApplicationConfig config = ApplicationConfig.load();

            if (!config.isDeployedMode()) {
                logger.info("Running in development mode (console logging enabled)");
                logger.info("Wiki: {}", config.getBaseUrl());
                logger.info("Data directory: {}", config.getDataDirectory());
            }

            final WikiAssistantApplication app = new WikiAssistantApplication(config);
            app.init();
            app.start();

            logger.info("MCP Wiki Assistant finished.");

        } catch (final Exception e) {
            // In deployed mode, we can't log to console, so write to stderr
            System.err.println("Failed to start MCP Wiki Assistant: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
