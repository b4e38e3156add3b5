package de.mirkosertic.mcp.wikiassistant.config;

import de.mirkosertic.mcp.wikiassistant.crawler.CrawlMode;
import de.mirkosertic.mcp.wikiassistant.crawler.CrawlerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.function.Function;

/**
 * Central configuration for the MCP Wiki Assistant.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.wikiassistant/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    static final String ENV_BASE_URL = "WIKI_BASE_URL";
    static final String ENV_DATA_DIR = "WIKI_DATA_DIR";
    static final String ENV_GENERATOR_URL = "WIKI_GENERATOR_URL";
    private static final String PROP_PROFILES_ACTIVE = "wiki.profile";
    private static final String CONFIG_DIR = ".wikiassistant";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    private final Function<String, String> environment;

    // Site settings
    private String baseUrl = CrawlerSettings.DEFAULT_BASE_URL;
    private String randomPagePath = CrawlerSettings.DEFAULT_RANDOM_PAGE_PATH;
    private String userAgent = CrawlerSettings.DEFAULT_USER_AGENT;
    private int requestTimeoutMs = 30000;

    // Crawler settings
    private int maxConcurrent = 20;
    private long batchDelayMs = 500;
    private int saveEveryPages = 50;
    private int checkpointInterval = 10;
    private long startOldid = 1;
    private long endOldid = 2606;
    private int targetPages = 100;
    private int maxConsecutiveEmptyBatches = 0;
    private boolean crawlOnStartup = false;
    private String startupMode = "systematic";

    // Storage settings
    private String dataDir;
    private String corpusFile = "wiki_data.json";
    private String randomCorpusFile = "wiki_random_data.json";
    private String randomSummaryFile = "wiki_random_summary.txt";
    private String checkpointFile = "wiki_random_checkpoint.json";

    // Assistant settings
    private String generatorUrl = "https://tools.originality.ai/tool-ai-prompt-generator/backend/generate.php";
    private long generatorTimeoutMs = 30000;
    private String generatorResponseField = "output";
    private String siteName = "FOSSCELL";
    private String siteDescription = "Free and Open Source Software Cell";
    private int topPages = 10;
    private String queryCorpusFile = "wiki_data.json";

    // Profile settings
    private boolean deployedMode = false;

    private ApplicationConfig(final Function<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        return load(System::getenv, getUserConfigPath());
    }

    static ApplicationConfig load(final Function<String, String> environment, final Path userConfigPath) {
        final ApplicationConfig config = new ApplicationConfig(environment);

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromFile(userConfigPath);

        // Step 3: Apply environment variables and system properties (highest priority)
        config.applyEnvironmentOverrides();

        // Step 4: Determine profile/mode
        config.determineProfile();

        logger.info("Configuration loaded: baseUrl={}, dataDir={}, generatorUrl={}, deployedMode={}",
                config.baseUrl, config.dataDir, config.generatorUrl, config.deployedMode);

        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromFile(final Path configPath) {
        if (Files.exists(configPath)) {
            try (final InputStream is = Files.newInputStream(configPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", configPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", configPath, e);
            } catch (final RuntimeException e) {
                logger.error("Invalid user config {}, ignoring it: {}", configPath, e.getMessage());
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        // Navigate to wiki section
        final Map<String, Object> wikiConfig = (Map<String, Object>) config.get("wiki");
        if (wikiConfig == null) {
            return;
        }

        final Map<String, Object> siteConfig = (Map<String, Object>) wikiConfig.get("site");
        if (siteConfig != null) {
            applySiteConfig(siteConfig);
        }

        final Map<String, Object> crawlerConfig = (Map<String, Object>) wikiConfig.get("crawler");
        if (crawlerConfig != null) {
            applyCrawlerConfig(crawlerConfig);
        }

        final Map<String, Object> storageConfig = (Map<String, Object>) wikiConfig.get("storage");
        if (storageConfig != null) {
            applyStorageConfig(storageConfig);
        }

        final Map<String, Object> assistantConfig = (Map<String, Object>) wikiConfig.get("assistant");
        if (assistantConfig != null) {
            applyAssistantConfig(assistantConfig);
        }
    }

    private void applySiteConfig(final Map<String, Object> siteConfig) {
        if (siteConfig.containsKey("base-url")) {
            this.baseUrl = stringValue(siteConfig.get("base-url"));
        }
        if (siteConfig.containsKey("random-page-path")) {
            this.randomPagePath = stringValue(siteConfig.get("random-page-path"));
        }
        if (siteConfig.containsKey("user-agent")) {
            this.userAgent = stringValue(siteConfig.get("user-agent"));
        }
        if (siteConfig.containsKey("request-timeout-ms")) {
            this.requestTimeoutMs = (int) longValue(siteConfig.get("request-timeout-ms"));
        }
    }

    private void applyCrawlerConfig(final Map<String, Object> crawlerConfig) {
        if (crawlerConfig.containsKey("max-concurrent")) {
            this.maxConcurrent = (int) longValue(crawlerConfig.get("max-concurrent"));
        }
        if (crawlerConfig.containsKey("batch-delay-ms")) {
            this.batchDelayMs = longValue(crawlerConfig.get("batch-delay-ms"));
        }
        if (crawlerConfig.containsKey("save-every-pages")) {
            this.saveEveryPages = (int) longValue(crawlerConfig.get("save-every-pages"));
        }
        if (crawlerConfig.containsKey("checkpoint-interval")) {
            this.checkpointInterval = (int) longValue(crawlerConfig.get("checkpoint-interval"));
        }
        if (crawlerConfig.containsKey("start-oldid")) {
            this.startOldid = longValue(crawlerConfig.get("start-oldid"));
        }
        if (crawlerConfig.containsKey("end-oldid")) {
            this.endOldid = longValue(crawlerConfig.get("end-oldid"));
        }
        if (crawlerConfig.containsKey("target-pages")) {
            this.targetPages = (int) longValue(crawlerConfig.get("target-pages"));
        }
        if (crawlerConfig.containsKey("max-consecutive-empty-batches")) {
            this.maxConsecutiveEmptyBatches = (int) longValue(crawlerConfig.get("max-consecutive-empty-batches"));
        }
        if (crawlerConfig.containsKey("crawl-on-startup")) {
            this.crawlOnStartup = booleanValue(crawlerConfig.get("crawl-on-startup"));
        }
        if (crawlerConfig.containsKey("startup-mode")) {
            this.startupMode = stringValue(crawlerConfig.get("startup-mode"));
        }
    }

    private void applyStorageConfig(final Map<String, Object> storageConfig) {
        if (storageConfig.containsKey("data-dir")) {
            this.dataDir = stringValue(storageConfig.get("data-dir"));
        }
        if (storageConfig.containsKey("corpus-file")) {
            this.corpusFile = stringValue(storageConfig.get("corpus-file"));
        }
        if (storageConfig.containsKey("random-corpus-file")) {
            this.randomCorpusFile = stringValue(storageConfig.get("random-corpus-file"));
        }
        if (storageConfig.containsKey("random-summary-file")) {
            this.randomSummaryFile = stringValue(storageConfig.get("random-summary-file"));
        }
        if (storageConfig.containsKey("checkpoint-file")) {
            this.checkpointFile = stringValue(storageConfig.get("checkpoint-file"));
        }
    }

    private void applyAssistantConfig(final Map<String, Object> assistantConfig) {
        if (assistantConfig.containsKey("generator-url")) {
            this.generatorUrl = stringValue(assistantConfig.get("generator-url"));
        }
        if (assistantConfig.containsKey("generator-timeout-ms")) {
            this.generatorTimeoutMs = longValue(assistantConfig.get("generator-timeout-ms"));
        }
        if (assistantConfig.containsKey("generator-response-field")) {
            this.generatorResponseField = stringValue(assistantConfig.get("generator-response-field"));
        }
        if (assistantConfig.containsKey("site-name")) {
            this.siteName = stringValue(assistantConfig.get("site-name"));
        }
        if (assistantConfig.containsKey("site-description")) {
            this.siteDescription = stringValue(assistantConfig.get("site-description"));
        }
        if (assistantConfig.containsKey("top-pages")) {
            this.topPages = (int) longValue(assistantConfig.get("top-pages"));
        }
        if (assistantConfig.containsKey("query-corpus-file")) {
            this.queryCorpusFile = stringValue(assistantConfig.get("query-corpus-file"));
        }
    }

    private String stringValue(final Object value) {
        return value == null ? "" : resolveVariables(value.toString());
    }

    private long longValue(final Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        final String resolved = stringValue(value).trim();
        try {
            return Long.parseLong(resolved);
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Expected a whole number but got '" + resolved + "'", e);
        }
    }

    private boolean booleanValue(final Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        return Boolean.parseBoolean(stringValue(value).trim());
    }

    private void applyEnvironmentOverrides() {
        final String envBaseUrl = environment.apply(ENV_BASE_URL);
        if (envBaseUrl != null && !envBaseUrl.trim().isEmpty()) {
            this.baseUrl = envBaseUrl.trim();
            logger.info("Wiki base URL from environment: {}", this.baseUrl);
        }

        final String envDataDir = environment.apply(ENV_DATA_DIR);
        if (envDataDir != null && !envDataDir.trim().isEmpty()) {
            this.dataDir = envDataDir.trim();
            logger.info("Data directory from environment: {}", this.dataDir);
        }

        final String envGeneratorUrl = environment.apply(ENV_GENERATOR_URL);
        if (envGeneratorUrl != null && !envGeneratorUrl.trim().isEmpty()) {
            this.generatorUrl = envGeneratorUrl.trim();
            logger.info("Generator URL from environment: {}", this.generatorUrl);
        }

        // Default data directory if not set
        if (this.dataDir == null || this.dataDir.isEmpty()) {
            this.dataDir = Paths.get(System.getProperty("user.home"), CONFIG_DIR, "data").toString();
        }

        // System property for data directory
        final String propDataDir = System.getProperty("wiki.data.dir");
        if (propDataDir != null && !propDataDir.isEmpty()) {
            this.dataDir = propDataDir;
        }
    }

    private void determineProfile() {
        this.deployedMode = isDeployedProfile();
    }

    /**
     * True if {@code -Dwiki.profile=deployed} (or {@code -Dprofile=deployed}) is set. Readable before
     * any configuration is loaded, so logging can be set up first.
     */
    public static boolean isDeployedProfile() {
        final String profile = System.getProperty(PROP_PROFILES_ACTIVE, System.getProperty("profile", "default"));
        return "deployed".equalsIgnoreCase(profile);
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = findClosingBrace(result, start + 2);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = environment.apply(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            // Handle nested ${user.home} type variables
            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    // Defaults may nest placeholders, as in ${WIKI_DATA_DIR:${user.home}/data}
    private static int findClosingBrace(final String value, final int from) {
        int depth = 0;
        for (int i = from; i < value.length(); i++) {
            final char c = value.charAt(i);
            if (c == '{' && i > 0 && value.charAt(i - 1) == '$') {
                depth++;
            } else if (c == '}') {
                if (depth == 0) {
                    return i;
                }
                depth--;
            }
        }
        return -1;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    /**
     * Freeze the crawl part of the configuration.
     *
     * @throws IllegalArgumentException if a value is out of range
     */
    public CrawlerSettings toCrawlerSettings() {
        return CrawlerSettings.builder(getDataDirectory())
                .baseUrl(baseUrl)
                .randomPagePath(randomPagePath)
                .userAgent(userAgent)
                .requestTimeoutMs(requestTimeoutMs)
                .maxConcurrent(maxConcurrent)
                .batchDelayMs(batchDelayMs)
                .saveEveryPages(saveEveryPages)
                .checkpointInterval(checkpointInterval)
                .oldidRange(startOldid, endOldid)
                .targetPages(targetPages)
                .maxConsecutiveEmptyBatches(maxConsecutiveEmptyBatches)
                .corpusFile(resolveDataFile(corpusFile))
                .randomCorpusFile(resolveDataFile(randomCorpusFile))
                .randomSummaryFile(resolveDataFile(randomSummaryFile))
                .checkpointFile(resolveDataFile(checkpointFile))
                .build();
    }

    /**
     * A file name relative to the data directory, or an absolute path as is.
     */
    public Path resolveDataFile(final String fileName) {
        final Path path = Paths.get(fileName);
        return path.isAbsolute() ? path : getDataDirectory().resolve(path);
    }

    // Getters
    public Path getDataDirectory() {
        return Paths.get(dataDir);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public boolean isCrawlOnStartup() {
        return crawlOnStartup;
    }

    public CrawlMode getStartupMode() {
        return CrawlMode.parse(startupMode);
    }

    public String getGeneratorUrl() {
        return generatorUrl;
    }

    public long getGeneratorTimeoutMs() {
        return generatorTimeoutMs;
    }

    public String getGeneratorResponseField() {
        return generatorResponseField;
    }

    public String getSiteName() {
        return siteName;
    }

    public String getSiteDescription() {
        return siteDescription;
    }

    public int getTopPages() {
        return topPages;
    }

    public Path getQueryCorpusFile() {
        return resolveDataFile(queryCorpusFile);
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
