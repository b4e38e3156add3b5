package de.mirkosertic.mcp.wikiassistant.config;

import de.mirkosertic.mcp.wikiassistant.crawler.CrawlMode;
import de.mirkosertic.mcp.wikiassistant.crawler.CrawlerSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ApplicationConfig Tests")
class ApplicationConfigTest {

    @TempDir
    Path tempDir;

    private final Map<String, String> env = new HashMap<>();

    private ApplicationConfig load(final Path userConfig) {
        return ApplicationConfig.load(env::get, userConfig);
    }

    @Test
    @DisplayName("Should use the classpath defaults without a user file")
    void classpathDefaults() {
        // When
        final ApplicationConfig config = load(tempDir.resolve("missing.yaml"));

        // Then
        assertThat(config.getBaseUrl()).isEqualTo("https://wiki.fosscell.org");
        assertThat(config.getMaxConcurrent()).isEqualTo(20);
        assertThat(config.isCrawlOnStartup()).isFalse();
        assertThat(config.getStartupMode()).isEqualTo(CrawlMode.SYSTEMATIC);
        assertThat(config.getSiteName()).isEqualTo("FOSSCELL");
        assertThat(config.getSiteDescription()).isEqualTo("Free and Open Source Software Cell");
        assertThat(config.getTopPages()).isEqualTo(10);
        assertThat(config.getGeneratorResponseField()).isEqualTo("output");
        assertThat(config.getDataDirectory())
                .isEqualTo(Paths.get(System.getProperty("user.home"), ".wikiassistant", "data"));
    }

    @Test
    @DisplayName("The user file overrides the defaults")
    void userFileOverrides() throws Exception {
        // Given
        final Path userConfig = tempDir.resolve("config.yaml");
        Files.writeString(userConfig, """
                wiki:
                  site:
                    base-url: https://wiki.example.org/
                  crawler:
                    max-concurrent: 4
                    end-oldid: "500"
                    crawl-on-startup: true
                    startup-mode: Random
                  storage:
                    data-dir: %s
                    corpus-file: corpus.json
                  assistant:
                    site-name: ACME
                    top-pages: 3
                """.formatted(tempDir.resolve("data")));

        // When
        final ApplicationConfig config = load(userConfig);
        final CrawlerSettings settings = config.toCrawlerSettings();

        // Then
        assertThat(config.getStartupMode()).isEqualTo(CrawlMode.RANDOM);
        assertThat(config.isCrawlOnStartup()).isTrue();
        assertThat(config.getSiteName()).isEqualTo("ACME");
        assertThat(config.getTopPages()).isEqualTo(3);
        assertThat(settings.baseUrl()).isEqualTo("https://wiki.example.org");
        assertThat(settings.maxConcurrent()).isEqualTo(4);
        assertThat(settings.endOldid()).isEqualTo(500);
        assertThat(settings.batchDelayMs()).isEqualTo(500);
        assertThat(settings.corpusFile()).isEqualTo(tempDir.resolve("data").resolve("corpus.json"));
        assertThat(settings.checkpointFile()).isEqualTo(tempDir.resolve("data").resolve("wiki_random_checkpoint.json"));
    }

    @Test
    @DisplayName("Environment variables win over every file")
    void environmentWins() throws Exception {
        final Path userConfig = tempDir.resolve("config.yaml");
        Files.writeString(userConfig, """
                wiki:
                  site:
                    base-url: https://from-file.example.org
                """);
        env.put(ApplicationConfig.ENV_BASE_URL, "https://from-env.example.org");
        env.put(ApplicationConfig.ENV_DATA_DIR, tempDir.toString());
        env.put(ApplicationConfig.ENV_GENERATOR_URL, "http://localhost:9999/generate");

        final ApplicationConfig config = load(userConfig);

        assertThat(config.getBaseUrl()).isEqualTo("https://from-env.example.org");
        assertThat(config.getDataDirectory()).isEqualTo(tempDir);
        assertThat(config.getGeneratorUrl()).isEqualTo("http://localhost:9999/generate");
        assertThat(config.getQueryCorpusFile()).isEqualTo(tempDir.resolve("wiki_data.json"));
    }

    @Test
    @DisplayName("Placeholders resolve from the environment with nested defaults")
    void resolvesPlaceholders() throws Exception {
        final Path userConfig = tempDir.resolve("config.yaml");
        Files.writeString(userConfig, """
                wiki:
                  assistant:
                    site-name: ${SITE:${OTHER_SITE:Fallback}}
                    generator-response-field: ${FIELD:text}
                """);
        env.put("OTHER_SITE", "Nested");

        final ApplicationConfig config = load(userConfig);

        assertThat(config.getSiteName()).isEqualTo("Nested");
        assertThat(config.getGeneratorResponseField()).isEqualTo("text");
    }

    @Test
    @DisplayName("Absolute file names are kept as they are")
    void absoluteFileNames() throws Exception {
        final Path absolute = tempDir.resolve("elsewhere").resolve("random.json");
        final Path userConfig = tempDir.resolve("config.yaml");
        Files.writeString(userConfig, """
                wiki:
                  storage:
                    random-corpus-file: %s
                """.formatted(absolute));

        assertThat(load(userConfig).toCrawlerSettings().randomCorpusFile()).isEqualTo(absolute);
    }

    @Test
    @DisplayName("Invalid YAML in the user file is ignored")
    void invalidUserFile() throws Exception {
        final Path userConfig = tempDir.resolve("config.yaml");
        Files.writeString(userConfig, "wiki: [unclosed");

        assertThat(load(userConfig).getMaxConcurrent()).isEqualTo(20);
    }

    @Test
    @DisplayName("Out of range values fail when the crawler settings are built")
    void invalidValues() throws Exception {
        final Path userConfig = tempDir.resolve("config.yaml");
        Files.writeString(userConfig, """
                wiki:
                  crawler:
                    max-concurrent: 0
                """);
        final ApplicationConfig config = load(userConfig);

        assertThatThrownBy(config::toCrawlerSettings).isInstanceOf(IllegalArgumentException.class);
    }
}
