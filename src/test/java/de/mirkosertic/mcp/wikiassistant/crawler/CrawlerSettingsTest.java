package de.mirkosertic.mcp.wikiassistant.crawler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CrawlerSettings Tests")
class CrawlerSettingsTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Defaults match the FOSSCELL wiki crawl")
    void defaults() {
        final CrawlerSettings settings = CrawlerSettings.builder(tempDir).build();

        assertThat(settings.baseUrl()).isEqualTo(CrawlerSettings.DEFAULT_BASE_URL);
        assertThat(settings.maxConcurrent()).isEqualTo(20);
        assertThat(settings.batchDelayMs()).isEqualTo(500);
        assertThat(settings.saveEveryPages()).isEqualTo(50);
        assertThat(settings.checkpointInterval()).isEqualTo(10);
        assertThat(settings.startOldid()).isEqualTo(1);
        assertThat(settings.endOldid()).isEqualTo(2606);
        assertThat(settings.targetPages()).isEqualTo(100);
        assertThat(settings.corpusFile()).isEqualTo(tempDir.resolve("wiki_data.json"));
        assertThat(settings.checkpointFile()).isEqualTo(tempDir.resolve("wiki_random_checkpoint.json"));
    }

    @Test
    @DisplayName("Should build revision and random page URLs from a normalized base URL")
    void buildsUrls() {
        final CrawlerSettings settings = CrawlerSettings.builder(tempDir)
                .baseUrl("https://wiki.example.org//")
                .randomPagePath("index.php/Special:Random")
                .build();

        assertThat(settings.revisionUrl(42)).isEqualTo("https://wiki.example.org/index.php?oldid=42");
        assertThat(settings.randomPageUrl()).isEqualTo("https://wiki.example.org/index.php/Special:Random");
    }

    @Test
    @DisplayName("Should reject invalid values")
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> CrawlerSettings.builder(tempDir).maxConcurrent(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CrawlerSettings.builder(tempDir).oldidRange(10, 5).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CrawlerSettings.builder(tempDir).targetPages(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CrawlerSettings.builder(tempDir).checkpointInterval(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("toBuilder keeps every value")
    void toBuilderRoundTrip() {
        final CrawlerSettings settings = CrawlerSettings.builder(tempDir).maxConcurrent(3).targetPages(7).build();

        assertThat(settings.toBuilder().build()).isEqualTo(settings);
    }

    @Test
    @DisplayName("Crawl modes parse case-insensitively")
    void parsesModes() {
        assertThat(CrawlMode.parse("random")).isEqualTo(CrawlMode.RANDOM);
        assertThat(CrawlMode.parse(" Systematic ")).isEqualTo(CrawlMode.SYSTEMATIC);
        assertThatThrownBy(() -> CrawlMode.parse("sideways"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sideways");
    }
}
