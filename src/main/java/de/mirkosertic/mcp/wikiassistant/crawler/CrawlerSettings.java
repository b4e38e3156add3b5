package de.mirkosertic.mcp.wikiassistant.crawler;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable crawl configuration, frozen from {@code ApplicationConfig} at startup.
 * <p>
 * The compact constructor rejects values the crawler cannot work with, so an invalid
 * configuration fails fast instead of surfacing halfway through a run.
 */
public record CrawlerSettings(
        String baseUrl,
        String randomPagePath,
        String userAgent,
        int requestTimeoutMs,
        int maxConcurrent,
        long batchDelayMs,
        int saveEveryPages,
        int checkpointInterval,
        long startOldid,
        long endOldid,
        int targetPages,
        int maxConsecutiveEmptyBatches,
        Path corpusFile,
        Path randomCorpusFile,
        Path randomSummaryFile,
        Path checkpointFile
) {

    public static final String DEFAULT_BASE_URL = "https://wiki.fosscell.org";
    public static final String DEFAULT_RANDOM_PAGE_PATH = "/index.php/Special:Random";
    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";

    public CrawlerSettings {
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(randomPagePath, "randomPagePath");
        Objects.requireNonNull(userAgent, "userAgent");
        Objects.requireNonNull(corpusFile, "corpusFile");
        Objects.requireNonNull(randomCorpusFile, "randomCorpusFile");
        Objects.requireNonNull(randomSummaryFile, "randomSummaryFile");
        Objects.requireNonNull(checkpointFile, "checkpointFile");
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        if (baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl must not be blank");
        }
        if (!randomPagePath.startsWith("/")) {
            randomPagePath = "/" + randomPagePath;
        }
        if (requestTimeoutMs <= 0) {
            throw new IllegalArgumentException("requestTimeoutMs must be positive, was " + requestTimeoutMs);
        }
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1, was " + maxConcurrent);
        }
        if (batchDelayMs < 0) {
            throw new IllegalArgumentException("batchDelayMs must not be negative, was " + batchDelayMs);
        }
        if (saveEveryPages < 1) {
            throw new IllegalArgumentException("saveEveryPages must be at least 1, was " + saveEveryPages);
        }
        if (checkpointInterval < 1) {
            throw new IllegalArgumentException("checkpointInterval must be at least 1, was " + checkpointInterval);
        }
        if (startOldid < 1 || endOldid < startOldid) {
            throw new IllegalArgumentException("Invalid oldid range [" + startOldid + ", " + endOldid + "]");
        }
        if (targetPages < 0) {
            throw new IllegalArgumentException("targetPages must not be negative, was " + targetPages);
        }
        if (maxConsecutiveEmptyBatches < 0) {
            throw new IllegalArgumentException("maxConsecutiveEmptyBatches must not be negative, was "
                    + maxConsecutiveEmptyBatches);
        }
    }

    public String revisionUrl(final long oldid) {
        return baseUrl + "/index.php?oldid=" + oldid;
    }

    public String randomPageUrl() {
        return baseUrl + randomPagePath;
    }

    public static Builder builder(final Path dataDir) {
        return new Builder(dataDir);
    }

    public Builder toBuilder() {
        final Builder builder = new Builder(corpusFile.toAbsolutePath().getParent());
        builder.baseUrl = baseUrl;
        builder.randomPagePath = randomPagePath;
        builder.userAgent = userAgent;
        builder.requestTimeoutMs = requestTimeoutMs;
        builder.maxConcurrent = maxConcurrent;
        builder.batchDelayMs = batchDelayMs;
        builder.saveEveryPages = saveEveryPages;
        builder.checkpointInterval = checkpointInterval;
        builder.startOldid = startOldid;
        builder.endOldid = endOldid;
        builder.targetPages = targetPages;
        builder.maxConsecutiveEmptyBatches = maxConsecutiveEmptyBatches;
        builder.corpusFile = corpusFile;
        builder.randomCorpusFile = randomCorpusFile;
        builder.randomSummaryFile = randomSummaryFile;
        builder.checkpointFile = checkpointFile;
        return builder;
    }

    /**
     * Builder pre-populated with the defaults of a crawl against the FOSSCELL wiki.
     */
    public static final class Builder {

        private String baseUrl = DEFAULT_BASE_URL;
        private String randomPagePath = DEFAULT_RANDOM_PAGE_PATH;
        private String userAgent = DEFAULT_USER_AGENT;
        private int requestTimeoutMs = 30_000;
        private int maxConcurrent = 20;
        private long batchDelayMs = 500;
        private int saveEveryPages = 50;
        private int checkpointInterval = 10;
        private long startOldid = 1;
        private long endOldid = 2606;
        private int targetPages = 100;
        private int maxConsecutiveEmptyBatches = 0;
        private Path corpusFile;
        private Path randomCorpusFile;
        private Path randomSummaryFile;
        private Path checkpointFile;

        private Builder(final Path dataDir) {
            this.corpusFile = dataDir.resolve("wiki_data.json");
            this.randomCorpusFile = dataDir.resolve("wiki_random_data.json");
            this.randomSummaryFile = dataDir.resolve("wiki_random_summary.txt");
            this.checkpointFile = dataDir.resolve("wiki_random_checkpoint.json");
        }

        public Builder baseUrl(final String value) {
            this.baseUrl = value;
            return this;
        }

        public Builder randomPagePath(final String value) {
            this.randomPagePath = value;
            return this;
        }

        public Builder userAgent(final String value) {
            this.userAgent = value;
            return this;
        }

        public Builder requestTimeoutMs(final int value) {
            this.requestTimeoutMs = value;
            return this;
        }

        public Builder maxConcurrent(final int value) {
            this.maxConcurrent = value;
            return this;
        }

        public Builder batchDelayMs(final long value) {
            this.batchDelayMs = value;
            return this;
        }

        public Builder saveEveryPages(final int value) {
            this.saveEveryPages = value;
            return this;
        }

        public Builder checkpointInterval(final int value) {
            this.checkpointInterval = value;
            return this;
        }

        public Builder oldidRange(final long start, final long end) {
            this.startOldid = start;
            this.endOldid = end;
            return this;
        }

        public Builder targetPages(final int value) {
            this.targetPages = value;
            return this;
        }

        public Builder maxConsecutiveEmptyBatches(final int value) {
            this.maxConsecutiveEmptyBatches = value;
            return this;
        }

        public Builder corpusFile(final Path value) {
            this.corpusFile = value;
            return this;
        }

        public Builder randomCorpusFile(final Path value) {
            this.randomCorpusFile = value;
            return this;
        }

        public Builder randomSummaryFile(final Path value) {
            this.randomSummaryFile = value;
            return this;
        }

        public Builder checkpointFile(final Path value) {
            this.checkpointFile = value;
            return this;
        }

        public CrawlerSettings build() {
            return new CrawlerSettings(baseUrl, randomPagePath, userAgent, requestTimeoutMs, maxConcurrent,
                    batchDelayMs, saveEveryPages, checkpointInterval, startOldid, endOldid, targetPages,
                    maxConsecutiveEmptyBatches, corpusFile, randomCorpusFile, randomSummaryFile, checkpointFile);
        }
    }
}
