package de.mirkosertic.mcp.wikiassistant.corpus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the persisted corpus artifacts.
 * <p>
 * Three JSON files are managed: the systematic corpus file, the random discovery checkpoint and
 * the completed random discovery corpus with its plain text summary. All writes go through
 * {@link AtomicFileWriter}. A file that exists but cannot be parsed is moved aside to
 * {@code <name>.corrupt-<epochMillis>} so that a fresh run never overwrites data that might
 * still be recoverable by hand.
 */
public class CorpusRepository {

    private static final Logger logger = LoggerFactory.getLogger(CorpusRepository.class);

    private static final int SUMMARY_CATEGORY_LIMIT = 3;

    private final ObjectMapper objectMapper;
    private final AtomicFileWriter fileWriter;

    public CorpusRepository() {
        this(new AtomicFileWriter());
    }

    public CorpusRepository(final AtomicFileWriter fileWriter) {
        this.fileWriter = fileWriter;
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    // ==================== Systematic corpus ====================

    /**
     * Load the systematic corpus file.
     *
     * @return the persisted state, or {@code null} if the file does not exist or was unreadable
     */
    public @Nullable CorpusState loadCorpus(final Path corpusFile) {
        final CorpusState state = readOrQuarantine(corpusFile, CorpusState.class);
        if (state != null) {
            logger.info("Loaded {} pages from {} (last oldid: {})",
                    state.pages().size(), corpusFile, state.lastOldid());
        }
        return state;
    }

    public void saveCorpus(final Path corpusFile, final CorpusState state) throws IOException {
        fileWriter.write(corpusFile, objectMapper.writeValueAsBytes(state));
        logger.info("Saved {} pages to {} (last oldid: {})", state.totalPages(), corpusFile, state.lastOldid());
    }

    // ==================== Random discovery checkpoint ====================

    /**
     * Load the random discovery checkpoint.
     *
     * @return the checkpoint, or {@code null} if none exists or it was unreadable
     */
    public @Nullable CheckpointState loadCheckpoint(final Path checkpointFile) {
        final CheckpointState state = readOrQuarantine(checkpointFile, CheckpointState.class);
        if (state != null) {
            logger.info("Loaded checkpoint with {} pages from {}", state.scrapedData().size(), checkpointFile);
        }
        return state;
    }

    public void saveCheckpoint(final Path checkpointFile, final CheckpointState state) throws IOException {
        fileWriter.write(checkpointFile, objectMapper.writeValueAsBytes(state));
        logger.info("Checkpoint saved: {} pages to {}", state.totalPagesScraped(), checkpointFile);
    }

    /**
     * Delete the checkpoint file if present.
     *
     * @return true if a file was deleted
     */
    public boolean deleteCheckpoint(final Path checkpointFile) throws IOException {
        final boolean deleted = Files.deleteIfExists(checkpointFile);
        Files.deleteIfExists(AtomicFileWriter.tempFileFor(checkpointFile));
        if (deleted) {
            logger.info("Deleted checkpoint {}", checkpointFile);
        }
        return deleted;
    }

    // ==================== Completed random discovery corpus ====================

    public @Nullable CompletedCorpus loadCompletedCorpus(final Path corpusFile) {
        return readOrQuarantine(corpusFile, CompletedCorpus.class);
    }

    /**
     * Write the completed corpus and its human-readable summary.
     */
    public void saveCompletedCorpus(final Path corpusFile, final Path summaryFile,
                                    final CompletedCorpus corpus) throws IOException {
        fileWriter.write(corpusFile, objectMapper.writeValueAsBytes(corpus));
        fileWriter.write(summaryFile, buildSummary(corpus).getBytes(StandardCharsets.UTF_8));
        logger.info("Saved completed corpus with {} pages to {} (summary: {})",
                corpus.totalPages(), corpusFile, summaryFile);
    }

    String buildSummary(final CompletedCorpus corpus) {
        final StringBuilder summary = new StringBuilder();
        summary.append("Wiki Corpus Summary\n");
        summary.append("Scraped at: ").append(Instant.ofEpochMilli((long) (corpus.scrapedAt() * 1000))).append('\n');
        summary.append("Total pages: ").append(corpus.totalPages()).append('\n');
        summary.append("=".repeat(60)).append("\n\n");

        int index = 1;
        for (final Page page : corpus.pages()) {
            summary.append(index++).append(". ").append(page.title()).append('\n');
            summary.append("   Words: ").append(page.wordCount()).append('\n');
            summary.append("   URL: ").append(page.url()).append('\n');
            if (!page.categories().isEmpty()) {
                final List<String> first = page.categories()
                        .subList(0, Math.min(SUMMARY_CATEGORY_LIMIT, page.categories().size()));
                summary.append("   Categories: ").append(String.join(", ", first)).append('\n');
            }
            summary.append('\n');
        }
        return summary.toString();
    }

    // ==================== Read-only access and curation ====================

    /**
     * Read the pages of any corpus artifact: the {@code pages} array of a corpus file or the
     * {@code scraped_data} array of a checkpoint. Never moves files aside.
     *
     * @return the pages, empty if the file does not exist
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public List<Page> loadPages(final Path file) throws IOException {
        if (!Files.exists(file)) {
            logger.warn("Corpus file {} not found", file);
            return List.of();
        }
        final JsonNode root = objectMapper.readTree(file.toFile());
        final JsonNode pagesNode = pagesNode(root);
        if (pagesNode == null) {
            return List.of();
        }
        final List<Page> pages = new ArrayList<>(pagesNode.size());
        for (final JsonNode node : pagesNode) {
            pages.add(objectMapper.treeToValue(node, Page.class));
        }
        return pages;
    }

    /**
     * Remove every page whose title contains {@code titleFragment} and rewrite the file. All other
     * top-level fields (for example {@code last_oldid}) are preserved, {@code total_pages} is updated.
     *
     * @return number of removed pages
     * @throws IOException if the file is missing, unreadable or cannot be rewritten
     */
    public int removePagesByTitle(final Path file, final String titleFragment) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Corpus file not found: " + file);
        }
        final JsonNode root = objectMapper.readTree(file.toFile());
        if (!(root instanceof ObjectNode rootObject)) {
            throw new IOException("Corpus file is not a JSON object: " + file);
        }
        final JsonNode pagesNode = pagesNode(rootObject);
        if (!(pagesNode instanceof ArrayNode pagesArray)) {
            return 0;
        }

        final ArrayNode kept = objectMapper.createArrayNode();
        for (final JsonNode page : pagesArray) {
            final String title = page.path("title").asText("");
            if (!title.contains(titleFragment)) {
                kept.add(page);
            }
        }
        final int removed = pagesArray.size() - kept.size();
        if (removed == 0) {
            logger.info("No page title in {} contains '{}'", file, titleFragment);
            return 0;
        }

        final String arrayField = rootObject.has("pages") ? "pages" : "scraped_data";
        rootObject.set(arrayField, kept);
        if (rootObject.has("total_pages")) {
            rootObject.put("total_pages", kept.size());
        }
        if (rootObject.has("total_pages_scraped")) {
            rootObject.put("total_pages_scraped", kept.size());
        }
        if (rootObject.has("scraped_urls")) {
            final ArrayNode urls = objectMapper.createArrayNode();
            for (final JsonNode page : kept) {
                urls.add(page.path("url").asText(""));
            }
            rootObject.set("scraped_urls", urls);
        }

        fileWriter.write(file, objectMapper.writeValueAsBytes(rootObject));
        logger.info("Removed {} pages with '{}' in their title from {}, {} remain",
                removed, titleFragment, file, kept.size());
        return removed;
    }

    // ==================== Internal ====================

    private static @Nullable JsonNode pagesNode(final JsonNode root) {
        if (root == null) {
            return null;
        }
        if (root.has("pages")) {
            return root.get("pages");
        }
        return root.get("scraped_data");
    }

    private <T> @Nullable T readOrQuarantine(final Path file, final Class<T> type) {
        if (!Files.exists(file)) {
            logger.info("No existing {} found, starting fresh", file);
            return null;
        }
        try {
            return objectMapper.readValue(file.toFile(), type);
        } catch (final JsonProcessingException e) {
            logger.error("Malformed JSON in {}: {}", file, e.getOriginalMessage());
            quarantine(file);
            return null;
        } catch (final IOException e) {
            logger.error("Failed to read {}", file, e);
            quarantine(file);
            return null;
        }
    }

    private void quarantine(final Path file) {
        final Path aside = file.resolveSibling(file.getFileName() + ".corrupt-" + System.currentTimeMillis());
        try {
            Files.move(file, aside, StandardCopyOption.REPLACE_EXISTING);
            logger.error("Moved unreadable file {} to {}, starting from empty state", file, aside);
        } catch (final IOException e) {
            logger.error("Could not move unreadable file {} aside, it will be overwritten on the next save", file, e);
        }
    }
}
