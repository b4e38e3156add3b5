package de.mirkosertic.mcp.wikiassistant.corpus;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A single scraped wiki page.
 * <p>
 * Pages are immutable once created. The identity of a page is its {@link #id()}: the decimal
 * revision id for pages fetched by oldid, the resolved URL for pages found through the random
 * page endpoint. {@link #wordCount()} is always derived from {@link #content()}, a stored
 * value is ignored when a page is read back from disk.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "oldid", "title", "url", "content", "categories", "word_count", "scraped_at"})
public record Page(
        String id,
        @Nullable Long oldid,
        String title,
        String url,
        String content,
        List<String> categories,
        @JsonProperty("word_count") int wordCount,
        @JsonProperty("scraped_at") double scrapedAt
) {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    public Page {
        content = content != null ? content : "";
        title = title != null ? title : "";
        url = url != null ? url : "";
        categories = categories != null ? List.copyOf(new LinkedHashSet<>(categories)) : List.of();
        wordCount = countWords(content);
        if (id == null || id.isEmpty()) {
            id = oldid != null ? String.valueOf(oldid) : url;
        }
    }

    @JsonCreator
    public static Page fromJson(@JsonProperty("id") final String id,
                                @JsonProperty("oldid") final Long oldid,
                                @JsonProperty("title") final String title,
                                @JsonProperty("url") final String url,
                                @JsonProperty("content") final String content,
                                @JsonProperty("categories") final List<String> categories,
                                @JsonProperty("scraped_at") final Double scrapedAt) {
        final List<String> cleanedCategories = new ArrayList<>();
        if (categories != null) {
            for (final String category : categories) {
                if (category != null && !category.isBlank()) {
                    cleanedCategories.add(category);
                }
            }
        }
        return new Page(id, oldid, title, url, content, cleanedCategories, 0,
                scrapedAt != null ? scrapedAt : 0.0);
    }

    /**
     * Page fetched by revision id. The id is the decimal oldid.
     */
    public static Page forRevision(final long oldid, final String title, final String url, final String content,
                                   final List<String> categories, final double scrapedAt) {
        return new Page(String.valueOf(oldid), oldid, title, url, content, categories, 0, scrapedAt);
    }

    /**
     * Page found through random discovery. The id is the resolved URL.
     */
    public static Page forUrl(final String url, final String title, final String content,
                              final List<String> categories, final double scrapedAt) {
        return new Page(url, null, title, url, content, categories, 0, scrapedAt);
    }

    /**
     * Number of whitespace separated tokens.
     */
    public static int countWords(final String text) {
        if (text == null) {
            return 0;
        }
        int count = 0;
        for (final String word : WHITESPACE.split(text)) {
            if (!word.isEmpty()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Current time as fractional epoch seconds, the timestamp unit of all persisted files.
     */
    public static double nowEpochSeconds() {
        return System.currentTimeMillis() / 1000.0;
    }
}
