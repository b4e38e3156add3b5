package de.mirkosertic.mcp.wikiassistant.crawler;

import de.mirkosertic.mcp.wikiassistant.corpus.Page;
import de.mirkosertic.mcp.wikiassistant.util.TextCleaner;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a parsed MediaWiki HTML page into a {@link Page}.
 * <p>
 * <ul>
 *   <li>Title: {@code h1#firstHeading}, falling back to the document {@code <title>}</li>
 *   <li>Content: text of {@code div#mw-content-text} without navigation boxes, info boxes and
 *       the table of contents, whitespace collapsed</li>
 *   <li>Categories: text of every link pointing to a {@code Category:} page, in document order</li>
 * </ul>
 * A page without any title container is not a wiki article and yields {@code null}. A missing
 * content container or missing categories degrade to empty values.
 */
public class WikiPageExtractor {

    static final String TITLE_SELECTOR = "h1#firstHeading";
    static final String CONTENT_SELECTOR = "div#mw-content-text";
    static final String NOISE_SELECTOR = "div.navbox, div.infobox, div.toc, table.navbox, table.infobox, table.toc";
    static final String CATEGORY_LINK_SELECTOR = "a[href*=Category:]";

    /**
     * Extract the page of a revision fetch.
     *
     * @return the page, or {@code null} if the document has no title container
     */
    public @Nullable Page extractRevision(final Document document, final long oldid, final String finalUrl) {
        final Element titleElement = findTitleElement(document);
        if (titleElement == null) {
            return null;
        }
        return Page.forRevision(oldid, TextCleaner.clean(titleElement.text()), finalUrl,
                extractContent(document), extractCategories(document), Page.nowEpochSeconds());
    }

    /**
     * Extract a page found through the random page endpoint. Its id is the final URL.
     *
     * @return the page, or {@code null} if the document has no title container
     */
    public @Nullable Page extractDiscovered(final Document document, final String finalUrl) {
        final Element titleElement = findTitleElement(document);
        if (titleElement == null) {
            return null;
        }
        return Page.forUrl(finalUrl, TextCleaner.clean(titleElement.text()),
                extractContent(document), extractCategories(document), Page.nowEpochSeconds());
    }

    private static @Nullable Element findTitleElement(final Document document) {
        final Element heading = document.selectFirst(TITLE_SELECTOR);
        if (heading != null) {
            return heading;
        }
        return document.selectFirst("title");
    }

    String extractContent(final Document document) {
        final Element contentContainer = document.selectFirst(CONTENT_SELECTOR);
        if (contentContainer == null) {
            return "";
        }
        // Work on a copy so the extractor never mutates its input
        final Element content = contentContainer.clone();
        content.select(NOISE_SELECTOR).remove();
        final String cleaned = TextCleaner.clean(content.text());
        return cleaned != null ? cleaned : "";
    }

    List<String> extractCategories(final Document document) {
        final Set<String> categories = new LinkedHashSet<>();
        for (final Element link : document.select(CATEGORY_LINK_SELECTOR)) {
            final String text = link.text().trim();
            if (!text.isEmpty()) {
                categories.add(text);
            }
        }
        return new ArrayList<>(categories);
    }
}
