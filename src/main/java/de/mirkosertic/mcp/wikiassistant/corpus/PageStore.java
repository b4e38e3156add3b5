package de.mirkosertic.mcp.wikiassistant.corpus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * In-memory page collection of a crawl run together with its duplicate suppression keys.
 * <p>
 * A store is keyed either by page id (systematic crawls) or by page URL (random discovery).
 * The key set is derived from the page list and is rebuilt from it whenever a store is
 * created from persisted state, so a lost or inconsistent key list can never let a duplicate
 * through.
 * <p>
 * Not thread-safe: only the crawl coordinator mutates a store.
 */
public class PageStore {

    private static final Logger logger = LoggerFactory.getLogger(PageStore.class);

    /**
     * Which page attribute acts as the duplicate suppression key.
     */
    public enum KeyType {
        ID(Page::id),
        URL(Page::url);

        private final Function<Page, String> extractor;

        KeyType(final Function<Page, String> extractor) {
            this.extractor = extractor;
        }

        String keyOf(final Page page) {
            return extractor.apply(page);
        }
    }

    private final KeyType keyType;
    private final List<Page> pages = new ArrayList<>();
    private final Set<String> keys = new HashSet<>();

    public PageStore(final KeyType keyType) {
        this.keyType = keyType;
    }

    /**
     * Store keyed by page id, seeded from a persisted systematic corpus.
     */
    public static PageStore fromCorpus(final CorpusState state) {
        final PageStore store = new PageStore(KeyType.ID);
        store.addAll(state.pages());
        return store;
    }

    /**
     * Store keyed by page URL, seeded from a random discovery checkpoint. The persisted URL list
     * is only compared against, the key set itself is rebuilt from the page list.
     */
    public static PageStore fromCheckpoint(final CheckpointState state) {
        final PageStore store = new PageStore(KeyType.URL);
        store.addAll(state.scrapedData());
        if (!new HashSet<>(state.scrapedUrls()).equals(store.keys)) {
            logger.warn("Checkpoint URL list is inconsistent with its pages ({} urls, {} pages), rebuilt from pages",
                    state.scrapedUrls().size(), store.size());
        }
        return store;
    }

    /**
     * Add a page unless its key is already known.
     *
     * @return true if the page was added, false if it was a duplicate
     */
    public boolean add(final Page page) {
        final String key = keyType.keyOf(page);
        if (!keys.add(key)) {
            return false;
        }
        pages.add(page);
        return true;
    }

    /**
     * Add all pages, skipping duplicates.
     *
     * @return number of pages actually added
     */
    public int addAll(final List<Page> newPages) {
        int added = 0;
        for (final Page page : newPages) {
            if (add(page)) {
                added++;
            }
        }
        final int skipped = newPages.size() - added;
        if (skipped > 0) {
            logger.warn("Dropped {} duplicate pages while loading", skipped);
        }
        return added;
    }

    public boolean containsKey(final String key) {
        return keys.contains(key);
    }

    public int size() {
        return pages.size();
    }

    /**
     * Unmodifiable view in insertion order.
     */
    public List<Page> pages() {
        return Collections.unmodifiableList(pages);
    }

    /**
     * Remove every page whose title contains the given text (case-sensitive).
     *
     * @return number of removed pages
     */
    public int removeByTitleContaining(final String titleFragment) {
        final int before = pages.size();
        pages.removeIf(page -> page.title().contains(titleFragment));
        keys.clear();
        for (final Page page : pages) {
            keys.add(keyType.keyOf(page));
        }
        return before - pages.size();
    }

    public CorpusState toCorpusState(final long lastOldid) {
        return new CorpusState(pages, pages.size(), Page.nowEpochSeconds(), lastOldid);
    }

    public CheckpointState toCheckpointState() {
        final List<String> urls = new ArrayList<>(pages.size());
        for (final Page page : pages) {
            urls.add(page.url());
        }
        return new CheckpointState(pages, urls, Page.nowEpochSeconds(), pages.size());
    }

    public CompletedCorpus toCompletedCorpus() {
        return new CompletedCorpus(Page.nowEpochSeconds(), pages.size(), pages);
    }
}
