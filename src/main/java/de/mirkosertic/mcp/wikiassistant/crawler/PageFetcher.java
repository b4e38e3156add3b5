package de.mirkosertic.mcp.wikiassistant.crawler;

/**
 * Fetches and extracts single wiki pages.
 * <p>
 * Implementations must never throw: every network or extraction problem is reported as a
 * {@link FetchResult#failed(FetchError, String) FAILED} result so that one bad page never
 * aborts a batch. Implementations must be safe to call from several threads at once.
 */
public interface PageFetcher {

    /**
     * Fetch the page of the given revision id.
     */
    FetchResult fetchRevision(long oldid);

    /**
     * Fetch whatever page the site's random page endpoint redirects to.
     */
    FetchResult fetchRandom();
}
