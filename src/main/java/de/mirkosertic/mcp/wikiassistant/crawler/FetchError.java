package de.mirkosertic.mcp.wikiassistant.crawler;

/**
 * Failure categories of a single page fetch.
 */
public enum FetchError {
    /** Connection refused, reset, DNS failure and other I/O problems. */
    NETWORK,
    /** The request did not complete within the configured timeout. */
    TIMEOUT,
    /** The server answered with a non-2xx status. */
    HTTP_STATUS,
    /** The response could not be turned into a page. */
    EXTRACTION
}
