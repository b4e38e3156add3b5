package de.mirkosertic.mcp.wikiassistant.crawler;

import java.nio.file.Path;

/**
 * What a finished crawl run achieved.
 *
 * @param corpusFile the file holding the run's pages: the systematic corpus, the completed
 *                   random corpus, or the checkpoint when a random run did not finish
 * @param lastOldid  cursor position of a systematic run, 0 for random runs
 */
public record CrawlRunSummary(
        CrawlMode mode,
        Outcome outcome,
        int totalPages,
        long pagesAccepted,
        long lastOldid,
        Path corpusFile,
        String message
) {

    public enum Outcome {
        /** Range fully walked or target reached. */
        COMPLETED,
        /** Stop request, interrupt or convergence guard; state was persisted for resuming. */
        STOPPED,
        /** Unexpected error; state was persisted for resuming. */
        FAILED
    }
}
