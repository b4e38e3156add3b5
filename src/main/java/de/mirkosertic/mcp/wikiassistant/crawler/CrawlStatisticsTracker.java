package de.mirkosertic.mcp.wikiassistant.crawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks crawler progress statistics.
 * Written by the crawl coordinator, read concurrently by status queries.
 */
public class CrawlStatisticsTracker {

    private static final Logger logger = LoggerFactory.getLogger(CrawlStatisticsTracker.class);

    private final AtomicLong pagesAccepted = new AtomicLong(0);
    private final AtomicLong duplicatesSkipped = new AtomicLong(0);
    private final AtomicLong emptyPages = new AtomicLong(0);
    private final AtomicLong persists = new AtomicLong(0);
    private final AtomicLong persistFailures = new AtomicLong(0);
    private final AtomicLong corpusSize = new AtomicLong(0);
    private final AtomicLong cursor = new AtomicLong(0);
    private final Map<FetchError, AtomicLong> failures = new EnumMap<>(FetchError.class);

    private volatile CrawlMode mode;
    private volatile long goal = 0;
    private volatile long startTime = 0;
    private volatile long endTime = 0;

    public CrawlStatisticsTracker() {
        for (final FetchError error : FetchError.values()) {
            failures.put(error, new AtomicLong(0));
        }
    }

    /**
     * Start tracking a new run.
     *
     * @param goal range end for systematic runs, target page count for random runs
     */
    public void reset(final CrawlMode newMode, final long newGoal, final int initialCorpusSize) {
        pagesAccepted.set(0);
        duplicatesSkipped.set(0);
        emptyPages.set(0);
        persists.set(0);
        persistFailures.set(0);
        cursor.set(0);
        corpusSize.set(initialCorpusSize);
        for (final AtomicLong counter : failures.values()) {
            counter.set(0);
        }
        mode = newMode;
        goal = newGoal;
        startTime = System.currentTimeMillis();
        endTime = 0;
    }

    public void recordAccepted() {
        pagesAccepted.incrementAndGet();
    }

    public void recordDuplicate() {
        duplicatesSkipped.incrementAndGet();
    }

    public void recordEmpty() {
        emptyPages.incrementAndGet();
    }

    public void recordFailure(final FetchError error) {
        failures.get(error).incrementAndGet();
    }

    public void recordPersist() {
        persists.incrementAndGet();
    }

    public void recordPersistFailure() {
        persistFailures.incrementAndGet();
    }

    public void updateProgress(final int currentCorpusSize, final long currentCursor) {
        corpusSize.set(currentCorpusSize);
        cursor.set(currentCursor);
    }

    public void markFinished() {
        endTime = System.currentTimeMillis();
    }

    /**
     * Log the per-batch progress line.
     */
    public void logProgress() {
        final CrawlStatistics stats = getStatistics();
        logger.info("Progress: {}% | Total pages collected: {} | accepted {}, duplicates {}, empty {}, failed {}",
                formatPercent(stats.progressPercent()),
                stats.corpusSize(),
                stats.pagesAccepted(),
                stats.duplicatesSkipped(),
                stats.emptyPages(),
                stats.pagesFailed());
    }

    static String formatPercent(final double percent) {
        return String.format(Locale.ROOT, "%.1f", percent);
    }

    public CrawlStatistics getStatistics() {
        final Map<FetchError, Long> failuresSnapshot = new EnumMap<>(FetchError.class);
        for (final Map.Entry<FetchError, AtomicLong> entry : failures.entrySet()) {
            failuresSnapshot.put(entry.getKey(), entry.getValue().get());
        }
        final long end = endTime != 0 ? endTime : System.currentTimeMillis();
        return new CrawlStatistics(
                mode,
                pagesAccepted.get(),
                duplicatesSkipped.get(),
                emptyPages.get(),
                Map.copyOf(failuresSnapshot),
                persists.get(),
                persistFailures.get(),
                corpusSize.get(),
                cursor.get(),
                goal,
                startTime,
                startTime == 0 ? 0 : end
        );
    }
}
