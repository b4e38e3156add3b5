package de.mirkosertic.mcp.wikiassistant.crawler;

import de.mirkosertic.mcp.wikiassistant.corpus.CheckpointState;
import de.mirkosertic.mcp.wikiassistant.corpus.CompletedCorpus;
import de.mirkosertic.mcp.wikiassistant.corpus.CorpusRepository;
import de.mirkosertic.mcp.wikiassistant.corpus.CorpusState;
import de.mirkosertic.mcp.wikiassistant.corpus.Page;
import de.mirkosertic.mcp.wikiassistant.corpus.PageStore;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Orchestrates wiki crawling: systematic oldid walks and random page discovery.
 * Manages crawler lifecycle: start, pause, resume and stop.
 * <p>
 * A single coordinator thread owns the {@link PageStore} of a run. Fetches are fanned out in
 * batches through the {@link CrawlExecutorService}, their results are merged and persisted
 * sequentially by the coordinator after each batch. Whatever way a run ends (completion, stop
 * request, interrupt or unexpected error) its state is persisted exactly once more before the
 * run returns, so a later run resumes where this one left off.
 */
public class WikiCrawlerService {

    private static final Logger logger = LoggerFactory.getLogger(WikiCrawlerService.class);

    private static final long PAUSE_POLL_MS = 100;
    private static final long SHUTDOWN_JOIN_MS = 30_000;

    private final CrawlerSettings settings;
    private final PageFetcher fetcher;
    private final CorpusRepository repository;
    private final CrawlExecutorService crawlExecutor;
    private final CrawlStatisticsTracker statisticsTracker;
    private final List<CrawlCompletionListener> completionListeners = new CopyOnWriteArrayList<>();

    private final AtomicBoolean crawling = new AtomicBoolean(false);
    private final AtomicBoolean paused = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    // Guards interrupts of the run thread so they never hit a file write
    private final Object interruptLock = new Object();
    private boolean interruptible = false;
    private @Nullable Thread runThread;

    private volatile @Nullable Thread coordinatorThread;
    private volatile @Nullable CrawlRunSummary lastRun;
    private volatile CrawlerState state = CrawlerState.IDLE;

    public WikiCrawlerService(
            final CrawlerSettings settings,
            final PageFetcher fetcher,
            final CorpusRepository repository,
            final CrawlExecutorService crawlExecutor,
            final CrawlStatisticsTracker statisticsTracker) {
        this.settings = settings;
        this.fetcher = fetcher;
        this.repository = repository;
        this.crawlExecutor = crawlExecutor;
        this.statisticsTracker = statisticsTracker;
    }

    public void addCompletionListener(final CrawlCompletionListener listener) {
        completionListeners.add(listener);
    }

    // ==================== Lifecycle ====================

    /**
     * Start a crawl on a background coordinator thread.
     *
     * @param targetPages target page count for random discovery, {@code null} for the configured default;
     *                    ignored in systematic mode
     * @return false if a crawl is already in progress
     */
    public boolean startCrawl(final CrawlMode mode, final @Nullable Integer targetPages) {
        final int target = effectiveTarget(targetPages);
        if (!beginRun()) {
            logger.warn("Crawl already in progress");
            return false;
        }
        final Thread coordinator = new Thread(() -> executeAndFinish(mode, target), "crawl-coordinator");
        coordinator.setDaemon(true);
        coordinatorThread = coordinator;
        coordinator.start();
        return true;
    }

    /**
     * Run a systematic crawl on the calling thread.
     *
     * @throws IllegalStateException if a crawl is already in progress
     */
    public CrawlRunSummary runSystematic() {
        if (!beginRun()) {
            throw new IllegalStateException("Crawl already in progress");
        }
        return executeAndFinish(CrawlMode.SYSTEMATIC, 0);
    }

    /**
     * Run a random discovery crawl on the calling thread.
     *
     * @param targetPages number of distinct pages to collect in total, {@code null} for the configured default
     * @throws IllegalStateException if a crawl is already in progress
     */
    public CrawlRunSummary runRandomDiscovery(final @Nullable Integer targetPages) {
        final int target = effectiveTarget(targetPages);
        if (!beginRun()) {
            throw new IllegalStateException("Crawl already in progress");
        }
        return executeAndFinish(CrawlMode.RANDOM, target);
    }

    /**
     * Ask the running crawl to stop. The crawl thread persists its state before it ends.
     *
     * @return false if no crawl is running
     */
    public boolean stopCrawler() {
        if (!crawling.get()) {
            return false;
        }
        if (stopRequested.compareAndSet(false, true)) {
            paused.set(false);
            state = CrawlerState.STOPPING;
            logger.info("Crawler stop requested");
            synchronized (interruptLock) {
                if (interruptible && runThread != null) {
                    runThread.interrupt();
                }
            }
        }
        return true;
    }

    /**
     * Edit persisted crawl data without racing a crawl. While the action runs no crawl can start.
     *
     * @return the action's result, or empty if a crawl is in progress and the action was not run
     */
    public <T> Optional<T> tryExclusive(final CorpusAction<T> action) throws IOException {
        if (!crawling.compareAndSet(false, true)) {
            return Optional.empty();
        }
        try {
            return Optional.of(action.run());
        } finally {
            crawling.set(false);
        }
    }

    public void pauseCrawler() {
        if (crawling.get() && !stopRequested.get() && paused.compareAndSet(false, true)) {
            state = CrawlerState.PAUSED;
            logger.info("Crawler paused");
        }
    }

    public void resumeCrawler() {
        if (crawling.get() && paused.compareAndSet(true, false)) {
            state = CrawlerState.CRAWLING;
            logger.info("Crawler resumed");
        }
    }

    public CrawlerState getState() {
        return state;
    }

    public boolean isCrawling() {
        return crawling.get();
    }

    public CrawlStatistics getStatistics() {
        return statisticsTracker.getStatistics();
    }

    public @Nullable CrawlRunSummary getLastRun() {
        return lastRun;
    }

    public CrawlerSettings getSettings() {
        return settings;
    }

    /**
     * Shutdown the crawler service. Should be called on application shutdown.
     * Stops a running crawl and waits for its final persist.
     */
    public void shutdown() {
        logger.info("Shutting down WikiCrawlerService");
        stopCrawler();

        final Thread coord = coordinatorThread;
        if (coord != null && coord != Thread.currentThread()) {
            try {
                coord.join(SHUTDOWN_JOIN_MS);
                if (coord.isAlive()) {
                    logger.warn("Crawl coordinator did not finish within {}ms", SHUTDOWN_JOIN_MS);
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for coordinator thread");
            }
        }
    }

    // ==================== Run management ====================

    private boolean beginRun() {
        if (!crawling.compareAndSet(false, true)) {
            return false;
        }
        stopRequested.set(false);
        paused.set(false);
        state = CrawlerState.CRAWLING;
        return true;
    }

    private CrawlRunSummary executeAndFinish(final CrawlMode mode, final int target) {
        synchronized (interruptLock) {
            runThread = Thread.currentThread();
            interruptible = true;
        }
        CrawlRunSummary summary = null;
        try {
            summary = mode == CrawlMode.SYSTEMATIC ? executeSystematic() : executeRandomDiscovery(target);
            return summary;
        } finally {
            synchronized (interruptLock) {
                interruptible = false;
                runThread = null;
            }
            statisticsTracker.markFinished();
            lastRun = summary;
            paused.set(false);
            state = CrawlerState.IDLE;
            crawling.set(false);
            if (summary != null) {
                notifyCompletion(summary);
            }
        }
    }

    private void notifyCompletion(final CrawlRunSummary summary) {
        for (final CrawlCompletionListener listener : completionListeners) {
            try {
                listener.onCrawlFinished(summary);
            } catch (final RuntimeException e) {
                logger.error("Crawl completion listener failed", e);
            }
        }
    }

    private int effectiveTarget(final @Nullable Integer targetPages) {
        if (targetPages == null) {
            return settings.targetPages();
        }
        if (targetPages < 0) {
            throw new IllegalArgumentException("targetPages must not be negative, was " + targetPages);
        }
        return targetPages;
    }

    // ==================== Systematic mode ====================

    private CrawlRunSummary executeSystematic() {
        final CorpusState loaded = repository.loadCorpus(settings.corpusFile());
        final PageStore store = loaded != null ? PageStore.fromCorpus(loaded) : new PageStore(PageStore.KeyType.ID);
        final long endOldid = settings.endOldid();
        long cursor = Math.max(settings.startOldid() - 1, loaded != null ? loaded.lastOldid() : 0);

        statisticsTracker.reset(CrawlMode.SYSTEMATIC, endOldid, store.size());
        statisticsTracker.updateProgress(store.size(), cursor);

        logger.info("Starting systematic crawl of oldid {} to {} from oldid {} ({} pages already stored)",
                settings.startOldid(), endOldid, cursor + 1, store.size());
        logger.info("Concurrent requests: {}, saving every {} pages", settings.maxConcurrent(), settings.saveEveryPages());

        CrawlRunSummary.Outcome outcome = CrawlRunSummary.Outcome.COMPLETED;
        int pagesSinceLastSave = 0;
        try {
            while (cursor < endOldid) {
                if (!awaitWhilePaused()) {
                    outcome = CrawlRunSummary.Outcome.STOPPED;
                    break;
                }

                final long batchStart = cursor + 1;
                final long batchEnd = Math.min(batchStart + settings.maxConcurrent() - 1, endOldid);
                logger.info("Processing batch: oldid {} to {}", batchStart, batchEnd);

                final List<Callable<FetchResult>> tasks = new ArrayList<>();
                for (long oldid = batchStart; oldid <= batchEnd; oldid++) {
                    final long id = oldid;
                    tasks.add(() -> fetcher.fetchRevision(id));
                }
                final List<FetchResult> results = crawlExecutor.invokeBatch(tasks, WikiCrawlerService::taskFailure);

                for (int i = 0; i < results.size(); i++) {
                    if (mergeResult(store, results.get(i))) {
                        pagesSinceLastSave++;
                    }
                    // The cursor moves past failed ids too, they are only retried by a fresh range
                    cursor = batchStart + i;
                }
                statisticsTracker.updateProgress(store.size(), cursor);

                if (pagesSinceLastSave >= settings.saveEveryPages()) {
                    saveCorpus(store, cursor);
                    pagesSinceLastSave = 0;
                }

                statisticsTracker.logProgress();

                if (cursor < endOldid) {
                    delayBetweenBatches();
                }
            }
        } catch (final InterruptedException e) {
            outcome = CrawlRunSummary.Outcome.STOPPED;
            logger.info("Crawl interrupted at oldid {}", cursor);
        } catch (final RuntimeException e) {
            outcome = CrawlRunSummary.Outcome.FAILED;
            logger.error("Error during systematic crawl at oldid {}", cursor, e);
        } finally {
            logger.info("Final save...");
            final long lastOldid = cursor;
            finalPersist(() -> repository.saveCorpus(settings.corpusFile(), store.toCorpusState(lastOldid)), "corpus");
        }

        final String message;
        if (cursor >= endOldid) {
            outcome = CrawlRunSummary.Outcome.COMPLETED;
            message = "Completed, all pages from oldid " + settings.startOldid() + " to " + endOldid + " processed";
        } else {
            message = "Stopped at oldid " + cursor + ", run again to continue";
        }
        logger.info("{}. Total pages collected: {}", message, store.size());

        return new CrawlRunSummary(CrawlMode.SYSTEMATIC, outcome, store.size(),
                statisticsTracker.getStatistics().pagesAccepted(), cursor, settings.corpusFile(), message);
    }

    private void saveCorpus(final PageStore store, final long cursor) {
        persist(() -> repository.saveCorpus(settings.corpusFile(), store.toCorpusState(cursor)), "corpus");
    }

    // ==================== Random discovery mode ====================

    private CrawlRunSummary executeRandomDiscovery(final int target) {
        final CheckpointState checkpoint = repository.loadCheckpoint(settings.checkpointFile());
        final PageStore store;
        if (checkpoint != null) {
            store = PageStore.fromCheckpoint(checkpoint);
        } else {
            store = new PageStore(PageStore.KeyType.URL);
            final CompletedCorpus completed = repository.loadCompletedCorpus(settings.randomCorpusFile());
            if (completed != null) {
                store.addAll(completed.pages());
                logger.info("Seeded random discovery with {} pages of the completed corpus {}",
                        store.size(), settings.randomCorpusFile());
            }
        }

        statisticsTracker.reset(CrawlMode.RANDOM, target, store.size());

        if (store.size() >= target && checkpoint == null) {
            final String message = "Target of " + target + " pages already reached (" + store.size() + " pages)";
            logger.info(message);
            return new CrawlRunSummary(CrawlMode.RANDOM, CrawlRunSummary.Outcome.COMPLETED, store.size(), 0, 0,
                    settings.randomCorpusFile(), message);
        }

        logger.info("Starting random discovery towards {} pages ({} already collected, {} concurrent requests)",
                target, store.size(), settings.maxConcurrent());

        CrawlRunSummary.Outcome outcome = CrawlRunSummary.Outcome.COMPLETED;
        int consecutiveEmptyBatches = 0;
        try {
            while (store.size() < target) {
                if (!awaitWhilePaused()) {
                    outcome = CrawlRunSummary.Outcome.STOPPED;
                    break;
                }

                final int need = target - store.size();
                final int batchSize = Math.min(settings.maxConcurrent(), need);
                final List<Callable<FetchResult>> tasks = new ArrayList<>(batchSize);
                for (int i = 0; i < batchSize; i++) {
                    tasks.add(fetcher::fetchRandom);
                }
                final List<FetchResult> results = crawlExecutor.invokeBatch(tasks, WikiCrawlerService::taskFailure);

                // Duplicate draws are not replaced within the batch
                int added = 0;
                boolean checkpointDue = false;
                for (final FetchResult result : results) {
                    if (mergeResult(store, result)) {
                        added++;
                        if (store.size() % settings.checkpointInterval() == 0) {
                            checkpointDue = true;
                        }
                    }
                }
                statisticsTracker.updateProgress(store.size(), 0);

                if (checkpointDue && store.size() < target) {
                    saveCheckpoint(store);
                }

                statisticsTracker.logProgress();

                consecutiveEmptyBatches = added == 0 ? consecutiveEmptyBatches + 1 : 0;
                if (settings.maxConsecutiveEmptyBatches() > 0
                        && consecutiveEmptyBatches >= settings.maxConsecutiveEmptyBatches()) {
                    logger.warn("{} batches in a row added no page, stopping random discovery at {} of {} pages",
                            consecutiveEmptyBatches, store.size(), target);
                    outcome = CrawlRunSummary.Outcome.STOPPED;
                    break;
                }

                if (store.size() < target) {
                    delayBetweenBatches();
                }
            }
        } catch (final InterruptedException e) {
            outcome = CrawlRunSummary.Outcome.STOPPED;
            logger.info("Random discovery interrupted at {} of {} pages", store.size(), target);
        } catch (final RuntimeException e) {
            outcome = CrawlRunSummary.Outcome.FAILED;
            logger.error("Error during random discovery at {} of {} pages", store.size(), target, e);
        } finally {
            if (store.size() >= target) {
                finishRandomDiscovery(store);
            } else {
                logger.info("Final checkpoint...");
                finalPersist(() -> repository.saveCheckpoint(settings.checkpointFile(), store.toCheckpointState()),
                        "checkpoint");
            }
        }

        final boolean completed = store.size() >= target;
        final String message = completed
                ? "Completed, collected " + store.size() + " distinct pages"
                : "Stopped at " + store.size() + " of " + target + " pages, run again to continue";
        logger.info(message);

        return new CrawlRunSummary(CrawlMode.RANDOM,
                completed ? CrawlRunSummary.Outcome.COMPLETED : outcome,
                store.size(),
                statisticsTracker.getStatistics().pagesAccepted(),
                0,
                completed ? settings.randomCorpusFile() : settings.checkpointFile(),
                message);
    }

    private void finishRandomDiscovery(final PageStore store) {
        final boolean written = finalPersist(() -> repository.saveCompletedCorpus(
                settings.randomCorpusFile(), settings.randomSummaryFile(), store.toCompletedCorpus()), "completed corpus");
        if (!written) {
            // Keep the progress resumable if the final corpus could not be written
            finalPersist(() -> repository.saveCheckpoint(settings.checkpointFile(), store.toCheckpointState()),
                    "checkpoint");
            return;
        }
        try {
            repository.deleteCheckpoint(settings.checkpointFile());
        } catch (final IOException e) {
            logger.error("Failed to delete checkpoint {}, a later run will resume from it",
                    settings.checkpointFile(), e);
        }
    }

    private void saveCheckpoint(final PageStore store) {
        persist(() -> repository.saveCheckpoint(settings.checkpointFile(), store.toCheckpointState()), "checkpoint");
    }

    // ==================== Shared helpers ====================

    /**
     * Merge one fetch result into the store.
     *
     * @return true if a new page was added
     */
    private boolean mergeResult(final PageStore store, final FetchResult result) {
        switch (result.outcome()) {
            case FETCHED -> {
                final Page page = result.page();
                if (store.add(page)) {
                    statisticsTracker.recordAccepted();
                    logger.info("Page {}: {} ({} words)", page.id(), page.title(), page.wordCount());
                    return true;
                }
                statisticsTracker.recordDuplicate();
                logger.debug("Skipping duplicate page {}", page.id());
                return false;
            }
            case EMPTY -> {
                statisticsTracker.recordEmpty();
                logger.debug("Empty fetch: {}", result.message());
                return false;
            }
            case FAILED -> {
                statisticsTracker.recordFailure(result.error());
                return false;
            }
            default -> throw new IllegalStateException("Unknown fetch outcome " + result.outcome());
        }
    }

    private static FetchResult taskFailure(final Throwable cause) {
        return FetchResult.failed(FetchError.EXTRACTION, String.valueOf(cause.getMessage()));
    }

    /**
     * Wait while the crawler is paused.
     *
     * @return false if a stop was requested
     */
    private boolean awaitWhilePaused() throws InterruptedException {
        while (paused.get() && !stopRequested.get()) {
            Thread.sleep(PAUSE_POLL_MS);
        }
        return !stopRequested.get();
    }

    private void delayBetweenBatches() throws InterruptedException {
        if (settings.batchDelayMs() > 0) {
            Thread.sleep(settings.batchDelayMs());
        }
    }

    @FunctionalInterface
    private interface PersistAction {
        void run() throws IOException;
    }

    /**
     * Cadence persist: shielded from stop interrupts, failures are counted and the crawl goes on.
     */
    private boolean persist(final PersistAction action, final String what) {
        synchronized (interruptLock) {
            interruptible = false;
        }
        final boolean interrupted = Thread.interrupted();
        try {
            return runPersist(action, what);
        } finally {
            synchronized (interruptLock) {
                interruptible = true;
            }
            if (interrupted || stopRequested.get()) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * End-of-run persist: no interrupt can reach the run thread any more.
     */
    private boolean finalPersist(final PersistAction action, final String what) {
        synchronized (interruptLock) {
            interruptible = false;
        }
        final boolean interrupted = Thread.interrupted();
        try {
            return runPersist(action, what);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private boolean runPersist(final PersistAction action, final String what) {
        try {
            action.run();
            statisticsTracker.recordPersist();
            return true;
        } catch (final IOException e) {
            statisticsTracker.recordPersistFailure();
            logger.error("Failed to save {}, data at risk until the next successful save", what, e);
            return false;
        }
    }

    public enum CrawlerState {
        IDLE,
        CRAWLING,
        PAUSED,
        STOPPING
    }

    /**
     * Work on persisted crawl data, see {@link #tryExclusive(CorpusAction)}.
     */
    @FunctionalInterface
    public interface CorpusAction<T> {
        T run() throws IOException;
    }
}
