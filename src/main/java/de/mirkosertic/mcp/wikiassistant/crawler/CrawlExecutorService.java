package de.mirkosertic.mcp.wikiassistant.crawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Thread pool for page fetches with a shared admission gate.
 * <p>
 * Every task passes a counting {@link Semaphore} before it runs and releases it on every exit
 * path, so no more than {@code maxConcurrent} fetches are in flight no matter how many tasks
 * are queued. Batches are joined with {@link #invokeBatch(List, Function)}: one failing task
 * never cancels or blocks its siblings.
 */
public class CrawlExecutorService {

    private static final Logger logger = LoggerFactory.getLogger(CrawlExecutorService.class);

    private final ThreadPoolExecutor executor;
    private final Semaphore admissionGate;
    private final int maxConcurrent;

    public CrawlExecutorService(final int maxConcurrent) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1, was " + maxConcurrent);
        }
        this.maxConcurrent = maxConcurrent;
        this.admissionGate = new Semaphore(maxConcurrent, true);

        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, "crawler-" + threadCounter.getAndIncrement());
            thread.setDaemon(false);
            return thread;
        };

        this.executor = new ThreadPoolExecutor(
                maxConcurrent,
                maxConcurrent,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(10000),
                threadFactory,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );

        logger.info("CrawlExecutorService initialized with {} threads", maxConcurrent);
    }

    /**
     * Submit a task that runs only while holding an admission permit.
     */
    public <T> Future<T> submitGated(final Callable<T> task) {
        return executor.submit(() -> {
            admissionGate.acquire();
            try {
                return task.call();
            } finally {
                admissionGate.release();
            }
        });
    }

    /**
     * Run all tasks through the admission gate and wait for every one of them.
     * <p>
     * Results are returned in submission order. A task that throws or is cancelled contributes
     * {@code onFailure.apply(cause)} for its slot only.
     *
     * @throws InterruptedException if the calling thread is interrupted while waiting; all
     *                              outstanding tasks of the batch are cancelled first
     */
    public <T> List<T> invokeBatch(final List<? extends Callable<T>> tasks,
                                   final Function<Throwable, T> onFailure) throws InterruptedException {
        final List<Future<T>> futures = new ArrayList<>(tasks.size());
        for (final Callable<T> task : tasks) {
            futures.add(submitGated(task));
        }

        final List<T> results = new ArrayList<>(futures.size());
        try {
            for (final Future<T> future : futures) {
                try {
                    results.add(future.get());
                } catch (final ExecutionException e) {
                    final Throwable cause = e.getCause() != null ? e.getCause() : e;
                    logger.error("Error in fetch task", cause);
                    results.add(onFailure.apply(cause));
                } catch (final CancellationException e) {
                    results.add(onFailure.apply(e));
                }
            }
        } catch (final InterruptedException e) {
            for (final Future<T> future : futures) {
                future.cancel(true);
            }
            logger.info("Batch interrupted, cancelled {} outstanding tasks", futures.size() - results.size());
            throw e;
        }
        return results;
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    /**
     * Number of free admission permits, {@code maxConcurrent} when idle.
     */
    public int availablePermits() {
        return admissionGate.availablePermits();
    }

    /**
     * Shutdown the executor service. Should be called on application shutdown.
     */
    public void shutdown() {
        logger.info("Shutting down CrawlExecutorService");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("CrawlExecutorService did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for CrawlExecutorService to terminate", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
