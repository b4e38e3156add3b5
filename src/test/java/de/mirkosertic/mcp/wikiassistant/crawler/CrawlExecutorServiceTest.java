package de.mirkosertic.mcp.wikiassistant.crawler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CrawlExecutorService Tests")
class CrawlExecutorServiceTest {

    private CrawlExecutorService executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    @DisplayName("Should never run more tasks at once than the concurrency limit")
    void boundsConcurrency() throws Exception {
        // Given
        executor = new CrawlExecutorService(3);
        final AtomicInteger inFlight = new AtomicInteger();
        final AtomicInteger maxInFlight = new AtomicInteger();
        final List<Callable<Integer>> tasks = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            final int value = i;
            tasks.add(() -> {
                final int now = inFlight.incrementAndGet();
                maxInFlight.accumulateAndGet(now, Math::max);
                Thread.sleep(20);
                inFlight.decrementAndGet();
                return value;
            });
        }

        // When
        final List<Integer> results = executor.invokeBatch(tasks, e -> -1);

        // Then
        assertThat(maxInFlight.get()).isLessThanOrEqualTo(3);
        assertThat(results).containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11);
        assertThat(executor.availablePermits()).isEqualTo(3);
    }

    @Test
    @DisplayName("A failing task only affects its own slot")
    void failureIsIsolated() throws Exception {
        executor = new CrawlExecutorService(2);
        final List<Callable<String>> tasks = List.of(
                () -> "a",
                () -> {
                    throw new IllegalStateException("boom");
                },
                () -> "c");

        final List<String> results = executor.invokeBatch(tasks, cause -> "failed: " + cause.getMessage());

        assertThat(results).containsExactly("a", "failed: boom", "c");
        assertThat(executor.availablePermits()).isEqualTo(2);
    }

    @Test
    @DisplayName("Interrupting the waiting thread cancels the batch and propagates")
    void interruptCancelsBatch() throws Exception {
        // Given
        executor = new CrawlExecutorService(2);
        final CountDownLatch started = new CountDownLatch(1);
        final AtomicReference<Throwable> thrown = new AtomicReference<>();
        final List<Callable<String>> tasks = List.of(() -> {
            started.countDown();
            Thread.sleep(10_000);
            return "never";
        });

        final Thread waiter = new Thread(() -> {
            try {
                executor.invokeBatch(tasks, e -> "failed");
            } catch (final InterruptedException e) {
                thrown.set(e);
            }
        });

        // When
        waiter.start();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        waiter.interrupt();
        waiter.join(5000);

        // Then
        assertThat(thrown.get()).isInstanceOf(InterruptedException.class);
    }

    @Test
    @DisplayName("Should reject a concurrency limit below one")
    void rejectsInvalidLimit() {
        assertThatThrownBy(() -> new CrawlExecutorService(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
