package de.mirkosertic.mcp.wikiassistant.crawler;

import de.mirkosertic.mcp.wikiassistant.corpus.CheckpointState;
import de.mirkosertic.mcp.wikiassistant.corpus.CompletedCorpus;
import de.mirkosertic.mcp.wikiassistant.corpus.CorpusRepository;
import de.mirkosertic.mcp.wikiassistant.corpus.CorpusState;
import de.mirkosertic.mcp.wikiassistant.corpus.Page;
import de.mirkosertic.mcp.wikiassistant.corpus.PageStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntFunction;
import java.util.function.LongFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Crawl loop tests against a scripted in-memory {@link PageFetcher}.
 */
@DisplayName("WikiCrawlerService Tests")
class WikiCrawlerServiceTest {

    private static final String BASE = "https://wiki.example.org";

    @TempDir
    Path tempDir;

    private CorpusRepository repository;
    private final List<CrawlExecutorService> executors = new ArrayList<>();

    @BeforeEach
    void setUp() {
        repository = new CorpusRepository();
    }

    @AfterEach
    void tearDown() {
        for (final CrawlExecutorService executor : executors) {
            executor.shutdown();
        }
    }

    /**
     * Fetcher whose answers are given by functions of the oldid or of the call number.
     */
    private static final class ScriptedFetcher implements PageFetcher {
        private final LongFunction<FetchResult> revisions;
        private final IntFunction<FetchResult> randomDraws;
        private final ConcurrentLinkedQueue<Long> fetchedOldids = new ConcurrentLinkedQueue<>();
        private final AtomicInteger randomCalls = new AtomicInteger();

        ScriptedFetcher(final LongFunction<FetchResult> revisions, final IntFunction<FetchResult> randomDraws) {
            this.revisions = revisions;
            this.randomDraws = randomDraws;
        }

        static ScriptedFetcher revisions(final LongFunction<FetchResult> revisions) {
            return new ScriptedFetcher(revisions, call -> FetchResult.failed(FetchError.NETWORK, "unused"));
        }

        static ScriptedFetcher random(final IntFunction<FetchResult> randomDraws) {
            return new ScriptedFetcher(oldid -> FetchResult.failed(FetchError.NETWORK, "unused"), randomDraws);
        }

        @Override
        public FetchResult fetchRevision(final long oldid) {
            fetchedOldids.add(oldid);
            return revisions.apply(oldid);
        }

        @Override
        public FetchResult fetchRandom() {
            return randomDraws.apply(randomCalls.incrementAndGet());
        }
    }

    private static FetchResult revisionPage(final long oldid) {
        return FetchResult.fetched(Page.forRevision(oldid, "Page " + oldid, BASE + "/index.php?oldid=" + oldid,
                "Content of revision " + oldid, List.of("General"), 1.0));
    }

    private static FetchResult discoveredPage(final String name) {
        return FetchResult.fetched(Page.forUrl(BASE + "/index.php/" + name, name, "About " + name, List.of(), 1.0));
    }

    private CrawlerSettings.Builder settings() {
        return CrawlerSettings.builder(tempDir)
                .baseUrl(BASE)
                .batchDelayMs(0)
                .maxConcurrent(2)
                .oldidRange(1, 10)
                .saveEveryPages(3)
                .checkpointInterval(5)
                .targetPages(6);
    }

    private WikiCrawlerService service(final CrawlerSettings settings, final PageFetcher fetcher) {
        final CrawlExecutorService executor = new CrawlExecutorService(settings.maxConcurrent());
        executors.add(executor);
        return new WikiCrawlerService(settings, fetcher, repository, executor, new CrawlStatisticsTracker());
    }

    @Nested
    @DisplayName("Systematic mode")
    class Systematic {

        @Test
        @DisplayName("Should walk the whole range and move the cursor past failed and empty ids")
        void walksWholeRange() {
            // Given
            final CrawlerSettings settings = settings().build();
            final ScriptedFetcher fetcher = ScriptedFetcher.revisions(oldid -> {
                if (oldid == 3) {
                    return FetchResult.failed(FetchError.NETWORK, "connection reset");
                }
                if (oldid == 5) {
                    return FetchResult.empty("No title container");
                }
                return revisionPage(oldid);
            });
            final WikiCrawlerService service = service(settings, fetcher);

            // When
            final CrawlRunSummary summary = service.runSystematic();

            // Then
            assertThat(summary.outcome()).isEqualTo(CrawlRunSummary.Outcome.COMPLETED);
            assertThat(summary.lastOldid()).isEqualTo(10);
            assertThat(summary.totalPages()).isEqualTo(8);
            assertThat(summary.message()).startsWith("Completed");

            final CorpusState persisted = repository.loadCorpus(settings.corpusFile());
            assertThat(persisted.lastOldid()).isEqualTo(10);
            assertThat(persisted.pages()).extracting(Page::id)
                    .containsExactly("1", "2", "4", "6", "7", "8", "9", "10");

            final CrawlStatistics stats = service.getStatistics();
            assertThat(stats.failuresByType().get(FetchError.NETWORK)).isEqualTo(1);
            assertThat(stats.emptyPages()).isEqualTo(1);
            assertThat(stats.pagesAccepted()).isEqualTo(8);
            assertThat(service.getState()).isEqualTo(WikiCrawlerService.CrawlerState.IDLE);
        }

        @Test
        @DisplayName("A second run over a finished range fetches nothing and changes nothing")
        void rerunIsIdempotent() {
            final CrawlerSettings settings = settings().build();
            service(settings, ScriptedFetcher.revisions(WikiCrawlerServiceTest::revisionPage)).runSystematic();
            final List<Page> before = repository.loadCorpus(settings.corpusFile()).pages();

            final ScriptedFetcher second = ScriptedFetcher.revisions(WikiCrawlerServiceTest::revisionPage);
            final CrawlRunSummary summary = service(settings, second).runSystematic();

            assertThat(second.fetchedOldids).isEmpty();
            assertThat(summary.outcome()).isEqualTo(CrawlRunSummary.Outcome.COMPLETED);
            assertThat(repository.loadCorpus(settings.corpusFile()).pages()).containsExactlyElementsOf(before);
        }

        @Test
        @DisplayName("Should resume after the persisted cursor")
        void resumesFromCursor() throws Exception {
            // Given: a corpus that stopped at oldid 6
            final CrawlerSettings settings = settings().build();
            final PageStore store = new PageStore(PageStore.KeyType.ID);
            for (long oldid = 1; oldid <= 6; oldid++) {
                store.add(revisionPage(oldid).page());
            }
            repository.saveCorpus(settings.corpusFile(), store.toCorpusState(6));
            final ScriptedFetcher fetcher = ScriptedFetcher.revisions(WikiCrawlerServiceTest::revisionPage);

            // When
            final CrawlRunSummary summary = service(settings, fetcher).runSystematic();

            // Then
            assertThat(fetcher.fetchedOldids).containsExactlyInAnyOrder(7L, 8L, 9L, 10L);
            assertThat(summary.totalPages()).isEqualTo(10);
            assertThat(summary.pagesAccepted()).isEqualTo(4);
        }

        @Test
        @DisplayName("Should start at the range start when no corpus exists")
        void startsAtRangeStart() {
            final CrawlerSettings settings = settings().oldidRange(5, 8).build();
            final ScriptedFetcher fetcher = ScriptedFetcher.revisions(WikiCrawlerServiceTest::revisionPage);

            service(settings, fetcher).runSystematic();

            assertThat(fetcher.fetchedOldids).containsExactlyInAnyOrder(5L, 6L, 7L, 8L);
        }

        @Test
        @DisplayName("A range where every fetch fails still completes with an empty corpus")
        void allFailuresStillAdvance() {
            final CrawlerSettings settings = settings().build();
            final ScriptedFetcher fetcher = ScriptedFetcher.revisions(
                    oldid -> FetchResult.failed(FetchError.HTTP_STATUS, "HTTP 404"));

            final CrawlRunSummary summary = service(settings, fetcher).runSystematic();

            assertThat(summary.lastOldid()).isEqualTo(10);
            assertThat(repository.loadCorpus(settings.corpusFile()).pages()).isEmpty();
            assertThat(repository.loadCorpus(settings.corpusFile()).lastOldid()).isEqualTo(10);
        }

        @Test
        @DisplayName("Should save every N accepted pages plus once at the end")
        void savesOnCadence() {
            // Batches of 2 pages: saves after pages 4 and 8, final save after page 10
            final CrawlerSettings settings = settings().build();
            final WikiCrawlerService service = service(settings,
                    ScriptedFetcher.revisions(WikiCrawlerServiceTest::revisionPage));

            service.runSystematic();

            assertThat(service.getStatistics().persists()).isEqualTo(3);
            assertThat(service.getStatistics().persistFailures()).isZero();
        }

        @Test
        @DisplayName("A duplicate page id is never stored twice")
        void duplicateIdsAreSkipped() {
            // Revisions 3 and 4 both resolve to the page with id 3
            final CrawlerSettings settings = settings().oldidRange(1, 4).build();
            final ScriptedFetcher fetcher = ScriptedFetcher.revisions(
                    oldid -> revisionPage(oldid == 4 ? 3 : oldid));
            final WikiCrawlerService service = service(settings, fetcher);

            final CrawlRunSummary summary = service.runSystematic();

            assertThat(summary.totalPages()).isEqualTo(3);
            assertThat(service.getStatistics().duplicatesSkipped()).isEqualTo(1);
        }

        @Test
        @DisplayName("Stopping persists the cursor and a new run continues from there")
        void stopPersistsAndResumes() throws Exception {
            // Given: the fetch of oldid 5 requests a stop
            final CrawlerSettings settings = settings().build();
            final AtomicReference<WikiCrawlerService> serviceRef = new AtomicReference<>();
            final ScriptedFetcher fetcher = ScriptedFetcher.revisions(oldid -> {
                if (oldid == 5) {
                    serviceRef.get().stopCrawler();
                    try {
                        Thread.sleep(5000);
                    } catch (final InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return revisionPage(oldid);
            });
            final WikiCrawlerService service = service(settings, fetcher);
            serviceRef.set(service);
            final CountDownLatch finished = new CountDownLatch(1);
            final AtomicReference<CrawlRunSummary> result = new AtomicReference<>();
            service.addCompletionListener(summary -> {
                result.set(summary);
                finished.countDown();
            });

            // When
            assertThat(service.startCrawl(CrawlMode.SYSTEMATIC, null)).isTrue();
            assertThat(finished.await(10, TimeUnit.SECONDS)).isTrue();

            // Then
            assertThat(result.get().outcome()).isEqualTo(CrawlRunSummary.Outcome.STOPPED);
            assertThat(result.get().lastOldid()).isEqualTo(4);
            assertThat(result.get().message()).isEqualTo("Stopped at oldid 4, run again to continue");
            assertThat(repository.loadCorpus(settings.corpusFile()).lastOldid()).isEqualTo(4);
            assertThat(service.isCrawling()).isFalse();

            // And a fresh run finishes the range
            final ScriptedFetcher resumed = ScriptedFetcher.revisions(WikiCrawlerServiceTest::revisionPage);
            final CrawlRunSummary second = service(settings, resumed).runSystematic();
            assertThat(resumed.fetchedOldids).doesNotContain(1L, 2L, 3L, 4L);
            assertThat(second.totalPages()).isEqualTo(10);
        }

        @Test
        @DisplayName("Only one crawl runs at a time")
        void rejectsSecondCrawl() throws Exception {
            final CrawlerSettings settings = settings().build();
            final CountDownLatch release = new CountDownLatch(1);
            final ScriptedFetcher fetcher = ScriptedFetcher.revisions(oldid -> {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return revisionPage(oldid);
            });
            final WikiCrawlerService service = service(settings, fetcher);

            assertThat(service.startCrawl(CrawlMode.SYSTEMATIC, null)).isTrue();
            assertThat(service.startCrawl(CrawlMode.RANDOM, null)).isFalse();
            assertThatThrownBy(service::runSystematic).isInstanceOf(IllegalStateException.class);
            assertThat(service.getState()).isEqualTo(WikiCrawlerService.CrawlerState.CRAWLING);

            release.countDown();
            service.shutdown();
            assertThat(service.isCrawling()).isFalse();
        }
    }

    @Nested
    @DisplayName("Random discovery mode")
    class RandomDiscovery {

        @Test
        @DisplayName("Should collect distinct pages, write the final corpus and delete the checkpoint")
        void collectsDistinctPages() {
            // Given: draws repeat A and B
            final List<String> draws = List.of("A", "B", "A", "C", "D", "B", "E", "F", "G", "H");
            final CrawlerSettings settings = settings().build();
            final WikiCrawlerService service = service(settings,
                    ScriptedFetcher.random(call -> discoveredPage(draws.get(call - 1))));

            // When
            final CrawlRunSummary summary = service.runRandomDiscovery(null);

            // Then
            assertThat(summary.outcome()).isEqualTo(CrawlRunSummary.Outcome.COMPLETED);
            assertThat(summary.totalPages()).isEqualTo(6);
            assertThat(summary.corpusFile()).isEqualTo(settings.randomCorpusFile());
            assertThat(service.getStatistics().duplicatesSkipped()).isEqualTo(2);

            final CompletedCorpus corpus = repository.loadCompletedCorpus(settings.randomCorpusFile());
            assertThat(corpus.totalPages()).isEqualTo(6);
            assertThat(corpus.pages()).extracting(Page::title).containsExactlyInAnyOrder("A", "B", "C", "D", "E", "F");
            assertThat(settings.randomSummaryFile()).exists();
            assertThat(settings.checkpointFile()).doesNotExist();
        }

        @Test
        @DisplayName("Should resume from a checkpoint and fetch only the missing pages")
        void resumesFromCheckpoint() throws Exception {
            // Given: a checkpoint holding 4 of 6 pages
            final CrawlerSettings settings = settings().build();
            final PageStore store = new PageStore(PageStore.KeyType.URL);
            for (final String name : List.of("A", "B", "C", "D")) {
                store.add(discoveredPage(name).page());
            }
            repository.saveCheckpoint(settings.checkpointFile(), store.toCheckpointState());
            final List<String> draws = List.of("E", "F");
            final ScriptedFetcher fetcher = ScriptedFetcher.random(call -> discoveredPage(draws.get(call - 1)));

            // When
            final CrawlRunSummary summary = service(settings, fetcher).runRandomDiscovery(null);

            // Then
            assertThat(fetcher.randomCalls.get()).isEqualTo(2);
            assertThat(summary.totalPages()).isEqualTo(6);
            assertThat(repository.loadCompletedCorpus(settings.randomCorpusFile()).pages())
                    .extracting(Page::title).startsWith("A", "B", "C", "D");
            assertThat(settings.checkpointFile()).doesNotExist();
        }

        @Test
        @DisplayName("Re-running after completion is a no-op")
        void rerunAfterCompletionIsNoOp() {
            final CrawlerSettings settings = settings().build();
            final List<String> draws = List.of("A", "B", "C", "D", "E", "F");
            service(settings, ScriptedFetcher.random(call -> discoveredPage(draws.get(call - 1))))
                    .runRandomDiscovery(null);

            final ScriptedFetcher second = ScriptedFetcher.random(call -> discoveredPage("X" + call));
            final WikiCrawlerService service = service(settings, second);
            final CrawlRunSummary summary = service.runRandomDiscovery(null);

            assertThat(second.randomCalls.get()).isZero();
            assertThat(summary.outcome()).isEqualTo(CrawlRunSummary.Outcome.COMPLETED);
            assertThat(summary.totalPages()).isEqualTo(6);
            assertThat(service.getStatistics().persists()).isZero();
            assertThat(settings.checkpointFile()).doesNotExist();
        }

        @Test
        @DisplayName("A larger target continues from the completed corpus")
        void largerTargetSeedsFromCompletedCorpus() {
            final CrawlerSettings settings = settings().build();
            final List<String> draws = List.of("A", "B", "C", "D", "E", "F");
            service(settings, ScriptedFetcher.random(call -> discoveredPage(draws.get(call - 1))))
                    .runRandomDiscovery(null);

            final ScriptedFetcher second = ScriptedFetcher.random(call -> discoveredPage("X" + call));
            final CrawlRunSummary summary = service(settings, second).runRandomDiscovery(8);

            assertThat(second.randomCalls.get()).isEqualTo(2);
            assertThat(summary.totalPages()).isEqualTo(8);
        }

        @Test
        @DisplayName("Checkpoints on the interval and stops when batches keep adding nothing")
        void checkpointsAndStopsOnEmptyBatches() {
            // Given: 7 distinct pages, then only failures
            final CrawlerSettings settings = settings()
                    .maxConcurrent(3)
                    .targetPages(20)
                    .maxConsecutiveEmptyBatches(2)
                    .build();
            final WikiCrawlerService service = service(settings, ScriptedFetcher.random(call -> call <= 7
                    ? discoveredPage("P" + call)
                    : FetchResult.failed(FetchError.TIMEOUT, "Timeout")));

            // When
            final CrawlRunSummary summary = service.runRandomDiscovery(null);

            // Then: one checkpoint when the corpus passed 5 pages, one final checkpoint
            assertThat(summary.outcome()).isEqualTo(CrawlRunSummary.Outcome.STOPPED);
            assertThat(summary.corpusFile()).isEqualTo(settings.checkpointFile());
            assertThat(service.getStatistics().persists()).isEqualTo(2);
            assertThat(settings.randomCorpusFile()).doesNotExist();

            final CheckpointState checkpoint = repository.loadCheckpoint(settings.checkpointFile());
            assertThat(checkpoint.scrapedData()).hasSize(7);
            assertThat(Set.copyOf(checkpoint.scrapedUrls())).hasSize(7);
        }

        @Test
        @DisplayName("Should reject a negative target before starting")
        void rejectsNegativeTarget() {
            final WikiCrawlerService service = service(settings().build(),
                    ScriptedFetcher.random(call -> discoveredPage("A")));

            assertThatThrownBy(() -> service.startCrawl(CrawlMode.RANDOM, -1))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(service.isCrawling()).isFalse();
        }
    }

    @Test
    @DisplayName("Corpus edits and crawls never overlap")
    void corpusEditsExcludeCrawls() throws Exception {
        // Given
        final CrawlerSettings settings = settings().build();
        final CountDownLatch release = new CountDownLatch(1);
        final WikiCrawlerService service = service(settings, ScriptedFetcher.revisions(oldid -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return revisionPage(oldid);
        }));
        final AtomicInteger editsRun = new AtomicInteger();

        // When a crawl is running the edit is refused
        assertThat(service.startCrawl(CrawlMode.SYSTEMATIC, null)).isTrue();
        assertThat(service.tryExclusive(editsRun::incrementAndGet)).isEmpty();
        assertThat(editsRun).hasValue(0);

        release.countDown();
        service.shutdown();

        // Then no crawl can start while an edit runs
        final Optional<Boolean> startedDuringEdit =
                service.tryExclusive(() -> service.startCrawl(CrawlMode.RANDOM, null));
        assertThat(startedDuringEdit).contains(false);
        assertThat(service.tryExclusive(editsRun::incrementAndGet)).contains(1);
        assertThat(service.isCrawling()).isFalse();
        assertThat(service.getState()).isEqualTo(WikiCrawlerService.CrawlerState.IDLE);
    }

    @Test
    @DisplayName("Completion listeners receive the run summary")
    void notifiesListeners() {
        final CrawlerSettings settings = settings().oldidRange(1, 2).build();
        final WikiCrawlerService service = service(settings,
                ScriptedFetcher.revisions(WikiCrawlerServiceTest::revisionPage));
        final List<CrawlRunSummary> received = new ArrayList<>();
        service.addCompletionListener(received::add);

        final CrawlRunSummary summary = service.runSystematic();

        assertThat(received).containsExactly(summary);
        assertThat(service.getLastRun()).isEqualTo(summary);
    }
}
