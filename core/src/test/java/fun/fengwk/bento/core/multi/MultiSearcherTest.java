package fun.fengwk.bento.core.multi;

import fun.fengwk.bento.core.engine.EngineRegistry;
import fun.fengwk.bento.core.engine.EngineNotFoundException;
import fun.fengwk.bento.core.engine.SearchEngine;
import fun.fengwk.bento.core.engine.StubSearchEngine;
import fun.fengwk.bento.core.engine.mock.MockEngine;
import fun.fengwk.bento.core.engine.mock.MockEngineFactory;
import fun.fengwk.bento.core.result.ErrorKind;
import fun.fengwk.bento.core.result.Item;
import fun.fengwk.bento.core.result.ResultSet;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
class MultiSearcherTest {

    @Test
    void shouldIsolateFailingEngine() {
        SearchEngine articles = new MockEngine(Map.of("id", "articles", "total_items", 3));
        SearchEngine books = new MockEngine(Map.of("id", "books", "total_items", 2));
        SearchEngine broken = new MockEngine(Map.of("id", "broken", "raise", "connection refused"));

        Map<String, ResultSet> results = MultiSearcher.runAll(List.of(articles, broken, books), "cancer", null);

        assertThat(results).hasSize(3);
        assertThat(results.keySet()).containsExactly("articles", "broken", "books");
        assertThat(results.values().stream().filter(ResultSet::failed)).hasSize(1);
        assertThat(results.get("broken").failed()).isTrue();
        assertThat(results.get("articles").size()).isEqualTo(3);
        assertThat(results.get("books").size()).isEqualTo(2);
        assertThat(results.get("books").getItems()).extracting(Item::getEngineId).containsOnly("books");
    }

    @Test
    void shouldConvertEscapedExceptionsIntoFailedResults() {
        SearchEngine buggy = new StubSearchEngine("buggy", request -> {
            throw new IllegalStateException("parser bug");
        });
        SearchEngine articles = new MockEngine(Map.of("id", "articles"));

        Map<String, ResultSet> results = MultiSearcher.runAll(List.of(buggy, articles), "cancer", null);

        ResultSet failed = results.get("buggy");
        assertThat(failed.failed()).isTrue();
        assertThat(failed.getError().getKind()).isEqualTo(ErrorKind.ENGINE_FAILURE);
        assertThat(failed.getError().getCause()).isInstanceOf(IllegalStateException.class).hasMessage("parser bug");
        assertThat(failed.getEngineId()).isEqualTo("buggy");
        assertThat(failed.getTiming()).isNotNull();
        assertThat(results.get("articles").failed()).isFalse();
    }

    @Test
    void shouldReturnResultsOnlyOncePerStart() {
        MultiSearcher searcher = new MultiSearcher(new MockEngine(Map.of("id", "articles")));
        searcher.start(Map.of("query", "cancer"));

        Map<String, ResultSet> first = searcher.results();
        Map<String, ResultSet> second = searcher.results();

        assertThat(first).containsOnlyKeys("articles");
        assertThat(second).isEmpty();

        searcher.start("again", null);
        assertThat(searcher.results()).containsOnlyKeys("articles");
    }

    @Test
    void shouldRejectStartBeforeCollecting() {
        MultiSearcher searcher = new MultiSearcher(new MockEngine(Map.of("id", "articles")));
        searcher.start("cancer", null);

        assertThatThrownBy(() -> searcher.start("cancer", null)).isInstanceOf(IllegalStateException.class);
        assertThat(searcher.results()).hasSize(1);
    }

    @Test
    void shouldRunEnginesConcurrently() throws Exception {
        int engineCount = 3;
        CountDownLatch allStarted = new CountDownLatch(engineCount);
        SearchEngine[] engines = new SearchEngine[engineCount];
        for (int i = 0; i < engineCount; i++) {
            engines[i] = new StubSearchEngine("engine-" + i, request -> {
                allStarted.countDown();
                if (!allStarted.await(5, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("engines did not run concurrently");
                }
                return new ResultSet(List.of(Item.builder().title(Thread.currentThread().getName()).build()), 1);
            });
        }

        Map<String, ResultSet> results = MultiSearcher.runAll(List.of(engines), "cancer", null);

        assertThat(results).hasSize(engineCount);
        assertThat(results.values()).allMatch(resultSet -> !resultSet.failed());
        assertThat(results.get("engine-0").get(0).getTitle()).startsWith("bento-multi-search-");
    }

    @Test
    void shouldKeepLastResultForDuplicateIds() {
        SearchEngine first = new MockEngine(Map.of("id", "same", "total_items", 1));
        SearchEngine second = new MockEngine(Map.of("id", "same", "total_items", 2));

        Map<String, ResultSet> results = MultiSearcher.runAll(List.of(first, second), "cancer", null);

        assertThat(results).hasSize(1);
        assertThat(results.get("same").getTotalItems()).isEqualTo(2);
    }

    @Test
    void shouldFallBackToClassNameWithoutId() {
        Map<String, ResultSet> results = MultiSearcher.runAll(List.of(new MockEngine()), "cancer", null);

        assertThat(results).containsOnlyKeys(MockEngine.class.getName());
    }

    @Test
    void shouldReturnEmptyMapWithoutEngines() {
        assertThat(MultiSearcher.runAll(List.of(), "cancer", null)).isEmpty();
    }

    @Test
    void shouldResolveEnginesFromRegistry() {
        EngineRegistry registry = new EngineRegistry(List.of(new MockEngineFactory()));
        registry.register("articles", Map.of("engine", "mock", "total_items", 4));
        registry.register("books", Map.of("engine", "mock", "total_items", 1));

        MultiSearcher searcher = MultiSearcher.of(registry, "articles", "books");
        searcher.start("cancer", Map.of("per_page", 2));
        Map<String, ResultSet> results = searcher.results();

        assertThat(results.get("articles").size()).isEqualTo(2);
        assertThat(results.get("books").size()).isEqualTo(1);
        assertThatThrownBy(() -> MultiSearcher.of(registry, "missing")).isInstanceOf(EngineNotFoundException.class);
    }

    @Test
    void shouldTerminateThreadsAfterCollecting() throws Exception {
        List<Thread> workers = new CopyOnWriteArrayList<>();
        SearchEngine failing = new StubSearchEngine("failing", request -> {
            workers.add(Thread.currentThread());
            throw new IllegalStateException("parser bug");
        });
        SearchEngine succeeding = new StubSearchEngine("succeeding", request -> {
            workers.add(Thread.currentThread());
            return new ResultSet(List.of(), 0);
        });

        Map<String, ResultSet> results = MultiSearcher.runAll(List.of(failing, succeeding), "cancer", null);

        assertThat(results.get("failing").failed()).isTrue();
        assertThat(results.get("succeeding").failed()).isFalse();
        for (Thread worker : workers) {
            worker.join(1000);
        }
        assertThat(workers).hasSize(2).noneMatch(Thread::isAlive);
    }

    @Test
    void shouldReleaseThreadsOfUncollectedRun() throws Exception {
        List<Thread> workers = new CopyOnWriteArrayList<>();
        CountDownLatch finished = new CountDownLatch(2);
        StubSearchEngine.Implementation implementation = request -> {
            workers.add(Thread.currentThread());
            finished.countDown();
            return new ResultSet(List.of(), 0);
        };
        MultiSearcher searcher = new MultiSearcher(
            new StubSearchEngine("articles", implementation),
            new StubSearchEngine("books", implementation)
        );

        searcher.start("cancer", null);

        assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();
        for (Thread worker : workers) {
            worker.join(5000);
        }
        assertThat(workers).hasSize(2).noneMatch(Thread::isAlive);
    }

    @Test
    void shouldStopRunningEnginesWhenInterrupted() throws Exception {
        AtomicReference<Thread> worker = new AtomicReference<>();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch never = new CountDownLatch(1);
        SearchEngine blocking = new StubSearchEngine("blocking", request -> {
            worker.set(Thread.currentThread());
            started.countDown();
            never.await();
            return new ResultSet(List.of(), 0);
        });
        MultiSearcher searcher = new MultiSearcher(blocking);
        searcher.start("cancer", null);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        Thread.currentThread().interrupt();
        Map<String, ResultSet> results = searcher.results();
        assertThat(Thread.interrupted()).isTrue();

        assertThat(results.get("blocking").failed()).isTrue();
        assertThat(results.get("blocking").getError().getKind()).isEqualTo(ErrorKind.ENGINE_FAILURE);
        worker.get().join(1000);
        assertThat(worker.get().isAlive()).isFalse();
    }

}
