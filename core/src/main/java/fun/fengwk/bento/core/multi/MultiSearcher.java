package fun.fengwk.bento.core.multi;

import fun.fengwk.bento.core.engine.EngineConfiguration;
import fun.fengwk.bento.core.engine.EngineRegistry;
import fun.fengwk.bento.core.engine.SearchEngine;
import fun.fengwk.bento.core.result.ErrorKind;
import fun.fengwk.bento.core.result.ResultSet;
import fun.fengwk.bento.core.result.SearchError;
import fun.fengwk.bento.core.search.SearchExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the same search on several engines concurrently.
 *
 * <pre>{@code
 * MultiSearcher searcher = new MultiSearcher(articles, books);
 * searcher.start("cancer", Map.of("per_page", 5));
 * Map<String, ResultSet> results = searcher.results();
 * }</pre>
 *
 * <p>{@link #start} submits one task per engine before anything is awaited.
 * {@link #results()} blocks until every task is done and returns the results keyed
 * by engine id, or by the engine class name when no id is configured. It can be
 * called once per {@link #start}; later calls return an empty map. The threads of a
 * run exit once its searches finish, whether or not the results are collected, and
 * are all terminated before {@link #results()} returns.
 *
 * <p>One engine failing never affects the others: exceptions that escape an
 * engine's executor become a failed {@link ResultSet} for that engine.
 *
 * @author fengwk
 */
@Slf4j
public class MultiSearcher {

    private static final String THREAD_NAME_PREFIX = "bento-multi-search-";
    private static final long TERMINATION_TIMEOUT_MS = 5000;

    private final List<SearchEngine> engines = new ArrayList<>();
    private final List<EngineTask> tasks = new ArrayList<>();
    private final AtomicInteger threadIdGen = new AtomicInteger(1);
    private ExecutorService executor;

    public MultiSearcher(SearchEngine... engines) {
        this(Arrays.asList(engines));
    }

    public MultiSearcher(Collection<? extends SearchEngine> engines) {
        engines.forEach(this::addEngine);
    }

    /**
     * Creates a searcher over registered engines.
     *
     * @throws fun.fengwk.bento.core.engine.EngineNotFoundException if an id is not registered
     */
    public static MultiSearcher of(EngineRegistry registry, String... engineIds) {
        return new MultiSearcher(registry.getAll(Arrays.asList(engineIds)));
    }

    /**
     * Starts a run and collects its results.
     */
    public static Map<String, ResultSet> runAll(Collection<? extends SearchEngine> engines,
                                                Object queryOrArgs,
                                                Map<String, ?> options) {
        MultiSearcher searcher = new MultiSearcher(engines);
        searcher.start(queryOrArgs, options);
        return searcher.results();
    }

    public synchronized MultiSearcher addEngine(SearchEngine engine) {
        if (engine == null) {
            throw new IllegalArgumentException("engine is null");
        }
        engines.add(engine);
        return this;
    }

    public synchronized List<SearchEngine> getEngines() {
        return List.copyOf(engines);
    }

    public void start(Map<String, ?> arguments) {
        start(arguments, null);
    }

    /**
     * Starts one search per engine, arguments as for {@link SearchExecutor#search}.
     *
     * @throws IllegalStateException if the previous run was not collected
     */
    public synchronized void start(Object queryOrArgs, Map<String, ?> options) {
        if (executor != null) {
            throw new IllegalStateException("multi search already started, collect results first");
        }
        executor = Executors.newFixedThreadPool(Math.max(1, engines.size()), newThreadFactory());
        for (SearchEngine engine : engines) {
            long startNanos = System.nanoTime();
            CompletableFuture<ResultSet> future = CompletableFuture.supplyAsync(
                () -> new SearchExecutor(engine).search(queryOrArgs, options),
                executor
            );
            tasks.add(new EngineTask(engine, future, startNanos));
        }
        // accepted tasks still run
        executor.shutdown();
        log.debug("multi search started, engines={}", engines.size());
    }

    /**
     * Waits for every engine of the current run and returns results keyed by engine id,
     * in engine order. Returns an empty map when there is no uncollected run.
     */
    public synchronized Map<String, ResultSet> results() {
        Map<String, ResultSet> results = new LinkedHashMap<>();
        if (executor == null) {
            return results;
        }
        try {
            for (EngineTask task : tasks) {
                String key = resultKey(task.engine);
                ResultSet previous = results.put(key, await(task));
                if (previous != null) {
                    log.warn("duplicate engine id in multi search, later result wins, engineId={}", key);
                }
            }
        } finally {
            tasks.clear();
            terminate(executor);
            executor = null;
        }
        return results;
    }

    /**
     * Configured engine id, falling back to the fully qualified engine class name.
     */
    public static String resultKey(SearchEngine engine) {
        String id = engine.configuration().getId();
        return StringUtils.hasText(id) ? id : engine.getClass().getName();
    }

    /**
     * Stops tasks still running after an interrupted collect and waits for them briefly.
     */
    private void terminate(ExecutorService runExecutor) {
        runExecutor.shutdownNow();
        boolean interrupted = Thread.interrupted();
        try {
            if (!runExecutor.awaitTermination(TERMINATION_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                log.warn("multi search threads did not terminate, timeoutMs={}", TERMINATION_TIMEOUT_MS);
            }
        } catch (InterruptedException ex) {
            interrupted = true;
            log.warn("interrupted while waiting for multi search threads to terminate");
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private ResultSet await(EngineTask task) {
        try {
            return task.future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("multi search interrupted, engineId={}", resultKey(task.engine));
            return failedResults(task, ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.warn("engine failed in multi search, engineId={}, error={}", resultKey(task.engine), cause.getMessage(), cause);
            return failedResults(task, cause);
        }
    }

    private ResultSet failedResults(EngineTask task, Throwable cause) {
        EngineConfiguration configuration = task.engine.configuration();
        ResultSet failed = ResultSet.failed(SearchError.of(ErrorKind.ENGINE_FAILURE, cause));
        failed.setEngineId(configuration.getId());
        failed.setDisplayConfiguration(configuration.getForDisplay());
        failed.setTiming(Duration.ofNanos(System.nanoTime() - task.startNanos));
        return failed;
    }

    private ThreadFactory newThreadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(THREAD_NAME_PREFIX + threadIdGen.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static class EngineTask {

        private final SearchEngine engine;
        private final CompletableFuture<ResultSet> future;
        private final long startNanos;

        private EngineTask(SearchEngine engine, CompletableFuture<ResultSet> future, long startNanos) {
            this.engine = engine;
            this.future = future;
            this.startNanos = startNanos;
        }

    }

}
