package fun.fengwk.bento.core.search;

import fun.fengwk.bento.core.engine.EngineConfiguration;
import fun.fengwk.bento.core.engine.SearchEngine;
import fun.fengwk.bento.core.result.ErrorKind;
import fun.fengwk.bento.core.result.Item;
import fun.fengwk.bento.core.result.ResultSet;
import fun.fengwk.bento.core.result.SearchError;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * Runs searches on one engine: normalizes arguments, calls the engine, contains
 * the exceptions the engine allows, and stamps metadata on the results.
 *
 * <p>Contained failures come back as failed {@link ResultSet}s. Exceptions outside
 * the engine's {@link SearchEngine#autoRescueExceptions()} are rethrown unchanged
 * so programming errors stay visible.
 *
 * @author fengwk
 */
@Slf4j
public class SearchExecutor {

    private final SearchEngine engine;

    public SearchExecutor(SearchEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    public ResultSet execute(Map<String, ?> rawArgs) {
        return search(rawArgs, null);
    }

    /**
     * @param queryOrArgs bare query, or a map of arguments holding {@code query}
     * @param options     additional arguments, may be null
     */
    public ResultSet search(Object queryOrArgs, Map<String, ?> options) {
        long startNanos = System.nanoTime();
        EngineConfiguration configuration = engine.configuration();
        Map<String, Object> arguments = SearchArgumentNormalizer.mergeArguments(queryOrArgs, options);

        SearchRequest request;
        try {
            request = SearchArgumentNormalizer.normalize(arguments, engine.capabilities(), configuration);
        } catch (InvalidSearchArgumentsException ex) {
            log.warn("invalid search arguments, engineId={}, error={}", configuration.getId(), ex.getMessage());
            ResultSet failed = ResultSet.failed(SearchError.of(ErrorKind.INVALID_ARGUMENTS, ex));
            failed.setSearchArgs(Collections.unmodifiableMap(arguments));
            fillInEngineMetadata(failed, configuration);
            failed.setTiming(elapsedSince(startNanos));
            return failed;
        }

        ResultSet results;
        try {
            results = engine.searchImplementation(request);
        } catch (Exception ex) {
            if (!isAutoRescue(ex)) {
                throw SearchExecutor.<RuntimeException>propagate(ex);
            }
            log.warn("search failed, engineId={}, error={}", configuration.getId(), ex.getMessage(), ex);
            results = ResultSet.failed(SearchError.of(ErrorKind.UPSTREAM_FAILURE, ex));
        }
        if (results == null) {
            throw new IllegalStateException(engine.getClass().getName() + " returned null results");
        }
        if (results.failed()) {
            results.setItems(new ArrayList<>());
        }

        fillInSearchMetadata(results, request);
        results.setTiming(elapsedSince(startNanos));

        for (Item item : results) {
            item.setEngineId(results.getEngineId());
            item.setDecorator(configuration.getDecorator());
            item.setDisplayConfiguration(configuration.getForDisplay());
        }
        return results;
    }

    /**
     * Sets the metadata derived from the normalized request and the engine configuration.
     */
    public void fillInSearchMetadata(ResultSet results, SearchRequest request) {
        results.setSearchArgs(request.toMap());
        results.setStart(request.getStart());
        results.setPerPage(request.getPerPage());
        fillInEngineMetadata(results, engine.configuration());
    }

    private boolean isAutoRescue(Exception ex) {
        for (Class<? extends Exception> type : engine.autoRescueExceptions()) {
            if (type.isInstance(ex)) {
                return true;
            }
        }
        return false;
    }

    private static void fillInEngineMetadata(ResultSet results, EngineConfiguration configuration) {
        results.setEngineId(configuration.getId());
        results.setDisplayConfiguration(configuration.getForDisplay());
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /**
     * Rethrows without wrapping, checked exceptions included.
     */
    @SuppressWarnings("unchecked")
    private static <E extends Exception> RuntimeException propagate(Exception ex) throws E {
        throw (E) ex;
    }

}
