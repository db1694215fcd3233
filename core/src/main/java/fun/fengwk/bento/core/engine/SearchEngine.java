package fun.fengwk.bento.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import fun.fengwk.bento.core.result.ResultSet;
import fun.fengwk.bento.core.search.PublicSearchArgs;
import fun.fengwk.bento.core.search.SearchExecutor;
import fun.fengwk.bento.core.search.SearchRequest;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Contract of a configured adapter for one external search source.
 *
 * <p>Implementations only translate a normalized {@link SearchRequest} into a call
 * to their source and the answer into a {@link ResultSet}. Argument normalization,
 * timing, metadata and exception containment are done by {@link SearchExecutor}.
 *
 * <p>An engine may be shared by concurrent searches, so it must not keep
 * per-search state in fields. Configuration is fixed at construction.
 *
 * @author fengwk
 */
public interface SearchEngine {

    /**
     * Exceptions turned into failed results unless an engine overrides
     * {@link #autoRescueExceptions()}.
     */
    List<Class<? extends Exception>> DEFAULT_AUTO_RESCUE_EXCEPTIONS = List.of(
        TimeoutException.class,
        SocketTimeoutException.class,
        HttpTimeoutException.class,
        JsonProcessingException.class,
        UpstreamResponseException.class
    );

    /**
     * Runs the search against the external source.
     *
     * @param request normalized request
     * @return results, never null; set the error for failures the engine detects itself
     * @throws Exception exceptions listed by {@link #autoRescueExceptions()} become failed
     *                   results, anything else reaches the caller
     */
    ResultSet searchImplementation(SearchRequest request) throws Exception;

    EngineCapabilities capabilities();

    EngineConfiguration configuration();

    /**
     * Exception types contained by the executor. Subclasses of listed types match too.
     */
    default List<Class<? extends Exception>> autoRescueExceptions() {
        return DEFAULT_AUTO_RESCUE_EXCEPTIONS;
    }

    /**
     * Argument keys that may be taken from untrusted input.
     */
    default Set<String> publicSettableSearchArgs() {
        return PublicSearchArgs.DEFAULT_KEYS;
    }

    /**
     * Searches with a bare query and options.
     */
    default ResultSet search(String query, Map<String, ?> options) {
        return new SearchExecutor(this).search(query, options);
    }

    /**
     * Searches with a single argument map holding {@code query}.
     */
    default ResultSet search(Map<String, ?> arguments) {
        return new SearchExecutor(this).execute(arguments);
    }

}
