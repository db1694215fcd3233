package fun.fengwk.bento.core.result;

/**
 * Categories of failed searches.
 *
 * @author fengwk
 */
public enum ErrorKind {

    /**
     * Caller arguments rejected during normalization.
     */
    INVALID_ARGUMENTS,

    /**
     * Contained exception from the external call of an engine.
     */
    UPSTREAM_FAILURE,

    /**
     * Exception that escaped the executor, caught by the multi searcher.
     */
    ENGINE_FAILURE

}
