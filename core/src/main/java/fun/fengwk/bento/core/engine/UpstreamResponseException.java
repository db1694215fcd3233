package fun.fengwk.bento.core.engine;

/**
 * The external source answered with a malformed or error response.
 * Contained by the search executor by default.
 *
 * @author fengwk
 */
public class UpstreamResponseException extends RuntimeException {

    public UpstreamResponseException(String message) {
        super(message);
    }

    public UpstreamResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
