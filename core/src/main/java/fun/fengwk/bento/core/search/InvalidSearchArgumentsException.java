package fun.fengwk.bento.core.search;

/**
 * Search arguments rejected during normalization.
 *
 * @author fengwk
 */
public class InvalidSearchArgumentsException extends IllegalArgumentException {

    public InvalidSearchArgumentsException(String message) {
        super(message);
    }

    public InvalidSearchArgumentsException(String message, Throwable cause) {
        super(message, cause);
    }
}
