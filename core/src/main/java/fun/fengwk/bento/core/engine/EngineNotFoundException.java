package fun.fengwk.bento.core.engine;

/**
 * No engine registered under the requested id.
 *
 * @author fengwk
 */
public class EngineNotFoundException extends RuntimeException {

    public EngineNotFoundException(String message) {
        super(message);
    }
}
