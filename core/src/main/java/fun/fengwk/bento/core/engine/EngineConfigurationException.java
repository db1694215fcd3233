package fun.fengwk.bento.core.engine;

/**
 * Engine configuration is missing or inconsistent. Thrown when an engine or the
 * registry is set up, never converted into a failed search.
 *
 * @author fengwk
 */
public class EngineConfigurationException extends RuntimeException {

    public EngineConfigurationException(String message) {
        super(message);
    }

    public EngineConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
