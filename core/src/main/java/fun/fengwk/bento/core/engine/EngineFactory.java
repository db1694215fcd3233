package fun.fengwk.bento.core.engine;

import java.util.Map;

/**
 * Creates engines of one type from configuration.
 *
 * @author fengwk
 */
public interface EngineFactory {

    /**
     * Type name referenced by the {@code engine} configuration key.
     */
    String type();

    /**
     * @throws EngineConfigurationException if required configuration is missing
     */
    SearchEngine create(Map<String, ?> configuration);

}
