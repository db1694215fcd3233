package fun.fengwk.bento.core.engine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Engines registered by id. Populated at startup, then only read.
 *
 * <p>{@link #get(String)} creates a fresh engine on every call, configured with the
 * registered configuration plus the registry id.
 *
 * @author fengwk
 */
@Slf4j
public class EngineRegistry {

    private final Map<String, EngineFactory> factories = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Object>> definitions = Collections.synchronizedMap(new LinkedHashMap<>());

    public EngineRegistry(Collection<? extends EngineFactory> factories) {
        if (factories != null) {
            factories.forEach(this::registerFactory);
        }
    }

    public void registerFactory(EngineFactory factory) {
        String type = factory.type();
        if (!StringUtils.hasText(type)) {
            throw new EngineConfigurationException("engine factory type is blank: " + factory.getClass().getName());
        }
        EngineFactory previous = factories.putIfAbsent(type, factory);
        if (previous != null && previous != factory) {
            throw new EngineConfigurationException("duplicate engine type " + type);
        }
    }

    /**
     * Registers an engine configuration.
     *
     * @param id     engine id, unique within this registry
     * @param config configuration, must name a known type under {@code engine}
     * @throws EngineConfigurationException if the id is blank or taken, or the type is unknown
     */
    public void register(String id, Map<String, ?> config) {
        if (!StringUtils.hasText(id)) {
            throw new EngineConfigurationException("engine id is blank");
        }
        String engineType = config == null || config.get(EngineConfiguration.ENGINE) == null
            ? null
            : config.get(EngineConfiguration.ENGINE).toString();
        if (!StringUtils.hasText(engineType)) {
            throw new EngineConfigurationException("engine " + id + " has no engine type");
        }
        if (!factories.containsKey(engineType)) {
            throw new EngineConfigurationException("engine " + id + " has unknown engine type " + engineType);
        }

        Map<String, Object> definition = new LinkedHashMap<>(config);
        definition.put(EngineConfiguration.ID, id);
        synchronized (definitions) {
            if (definitions.containsKey(id)) {
                throw new EngineConfigurationException("duplicate engine id " + id);
            }
            definitions.put(id, Collections.unmodifiableMap(definition));
        }
        log.info("engine registered, id={}, type={}", id, engineType);
    }

    /**
     * Creates a new engine for the id.
     *
     * @throws EngineNotFoundException if the id is not registered
     */
    public SearchEngine get(String id) {
        Map<String, Object> definition = id == null ? null : definitions.get(id);
        if (definition == null) {
            throw new EngineNotFoundException("no engine registered with id " + id);
        }
        EngineFactory factory = factories.get(definition.get(EngineConfiguration.ENGINE).toString());
        return factory.create(definition);
    }

    public boolean contains(String id) {
        return id != null && definitions.containsKey(id);
    }

    /**
     * Registered ids in registration order.
     */
    public List<String> ids() {
        synchronized (definitions) {
            return List.copyOf(definitions.keySet());
        }
    }

    public Set<String> types() {
        return Collections.unmodifiableSet(factories.keySet());
    }

    public List<SearchEngine> getAll(Collection<String> ids) {
        List<SearchEngine> engines = new ArrayList<>();
        for (String id : ids) {
            engines.add(get(id));
        }
        return engines;
    }

}
