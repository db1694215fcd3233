package fun.fengwk.bento.core.configuration;

import fun.fengwk.bento.core.engine.EngineFactory;
import fun.fengwk.bento.core.engine.EngineRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * @author fengwk
 */
@Slf4j
@Configuration
public class EngineRegistryConfiguration {

    @Bean
    public EngineRegistry engineRegistry(BentoProperties bentoProperties, List<EngineFactory> engineFactories) {
        EngineRegistry registry = new EngineRegistry(engineFactories);
        bentoProperties.getEngines().forEach(registry::register);
        for (String id : bentoProperties.getDefaultEngines()) {
            if (!registry.contains(id)) {
                log.warn("default engine is not registered, id={}", id);
            }
        }
        log.info("engine registry ready, engines={}, types={}", registry.ids(), registry.types());
        return registry;
    }

}
