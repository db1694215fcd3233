package fun.fengwk.bento.core.configuration;

import fun.fengwk.bento.core.engine.EngineConfigurationException;
import fun.fengwk.bento.core.engine.EngineRegistry;
import fun.fengwk.bento.core.engine.mock.MockEngineFactory;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
class EngineRegistryConfigurationTest {

    private final EngineRegistryConfiguration configuration = new EngineRegistryConfiguration();

    @Test
    void shouldRegisterConfiguredEngines() {
        BentoProperties properties = new BentoProperties();
        properties.getEngines().put("articles", new LinkedHashMap<>(Map.of("engine", "mock", "total_items", 5)));
        properties.getEngines().put("books", new LinkedHashMap<>(Map.of("engine", "mock")));
        properties.setDefaultEngines(List.of("articles", "missing"));

        EngineRegistry registry = configuration.engineRegistry(properties, List.of(new MockEngineFactory()));

        assertThat(registry.ids()).containsExactly("articles", "books");
        assertThat(registry.get("articles").configuration().getId()).isEqualTo("articles");
        assertThat(registry.get("articles").search("cancer", null).getTotalItems()).isEqualTo(5);
    }

    @Test
    void shouldFailOnUnknownEngineType() {
        BentoProperties properties = new BentoProperties();
        properties.getEngines().put("articles", new LinkedHashMap<>(Map.of("engine", "summon")));

        assertThatThrownBy(() -> configuration.engineRegistry(properties, List.of(new MockEngineFactory())))
            .isInstanceOf(EngineConfigurationException.class)
            .hasMessage("engine articles has unknown engine type summon");
    }

}
