package fun.fengwk.bento.core.service.impl;

import fun.fengwk.bento.core.configuration.BentoProperties;
import fun.fengwk.bento.core.engine.EngineNotFoundException;
import fun.fengwk.bento.core.engine.EngineRegistry;
import fun.fengwk.bento.core.engine.SearchEngine;
import fun.fengwk.bento.core.engine.StubSearchEngine;
import fun.fengwk.bento.core.engine.mock.MockEngine;
import fun.fengwk.bento.core.engine.mock.MockEngineFactory;
import fun.fengwk.bento.core.result.ResultSet;
import fun.fengwk.bento.core.search.SearchRequest;
import fun.fengwk.bento.core.service.model.EngineDescription;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
class BentoSearchServiceImplTest {

    @Mock
    private EngineRegistry engineRegistry;

    private BentoProperties bentoProperties;

    private BentoSearchServiceImpl bentoSearchService;

    @BeforeEach
    void setUp() {
        bentoProperties = new BentoProperties();
        bentoSearchService = new BentoSearchServiceImpl(engineRegistry, bentoProperties);
    }

    @Test
    void shouldFilterUntrustedArguments() {
        AtomicReference<SearchRequest> received = new AtomicReference<>();
        SearchEngine engine = new StubSearchEngine("articles", request -> {
            received.set(request);
            return new ResultSet(List.of(), 0);
        });
        when(engineRegistry.get("articles")).thenReturn(engine);

        ResultSet results = bentoSearchService.search("articles",
            Map.of("query", "cancer", "page", "2", "auth", true));

        assertThat(results.failed()).isFalse();
        assertThat(received.get().getPage()).isEqualTo(2);
        assertThat(received.get().getExtra()).doesNotContainKey("auth");
    }

    @Test
    void shouldPropagateUnknownEngine() {
        when(engineRegistry.get("missing")).thenThrow(new EngineNotFoundException("no engine registered with id missing"));

        assertThatThrownBy(() -> bentoSearchService.search("missing", Map.of("query", "cancer")))
            .isInstanceOf(EngineNotFoundException.class);
    }

    @Test
    void shouldUseDefaultEnginesForMultiSearch() {
        bentoProperties.setDefaultEngines(List.of("articles"));
        when(engineRegistry.getAll(List.of("articles")))
            .thenReturn(List.of(new MockEngine(Map.of("id", "articles", "total_items", 2))));

        Map<String, ResultSet> results = bentoSearchService.multiSearch(null, Map.of("query", "cancer"));

        assertThat(results).containsOnlyKeys("articles");
        assertThat(results.get("articles").size()).isEqualTo(2);
    }

    @Test
    void shouldSearchAllEnginesWhenNoDefaults() {
        when(engineRegistry.ids()).thenReturn(List.of("articles", "books"));
        when(engineRegistry.getAll(List.of("articles", "books"))).thenReturn(List.of(
            new MockEngine(Map.of("id", "articles")),
            new MockEngine(Map.of("id", "books", "error", "bad database"))
        ));

        Map<String, ResultSet> results = bentoSearchService.multiSearch(List.of(), Map.of("query", "cancer"));

        assertThat(results.get("articles").failed()).isFalse();
        assertThat(results.get("books").failed()).isTrue();
    }

    @Test
    void shouldDescribeRegisteredEngines() {
        EngineRegistry registry = new EngineRegistry(List.of(new MockEngineFactory()));
        registry.register("articles", Map.of(
            "engine", "mock",
            "max_per_page", 50,
            "search_fields", "TI,AU",
            "semantic_fields", Map.of("title", "TI"),
            "sort_keys", "relevance"
        ));
        BentoSearchServiceImpl service = new BentoSearchServiceImpl(registry, bentoProperties);

        List<EngineDescription> engines = service.listEngines();

        assertThat(engines).hasSize(1);
        EngineDescription description = engines.get(0);
        assertThat(description.getId()).isEqualTo("articles");
        assertThat(description.getEngine()).isEqualTo("mock");
        assertThat(description.getMaxPerPage()).isEqualTo(50);
        assertThat(description.getSearchFields()).containsExactly("TI", "AU");
        assertThat(description.getSemanticSearchFields()).containsExactly("title");
        assertThat(description.getSortKeys()).containsExactly("relevance");
    }

}
