package fun.fengwk.bento.core.engine.mock;

import fun.fengwk.bento.core.engine.EngineCapabilities;
import fun.fengwk.bento.core.engine.EngineConfiguration;
import fun.fengwk.bento.core.engine.SearchEngine;
import fun.fengwk.bento.core.engine.SearchFieldDefinition;
import fun.fengwk.bento.core.engine.SemanticSearchField;
import fun.fengwk.bento.core.engine.UpstreamResponseException;
import fun.fengwk.bento.core.result.Author;
import fun.fengwk.bento.core.result.ErrorKind;
import fun.fengwk.bento.core.result.Item;
import fun.fengwk.bento.core.result.ItemFormat;
import fun.fengwk.bento.core.result.ResultSet;
import fun.fengwk.bento.core.result.SearchError;
import fun.fengwk.bento.core.search.SearchRequest;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory engine producing deterministic items, for tests and demos.
 *
 * <p>Configuration keys:
 * <ul>
 *     <li>{@code total_items}: hit count reported, default 1000</li>
 *     <li>{@code max_per_page}: advertised maximum page size</li>
 *     <li>{@code search_fields}: supported search field keys</li>
 *     <li>{@code semantic_fields}: map of semantic name to search field key</li>
 *     <li>{@code sort_keys}: supported sort keys</li>
 *     <li>{@code error}: when set, every search returns a failed result with this info</li>
 *     <li>{@code raise}: when set, every search throws {@link UpstreamResponseException} with this message</li>
 *     <li>{@code delay_ms}: latency to simulate before answering</li>
 *     <li>{@code format}: format of the produced items, default Article</li>
 * </ul>
 *
 * @author fengwk
 */
public class MockEngine implements SearchEngine {

    public static final String TYPE = "mock";

    private static final Map<String, Object> DEFAULT_CONFIGURATION = Map.of(
        "total_items", 1000,
        "format", ItemFormat.ARTICLE.name()
    );

    private final EngineConfiguration configuration;
    private final EngineCapabilities capabilities;

    public MockEngine() {
        this(Map.of());
    }

    public MockEngine(Map<String, ?> config) {
        this.configuration = EngineConfiguration.create(TYPE, DEFAULT_CONFIGURATION, config, List.of());
        this.capabilities = buildCapabilities(configuration);
    }

    @Override
    public ResultSet searchImplementation(SearchRequest request) throws Exception {
        long delayMs = configuration.getLong("delay_ms", 0L);
        if (delayMs > 0) {
            Thread.sleep(delayMs);
        }

        String raise = configuration.getString("raise");
        if (StringUtils.hasText(raise)) {
            throw new UpstreamResponseException(raise);
        }
        String error = configuration.getString("error");
        if (StringUtils.hasText(error)) {
            return ResultSet.failed(SearchError.of(ErrorKind.UPSTREAM_FAILURE, error));
        }

        Integer configuredTotal = configuration.getInteger("total_items");
        int totalItems = configuredTotal == null ? 0 : configuredTotal;
        int count = Math.max(0, Math.min(request.getPerPage(), totalItems - request.getStart()));
        ItemFormat format = ItemFormat.fromValue(configuration.getString("format"));

        List<Item> items = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int number = request.getStart() + i + 1;
            items.add(Item.builder()
                .title("Item " + number + ": " + request.getQuery())
                .link("https://example.org/mock/" + number)
                .format(format)
                .authors(new ArrayList<>(List.of(new Author("Jane", "Doe"))))
                .year(2000 + number % 25)
                .build());
        }
        return new ResultSet(items, totalItems);
    }

    @Override
    public EngineCapabilities capabilities() {
        return capabilities;
    }

    @Override
    public EngineConfiguration configuration() {
        return configuration;
    }

    private static EngineCapabilities buildCapabilities(EngineConfiguration configuration) {
        Map<String, String> semanticMap = new LinkedHashMap<>();
        configuration.getMap("semantic_fields").forEach((semantic, key) -> {
            if (key != null) {
                semanticMap.put(semantic, key.toString());
            }
        });

        List<SearchFieldDefinition> searchFields = new ArrayList<>();
        for (String key : configuration.getStringList("search_fields")) {
            SemanticSearchField semantic = null;
            for (Map.Entry<String, String> entry : semanticMap.entrySet()) {
                if (entry.getValue().equals(key)) {
                    semantic = SemanticSearchField.fromKey(entry.getKey());
                    break;
                }
            }
            searchFields.add(SearchFieldDefinition.of(key, semantic));
        }

        return EngineCapabilities.builder()
            .maxPerPage(configuration.getInteger("max_per_page"))
            .searchFields(searchFields)
            .semanticSearchMap(semanticMap)
            .sortDefinitions(configuration.getStringList("sort_keys"))
            .build();
    }

}
