package fun.fengwk.bento.core.search;

import fun.fengwk.bento.core.engine.SemanticSearchField;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalized search request handed to an engine.
 *
 * <p>{@code page} and {@code start} are both always set and agree with each other:
 * {@code start = (page - 1) * perPage}.
 *
 * @author fengwk
 */
@Value
@Builder
public class SearchRequest {

    String query;

    /**
     * Engine specific search field, null to search all fields.
     */
    String searchField;

    /**
     * Semantic field the caller asked for, null if none or non-standard.
     */
    SemanticSearchField semanticSearchField;

    String sort;

    /**
     * 1-based page.
     */
    int page;

    /**
     * 0-based index of the first record.
     */
    int start;

    int perPage;

    /**
     * Caller keys the engine interprets itself.
     */
    @Builder.Default
    Map<String, Object> extra = Map.of();

    public Object getExtra(String key) {
        return extra.get(key);
    }

    /**
     * Map form with the standard keys followed by the extra keys.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(SearchArgs.QUERY, query);
        map.put(SearchArgs.PER_PAGE, perPage);
        map.put(SearchArgs.START, start);
        map.put(SearchArgs.PAGE, page);
        map.put(SearchArgs.SEARCH_FIELD, searchField);
        map.put(SearchArgs.SORT, sort);
        if (semanticSearchField != null) {
            map.put(SearchArgs.SEMANTIC_SEARCH_FIELD, semanticSearchField.getKey());
        }
        extra.forEach(map::putIfAbsent);
        return Collections.unmodifiableMap(map);
    }

}
