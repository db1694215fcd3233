package fun.fengwk.bento.core.engine;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static description of what an engine type supports. Read-only once built.
 *
 * @author fengwk
 */
@Getter
@ToString
public class EngineCapabilities {

    public static final EngineCapabilities NONE = EngineCapabilities.builder().build();

    /**
     * Largest accepted page size, null means unbounded.
     */
    private final Integer maxPerPage;

    /**
     * Search field key to definition, in declaration order.
     */
    private final Map<String, SearchFieldDefinition> searchFieldDefinitions;

    /**
     * Semantic name to engine search field key. Contains the explicit entries
     * plus those derived from definitions that declare a semantic field.
     */
    private final Map<String, String> semanticSearchMap;

    /**
     * Supported sort keys, in declaration order.
     */
    private final List<String> sortDefinitions;

    @Builder
    private EngineCapabilities(Integer maxPerPage,
                               Collection<SearchFieldDefinition> searchFields,
                               Map<String, String> semanticSearchMap,
                               List<String> sortDefinitions) {
        if (maxPerPage != null && maxPerPage < 1) {
            throw new IllegalArgumentException("maxPerPage must be positive: " + maxPerPage);
        }
        this.maxPerPage = maxPerPage;

        Map<String, SearchFieldDefinition> definitions = new LinkedHashMap<>();
        Map<String, String> semantic = new LinkedHashMap<>();
        if (searchFields != null) {
            for (SearchFieldDefinition definition : searchFields) {
                definitions.put(definition.getKey(), definition);
                if (definition.getSemantic() != null) {
                    semantic.putIfAbsent(definition.getSemantic().getKey(), definition.getKey());
                }
            }
        }
        if (semanticSearchMap != null) {
            semantic.putAll(semanticSearchMap);
        }
        this.searchFieldDefinitions = Collections.unmodifiableMap(definitions);
        this.semanticSearchMap = Collections.unmodifiableMap(semantic);
        this.sortDefinitions = sortDefinitions == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(sortDefinitions));
    }

    public Set<String> searchKeys() {
        return searchFieldDefinitions.keySet();
    }

    public Set<String> semanticSearchKeys() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(semanticSearchMap.keySet()));
    }

    public List<String> sortKeys() {
        return sortDefinitions;
    }

}
