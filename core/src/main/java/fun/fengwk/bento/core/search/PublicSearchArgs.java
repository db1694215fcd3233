package fun.fengwk.bento.core.search;

import fun.fengwk.bento.core.engine.SearchEngine;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Whitelist of arguments that may come from untrusted input such as a web request.
 * Elevated access flags are not on it and must be set from trusted context only.
 *
 * @author fengwk
 */
public final class PublicSearchArgs {

    public static final Set<String> DEFAULT_KEYS = Set.of(
        SearchArgs.QUERY,
        SearchArgs.SEARCH_FIELD,
        SearchArgs.SEMANTIC_SEARCH_FIELD,
        SearchArgs.SORT,
        SearchArgs.PAGE,
        SearchArgs.START,
        SearchArgs.PER_PAGE
    );

    private PublicSearchArgs() {
    }

    /**
     * Keeps only the default whitelisted keys.
     */
    public static Map<String, Object> filter(Map<String, ?> untrusted) {
        return filter(untrusted, DEFAULT_KEYS);
    }

    /**
     * Keeps only the keys the engine accepts from untrusted input.
     */
    public static Map<String, Object> filter(Map<String, ?> untrusted, SearchEngine engine) {
        return filter(untrusted, engine.publicSettableSearchArgs());
    }

    public static Map<String, Object> filter(Map<String, ?> untrusted, Set<String> allowedKeys) {
        Map<String, Object> filtered = new LinkedHashMap<>();
        if (untrusted == null) {
            return filtered;
        }
        untrusted.forEach((key, value) -> {
            if (key != null && allowedKeys.contains(key)) {
                filtered.put(key, value);
            }
        });
        return filtered;
    }

}
