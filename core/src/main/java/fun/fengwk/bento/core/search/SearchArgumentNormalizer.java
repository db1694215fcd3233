package fun.fengwk.bento.core.search;

import fun.fengwk.bento.core.engine.EngineCapabilities;
import fun.fengwk.bento.core.engine.EngineConfiguration;
import fun.fengwk.bento.core.engine.SemanticSearchField;
import fun.fengwk.bento.core.engine.UnrecognizedSearchFieldPolicy;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Turns loosely typed caller arguments into a {@link SearchRequest}.
 *
 * <p>Pagination values may be strings or numbers; blank values count as unset.
 * Exactly one of {@code page} and {@code start} may be given and the other is
 * derived from it. Invalid input raises {@link InvalidSearchArgumentsException}
 * rather than being silently fixed.
 *
 * @author fengwk
 */
public final class SearchArgumentNormalizer {

    private SearchArgumentNormalizer() {
    }

    /**
     * Combines a bare query and options into one argument map. A map given as
     * first argument is used as the options map; option entries win over the query.
     */
    public static Map<String, Object> mergeArguments(Object queryOrArgs, Map<String, ?> options) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        if (queryOrArgs instanceof Map<?, ?> map) {
            map.forEach((key, value) -> arguments.put(String.valueOf(key), value));
        } else if (queryOrArgs != null) {
            arguments.put(SearchArgs.QUERY, queryOrArgs.toString());
        }
        if (options != null) {
            options.forEach(arguments::put);
        }
        return arguments;
    }

    public static SearchRequest normalize(Object queryOrArgs,
                                          Map<String, ?> options,
                                          EngineCapabilities capabilities,
                                          EngineConfiguration configuration) {
        return normalize(mergeArguments(queryOrArgs, options), capabilities, configuration);
    }

    /**
     * Normalizes arguments for an engine.
     *
     * @param rawArgs       caller arguments, not modified
     * @param capabilities  capabilities of the target engine
     * @param configuration configuration of the target engine
     * @throws InvalidSearchArgumentsException if the arguments are conflicting or not supported
     */
    public static SearchRequest normalize(Map<String, ?> rawArgs,
                                          EngineCapabilities capabilities,
                                          EngineConfiguration configuration) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        if (rawArgs != null) {
            rawArgs.forEach(arguments::put);
        }
        EngineCapabilities caps = capabilities == null ? EngineCapabilities.NONE : capabilities;
        EngineConfiguration config = configuration == null ? EngineConfiguration.empty() : configuration;

        Object queryValue = arguments.remove(SearchArgs.QUERY);
        String query = queryValue == null ? null : queryValue.toString();

        Integer page = toInteger(arguments.remove(SearchArgs.PAGE), SearchArgs.PAGE);
        Integer start = toInteger(arguments.remove(SearchArgs.START), SearchArgs.START);
        Integer perPage = toInteger(arguments.remove(SearchArgs.PER_PAGE), SearchArgs.PER_PAGE);
        if (perPage == null) {
            perPage = SearchArgs.DEFAULT_PER_PAGE;
        }

        if (page != null && start != null) {
            throw new InvalidSearchArgumentsException("can't supply both page and start");
        }
        if (perPage < 1) {
            throw new InvalidSearchArgumentsException("per_page must be positive: " + perPage);
        }
        if (caps.getMaxPerPage() != null && perPage > caps.getMaxPerPage()) {
            throw new InvalidSearchArgumentsException(perPage + " is more than maximum per_page of "
                + caps.getMaxPerPage() + " for " + engineName(config));
        }

        if (page != null) {
            if (page < 1) {
                throw new InvalidSearchArgumentsException("page must be positive: " + page);
            }
            try {
                start = Math.multiplyExact(page - 1, perPage);
            } catch (ArithmeticException ex) {
                throw new InvalidSearchArgumentsException("page " + page + " with per_page " + perPage
                    + " is out of range", ex);
            }
        } else if (start != null) {
            if (start < 0) {
                throw new InvalidSearchArgumentsException("start must not be negative: " + start);
            }
            page = start / perPage + 1;
        } else {
            page = 1;
            start = 0;
        }

        String sort = toSort(arguments.remove(SearchArgs.SORT));

        UnrecognizedSearchFieldPolicy policy = resolvePolicy(arguments, config);
        String searchField = toText(arguments.remove(SearchArgs.SEARCH_FIELD));
        SemanticSearchField semanticSearchField = null;
        String semantic = toSemanticKey(arguments.remove(SearchArgs.SEMANTIC_SEARCH_FIELD));
        if (semantic != null) {
            String mapped = caps.getSemanticSearchMap().get(semantic);
            if (mapped == null && policy == UnrecognizedSearchFieldPolicy.RAISE) {
                throw new InvalidSearchArgumentsException(engineName(config)
                    + " does not know about semantic_search_field " + semantic);
            }
            searchField = mapped;
            semanticSearchField = SemanticSearchField.fromKey(semantic);
        }
        if (searchField != null && !caps.searchKeys().contains(searchField)
            && policy == UnrecognizedSearchFieldPolicy.RAISE) {
            throw new InvalidSearchArgumentsException(engineName(config)
                + " does not know about search_field " + searchField);
        }

        return SearchRequest.builder()
            .query(query)
            .searchField(searchField)
            .semanticSearchField(semanticSearchField)
            .sort(sort)
            .page(page)
            .start(start)
            .perPage(perPage)
            .extra(Collections.unmodifiableMap(arguments))
            .build();
    }

    /**
     * Request value when present and not blank, else the engine configuration.
     */
    private static UnrecognizedSearchFieldPolicy resolvePolicy(Map<String, Object> arguments,
                                                               EngineConfiguration configuration) {
        Object requested = arguments.get(SearchArgs.UNRECOGNIZED_SEARCH_FIELD);
        if (requested != null && StringUtils.hasText(requested.toString())) {
            return UnrecognizedSearchFieldPolicy.fromValue(requested);
        }
        return UnrecognizedSearchFieldPolicy.fromValue(configuration.getUnrecognizedSearchField());
    }

    /**
     * Exact conversion: fractions and values outside the int range are rejected.
     */
    private static Integer toInteger(Object value, String key) {
        if (value == null) {
            return null;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(text).intValueExact();
        } catch (NumberFormatException | ArithmeticException ex) {
            throw new InvalidSearchArgumentsException(key + " is not an integer in range: " + value, ex);
        }
    }

    private static String toSort(Object value) {
        if (value instanceof Enum<?> constant) {
            return constant.name().toLowerCase(Locale.ROOT);
        }
        return toText(value);
    }

    private static String toSemanticKey(Object value) {
        if (value instanceof SemanticSearchField field) {
            return field.getKey();
        }
        String text = toText(value);
        return text == null ? null : text.toLowerCase(Locale.ROOT);
    }

    private static String toText(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    private static String engineName(EngineConfiguration configuration) {
        String id = configuration.getId();
        return StringUtils.hasText(id) ? id : "engine";
    }

}
