package fun.fengwk.bento.core.engine;

import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only engine configuration.
 *
 * <p>Values are kept as nested maps. Keys are normalized so that {@code for-display}
 * and {@code for_display} address the same entry, and {@link #lookup(String)}
 * resolves dotted paths such as {@code for_display.decorator} against either
 * nested maps or flat dotted keys.
 *
 * <p>Standard keys:
 * <ul>
 *     <li>{@code id}: identity of the engine within a registry</li>
 *     <li>{@code engine}: engine type, used by {@link EngineRegistry}</li>
 *     <li>{@code for_display}: display options, always present, copied to every item</li>
 *     <li>{@code for_display.decorator}: name of a presentation adapter, opaque here</li>
 *     <li>{@code unrecognized_search_field}: "raise" or "ignore"</li>
 * </ul>
 *
 * @author fengwk
 */
public final class EngineConfiguration {

    public static final String ID = "id";
    public static final String ENGINE = "engine";
    public static final String FOR_DISPLAY = "for_display";
    public static final String DECORATOR = "decorator";
    public static final String UNRECOGNIZED_SEARCH_FIELD = "unrecognized_search_field";

    private static final EngineConfiguration EMPTY = of(Map.of());

    private final Map<String, Object> values;

    private EngineConfiguration(Map<String, Object> values) {
        this.values = values;
    }

    public static EngineConfiguration empty() {
        return EMPTY;
    }

    public static EngineConfiguration of(Map<String, ?> config) {
        return create(null, null, config, null);
    }

    /**
     * Merges {@code config} over {@code defaults} and checks required keys.
     *
     * @param engineType   name used in error messages
     * @param defaults     type defaults, may be null
     * @param config       instance configuration, may be null
     * @param requiredKeys dotted paths that must resolve to a non-null value
     * @throws EngineConfigurationException if a required key is missing
     */
    public static EngineConfiguration create(String engineType,
                                             Map<String, ?> defaults,
                                             Map<String, ?> config,
                                             Collection<String> requiredKeys) {
        Map<String, Object> merged = new LinkedHashMap<>();
        deepMerge(merged, defaults);
        deepMerge(merged, config);
        if (!(merged.get(FOR_DISPLAY) instanceof Map)) {
            merged.put(FOR_DISPLAY, new LinkedHashMap<String, Object>());
        }

        EngineConfiguration configuration = new EngineConfiguration(freeze(merged));
        if (requiredKeys != null) {
            for (String requiredKey : requiredKeys) {
                if (configuration.lookup(requiredKey) == null) {
                    throw new EngineConfigurationException(
                        (engineType == null ? "engine" : engineType) + " requires configuration key " + requiredKey);
                }
            }
        }
        return configuration;
    }

    /**
     * Copy with the given id, used when an engine is created from a registry entry.
     */
    public EngineConfiguration withId(String id) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(ID, id);
        return new EngineConfiguration(Collections.unmodifiableMap(copy));
    }

    public Object get(String key) {
        return values.get(normalizeKey(key));
    }

    /**
     * Resolves a dotted path, returning null when any segment is missing.
     */
    public Object lookup(String path) {
        if (!StringUtils.hasText(path)) {
            return null;
        }
        String normalized = normalizeKey(path);
        if (values.containsKey(normalized)) {
            return values.get(normalized);
        }
        Object current = values;
        for (String segment : normalized.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    public String getString(String path) {
        Object value = lookup(path);
        return value == null ? null : value.toString();
    }

    public Integer getInteger(String path) {
        Object value = lookup(path);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException ex) {
            throw new EngineConfigurationException("configuration key " + path + " is not an integer: " + value, ex);
        }
    }

    public long getLong(String path, long defaultValue) {
        Object value = lookup(path);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value == null || !StringUtils.hasText(value.toString())) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException ex) {
            throw new EngineConfigurationException("configuration key " + path + " is not a number: " + value, ex);
        }
    }

    public boolean getBoolean(String path, boolean defaultValue) {
        Object value = lookup(path);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }

    /**
     * Reads a list given either as a list, an index-keyed map or a comma separated string.
     */
    public List<String> getStringList(String path) {
        Object value = lookup(path);
        List<String> result = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object element : collection) {
                addIfText(result, element);
            }
        } else if (value instanceof Map<?, ?> map) {
            for (Object element : map.values()) {
                addIfText(result, element);
            }
        } else if (value != null) {
            Arrays.stream(value.toString().split(",")).forEach(element -> addIfText(result, element));
        }
        return Collections.unmodifiableList(result);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String path) {
        Object value = lookup(path);
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return Map.of();
    }

    public String getId() {
        return getString(ID);
    }

    public String getEngine() {
        return getString(ENGINE);
    }

    public Map<String, Object> getForDisplay() {
        return getMap(FOR_DISPLAY);
    }

    public String getDecorator() {
        return getString(FOR_DISPLAY + "." + DECORATOR);
    }

    public String getUnrecognizedSearchField() {
        return getString(UNRECOGNIZED_SEARCH_FIELD);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "EngineConfiguration" + values;
    }

    static String normalizeKey(String key) {
        return key == null ? null : key.trim().replace('-', '_');
    }

    private static void addIfText(List<String> result, Object element) {
        if (element != null && StringUtils.hasText(element.toString())) {
            result.add(element.toString().trim());
        }
    }

    private static void deepMerge(Map<String, Object> target, Map<String, ?> source) {
        if (source == null) {
            return;
        }
        for (Map.Entry<String, ?> entry : source.entrySet()) {
            if (entry.getKey() == null) {
                continue;
            }
            String key = normalizeKey(entry.getKey());
            Object value = entry.getValue();
            Object existing = target.get(key);
            if (value instanceof Map<?, ?> map) {
                Map<String, Object> nested = new LinkedHashMap<>();
                if (existing instanceof Map<?, ?> existingMap) {
                    deepMerge(nested, toStringKeyMap(existingMap));
                }
                deepMerge(nested, toStringKeyMap(map));
                target.put(key, nested);
            } else {
                target.put(key, value);
            }
        }
    }

    private static Map<String, Object> toStringKeyMap(Map<?, ?> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((key, value) -> result.put(String.valueOf(key), value));
        return result;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> freeze(Map<String, Object> map) {
        Map<String, Object> frozen = new LinkedHashMap<>();
        map.forEach((key, value) -> {
            if (value instanceof Map<?, ?> nested) {
                frozen.put(key, freeze((Map<String, Object>) nested));
            } else if (value instanceof Collection<?> collection) {
                frozen.put(key, Collections.unmodifiableList(new ArrayList<>(collection)));
            } else {
                frozen.put(key, value);
            }
        });
        return Collections.unmodifiableMap(frozen);
    }

}
