package fun.fengwk.bento.core.engine;

import org.springframework.util.StringUtils;

/**
 * What to do with a search field the engine does not know.
 *
 * @author fengwk
 */
public enum UnrecognizedSearchFieldPolicy {

    /**
     * Drop the field and search all fields.
     */
    IGNORE("ignore"),

    /**
     * Reject the search arguments.
     */
    RAISE("raise");

    private final String value;

    UnrecognizedSearchFieldPolicy(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Anything other than "raise" means {@link #IGNORE}.
     */
    public static UnrecognizedSearchFieldPolicy fromValue(Object value) {
        if (value instanceof UnrecognizedSearchFieldPolicy policy) {
            return policy;
        }
        if (value != null && StringUtils.hasText(value.toString())
            && RAISE.value.equalsIgnoreCase(value.toString().trim())) {
            return RAISE;
        }
        return IGNORE;
    }

}
