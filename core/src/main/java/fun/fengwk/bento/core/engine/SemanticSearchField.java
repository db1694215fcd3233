package fun.fengwk.bento.core.engine;

import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * Cross-engine field names that engines map to their own search field keys.
 *
 * @author fengwk
 */
public enum SemanticSearchField {

    TITLE("title"),
    AUTHOR("author"),
    SUBJECT("subject"),
    ISBN("isbn"),
    ISSN("issn"),
    OCLCNUM("oclcnum"),
    YEAR("year"),
    PUBLISHER("publisher");

    private final String key;

    SemanticSearchField(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * Returns null for blank or non-standard names.
     */
    public static SemanticSearchField fromKey(String key) {
        if (!StringUtils.hasText(key)) {
            return null;
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (SemanticSearchField field : values()) {
            if (field.key.equals(normalized)) {
                return field;
            }
        }
        return null;
    }

}
