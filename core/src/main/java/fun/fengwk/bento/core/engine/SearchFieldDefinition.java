package fun.fengwk.bento.core.engine;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Engine specific search field.
 *
 * @author fengwk
 */
@Getter
@Builder
@ToString
public class SearchFieldDefinition {

    /**
     * Key passed to the engine as {@code search_field}.
     */
    private final String key;

    /**
     * Semantic field served by this key, null if none.
     */
    private final SemanticSearchField semantic;

    /**
     * Optional label for building search forms.
     */
    private final String label;

    public static SearchFieldDefinition of(String key) {
        return SearchFieldDefinition.builder().key(key).build();
    }

    public static SearchFieldDefinition of(String key, SemanticSearchField semantic) {
        return SearchFieldDefinition.builder().key(key).semantic(semantic).build();
    }

}
