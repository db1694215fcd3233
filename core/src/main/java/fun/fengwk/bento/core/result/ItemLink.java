package fun.fengwk.bento.core.result;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Additional link of a result item, e.g. full text or a catalog record.
 *
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ItemLink {

    private String label;

    private String url;

    /**
     * Link relation, e.g. "alternate".
     */
    private String rel;

}
