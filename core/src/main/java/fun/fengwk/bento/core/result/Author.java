package fun.fengwk.bento.core.result;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.util.StringUtils;

/**
 * Author of a result item.
 *
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Author {

    private String first;

    private String last;

    private String middle;

    /**
     * Explicit display form; derived from last and first when absent.
     */
    private String display;

    public Author(String first, String last) {
        this.first = first;
        this.last = last;
    }

    /**
     * Display form, "Last, F" unless set explicitly.
     */
    public String getDisplay() {
        if (StringUtils.hasText(display)) {
            return display;
        }
        if (!StringUtils.hasText(last)) {
            return StringUtils.hasText(first) ? first.trim() : null;
        }
        StringBuilder builder = new StringBuilder(last.trim());
        if (StringUtils.hasText(first)) {
            builder.append(", ").append(first.trim().charAt(0));
        }
        return builder.toString();
    }

}
