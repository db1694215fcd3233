package fun.fengwk.bento.core.result;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single normalized result item.
 *
 * <p>Engines fill the bibliographic fields. {@code engineId}, {@code decorator}
 * and {@code displayConfiguration} are stamped by the search executor and
 * anything an engine puts there is overwritten.
 *
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Item {

    private String title;

    private String subtitle;

    /**
     * Main link to the item.
     */
    private String link;

    private ItemFormat format;

    /**
     * Engine specific format label, shown in place of {@link #format} when set.
     */
    private String formatStr;

    @Builder.Default
    private List<Author> authors = new ArrayList<>();

    private Integer year;

    private String volume;

    private String issue;

    private String startPage;

    private String endPage;

    private String journalTitle;

    /**
     * Container title for non-journal sources, e.g. the book of a chapter.
     */
    private String sourceTitle;

    private String issn;

    private String doi;

    private String isbn;

    private String oclcnum;

    private String publisher;

    private String abstractText;

    private String languageCode;

    @Builder.Default
    private List<ItemLink> otherLinks = new ArrayList<>();

    /**
     * Engine specific values, not interpreted here.
     */
    @Builder.Default
    private Map<String, Object> customData = new LinkedHashMap<>();

    private String engineId;

    private String decorator;

    private Map<String, Object> displayConfiguration;

    /**
     * Title and subtitle joined with a colon.
     */
    public String getCompleteTitle() {
        if (!StringUtils.hasText(subtitle)) {
            return title;
        }
        if (!StringUtils.hasText(title)) {
            return subtitle;
        }
        return title + ": " + subtitle;
    }

    /**
     * Format label for display.
     */
    public String getDisplayFormat() {
        if (StringUtils.hasText(formatStr)) {
            return formatStr;
        }
        return format == null ? null : format.getLabel();
    }

}
