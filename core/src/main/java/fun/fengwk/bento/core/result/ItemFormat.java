package fun.fengwk.bento.core.result;

import org.springframework.util.StringUtils;

/**
 * Normalized formats of result items. Engines with formats not listed here
 * use {@link #OTHER} and put their own label in {@link Item#getFormatStr()}.
 *
 * @author fengwk
 */
public enum ItemFormat {

    ARTICLE("Article"),
    BOOK("Book"),
    BOOK_CHAPTER("Book Chapter"),
    CONFERENCE_PAPER("Conference Paper"),
    DISSERTATION("Dissertation"),
    JOURNAL("Journal"),
    SERIAL("Serial"),
    REPORT("Report"),
    VIDEO("Video"),
    AUDIO_RECORDING("Audio Recording"),
    WEB_PAGE("Web Page"),
    OTHER("Other");

    private final String label;

    ItemFormat(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static ItemFormat fromValue(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        String normalized = value.trim();
        for (ItemFormat format : values()) {
            if (format.name().equalsIgnoreCase(normalized) || format.label.equalsIgnoreCase(normalized)) {
                return format;
            }
        }
        return OTHER;
    }

}
