package fun.fengwk.bento.core.result;

import lombok.Getter;
import lombok.ToString;

/**
 * Pagination view derived from start, per page and total items.
 *
 * @author fengwk
 */
@Getter
@ToString
public class Pagination {

    private final int currentPage;
    private final int perPage;
    private final int totalItems;
    private final int totalPages;

    /**
     * 1-based index of the first record on this page, 0 when there are none.
     */
    private final int startRecord;

    /**
     * 1-based index of the last record on this page, 0 when there are none.
     */
    private final int endRecord;

    public Pagination(int start, int perPage, int totalItems) {
        if (perPage < 1) {
            throw new IllegalArgumentException("perPage must be positive: " + perPage);
        }
        int safeStart = Math.max(0, start);
        this.perPage = perPage;
        this.totalItems = Math.max(0, totalItems);
        this.currentPage = safeStart / perPage + 1;
        this.totalPages = (this.totalItems + perPage - 1) / perPage;
        if (safeStart >= this.totalItems) {
            this.startRecord = 0;
            this.endRecord = 0;
        } else {
            this.startRecord = safeStart + 1;
            this.endRecord = Math.min(safeStart + perPage, this.totalItems);
        }
    }

    public boolean isFirstPage() {
        return currentPage == 1;
    }

    public boolean isLastPage() {
        return currentPage >= totalPages;
    }

}
