package fun.fengwk.bento.core.result;

import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Normalized outcome of one search against one engine.
 *
 * <p>A set is failed exactly when {@link #getError()} is present, and a failed
 * set carries no items. Callers should check {@link #failed()} before treating
 * an empty set as "no results".
 *
 * @author fengwk
 */
@Data
public class ResultSet implements Iterable<Item> {

    /**
     * Items in the order returned by the source.
     */
    private List<Item> items = new ArrayList<>();

    /**
     * Total hit count reported by the source, null if unknown.
     */
    private Integer totalItems;

    private SearchError error;

    private Duration timing;

    private int start;

    private Integer perPage;

    private String engineId;

    private Map<String, Object> displayConfiguration;

    /**
     * Normalized arguments the search ran with.
     */
    private Map<String, Object> searchArgs;

    public ResultSet() {
    }

    public ResultSet(List<Item> items, Integer totalItems) {
        this.items = items == null ? new ArrayList<>() : new ArrayList<>(items);
        this.totalItems = totalItems;
    }

    public static ResultSet failed(SearchError error) {
        ResultSet results = new ResultSet();
        results.setError(error);
        return results;
    }

    public boolean failed() {
        return error != null;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public Item get(int index) {
        return items.get(index);
    }

    public void add(Item item) {
        items.add(item);
    }

    /**
     * Pagination view, null when the page size is not known yet.
     */
    public Pagination getPagination() {
        if (perPage == null || perPage < 1) {
            return null;
        }
        return new Pagination(start, perPage, totalItems == null ? 0 : totalItems);
    }

    @Override
    public Iterator<Item> iterator() {
        return items.iterator();
    }

}
