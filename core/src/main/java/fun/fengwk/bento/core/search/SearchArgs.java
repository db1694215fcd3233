package fun.fengwk.bento.core.search;

/**
 * Standard search argument keys.
 *
 * @author fengwk
 */
public final class SearchArgs {

    public static final String QUERY = "query";
    public static final String SEARCH_FIELD = "search_field";
    public static final String SEMANTIC_SEARCH_FIELD = "semantic_search_field";
    public static final String SORT = "sort";
    public static final String PAGE = "page";
    public static final String START = "start";
    public static final String PER_PAGE = "per_page";
    public static final String UNRECOGNIZED_SEARCH_FIELD = "unrecognized_search_field";

    public static final int DEFAULT_PER_PAGE = 10;

    private SearchArgs() {
    }

}
