package fun.fengwk.bento.core.mcp;

import fun.fengwk.bento.core.engine.EngineNotFoundException;
import fun.fengwk.bento.core.result.ResultSet;
import fun.fengwk.bento.core.search.SearchArgs;
import fun.fengwk.bento.core.service.BentoSearchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BentoMcp {

    private final BentoSearchService bentoSearchService;
    private final McpFormatter mcpFormatter;

    @Tool(name = "search",
        description = """
            Search one configured bibliographic engine and return normalized results.
            Return format: numbered items with title, authors, format, year and link, \
            followed by paging info; or 'No results.'; or an error description.""",
        resultConverter = TextToolCallResultConverter.class)
    public String search(
        @ToolParam(description = "engine id, see list_engines") String engineId,
        @ToolParam(description = "query keywords") String query,
        @ToolParam(description = "engine specific search field, default all fields", required = false) String searchField,
        @ToolParam(description = "cross-engine field: title/author/subject/isbn/issn", required = false) String semanticSearchField,
        @ToolParam(description = "sort key supported by the engine", required = false) String sort,
        @ToolParam(description = "page number, starting from 1, default 1", required = false) Integer page,
        @ToolParam(description = "results per page, default 10", required = false) Integer perPage
    ) {
        Map<String, Object> args = buildArgs(query, searchField, semanticSearchField, sort, page, perPage);
        try {
            ResultSet results = bentoSearchService.search(engineId, args);
            return mcpFormatter.formatResults(results);
        } catch (EngineNotFoundException ex) {
            log.warn("search on unknown engine, engineId={}", engineId);
            return "Error: " + ex.getMessage();
        }
    }

    @Tool(name = "multi_search",
        description = """
            Search several engines concurrently with the same query.
            Return format: one section per engine with its results or its error.""",
        resultConverter = TextToolCallResultConverter.class)
    public String multiSearch(
        @ToolParam(description = "engine ids, default the configured default engines", required = false) List<String> engineIds,
        @ToolParam(description = "query keywords") String query,
        @ToolParam(description = "cross-engine field: title/author/subject/isbn/issn", required = false) String semanticSearchField,
        @ToolParam(description = "sort key", required = false) String sort,
        @ToolParam(description = "results per engine, default 10", required = false) Integer perPage
    ) {
        Map<String, Object> args = buildArgs(query, null, semanticSearchField, sort, null, perPage);
        try {
            Map<String, ResultSet> results = bentoSearchService.multiSearch(engineIds, args);
            return mcpFormatter.formatMultiSearch(results);
        } catch (EngineNotFoundException ex) {
            log.warn("multi search on unknown engine, engineIds={}", engineIds);
            return "Error: " + ex.getMessage();
        }
    }

    @Tool(name = "list_engines",
        description = """
            List configured search engines with their search fields, semantic fields, sort keys and max page size.
            No parameters.""",
        resultConverter = TextToolCallResultConverter.class)
    public String listEngines() {
        return mcpFormatter.formatEngines(bentoSearchService.listEngines());
    }

    private static Map<String, Object> buildArgs(String query, String searchField, String semanticSearchField,
                                                 String sort, Integer page, Integer perPage) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put(SearchArgs.QUERY, query);
        putIfNotNull(args, SearchArgs.SEARCH_FIELD, searchField);
        putIfNotNull(args, SearchArgs.SEMANTIC_SEARCH_FIELD, semanticSearchField);
        putIfNotNull(args, SearchArgs.SORT, sort);
        putIfNotNull(args, SearchArgs.PAGE, page);
        putIfNotNull(args, SearchArgs.PER_PAGE, perPage);
        return args;
    }

    private static void putIfNotNull(Map<String, Object> args, String key, Object value) {
        if (value != null) {
            args.put(key, value);
        }
    }

}
