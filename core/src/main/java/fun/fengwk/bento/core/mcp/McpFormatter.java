package fun.fengwk.bento.core.mcp;

import fun.fengwk.bento.core.result.ResultSet;
import fun.fengwk.bento.core.service.model.EngineDescription;
import freemarker.template.Template;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.StringWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders search results as text for MCP tools.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class McpFormatter {

    static final String SEARCH_TEMPLATE = "bento_search_result.ftl";
    static final String MULTI_SEARCH_TEMPLATE = "bento_multi_search_result.ftl";
    static final String ENGINE_LIST_TEMPLATE = "bento_engine_list.ftl";

    private final freemarker.template.Configuration mcpTemplateConfiguration;

    public McpFormatter(@Qualifier("mcpTemplateConfiguration") freemarker.template.Configuration mcpTemplateConfiguration) {
        this.mcpTemplateConfiguration = mcpTemplateConfiguration;
    }

    public String formatResults(ResultSet results) {
        if (results == null) {
            return "empty response";
        }
        return render(SEARCH_TEMPLATE, Map.of("data", results));
    }

    /**
     * One section per engine, in the order of the given map.
     */
    public String formatMultiSearch(Map<String, ResultSet> results) {
        if (results == null) {
            return "empty response";
        }
        List<Map<String, Object>> sections = new ArrayList<>();
        results.forEach((engineId, resultSet) -> {
            Map<String, Object> section = new LinkedHashMap<>();
            section.put("engineId", engineId);
            section.put("results", resultSet);
            sections.add(section);
        });
        return render(MULTI_SEARCH_TEMPLATE, Map.of("sections", sections));
    }

    public String formatEngines(List<EngineDescription> engines) {
        return render(ENGINE_LIST_TEMPLATE, Map.of("engines", engines == null ? List.of() : engines));
    }

    String render(String templateName, Map<String, ?> model) {
        StringWriter result = new StringWriter(1024);
        try {
            Template template = mcpTemplateConfiguration.getTemplate(templateName);
            template.process(model, result);
            return result.toString();
        } catch (Exception ex) {
            log.warn("failed to render template, template={}, error={}", templateName, ex.getMessage(), ex);
            return "format error: " + ex.getMessage();
        }
    }

}
