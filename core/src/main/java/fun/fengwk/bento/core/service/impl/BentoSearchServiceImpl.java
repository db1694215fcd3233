package fun.fengwk.bento.core.service.impl;

import fun.fengwk.bento.core.configuration.BentoProperties;
import fun.fengwk.bento.core.engine.EngineCapabilities;
import fun.fengwk.bento.core.engine.EngineRegistry;
import fun.fengwk.bento.core.engine.SearchEngine;
import fun.fengwk.bento.core.multi.MultiSearcher;
import fun.fengwk.bento.core.result.ResultSet;
import fun.fengwk.bento.core.search.PublicSearchArgs;
import fun.fengwk.bento.core.service.BentoSearchService;
import fun.fengwk.bento.core.service.model.EngineDescription;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BentoSearchServiceImpl implements BentoSearchService {

    private final EngineRegistry engineRegistry;
    private final BentoProperties bentoProperties;

    @Override
    public ResultSet search(String engineId, Map<String, ?> args) {
        SearchEngine engine = engineRegistry.get(engineId);
        return engine.search(PublicSearchArgs.filter(args, engine));
    }

    @Override
    public Map<String, ResultSet> multiSearch(List<String> engineIds, Map<String, ?> args) {
        List<String> ids = resolveEngineIds(engineIds);
        List<SearchEngine> engines = engineRegistry.getAll(ids);
        log.debug("multi search, engines={}", ids);
        return MultiSearcher.runAll(engines, PublicSearchArgs.filter(args), null);
    }

    @Override
    public List<EngineDescription> listEngines() {
        List<EngineDescription> descriptions = new ArrayList<>();
        for (String id : engineRegistry.ids()) {
            SearchEngine engine = engineRegistry.get(id);
            EngineCapabilities capabilities = engine.capabilities();
            descriptions.add(EngineDescription.builder()
                .id(id)
                .engine(engine.configuration().getEngine())
                .maxPerPage(capabilities.getMaxPerPage())
                .searchFields(List.copyOf(capabilities.searchKeys()))
                .semanticSearchFields(List.copyOf(capabilities.semanticSearchKeys()))
                .sortKeys(capabilities.sortKeys())
                .build());
        }
        return descriptions;
    }

    private List<String> resolveEngineIds(List<String> engineIds) {
        if (engineIds != null && !engineIds.isEmpty()) {
            return engineIds;
        }
        if (bentoProperties.getDefaultEngines() != null && !bentoProperties.getDefaultEngines().isEmpty()) {
            return bentoProperties.getDefaultEngines();
        }
        return engineRegistry.ids();
    }

}
