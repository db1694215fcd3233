package fun.fengwk.bento.core.service;

import fun.fengwk.bento.core.result.ResultSet;
import fun.fengwk.bento.core.service.model.EngineDescription;

import java.util.List;
import java.util.Map;

/**
 * Search entry point for untrusted callers. Arguments are reduced to the public
 * whitelist before they reach an engine.
 *
 * @author fengwk
 */
public interface BentoSearchService {

    /**
     * @throws fun.fengwk.bento.core.engine.EngineNotFoundException if the engine is not registered
     */
    ResultSet search(String engineId, Map<String, ?> args);

    /**
     * Searches several engines concurrently; no ids means the default engines.
     *
     * @throws fun.fengwk.bento.core.engine.EngineNotFoundException if an engine is not registered
     */
    Map<String, ResultSet> multiSearch(List<String> engineIds, Map<String, ?> args);

    List<EngineDescription> listEngines();

}
