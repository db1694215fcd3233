package fun.fengwk.bento.core.engine.mock;

import fun.fengwk.bento.core.engine.EngineFactory;
import fun.fengwk.bento.core.engine.SearchEngine;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * @author fengwk
 */
@Component
public class MockEngineFactory implements EngineFactory {

    @Override
    public String type() {
        return MockEngine.TYPE;
    }

    @Override
    public SearchEngine create(Map<String, ?> configuration) {
        return new MockEngine(configuration);
    }

}
