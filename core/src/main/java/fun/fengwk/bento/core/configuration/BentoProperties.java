package fun.fengwk.bento.core.configuration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Engine registry configuration.
 *
 * <pre>
 * bento:
 *   default-engines: [articles, books]
 *   engines:
 *     articles:
 *       engine: mock
 *       for_display:
 *         decorator: article
 * </pre>
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "bento")
public class BentoProperties {

    /**
     * Engine id to engine configuration; every entry needs an {@code engine} type.
     */
    private Map<String, Map<String, Object>> engines = new LinkedHashMap<>();

    /**
     * Engines used by multi search when the caller names none (empty means all).
     */
    private List<String> defaultEngines = new ArrayList<>();

}
