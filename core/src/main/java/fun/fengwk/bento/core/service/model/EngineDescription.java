package fun.fengwk.bento.core.service.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Registered engine and what it supports.
 *
 * @author fengwk
 */
@Data
@Builder
public class EngineDescription {

    private String id;

    /**
     * Engine type name.
     */
    private String engine;

    private Integer maxPerPage;

    private List<String> searchFields;

    private List<String> semanticSearchFields;

    private List<String> sortKeys;

}
