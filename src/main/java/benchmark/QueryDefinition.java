package benchmark;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One benchmarked query of the catalogue.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryDefinition {

    private String name;
    private String category;

    /** Shape of the query, e.g. "timeline page by chat, newest first". */
    private String description;

    /** Native SQL with named parameters, without LIMIT/OFFSET. */
    private String sql;

    /** Literal values, or "$probe" to bind the result of a probe. */
    @Builder.Default
    private Map<String, String> parameters = new LinkedHashMap<>();

    private Integer limit;
    private Integer offset;
    private double thresholdMs;
}
