package benchmark;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Scalar query whose first value parameterizes the benchmark queries, e.g. the busiest chat.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProbeDefinition {
    private String name;
    private String sql;
}
