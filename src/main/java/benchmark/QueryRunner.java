package benchmark;

import model.EntityKind;

import java.util.Map;

/**
 * Store access of the benchmark harness. Failures are reported as {@link dao.StoreException}.
 */
public interface QueryRunner {

    Map<EntityKind, Long> datasetCounts();

    /** First value of the first row, or null when the probe finds nothing. */
    String probe(String sql);

    /**
     * Runs {@code query} once with the store timeout.
     *
     * @return number of rows returned
     */
    int execute(QueryDefinition query, Map<String, Object> parameters);
}
