package benchmark;

import config.AppConfig;
import config.ConfigurationException;
import lombok.Data;
import lombok.NoArgsConstructor;
import util.JsonSupport;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The probes and queries of a benchmark run, loaded from JSON.
 */
@Data
@NoArgsConstructor
public class QueryCatalogue {

    public static final String PROBE_PREFIX = "$";

    private List<ProbeDefinition> probes = new ArrayList<>();
    private List<QueryDefinition> queries = new ArrayList<>();

    public static QueryCatalogue loadDefault() {
        return load(AppConfig.DEFAULT_QUERY_CATALOGUE);
    }

    /**
     * @throws ConfigurationException when the catalogue cannot be read or is inconsistent
     */
    public static QueryCatalogue load(String location) {
        QueryCatalogue catalogue = JsonSupport.read(location, QueryCatalogue.class);
        catalogue.validate();
        return catalogue;
    }

    public void validate() {
        List<String> problems = new ArrayList<>();
        Set<String> probeNames = new HashSet<>();
        for (ProbeDefinition probe : probes) {
            if (probe.getName() == null || probe.getSql() == null) {
                problems.add("probe needs a name and sql");
            } else if (!probeNames.add(probe.getName())) {
                problems.add("duplicate probe " + probe.getName());
            }
        }

        Set<String> queryNames = new HashSet<>();
        if (queries.isEmpty()) {
            problems.add("catalogue has no queries");
        }
        for (QueryDefinition query : queries) {
            if (query.getName() == null || query.getSql() == null) {
                problems.add("query needs a name and sql");
                continue;
            }
            if (!queryNames.add(query.getName())) {
                problems.add("duplicate query " + query.getName());
            }
            if (query.getThresholdMs() <= 0) {
                problems.add(query.getName() + ": thresholdMs must be > 0");
            }
            if (query.getLimit() != null && query.getLimit() < 1) {
                problems.add(query.getName() + ": limit must be >= 1");
            }
            if (query.getOffset() != null && query.getOffset() < 0) {
                problems.add(query.getName() + ": offset must be >= 0");
            }
            if (query.getParameters() != null) {
                for (Map.Entry<String, String> param : query.getParameters().entrySet()) {
                    String value = param.getValue();
                    if (value != null && value.startsWith(PROBE_PREFIX)
                            && !probeNames.contains(value.substring(PROBE_PREFIX.length()))) {
                        problems.add(query.getName() + ": parameter " + param.getKey() + " uses unknown probe " + value);
                    }
                }
            }
        }

        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
    }
}
