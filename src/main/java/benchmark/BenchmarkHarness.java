package benchmark;

import config.AppConfig;
import config.ConfigurationException;
import dao.StoreException;
import model.EntityKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import util.RetryExhaustedException;
import util.RetryPolicy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Times every catalogue query: warm-up trials are discarded, then each timed trial is one round trip.
 * Failed trials (timeouts, SQL errors) are counted; a store that stays unreachable aborts the run.
 */
public class BenchmarkHarness {

    private static final Logger logger = LogManager.getLogger(BenchmarkHarness.class);

    /** Bound when a probe finds nothing; matches no row. */
    public static final String PLACEHOLDER_ID = "00000000-0000-0000-0000-000000000000";

    private final QueryRunner runner;
    private final RetryPolicy retryPolicy;
    private final int trials;
    private final int warmupTrials;

    public BenchmarkHarness(QueryRunner runner, RetryPolicy retryPolicy) {
        this(runner, retryPolicy, AppConfig.BENCHMARK_TRIALS, AppConfig.BENCHMARK_WARMUP_TRIALS);
    }

    public BenchmarkHarness(QueryRunner runner, RetryPolicy retryPolicy, int trials, int warmupTrials) {
        validateTrials(trials, warmupTrials);
        this.runner = runner;
        // only connectivity is worth retrying, a slow query is a result
        this.retryPolicy = retryPolicy.toBuilder().retryOn(BenchmarkHarness::isConnectivityFailure).build();
        this.trials = trials;
        this.warmupTrials = warmupTrials;
    }

    /**
     * @throws ConfigurationException unless there is at least one timed trial and no negative warm-up count
     */
    public static void validateTrials(int trials, int warmupTrials) {
        List<String> problems = new ArrayList<>();
        if (trials < 1) problems.add("trials must be >= 1, was " + trials);
        if (warmupTrials < 0) problems.add("warmupTrials must be >= 0, was " + warmupTrials);
        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
    }

    public BenchmarkReport run(QueryCatalogue catalogue) {
        long start = System.currentTimeMillis();
        BenchmarkReport.BenchmarkReportBuilder report = BenchmarkReport.builder();
        List<QueryResult> results = new ArrayList<>();
        boolean aborted = false;

        try {
            Map<EntityKind, Long> counts = retryPolicy.execute("dataset counts", runner::datasetCounts);
            report.datasetCounts(counts);
            long messages = counts.getOrDefault(EntityKind.MESSAGE, 0L);
            if (messages < AppConfig.MINIMUM_MESSAGE_COUNT_WARNING) {
                report.warning("Only " + messages + " messages; run a scale population for meaningful timings");
            }

            Map<String, String> probeValues = resolveProbes(catalogue);
            report.probeValues(probeValues);

            List<QueryDefinition> queries = catalogue.getQueries();
            for (int i = 0; i < queries.size(); i++) {
                results.add(benchmark(i, queries.get(i), probeValues));
            }
        } catch (BenchmarkAbortedException e) {
            logger.error("Benchmark aborted at query {}: {}", e.getQueryIndex(), e.getMessage());
            aborted = true;
            report.aborted(true).abortedAtQuery(e.getQueryIndex()).abortCause(e.getMessage());
        } catch (RetryExhaustedException e) {
            logger.error("Benchmark aborted before the first query: {}", e.getMessage());
            aborted = true;
            report.aborted(true).abortedAtQuery(-1).abortCause(e.getMessage());
        }

        BenchmarkReport result = report
                .results(results)
                .status(BenchmarkReport.statusOf(results, aborted))
                .durationMs(System.currentTimeMillis() - start)
                .build();
        logger.info("Benchmark {} ({} queries)", result.getStatus(), results.size());
        return result;
    }

    private Map<String, String> resolveProbes(QueryCatalogue catalogue) {
        Map<String, String> values = new LinkedHashMap<>();
        for (ProbeDefinition probe : catalogue.getProbes()) {
            String value = retryPolicy.execute("probe " + probe.getName(), () -> runner.probe(probe.getSql()));
            if (value == null) {
                logger.warn("Probe {} found nothing, binding placeholder id", probe.getName());
                value = PLACEHOLDER_ID;
            }
            values.put(probe.getName(), value);
        }
        return values;
    }

    private QueryResult benchmark(int index, QueryDefinition query, Map<String, String> probeValues) {
        Map<String, Object> parameters = bind(query, probeValues);

        for (int i = 0; i < warmupTrials; i++) {
            trial(index, query, parameters);
        }

        List<Double> times = new ArrayList<>();
        int failed = 0;
        int rows = 0;
        String error = null;
        for (int i = 0; i < trials; i++) {
            Trial trial = trial(index, query, parameters);
            if (trial.error != null) {
                failed++;
                error = trial.error;
            } else {
                times.add(trial.millis);
                rows = trial.rows;
            }
        }

        double avg = times.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double min = times.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
        double max = times.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);

        QueryResult.Status status;
        if (failed > 0) {
            status = QueryResult.Status.ERROR;
        } else if (avg > query.getThresholdMs()) {
            status = QueryResult.Status.REGRESSION;
        } else {
            status = QueryResult.Status.PASS;
        }

        logger.info("{}: avg {} ms (min {}, max {}), {} rows, {}",
                query.getName(), String.format("%.2f", avg), String.format("%.2f", min), String.format("%.2f", max),
                rows, status);

        return QueryResult.builder()
                .name(query.getName())
                .category(query.getCategory())
                .description(query.getDescription())
                .thresholdMs(query.getThresholdMs())
                .trials(trials)
                .failedTrials(failed)
                .avgMs(avg)
                .minMs(min)
                .maxMs(max)
                .rows(rows)
                .status(status)
                .error(error)
                .build();
    }

    private static final class Trial {
        final double millis;
        final int rows;
        final String error;

        Trial(double millis, int rows, String error) {
            this.millis = millis;
            this.rows = rows;
            this.error = error;
        }
    }

    private Trial trial(int index, QueryDefinition query, Map<String, Object> parameters) {
        try {
            return retryPolicy.execute("query " + query.getName(), () -> {
                long start = System.nanoTime();
                int rows = runner.execute(query, parameters);
                return new Trial((System.nanoTime() - start) / 1_000_000.0, rows, null);
            });
        } catch (RetryExhaustedException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (isConnectivityFailure(cause)) {
                throw new BenchmarkAbortedException(index, "query " + query.getName() + ": " + cause.getMessage(), cause);
            }
            return new Trial(0, 0, cause.getMessage());
        }
    }

    static Map<String, Object> bind(QueryDefinition query, Map<String, String> probeValues) {
        Map<String, Object> bound = new LinkedHashMap<>();
        if (query.getParameters() == null) {
            return bound;
        }
        query.getParameters().forEach((name, value) -> {
            if (value != null && value.startsWith(QueryCatalogue.PROBE_PREFIX)) {
                bound.put(name, probeValues.getOrDefault(value.substring(QueryCatalogue.PROBE_PREFIX.length()), PLACEHOLDER_ID));
            } else {
                bound.put(name, value);
            }
        });
        return bound;
    }

    static boolean isConnectivityFailure(Throwable e) {
        return e instanceof StoreException && ((StoreException) e).getKind() == StoreException.Kind.CONNECTIVITY;
    }
}
