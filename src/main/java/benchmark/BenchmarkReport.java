package benchmark;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import model.EntityKind;
import util.JsonSupport;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class BenchmarkReport {

    public enum Status {
        SUCCESS,
        /** Every query ran, some above their threshold. */
        SUCCESS_WITH_WARNINGS,
        FAILURE
    }

    Status status;
    Map<EntityKind, Long> datasetCounts;
    Map<String, String> probeValues;

    @Singular
    List<QueryResult> results;

    @Singular
    List<String> warnings;

    boolean aborted;
    Integer abortedAtQuery;
    String abortCause;
    long durationMs;

    static Status statusOf(List<QueryResult> results, boolean aborted) {
        if (aborted || results.stream().anyMatch(r -> r.getStatus() == QueryResult.Status.ERROR)) {
            return Status.FAILURE;
        }
        if (results.stream().anyMatch(r -> r.getStatus() == QueryResult.Status.REGRESSION)) {
            return Status.SUCCESS_WITH_WARNINGS;
        }
        return Status.SUCCESS;
    }

    public String toJson() {
        return JsonSupport.toJson(this);
    }

    public String toText() {
        StringBuilder sb = new StringBuilder("Benchmark ").append(status).append('\n');
        if (datasetCounts != null) {
            sb.append("  Dataset:");
            for (EntityKind kind : EntityKind.values()) {
                sb.append(String.format(" %s=%,d", kind.label(), datasetCounts.getOrDefault(kind, 0L)));
            }
            sb.append('\n');
        }
        for (String warning : warnings) {
            sb.append("  WARNING: ").append(warning).append('\n');
        }
        sb.append(String.format("  %-34s %9s %9s %9s %9s %6s  %s%n",
                "query", "avg ms", "min ms", "max ms", "limit ms", "rows", "status"));
        for (QueryResult r : results) {
            sb.append(String.format("  %-34s %9.2f %9.2f %9.2f %9.1f %6d  %s%n",
                    r.getName(), r.getAvgMs(), r.getMinMs(), r.getMaxMs(), r.getThresholdMs(), r.getRows(), r.getStatus()));
            if (r.getError() != null) {
                sb.append("      ").append(r.getFailedTrials()).append(" failed trial(s): ").append(r.getError()).append('\n');
            }
        }
        if (aborted) {
            sb.append("  ABORTED at query ").append(abortedAtQuery).append(": ").append(abortCause).append('\n');
        }
        return sb.toString();
    }
}
