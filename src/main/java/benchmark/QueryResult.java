package benchmark;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class QueryResult {

    public enum Status {
        PASS,
        /** Average above the threshold. */
        REGRESSION,
        /** At least one trial failed. */
        ERROR
    }

    String name;
    String category;
    String description;
    double thresholdMs;
    int trials;
    int failedTrials;
    double avgMs;
    double minMs;
    double maxMs;
    int rows;
    Status status;
    String error;
}
