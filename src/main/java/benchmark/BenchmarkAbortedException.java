package benchmark;

/**
 * The store stayed unreachable, the remaining queries were not run.
 */
public class BenchmarkAbortedException extends RuntimeException {

    private final int queryIndex;

    public BenchmarkAbortedException(int queryIndex, String message, Throwable cause) {
        super(message, cause);
        this.queryIndex = queryIndex;
    }

    /** Index of the query that was running, -1 before the first query. */
    public int getQueryIndex() {
        return queryIndex;
    }
}
