package generator;

import java.util.List;

/**
 * A batch that could not be committed, even after retries.
 */
public class BatchFailedException extends RuntimeException {

    private final int batchIndex;
    private final List<String> rowSample;

    public BatchFailedException(int batchIndex, List<String> rowSample, Throwable cause) {
        super("Batch " + batchIndex + " failed: " + (cause == null ? "unknown" : cause.getMessage()), cause);
        this.batchIndex = batchIndex;
        this.rowSample = List.copyOf(rowSample);
    }

    public int getBatchIndex() {
        return batchIndex;
    }

    public List<String> getRowSample() {
        return rowSample;
    }
}
