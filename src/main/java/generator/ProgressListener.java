package generator;

import dao.Batch;
import dao.BatchOutcome;

/**
 * Callbacks of a generation run. Called on the thread that committed the batch.
 */
public interface ProgressListener {

    ProgressListener NONE = new ProgressListener() {
    };

    default void onBatchCommitted(Batch batch, BatchOutcome outcome, GenerationContext context) {
    }

    default void onRunFinished(GenerationReport report) {
    }
}
