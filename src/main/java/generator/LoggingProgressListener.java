package generator;

import dao.Batch;
import dao.BatchOutcome;
import model.EntityKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class LoggingProgressListener implements ProgressListener {

    private static final Logger logger = LogManager.getLogger(LoggingProgressListener.class);

    @Override
    public void onBatchCommitted(Batch batch, BatchOutcome outcome, GenerationContext context) {
        logger.info("Batch {} committed ({} rows, {} skipped) - users={} chats={} memberships={} messages={}",
                batch.getIndex(), outcome.insertedTotal(), outcome.skippedTotal(),
                context.committed(EntityKind.USER), context.committed(EntityKind.CHAT),
                context.committed(EntityKind.MEMBERSHIP), context.committed(EntityKind.MESSAGE));
    }

    @Override
    public void onRunFinished(GenerationReport report) {
        if (report.getStatus() == GenerationReport.Status.SUCCESS) {
            logger.info("Generation finished in {} ms, {} batches", report.getDurationMs(), report.getBatches());
        } else {
            logger.error("Generation {}: {}", report.getStatus(), report.getFailureCause());
        }
    }
}
