package generator;

import config.DatasetMode;
import config.ScaleConfig;
import dao.BatchSink;
import model.EntityKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import util.RetryPolicy;

import java.time.Duration;
import java.time.Instant;

/**
 * Runs a generation strategy into a {@link BatchSink} and reports the result.
 * Configuration problems are thrown before anything is written; store failures and
 * cancellation end up in the returned report.
 */
public class DatasetGenerator {

    private static final Logger logger = LogManager.getLogger(DatasetGenerator.class);

    private final BatchSink sink;
    private final RetryPolicy retryPolicy;
    private final ProgressListener listener;

    public DatasetGenerator(BatchSink sink, RetryPolicy retryPolicy, ProgressListener listener) {
        this.sink = sink;
        this.retryPolicy = retryPolicy;
        this.listener = listener != null ? listener : ProgressListener.NONE;
    }

    public static GenerationStrategy strategyFor(ScaleConfig config) {
        return config.getMode() == DatasetMode.DETERMINISTIC ? new FixtureStrategy() : new SamplingStrategy();
    }

    /**
     * @throws config.ConfigurationException when the configuration or fixtures are invalid
     */
    public GenerationReport generate(ScaleConfig config) {
        config.validate();
        return generate(GenerationContext.create(config));
    }

    public GenerationReport generate(GenerationContext context) {
        ScaleConfig config = context.getConfig();
        GenerationStrategy strategy = strategyFor(config);
        logger.info("Starting {} generation, seed {}, identity mode {}, batch size {}{}",
                strategy.name(), context.getSeed(), context.getIdentities().getMode(),
                config.getBatchSize(), config.isPipelined() ? ", pipelined" : "");

        GenerationReport.GenerationReportBuilder report = GenerationReport.builder();
        try (BatchPipeline pipeline = new BatchPipeline(sink, strategy.writeMode(), context, retryPolicy, listener)) {
            strategy.generate(context, pipeline::add);
            pipeline.finish();
            report.status(GenerationReport.Status.SUCCESS);
        } catch (BatchFailedException e) {
            logger.error("Batch {} failed, rows {}", e.getBatchIndex(), e.getRowSample(), e);
            report.status(GenerationReport.Status.FAILED)
                    .failedBatchIndex(e.getBatchIndex())
                    .failureCause(e.getCause() != null ? e.getCause().getMessage() : e.getMessage())
                    .failedRowSample(e.getRowSample());
        } catch (GenerationCancelledException e) {
            logger.warn("Generation cancelled: {}", e.getMessage());
            report.status(GenerationReport.Status.CANCELLED).failureCause(e.getMessage());
        }

        GenerationReport result = finish(report, context);
        listener.onRunFinished(result);
        return result;
    }

    private GenerationReport finish(GenerationReport.GenerationReportBuilder report, GenerationContext context) {
        ScaleConfig config = context.getConfig();
        long durationMs = Duration.between(context.getStartedAt(), Instant.now()).toMillis();
        long messages = context.committed(EntityKind.MESSAGE);
        double messagesPerSecond = durationMs > 0 ? messages * 1000.0 / durationMs : 0.0;

        return report
                .mode(config.getMode())
                .identityMode(context.getIdentities().getMode())
                .seed(context.getSeed())
                .referenceTime(context.getReferenceTime().toString())
                .committed(context.committedCounts())
                .skipped(context.skippedCounts())
                .batches(context.batchCount())
                .durationMs(durationMs)
                .messagesPerSecond(messagesPerSecond)
                .warnings(context.getWarnings())
                .build();
    }
}
