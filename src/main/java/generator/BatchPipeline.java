package generator;

import dao.Batch;
import dao.BatchOutcome;
import dao.BatchSink;
import dao.StoreException;
import dao.WriteMode;
import model.Identified;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import util.RetryExhaustedException;
import util.RetryPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Buffers emitted entities and commits them in batches of the configured size, in emission order.
 * <p>
 * In pipelined mode a single worker commits while the next batch is being buffered; at most one
 * batch is in flight. Cancellation is honoured between batches only.
 */
public class BatchPipeline implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(BatchPipeline.class);

    static final int ROW_SAMPLE_SIZE = 5;
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

    private final BatchSink sink;
    private final WriteMode writeMode;
    private final GenerationContext context;
    private final RetryPolicy retryPolicy;
    private final ProgressListener listener;
    private final int batchSize;
    private final ExecutorService worker;

    private List<Identified> buffer = new ArrayList<>();
    private Future<?> inFlight;

    public BatchPipeline(BatchSink sink, WriteMode writeMode, GenerationContext context,
                         RetryPolicy retryPolicy, ProgressListener listener) {
        this.sink = sink;
        this.writeMode = writeMode;
        this.context = context;
        this.retryPolicy = retryPolicy;
        this.listener = listener;
        this.batchSize = context.getConfig().getBatchSize();
        this.worker = context.getConfig().isPipelined()
                ? Executors.newSingleThreadExecutor(r -> {
                    Thread t = new Thread(r, "batch-writer");
                    t.setDaemon(true);
                    return t;
                })
                : null;
    }

    public void add(Identified entity) {
        buffer.add(entity);
        if (buffer.size() >= batchSize) {
            flush();
        }
    }

    /** Commits whatever is buffered and waits for the last batch in flight. */
    public void finish() {
        if (!buffer.isEmpty()) {
            flush();
        }
        awaitInFlight();
    }

    private void flush() {
        awaitInFlight();
        if (context.isCancelled()) {
            throw new GenerationCancelledException("Cancelled after " + context.batchCount() + " committed batches");
        }

        Batch batch = new Batch(context.nextBatchIndex(), buffer);
        buffer = new ArrayList<>(batchSize);

        if (worker == null) {
            commit(batch);
        } else {
            inFlight = worker.submit(() -> commit(batch));
        }
    }

    private void commit(Batch batch) {
        BatchOutcome outcome;
        try {
            outcome = retryPolicy.execute("batch " + batch.getIndex(), () -> sink.write(batch, writeMode));
        } catch (RetryExhaustedException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new BatchFailedException(batch.getIndex(), failedRows(batch, cause), cause);
        }
        context.recordOutcome(outcome);
        listener.onBatchCommitted(batch, outcome, context);
    }

    /** The rows the store named as violators, else the first rows of the batch. */
    static List<String> failedRows(Batch batch, Throwable cause) {
        if (cause instanceof StoreException) {
            List<String> offending = ((StoreException) cause).getOffendingRows();
            if (!offending.isEmpty()) {
                return offending.size() > ROW_SAMPLE_SIZE ? offending.subList(0, ROW_SAMPLE_SIZE) : offending;
            }
        }
        return batch.sampleIds(ROW_SAMPLE_SIZE);
    }

    private void awaitInFlight() {
        if (inFlight == null) {
            return;
        }
        try {
            inFlight.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            context.cancel();
            throw new GenerationCancelledException("Interrupted while a batch was in flight");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Batch writer failed", cause);
        } finally {
            inFlight = null;
        }
    }

    @Override
    public void close() {
        if (worker == null) {
            return;
        }
        worker.shutdown();
        try {
            // let an in-flight batch finish, it is committed whole or not at all
            if (!worker.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Batch writer did not stop in time, forcing shutdown");
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
