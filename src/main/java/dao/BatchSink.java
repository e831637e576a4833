package dao;

/**
 * Destination of generated batches. A batch is committed whole or not at all.
 */
public interface BatchSink {

    /**
     * @throws StoreException when the batch could not be committed; nothing of it is left behind
     */
    BatchOutcome write(Batch batch, WriteMode mode);
}
