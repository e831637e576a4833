package dao;

import jakarta.persistence.EntityExistsException;
import jakarta.persistence.LockTimeoutException;
import jakarta.persistence.QueryTimeoutException;
import org.hibernate.NonUniqueObjectException;
import org.hibernate.TransactionException;
import org.hibernate.exception.ConstraintViolationException;
import org.hibernate.exception.JDBCConnectionException;
import org.hibernate.exception.LockAcquisitionException;

import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.util.List;

/**
 * A failed store round trip, classified so callers can decide whether to retry.
 */
public class StoreException extends RuntimeException {

    public enum Kind {
        CONSTRAINT_VIOLATION,
        CONNECTIVITY,
        TIMEOUT,
        OTHER
    }

    private final Kind kind;
    private final List<String> offendingRows;

    public StoreException(Kind kind, String message) {
        this(kind, message, null, List.of());
    }

    public StoreException(Kind kind, String message, Throwable cause) {
        this(kind, message, cause, List.of());
    }

    public StoreException(Kind kind, String message, Throwable cause, List<String> offendingRows) {
        super(message, cause);
        this.kind = kind;
        this.offendingRows = List.copyOf(offendingRows);
    }

    public Kind getKind() {
        return kind;
    }

    /** Rows ("kind/id") that broke a constraint, when the store could tell. */
    public List<String> getOffendingRows() {
        return offendingRows;
    }

    public StoreException withOffendingRows(List<String> rows) {
        StoreException copy = new StoreException(kind, getMessage(), getCause(), rows);
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    public boolean isRetryable() {
        return kind != Kind.OTHER;
    }

    /** True for a {@link StoreException} of a retryable kind. */
    public static boolean isRetryableFailure(Throwable e) {
        return e instanceof StoreException && ((StoreException) e).isRetryable();
    }

    /**
     * Maps a Hibernate / JPA / JDBC failure onto a {@link Kind}, looking through the cause chain.
     */
    public static StoreException translate(String operation, Throwable e) {
        if (e instanceof StoreException) {
            return (StoreException) e;
        }
        Kind kind = classify(e);
        return new StoreException(kind, operation + " failed (" + kind + "): " + rootMessage(e), e);
    }

    static Kind classify(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof ConstraintViolationException
                    || t instanceof SQLIntegrityConstraintViolationException
                    || t instanceof EntityExistsException
                    || t instanceof NonUniqueObjectException) {
                return Kind.CONSTRAINT_VIOLATION;
            }
            if (t instanceof JDBCConnectionException
                    || t instanceof SQLTransientConnectionException
                    || t instanceof SQLNonTransientConnectionException) {
                return Kind.CONNECTIVITY;
            }
            if (t instanceof QueryTimeoutException
                    || t instanceof org.hibernate.QueryTimeoutException
                    || t instanceof LockTimeoutException
                    || t instanceof LockAcquisitionException
                    || t instanceof SQLTimeoutException) {
                return Kind.TIMEOUT;
            }
            if (t instanceof TransactionException && t.getMessage() != null
                    && t.getMessage().toLowerCase().contains("timeout")) {
                return Kind.TIMEOUT;
            }
            if (t.getCause() == t) break;
        }
        return Kind.OTHER;
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
