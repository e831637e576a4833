package dao;

import config.StoreSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hibernate.Session;
import org.hibernate.SessionFactory;
import org.hibernate.Transaction;
import org.hibernate.query.NativeQuery;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Session and transaction handling shared by the store DAOs.
 * Every failure leaves as a {@link StoreException}, after the transaction is rolled back.
 */
public abstract class BaseDao {

    private static final Logger logger = LogManager.getLogger(BaseDao.class);

    protected final SessionFactory sessionFactory;
    protected final int timeoutSeconds;
    protected final int pageSize;

    protected BaseDao(SessionFactory sessionFactory, StoreSettings settings) {
        this(sessionFactory, settings.getTimeoutSeconds(), settings.getPageSize());
    }

    protected BaseDao(SessionFactory sessionFactory, int timeoutSeconds, int pageSize) {
        this.sessionFactory = sessionFactory;
        this.timeoutSeconds = timeoutSeconds;
        this.pageSize = pageSize;
    }

    // Thực thi với transaction, commit khi thành công
    protected <R> R executeTransaction(String operation, Function<Session, R> action) {
        try (Session session = sessionFactory.openSession()) {
            Transaction tx = session.getTransaction();
            try {
                tx.setTimeout(timeoutSeconds);
                tx.begin();
                R result = action.apply(session);
                tx.commit();
                return result;
            } catch (RuntimeException e) {
                rollback(tx, operation, e);
                throw e;
            }
        } catch (RuntimeException e) {
            throw StoreException.translate(operation, e);
        }
    }

    // Transaction luôn rollback, dùng để thử ràng buộc
    protected <R> R executeRolledBack(String operation, Function<Session, R> action) {
        try (Session session = sessionFactory.openSession()) {
            Transaction tx = session.getTransaction();
            try {
                tx.setTimeout(timeoutSeconds);
                tx.begin();
                return action.apply(session);
            } finally {
                rollback(tx, operation, null);
            }
        } catch (RuntimeException e) {
            throw StoreException.translate(operation, e);
        }
    }

    // Chỉ đọc
    protected <R> R executeRead(String operation, Function<Session, R> action) {
        try (Session session = sessionFactory.openSession()) {
            session.setDefaultReadOnly(true);
            return action.apply(session);
        } catch (RuntimeException e) {
            throw StoreException.translate(operation, e);
        }
    }

    protected NativeQuery<?> nativeQuery(Session session, String sql, Map<String, ?> params) {
        NativeQuery<?> query = session.createNativeQuery(sql);
        query.setTimeout(timeoutSeconds);
        if (params != null) {
            for (Map.Entry<String, ?> param : params.entrySet()) {
                query.setParameter(param.getKey(), param.getValue());
            }
        }
        return query;
    }

    protected List<Object[]> rows(NativeQuery<?> query) {
        List<?> raw = query.getResultList();
        List<Object[]> rows = new ArrayList<>(raw.size());
        for (Object row : raw) {
            rows.add(row instanceof Object[] ? (Object[]) row : new Object[]{row});
        }
        return rows;
    }

    protected long scalarLong(Session session, String sql, Map<String, ?> params) {
        List<Object[]> result = rows(nativeQuery(session, sql, params));
        return result.isEmpty() ? 0L : toLong(result.get(0)[0]);
    }

    /**
     * Streams the rows of {@code sql} page by page. The statement must have a stable ORDER BY.
     */
    protected void forEachPage(Session session, String sql, Map<String, ?> params, Consumer<Object[]> consumer) {
        int offset = 0;
        while (true) {
            NativeQuery<?> query = nativeQuery(session, sql, params);
            query.setFirstResult(offset);
            query.setMaxResults(pageSize);
            List<Object[]> page = rows(query);
            page.forEach(consumer);
            if (page.size() < pageSize) {
                return;
            }
            offset += page.size();
            session.clear();
        }
    }

    protected static long toLong(Object value) {
        if (value == null) return 0L;
        if (value instanceof Number) return ((Number) value).longValue();
        return Long.parseLong(value.toString());
    }

    protected static String toStr(Object value) {
        return value == null ? null : value.toString();
    }

    protected static LocalDateTime toDateTime(Object value) {
        if (value == null) return null;
        if (value instanceof LocalDateTime) return (LocalDateTime) value;
        if (value instanceof Timestamp) return ((Timestamp) value).toLocalDateTime();
        if (value instanceof OffsetDateTime) return ((OffsetDateTime) value).toLocalDateTime();
        if (value instanceof Instant) return LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC);
        if (value instanceof java.util.Date) return new Timestamp(((java.util.Date) value).getTime()).toLocalDateTime();
        return LocalDateTime.parse(value.toString().replace(' ', 'T'));
    }

    private static void rollback(Transaction tx, String operation, RuntimeException failure) {
        if (tx == null || !tx.getStatus().canRollback()) {
            return;
        }
        try {
            tx.rollback();
        } catch (RuntimeException rollbackFailure) {
            logger.warn("Rollback of {} failed: {}", operation, rollbackFailure.getMessage());
            if (failure != null) {
                failure.addSuppressed(rollbackFailure);
            } else {
                throw rollbackFailure;
            }
        }
    }
}
