package dao;

import benchmark.QueryDefinition;
import benchmark.QueryRunner;
import config.StoreSettings;
import model.EntityKind;
import org.hibernate.SessionFactory;
import org.hibernate.query.NativeQuery;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs catalogue queries as native SQL in read-only sessions. Pagination goes through
 * setFirstResult / setMaxResults so the dialect renders LIMIT / OFFSET.
 */
public class BenchmarkDao extends BaseDao implements QueryRunner {

    public BenchmarkDao(SessionFactory sessionFactory, StoreSettings settings) {
        super(sessionFactory, settings);
    }

    @Override
    public Map<EntityKind, Long> datasetCounts() {
        return executeRead("dataset counts", session -> {
            Map<EntityKind, Long> counts = new EnumMap<>(EntityKind.class);
            for (EntityKind kind : EntityKind.values()) {
                counts.put(kind, scalarLong(session, "SELECT COUNT(*) FROM " + kind.table(), null));
            }
            return counts;
        });
    }

    @Override
    public String probe(String sql) {
        return executeRead("probe", session -> {
            NativeQuery<?> query = nativeQuery(session, sql, null);
            query.setMaxResults(1);
            List<Object[]> rows = rows(query);
            return rows.isEmpty() ? null : toStr(rows.get(0)[0]);
        });
    }

    @Override
    public int execute(QueryDefinition definition, Map<String, Object> parameters) {
        return executeRead("query " + definition.getName(), session -> {
            NativeQuery<?> query = nativeQuery(session, definition.getSql(), parameters);
            if (definition.getOffset() != null) {
                query.setFirstResult(definition.getOffset());
            }
            if (definition.getLimit() != null) {
                query.setMaxResults(definition.getLimit());
            }
            return query.getResultList().size();
        });
    }
}
