package dao;

import config.StoreSettings;
import model.EntityKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hibernate.SessionFactory;
import org.hibernate.query.MutationQuery;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Empties the dataset tables, children first, in a single transaction.
 */
public class CleanupDao extends BaseDao {

    private static final Logger logger = LogManager.getLogger(CleanupDao.class);

    static final List<EntityKind> DELETE_ORDER =
            List.of(EntityKind.MESSAGE, EntityKind.MEMBERSHIP, EntityKind.CHAT, EntityKind.USER);

    public CleanupDao(SessionFactory sessionFactory, StoreSettings settings) {
        super(sessionFactory, settings);
    }

    public Map<EntityKind, Long> deleteAll() {
        return executeTransaction("clean dataset", session -> {
            Map<EntityKind, Long> deleted = new EnumMap<>(EntityKind.class);
            for (EntityKind kind : DELETE_ORDER) {
                MutationQuery delete = session.createNativeMutationQuery("DELETE FROM " + kind.table());
                delete.setTimeout(timeoutSeconds);
                long rows = delete.executeUpdate();
                deleted.put(kind, rows);
                logger.info("Deleted {} {}", rows, kind.label());
            }
            return deleted;
        });
    }
}
