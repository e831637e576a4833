package dao;

import config.StoreSettings;
import model.Chat;
import model.EntityKind;
import model.Identified;
import model.Membership;
import model.Message;
import model.Users;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hibernate.Session;
import org.hibernate.SessionFactory;
import org.hibernate.query.NativeQuery;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Writes generated batches through Hibernate, one transaction per batch.
 */
public class DatasetDao extends BaseDao implements BatchSink {

    private static final Logger logger = LogManager.getLogger(DatasetDao.class);

    static final int LOOKUP_CHUNK = 500;

    public DatasetDao(SessionFactory sessionFactory, StoreSettings settings) {
        super(sessionFactory, settings);
    }

    @Override
    public BatchOutcome write(Batch batch, WriteMode mode) {
        try {
            return executeTransaction("write batch " + batch.getIndex(), session -> {
                Map<EntityKind, Long> inserted = new EnumMap<>(EntityKind.class);
                Map<EntityKind, Long> skipped = new EnumMap<>(EntityKind.class);

                for (Identified entity : batch.getEntities()) {
                    // Idempotent: an id that is already stored is skipped
                    if (mode == WriteMode.UPSERT_OR_SKIP
                            && session.get(entity.kind().entityClass(), entity.getId()) != null) {
                        skipped.merge(entity.kind(), 1L, Long::sum);
                        continue;
                    }
                    session.persist(entity);
                    inserted.merge(entity.kind(), 1L, Long::sum);
                }
                session.flush();

                BatchOutcome outcome = new BatchOutcome(batch.getIndex(), inserted, skipped);
                logger.debug("Batch {} flushed: {} inserted, {} skipped",
                        batch.getIndex(), outcome.insertedTotal(), outcome.skippedTotal());
                return outcome;
            });
        } catch (StoreException e) {
            if (e.getKind() != StoreException.Kind.CONSTRAINT_VIOLATION) {
                throw e;
            }
            throw e.withOffendingRows(conflictsOf(batch, mode));
        }
    }

    /**
     * Rows of {@code batch} that collide with stored rows or with earlier rows of the batch, or that
     * reference a chat or user found nowhere. Looked up after the failed transaction was rolled back.
     */
    List<String> conflictsOf(Batch batch, WriteMode mode) {
        try {
            return executeRead("find conflicts of batch " + batch.getIndex(), session -> findConflicts(session, batch, mode));
        } catch (StoreException e) {
            logger.warn("Could not name the conflicting rows of batch {}: {}", batch.getIndex(), e.getMessage());
            return List.of();
        }
    }

    private List<String> findConflicts(Session session, Batch batch, WriteMode mode) {
        Map<EntityKind, Set<String>> ids = new EnumMap<>(EntityKind.class);
        for (EntityKind kind : EntityKind.values()) {
            ids.put(kind, new LinkedHashSet<>());
        }
        Set<String> handles = new HashSet<>();
        Set<String> dmKeys = new HashSet<>();
        Set<String> membershipChats = new HashSet<>();
        for (Identified entity : batch.getEntities()) {
            ids.get(entity.kind()).add(entity.getId());
            if (entity instanceof Users) {
                handles.add(lower(((Users) entity).getUsername()));
            } else if (entity instanceof Chat && ((Chat) entity).getDmKey() != null) {
                dmKeys.add(((Chat) entity).getDmKey());
            } else if (entity instanceof Membership) {
                Membership membership = (Membership) entity;
                membershipChats.add(membership.getChatId());
                ids.get(EntityKind.CHAT).add(membership.getChatId());
                ids.get(EntityKind.USER).add(membership.getUserId());
            } else if (entity instanceof Message) {
                ids.get(EntityKind.CHAT).add(((Message) entity).getChatId());
                ids.get(EntityKind.USER).add(((Message) entity).getSenderId());
            }
        }

        Map<EntityKind, Set<String>> stored = new EnumMap<>(EntityKind.class);
        for (EntityKind kind : EntityKind.values()) {
            stored.put(kind, lookup(session, "SELECT id FROM " + kind.table() + " WHERE id IN (:values)",
                    ids.get(kind), row -> toStr(row[0])));
        }
        Set<String> storedHandles = lookup(session, "SELECT LOWER(username) FROM users WHERE LOWER(username) IN (:values)",
                handles, row -> toStr(row[0]));
        Set<String> storedDmKeys = lookup(session, "SELECT dm_key FROM chats WHERE dm_key IN (:values)",
                dmKeys, row -> toStr(row[0]));
        Set<String> storedPairs = lookup(session, "SELECT chat_id, user_id FROM memberships WHERE chat_id IN (:values)",
                membershipChats, row -> toStr(row[0]) + "/" + toStr(row[1]));

        Map<EntityKind, Set<String>> staged = new EnumMap<>(EntityKind.class);
        for (EntityKind kind : EntityKind.values()) {
            staged.put(kind, new HashSet<>());
        }
        Set<String> stagedHandles = new HashSet<>();
        Set<String> stagedDmKeys = new HashSet<>();
        Set<String> stagedPairs = new HashSet<>();

        List<String> conflicts = new ArrayList<>();
        for (Identified entity : batch.getEntities()) {
            EntityKind kind = entity.kind();
            boolean isStored = stored.get(kind).contains(entity.getId());
            if (isStored && mode == WriteMode.UPSERT_OR_SKIP && !staged.get(kind).contains(entity.getId())) {
                continue;
            }
            boolean conflict = isStored || !staged.get(kind).add(entity.getId());

            if (entity instanceof Users) {
                String handle = lower(((Users) entity).getUsername());
                conflict |= storedHandles.contains(handle) || !stagedHandles.add(handle);
            } else if (entity instanceof Chat && ((Chat) entity).getDmKey() != null) {
                String key = ((Chat) entity).getDmKey();
                conflict |= storedDmKeys.contains(key) || !stagedDmKeys.add(key);
            } else if (entity instanceof Membership) {
                Membership membership = (Membership) entity;
                String pair = membership.getChatId() + "/" + membership.getUserId();
                conflict |= storedPairs.contains(pair) || !stagedPairs.add(pair)
                        || missing(membership.getChatId(), EntityKind.CHAT, stored, staged)
                        || missing(membership.getUserId(), EntityKind.USER, stored, staged);
            } else if (entity instanceof Message) {
                Message message = (Message) entity;
                conflict |= missing(message.getChatId(), EntityKind.CHAT, stored, staged)
                        || missing(message.getSenderId(), EntityKind.USER, stored, staged);
            }

            if (conflict) {
                conflicts.add(Batch.rowOf(entity));
            }
        }
        return conflicts;
    }

    private static boolean missing(String id, EntityKind kind,
                                   Map<EntityKind, Set<String>> stored, Map<EntityKind, Set<String>> staged) {
        return id == null || !(stored.get(kind).contains(id) || staged.get(kind).contains(id));
    }

    private Set<String> lookup(Session session, String sql, Collection<String> values, Function<Object[], String> mapper) {
        Set<String> found = new HashSet<>();
        List<String> all = new ArrayList<>(values);
        all.removeIf(Objects::isNull);
        for (int from = 0; from < all.size(); from += LOOKUP_CHUNK) {
            NativeQuery<?> query = session.createNativeQuery(sql);
            query.setTimeout(timeoutSeconds);
            query.setParameterList("values", all.subList(from, Math.min(all.size(), from + LOOKUP_CHUNK)));
            for (Object[] row : rows(query)) {
                found.add(mapper.apply(row));
            }
        }
        return found;
    }

    private static String lower(String value) {
        return value == null ? null : value.toLowerCase();
    }
}
