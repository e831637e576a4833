package dao;

import config.StoreSettings;
import model.EntityKind;
import org.hibernate.Session;
import org.hibernate.SessionFactory;
import org.hibernate.query.NativeQuery;
import verifier.ChatSummary;
import verifier.Findings;
import verifier.MessageTiming;
import verifier.SnapshotReader;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Read-only snapshot queries used by the verifier. Every query carries the store timeout
 * and large results are read page by page.
 */
public class SnapshotDao extends BaseDao implements SnapshotReader {

    public SnapshotDao(SessionFactory sessionFactory, StoreSettings settings) {
        super(sessionFactory, settings);
    }

    @Override
    public long count(EntityKind kind) {
        return executeRead("count " + kind.label(),
                session -> scalarLong(session, "SELECT COUNT(*) FROM " + kind.table(), null));
    }

    @Override
    public Findings duplicateIds(EntityKind kind, int limit) {
        String grouped = "SELECT id FROM " + kind.table() + " GROUP BY id HAVING COUNT(*) > 1";
        return findings("duplicate " + kind.label() + " ids", grouped, grouped + " ORDER BY id", limit);
    }

    @Override
    public Findings duplicateHandles(int limit) {
        String grouped = """
                SELECT LOWER(username) AS handle
                FROM users
                GROUP BY LOWER(username)
                HAVING COUNT(*) > 1
                """;
        return findings("duplicate handles", grouped, grouped + " ORDER BY handle", limit);
    }

    @Override
    public Findings duplicateMembershipPairs(int limit) {
        String grouped = """
                SELECT chat_id, user_id
                FROM memberships
                GROUP BY chat_id, user_id
                HAVING COUNT(*) > 1
                """;
        return findings("duplicate membership pairs", grouped, grouped + " ORDER BY chat_id, user_id", limit);
    }

    @Override
    public Findings duplicateDirectChatKeys(int limit) {
        String grouped = """
                SELECT dm_key
                FROM chats
                WHERE dm_key IS NOT NULL
                GROUP BY dm_key
                HAVING COUNT(*) > 1
                """;
        return findings("duplicate direct chat keys", grouped, grouped + " ORDER BY dm_key", limit);
    }

    @Override
    public Findings orphanMemberships(int limit) {
        String sql = """
                SELECT mb.id
                FROM memberships mb
                LEFT JOIN chats c ON c.id = mb.chat_id
                LEFT JOIN users u ON u.id = mb.user_id
                WHERE c.id IS NULL OR u.id IS NULL
                """;
        return findings("orphan memberships", sql, sql + " ORDER BY mb.id", limit);
    }

    @Override
    public Findings orphanMessages(int limit) {
        String sql = """
                SELECT m.id
                FROM messages m
                LEFT JOIN chats c ON c.id = m.chat_id
                LEFT JOIN users u ON u.id = m.sender_id
                WHERE c.id IS NULL OR u.id IS NULL
                """;
        return findings("orphan messages", sql, sql + " ORDER BY m.id", limit);
    }

    @Override
    public Findings messagesFromNonMembers(int limit) {
        String sql = """
                SELECT DISTINCT m.id
                FROM messages m
                LEFT JOIN memberships mb
                       ON mb.chat_id = m.chat_id AND mb.user_id = m.sender_id
                WHERE mb.id IS NULL OR mb.joined_at > m.sent_at
                """;
        return findings("messages from non-members", sql, sql + " ORDER BY m.id", limit);
    }

    @Override
    public Findings malformedHandles(int limit) {
        // Case is checked here rather than in SQL, collations may compare case-insensitively
        return executeRead("malformed handles", session -> {
            long[] count = {0};
            List<String> sample = new ArrayList<>();
            forEachPage(session, "SELECT id, username FROM users ORDER BY id", null, row -> {
                String handle = toStr(row[1]);
                if (handle == null || handle.isBlank() || !handle.equals(handle.toLowerCase())) {
                    count[0]++;
                    if (sample.size() < limit) sample.add(toStr(row[0]));
                }
            });
            return Findings.of(count[0], sample);
        });
    }

    @Override
    public Findings emptyMessages(int limit) {
        String sql = """
                SELECT id
                FROM messages
                WHERE content IS NULL OR LENGTH(TRIM(content)) = 0
                """;
        return findings("empty messages", sql, sql + " ORDER BY id", limit);
    }

    @Override
    public void forEachChatSummary(Consumer<ChatSummary> consumer) {
        String sql = """
                SELECT c.id, c.chat_type, c.dm_key,
                       COUNT(mb.id), MIN(mb.user_id), MAX(mb.user_id)
                FROM chats c
                LEFT JOIN memberships mb ON mb.chat_id = c.id
                GROUP BY c.id, c.chat_type, c.dm_key
                ORDER BY c.id
                """;
        executeRead("chat summaries", session -> {
            forEachPage(session, sql, null, row -> consumer.accept(new ChatSummary(
                    toStr(row[0]), toStr(row[1]), toStr(row[2]),
                    toLong(row[3]), toStr(row[4]), toStr(row[5]))));
            return null;
        });
    }

    @Override
    public void forEachMessageTiming(Consumer<MessageTiming> consumer) {
        String sql = """
                SELECT m.id, m.chat_id, m.sent_at, c.created_at
                FROM messages m
                LEFT JOIN chats c ON c.id = m.chat_id
                ORDER BY m.id
                """;
        executeRead("message timings", session -> {
            forEachPage(session, sql, null, row -> consumer.accept(new MessageTiming(
                    toStr(row[0]), toStr(row[1]), toDateTime(row[2]), toDateTime(row[3]))));
            return null;
        });
    }

    /**
     * Counts the rows of {@code sql} and reads the first {@code limit} of them as identifiers.
     * Multi-column rows are joined with '/'.
     */
    private Findings findings(String operation, String sql, String orderedSql, int limit) {
        return executeRead(operation, session -> {
            long count = scalarLong(session, "SELECT COUNT(*) FROM (" + sql + ") probe", null);
            if (count == 0) {
                return Findings.none();
            }
            return Findings.of(count, sample(session, orderedSql, limit));
        });
    }

    private List<String> sample(Session session, String sql, int limit) {
        NativeQuery<?> query = nativeQuery(session, sql, Map.of());
        query.setMaxResults(Math.max(1, limit));
        List<String> sample = new ArrayList<>();
        for (Object[] row : rows(query)) {
            StringBuilder id = new StringBuilder();
            for (int i = 0; i < row.length; i++) {
                if (i > 0) id.append('/');
                id.append(row[i]);
            }
            sample.add(id.toString());
        }
        return sample;
    }
}
