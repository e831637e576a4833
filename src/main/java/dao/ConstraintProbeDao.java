package dao;

import config.StoreSettings;
import lombok.Value;
import model.Chat;
import model.Chat.ChatType;
import model.DirectChatKey;
import model.Membership;
import model.Membership.MemberRole;
import model.Message;
import model.Users;
import model.Users.UserStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hibernate.Session;
import org.hibernate.SessionFactory;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Tries writes the schema must reject and reports whether it did.
 * Every attempt runs in its own transaction, which is always rolled back.
 */
public class ConstraintProbeDao extends BaseDao {

    private static final Logger logger = LogManager.getLogger(ConstraintProbeDao.class);

    public enum ProbeStatus {
        ENFORCED,
        NOT_ENFORCED,
        ERROR
    }

    @Value
    public static class ProbeResult {
        String constraint;
        ProbeStatus status;
        String detail;
    }

    public ConstraintProbeDao(SessionFactory sessionFactory, StoreSettings settings) {
        super(sessionFactory, settings);
    }

    public List<ProbeResult> probeAll() {
        return List.of(
                probe("unique direct chat key", this::duplicateDirectChatKey),
                probe("unique membership per chat and user", this::duplicateMembership),
                probe("message references an existing chat", this::messageForMissingChat));
    }

    private ProbeResult probe(String constraint, Consumer<Session> attempt) {
        try {
            executeRolledBack("probe " + constraint, session -> {
                attempt.accept(session);
                session.flush();
                return null;
            });
            logger.warn("Constraint not enforced: {}", constraint);
            return new ProbeResult(constraint, ProbeStatus.NOT_ENFORCED, "the store accepted the write");
        } catch (StoreException e) {
            if (e.getKind() == StoreException.Kind.CONSTRAINT_VIOLATION) {
                logger.info("Constraint enforced: {}", constraint);
                return new ProbeResult(constraint, ProbeStatus.ENFORCED, "rejected as expected");
            }
            logger.warn("Constraint probe '{}' could not run: {}", constraint, e.getMessage());
            return new ProbeResult(constraint, ProbeStatus.ERROR, e.getMessage());
        }
    }

    private void duplicateDirectChatKey(Session session) {
        String key = DirectChatKey.keyOf(newId(), newId());
        session.persist(directChat(key));
        session.flush();
        session.persist(directChat(key));
    }

    private void duplicateMembership(Session session) {
        Users user = probeUser();
        Chat chat = Chat.builder().id(newId()).type(ChatType.group).topic("probe").createdAt(now()).build();
        session.persist(user);
        session.persist(chat);
        session.persist(membership(chat, user));
        session.flush();
        session.persist(membership(chat, user));
    }

    private void messageForMissingChat(Session session) {
        Users user = probeUser();
        session.persist(user);
        session.flush();
        session.persist(Message.builder()
                .id(newId())
                .chatId(newId())
                .senderId(user.getId())
                .content("probe")
                .sentAt(now())
                .build());
    }

    private static Chat directChat(String key) {
        return Chat.builder().id(newId()).type(ChatType.direct).dmKey(key).createdAt(now()).build();
    }

    private static Membership membership(Chat chat, Users user) {
        return Membership.builder()
                .id(newId())
                .chatId(chat.getId())
                .userId(user.getId())
                .role(MemberRole.MEMBER)
                .joinedAt(now())
                .build();
    }

    private static Users probeUser() {
        String id = newId();
        return Users.builder()
                .id(id)
                .username("probe_" + id.substring(0, 8))
                .displayName("Probe")
                .passwordHash("-")
                .status(UserStatus.DISABLED)
                .createdAt(now())
                .build();
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }

    private static LocalDateTime now() {
        return LocalDateTime.now().withNano(0);
    }
}
