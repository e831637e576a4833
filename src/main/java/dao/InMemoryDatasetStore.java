package dao;

import model.Chat;
import model.EntityKind;
import model.Identified;
import model.Membership;
import model.Message;
import model.Users;
import verifier.ChatSummary;
import verifier.Findings;
import verifier.MessageTiming;
import verifier.SnapshotReader;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Store kept in memory, for dry runs and tests. Batches are checked against the same unique and
 * reference constraints as the migrated schema and applied all-or-nothing.
 * {@link #insertRaw(Identified)} bypasses every check so tests can corrupt a dataset.
 */
public class InMemoryDatasetStore implements BatchSink, SnapshotReader {

    private final Map<EntityKind, List<Identified>> rows = new EnumMap<>(EntityKind.class);

    public InMemoryDatasetStore() {
        for (EntityKind kind : EntityKind.values()) {
            rows.put(kind, new ArrayList<>());
        }
    }

    @Override
    public synchronized BatchOutcome write(Batch batch, WriteMode mode) {
        Map<EntityKind, Long> inserted = new EnumMap<>(EntityKind.class);
        Map<EntityKind, Long> skipped = new EnumMap<>(EntityKind.class);
        List<Identified> staged = new ArrayList<>();

        Map<EntityKind, Set<String>> storedIds = new EnumMap<>(EntityKind.class);
        Map<EntityKind, Set<String>> stagedIds = new EnumMap<>(EntityKind.class);
        for (EntityKind kind : EntityKind.values()) {
            storedIds.put(kind, idsOf(kind));
            stagedIds.put(kind, new HashSet<>());
        }
        Set<String> handles = users().stream().map(u -> lower(u.getUsername())).collect(Collectors.toCollection(HashSet::new));
        Set<String> dmKeys = chats().stream().map(Chat::getDmKey).filter(k -> k != null).collect(Collectors.toCollection(HashSet::new));
        Set<String> pairs = memberships().stream().map(m -> pair(m.getChatId(), m.getUserId())).collect(Collectors.toCollection(HashSet::new));

        for (Identified entity : batch.getEntities()) {
            EntityKind kind = entity.kind();
            boolean stored = storedIds.get(kind).contains(entity.getId());
            if (stored && mode == WriteMode.UPSERT_OR_SKIP && !stagedIds.get(kind).contains(entity.getId())) {
                skipped.merge(kind, 1L, Long::sum);
                continue;
            }
            if (stored || stagedIds.get(kind).contains(entity.getId())) {
                throw violation(batch, entity, "duplicate " + kind.label() + " id " + entity.getId());
            }

            switch (kind) {
                case USER -> {
                    Users user = (Users) entity;
                    if (!handles.add(lower(user.getUsername()))) {
                        throw violation(batch, entity, "duplicate username " + user.getUsername());
                    }
                }
                case CHAT -> {
                    Chat chat = (Chat) entity;
                    if (chat.getDmKey() != null && !dmKeys.add(chat.getDmKey())) {
                        throw violation(batch, entity, "duplicate dm_key " + chat.getDmKey());
                    }
                }
                case MEMBERSHIP -> {
                    Membership membership = (Membership) entity;
                    requireReference(batch, entity, storedIds, stagedIds, EntityKind.CHAT, membership.getChatId());
                    requireReference(batch, entity, storedIds, stagedIds, EntityKind.USER, membership.getUserId());
                    if (!pairs.add(pair(membership.getChatId(), membership.getUserId()))) {
                        throw violation(batch, entity, "duplicate membership " + pair(membership.getChatId(), membership.getUserId()));
                    }
                }
                case MESSAGE -> {
                    Message message = (Message) entity;
                    requireReference(batch, entity, storedIds, stagedIds, EntityKind.CHAT, message.getChatId());
                    requireReference(batch, entity, storedIds, stagedIds, EntityKind.USER, message.getSenderId());
                }
            }

            stagedIds.get(kind).add(entity.getId());
            staged.add(entity);
            inserted.merge(kind, 1L, Long::sum);
        }

        staged.forEach(entity -> rows.get(entity.kind()).add(entity));
        return new BatchOutcome(batch.getIndex(), inserted, skipped);
    }

    /** Stores {@code entity} without any constraint check. */
    public synchronized void insertRaw(Identified entity) {
        rows.get(entity.kind()).add(entity);
    }

    public synchronized Map<EntityKind, Long> clear() {
        Map<EntityKind, Long> deleted = new EnumMap<>(EntityKind.class);
        for (EntityKind kind : EntityKind.values()) {
            deleted.put(kind, (long) rows.get(kind).size());
            rows.get(kind).clear();
        }
        return deleted;
    }

    public synchronized List<Users> users() {
        return typed(EntityKind.USER, Users.class);
    }

    public synchronized List<Chat> chats() {
        return typed(EntityKind.CHAT, Chat.class);
    }

    public synchronized List<Membership> memberships() {
        return typed(EntityKind.MEMBERSHIP, Membership.class);
    }

    public synchronized List<Message> messages() {
        return typed(EntityKind.MESSAGE, Message.class);
    }

    // ---- SnapshotReader

    @Override
    public synchronized long count(EntityKind kind) {
        return rows.get(kind).size();
    }

    @Override
    public synchronized Findings duplicateIds(EntityKind kind, int limit) {
        return duplicates(rows.get(kind), Identified::getId, limit);
    }

    @Override
    public synchronized Findings duplicateHandles(int limit) {
        return duplicates(users(), u -> lower(u.getUsername()), limit);
    }

    @Override
    public synchronized Findings duplicateMembershipPairs(int limit) {
        return duplicates(memberships(), m -> m.getChatId() + "/" + m.getUserId(), limit);
    }

    @Override
    public synchronized Findings duplicateDirectChatKeys(int limit) {
        List<Chat> keyed = chats().stream().filter(c -> c.getDmKey() != null).collect(Collectors.toList());
        return duplicates(keyed, Chat::getDmKey, limit);
    }

    @Override
    public synchronized Findings orphanMemberships(int limit) {
        Set<String> chatIds = idsOf(EntityKind.CHAT);
        Set<String> userIds = idsOf(EntityKind.USER);
        return matching(memberships(), m -> !chatIds.contains(m.getChatId()) || !userIds.contains(m.getUserId()),
                Membership::getId, limit);
    }

    @Override
    public synchronized Findings orphanMessages(int limit) {
        Set<String> chatIds = idsOf(EntityKind.CHAT);
        Set<String> userIds = idsOf(EntityKind.USER);
        return matching(messages(), m -> !chatIds.contains(m.getChatId()) || !userIds.contains(m.getSenderId()),
                Message::getId, limit);
    }

    @Override
    public synchronized Findings messagesFromNonMembers(int limit) {
        Map<String, LocalDateTime> earliestJoin = new HashMap<>();
        for (Membership m : memberships()) {
            earliestJoin.merge(pair(m.getChatId(), m.getUserId()), m.getJoinedAt(),
                    (a, b) -> a.isBefore(b) ? a : b);
        }
        return matching(messages(), m -> {
            LocalDateTime joined = earliestJoin.get(pair(m.getChatId(), m.getSenderId()));
            return joined == null || joined.isAfter(m.getSentAt());
        }, Message::getId, limit);
    }

    @Override
    public synchronized Findings malformedHandles(int limit) {
        return matching(users(), u -> u.getUsername() == null || u.getUsername().isBlank()
                || !u.getUsername().equals(u.getUsername().toLowerCase()), Users::getId, limit);
    }

    @Override
    public synchronized Findings emptyMessages(int limit) {
        return matching(messages(), m -> m.getContent() == null || m.getContent().isBlank(), Message::getId, limit);
    }

    @Override
    public synchronized void forEachChatSummary(Consumer<ChatSummary> consumer) {
        Map<String, List<String>> membersByChat = new HashMap<>();
        for (Membership m : memberships()) {
            membersByChat.computeIfAbsent(m.getChatId(), k -> new ArrayList<>()).add(m.getUserId());
        }
        chats().stream()
                .sorted(Comparator.comparing(Chat::getId))
                .forEach(chat -> {
                    List<String> members = membersByChat.getOrDefault(chat.getId(), List.of());
                    String min = members.stream().min(Comparator.naturalOrder()).orElse(null);
                    String max = members.stream().max(Comparator.naturalOrder()).orElse(null);
                    String type = chat.getType() == null ? null : chat.getType().name();
                    consumer.accept(new ChatSummary(chat.getId(), type, chat.getDmKey(), members.size(), min, max));
                });
    }

    @Override
    public synchronized void forEachMessageTiming(Consumer<MessageTiming> consumer) {
        Map<String, LocalDateTime> chatCreated = new HashMap<>();
        for (Chat chat : chats()) {
            chatCreated.putIfAbsent(chat.getId(), chat.getCreatedAt());
        }
        messages().stream()
                .sorted(Comparator.comparing(Message::getId))
                .forEach(m -> consumer.accept(
                        new MessageTiming(m.getId(), m.getChatId(), m.getSentAt(), chatCreated.get(m.getChatId()))));
    }

    private <T extends Identified> List<T> typed(EntityKind kind, Class<T> type) {
        return rows.get(kind).stream().map(type::cast).collect(Collectors.toList());
    }

    private Set<String> idsOf(EntityKind kind) {
        return rows.get(kind).stream().map(Identified::getId).collect(Collectors.toSet());
    }

    private static <T> Findings duplicates(List<T> items, Function<T, String> key, int limit) {
        Map<String, Long> counts = new TreeMap<>();
        for (T item : items) {
            counts.merge(key.apply(item), 1L, Long::sum);
        }
        List<String> repeated = counts.entrySet().stream()
                .filter(e -> e.getValue() > 1)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
        return Findings.of(repeated.size(), repeated.stream().limit(limit).collect(Collectors.toList()));
    }

    private static <T> Findings matching(List<T> items, Predicate<T> offending,
                                         Function<T, String> id, int limit) {
        Map<String, Boolean> hits = new LinkedHashMap<>();
        for (T item : items) {
            if (offending.test(item)) hits.put(id.apply(item), Boolean.TRUE);
        }
        List<String> sample = hits.keySet().stream().sorted().limit(limit).collect(Collectors.toList());
        return Findings.of(hits.size(), sample);
    }

    private static void requireReference(Batch batch, Identified entity, Map<EntityKind, Set<String>> storedIds,
                                         Map<EntityKind, Set<String>> stagedIds, EntityKind kind, String id) {
        if (id == null || !(storedIds.get(kind).contains(id) || stagedIds.get(kind).contains(id))) {
            throw violation(batch, entity, "missing " + kind.label() + " row " + id);
        }
    }

    private static StoreException violation(Batch batch, Identified entity, String detail) {
        return new StoreException(StoreException.Kind.CONSTRAINT_VIOLATION,
                "write batch " + batch.getIndex() + " failed (CONSTRAINT_VIOLATION): " + detail, null,
                List.of(Batch.rowOf(entity)));
    }

    private static String pair(String chatId, String userId) {
        return chatId + "/" + userId;
    }

    private static String lower(String value) {
        return value == null ? null : value.toLowerCase();
    }
}
