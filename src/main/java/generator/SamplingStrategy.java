package generator;

import config.ScaleConfig;
import dao.WriteMode;
import model.Chat;
import model.Chat.ChatType;
import model.DirectChatKey;
import model.Identified;
import model.Membership;
import model.Membership.MemberRole;
import model.Message;
import model.Users;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.ListSampler;
import org.apache.commons.rng.sampling.distribution.AliasMethodDiscreteSampler;
import org.apache.commons.rng.sampling.distribution.SharedStateDiscreteSampler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.mindrot.jbcrypt.BCrypt;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

import static util.RandomSources.between;
import static util.RandomSources.chance;
import static util.RandomSources.pick;

/**
 * Large synthetic dataset drawn from configured distributions, reproducible from the run seed.
 */
public class SamplingStrategy implements GenerationStrategy {

    private static final Logger logger = LogManager.getLogger(SamplingStrategy.class);

    static final int DIRECT_CHAT_ATTEMPTS_PER_CHAT = 20;

    /** A chat with its members, kept for message sampling. */
    private static final class ChatMembers {
        final Chat chat;
        final List<Membership> members = new ArrayList<>();
        final List<Membership> activeMembers = new ArrayList<>();

        ChatMembers(Chat chat) {
            this.chat = chat;
        }
    }

    @Override
    public String name() {
        return "sampling";
    }

    @Override
    public WriteMode writeMode() {
        return WriteMode.INSERT;
    }

    @Override
    public void generate(GenerationContext context, Consumer<Identified> emit) {
        ScaleConfig config = context.getConfig();
        UniformRandomProvider rng = context.getRng();
        LocalDateTime reference = context.getReferenceTime();

        logger.info("Sampling dataset: {} users, {} groups, {} direct chats, {} messages (seed {})",
                config.getUserCount(), config.getGroupChatCount(), config.getDirectChatCount(),
                config.getMessageCount(), context.getSeed());

        List<Users> users = createUsers(context, emit);
        Set<String> activeUserIds = new HashSet<>();
        int activeCount = (int) (users.size() * config.getActiveUserRatio());
        for (Users user : ListSampler.sample(rng, users, activeCount)) {
            activeUserIds.add(user.getId());
        }

        List<ChatMembers> chats = new ArrayList<>();
        createGroupChats(context, users, activeUserIds, chats, emit);
        createDirectChats(context, users, activeUserIds, chats, emit);
        createMessages(context, chats, reference, emit);
    }

    private List<Users> createUsers(GenerationContext context, Consumer<Identified> emit) {
        ScaleConfig config = context.getConfig();
        UniformRandomProvider rng = context.getRng();
        LocalDateTime reference = context.getReferenceTime();

        // every sampled user shares the default password, hash it once
        String passwordHash = config.getUserCount() > 0
                ? BCrypt.hashpw(config.getDefaultPassword(), BCrypt.gensalt(config.getPasswordRounds()))
                : null;

        Set<String> used = new HashSet<>();
        List<Users> users = new ArrayList<>(config.getUserCount());
        for (int i = 0; i < config.getUserCount(); i++) {
            String username = unique(SampleVocabulary.username(rng), "", used);
            Users user = Users.builder()
                    .id(context.getIdentities().idFor("large_user_" + username))
                    .username(username)
                    .displayName(displayNameOf(username))
                    .passwordHash(passwordHash)
                    .status(Users.UserStatus.ACTIVE)
                    .createdAt(reference.minusDays(between(rng, 1, config.getMaxUserAgeDays())))
                    .build();
            users.add(user);
            emit.accept(user);
        }
        return users;
    }

    private void createGroupChats(GenerationContext context, List<Users> users, Set<String> activeUserIds,
                                  List<ChatMembers> chats, Consumer<Identified> emit) {
        ScaleConfig config = context.getConfig();
        UniformRandomProvider rng = context.getRng();
        LocalDateTime reference = context.getReferenceTime();
        Set<String> topics = new HashSet<>();

        for (int i = 0; i < config.getGroupChatCount(); i++) {
            String topic = unique(SampleVocabulary.groupTopic(rng), " ", topics);
            Chat chat = Chat.builder()
                    .id(context.getIdentities().idFor("large_group_" + topic))
                    .type(ChatType.group)
                    .topic(topic)
                    .createdAt(reference.minusDays(between(rng, 1, config.getMaxGroupChatAgeDays())))
                    .build();
            emit.accept(chat);

            ChatMembers entry = new ChatMembers(chat);
            int size = between(rng, config.getMinGroupMembers(), Math.min(config.getMaxGroupMembers(), users.size()));
            List<Users> members = ListSampler.sample(rng, users, size);
            for (int j = 0; j < members.size(); j++) {
                Users user = members.get(j);
                MemberRole role = j == 0 || chance(rng, config.getAdminPromotionChance())
                        ? MemberRole.ADMIN
                        : MemberRole.MEMBER;
                LocalDateTime joined = chat.getCreatedAt().plusMinutes(between(rng, 0, config.getMaxJoinDelayMinutes()));
                Membership membership = Membership.builder()
                        .id(context.getIdentities().idFor("large_membership_" + chat.getId() + "_" + user.getId()))
                        .chatId(chat.getId())
                        .userId(user.getId())
                        .role(role)
                        .joinedAt(joined.isAfter(reference) ? reference : joined)
                        .build();
                emit.accept(membership);
                track(entry, membership, activeUserIds);
            }
            chats.add(entry);
        }
    }

    private void createDirectChats(GenerationContext context, List<Users> users, Set<String> activeUserIds,
                                   List<ChatMembers> chats, Consumer<Identified> emit) {
        ScaleConfig config = context.getConfig();
        UniformRandomProvider rng = context.getRng();
        LocalDateTime reference = context.getReferenceTime();

        int wanted = config.getDirectChatCount();
        int maxAttempts = wanted * DIRECT_CHAT_ATTEMPTS_PER_CHAT;
        int created = 0;
        int attempts = 0;

        while (created < wanted && attempts < maxAttempts && users.size() >= 2) {
            attempts++;
            int a = rng.nextInt(users.size());
            int b = rng.nextInt(users.size() - 1);
            if (b >= a) b++;
            Users first = users.get(a);
            Users second = users.get(b);

            String key = DirectChatKey.keyOf(first.getId(), second.getId());
            if (!context.registerDirectChatKey(key)) {
                continue;
            }

            Chat chat = Chat.builder()
                    .id(context.getIdentities().idFor("large_dm_" + key))
                    .type(ChatType.direct)
                    .dmKey(key)
                    .createdAt(reference.minusDays(between(rng, 1, config.getMaxDirectChatAgeDays())))
                    .build();
            emit.accept(chat);

            ChatMembers entry = new ChatMembers(chat);
            for (Users user : List.of(first, second)) {
                Membership membership = Membership.builder()
                        .id(context.getIdentities().idFor("large_membership_" + chat.getId() + "_" + user.getId()))
                        .chatId(chat.getId())
                        .userId(user.getId())
                        .role(MemberRole.MEMBER)
                        .joinedAt(chat.getCreatedAt())
                        .build();
                emit.accept(membership);
                track(entry, membership, activeUserIds);
            }
            chats.add(entry);
            created++;
        }

        if (created < wanted) {
            String warning = "Only " + created + " of " + wanted + " direct chats created after " + attempts + " attempts";
            logger.warn(warning);
            context.warn(warning);
        }
    }

    private void createMessages(GenerationContext context, List<ChatMembers> chats, LocalDateTime reference,
                                Consumer<Identified> emit) {
        ScaleConfig config = context.getConfig();
        if (config.getMessageCount() == 0 || chats.isEmpty()) {
            return;
        }
        UniformRandomProvider rng = context.getRng();

        // bigger chats get more traffic
        double[] weights = new double[chats.size()];
        for (int i = 0; i < chats.size(); i++) {
            weights[i] = Math.max(1, chats.get(i).members.size() / 2);
        }
        SharedStateDiscreteSampler chatSampler = AliasMethodDiscreteSampler.of(rng, normalize(weights));

        ActivityTimeSampler timeSampler = new ActivityTimeSampler(config.activityProfile(), rng,
                reference.minusDays(config.getHistoryDays()), reference);

        for (int i = 0; i < config.getMessageCount(); i++) {
            ChatMembers entry = chats.get(chatSampler.sample());
            List<Membership> candidates = entry.activeMembers.isEmpty() ? entry.members : entry.activeMembers;
            Membership sender = pick(rng, candidates);

            emit.accept(Message.builder()
                    .id(context.getIdentities().idFor("large_msg_" + entry.chat.getId() + "_" + i + "_" + sender.getUserId()))
                    .chatId(entry.chat.getId())
                    .senderId(sender.getUserId())
                    .content(SampleVocabulary.messageBody(rng))
                    .sentAt(timeSampler.sample(sender.getJoinedAt()))
                    .build());
        }

        if (timeSampler.getFallbacks() > 0) {
            logger.debug("{} message times fell back to uniform sampling", timeSampler.getFallbacks());
        }
    }

    private static void track(ChatMembers entry, Membership membership, Set<String> activeUserIds) {
        entry.members.add(membership);
        if (activeUserIds.contains(membership.getUserId())) {
            entry.activeMembers.add(membership);
        }
    }

    /** "alex_dev" becomes "Alex Dev". */
    static String displayNameOf(String username) {
        StringBuilder sb = new StringBuilder();
        for (String part : username.split("_")) {
            if (part.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
        }
        return sb.length() > 0 ? sb.toString() : username;
    }

    /** Appends 1, 2, ... (after {@code separator}) until {@code base} is unused. */
    static String unique(String base, String separator, Set<String> used) {
        String candidate = base;
        int counter = 1;
        while (used.contains(candidate)) {
            candidate = base + separator + counter;
            counter++;
        }
        used.add(candidate);
        return candidate;
    }

    private static double[] normalize(double[] weights) {
        double total = 0;
        for (double w : weights) total += w;
        double[] result = new double[weights.length];
        for (int i = 0; i < weights.length; i++) {
            result[i] = weights[i] / total;
        }
        return result;
    }
}
