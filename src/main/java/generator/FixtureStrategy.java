package generator;

import config.ConfigurationException;
import config.ScaleConfig;
import dao.WriteMode;
import generator.Fixtures.ConversationFixture;
import generator.Fixtures.ConversationsFixture;
import generator.Fixtures.MessageFixture;
import generator.Fixtures.UserFixture;
import model.Chat;
import model.Chat.ChatType;
import model.DirectChatKey;
import model.Identified;
import model.Membership;
import model.Membership.MemberRole;
import model.Message;
import model.Users;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.mindrot.jbcrypt.BCrypt;
import util.JsonSupport;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Small fixed dataset read from the user and conversation fixture files.
 * Identifiers derive from logical names, so repeated runs address the same rows.
 */
public class FixtureStrategy implements GenerationStrategy {

    private static final Logger logger = LogManager.getLogger(FixtureStrategy.class);

    static final long USER_AGE_DAYS = 30;
    static final long CHAT_CREATION_OFFSET_MINUTES = 150;
    static final long MEMBERSHIP_JOIN_OFFSET_MINUTES = 140;

    @Override
    public String name() {
        return "fixture";
    }

    @Override
    public WriteMode writeMode() {
        return WriteMode.UPSERT_OR_SKIP;
    }

    @Override
    public void generate(GenerationContext context, Consumer<Identified> emit) {
        ScaleConfig config = context.getConfig();
        UserFixture[] userFixtures = JsonSupport.read(config.getUsersFixture(), UserFixture[].class);
        ConversationsFixture conversations = JsonSupport.read(config.getConversationsFixture(), ConversationsFixture.class);
        validate(userFixtures, conversations);

        LocalDateTime anchor = anchorTime(config, conversations);
        logger.info("Fixture dataset: {} users, {} conversations, anchor {}",
                userFixtures.length, conversations.getConversations().size(), anchor);

        Map<String, Users> users = new LinkedHashMap<>();
        for (UserFixture fixture : userFixtures) {
            Users user = user(context, fixture, anchor);
            users.put(user.getUsername(), user);
            emit.accept(user);
        }

        for (ConversationFixture conversation : conversations.getConversations()) {
            emitConversation(context, conversation, users, anchor, emit);
        }
    }

    private Users user(GenerationContext context, UserFixture fixture, LocalDateTime anchor) {
        ScaleConfig config = context.getConfig();
        String password = fixture.getPassword() != null ? fixture.getPassword() : config.getDefaultPassword();
        String displayName = fixture.getDisplayName() != null
                ? fixture.getDisplayName()
                : SamplingStrategy.displayNameOf(fixture.getUsername());
        return Users.builder()
                .id(context.getIdentities().idFor("user_" + fixture.getUsername()))
                .username(fixture.getUsername())
                .displayName(displayName)
                .passwordHash(BCrypt.hashpw(password, BCrypt.gensalt(config.getPasswordRounds())))
                .status(Users.UserStatus.ACTIVE)
                .createdAt(anchor.minusDays(USER_AGE_DAYS))
                .build();
    }

    private void emitConversation(GenerationContext context, ConversationFixture conversation,
                                  Map<String, Users> users, LocalDateTime anchor, Consumer<Identified> emit) {
        boolean direct = isDirect(conversation);
        String chatSeed = chatSeed(conversation);

        Chat.ChatBuilder chat = Chat.builder()
                .id(context.getIdentities().idFor(chatSeed))
                .type(direct ? ChatType.direct : ChatType.group)
                .createdAt(anchor.minusMinutes(CHAT_CREATION_OFFSET_MINUTES));
        if (direct) {
            List<String> pair = conversation.getParticipants();
            String key = DirectChatKey.keyOf(users.get(pair.get(0)).getId(), users.get(pair.get(1)).getId());
            if (!context.registerDirectChatKey(key)) {
                throw new ConfigurationException("Two direct conversations between " + pair);
            }
            chat.dmKey(key);
        } else {
            chat.topic(conversation.getTopic());
        }
        Chat built = chat.build();
        emit.accept(built);

        List<String> participants = conversation.getParticipants();
        for (int i = 0; i < participants.size(); i++) {
            String username = participants.get(i);
            // first participant of a group administers it
            MemberRole role = !direct && i == 0 ? MemberRole.ADMIN : MemberRole.MEMBER;
            emit.accept(Membership.builder()
                    .id(context.getIdentities().idFor("membership_" + chatSeed + "_" + username))
                    .chatId(built.getId())
                    .userId(users.get(username).getId())
                    .role(role)
                    .joinedAt(anchor.minusMinutes(MEMBERSHIP_JOIN_OFFSET_MINUTES))
                    .build());
        }

        List<MessageFixture> messages = conversation.getMessages();
        for (int i = 0; i < messages.size(); i++) {
            MessageFixture message = messages.get(i);
            emit.accept(Message.builder()
                    .id(context.getIdentities().idFor("msg_" + chatSeed + "_" + i + "_" + message.getSender()))
                    .chatId(built.getId())
                    .senderId(users.get(message.getSender()).getId())
                    .content(message.getContent())
                    .sentAt(anchor.plusMinutes(message.getOffsetMinutes()))
                    .build());
        }
    }

    static String chatSeed(ConversationFixture conversation) {
        if (isDirect(conversation)) {
            List<String> names = new ArrayList<>(conversation.getParticipants());
            names.sort(String::compareTo);
            return "dm_" + names.get(0) + "_" + names.get(1);
        }
        return "group_" + conversation.getTopic();
    }

    private static boolean isDirect(ConversationFixture conversation) {
        return "direct".equalsIgnoreCase(conversation.getType());
    }

    private static LocalDateTime anchorTime(ScaleConfig config, ConversationsFixture conversations) {
        LocalDateTime configured = config.parsedReferenceTime();
        if (configured != null) {
            return configured;
        }
        if (conversations.getAnchorTime() == null) {
            throw new ConfigurationException("conversations fixture has no anchorTime and no referenceTime is configured");
        }
        try {
            return LocalDateTime.parse(conversations.getAnchorTime().trim());
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("Invalid anchorTime in conversations fixture: " + conversations.getAnchorTime(), e);
        }
    }

    /**
     * Collects every fixture problem and fails with all of them.
     */
    static void validate(UserFixture[] userFixtures, ConversationsFixture conversations) {
        List<String> problems = new ArrayList<>();
        Set<String> usernames = new HashSet<>();

        for (UserFixture user : userFixtures) {
            String name = user.getUsername();
            if (name == null || name.isBlank()) {
                problems.add("user without username");
            } else if (!name.equals(name.toLowerCase())) {
                problems.add("username must be lowercase: " + name);
            } else if (!usernames.add(name)) {
                problems.add("duplicate username: " + name);
            }
        }

        Set<String> topics = new HashSet<>();
        for (ConversationFixture conversation : conversations.getConversations()) {
            String type = conversation.getType();
            List<String> participants = conversation.getParticipants();
            String label = type + " " + (conversation.getTopic() != null ? conversation.getTopic() : participants);

            if (!"direct".equalsIgnoreCase(type) && !"group".equalsIgnoreCase(type)) {
                problems.add("unknown conversation type: " + type);
                continue;
            }
            for (String participant : participants) {
                if (!usernames.contains(participant)) {
                    problems.add(label + ": unknown participant " + participant);
                }
            }
            if (new HashSet<>(participants).size() != participants.size()) {
                problems.add(label + ": repeated participant");
            }
            if ("direct".equalsIgnoreCase(type) && participants.size() != 2) {
                problems.add(label + ": a direct conversation has exactly 2 participants");
            }
            if ("group".equalsIgnoreCase(type)) {
                if (conversation.getTopic() == null || conversation.getTopic().isBlank()) {
                    problems.add(label + ": a group conversation needs a topic");
                } else if (!topics.add(conversation.getTopic())) {
                    problems.add(label + ": duplicate group topic");
                }
                if (participants.size() < 2) {
                    problems.add(label + ": a group conversation needs at least 2 participants");
                }
            }

            for (MessageFixture message : conversation.getMessages()) {
                if (!participants.contains(message.getSender())) {
                    problems.add(label + ": message from non-participant " + message.getSender());
                }
                if (message.getContent() == null || message.getContent().isBlank()) {
                    problems.add(label + ": empty message from " + message.getSender());
                }
                if (message.getOffsetMinutes() < -MEMBERSHIP_JOIN_OFFSET_MINUTES) {
                    problems.add(label + ": message at offset " + message.getOffsetMinutes()
                            + " min precedes the participants joining");
                }
            }
        }

        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
    }
}
