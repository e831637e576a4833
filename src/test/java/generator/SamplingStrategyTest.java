package generator;

import config.ScaleConfig;
import model.Chat;
import model.EntityKind;
import model.Identified;
import model.Membership;
import model.Message;
import model.Users;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class SamplingStrategyTest {

    private static final LocalDateTime REFERENCE = LocalDateTime.of(2024, 3, 1, 12, 0);

    private static ScaleConfig config(long seed) {
        ScaleConfig config = ScaleConfig.scale();
        config.setSeed(seed);
        config.setUserCount(40);
        config.setGroupChatCount(6);
        config.setDirectChatCount(25);
        config.setMessageCount(500);
        config.setPasswordRounds(4);
        config.setReferenceTime(REFERENCE.toString());
        return config;
    }

    private static GenerationContext contextFor(ScaleConfig config) {
        return GenerationContext.create(config);
    }

    private static List<Identified> run(GenerationContext context) {
        List<Identified> emitted = new ArrayList<>();
        new SamplingStrategy().generate(context, emitted::add);
        return emitted;
    }

    @Test
    void producesTheConfiguredCounts() {
        List<Identified> emitted = run(contextFor(config(1)));
        Map<EntityKind, Long> counts = emitted.stream()
                .collect(Collectors.groupingBy(Identified::kind, Collectors.counting()));

        assertThat(counts).containsEntry(EntityKind.USER, 40L)
                .containsEntry(EntityKind.CHAT, 31L)
                .containsEntry(EntityKind.MESSAGE, 500L);
        assertThat(emitted.stream().map(Identified::getId).collect(Collectors.toList())).doesNotHaveDuplicates();
    }

    @Test
    void sameSeedReplaysTheSameDataset() {
        List<Identified> first = run(contextFor(config(7)));
        List<Identified> second = run(contextFor(config(7)));
        List<Identified> other = run(contextFor(config(8)));

        assertThat(first).extracting(Identified::getId).isEqualTo(second.stream().map(Identified::getId).collect(Collectors.toList()));
        assertThat(first).extracting(Identified::getId).isNotEqualTo(other.stream().map(Identified::getId).collect(Collectors.toList()));

        List<String> firstNames = first.stream().filter(e -> e instanceof Users)
                .map(e -> ((Users) e).getUsername()).collect(Collectors.toList());
        List<String> secondNames = second.stream().filter(e -> e instanceof Users)
                .map(e -> ((Users) e).getUsername()).collect(Collectors.toList());
        assertThat(firstNames).isEqualTo(secondNames).doesNotHaveDuplicates();
    }

    @Test
    void structuralRulesHold() {
        ScaleConfig config = config(3);
        List<Identified> emitted = run(contextFor(config));

        Set<String> handles = new HashSet<>();
        Map<String, Chat> chats = new HashMap<>();
        Map<String, List<Membership>> members = new HashMap<>();
        for (Identified entity : emitted) {
            if (entity instanceof Users) {
                Users user = (Users) entity;
                assertThat(user.getUsername()).isEqualTo(user.getUsername().toLowerCase());
                assertThat(handles.add(user.getUsername())).isTrue();
            } else if (entity instanceof Chat) {
                chats.put(entity.getId(), (Chat) entity);
            } else if (entity instanceof Membership) {
                Membership m = (Membership) entity;
                members.computeIfAbsent(m.getChatId(), k -> new ArrayList<>()).add(m);
                assertThat(m.getJoinedAt()).isAfterOrEqualTo(chats.get(m.getChatId()).getCreatedAt())
                        .isBeforeOrEqualTo(REFERENCE);
            } else {
                Message message = (Message) entity;
                Membership sender = members.get(message.getChatId()).stream()
                        .filter(m -> m.getUserId().equals(message.getSenderId()))
                        .findFirst().orElseThrow();
                assertThat(message.getSentAt()).isAfterOrEqualTo(sender.getJoinedAt()).isBeforeOrEqualTo(REFERENCE);
                assertThat(message.getContent()).isNotBlank();
            }
        }

        for (Chat chat : chats.values()) {
            List<Membership> chatMembers = members.get(chat.getId());
            if (chat.getType() == Chat.ChatType.direct) {
                assertThat(chatMembers).hasSize(2);
                assertThat(chat.getDmKey()).isEqualTo(model.DirectChatKey.keyOf(
                        chatMembers.get(0).getUserId(), chatMembers.get(1).getUserId()));
            } else {
                assertThat(chatMembers.size()).isBetween(config.getMinGroupMembers(), config.getMaxGroupMembers());
                assertThat(chatMembers.get(0).getRole()).isEqualTo(Membership.MemberRole.ADMIN);
            }
        }
    }

    @Test
    void directChatShortfallBecomesAWarning() {
        ScaleConfig config = config(5);
        config.setUserCount(4);
        config.setGroupChatCount(1);
        config.setDirectChatCount(6);
        config.setMessageCount(10);
        GenerationContext context = contextFor(config);

        List<Identified> emitted = run(context);

        // 6 pairs exist, so all are found within the attempt budget or a warning explains the shortfall
        long directs = emitted.stream().filter(e -> e instanceof Chat && ((Chat) e).getDmKey() != null).count();
        if (directs < 6) {
            assertThat(context.getWarnings()).anyMatch(w -> w.startsWith("Only " + directs + " of 6"));
        } else {
            assertThat(context.getWarnings()).isEmpty();
        }
    }

    @Test
    void displayNamesAndUniqueSuffixes() {
        assertThat(SamplingStrategy.displayNameOf("alex_dev")).isEqualTo("Alex Dev");
        assertThat(SamplingStrategy.displayNameOf("sam")).isEqualTo("Sam");

        Set<String> used = new HashSet<>();
        assertThat(SamplingStrategy.unique("Team Sync", " ", used)).isEqualTo("Team Sync");
        assertThat(SamplingStrategy.unique("Team Sync", " ", used)).isEqualTo("Team Sync 1");
        assertThat(SamplingStrategy.unique("Team Sync", " ", used)).isEqualTo("Team Sync 2");
    }
}
