package verifier;

import config.ActivityProfile;
import config.AppConfig;
import config.ConfigurationException;
import config.DatasetMode;
import config.ScaleConfig;
import generator.Fixtures.ConversationFixture;
import generator.Fixtures.ConversationsFixture;
import generator.Fixtures.UserFixture;
import lombok.Builder;
import lombok.Value;
import model.EntityKind;
import util.JsonSupport;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * What a verified dataset is expected to look like.
 */
@Value
@Builder(toBuilder = true)
public class VerificationExpectations {

    /** Kinds without a range are not count-checked. */
    Map<EntityKind, CountRange> counts;

    @Builder.Default
    int minGroupMembers = 2;

    /** Null skips the activity distribution test. */
    ActivityProfile activityProfile;

    /** Window the message times were drawn from. Null assumes whole weeks. */
    LocalDateTime activityWindowStart;
    LocalDateTime activityWindowEnd;

    @Builder.Default
    int minDistributionSamples = AppConfig.MIN_DISTRIBUTION_SAMPLES;

    @Builder.Default
    double distributionTolerance = AppConfig.DISTRIBUTION_TOLERANCE;

    @Builder.Default
    int sampleLimit = AppConfig.SAMPLE_LIMIT;

    public CountRange countFor(EntityKind kind) {
        return counts == null ? null : counts.get(kind);
    }

    /**
     * Peak share the activity profile predicts for the activity window.
     *
     * @return NaN when the window is empty
     */
    public double expectedPeakShare() {
        if (activityWindowStart == null || activityWindowEnd == null) {
            return activityProfile.expectedPeakShare();
        }
        return activityProfile.expectedPeakShare(activityWindowStart, activityWindowEnd);
    }

    /** Expectations from the config that generated the dataset. */
    public static VerificationExpectations forConfig(ScaleConfig config) {
        return config.getMode() == DatasetMode.DETERMINISTIC ? forFixtures(config) : forScale(config);
    }

    /**
     * Exact counts taken from the fixture files.
     */
    public static VerificationExpectations forFixtures(ScaleConfig config) {
        UserFixture[] users = JsonSupport.read(config.getUsersFixture(), UserFixture[].class);
        ConversationsFixture conversations = JsonSupport.read(config.getConversationsFixture(), ConversationsFixture.class);

        long memberships = 0;
        long messages = 0;
        for (ConversationFixture conversation : conversations.getConversations()) {
            memberships += conversation.getParticipants().size();
            messages += conversation.getMessages().size();
        }

        Map<EntityKind, CountRange> counts = new EnumMap<>(EntityKind.class);
        counts.put(EntityKind.USER, CountRange.exactly(users.length));
        counts.put(EntityKind.CHAT, CountRange.exactly(conversations.getConversations().size()));
        counts.put(EntityKind.MEMBERSHIP, CountRange.exactly(memberships));
        counts.put(EntityKind.MESSAGE, CountRange.exactly(messages));

        return VerificationExpectations.builder()
                .counts(Collections.unmodifiableMap(counts))
                .minGroupMembers(2)
                .build();
    }

    /**
     * Users and messages are exact. Direct chat sampling may fall short, so chats and memberships are ranges.
     */
    public static VerificationExpectations forScale(ScaleConfig config) {
        if (config.getMode() != DatasetMode.SCALE) {
            throw new ConfigurationException("scale expectations need a SCALE config");
        }
        long groups = config.getGroupChatCount();
        long directs = config.getDirectChatCount();
        long groupSizeMax = Math.min(config.getMaxGroupMembers(), config.getUserCount());

        Map<EntityKind, CountRange> counts = new EnumMap<>(EntityKind.class);
        counts.put(EntityKind.USER, CountRange.exactly(config.getUserCount()));
        counts.put(EntityKind.CHAT, CountRange.between(groups + directs / 2, groups + directs));
        counts.put(EntityKind.MEMBERSHIP, CountRange.between(
                groups * config.getMinGroupMembers() + 2 * (directs / 2),
                groups * groupSizeMax + 2 * directs));
        counts.put(EntityKind.MESSAGE, CountRange.exactly(config.getMessageCount()));

        // same window the generator samples message times from
        LocalDateTime reference = config.parsedReferenceTime();
        if (reference == null) {
            reference = LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS);
        }

        return VerificationExpectations.builder()
                .counts(Collections.unmodifiableMap(counts))
                .minGroupMembers(config.getMinGroupMembers())
                .activityProfile(config.activityProfile())
                .activityWindowStart(reference.minusDays(config.getHistoryDays()))
                .activityWindowEnd(reference)
                .build();
    }

    /** Structural checks only: no count ranges and no distribution test. */
    public static VerificationExpectations structural() {
        return VerificationExpectations.builder().counts(Map.of()).build();
    }
}
