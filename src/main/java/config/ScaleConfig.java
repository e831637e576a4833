package config;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Generation parameters. Loaded from JSON by {@link ConfigLoader}, defaults follow the large population run.
 */
@Data
@NoArgsConstructor
public class ScaleConfig {

    private DatasetMode mode = DatasetMode.SCALE;

    /** Null picks HASHED for deterministic runs and SEEDED for scale runs. */
    private IdentityMode identityMode;

    private Long seed;

    // Volume
    private int userCount = 200;
    private int groupChatCount = 75;
    private int directChatCount = 300;
    private int messageCount = 25000;
    private int historyDays = 120;
    private int batchSize = 1000;

    // Chats
    private int minGroupMembers = 3;
    private int maxGroupMembers = 15;
    private double activeUserRatio = 0.7;
    private double adminPromotionChance = 0.1;

    // Ages, counted back from the reference time
    private int maxUserAgeDays = 180;
    private int maxGroupChatAgeDays = 120;
    private int maxDirectChatAgeDays = 90;
    private int maxJoinDelayMinutes = 60;

    // Activity weighting
    private int businessHourStart = 9;
    private int businessHourEnd = 18;
    private double businessHoursRatio = 0.7;
    private double weekendWeight = 0.4;

    // Credentials
    private int passwordRounds = 10;
    private String defaultPassword = "password123";

    /** ISO local date-time, e.g. 2025-01-06T10:00:00. */
    private String referenceTime;

    private boolean pipelined = false;

    // Fixtures (classpath resource or file path)
    private String usersFixture = "fixtures/users.json";
    private String conversationsFixture = "fixtures/conversations.json";

    public static ScaleConfig deterministic() {
        ScaleConfig config = new ScaleConfig();
        config.setMode(DatasetMode.DETERMINISTIC);
        return config;
    }

    public static ScaleConfig scale() {
        return new ScaleConfig();
    }

    public IdentityMode resolvedIdentityMode() {
        if (identityMode != null) return identityMode;
        return mode == DatasetMode.DETERMINISTIC ? IdentityMode.HASHED : IdentityMode.SEEDED;
    }

    /** Null when no reference time is configured. */
    public LocalDateTime parsedReferenceTime() {
        if (referenceTime == null || referenceTime.isBlank()) return null;
        return LocalDateTime.parse(referenceTime.trim());
    }

    public ActivityProfile activityProfile() {
        return new ActivityProfile(businessHourStart, businessHourEnd, businessHoursRatio, weekendWeight);
    }

    /**
     * Checks every rule and reports all violations at once.
     *
     * @throws ConfigurationException if any rule is violated
     */
    public void validate() {
        List<String> problems = new ArrayList<>();

        if (mode == null) problems.add("mode is required");
        if (batchSize < 1) problems.add("batchSize must be >= 1, was " + batchSize);
        if (passwordRounds < 4 || passwordRounds > 31) {
            problems.add("passwordRounds must be within 4..31, was " + passwordRounds);
        }
        if (defaultPassword == null || defaultPassword.isEmpty()) problems.add("defaultPassword is required");

        if (referenceTime != null && !referenceTime.isBlank()) {
            try {
                LocalDateTime.parse(referenceTime.trim());
            } catch (DateTimeParseException e) {
                problems.add("referenceTime is not an ISO local date-time: " + referenceTime);
            }
        }

        if (mode == DatasetMode.DETERMINISTIC) {
            if (usersFixture == null || conversationsFixture == null) {
                problems.add("deterministic mode needs usersFixture and conversationsFixture");
            }
        } else {
            validateScale(problems);
        }

        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
    }

    private void validateScale(List<String> problems) {
        if (userCount < 0) problems.add("userCount must be >= 0");
        if (groupChatCount < 0) problems.add("groupChatCount must be >= 0");
        if (directChatCount < 0) problems.add("directChatCount must be >= 0");
        if (messageCount < 0) problems.add("messageCount must be >= 0");
        if (historyDays < 1) problems.add("historyDays must be >= 1");

        if (minGroupMembers < 2) problems.add("minGroupMembers must be >= 2, was " + minGroupMembers);
        if (maxGroupMembers < minGroupMembers) {
            problems.add("maxGroupMembers (" + maxGroupMembers + ") must be >= minGroupMembers (" + minGroupMembers + ")");
        }
        if (groupChatCount > 0 && userCount < minGroupMembers) {
            problems.add("userCount (" + userCount + ") is below minGroupMembers (" + minGroupMembers + ")");
        }

        long possiblePairs = (long) userCount * (userCount - 1) / 2;
        if (directChatCount > possiblePairs) {
            problems.add("directChatCount (" + directChatCount + ") exceeds the " + possiblePairs + " possible user pairs");
        }
        if (messageCount > 0 && groupChatCount + directChatCount == 0) {
            problems.add("messageCount > 0 needs at least one chat");
        }

        if (!isRatio(activeUserRatio)) problems.add("activeUserRatio must be within [0,1]");
        if (!isRatio(adminPromotionChance)) problems.add("adminPromotionChance must be within [0,1]");
        if (!isRatio(businessHoursRatio)) problems.add("businessHoursRatio must be within [0,1]");
        if (weekendWeight < 0 || weekendWeight > 1) problems.add("weekendWeight must be within [0,1]");
        if (businessHourStart < 0 || businessHourEnd > 24 || businessHourStart >= businessHourEnd) {
            problems.add("business hours must satisfy 0 <= start < end <= 24");
        }

        if (maxUserAgeDays < 1 || maxGroupChatAgeDays < 1 || maxDirectChatAgeDays < 1) {
            problems.add("maximum ages must be >= 1 day");
        }
        if (maxJoinDelayMinutes < 0) problems.add("maxJoinDelayMinutes must be >= 0");
    }

    private static boolean isRatio(double value) {
        return value >= 0.0 && value <= 1.0;
    }
}
