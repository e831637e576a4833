package verifier.checks;

import config.ActivityProfile;
import verifier.CheckResult;
import verifier.CheckStatus;
import verifier.SnapshotReader;
import verifier.VerificationCheck;
import verifier.VerificationExpectations;

/**
 * No message predates its chat. With an activity profile, the share of messages sent in
 * weekday business hours must also be close to what the profile predicts.
 */
public class TemporalCheck implements VerificationCheck {

    public static final String NAME = "temporal";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CheckResult run(SnapshotReader reader, VerificationExpectations expectations) {
        int limit = expectations.getSampleLimit();
        ActivityProfile profile = expectations.getActivityProfile();
        CheckResult.CheckResultBuilder result = CheckResult.builder().check(NAME);
        long[] counts = new long[3]; // messages, out of order, peak

        reader.forEachMessageTiming(message -> {
            counts[0]++;
            if (message.getChatCreatedAt() != null && message.getSentAt() != null
                    && message.getSentAt().isBefore(message.getChatCreatedAt())) {
                if (counts[1]++ < limit) {
                    result.offender(message.getMessageId());
                }
            }
            if (profile != null && message.getSentAt() != null && profile.isPeak(message.getSentAt())) {
                counts[2]++;
            }
        });

        long messages = counts[0];
        if (counts[1] > 0) {
            return result.status(CheckStatus.FAIL)
                    .summary(counts[1] + " message(s) sent before their chat was created")
                    .build();
        }
        if (messages == 0) {
            return result.status(CheckStatus.INCONCLUSIVE).summary("no messages to evaluate").build();
        }
        if (profile == null) {
            return result.status(CheckStatus.PASS)
                    .summary(messages + " messages, none before their chat")
                    .build();
        }

        double expected = expectations.expectedPeakShare();
        if (Double.isNaN(expected)) {
            return result.status(CheckStatus.INCONCLUSIVE)
                    .summary(messages + " messages ordered, activity window too short to judge the distribution")
                    .build();
        }
        double observed = (double) counts[2] / messages;
        result.detail(String.format("weekday business-hour share %.3f, expected %.3f (uniform %.3f)",
                observed, expected, profile.uniformPeakShare()));

        if (messages < expectations.getMinDistributionSamples()) {
            return result.status(CheckStatus.INCONCLUSIVE)
                    .summary(messages + " messages, at least " + expectations.getMinDistributionSamples()
                            + " needed to judge the activity distribution")
                    .build();
        }
        if (Math.abs(observed - expected) > expectations.getDistributionTolerance()) {
            return result.status(CheckStatus.FAIL)
                    .summary(String.format("peak share %.3f deviates from %.3f by more than %.2f",
                            observed, expected, expectations.getDistributionTolerance()))
                    .build();
        }
        return result.status(CheckStatus.PASS)
                .summary(String.format("%d messages ordered, peak share %.3f within %.2f of %.3f",
                        messages, observed, expectations.getDistributionTolerance(), expected))
                .build();
    }
}
