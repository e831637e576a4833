package verifier.checks;

import verifier.CheckResult;
import verifier.CheckStatus;
import verifier.SnapshotReader;
import verifier.VerificationCheck;
import verifier.VerificationExpectations;

/**
 * Direct chats have exactly two members, group chats at least the minimum group size.
 */
public class CardinalityCheck implements VerificationCheck {

    public static final String NAME = "cardinality";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CheckResult run(SnapshotReader reader, VerificationExpectations expectations) {
        int limit = expectations.getSampleLimit();
        int minGroup = expectations.getMinGroupMembers();
        CheckResult.CheckResultBuilder result = CheckResult.builder().check(NAME);
        long[] counts = new long[3]; // direct, group, violations
        long[] sampled = {0};

        reader.forEachChatSummary(chat -> {
            String problem = null;
            if (chat.isDirect()) {
                counts[0]++;
                if (chat.getMemberCount() != 2) {
                    problem = "direct chat with " + chat.getMemberCount() + " members";
                }
            } else if (chat.isGroup()) {
                counts[1]++;
                if (chat.getMemberCount() < minGroup) {
                    problem = "group chat with " + chat.getMemberCount() + " members (min " + minGroup + ")";
                }
            } else {
                problem = "unknown chat type " + chat.getType();
            }
            if (problem != null) {
                counts[2]++;
                if (sampled[0]++ < limit) {
                    result.offender(chat.getChatId());
                    result.detail(chat.getChatId() + ": " + problem);
                }
            }
        });

        if (counts[2] > 0) {
            return result.status(CheckStatus.FAIL)
                    .summary(counts[2] + " chat(s) with the wrong number of members")
                    .build();
        }
        return result.status(CheckStatus.PASS)
                .summary(counts[0] + " direct chats with 2 members, " + counts[1] + " group chats with >= " + minGroup)
                .build();
    }
}
