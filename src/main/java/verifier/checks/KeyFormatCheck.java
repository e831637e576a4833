package verifier.checks;

import model.DirectChatKey;
import verifier.CheckResult;
import verifier.CheckStatus;
import verifier.Findings;
import verifier.SnapshotReader;
import verifier.VerificationCheck;
import verifier.VerificationExpectations;

/**
 * Direct chats carry the canonical key of their two members, groups carry none.
 * Also flags empty or mixed-case handles and blank message bodies.
 */
public class KeyFormatCheck implements VerificationCheck {

    public static final String NAME = "key-format";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CheckResult run(SnapshotReader reader, VerificationExpectations expectations) {
        int limit = expectations.getSampleLimit();
        CheckResult.CheckResultBuilder result = CheckResult.builder().check(NAME);
        long[] violations = {0};
        long[] sampled = {0};

        reader.forEachChatSummary(chat -> {
            String problem = null;
            if (chat.isDirect()) {
                if (!DirectChatKey.isWellFormed(chat.getDmKey())) {
                    problem = "malformed direct chat key '" + chat.getDmKey() + "'";
                } else if (chat.getMemberCount() == 2 && chat.getMinMemberId() != null
                        && !chat.getMinMemberId().equals(chat.getMaxMemberId())
                        && !DirectChatKey.keyOf(chat.getMinMemberId(), chat.getMaxMemberId()).equals(chat.getDmKey())) {
                    problem = "direct chat key does not match its members";
                }
            } else if (chat.isGroup() && chat.getDmKey() != null) {
                problem = "group chat with a direct chat key";
            }
            if (problem != null) {
                violations[0]++;
                if (sampled[0]++ < limit) {
                    result.offender(chat.getChatId());
                    result.detail(chat.getChatId() + ": " + problem);
                }
            }
        });

        Findings handles = reader.malformedHandles(limit);
        Findings bodies = reader.emptyMessages(limit);
        for (Findings findings : new Findings[]{handles, bodies}) {
            for (String id : findings.getSample()) {
                if (sampled[0]++ < limit) result.offender(id);
            }
        }
        if (!handles.isEmpty()) result.detail("empty or non-lowercase handles: " + handles.getCount());
        if (!bodies.isEmpty()) result.detail("blank message bodies: " + bodies.getCount());

        long total = violations[0] + handles.getCount() + bodies.getCount();
        if (total > 0) {
            return result.status(CheckStatus.FAIL).summary(total + " formatting violation(s)").build();
        }
        return result.status(CheckStatus.PASS).summary("keys, handles and bodies well formed").build();
    }
}
