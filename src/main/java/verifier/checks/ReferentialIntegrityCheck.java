package verifier.checks;

import verifier.CheckResult;
import verifier.SnapshotReader;
import verifier.VerificationCheck;
import verifier.VerificationExpectations;

/**
 * Every membership and message points at existing rows, and every message comes from a member
 * who had joined by the time it was sent.
 */
public class ReferentialIntegrityCheck implements VerificationCheck {

    public static final String NAME = "referential-integrity";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CheckResult run(SnapshotReader reader, VerificationExpectations expectations) {
        int limit = expectations.getSampleLimit();
        return new FindingsCollector(NAME, limit)
                .add("memberships with a missing chat or user", reader.orphanMemberships(limit))
                .add("messages with a missing chat or sender", reader.orphanMessages(limit))
                .add("messages from non-members", reader.messagesFromNonMembers(limit))
                .build("all references resolve");
    }
}
