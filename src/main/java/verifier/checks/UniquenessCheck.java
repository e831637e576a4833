package verifier.checks;

import model.EntityKind;
import verifier.CheckResult;
import verifier.SnapshotReader;
import verifier.VerificationCheck;
import verifier.VerificationExpectations;

/**
 * Duplicate identifiers, handles (ignoring case), membership pairs and direct chat keys.
 */
public class UniquenessCheck implements VerificationCheck {

    public static final String NAME = "uniqueness";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CheckResult run(SnapshotReader reader, VerificationExpectations expectations) {
        int limit = expectations.getSampleLimit();
        FindingsCollector collector = new FindingsCollector(NAME, limit);
        for (EntityKind kind : EntityKind.values()) {
            collector.add("duplicate " + kind.label() + " ids", reader.duplicateIds(kind, limit));
        }
        return collector
                .add("duplicate handles", reader.duplicateHandles(limit))
                .add("duplicate memberships", reader.duplicateMembershipPairs(limit))
                .add("duplicate direct chat keys", reader.duplicateDirectChatKeys(limit))
                .build("no duplicates");
    }
}
