package verifier.checks;

import model.EntityKind;
import verifier.CheckResult;
import verifier.CheckStatus;
import verifier.CountRange;
import verifier.SnapshotReader;
import verifier.VerificationCheck;
import verifier.VerificationExpectations;

/**
 * Row counts per entity kind against the expected ranges.
 */
public class RowCountCheck implements VerificationCheck {

    public static final String NAME = "row-counts";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CheckResult run(SnapshotReader reader, VerificationExpectations expectations) {
        CheckResult.CheckResultBuilder result = CheckResult.builder().check(NAME);
        boolean failed = false;
        StringBuilder summary = new StringBuilder();

        for (EntityKind kind : EntityKind.values()) {
            long count = reader.count(kind);
            CountRange expected = expectations.countFor(kind);
            if (summary.length() > 0) summary.append(", ");
            summary.append(kind.label()).append('=').append(count);

            if (expected == null) {
                continue;
            }
            if (expected.contains(count)) {
                result.detail(kind.label() + ": " + count + " (expected " + expected + ")");
            } else {
                failed = true;
                result.detail(kind.label() + ": " + count + " outside expected " + expected);
            }
        }

        return result.status(failed ? CheckStatus.FAIL : CheckStatus.PASS)
                .summary(summary.toString())
                .build();
    }
}
