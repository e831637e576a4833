package verifier;

/**
 * One independently reportable property of a stored dataset.
 * Implementations only read through the {@link SnapshotReader}.
 */
public interface VerificationCheck {

    String name();

    CheckResult run(SnapshotReader reader, VerificationExpectations expectations);
}
