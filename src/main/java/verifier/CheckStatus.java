package verifier;

public enum CheckStatus {
    PASS,
    FAIL,
    /** Not enough data to decide. Does not fail the verification. */
    INCONCLUSIVE
}
