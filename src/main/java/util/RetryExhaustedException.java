package util;

/**
 * A unit of work that kept failing until the retry policy gave up.
 */
public class RetryExhaustedException extends RuntimeException {

    private final String unit;
    private final int attempts;

    public RetryExhaustedException(String unit, int attempts, Throwable lastCause) {
        super(unit + " failed after " + attempts + " attempt(s): " + describe(lastCause), lastCause);
        this.unit = unit;
        this.attempts = attempts;
    }

    public String getUnit() {
        return unit;
    }

    public int getAttempts() {
        return attempts;
    }

    private static String describe(Throwable cause) {
        if (cause == null) return "unknown cause";
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
