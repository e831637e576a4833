package verifier;

import lombok.Value;

/**
 * Inclusive range of acceptable row counts.
 */
@Value
public class CountRange {

    long min;
    long max;

    public static CountRange exactly(long count) {
        return new CountRange(count, count);
    }

    public static CountRange between(long min, long max) {
        return new CountRange(Math.min(min, max), Math.max(min, max));
    }

    public boolean contains(long value) {
        return value >= min && value <= max;
    }

    @Override
    public String toString() {
        return min == max ? String.valueOf(min) : "[" + min + ".." + max + "]";
    }
}
