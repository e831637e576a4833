package verifier;

import lombok.Value;

import java.util.List;

/**
 * Result of one store probe: how many offending rows exist, with a capped sample of their identifiers.
 */
@Value
public class Findings {

    private static final Findings NONE = new Findings(0, List.of());

    long count;
    List<String> sample;

    public static Findings none() {
        return NONE;
    }

    public static Findings of(long count, List<String> sample) {
        return count == 0 ? NONE : new Findings(count, List.copyOf(sample));
    }

    public boolean isEmpty() {
        return count == 0;
    }
}
