package verifier;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one verification check. Offending identifiers are capped at the sample limit.
 */
@Value
@Builder
public class CheckResult {

    String check;
    CheckStatus status;
    String summary;

    @Singular
    List<String> details;

    @Singular("offender")
    List<String> offenders;

    public static CheckResult pass(String check, String summary) {
        return CheckResult.builder().check(check).status(CheckStatus.PASS).summary(summary).build();
    }

    public static CheckResult inconclusive(String check, String summary) {
        return CheckResult.builder().check(check).status(CheckStatus.INCONCLUSIVE).summary(summary).build();
    }

    public boolean isFailed() {
        return status == CheckStatus.FAIL;
    }
}
