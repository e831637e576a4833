package verifier.checks;

import verifier.CheckResult;
import verifier.CheckStatus;
import verifier.Findings;

/**
 * Folds several probe findings into one check result.
 */
class FindingsCollector {

    private final String check;
    private final int sampleLimit;
    private final CheckResult.CheckResultBuilder result;
    private long violations;
    private int sampled;

    FindingsCollector(String check, int sampleLimit) {
        this.check = check;
        this.sampleLimit = sampleLimit;
        this.result = CheckResult.builder().check(check);
    }

    FindingsCollector add(String label, Findings findings) {
        if (findings.isEmpty()) {
            return this;
        }
        violations += findings.getCount();
        result.detail(label + ": " + findings.getCount());
        for (String id : findings.getSample()) {
            if (sampled >= sampleLimit) break;
            result.offender(id);
            sampled++;
        }
        return this;
    }

    CheckResult build(String passSummary) {
        if (violations == 0) {
            return result.status(CheckStatus.PASS).summary(passSummary).build();
        }
        return result.status(CheckStatus.FAIL)
                .summary(violations + " violation(s) found by " + check)
                .build();
    }
}
