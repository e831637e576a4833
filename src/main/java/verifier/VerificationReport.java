package verifier;

import lombok.Value;
import util.JsonSupport;

import java.util.List;
import java.util.stream.Collectors;

/**
 * All check results of one verification pass and their aggregate.
 */
@Value
public class VerificationReport {

    CheckStatus overall;
    List<CheckResult> results;
    long durationMs;

    public static VerificationReport of(List<CheckResult> results, long durationMs) {
        boolean failed = results.stream().anyMatch(CheckResult::isFailed);
        return new VerificationReport(failed ? CheckStatus.FAIL : CheckStatus.PASS, List.copyOf(results), durationMs);
    }

    public boolean isPassed() {
        return overall == CheckStatus.PASS;
    }

    public CheckResult result(String check) {
        return results.stream().filter(r -> r.getCheck().equals(check)).findFirst().orElse(null);
    }

    public List<String> inconclusiveChecks() {
        return results.stream()
                .filter(r -> r.getStatus() == CheckStatus.INCONCLUSIVE)
                .map(CheckResult::getCheck)
                .collect(Collectors.toList());
    }

    public String toJson() {
        return JsonSupport.toJson(this);
    }

    public String toText() {
        StringBuilder sb = new StringBuilder("Verification ").append(overall)
                .append(" (").append(durationMs).append(" ms)\n");
        for (CheckResult result : results) {
            sb.append(String.format("  [%-12s] %-22s %s%n", result.getStatus(), result.getCheck(), result.getSummary()));
            for (String detail : result.getDetails()) {
                sb.append("      ").append(detail).append('\n');
            }
            if (!result.getOffenders().isEmpty()) {
                sb.append("      offending: ").append(String.join(", ", result.getOffenders())).append('\n');
            }
        }
        List<String> inconclusive = inconclusiveChecks();
        if (!inconclusive.isEmpty()) {
            sb.append("  Inconclusive: ").append(String.join(", ", inconclusive)).append('\n');
        }
        return sb.toString();
    }
}
