package verifier;

import dao.StoreException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import util.RetryExhaustedException;
import util.RetryPolicy;
import verifier.checks.CardinalityCheck;
import verifier.checks.KeyFormatCheck;
import verifier.checks.ReferentialIntegrityCheck;
import verifier.checks.RowCountCheck;
import verifier.checks.TemporalCheck;
import verifier.checks.UniquenessCheck;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs every verification check against a snapshot. A check that cannot complete is
 * reported as failed with its cause; it never stops the remaining checks.
 */
public class Verifier {

    private static final Logger logger = LogManager.getLogger(Verifier.class);

    private final List<VerificationCheck> checks;
    private final RetryPolicy retryPolicy;

    public Verifier(RetryPolicy retryPolicy) {
        this(defaultChecks(), retryPolicy);
    }

    public Verifier(List<VerificationCheck> checks, RetryPolicy retryPolicy) {
        this.checks = List.copyOf(checks);
        this.retryPolicy = retryPolicy;
    }

    public static List<VerificationCheck> defaultChecks() {
        return List.of(
                new RowCountCheck(),
                new UniquenessCheck(),
                new ReferentialIntegrityCheck(),
                new CardinalityCheck(),
                new KeyFormatCheck(),
                new TemporalCheck());
    }

    public VerificationReport verify(SnapshotReader reader, VerificationExpectations expectations) {
        long start = System.currentTimeMillis();
        List<CheckResult> results = new ArrayList<>();

        for (VerificationCheck check : checks) {
            CheckResult result;
            try {
                result = retryPolicy.execute("check " + check.name(), () -> check.run(reader, expectations));
            } catch (RetryExhaustedException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                logger.error("Check {} could not complete: {}", check.name(), cause.getMessage());
                result = CheckResult.builder()
                        .check(check.name())
                        .status(CheckStatus.FAIL)
                        .summary("check could not complete: " + cause.getMessage())
                        .detail(e.getMessage())
                        .build();
            }
            logger.info("{}: {} - {}", check.name(), result.getStatus(), result.getSummary());
            results.add(result);
        }

        VerificationReport report = VerificationReport.of(results, System.currentTimeMillis() - start);
        logger.info("Verification {}", report.getOverall());
        return report;
    }

    /** Retries connectivity and timeout failures only, a constraint error will not go away on a read. */
    public static boolean isTransientReadFailure(Throwable e) {
        if (!(e instanceof StoreException)) return false;
        StoreException.Kind kind = ((StoreException) e).getKind();
        return kind == StoreException.Kind.CONNECTIVITY || kind == StoreException.Kind.TIMEOUT;
    }
}
