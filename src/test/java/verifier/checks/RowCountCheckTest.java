package verifier.checks;

import dao.DatasetFixtures;
import model.EntityKind;
import org.junit.jupiter.api.Test;
import verifier.CheckResult;
import verifier.CheckStatus;
import verifier.CountRange;
import verifier.VerificationExpectations;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RowCountCheckTest {

    private final RowCountCheck check = new RowCountCheck();

    @Test
    void passesInsideTheRanges() {
        VerificationExpectations expectations = VerificationExpectations.builder()
                .counts(Map.of(EntityKind.USER, CountRange.exactly(3), EntityKind.MESSAGE, CountRange.between(1, 5)))
                .build();

        CheckResult result = check.run(DatasetFixtures.smallStore(), expectations);

        assertThat(result.getStatus()).isEqualTo(CheckStatus.PASS);
        assertThat(result.getSummary()).isEqualTo("users=3, chats=2, memberships=5, messages=3");
    }

    @Test
    void failsOutsideARange() {
        VerificationExpectations expectations = VerificationExpectations.builder()
                .counts(Map.of(EntityKind.CHAT, CountRange.between(4, 6)))
                .build();

        CheckResult result = check.run(DatasetFixtures.smallStore(), expectations);

        assertThat(result.getStatus()).isEqualTo(CheckStatus.FAIL);
        assertThat(result.getDetails()).containsExactly("chats: 2 outside expected [4..6]");
    }

    @Test
    void structuralExpectationsOnlyReport() {
        CheckResult result = check.run(DatasetFixtures.smallStore(), VerificationExpectations.structural());

        assertThat(result.getStatus()).isEqualTo(CheckStatus.PASS);
        assertThat(result.getDetails()).isEmpty();
    }
}
