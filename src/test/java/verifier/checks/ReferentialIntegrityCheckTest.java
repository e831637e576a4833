package verifier.checks;

import dao.InMemoryDatasetStore;
import org.junit.jupiter.api.Test;
import verifier.CheckResult;
import verifier.CheckStatus;
import verifier.VerificationExpectations;

import static dao.DatasetFixtures.T0;
import static dao.DatasetFixtures.member;
import static dao.DatasetFixtures.message;
import static dao.DatasetFixtures.smallStore;
import static org.assertj.core.api.Assertions.assertThat;

class ReferentialIntegrityCheckTest {

    private final ReferentialIntegrityCheck check = new ReferentialIntegrityCheck();

    @Test
    void cleanDatasetPasses() {
        CheckResult result = check.run(smallStore(), VerificationExpectations.structural());

        assertThat(result.getStatus()).isEqualTo(CheckStatus.PASS);
        assertThat(result.getSummary()).isEqualTo("all references resolve");
    }

    @Test
    void reportsOrphansAndNonMemberSenders() {
        InMemoryDatasetStore store = smallStore();
        store.insertRaw(member("m-orphan", "no-such-chat", "u1"));
        store.insertRaw(message("x-orphan", "g1", "no-such-user", T0));
        store.insertRaw(message("x-outsider", "d1", "u3", T0));

        CheckResult result = check.run(store, VerificationExpectations.structural());

        assertThat(result.getStatus()).isEqualTo(CheckStatus.FAIL);
        assertThat(result.getDetails()).containsExactly(
                "memberships with a missing chat or user: 1",
                "messages with a missing chat or sender: 1",
                "messages from non-members: 2");
        assertThat(result.getOffenders()).containsExactly("m-orphan", "x-orphan", "x-orphan", "x-outsider");
    }
}
