package verifier.checks;

import dao.InMemoryDatasetStore;
import org.junit.jupiter.api.Test;
import verifier.CheckResult;
import verifier.CheckStatus;
import verifier.VerificationExpectations;

import static dao.DatasetFixtures.direct;
import static dao.DatasetFixtures.member;
import static dao.DatasetFixtures.smallStore;
import static dao.DatasetFixtures.user;
import static org.assertj.core.api.Assertions.assertThat;

class UniquenessCheckTest {

    private final UniquenessCheck check = new UniquenessCheck();

    @Test
    void cleanDatasetPasses() {
        assertThat(check.run(smallStore(), VerificationExpectations.structural()).getStatus())
                .isEqualTo(CheckStatus.PASS);
    }

    @Test
    void reportsEveryKindOfDuplicate() {
        InMemoryDatasetStore store = smallStore();
        store.insertRaw(user("u1", "someone"));
        store.insertRaw(user("u9", "ALICE"));
        store.insertRaw(member("m9", "g1", "u1"));
        store.insertRaw(direct("d9", "u2", "u1"));

        CheckResult result = check.run(store, VerificationExpectations.structural());

        assertThat(result.getStatus()).isEqualTo(CheckStatus.FAIL);
        assertThat(result.getDetails()).containsExactly(
                "duplicate users ids: 1",
                "duplicate handles: 1",
                "duplicate memberships: 1",
                "duplicate direct chat keys: 1");
        assertThat(result.getOffenders()).contains("u1", "alice", "g1/u1");
    }

    @Test
    void offendersAreCappedAtTheSampleLimit() {
        InMemoryDatasetStore store = smallStore();
        for (int i = 0; i < 5; i++) {
            store.insertRaw(user("dup" + i, "dup" + i));
            store.insertRaw(user("dup" + i, "other" + i));
        }

        CheckResult result = check.run(store, VerificationExpectations.structural().toBuilder().sampleLimit(2).build());

        assertThat(result.getSummary()).startsWith("5 violation(s)");
        assertThat(result.getOffenders()).hasSize(2);
    }
}
