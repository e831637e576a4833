package verifier.checks;

import dao.InMemoryDatasetStore;
import org.junit.jupiter.api.Test;
import verifier.CheckResult;
import verifier.CheckStatus;
import verifier.VerificationExpectations;

import static dao.DatasetFixtures.direct;
import static dao.DatasetFixtures.group;
import static dao.DatasetFixtures.member;
import static dao.DatasetFixtures.smallStore;
import static org.assertj.core.api.Assertions.assertThat;

class CardinalityCheckTest {

    private final CardinalityCheck check = new CardinalityCheck();

    @Test
    void cleanDatasetPasses() {
        CheckResult result = check.run(smallStore(), VerificationExpectations.structural());

        assertThat(result.getStatus()).isEqualTo(CheckStatus.PASS);
        assertThat(result.getSummary()).isEqualTo("1 direct chats with 2 members, 1 group chats with >= 2");
    }

    @Test
    void flagsWrongMemberCounts() {
        InMemoryDatasetStore store = smallStore();
        store.insertRaw(direct("d2", "u1", "u3"));
        store.insertRaw(member("m6", "d2", "u1"));
        store.insertRaw(member("m7", "d1", "u3"));
        store.insertRaw(group("g2", "Lonely"));
        store.insertRaw(member("m8", "g2", "u1"));

        CheckResult result = check.run(store, VerificationExpectations.structural());

        assertThat(result.getStatus()).isEqualTo(CheckStatus.FAIL);
        assertThat(result.getOffenders()).containsExactly("d1", "d2", "g2");
        assertThat(result.getDetails()).contains("d1: direct chat with 3 members", "g2: group chat with 1 members (min 2)");
    }

    @Test
    void usesTheConfiguredMinimumGroupSize() {
        VerificationExpectations expectations = VerificationExpectations.structural().toBuilder()
                .minGroupMembers(4)
                .build();

        assertThat(check.run(smallStore(), expectations).getOffenders()).containsExactly("g1");
    }
}
