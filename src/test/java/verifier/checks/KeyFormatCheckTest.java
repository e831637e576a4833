package verifier.checks;

import dao.InMemoryDatasetStore;
import model.Chat;
import model.Message;
import org.junit.jupiter.api.Test;
import verifier.CheckResult;
import verifier.CheckStatus;
import verifier.VerificationExpectations;

import static dao.DatasetFixtures.T0;
import static dao.DatasetFixtures.member;
import static dao.DatasetFixtures.smallStore;
import static dao.DatasetFixtures.user;
import static org.assertj.core.api.Assertions.assertThat;

class KeyFormatCheckTest {

    private final KeyFormatCheck check = new KeyFormatCheck();

    @Test
    void cleanDatasetPasses() {
        assertThat(check.run(smallStore(), VerificationExpectations.structural()).getStatus())
                .isEqualTo(CheckStatus.PASS);
    }

    @Test
    void flagsKeysThatDoNotMatchTheMembers() {
        InMemoryDatasetStore store = smallStore();
        store.insertRaw(Chat.builder().id("d2").type(Chat.ChatType.direct).dmKey("u1::u2").createdAt(T0).build());
        store.insertRaw(member("m6", "d2", "u1"));
        store.insertRaw(member("m7", "d2", "u3"));
        store.insertRaw(Chat.builder().id("d3").type(Chat.ChatType.direct).dmKey("u3::u1").createdAt(T0).build());
        store.insertRaw(Chat.builder().id("g2").type(Chat.ChatType.group).topic("x").dmKey("u1::u3").createdAt(T0).build());

        CheckResult result = check.run(store, VerificationExpectations.structural());

        assertThat(result.getStatus()).isEqualTo(CheckStatus.FAIL);
        assertThat(result.getDetails()).containsExactly(
                "d2: direct chat key does not match its members",
                "d3: malformed direct chat key 'u3::u1'",
                "g2: group chat with a direct chat key");
    }

    @Test
    void flagsHandlesAndBlankBodies() {
        InMemoryDatasetStore store = smallStore();
        store.insertRaw(user("u9", "Mallory"));
        store.insertRaw(Message.builder().id("x9").chatId("g1").senderId("u1").content("  ").sentAt(T0).build());

        CheckResult result = check.run(store, VerificationExpectations.structural());

        assertThat(result.getStatus()).isEqualTo(CheckStatus.FAIL);
        assertThat(result.getSummary()).isEqualTo("2 formatting violation(s)");
        assertThat(result.getOffenders()).containsExactly("u9", "x9");
    }
}
