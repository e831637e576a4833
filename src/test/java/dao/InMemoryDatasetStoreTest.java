package dao;

import model.EntityKind;
import model.Identified;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dao.DatasetFixtures.T0;
import static dao.DatasetFixtures.direct;
import static dao.DatasetFixtures.member;
import static dao.DatasetFixtures.message;
import static dao.DatasetFixtures.user;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryDatasetStoreTest {

    private final InMemoryDatasetStore store = new InMemoryDatasetStore();

    private static Batch batch(int index, Identified... entities) {
        return new Batch(index, List.of(entities));
    }

    @Test
    void writesParentsAndChildrenInOneBatch() {
        BatchOutcome outcome = store.write(batch(0,
                user("u1", "alice"), user("u2", "bob"),
                direct("c1", "u1", "u2"),
                member("m1", "c1", "u1"), member("m2", "c1", "u2"),
                message("x1", "c1", "u1", T0)), WriteMode.INSERT);

        assertThat(outcome.insertedTotal()).isEqualTo(6);
        assertThat(outcome.inserted(EntityKind.MEMBERSHIP)).isEqualTo(2);
        assertThat(store.count(EntityKind.MESSAGE)).isEqualTo(1);
    }

    @Test
    void failedBatchLeavesNothingBehind() {
        store.write(batch(0, user("u1", "alice")), WriteMode.INSERT);

        assertThatThrownBy(() -> store.write(batch(1, user("u2", "bob"), user("u3", "ALICE")), WriteMode.INSERT))
                .isInstanceOf(StoreException.class)
                .hasMessageContaining("duplicate username")
                .satisfies(e -> {
                    assertThat(((StoreException) e).getKind()).isEqualTo(StoreException.Kind.CONSTRAINT_VIOLATION);
                    assertThat(((StoreException) e).getOffendingRows()).containsExactly("users/u3");
                });

        assertThat(store.users()).extracting("username").containsExactly("alice");
    }

    @Test
    void rejectsMissingReferences() {
        store.write(batch(0, user("u1", "alice")), WriteMode.INSERT);

        assertThatThrownBy(() -> store.write(batch(1, member("m1", "missing-chat", "u1")), WriteMode.INSERT))
                .isInstanceOf(StoreException.class)
                .hasMessageContaining("missing chats row")
                .satisfies(e -> assertThat(((StoreException) e).getOffendingRows()).containsExactly("memberships/m1"));
    }

    @Test
    void rejectsDuplicateMembershipAndDirectKey() {
        store.write(batch(0, user("u1", "alice"), user("u2", "bob"), direct("c1", "u1", "u2"),
                member("m1", "c1", "u1")), WriteMode.INSERT);

        assertThatThrownBy(() -> store.write(batch(1, member("m2", "c1", "u1")), WriteMode.INSERT))
                .hasMessageContaining("duplicate membership");
        assertThatThrownBy(() -> store.write(batch(2, direct("c2", "u2", "u1")), WriteMode.INSERT))
                .hasMessageContaining("duplicate dm_key");
    }

    @Test
    void upsertSkipsStoredIdsButInsertRejectsThem() {
        store.write(batch(0, user("u1", "alice")), WriteMode.INSERT);

        BatchOutcome outcome = store.write(batch(1, user("u1", "alice"), user("u2", "bob")), WriteMode.UPSERT_OR_SKIP);
        assertThat(outcome.skipped(EntityKind.USER)).isEqualTo(1);
        assertThat(outcome.inserted(EntityKind.USER)).isEqualTo(1);

        assertThatThrownBy(() -> store.write(batch(2, user("u1", "alice")), WriteMode.INSERT))
                .hasMessageContaining("duplicate users id");
    }

    @Test
    void repeatedIdInsideOneBatchIsAViolationEvenWhenUpserting() {
        assertThatThrownBy(() -> store.write(batch(0, user("u1", "alice"), user("u1", "bob")), WriteMode.UPSERT_OR_SKIP))
                .isInstanceOf(StoreException.class);
        assertThat(store.count(EntityKind.USER)).isZero();
    }

    @Test
    void clearReportsDeletedCounts() {
        store.write(batch(0, user("u1", "alice"), user("u2", "bob")), WriteMode.INSERT);

        assertThat(store.clear()).containsEntry(EntityKind.USER, 2L).containsEntry(EntityKind.MESSAGE, 0L);
        assertThat(store.count(EntityKind.USER)).isZero();
    }

    @Test
    void nonMemberProbeUsesJoinTime() {
        store.write(batch(0, user("u1", "alice"), user("u2", "bob"), user("u3", "carol"),
                direct("c1", "u1", "u2"), member("m1", "c1", "u1"), member("m2", "c1", "u2")), WriteMode.INSERT);
        store.insertRaw(message("early", "c1", "u1", T0.minusHours(3)));
        store.insertRaw(message("stranger", "c1", "u3", T0));
        store.insertRaw(message("fine", "c1", "u2", T0));

        assertThat(store.messagesFromNonMembers(10).getSample()).containsExactly("early", "stranger");
    }
}
