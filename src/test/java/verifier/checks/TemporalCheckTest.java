package verifier.checks;

import config.ActivityProfile;
import dao.InMemoryDatasetStore;
import org.junit.jupiter.api.Test;
import verifier.CheckResult;
import verifier.CheckStatus;
import verifier.VerificationExpectations;

import java.time.LocalDateTime;

import static dao.DatasetFixtures.T0;
import static dao.DatasetFixtures.message;
import static dao.DatasetFixtures.smallStore;
import static org.assertj.core.api.Assertions.assertThat;

class TemporalCheckTest {

    private static final ActivityProfile PROFILE = new ActivityProfile(9, 18, 0.7, 0.4);

    // 2024-01-16 is a Tuesday
    private static final LocalDateTime PEAK = LocalDateTime.of(2024, 1, 16, 10, 0);
    private static final LocalDateTime OFF_PEAK = LocalDateTime.of(2024, 1, 16, 20, 0);

    private final TemporalCheck check = new TemporalCheck();

    private static VerificationExpectations withProfile() {
        return VerificationExpectations.structural().toBuilder()
                .activityProfile(PROFILE)
                .minDistributionSamples(200)
                .distributionTolerance(0.15)
                .build();
    }

    @Test
    void messageBeforeItsChatFails() {
        InMemoryDatasetStore store = smallStore();
        store.insertRaw(message("early", "g1", "u1", T0.minusDays(1)));

        CheckResult result = check.run(store, VerificationExpectations.structural());

        assertThat(result.getStatus()).isEqualTo(CheckStatus.FAIL);
        assertThat(result.getOffenders()).containsExactly("early");
    }

    @Test
    void noMessagesIsInconclusive() {
        InMemoryDatasetStore store = new InMemoryDatasetStore();

        assertThat(check.run(store, withProfile()).getStatus()).isEqualTo(CheckStatus.INCONCLUSIVE);
    }

    @Test
    void withoutProfileOnlyOrderingIsChecked() {
        assertThat(check.run(smallStore(), VerificationExpectations.structural()).getStatus())
                .isEqualTo(CheckStatus.PASS);
    }

    @Test
    void tooFewSamplesIsInconclusive() {
        CheckResult result = check.run(smallStore(), withProfile());

        assertThat(result.getStatus()).isEqualTo(CheckStatus.INCONCLUSIVE);
        assertThat(result.getDetails()).hasSize(1);
    }

    @Test
    void distributionMatchingTheProfilePasses() {
        // 3 messages of the small store sit at 12:00 on a Monday, peak
        InMemoryDatasetStore store = smallStore();
        addMessages(store, 697, PEAK);
        addMessages(store, 300, OFF_PEAK);

        assertThat(check.run(store, withProfile()).getStatus()).isEqualTo(CheckStatus.PASS);
    }

    @Test
    void uniformlyOffPeakActivityFails() {
        InMemoryDatasetStore store = smallStore();
        addMessages(store, 400, OFF_PEAK);

        CheckResult result = check.run(store, withProfile());

        assertThat(result.getStatus()).isEqualTo(CheckStatus.FAIL);
        assertThat(result.getSummary()).startsWith("peak share");
    }

    @Test
    void expectedShareFollowsTheActivityWindow() {
        // Saturday and Sunday only: no peak hours to expect
        LocalDateTime saturday = LocalDateTime.of(2024, 1, 20, 0, 0);
        InMemoryDatasetStore store = new InMemoryDatasetStore();
        addMessages(store, 300, saturday.plusHours(11));
        VerificationExpectations weekend = withProfile().toBuilder()
                .activityWindowStart(saturday)
                .activityWindowEnd(saturday.plusDays(2))
                .build();

        assertThat(check.run(store, withProfile()).getStatus()).isEqualTo(CheckStatus.FAIL);
        assertThat(check.run(store, weekend).getStatus()).isEqualTo(CheckStatus.PASS);
    }

    @Test
    void emptyActivityWindowIsInconclusive() {
        InMemoryDatasetStore store = new InMemoryDatasetStore();
        addMessages(store, 300, PEAK);
        VerificationExpectations empty = withProfile().toBuilder()
                .activityWindowStart(PEAK)
                .activityWindowEnd(PEAK)
                .build();

        CheckResult result = check.run(store, empty);

        assertThat(result.getStatus()).isEqualTo(CheckStatus.INCONCLUSIVE);
        assertThat(result.getSummary()).contains("window too short");
    }

    private static void addMessages(InMemoryDatasetStore store, int n, LocalDateTime at) {
        for (int i = 0; i < n; i++) {
            store.insertRaw(message(at.getHour() + "-" + i, "g1", "u1", at));
        }
    }
}
