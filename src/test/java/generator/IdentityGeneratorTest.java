package generator;

import config.ConfigurationException;
import config.IdentityMode;
import org.junit.jupiter.api.Test;
import util.RandomSources;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdentityGeneratorTest {

    @Test
    void hashedIdsAreStableAcrossRuns() {
        IdentityGenerator first = new IdentityGenerator(IdentityMode.HASHED, RandomSources.create(1));
        IdentityGenerator second = new IdentityGenerator(IdentityMode.HASHED, RandomSources.create(2));

        assertThat(first.idFor("user_alice")).isEqualTo(second.idFor("user_alice"));
        assertThat(IdentityGenerator.hashedId("user_alice")).isNotEqualTo(IdentityGenerator.hashedId("user_bob"));
        assertThat(UUID.fromString(IdentityGenerator.hashedId("user_alice"))).isNotNull();
    }

    @Test
    void hashedModeRejectsReusedLogicalNames() {
        IdentityGenerator ids = new IdentityGenerator(IdentityMode.HASHED, RandomSources.create(1));
        ids.idFor("user_alice");

        assertThatThrownBy(() -> ids.idFor("user_alice"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("user_alice");
    }

    @Test
    void seededIdsReplayFromTheSeed() {
        List<String> first = draw(42, 50);
        List<String> second = draw(42, 50);

        assertThat(first).isEqualTo(second).doesNotHaveDuplicates();
        assertThat(draw(43, 50)).isNotEqualTo(first);
    }

    @Test
    void seededIdsAreVersion4Shaped() {
        UUID id = UUID.fromString(IdentityGenerator.seededId(RandomSources.create(9)));

        assertThat(id.version()).isEqualTo(4);
        assertThat(id.variant()).isEqualTo(2);
    }

    @Test
    void tracksIssuedIds() {
        IdentityGenerator ids = new IdentityGenerator(IdentityMode.SEEDED, RandomSources.create(5));
        String id = ids.idFor("ignored");

        assertThat(ids.isIssued(id)).isTrue();
        assertThat(ids.issuedCount()).isEqualTo(1);
        assertThat(ids.issuedIds()).containsExactly(id);
    }

    private static List<String> draw(long seed, int n) {
        IdentityGenerator ids = new IdentityGenerator(IdentityMode.SEEDED, RandomSources.create(seed));
        List<String> drawn = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            drawn.add(ids.idFor("x"));
        }
        return drawn;
    }
}
