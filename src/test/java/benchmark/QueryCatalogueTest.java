package benchmark;

import config.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryCatalogueTest {

    @Test
    void defaultCatalogueLoads() {
        QueryCatalogue catalogue = QueryCatalogue.loadDefault();

        assertThat(catalogue.getProbes()).extracting(ProbeDefinition::getName).containsExactly("busiestChat", "firstUser");
        assertThat(catalogue.getQueries()).hasSize(8);
        assertThat(catalogue.getQueries()).allSatisfy(q -> {
            assertThat(q.getThresholdMs()).isPositive();
            assertThat(q.getSql()).doesNotContainIgnoringCase("limit");
        });
        assertThat(catalogue.getQueries().get(1).getOffset()).isEqualTo(100);
    }

    @Test
    void rejectsUnknownProbesAndBadLimits() {
        QueryCatalogue catalogue = new QueryCatalogue();
        catalogue.setQueries(List.of(
                QueryDefinition.builder().name("a").sql("SELECT 1").thresholdMs(5)
                        .parameters(Map.of("chatId", "$nowhere")).build(),
                QueryDefinition.builder().name("a").sql("SELECT 1").thresholdMs(0).limit(0).build()));

        assertThatThrownBy(catalogue::validate)
                .isInstanceOf(ConfigurationException.class)
                .satisfies(e -> assertThat(((ConfigurationException) e).getProblems()).containsExactlyInAnyOrder(
                        "a: parameter chatId uses unknown probe $nowhere",
                        "duplicate query a",
                        "a: thresholdMs must be > 0",
                        "a: limit must be >= 1"));
    }

    @Test
    void emptyCatalogueIsInvalid() {
        assertThatThrownBy(() -> new QueryCatalogue().validate()).hasMessageContaining("no queries");
    }
}
