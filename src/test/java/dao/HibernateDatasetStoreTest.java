package dao;

import benchmark.BenchmarkHarness;
import benchmark.BenchmarkReport;
import benchmark.QueryCatalogue;
import benchmark.QueryResult;
import config.HibernateUtil;
import config.ScaleConfig;
import config.StoreRole;
import config.StoreSettings;
import dao.ConstraintProbeDao.ProbeResult;
import dao.ConstraintProbeDao.ProbeStatus;
import generator.DatasetGenerator;
import generator.GenerationReport;
import generator.IdentityGenerator;
import generator.ProgressListener;
import model.EntityKind;
import org.hibernate.SessionFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import util.RetryPolicy;
import verifier.CheckStatus;
import verifier.VerificationExpectations;
import verifier.VerificationReport;
import verifier.Verifier;
import verifier.checks.ReferentialIntegrityCheck;

import java.util.List;
import java.util.Map;

import static dao.DatasetFixtures.T0;
import static dao.DatasetFixtures.message;
import static dao.DatasetFixtures.user;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Generator, verifier, benchmark and cleanup against an in-memory H2 database.
 */
class HibernateDatasetStoreTest {

    private static StoreSettings settings;
    private static SessionFactory sessionFactory;

    private final RetryPolicy retry = RetryPolicy.builder().maxAttempts(1).sleeper(ms -> { }).build();

    @BeforeAll
    static void openStore() {
        settings = StoreSettings.builder()
                .role(StoreRole.ADMIN)
                .url("jdbc:h2:mem:datatools;DB_CLOSE_DELAY=-1")
                .username("sa")
                .password("")
                .driverClass("org.h2.Driver")
                .schemaAction("create-drop")
                .pageSize(7)
                .build();
        sessionFactory = HibernateUtil.buildSessionFactory(settings);
    }

    @AfterAll
    static void closeStore() {
        HibernateUtil.shutdown(sessionFactory);
    }

    @BeforeEach
    void emptyStore() {
        new CleanupDao(sessionFactory, settings).deleteAll();
    }

    private static ScaleConfig fixtureConfig() {
        ScaleConfig config = ScaleConfig.deterministic();
        config.setPasswordRounds(4);
        config.setBatchSize(6);
        return config;
    }

    private GenerationReport generate(ScaleConfig config) {
        return new DatasetGenerator(new DatasetDao(sessionFactory, settings), retry, ProgressListener.NONE)
                .generate(config);
    }

    @Test
    void fixtureDatasetVerifiesAndRerunsAreIdempotent() {
        GenerationReport first = generate(fixtureConfig());
        GenerationReport second = generate(fixtureConfig());

        assertThat(first.isSuccess()).isTrue();
        assertThat(first.committed(EntityKind.USER)).isEqualTo(5);
        assertThat(first.committed(EntityKind.MESSAGE)).isEqualTo(16);
        assertThat(second.isSuccess()).isTrue();
        assertThat(second.committed(EntityKind.MESSAGE)).isZero();
        assertThat(second.skipped(EntityKind.MESSAGE)).isEqualTo(16);

        VerificationReport report = new Verifier(retry)
                .verify(new SnapshotDao(sessionFactory, settings), VerificationExpectations.forConfig(fixtureConfig()));

        assertThat(report.getResults()).allSatisfy(r ->
                assertThat(r.getStatus()).as(r.getCheck() + ": " + r.getSummary()).isNotEqualTo(CheckStatus.FAIL));
        assertThat(report.isPassed()).isTrue();
    }

    @Test
    void sampledDatasetVerifies() {
        ScaleConfig config = ScaleConfig.scale();
        config.setSeed(11L);
        config.setUserCount(20);
        config.setGroupChatCount(3);
        config.setDirectChatCount(10);
        config.setMessageCount(150);
        config.setBatchSize(40);
        config.setPasswordRounds(4);
        config.setReferenceTime("2024-03-01T12:00:00");

        GenerationReport report = generate(config);
        VerificationReport verification = new Verifier(retry)
                .verify(new SnapshotDao(sessionFactory, settings), VerificationExpectations.forConfig(config));

        assertThat(report.isSuccess()).isTrue();
        assertThat(verification.isPassed()).as(verification.toText()).isTrue();
    }

    @Test
    void snapshotFindsInjectedNonMemberMessage() {
        generate(fixtureConfig());
        SnapshotDao snapshot = new SnapshotDao(sessionFactory, settings);
        // eve is in no direct chat
        String outsider = IdentityGenerator.hashedId("user_eve");

        new DatasetDao(sessionFactory, settings).write(
                new Batch(99, List.of(message("intruder", anyDirectChat(snapshot), outsider, T0))), WriteMode.INSERT);

        VerificationReport report = new Verifier(retry).verify(snapshot, VerificationExpectations.structural());

        assertThat(report.isPassed()).isFalse();
        assertThat(report.result(ReferentialIntegrityCheck.NAME).getOffenders()).containsExactly("intruder");
    }

    @Test
    void uniqueConstraintsAreEnforced() {
        List<ProbeResult> probes = new ConstraintProbeDao(sessionFactory, settings).probeAll();

        assertThat(probes).hasSize(3);
        assertThat(probes.get(0).getStatus()).isEqualTo(ProbeStatus.ENFORCED);
        assertThat(probes.get(1).getStatus()).isEqualTo(ProbeStatus.ENFORCED);
        // rolled back, nothing left behind
        assertThat(new SnapshotDao(sessionFactory, settings).count(EntityKind.CHAT)).isZero();
    }

    @Test
    void duplicateInsertFailsTheBatchAndRollsBack() {
        generate(fixtureConfig());
        ScaleConfig config = fixtureConfig();
        // same hashed ids written with INSERT semantics
        DatasetDao dao = new DatasetDao(sessionFactory, settings);
        long before = new SnapshotDao(sessionFactory, settings).count(EntityKind.USER);

        GenerationReport report = new DatasetGenerator(
                (batch, mode) -> dao.write(batch, WriteMode.INSERT), retry, ProgressListener.NONE).generate(config);

        assertThat(report.getStatus()).isEqualTo(GenerationReport.Status.FAILED);
        assertThat(report.getFailedBatchIndex()).isZero();
        assertThat(report.getFailedRowSample()).isNotEmpty();
        assertThat(new SnapshotDao(sessionFactory, settings).count(EntityKind.USER)).isEqualTo(before);
    }

    @Test
    void constraintFailureNamesTheViolatingRows() {
        DatasetDao dao = new DatasetDao(sessionFactory, settings);
        dao.write(new Batch(0, List.of(user("u1", "alice"))), WriteMode.INSERT);

        assertThatThrownBy(() -> dao.write(new Batch(1, List.of(user("u2", "bob"), user("u3", "carol"),
                user("u4", "alice"), user("u1", "dave"))), WriteMode.INSERT))
                .isInstanceOfSatisfying(StoreException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(StoreException.Kind.CONSTRAINT_VIOLATION);
                    assertThat(e.getOffendingRows()).containsExactly("users/u4", "users/u1");
                });
        assertThat(new SnapshotDao(sessionFactory, settings).count(EntityKind.USER)).isEqualTo(1);
    }

    @Test
    void benchmarkRunsTheDefaultCatalogue() {
        generate(fixtureConfig());

        BenchmarkReport report = new BenchmarkHarness(new BenchmarkDao(sessionFactory, settings), retry, 2, 1)
                .run(QueryCatalogue.loadDefault());

        assertThat(report.getStatus()).isNotEqualTo(BenchmarkReport.Status.FAILURE);
        assertThat(report.getResults()).hasSize(8).noneMatch(r -> r.getStatus() == QueryResult.Status.ERROR);
        assertThat(report.getProbeValues()).containsKeys("busiestChat", "firstUser");
        assertThat(report.getWarnings()).anyMatch(w -> w.contains("16 messages"));
        assertThat(report.getResults().get(0).getRows()).isEqualTo(5);
    }

    @Test
    void benchmarkOnAnEmptyStoreBindsPlaceholders() {
        BenchmarkReport report = new BenchmarkHarness(new BenchmarkDao(sessionFactory, settings), retry, 1, 0)
                .run(QueryCatalogue.loadDefault());

        assertThat(report.isAborted()).isFalse();
        assertThat(report.getProbeValues()).containsValue(BenchmarkHarness.PLACEHOLDER_ID);
        assertThat(report.getResults()).hasSize(8).allSatisfy(r -> {
            assertThat(r.getStatus()).isNotEqualTo(QueryResult.Status.ERROR);
            assertThat(r.getRows()).isZero();
        });
        assertThat(report.getWarnings()).anyMatch(w -> w.contains("Only 0 messages"));
    }

    @Test
    void cleanupEmptiesEveryTable() {
        generate(fixtureConfig());

        Map<EntityKind, Long> deleted = new CleanupDao(sessionFactory, settings).deleteAll();

        assertThat(deleted).containsEntry(EntityKind.MESSAGE, 16L).containsEntry(EntityKind.USER, 5L);
        assertThat(new BenchmarkDao(sessionFactory, settings).datasetCounts()).containsOnly(
                Map.entry(EntityKind.USER, 0L), Map.entry(EntityKind.CHAT, 0L),
                Map.entry(EntityKind.MEMBERSHIP, 0L), Map.entry(EntityKind.MESSAGE, 0L));
    }

    private String anyDirectChat(SnapshotDao snapshot) {
        String[] found = {null};
        snapshot.forEachChatSummary(chat -> {
            if (found[0] == null && chat.isDirect()) found[0] = chat.getChatId();
        });
        return found[0];
    }
}
