package cli;

import config.ConfigLoader;
import config.DatasetMode;
import config.IdentityMode;
import config.ScaleConfig;
import config.StoreRole;
import config.StoreSettings;
import config.HibernateUtil;
import dao.CleanupDao;
import dao.ConstraintProbeDao;
import dao.ConstraintProbeDao.ProbeResult;
import dao.ConstraintProbeDao.ProbeStatus;
import dao.DatasetDao;
import dao.InMemoryDatasetStore;
import dao.SnapshotDao;
import generator.DatasetGenerator;
import generator.GenerationContext;
import generator.GenerationReport;
import generator.LoggingProgressListener;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hibernate.SessionFactory;
import picocli.CommandLine;
import util.RetryPolicy;
import verifier.SnapshotReader;
import verifier.VerificationExpectations;
import verifier.VerificationReport;
import verifier.Verifier;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/// Populates the store with a deterministic fixture dataset or a sampled large-scale one.
///
/// ```
/// generate --mode DETERMINISTIC
/// generate --mode SCALE --users 500 --messages 50000 --seed 42 --pipelined
/// generate --mode SCALE --dry-run
/// ```
@CommandLine.Command(name = "generate",
    header = "Generate a synthetic dataset into the store",
    description = "Writes users, chats, memberships and messages in atomic batches.",
    exitCodeList = {"0: success", "1: generation or verification failed", "2: configuration error"})
public class CMD_generate implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_generate.class);

    @CommandLine.Mixin
    private StoreOptions storeOptions = new StoreOptions();

    @CommandLine.Option(names = {"-m", "--mode"}, description = "${COMPLETION-CANDIDATES}")
    private DatasetMode mode;

    @CommandLine.Option(names = {"-c", "--config"}, description = "Scale config JSON (file or classpath resource)")
    private String configLocation;

    @CommandLine.Option(names = {"--identity"}, description = "Identifier mode: ${COMPLETION-CANDIDATES}")
    private IdentityMode identityMode;

    @CommandLine.Option(names = {"-s", "--seed"}, description = "Random seed, drawn and logged when absent")
    private Long seed;

    @CommandLine.Option(names = {"--users"}, description = "Number of users")
    private Integer users;

    @CommandLine.Option(names = {"--groups"}, description = "Number of group chats")
    private Integer groups;

    @CommandLine.Option(names = {"--directs"}, description = "Number of direct chats")
    private Integer directs;

    @CommandLine.Option(names = {"--messages"}, description = "Number of messages")
    private Integer messages;

    @CommandLine.Option(names = {"--history-days"}, description = "Message history window in days")
    private Integer historyDays;

    @CommandLine.Option(names = {"-b", "--batch-size"}, description = "Entities per atomic batch")
    private Integer batchSize;

    @CommandLine.Option(names = {"--reference-time"}, description = "ISO local date-time anchoring all timestamps")
    private String referenceTime;

    @CommandLine.Option(names = {"--pipelined"}, description = "Buffer the next batch while the current one is written")
    private boolean pipelined;

    @CommandLine.Option(names = {"--clean"}, description = "Delete the existing dataset first")
    private boolean clean;

    @CommandLine.Option(names = {"--dry-run"}, description = "Generate in memory and verify, without a store")
    private boolean dryRun;

    @CommandLine.Option(names = {"--verify"}, description = "Verify the store after generating")
    private boolean verify;

    @CommandLine.Option(names = {"--probe-constraints"}, description = "Check that the store rejects invalid writes")
    private boolean probeConstraints;

    @CommandLine.Option(names = {"--report-json"}, description = "Write the generation report as JSON")
    private Path reportJson;

    @Override
    public Integer call() {
        ScaleConfig config = buildConfig();
        config.validate();

        if (dryRun) {
            return dryRun(config);
        }

        StoreSettings settings = storeOptions.settings(StoreRole.READ_WRITE);
        SessionFactory sessionFactory = HibernateUtil.buildSessionFactory(settings);
        try {
            if (clean) {
                new CleanupDao(sessionFactory, settings).deleteAll();
            }

            DatasetGenerator generator = new DatasetGenerator(new DatasetDao(sessionFactory, settings),
                    CommandSupport.writeRetry(settings), new LoggingProgressListener());
            GenerationReport report = runCancellable(generator, config);

            if (probeConstraints && report.isSuccess()) {
                GenerationReport.GenerationReportBuilder withWarnings = report.toBuilder();
                for (ProbeResult probe : new ConstraintProbeDao(sessionFactory, settings).probeAll()) {
                    if (probe.getStatus() != ProbeStatus.ENFORCED) {
                        withWarnings.warning("constraint '" + probe.getConstraint() + "' " + probe.getStatus()
                                + ": " + probe.getDetail());
                    }
                }
                report = withWarnings.build();
            }

            System.out.println(report.toText());
            CommandSupport.writeJson(reportJson, report);
            if (!report.isSuccess()) {
                return CommandSupport.EXIT_FAILURE;
            }

            if (verify) {
                pinReferenceTime(config, report);
                VerificationReport verification = new Verifier(CommandSupport.readRetry(settings))
                        .verify(new SnapshotDao(sessionFactory, settings), VerificationExpectations.forConfig(config));
                System.out.println(verification.toText());
                return verification.isPassed() ? CommandSupport.EXIT_SUCCESS : CommandSupport.EXIT_FAILURE;
            }
            return CommandSupport.EXIT_SUCCESS;
        } finally {
            HibernateUtil.shutdown(sessionFactory);
        }
    }

    private int dryRun(ScaleConfig config) {
        logger.info("Dry run: generating in memory");
        InMemoryDatasetStore store = new InMemoryDatasetStore();
        GenerationReport report = new DatasetGenerator(store, RetryPolicy.defaults(), new LoggingProgressListener())
                .generate(config);
        System.out.println(report.toText());
        CommandSupport.writeJson(reportJson, report);
        if (!report.isSuccess()) {
            return CommandSupport.EXIT_FAILURE;
        }

        pinReferenceTime(config, report);
        SnapshotReader reader = store;
        VerificationReport verification = new Verifier(RetryPolicy.defaults())
                .verify(reader, VerificationExpectations.forConfig(config));
        System.out.println(verification.toText());
        return verification.isPassed() ? CommandSupport.EXIT_SUCCESS : CommandSupport.EXIT_FAILURE;
    }

    /**
     * Runs the generator with a shutdown hook that cancels between batches and waits for the
     * batch in flight, so an interrupted run never leaves a partial batch.
     */
    private GenerationReport runCancellable(DatasetGenerator generator, ScaleConfig config) {
        GenerationContext context = GenerationContext.create(config);
        CountDownLatch done = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            context.cancel();
            try {
                done.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "generate-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            return generator.generate(context);
        } finally {
            done.countDown();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException shuttingDown) {
                logger.debug("JVM is shutting down, hook stays registered");
            }
        }
    }

    /** Verifies against the reference time the run drew "now" as, when none was configured. */
    private static void pinReferenceTime(ScaleConfig config, GenerationReport report) {
        if (config.parsedReferenceTime() == null) {
            config.setReferenceTime(report.getReferenceTime());
        }
    }

    ScaleConfig buildConfig() {
        ScaleConfig config = ConfigLoader.load(configLocation);
        if (mode != null) config.setMode(mode);
        if (identityMode != null) config.setIdentityMode(identityMode);
        if (seed != null) config.setSeed(seed);
        if (users != null) config.setUserCount(users);
        if (groups != null) config.setGroupChatCount(groups);
        if (directs != null) config.setDirectChatCount(directs);
        if (messages != null) config.setMessageCount(messages);
        if (historyDays != null) config.setHistoryDays(historyDays);
        if (batchSize != null) config.setBatchSize(batchSize);
        if (referenceTime != null) config.setReferenceTime(referenceTime);
        if (pipelined) config.setPipelined(true);
        return config;
    }
}
