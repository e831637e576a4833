package cli;

import config.ConfigLoader;
import config.DatasetMode;
import config.HibernateUtil;
import config.ScaleConfig;
import config.StoreRole;
import config.StoreSettings;
import dao.SnapshotDao;
import org.hibernate.SessionFactory;
import picocli.CommandLine;
import verifier.VerificationExpectations;
import verifier.VerificationReport;
import verifier.Verifier;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Read-only verification of the stored dataset.
///
/// ```
/// verify --mode DETERMINISTIC
/// verify --config scale.json
/// verify --structural
/// ```
@CommandLine.Command(name = "verify",
    header = "Verify integrity and shape of the stored dataset",
    exitCodeList = {"0: all checks passed", "1: a check failed", "2: configuration error"})
public class CMD_verify implements Callable<Integer> {

    @CommandLine.Mixin
    private StoreOptions storeOptions = new StoreOptions();

    @CommandLine.Option(names = {"-m", "--mode"}, description = "Mode the dataset was generated with")
    private DatasetMode mode;

    @CommandLine.Option(names = {"-c", "--config"}, description = "Scale config the dataset was generated with")
    private String configLocation;

    @CommandLine.Option(names = {"--structural"}, description = "Skip count and distribution expectations")
    private boolean structural;

    @CommandLine.Option(names = {"--sample-limit"}, description = "Maximum offending ids reported per check")
    private Integer sampleLimit;

    @CommandLine.Option(names = {"--report-json"}, description = "Write the verification report as JSON")
    private Path reportJson;

    @Override
    public Integer call() {
        VerificationExpectations expectations = expectations();
        StoreSettings settings = storeOptions.settings(StoreRole.READ_ONLY);
        SessionFactory sessionFactory = HibernateUtil.buildSessionFactory(settings);
        try {
            VerificationReport report = new Verifier(CommandSupport.readRetry(settings))
                    .verify(new SnapshotDao(sessionFactory, settings), expectations);
            System.out.println(report.toText());
            CommandSupport.writeJson(reportJson, report);
            return report.isPassed() ? CommandSupport.EXIT_SUCCESS : CommandSupport.EXIT_FAILURE;
        } finally {
            HibernateUtil.shutdown(sessionFactory);
        }
    }

    VerificationExpectations expectations() {
        VerificationExpectations expectations;
        if (structural) {
            expectations = VerificationExpectations.structural();
        } else {
            ScaleConfig config = ConfigLoader.load(configLocation);
            if (mode != null) config.setMode(mode);
            config.validate();
            expectations = VerificationExpectations.forConfig(config);
        }
        if (sampleLimit != null) {
            expectations = expectations.toBuilder().sampleLimit(sampleLimit).build();
        }
        return expectations;
    }
}
