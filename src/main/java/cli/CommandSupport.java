package cli;

import config.StoreSettings;
import dao.StoreException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import util.JsonSupport;
import util.RetryPolicy;
import verifier.Verifier;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Helpers shared by the subcommands.
 */
final class CommandSupport {

    private static final Logger logger = LogManager.getLogger(CommandSupport.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_CONFIG_ERROR = 2;

    private CommandSupport() {
    }

    static RetryPolicy writeRetry(StoreSettings settings) {
        return RetryPolicy.from(settings, StoreException::isRetryableFailure);
    }

    static RetryPolicy readRetry(StoreSettings settings) {
        return RetryPolicy.from(settings, Verifier::isTransientReadFailure);
    }

    static void writeJson(Path path, Object report) {
        if (path == null) {
            return;
        }
        try {
            JsonSupport.write(path, report);
            logger.info("Report written to {}", path.toAbsolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write report to " + path, e);
        }
    }
}
