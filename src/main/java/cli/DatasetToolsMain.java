package cli;

import config.ConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

/**
 * Entry point: {@code generate}, {@code verify}, {@code bench} and {@code clean}.
 */
@CommandLine.Command(name = "appchat-datatools",
    mixinStandardHelpOptions = true,
    version = "appchat-datatools 1.0",
    header = "Synthetic dataset generation, verification and benchmarking for the chat store",
    exitCodeList = {"0: success", "1: failure", "2: configuration error"},
    subcommands = {CMD_generate.class, CMD_verify.class, CMD_bench.class, CMD_clean.class,
        CommandLine.HelpCommand.class})
public class DatasetToolsMain {

    private static final Logger logger = LogManager.getLogger(DatasetToolsMain.class);

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    public static CommandLine commandLine() {
        CommandLine commandLine = new CommandLine(new DatasetToolsMain());
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof ConfigurationException) {
                cmd.getErr().println("Configuration error:");
                for (String problem : ((ConfigurationException) ex).getProblems()) {
                    cmd.getErr().println("  - " + problem);
                }
                return CommandSupport.EXIT_CONFIG_ERROR;
            }
            logger.error("{} failed", cmd.getCommandName(), ex);
            cmd.getErr().println(cmd.getCommandName() + " failed: " + ex.getMessage());
            return CommandSupport.EXIT_FAILURE;
        });
        return commandLine;
    }
}
