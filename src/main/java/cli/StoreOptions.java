package cli;

import config.StoreRole;
import config.StoreSettings;
import picocli.CommandLine;

/**
 * Store connection options shared by the commands. Unset options fall back to the environment.
 */
public class StoreOptions {

    @CommandLine.Option(names = {"--role"},
        description = "Store role whose credentials are used: ${COMPLETION-CANDIDATES}")
    private StoreRole role;

    @CommandLine.Option(names = {"--url"}, description = "JDBC url, overrides APPCHAT_<ROLE>_URL")
    private String url;

    @CommandLine.Option(names = {"--user"}, description = "Store user")
    private String user;

    @CommandLine.Option(names = {"--password"}, description = "Store password", interactive = true, arity = "0..1")
    private String password;

    @CommandLine.Option(names = {"--timeout"}, description = "Per round-trip timeout in seconds")
    private Integer timeoutSeconds;

    public StoreSettings settings(StoreRole defaultRole) {
        StoreSettings resolved = StoreSettings.forRole(role != null ? role : defaultRole);
        StoreSettings.StoreSettingsBuilder builder = resolved.toBuilder();
        if (url != null) {
            builder.url(url);
            if (!url.startsWith("jdbc:mysql:")) {
                // let the driver be resolved from the url
                builder.driverClass(null);
            }
        }
        if (user != null) builder.username(user);
        if (password != null) builder.password(password);
        if (timeoutSeconds != null) builder.timeoutSeconds(timeoutSeconds);
        return builder.build();
    }
}
