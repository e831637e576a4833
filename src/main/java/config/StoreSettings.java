package config;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Connection and round-trip settings for one store role.
 */
@Value
@Builder(toBuilder = true)
public class StoreSettings {

    StoreRole role;
    String url;
    String username;
    String password;

    /** JDBC driver class, null lets DriverManager resolve it from the url. */
    String driverClass;

    /** Hibernate dialect, null lets Hibernate detect it. */
    String dialect;

    /** Schema action, "none" unless a test creates its own schema. */
    @Builder.Default
    String schemaAction = "none";

    @Builder.Default
    boolean showSql = false;

    @Builder.Default
    int jdbcBatchSize = AppConfig.JDBC_BATCH_SIZE;

    @Builder.Default
    int timeoutSeconds = AppConfig.STORE_TIMEOUT_SECONDS;

    @Builder.Default
    int pageSize = AppConfig.READ_PAGE_SIZE;

    @Builder.Default
    int retryMaxAttempts = AppConfig.RETRY_MAX_ATTEMPTS;

    @Builder.Default
    long retryInitialBackoffMs = AppConfig.RETRY_INITIAL_BACKOFF_MS;

    @Builder.Default
    double retryBackoffMultiplier = AppConfig.RETRY_BACKOFF_MULTIPLIER;

    @Builder.Default
    long retryMaxBackoffMs = AppConfig.RETRY_MAX_BACKOFF_MS;

    /**
     * Resolves the settings of a role from system properties, then the environment.
     * APPCHAT_&lt;ROLE&gt;_URL wins over APPCHAT_DATABASE_URL, which wins over {@link AppConfig}.
     */
    public static StoreSettings forRole(StoreRole role) {
        return forRole(role, System.getenv());
    }

    static StoreSettings forRole(StoreRole role, Map<String, String> env) {
        String prefix = AppConfig.ENV_PREFIX + role.name() + "_";

        String url = lookup(env, prefix + "URL", AppConfig.ENV_DATABASE_URL, null);
        String user = lookup(env, prefix + "USER", AppConfig.ENV_DATABASE_USER, AppConfig.DB_USER);
        String password = lookup(env, prefix + "PASSWORD", AppConfig.ENV_DATABASE_PASSWORD, AppConfig.DB_PASSWORD);

        StoreSettingsBuilder builder = StoreSettings.builder()
                .role(role)
                .username(user)
                .password(password);
        if (url == null) {
            builder.url(AppConfig.DEFAULT_URL).driverClass(AppConfig.DB_DRIVER);
        } else {
            builder.url(url);
        }
        return builder.build();
    }

    private static String lookup(Map<String, String> env, String roleKey, String sharedKey, String fallback) {
        String value = System.getProperty(roleKey);
        if (value == null) value = env.get(roleKey);
        if (value == null) value = System.getProperty(sharedKey);
        if (value == null) value = env.get(sharedKey);
        return value != null ? value : fallback;
    }
}
