package config;

/**
 * Default values for the dataset tools
 * - Database connection
 * - Store round-trip timeout and retry policy
 * - Verifier / benchmark defaults
 */
public class AppConfig {

    // Database config
    public static final String DB_NAME = "appchat";
    public static final String DB_HOST = "localhost";
    public static final int DB_PORT = 3306;
    public static final String DB_USER = "root";
    public static final String DB_PASSWORD = "";
    public static final String DB_DRIVER = "com.mysql.cj.jdbc.Driver";

    public static final String DEFAULT_URL =
            "jdbc:mysql://" + DB_HOST + ":" + DB_PORT + "/" + DB_NAME + "?useSSL=false&serverTimezone=UTC";

    // Environment / system property names, <ROLE> is ADMIN, READ_WRITE or READ_ONLY
    public static final String ENV_PREFIX = "APPCHAT_";
    public static final String ENV_DATABASE_URL = "APPCHAT_DATABASE_URL";
    public static final String ENV_DATABASE_USER = "APPCHAT_DATABASE_USER";
    public static final String ENV_DATABASE_PASSWORD = "APPCHAT_DATABASE_PASSWORD";

    // Store round trips
    public static final int STORE_TIMEOUT_SECONDS = 30;
    public static final int JDBC_BATCH_SIZE = 50;
    public static final int READ_PAGE_SIZE = 1000;

    // Retry policy
    public static final int RETRY_MAX_ATTEMPTS = 3;
    public static final long RETRY_INITIAL_BACKOFF_MS = 200;
    public static final double RETRY_BACKOFF_MULTIPLIER = 2.0;
    public static final long RETRY_MAX_BACKOFF_MS = 5000;

    // Verifier
    public static final int SAMPLE_LIMIT = 20;
    public static final int MIN_DISTRIBUTION_SAMPLES = 200;
    public static final double DISTRIBUTION_TOLERANCE = 0.15;

    // Benchmark
    public static final int BENCHMARK_TRIALS = 5;
    public static final int BENCHMARK_WARMUP_TRIALS = 1;
    public static final long MINIMUM_MESSAGE_COUNT_WARNING = 1000;
    public static final String DEFAULT_QUERY_CATALOGUE = "benchmark/queries.json";

    private AppConfig() {
    }
}
