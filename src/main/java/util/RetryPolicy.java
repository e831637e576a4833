package util;

import config.AppConfig;
import config.StoreSettings;
import lombok.Builder;
import lombok.Getter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * Bounded retries with exponential backoff.
 * <p>
 * Only failures accepted by {@link #getRetryOn()} are retried, anything else gives up at once.
 */
@Getter
@Builder(toBuilder = true)
public class RetryPolicy {

    private static final Logger logger = LogManager.getLogger(RetryPolicy.class);

    @Builder.Default
    private final int maxAttempts = AppConfig.RETRY_MAX_ATTEMPTS;

    @Builder.Default
    private final long initialBackoffMs = AppConfig.RETRY_INITIAL_BACKOFF_MS;

    @Builder.Default
    private final double multiplier = AppConfig.RETRY_BACKOFF_MULTIPLIER;

    @Builder.Default
    private final long maxBackoffMs = AppConfig.RETRY_MAX_BACKOFF_MS;

    @Builder.Default
    private final Predicate<Throwable> retryOn = e -> true;

    @Builder.Default
    private final Sleeper sleeper = Thread::sleep;

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    public static RetryPolicy from(StoreSettings settings, Predicate<Throwable> retryOn) {
        return RetryPolicy.builder()
                .maxAttempts(settings.getRetryMaxAttempts())
                .initialBackoffMs(settings.getRetryInitialBackoffMs())
                .multiplier(settings.getRetryBackoffMultiplier())
                .maxBackoffMs(settings.getRetryMaxBackoffMs())
                .retryOn(retryOn)
                .build();
    }

    /** Delay before the attempt following {@code attempt} (1-based). */
    public long backoffAfter(int attempt) {
        double delay = initialBackoffMs * Math.pow(multiplier, Math.max(0, attempt - 1));
        return (long) Math.min(delay, (double) maxBackoffMs);
    }

    /**
     * Runs {@code action} until it succeeds or the policy gives up.
     *
     * @param unit what is being attempted, used in logs and the failure
     * @throws RetryExhaustedException once every permitted attempt has failed or a failure is not retryable
     */
    public <T> T execute(String unit, Callable<T> action) {
        int attempts = Math.max(1, maxAttempts);
        Exception last = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return action.call();
            } catch (Exception e) {
                last = e;
                if (!retryOn.test(e)) {
                    throw new RetryExhaustedException(unit, attempt, e);
                }
                if (attempt == attempts) {
                    break;
                }
                long delay = backoffAfter(attempt);
                logger.warn("{} failed (attempt {}/{}), retrying in {} ms: {}", unit, attempt, attempts, delay, e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new RetryExhaustedException(unit, attempt, e);
                }
            }
        }
        throw new RetryExhaustedException(unit, attempts, last);
    }
}
