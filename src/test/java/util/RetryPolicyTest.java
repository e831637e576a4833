package util;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    private final List<Long> sleeps = new ArrayList<>();

    private RetryPolicy policy(int attempts) {
        return RetryPolicy.builder()
                .maxAttempts(attempts)
                .initialBackoffMs(100)
                .multiplier(2.0)
                .maxBackoffMs(300)
                .sleeper(sleeps::add)
                .build();
    }

    @Test
    void succeedsAfterTransientFailures() {
        AtomicInteger calls = new AtomicInteger();

        String result = policy(3).execute("unit", () -> {
            if (calls.incrementAndGet() < 3) throw new IllegalStateException("flaky");
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
        assertThat(sleeps).containsExactly(100L, 200L);
    }

    @Test
    void givesUpAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy(3).execute("batch 4", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("down");
        }))
                .isInstanceOf(RetryExhaustedException.class)
                .hasMessageContaining("batch 4")
                .hasRootCauseMessage("down")
                .satisfies(e -> assertThat(((RetryExhaustedException) e).getAttempts()).isEqualTo(3));
        assertThat(calls).hasValue(3);
    }

    @Test
    void doesNotRetryRejectedFailures() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = policy(5).toBuilder().retryOn(e -> !(e instanceof IllegalArgumentException)).build();

        assertThatThrownBy(() -> policy.execute("unit", () -> {
            calls.incrementAndGet();
            throw new IllegalArgumentException("bad input");
        })).isInstanceOf(RetryExhaustedException.class);
        assertThat(calls).hasValue(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void backoffIsCapped() {
        RetryPolicy policy = policy(10);
        assertThat(policy.backoffAfter(1)).isEqualTo(100);
        assertThat(policy.backoffAfter(2)).isEqualTo(200);
        assertThat(policy.backoffAfter(3)).isEqualTo(300);
        assertThat(policy.backoffAfter(8)).isEqualTo(300);
    }

    @Test
    void interruptedBackoffStopsRetrying() {
        RetryPolicy policy = policy(3).toBuilder().sleeper(ms -> {
            throw new InterruptedException();
        }).build();

        try {
            assertThatThrownBy(() -> policy.execute("unit", () -> {
                throw new IllegalStateException("down");
            })).isInstanceOf(RetryExhaustedException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
