package generator;

import config.ActivityProfile;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.AliasMethodDiscreteSampler;
import org.apache.commons.rng.sampling.distribution.SharedStateDiscreteSampler;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Draws message timestamps following an {@link ActivityProfile} inside a fixed history window.
 * A narrower range is served by rejection, with a uniform fallback when it keeps missing.
 */
public class ActivityTimeSampler {

    static final int MAX_REJECTIONS = 64;

    private final UniformRandomProvider rng;
    private final LocalDate firstDay;
    private final LocalDateTime windowStart;
    private final LocalDateTime windowEnd;
    private final SharedStateDiscreteSampler daySampler;
    private final SharedStateDiscreteSampler hourSampler;

    private long fallbacks;

    public ActivityTimeSampler(ActivityProfile profile, UniformRandomProvider rng,
                               LocalDateTime windowStart, LocalDateTime windowEnd) {
        if (windowEnd.isBefore(windowStart)) {
            throw new IllegalArgumentException("window ends before it starts: " + windowStart + " > " + windowEnd);
        }
        this.rng = rng;
        this.windowStart = windowStart;
        this.windowEnd = windowEnd;
        this.firstDay = windowStart.toLocalDate();

        int days = (int) ChronoUnit.DAYS.between(firstDay, windowEnd.toLocalDate()) + 1;
        double[] dayWeights = new double[days];
        for (int d = 0; d < days; d++) {
            dayWeights[d] = profile.dayWeight(firstDay.plusDays(d).getDayOfWeek());
        }
        this.daySampler = AliasMethodDiscreteSampler.of(rng, normalized(dayWeights));
        this.hourSampler = AliasMethodDiscreteSampler.of(rng, normalized(profile.hourWeights()));
    }

    public LocalDateTime getWindowStart() {
        return windowStart;
    }

    public LocalDateTime getWindowEnd() {
        return windowEnd;
    }

    /** Number of draws that fell back to a uniform time. */
    public long getFallbacks() {
        return fallbacks;
    }

    /**
     * Draws a time in [{@code notBefore}, window end], never before the window start.
     */
    public LocalDateTime sample(LocalDateTime notBefore) {
        LocalDateTime from = notBefore == null || notBefore.isBefore(windowStart) ? windowStart : notBefore;
        if (from.isAfter(windowEnd)) {
            from = windowEnd;
        }

        for (int i = 0; i < MAX_REJECTIONS; i++) {
            LocalDateTime candidate = firstDay.plusDays(daySampler.sample())
                    .atTime(hourSampler.sample(), rng.nextInt(60), rng.nextInt(60));
            if (!candidate.isBefore(from) && !candidate.isAfter(windowEnd)) {
                return candidate;
            }
        }

        fallbacks++;
        long seconds = Duration.between(from, windowEnd).getSeconds();
        return seconds <= 0 ? from : from.plusSeconds((long) (rng.nextDouble() * (seconds + 1)));
    }

    private static double[] normalized(double[] weights) {
        double total = 0;
        for (double w : weights) total += w;
        double[] result = new double[weights.length];
        for (int i = 0; i < weights.length; i++) {
            result[i] = total > 0 ? weights[i] / total : 1.0 / weights.length;
        }
        return result;
    }
}
