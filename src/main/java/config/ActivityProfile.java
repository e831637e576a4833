package config;

import lombok.Value;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Time-of-day / day-of-week weighting of message activity.
 * <p>
 * Hour weight is a mixture of "uniform over the day" and "uniform over business hours":
 * {@code w(h) = (1 - r) / 24 + (start <= h < end ? r / (end - start) : 0)}, with {@code r = businessHoursRatio}.
 * Weekdays weigh 1.0, Saturday and Sunday weigh {@code weekendWeight}.
 */
@Value
public class ActivityProfile {

    int businessHourStart;
    int businessHourEnd;
    double businessHoursRatio;
    double weekendWeight;

    public boolean isBusinessHour(int hour) {
        return hour >= businessHourStart && hour < businessHourEnd;
    }

    public double hourWeight(int hour) {
        double weight = (1.0 - businessHoursRatio) / 24.0;
        if (isBusinessHour(hour)) {
            weight += businessHoursRatio / (businessHourEnd - businessHourStart);
        }
        return weight;
    }

    /** Weights of hours 0..23, summing to 1. */
    public double[] hourWeights() {
        double[] weights = new double[24];
        for (int h = 0; h < 24; h++) {
            weights[h] = hourWeight(h);
        }
        return weights;
    }

    public double dayWeight(DayOfWeek day) {
        return isWeekend(day) ? weekendWeight : 1.0;
    }

    /** A weekday inside business hours. */
    public boolean isPeak(LocalDateTime time) {
        return !isWeekend(time.getDayOfWeek()) && isBusinessHour(time.getHour());
    }

    /** Share of messages expected to be {@link #isPeak(LocalDateTime) peak} over whole weeks. */
    public double expectedPeakShare() {
        double weekdayShare = 5.0 / (5.0 + 2.0 * weekendWeight);
        double businessShare = 0.0;
        for (int h = businessHourStart; h < businessHourEnd; h++) {
            businessShare += hourWeight(h);
        }
        return weekdayShare * businessShare;
    }

    /**
     * Share of messages expected to be peak when activity is drawn inside [{@code start}, {@code end}].
     * Each hour slot weighs {@code dayWeight * hourWeight}, scaled by the part of the slot inside the window.
     *
     * @return NaN for an empty window
     */
    public double expectedPeakShare(LocalDateTime start, LocalDateTime end) {
        double total = 0.0;
        double peak = 0.0;
        LocalDateTime slot = start.truncatedTo(ChronoUnit.HOURS);
        while (slot.isBefore(end)) {
            LocalDateTime next = slot.plusHours(1);
            LocalDateTime from = slot.isBefore(start) ? start : slot;
            LocalDateTime to = next.isAfter(end) ? end : next;
            double mass = Duration.between(from, to).getSeconds() / 3600.0
                    * dayWeight(slot.getDayOfWeek()) * hourWeight(slot.getHour());
            total += mass;
            if (isPeak(slot)) {
                peak += mass;
            }
            slot = next;
        }
        return total > 0 ? peak / total : Double.NaN;
    }

    /** Peak share of uniformly spread activity, for comparison. */
    public double uniformPeakShare() {
        return (5.0 / 7.0) * (businessHourEnd - businessHourStart) / 24.0;
    }

    private static boolean isWeekend(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
}
