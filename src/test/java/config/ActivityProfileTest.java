package config;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ActivityProfileTest {

    private final ActivityProfile profile = new ActivityProfile(9, 18, 0.7, 0.4);

    @Test
    void hourWeightsSumToOne() {
        assertThat(Arrays.stream(profile.hourWeights()).sum()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void businessHoursWeighMore() {
        assertThat(profile.hourWeight(10)).isGreaterThan(profile.hourWeight(3));
        assertThat(profile.isBusinessHour(9)).isTrue();
        assertThat(profile.isBusinessHour(18)).isFalse();
    }

    @Test
    void weekendsWeighLess() {
        assertThat(profile.dayWeight(DayOfWeek.SATURDAY)).isEqualTo(0.4);
        assertThat(profile.dayWeight(DayOfWeek.WEDNESDAY)).isEqualTo(1.0);
    }

    @Test
    void peakIsWeekdayBusinessHour() {
        // 2024-03-04 is a Monday
        assertThat(profile.isPeak(LocalDateTime.of(2024, 3, 4, 10, 0))).isTrue();
        assertThat(profile.isPeak(LocalDateTime.of(2024, 3, 4, 20, 0))).isFalse();
        assertThat(profile.isPeak(LocalDateTime.of(2024, 3, 2, 10, 0))).isFalse();
    }

    @Test
    void expectedPeakShareExceedsUniform() {
        // 5 / 5.8 weekday share times 0.7 + 9 * 0.3 / 24 business share
        assertThat(profile.expectedPeakShare()).isCloseTo((5.0 / 5.8) * 0.8125, within(1e-9));
        assertThat(profile.expectedPeakShare()).isGreaterThan(profile.uniformPeakShare());
    }

    @Test
    void windowOfWholeWeeksMatchesTheWeeklyShare() {
        // Monday to Monday, two weeks
        LocalDateTime start = LocalDateTime.of(2024, 3, 4, 0, 0);

        assertThat(profile.expectedPeakShare(start, start.plusWeeks(2)))
                .isCloseTo(profile.expectedPeakShare(), within(1e-9));
    }

    @Test
    void weekendWindowHasNoPeak() {
        assertThat(profile.expectedPeakShare(LocalDateTime.of(2024, 3, 2, 0, 0), LocalDateTime.of(2024, 3, 4, 0, 0)))
                .isZero();
    }

    @Test
    void weekdayWindowIsTheBusinessHourShare() {
        // Tuesday 00:00 to Thursday 00:00
        assertThat(profile.expectedPeakShare(LocalDateTime.of(2024, 3, 5, 0, 0), LocalDateTime.of(2024, 3, 7, 0, 0)))
                .isCloseTo(0.8125, within(1e-9));
    }

    @Test
    void partialHoursCountProRata() {
        // 10:30 to 11:00 peak, then 18:00 to 18:30 off-peak, on a Tuesday
        ActivityProfile flat = new ActivityProfile(9, 18, 0.0, 1.0);
        LocalDateTime start = LocalDateTime.of(2024, 3, 5, 10, 30);

        assertThat(flat.expectedPeakShare(start, start.plusMinutes(30))).isCloseTo(1.0, within(1e-9));
        assertThat(flat.expectedPeakShare(start, start.plusHours(8))).isCloseTo(7.5 / 8, within(1e-9));
    }

    @Test
    void emptyWindowIsNaN() {
        LocalDateTime at = LocalDateTime.of(2024, 3, 5, 10, 0);

        assertThat(profile.expectedPeakShare(at, at)).isNaN();
    }
}
