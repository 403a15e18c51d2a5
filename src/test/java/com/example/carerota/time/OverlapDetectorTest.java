package com.example.carerota.time;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class OverlapDetectorTest {

    private static final LocalDate JAN_1 = LocalDate.of(2024, 1, 1);
    private static final LocalDate JAN_2 = LocalDate.of(2024, 1, 2);

    private final OverlapDetector detector = new OverlapDetector();

    @Test
    void nightShiftSpillsIntoNextDayShift() {
        ShiftInterval night = ShiftInterval.of(JAN_1, "22:00", "02:00");
        ShiftInterval early = ShiftInterval.of(JAN_2, "01:00", "05:00");

        assertThat(detector.overlaps(night, early)).isTrue();
        assertThat(detector.overlaps(early, night)).isTrue();
    }

    @Test
    void adjacentShiftsDoNotOverlap() {
        ShiftInterval day = ShiftInterval.of(JAN_1, "09:00", "17:00");
        ShiftInterval late = ShiftInterval.of(JAN_1, "17:00", "23:00");

        assertThat(detector.overlaps(day, late)).isFalse();
        assertThat(detector.overlaps(late, day)).isFalse();
    }

    @Test
    void eveningShiftDoesNotOverlapNextNightShift() {
        ShiftInterval evening = ShiftInterval.of(JAN_1, "20:00", "23:00");
        ShiftInterval nextNight = ShiftInterval.of(JAN_2, "22:00", "06:00");

        assertThat(detector.overlaps(evening, nextNight)).isFalse();
        assertThat(detector.overlaps(nextNight, evening)).isFalse();
    }

    @Test
    void sameDateOverlapIncludingNightShifts() {
        ShiftInterval night = ShiftInterval.of(JAN_1, "22:00", "06:00");
        ShiftInterval late = ShiftInterval.of(JAN_1, "18:00", "23:00");
        ShiftInterval morning = ShiftInterval.of(JAN_1, "06:00", "14:00");

        assertThat(detector.overlaps(night, late)).isTrue();
        assertThat(detector.overlaps(night, morning)).isFalse();
    }

    @Test
    void spilloverEndingAtNextStartDoesNotOverlap() {
        ShiftInterval night = ShiftInterval.of(JAN_1, "22:00", "06:00");
        ShiftInterval morning = ShiftInterval.of(JAN_2, "06:00", "14:00");

        assertThat(detector.overlaps(night, morning)).isFalse();
        assertThat(detector.overlaps(morning, night)).isFalse();
    }

    @Test
    void datesTwoDaysApartNeverOverlap() {
        ShiftInterval night = ShiftInterval.of(JAN_1, "22:00", "21:00");
        ShiftInterval later = ShiftInterval.of(JAN_1.plusDays(2), "00:00", "23:00");

        assertThat(detector.overlaps(night, later)).isFalse();
    }

    @Test
    void overlapIsSymmetric() {
        List<ShiftInterval> intervals = List.of(
                ShiftInterval.of(JAN_1, "22:00", "02:00"),
                ShiftInterval.of(JAN_1, "09:00", "17:00"),
                ShiftInterval.of(JAN_1, "16:00", "00:00"),
                ShiftInterval.of(JAN_2, "00:00", "08:00"),
                ShiftInterval.of(JAN_2, "01:00", "05:00"),
                ShiftInterval.of(JAN_2, "20:00", "08:00"),
                ShiftInterval.of(JAN_1.minusDays(1), "23:00", "10:00"));

        for (ShiftInterval a : intervals) {
            for (ShiftInterval b : intervals) {
                assertThat(detector.overlaps(a, b))
                        .as("%s vs %s", a, b)
                        .isEqualTo(detector.overlaps(b, a));
            }
        }
    }

    @Test
    void findOverlapping_keepsIterationOrder() {
        ShiftInterval candidate = ShiftInterval.of(JAN_1, "08:00", "20:00");
        List<ShiftInterval> existing = List.of(
                ShiftInterval.of(JAN_1, "19:00", "23:00"),
                ShiftInterval.of(JAN_1, "20:00", "23:00"),
                ShiftInterval.of(JAN_1.minusDays(1), "22:00", "09:00"));

        List<ShiftInterval> found = detector.findOverlapping(candidate, existing, Function.identity());

        assertThat(found).containsExactly(existing.get(0), existing.get(2));
        assertThat(detector.anyOverlap(candidate, existing)).isTrue();
    }
}
