package com.example.carerota.time;

import com.example.carerota.exception.InvalidTimeFormatException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeIntervalTest {

    @Test
    void durationHours_sameDay() {
        TimeInterval interval = TimeInterval.parse("09:00", "17:30");

        assertThat(interval.crossesMidnight()).isFalse();
        assertThat(interval.effectiveEndMinutes()).isEqualTo(17 * 60 + 30);
        assertThat(interval.durationHours()).isEqualTo(8.5);
    }

    @Test
    void durationHours_wrapsPastMidnight() {
        TimeInterval interval = TimeInterval.parse("22:00", "06:00");

        assertThat(interval.crossesMidnight()).isTrue();
        assertThat(interval.effectiveEndMinutes()).isEqualTo(30 * 60);
        assertThat(interval.durationHours()).isEqualTo(8.0);
    }

    @Test
    void endAtMidnight_isTreatedAsNextDay() {
        TimeInterval interval = TimeInterval.parse("18:00", "00:00");

        assertThat(interval.crossesMidnight()).isTrue();
        assertThat(interval.durationHours()).isEqualTo(6.0);
    }

    @Test
    void parse_acceptsZeroSeconds() {
        assertThat(TimeOfDay.parse("07:45:00").minutes()).isEqualTo(7 * 60 + 45);
        assertThat(TimeOfDay.parse("7:05").toString()).isEqualTo("07:05");
    }

    @Test
    void parse_rejectsMalformedTimes() {
        assertThatThrownBy(() -> TimeInterval.parse("25:00", "06:00"))
                .isInstanceOf(InvalidTimeFormatException.class)
                .hasMessageContaining("25:00");
        assertThatThrownBy(() -> TimeOfDay.parse("9am"))
                .isInstanceOf(InvalidTimeFormatException.class);
        assertThatThrownBy(() -> TimeOfDay.parse(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void weekday_isMondayFirstAndParsesLowerCaseKeys() {
        assertThat(Weekday.values()[0]).isEqualTo(Weekday.MONDAY);
        assertThat(Weekday.fromKey("saturday")).isEqualTo(Weekday.SATURDAY);
        assertThat(Weekday.of(java.time.LocalDate.of(2024, 1, 1))).isEqualTo(Weekday.MONDAY);
        assertThatThrownBy(() -> Weekday.fromKey("funday")).isInstanceOf(IllegalArgumentException.class);
    }
}
