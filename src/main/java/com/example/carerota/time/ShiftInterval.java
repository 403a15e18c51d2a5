package com.example.carerota.time;

import java.time.LocalDate;

/**
 * A dated shift window. When {@code endMinutes <= startMinutes} the shift occupies
 * {@code [startMinutes, 1440)} on {@code date} and {@code [0, endMinutes)} on the next day.
 */
public record ShiftInterval(LocalDate date, int startMinutes, int endMinutes) {

    public ShiftInterval {
        if (date == null) {
            throw new IllegalArgumentException("Shift date is required");
        }
        if (startMinutes < 0 || startMinutes >= TimeOfDay.MINUTES_PER_DAY
                || endMinutes < 0 || endMinutes >= TimeOfDay.MINUTES_PER_DAY) {
            throw new IllegalArgumentException("Shift minutes out of range: " + startMinutes + "-" + endMinutes);
        }
    }

    public static ShiftInterval of(LocalDate date, TimeInterval time) {
        return new ShiftInterval(date, time.start().minutes(), time.end().minutes());
    }

    public static ShiftInterval of(LocalDate date, String start, String end) {
        return of(date, TimeInterval.parse(start, end));
    }

    public boolean crossesMidnight() {
        return endMinutes <= startMinutes;
    }

    public int effectiveEndMinutes() {
        return crossesMidnight() ? endMinutes + TimeOfDay.MINUTES_PER_DAY : endMinutes;
    }

    public TimeInterval time() {
        return new TimeInterval(new TimeOfDay(startMinutes), new TimeOfDay(endMinutes));
    }

    public double durationHours() {
        return (effectiveEndMinutes() - startMinutes) / 60.0;
    }

    @Override
    public String toString() {
        return date + " " + time();
    }
}
