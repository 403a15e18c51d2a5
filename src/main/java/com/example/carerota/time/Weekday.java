package com.example.carerota.time;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Locale;

/**
 * Days of the rota week, Monday first. Keys match the lower-case day names used
 * in template URLs and JSON ({@code monday} ... {@code sunday}).
 */
public enum Weekday {
    MONDAY(DayOfWeek.MONDAY),
    TUESDAY(DayOfWeek.TUESDAY),
    WEDNESDAY(DayOfWeek.WEDNESDAY),
    THURSDAY(DayOfWeek.THURSDAY),
    FRIDAY(DayOfWeek.FRIDAY),
    SATURDAY(DayOfWeek.SATURDAY),
    SUNDAY(DayOfWeek.SUNDAY);

    private final DayOfWeek dayOfWeek;

    Weekday(DayOfWeek dayOfWeek) {
        this.dayOfWeek = dayOfWeek;
    }

    public static Weekday of(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        for (Weekday w : values()) {
            if (w.dayOfWeek == dow) {
                return w;
            }
        }
        throw new IllegalStateException("Unmapped day of week: " + dow);
    }

    public static Weekday fromKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Day name is required");
        }
        try {
            return valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown day name: " + key);
        }
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public DayOfWeek toDayOfWeek() {
        return dayOfWeek;
    }
}
