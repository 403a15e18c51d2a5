package com.example.carerota.time;

import com.example.carerota.exception.InvalidTimeFormatException;

import java.time.LocalTime;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Wall-clock time as minutes since midnight (0-1439).
 */
public record TimeOfDay(int minutes) implements Comparable<TimeOfDay> {

    public static final int MINUTES_PER_DAY = 24 * 60;

    // HH:MM, optionally with a zero seconds part as sent by browser time inputs
    private static final Pattern HH_MM = Pattern.compile("^(\\d{1,2}):(\\d{2})(?::00)?$");

    public TimeOfDay {
        if (minutes < 0 || minutes >= MINUTES_PER_DAY) {
            throw new IllegalArgumentException("Minutes since midnight out of range: " + minutes);
        }
    }

    public static TimeOfDay parse(String value) {
        if (value == null) {
            throw new InvalidTimeFormatException(null);
        }
        Matcher m = HH_MM.matcher(value.trim());
        if (!m.matches()) {
            throw new InvalidTimeFormatException(value);
        }
        int hours = Integer.parseInt(m.group(1));
        int mins = Integer.parseInt(m.group(2));
        if (hours > 23 || mins > 59) {
            throw new InvalidTimeFormatException(value);
        }
        return new TimeOfDay(hours * 60 + mins);
    }

    public static TimeOfDay of(LocalTime time) {
        return new TimeOfDay(time.getHour() * 60 + time.getMinute());
    }

    public LocalTime toLocalTime() {
        return LocalTime.of(minutes / 60, minutes % 60);
    }

    @Override
    public int compareTo(TimeOfDay other) {
        return Integer.compare(minutes, other.minutes);
    }

    @Override
    public String toString() {
        return String.format("%02d:%02d", minutes / 60, minutes % 60);
    }
}
