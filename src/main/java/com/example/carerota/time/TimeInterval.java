package com.example.carerota.time;

/**
 * Start/end pair of wall-clock times. An end at or before the start means the
 * interval runs past midnight into the next day.
 */
public record TimeInterval(TimeOfDay start, TimeOfDay end) {

    public TimeInterval {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Start and end times are required");
        }
    }

    public static TimeInterval parse(String start, String end) {
        return new TimeInterval(TimeOfDay.parse(start), TimeOfDay.parse(end));
    }

    public boolean crossesMidnight() {
        return end.minutes() <= start.minutes();
    }

    /**
     * End in minutes relative to the start day; 1440 is added when the interval crosses midnight.
     */
    public int effectiveEndMinutes() {
        return crossesMidnight() ? end.minutes() + TimeOfDay.MINUTES_PER_DAY : end.minutes();
    }

    public int durationMinutes() {
        return effectiveEndMinutes() - start.minutes();
    }

    public double durationHours() {
        return durationMinutes() / 60.0;
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
