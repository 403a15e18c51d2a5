package com.example.carerota.hours;

/**
 * Unpaid break deducted from a shift when reporting paid hours. Reporting only;
 * the daily hour limit is checked against gross hours.
 */
public final class BreakRules {

    private static final double EIGHT_HOURS = 8.0;
    private static final double TWELVE_HOURS = 12.0;

    private BreakRules() {
    }

    /**
     * Break in hours for a shift of the given gross length: none under 8h, half an
     * hour from 8h up to 12h, one hour from 12h.
     */
    public static double breakHours(double shiftHours) {
        if (shiftHours >= TWELVE_HOURS) {
            return 1.0;
        }
        if (shiftHours >= EIGHT_HOURS) {
            return 0.5;
        }
        return 0.0;
    }

    public static double paidHours(double shiftHours) {
        return Math.max(0.0, shiftHours - breakHours(shiftHours));
    }
}
