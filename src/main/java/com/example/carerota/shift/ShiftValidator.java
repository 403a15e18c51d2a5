package com.example.carerota.shift;

import java.time.LocalTime;

/**
 * Input checks shared by manual shift edits, template patterns and materialized
 * shifts. Violations are {@link IllegalArgumentException}s and never reach conflict logic.
 */
public final class ShiftValidator {

    private ShiftValidator() {
    }

    public static void validateTimes(LocalTime start, LocalTime end) {
        if (start == null) {
            throw new IllegalArgumentException("Start time is required");
        }
        if (end == null) {
            throw new IllegalArgumentException("End time is required");
        }
        if (start.getHour() == end.getHour() && start.getMinute() == end.getMinute()) {
            throw new IllegalArgumentException("Start and end time must differ");
        }
    }

    public static void validateStaffCount(Integer requiredStaffCount) {
        if (requiredStaffCount == null || requiredStaffCount < 1) {
            throw new IllegalArgumentException("Required staff count must be at least 1");
        }
    }

    public static void validate(Shift shift) {
        if (shift.getHome() == null) {
            throw new IllegalArgumentException("Home is required");
        }
        if (shift.getService() == null) {
            throw new IllegalArgumentException("Service is required");
        }
        if (shift.getWorkDate() == null) {
            throw new IllegalArgumentException("Date is required");
        }
        if (shift.getShiftType() == null) {
            throw new IllegalArgumentException("Shift type is required");
        }
        validateTimes(shift.getStartTime(), shift.getEndTime());
        validateStaffCount(shift.getRequiredStaffCount());
    }
}
