package com.example.carerota.conflict;

import com.example.carerota.shift.Shift;
import com.example.carerota.timeoff.TimeOffRequest;

import java.util.List;

/**
 * Everything the evaluator needs about one staff member, fetched by the caller.
 *
 * @param approvedTimeOff    the staff member's approved requests around the shift date
 * @param otherShiftsForUser shifts the staff member is assigned to from the day before
 *                           to the day after the shift date; the candidate itself may be
 *                           included and is skipped by id
 * @param dailyHourLimit     maximum gross hours on one calendar date
 */
public record AssignmentContext(List<TimeOffRequest> approvedTimeOff,
                                List<Shift> otherShiftsForUser,
                                double dailyHourLimit) {

    public AssignmentContext {
        approvedTimeOff = approvedTimeOff == null ? List.of() : List.copyOf(approvedTimeOff);
        otherShiftsForUser = otherShiftsForUser == null ? List.of() : List.copyOf(otherShiftsForUser);
        if (dailyHourLimit <= 0) {
            throw new IllegalArgumentException("Daily hour limit must be positive");
        }
    }
}
