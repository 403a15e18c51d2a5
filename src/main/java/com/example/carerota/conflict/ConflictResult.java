package com.example.carerota.conflict;

import com.example.carerota.time.ShiftInterval;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of evaluating one (shift, staff member) pair. Exactly one variant is
 * populated, selected by {@link #type()}; the other variants' fields are null.
 *
 * @param timeOffRequestIds   approved requests covering the shift date ({@link ConflictType#TIME_OFF})
 * @param conflictingShiftId  first overlapping shift ({@link ConflictType#OVERLAPPING_SHIFT})
 * @param conflictingInterval window of that shift
 * @param attemptedHours      hours on the day including the candidate ({@link ConflictType#MAX_HOURS_EXCEEDED})
 * @param limitHours          the daily limit that was exceeded
 */
public record ConflictResult(ConflictType type,
                             String message,
                             List<Long> timeOffRequestIds,
                             Long conflictingShiftId,
                             ShiftInterval conflictingInterval,
                             Double attemptedHours,
                             Double limitHours) {

    private static final ConflictResult NO_CONFLICT =
            new ConflictResult(ConflictType.NONE, "No conflict", null, null, null, null, null);

    public static ConflictResult none() {
        return NO_CONFLICT;
    }

    public static ConflictResult timeOff(List<Long> requestIds) {
        return new ConflictResult(ConflictType.TIME_OFF,
                "Staff member has approved time off on this date",
                List.copyOf(requestIds), null, null, null, null);
    }

    public static ConflictResult overlappingShift(Long shiftId, ShiftInterval interval) {
        return new ConflictResult(ConflictType.OVERLAPPING_SHIFT,
                "Staff member is already assigned to an overlapping shift (" + interval + ")",
                null, shiftId, interval, null, null);
    }

    public static ConflictResult maxHoursExceeded(double attemptedHours, double limitHours) {
        return new ConflictResult(ConflictType.MAX_HOURS_EXCEEDED,
                String.format("Assignment would bring the day to %.1fh, above the %.1fh limit", attemptedHours, limitHours),
                null, null, null, attemptedHours, limitHours);
    }

    public boolean isConflict() {
        return type != ConflictType.NONE;
    }

    /**
     * Variant-specific fields as a map, for the {@code details} part of a 409 body.
     */
    public Map<String, Object> details() {
        Map<String, Object> details = new LinkedHashMap<>();
        switch (type) {
            case TIME_OFF -> details.put("timeOffRequestIds", timeOffRequestIds);
            case OVERLAPPING_SHIFT -> {
                details.put("conflictingShiftId", conflictingShiftId);
                details.put("date", conflictingInterval.date().toString());
                details.put("time", conflictingInterval.time().toString());
            }
            case MAX_HOURS_EXCEEDED -> {
                details.put("attemptedHours", attemptedHours);
                details.put("limitHours", limitHours);
            }
            case NONE -> {
            }
        }
        return details;
    }
}
