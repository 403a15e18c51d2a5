package com.example.carerota.conflict;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Map;

/**
 * One conflicting assignment found by a consistency scan.
 */
public record ConflictReport(Long shiftId,
                             Long homeId,
                             LocalDate date,
                             LocalTime startTime,
                             LocalTime endTime,
                             Long userId,
                             String userName,
                             ConflictType conflictType,
                             String message,
                             Map<String, Object> details) {
}
