package com.example.carerota.template;

import com.example.carerota.shift.ShiftDto;

import java.time.LocalDate;
import java.util.List;

/**
 * Outcome of persisting one week of template shifts.
 *
 * @param requested candidates produced by the template for the week
 * @param skipped   candidates that already existed and were not re-created
 */
public record MaterializationReport(LocalDate weekStart,
                                    int requested,
                                    int skipped,
                                    List<ShiftDto> created,
                                    List<Failure> failures) {

    public int succeeded() {
        return created.size();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public record Failure(LocalDate date, String startTime, String endTime, String error) {}
}
