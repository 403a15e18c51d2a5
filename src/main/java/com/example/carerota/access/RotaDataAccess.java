package com.example.carerota.access;

import com.example.carerota.shift.Shift;
import com.example.carerota.template.WeeklyScheduleTemplate;
import com.example.carerota.timeoff.TimeOffRequest;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Record store the rota engine reads from and writes materialized shifts to.
 * Date ranges are inclusive.
 */
public interface RotaDataAccess {

    /**
     * All shifts of the home in the range, soft-deleted ones included.
     */
    List<Shift> getShifts(Long homeId, LocalDate from, LocalDate to);

    /**
     * Active shifts the staff member is assigned to in the range, across homes.
     */
    List<Shift> getShiftsForStaff(Long staffId, LocalDate from, LocalDate to);

    /**
     * Approved requests of the staff member that intersect the range.
     */
    List<TimeOffRequest> getApprovedTimeOff(Long staffId, LocalDate from, LocalDate to);

    Optional<WeeklyScheduleTemplate> getWeeklyScheduleTemplate(Long homeId);

    /**
     * Persists each shift independently; one failure does not stop the rest.
     */
    List<PersistOutcome> persistShifts(List<Shift> shifts);
}
