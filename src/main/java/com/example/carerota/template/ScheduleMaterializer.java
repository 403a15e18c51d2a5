package com.example.carerota.template;

import com.example.carerota.shift.Shift;
import com.example.carerota.time.Weekday;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Expands a weekly template into unsaved shifts for the seven days starting at
 * {@code weekStart}. Output depends only on the arguments, so repeated calls yield
 * equal candidates; filtering out slots that already exist is the caller's job.
 */
@Component
public class ScheduleMaterializer {

    public static final int DAYS_PER_WEEK = 7;

    public List<Shift> materialize(WeeklyScheduleTemplate template, LocalDate weekStart) {
        List<Shift> candidates = new ArrayList<>();
        if (!template.isActive()) {
            return candidates;
        }
        for (int i = 0; i < DAYS_PER_WEEK; i++) {
            LocalDate date = weekStart.plusDays(i);
            DaySchedule day = template.findDay(Weekday.of(date)).orElse(null);
            if (day == null || !day.isActive()) {
                continue;
            }
            for (ShiftPattern pattern : day.getPatterns()) {
                candidates.add(stamp(template, pattern, date));
            }
        }
        return candidates;
    }

    private Shift stamp(WeeklyScheduleTemplate template, ShiftPattern pattern, LocalDate date) {
        Shift shift = new Shift(template.getHome(), pattern.getService(), date,
                pattern.getStartTime(), pattern.getEndTime(), pattern.getShiftType(),
                pattern.getRequiredStaffCount() == null ? 1 : pattern.getRequiredStaffCount());
        shift.setNotes(pattern.getNotes());
        return shift;
    }
}
