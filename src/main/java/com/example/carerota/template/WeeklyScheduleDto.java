package com.example.carerota.template;

import com.example.carerota.shift.ShiftType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON view of a template keyed by lower-case day name, Monday first.
 */
public record WeeklyScheduleDto(Long id,
                                Long homeId,
                                boolean active,
                                Map<String, DayDto> schedule,
                                int totalWeeklyShifts,
                                double totalWeeklyHours) {

    public static WeeklyScheduleDto from(WeeklyScheduleTemplate template) {
        Map<String, DayDto> days = new LinkedHashMap<>();
        for (DaySchedule day : template.orderedDays()) {
            List<PatternDto> shifts = day.getPatterns().stream().map(PatternDto::from).toList();
            days.put(day.getWeekday().key(), new DayDto(day.isActive(), shifts));
        }
        return new WeeklyScheduleDto(template.getId(), template.getHomeId(), template.isActive(), days,
                template.totalWeeklyShifts(), template.totalWeeklyHours());
    }

    public record DayDto(boolean active, List<PatternDto> shifts) {}

    public record PatternDto(Long serviceId,
                             String startTime,
                             String endTime,
                             ShiftType shiftType,
                             Integer requiredStaffCount,
                             String notes,
                             double durationHours) {

        static PatternDto from(ShiftPattern pattern) {
            return new PatternDto(
                    pattern.getService() == null ? null : pattern.getService().getId(),
                    pattern.time().start().toString(),
                    pattern.time().end().toString(),
                    pattern.getShiftType(),
                    pattern.getRequiredStaffCount(),
                    pattern.getNotes(),
                    pattern.durationHours());
        }
    }
}
