package com.example.carerota.template;

import com.example.carerota.shift.Shift;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Identity of a materialized shift: two shifts with the same key are the same rota slot.
 */
public record ShiftKey(Long homeId, LocalDate date, LocalTime start, LocalTime end, Long serviceId) {

    public static ShiftKey of(Shift shift) {
        return new ShiftKey(shift.getHomeId(), shift.getWorkDate(), shift.getStartTime(), shift.getEndTime(),
                shift.getServiceId());
    }
}
