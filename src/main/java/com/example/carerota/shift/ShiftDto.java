package com.example.carerota.shift;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

public record ShiftDto(
        Long id,
        Long homeId,
        Long serviceId,
        LocalDate date,
        LocalTime startTime,
        LocalTime endTime,
        ShiftType shiftType,
        Integer requiredStaffCount,
        List<AssignmentDto> assignedStaff,
        String notes,
        boolean active,
        ShiftStatus status,
        double durationHours,
        boolean crossesMidnight) {

    public static ShiftDto from(Shift shift) {
        List<AssignmentDto> staff = shift.getAssignments().stream()
                .map(a -> new AssignmentDto(a.getStaffId(), a.getAssignedAt(), a.getNote()))
                .toList();
        return new ShiftDto(
                shift.getId(),
                shift.getHomeId(),
                shift.getServiceId(),
                shift.getWorkDate(),
                shift.getStartTime(),
                shift.getEndTime(),
                shift.getShiftType(),
                shift.getRequiredStaffCount(),
                staff,
                shift.getNotes(),
                shift.isActive(),
                shift.status(),
                shift.durationHours(),
                shift.interval().crossesMidnight()
        );
    }

    public record AssignmentDto(Long userId, LocalDateTime assignedAt, String note) {}
}
