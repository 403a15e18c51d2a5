package com.example.carerota.shift;

import com.example.carerota.common.ApiResponse;
import com.example.carerota.conflict.ConflictCheckService;
import com.example.carerota.conflict.ConflictReport;
import com.example.carerota.conflict.ConflictResult;
import com.example.carerota.conflict.ConflictScanStore;
import com.example.carerota.exception.ResourceNotFoundException;
import com.example.carerota.time.TimeInterval;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/shifts")
public class ShiftController {

    private final ShiftAssignmentService shiftService;
    private final ConflictCheckService conflictCheckService;
    private final ConflictScanStore scanStore;

    public ShiftController(ShiftAssignmentService shiftService,
                           ConflictCheckService conflictCheckService,
                           ConflictScanStore scanStore) {
        this.shiftService = shiftService;
        this.conflictCheckService = conflictCheckService;
        this.scanStore = scanStore;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<ShiftDto>>> list(
            @RequestParam Long homeId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam Long callerId) {
        List<ShiftDto> data = shiftService.listShifts(homeId, startDate, endDate, callerId).stream()
                .map(ShiftDto::from)
                .toList();
        Map<String, Object> meta = new HashMap<>();
        meta.put("count", data.size());
        return ResponseEntity.ok(ApiResponse.success(null, data, meta));
    }

    @GetMapping("/available")
    public ResponseEntity<ApiResponse<List<ShiftDto>>> available(
            @RequestParam Long userId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) List<Long> homeIds) {
        List<ShiftDto> data = conflictCheckService.findAvailableShifts(userId, startDate, endDate, homeIds).stream()
                .map(ShiftDto::from)
                .toList();
        Map<String, Object> meta = new HashMap<>();
        meta.put("count", data.size());
        return ResponseEntity.ok(ApiResponse.success(data.size() + " shifts available", data, meta));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ShiftDto>> get(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(ShiftDto.from(shiftService.getShift(id))));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<ShiftDto>> create(@Valid @RequestBody CreateShiftRequest body) {
        Shift created = shiftService.createShift(new ShiftAssignmentService.ShiftCommand(body.homeId(),
                body.serviceId(), body.date(), body.startTime(), body.endTime(), body.shiftType(),
                body.requiredStaffCount(), body.notes()));
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success("Shift created", ShiftDto.from(created)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<ShiftDto>> update(@PathVariable Long id, @Valid @RequestBody UpdateShiftRequest body) {
        Shift updated = shiftService.updateShift(id, new ShiftAssignmentService.ShiftUpdate(body.startTime(),
                body.endTime(), body.shiftType(), body.requiredStaffCount(), body.notes()));
        return ResponseEntity.ok(ApiResponse.success("Shift updated", ShiftDto.from(updated)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable Long id,
                                                    @RequestParam(defaultValue = "false") boolean hard) {
        shiftService.deleteShift(id, hard);
        return ResponseEntity.ok(ApiResponse.success(hard ? "Shift deleted" : "Shift deactivated", null));
    }

    @PostMapping("/{id}/assign")
    public ResponseEntity<ApiResponse<ShiftDto>> assign(@PathVariable Long id, @Valid @RequestBody AssignRequest body) {
        Shift shift = shiftService.assign(id, body.userId(), body.note());
        return ResponseEntity.ok(ApiResponse.success("Staff assigned", ShiftDto.from(shift)));
    }

    @DeleteMapping("/{id}/assign/{userId}")
    public ResponseEntity<ApiResponse<ShiftDto>> unassign(@PathVariable Long id, @PathVariable Long userId) {
        return ResponseEntity.ok(ApiResponse.success("Staff unassigned", ShiftDto.from(shiftService.unassign(id, userId))));
    }

    // Pre-flight only; nothing is saved
    @GetMapping("/{id}/assign/{userId}/evaluate")
    public ResponseEntity<ApiResponse<ConflictResult>> evaluate(@PathVariable Long id, @PathVariable Long userId) {
        ConflictResult result = conflictCheckService.evaluateAssignment(id, userId);
        return ResponseEntity.ok(ApiResponse.success(result.message(), result));
    }

    @PostMapping("/overlap-check")
    public ResponseEntity<ApiResponse<Map<String, Object>>> overlapCheck(@Valid @RequestBody OverlapCheckRequest body) {
        TimeInterval candidate = TimeInterval.parse(body.startTime(), body.endTime());
        List<ShiftDto> overlapping = conflictCheckService
                .findOverlappingShifts(candidate, body.date(), body.homeId(), body.excludeShiftId()).stream()
                .map(ShiftDto::from)
                .toList();
        Map<String, Object> data = new HashMap<>();
        data.put("overlaps", !overlapping.isEmpty());
        data.put("shifts", overlapping);
        return ResponseEntity.ok(ApiResponse.success(data));
    }

    @GetMapping("/conflicts/check")
    public ResponseEntity<ApiResponse<List<ConflictReport>>> checkConflicts(
            @RequestParam Long homeId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        List<ConflictReport> conflicts = conflictCheckService.scanConflicts(homeId, startDate, endDate);
        return ResponseEntity.ok(ApiResponse.success(conflicts.size() + " conflicts found", conflicts));
    }

    @GetMapping("/conflicts/latest")
    public ResponseEntity<ApiResponse<ConflictScanStore.Snapshot>> latestScan(@RequestParam Long homeId) {
        ConflictScanStore.Snapshot snapshot = scanStore.get(homeId)
                .orElseThrow(() -> new ResourceNotFoundException("Conflict scan for home", homeId));
        return ResponseEntity.ok(ApiResponse.success(snapshot));
    }

    public record CreateShiftRequest(@NotNull(message = "homeId is required") Long homeId,
                                     @NotNull(message = "serviceId is required") Long serviceId,
                                     @NotNull(message = "date is required") LocalDate date,
                                     @NotBlank(message = "startTime is required") String startTime,
                                     @NotBlank(message = "endTime is required") String endTime,
                                     ShiftType shiftType,
                                     @Min(value = 1, message = "requiredStaffCount must be at least 1") Integer requiredStaffCount,
                                     String notes) {}

    public record UpdateShiftRequest(String startTime,
                                     String endTime,
                                     ShiftType shiftType,
                                     @Min(value = 1, message = "requiredStaffCount must be at least 1") Integer requiredStaffCount,
                                     String notes) {}

    public record AssignRequest(@NotNull(message = "userId is required") Long userId, String note) {}

    public record OverlapCheckRequest(@NotNull(message = "homeId is required") Long homeId,
                                      @NotNull(message = "date is required") LocalDate date,
                                      @NotBlank(message = "startTime is required") String startTime,
                                      @NotBlank(message = "endTime is required") String endTime,
                                      Long excludeShiftId) {}
}
