package com.example.carerota.template;

import com.example.carerota.common.ApiResponse;
import com.example.carerota.shift.ShiftDto;
import com.example.carerota.time.Weekday;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/weekly-schedules")
public class WeeklyScheduleController {

    private final WeeklyScheduleService weeklyScheduleService;

    public WeeklyScheduleController(WeeklyScheduleService weeklyScheduleService) {
        this.weeklyScheduleService = weeklyScheduleService;
    }

    @GetMapping("/home/{homeId}")
    public ResponseEntity<ApiResponse<WeeklyScheduleDto>> getByHome(@PathVariable Long homeId) {
        WeeklyScheduleTemplate template = weeklyScheduleService.getOrCreateTemplate(homeId);
        return ResponseEntity.ok(ApiResponse.success(WeeklyScheduleDto.from(template)));
    }

    @PostMapping("/{id}/days/{day}/shifts")
    public ResponseEntity<ApiResponse<WeeklyScheduleDto>> addShift(@PathVariable Long id,
                                                                   @PathVariable String day,
                                                                   @RequestBody WeeklyScheduleService.PatternCommand body) {
        WeeklyScheduleTemplate template = weeklyScheduleService.addPattern(id, Weekday.fromKey(day), body);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Shift added to " + day, WeeklyScheduleDto.from(template)));
    }

    @DeleteMapping("/{id}/days/{day}/shifts/{index}")
    public ResponseEntity<ApiResponse<WeeklyScheduleDto>> removeShift(@PathVariable Long id,
                                                                      @PathVariable String day,
                                                                      @PathVariable int index) {
        WeeklyScheduleTemplate template = weeklyScheduleService.removePattern(id, Weekday.fromKey(day), index);
        return ResponseEntity.ok(ApiResponse.success("Shift removed from " + day, WeeklyScheduleDto.from(template)));
    }

    @PatchMapping("/{id}/days/{day}/toggle")
    public ResponseEntity<ApiResponse<WeeklyScheduleDto>> toggleDay(@PathVariable Long id, @PathVariable String day) {
        WeeklyScheduleTemplate template = weeklyScheduleService.toggleDay(id, Weekday.fromKey(day));
        return ResponseEntity.ok(ApiResponse.success("Day status updated", WeeklyScheduleDto.from(template)));
    }

    // Candidates only; nothing is saved
    @GetMapping("/home/{homeId}/materialize")
    public ResponseEntity<ApiResponse<List<ShiftDto>>> materialize(
            @PathVariable Long homeId,
            @RequestParam("weekStart") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate weekStart) {
        List<ShiftDto> data = weeklyScheduleService.materializeWeek(homeId, weekStart).stream()
                .map(ShiftDto::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(data.size() + " shifts to create", data));
    }

    @PostMapping("/home/{homeId}/generate")
    public ResponseEntity<ApiResponse<MaterializationReport>> generate(
            @PathVariable Long homeId,
            @RequestParam("weekStart") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate weekStart) {
        MaterializationReport report = weeklyScheduleService.generateWeek(homeId, weekStart);
        Map<String, Object> meta = new HashMap<>();
        meta.put("requested", report.requested());
        meta.put("created", report.succeeded());
        meta.put("skipped", report.skipped());
        meta.put("failed", report.failures().size());
        String message = report.succeeded() + " of " + (report.requested() - report.skipped()) + " shifts created";
        return ResponseEntity.ok(ApiResponse.success(message, report, meta));
    }
}
