package com.example.carerota.timeoff;

import com.example.carerota.common.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/time-off")
public class TimeOffController {

    private final TimeOffService timeOffService;

    public TimeOffController(TimeOffService timeOffService) {
        this.timeOffService = timeOffService;
    }

    @PostMapping
    public ResponseEntity<ApiResponse<TimeOffRequest>> submit(@Valid @RequestBody SubmitBody body) {
        TimeOffRequest saved = timeOffService.submit(body.userId(), body.startDate(), body.endDate(),
                body.requestType(), body.reason());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success("Time off requested", saved));
    }

    @PutMapping("/{id}/approve")
    public ResponseEntity<ApiResponse<TimeOffRequest>> approve(@PathVariable Long id,
                                                               @RequestBody(required = false) DecisionBody body) {
        Long approver = body == null ? null : body.approverId();
        return ResponseEntity.ok(ApiResponse.success("Time off approved", timeOffService.approve(id, approver)));
    }

    @PutMapping("/{id}/reject")
    public ResponseEntity<ApiResponse<TimeOffRequest>> reject(@PathVariable Long id,
                                                              @RequestBody(required = false) DecisionBody body) {
        Long approver = body == null ? null : body.approverId();
        String reason = body == null ? null : body.reason();
        return ResponseEntity.ok(ApiResponse.success("Time off rejected", timeOffService.reject(id, approver, reason)));
    }

    @GetMapping("/user/{userId}")
    public ResponseEntity<ApiResponse<List<TimeOffRequest>>> forUser(@PathVariable Long userId) {
        return ResponseEntity.ok(ApiResponse.success(timeOffService.forStaff(userId)));
    }

    public record SubmitBody(@NotNull(message = "userId is required") Long userId,
                             @NotNull(message = "startDate is required") LocalDate startDate,
                             @NotNull(message = "endDate is required") LocalDate endDate,
                             TimeOffRequest.Type requestType,
                             String reason) {}

    public record DecisionBody(Long approverId, String reason) {}
}
