package com.example.carerota.hours;

import com.example.carerota.common.ApiResponse;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/hours")
public class HoursSummaryController {

    private final HoursSummaryService hoursSummaryService;

    public HoursSummaryController(HoursSummaryService hoursSummaryService) {
        this.hoursSummaryService = hoursSummaryService;
    }

    @GetMapping("/summary")
    public ResponseEntity<ApiResponse<HoursSummary>> summary(
            @RequestParam Long homeId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate weekStart) {
        return ResponseEntity.ok(ApiResponse.success(hoursSummaryService.weeklySummary(homeId, weekStart)));
    }
}
