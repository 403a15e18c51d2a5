package com.example.carerota.admin;

import com.example.carerota.common.ApiResponse;
import com.example.carerota.common.error.ErrorLogBuffer;
import com.example.carerota.home.HomeRepository;
import com.example.carerota.shift.ShiftRepository;
import com.example.carerota.staff.StaffMemberRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private final ErrorLogBuffer errorLogBuffer;
    private final HomeRepository homeRepository;
    private final StaffMemberRepository staffRepository;
    private final ShiftRepository shiftRepository;

    public AdminController(ErrorLogBuffer errorLogBuffer,
                           HomeRepository homeRepository,
                           StaffMemberRepository staffRepository,
                           ShiftRepository shiftRepository) {
        this.errorLogBuffer = errorLogBuffer;
        this.homeRepository = homeRepository;
        this.staffRepository = staffRepository;
        this.shiftRepository = shiftRepository;
    }

    @GetMapping("/status")
    public ResponseEntity<ApiResponse<Map<String, Object>>> status() {
        Map<String, Object> data = new HashMap<>();
        data.put("homes", homeRepository.count());
        data.put("staff", staffRepository.count());
        data.put("shifts", shiftRepository.count());
        data.put("recentErrors", errorLogBuffer.recent().size());
        data.put("failedScans", errorLogBuffer.recent(ErrorLogBuffer.Source.CONFLICT_SCAN, null).size());
        return ResponseEntity.ok(ApiResponse.success("system status", data));
    }

    @GetMapping("/error-logs")
    public ResponseEntity<ApiResponse<Map<String, Object>>> errorLogs(
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) ErrorLogBuffer.Source source,
            @RequestParam(required = false) Long homeId) {
        List<ErrorLogBuffer.Entry> list = errorLogBuffer.recent(source, homeId);
        if (limit != null && limit > 0 && list.size() > limit) {
            list = list.subList(0, limit);
        }
        Map<String, Object> data = new HashMap<>();
        data.put("count", list.size());
        data.put("items", list);
        return ResponseEntity.ok(ApiResponse.success("recent error logs", data));
    }

    @DeleteMapping("/error-logs")
    public ResponseEntity<ApiResponse<Void>> clearErrorLogs() {
        errorLogBuffer.clear();
        return ResponseEntity.ok(ApiResponse.success("error logs cleared", null));
    }
}
