package com.example.carerota.swap;

import com.example.carerota.common.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/shift-swaps")
public class ShiftSwapController {

    private final ShiftSwapService swapService;

    public ShiftSwapController(ShiftSwapService swapService) {
        this.swapService = swapService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<ShiftSwap>>> forStaff(
            @RequestParam Long userId,
            @RequestParam(required = false) ShiftSwapService.Direction direction) {
        return ResponseEntity.ok(ApiResponse.success(swapService.forStaff(userId, direction)));
    }

    @GetMapping("/pending")
    public ResponseEntity<ApiResponse<List<ShiftSwap>>> pending(@RequestParam Long userId) {
        List<ShiftSwap> swaps = swapService.awaitingResponse(userId);
        return ResponseEntity.ok(ApiResponse.success(swaps.size() + " swap requests awaiting response", swaps));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ShiftSwap>> get(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(swapService.getSwap(id)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<ShiftSwap>> create(@Valid @RequestBody CreateSwapRequest body) {
        ShiftSwap swap = swapService.create(new ShiftSwapService.SwapCommand(body.requesterId(),
                body.requesterShiftId(), body.targetShiftId(), body.targetUserId(), body.message()));
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success("Swap requested", swap));
    }

    @PutMapping("/{id}/approve")
    public ResponseEntity<ApiResponse<ShiftSwap>> approve(@PathVariable Long id, @Valid @RequestBody DecisionBody body) {
        return ResponseEntity.ok(ApiResponse.success("Swap approved",
                swapService.approve(id, body.responderId(), body.message())));
    }

    @PutMapping("/{id}/reject")
    public ResponseEntity<ApiResponse<ShiftSwap>> reject(@PathVariable Long id, @Valid @RequestBody DecisionBody body) {
        return ResponseEntity.ok(ApiResponse.success("Swap rejected",
                swapService.reject(id, body.responderId(), body.message())));
    }

    @PutMapping("/{id}/cancel")
    public ResponseEntity<ApiResponse<ShiftSwap>> cancel(@PathVariable Long id, @Valid @RequestBody CancelBody body) {
        return ResponseEntity.ok(ApiResponse.success("Swap cancelled", swapService.cancel(id, body.requesterId())));
    }

    public record CreateSwapRequest(@NotNull(message = "requesterId is required") Long requesterId,
                                    @NotNull(message = "requesterShiftId is required") Long requesterShiftId,
                                    @NotNull(message = "targetShiftId is required") Long targetShiftId,
                                    Long targetUserId,
                                    String message) {}

    public record DecisionBody(@NotNull(message = "responderId is required") Long responderId, String message) {}

    public record CancelBody(@NotNull(message = "requesterId is required") Long requesterId) {}
}
