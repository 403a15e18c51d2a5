package com.example.carerota.swap;

import jakarta.persistence.*;

import java.time.LocalDateTime;

/**
 * A request by one staff member to trade their shift for a colleague's shift in the
 * same home. Approval by the colleague exchanges the two assignments.
 */
@Entity
@Table(name = "shift_swaps", indexes = {
        @Index(name = "idx_shift_swaps_requester", columnList = "requester_id"),
        @Index(name = "idx_shift_swaps_target_user", columnList = "target_user_id")
})
public class ShiftSwap {

    public enum Status { PENDING, APPROVED, REJECTED, CANCELLED }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "home_id", nullable = false)
    private Long homeId;

    @Column(name = "requester_shift_id", nullable = false)
    private Long requesterShiftId;

    @Column(name = "target_shift_id", nullable = false)
    private Long targetShiftId;

    @Column(name = "requester_id", nullable = false)
    private Long requesterId;

    @Column(name = "target_user_id", nullable = false)
    private Long targetUserId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Status status = Status.PENDING;

    @Column(name = "requester_message", length = 500)
    private String requesterMessage;

    @Column(name = "response_message", length = 500)
    private String responseMessage;

    @Column(name = "requested_at", nullable = false)
    private LocalDateTime requestedAt;

    @Column(name = "responded_at")
    private LocalDateTime respondedAt;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    protected ShiftSwap() {
    }

    public ShiftSwap(Long homeId, Long requesterShiftId, Long targetShiftId, Long requesterId, Long targetUserId,
                     String requesterMessage, LocalDateTime requestedAt, LocalDateTime expiresAt) {
        this.homeId = homeId;
        this.requesterShiftId = requesterShiftId;
        this.targetShiftId = targetShiftId;
        this.requesterId = requesterId;
        this.targetUserId = targetUserId;
        this.requesterMessage = requesterMessage;
        this.requestedAt = requestedAt;
        this.expiresAt = expiresAt;
    }

    public boolean isExpired() {
        return status == Status.PENDING && expiresAt != null && LocalDateTime.now().isAfter(expiresAt);
    }

    /**
     * Marks the request decided. Only pending requests can be decided.
     */
    public void decide(Status outcome, String message) {
        if (status != Status.PENDING) {
            throw new IllegalStateException("Swap request " + id + " is already " + status);
        }
        this.status = outcome;
        this.responseMessage = message;
        this.respondedAt = LocalDateTime.now();
    }

    public Long getId() { return id; }
    public Long getHomeId() { return homeId; }
    public Long getRequesterShiftId() { return requesterShiftId; }
    public Long getTargetShiftId() { return targetShiftId; }
    public Long getRequesterId() { return requesterId; }
    public Long getTargetUserId() { return targetUserId; }
    public Status getStatus() { return status; }
    public String getRequesterMessage() { return requesterMessage; }
    public String getResponseMessage() { return responseMessage; }
    public LocalDateTime getRequestedAt() { return requestedAt; }
    public LocalDateTime getRespondedAt() { return respondedAt; }
    public LocalDateTime getExpiresAt() { return expiresAt; }
    public void setExpiresAt(LocalDateTime expiresAt) { this.expiresAt = expiresAt; }
}
