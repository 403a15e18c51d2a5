package com.example.carerota.timeoff;

import com.example.carerota.staff.StaffMember;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

@Entity
@Table(name = "time_off_requests")
public class TimeOffRequest {
    public enum Status { PENDING, APPROVED, REJECTED }

    public enum Type { ANNUAL_LEAVE, SICK_LEAVE, PERSONAL_LEAVE, BEREAVEMENT, OTHER }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @JsonIgnore
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "staff_id", nullable = false)
    private StaffMember staffMember;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Column(length = 500)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(name = "request_type", nullable = false)
    private Type requestType = Type.ANNUAL_LEAVE;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private Status status = Status.PENDING;

    @Column(name = "decided_by")
    private Long decidedBy;

    @Column(name = "decided_at")
    private LocalDateTime decidedAt;

    @Column(name = "denial_reason")
    private String denialReason;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    protected TimeOffRequest() {}

    public TimeOffRequest(StaffMember staffMember, LocalDate startDate, LocalDate endDate, Type requestType, String reason) {
        this.staffMember = staffMember;
        this.startDate = startDate;
        this.endDate = endDate;
        this.requestType = requestType == null ? Type.ANNUAL_LEAVE : requestType;
        this.reason = reason;
    }

    @PrePersist
    protected void onCreate() { this.createdAt = LocalDateTime.now(); this.updatedAt = LocalDateTime.now(); }
    @PreUpdate
    protected void onUpdate() { this.updatedAt = LocalDateTime.now(); }

    /**
     * Inclusive on both ends.
     */
    public boolean covers(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }

    public long durationDays() {
        return ChronoUnit.DAYS.between(startDate, endDate) + 1;
    }

    public boolean isApproved() {
        return status == Status.APPROVED;
    }

    public Long getId() { return id; }
    public StaffMember getStaffMember() { return staffMember; }
    public Long getStaffId() { return staffMember == null ? null : staffMember.getId(); }
    public LocalDate getStartDate() { return startDate; }
    public void setStartDate(LocalDate startDate) { this.startDate = startDate; }
    public LocalDate getEndDate() { return endDate; }
    public void setEndDate(LocalDate endDate) { this.endDate = endDate; }
    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }
    public Type getRequestType() { return requestType; }
    public void setRequestType(Type requestType) { this.requestType = requestType; }
    public Status getStatus() { return status; }
    public void setStatus(Status status) { this.status = status; }
    public Long getDecidedBy() { return decidedBy; }
    public void setDecidedBy(Long decidedBy) { this.decidedBy = decidedBy; }
    public LocalDateTime getDecidedAt() { return decidedAt; }
    public void setDecidedAt(LocalDateTime decidedAt) { this.decidedAt = decidedAt; }
    public String getDenialReason() { return denialReason; }
    public void setDenialReason(String denialReason) { this.denialReason = denialReason; }
}
