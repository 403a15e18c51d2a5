package com.example.carerota.shift;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.time.LocalDateTime;

@Embeddable
public class StaffAssignment {

    @Column(name = "staff_id", nullable = false)
    private Long staffId;

    @Column(name = "assigned_at", nullable = false)
    private LocalDateTime assignedAt;

    @Column(name = "note")
    private String note;

    protected StaffAssignment() {
    }

    public StaffAssignment(Long staffId, LocalDateTime assignedAt, String note) {
        this.staffId = staffId;
        this.assignedAt = assignedAt;
        this.note = note;
    }

    public Long getStaffId() { return staffId; }
    public LocalDateTime getAssignedAt() { return assignedAt; }
    public String getNote() { return note; }
}
