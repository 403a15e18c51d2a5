package com.example.carerota.shift;

import com.example.carerota.careservice.CareService;
import com.example.carerota.home.Home;
import com.example.carerota.time.ShiftInterval;
import com.example.carerota.time.TimeOfDay;
import jakarta.persistence.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

@Entity
@Table(name = "shifts", indexes = {
        @Index(name = "idx_shifts_home_date", columnList = "home_id, work_date")
})
public class Shift {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "home_id", nullable = false)
    private Home home;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "service_id", nullable = false)
    private CareService service;

    @Column(name = "work_date", nullable = false)
    private LocalDate workDate;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(name = "required_staff_count", nullable = false)
    private Integer requiredStaffCount = 1;

    @Enumerated(EnumType.STRING)
    @Column(name = "shift_type", nullable = false)
    private ShiftType shiftType = ShiftType.DAY;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "shift_staff_assignments",
            joinColumns = @JoinColumn(name = "shift_id"),
            uniqueConstraints = @UniqueConstraint(columnNames = {"shift_id", "staff_id"}))
    private List<StaffAssignment> assignments = new ArrayList<>();

    @Column(length = 1000)
    private String notes;

    @Column(name = "is_active")
    private Boolean active = true;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    protected Shift() {
    }

    public Shift(Home home, CareService service, LocalDate workDate, LocalTime startTime, LocalTime endTime,
                 ShiftType shiftType, int requiredStaffCount) {
        this.home = home;
        this.service = service;
        this.workDate = workDate;
        this.startTime = startTime;
        this.endTime = endTime;
        this.shiftType = shiftType;
        this.requiredStaffCount = requiredStaffCount;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public ShiftInterval interval() {
        return new ShiftInterval(workDate, TimeOfDay.of(startTime).minutes(), TimeOfDay.of(endTime).minutes());
    }

    public double durationHours() {
        return interval().durationHours();
    }

    public ShiftStatus status() {
        return ShiftStatus.of(assignments.size(), requiredStaffCount == null ? 1 : requiredStaffCount);
    }

    public boolean needsStaff() {
        return assignments.size() < (requiredStaffCount == null ? 1 : requiredStaffCount);
    }

    public boolean isAssigned(Long staffId) {
        return assignments.stream().anyMatch(a -> a.getStaffId().equals(staffId));
    }

    /**
     * Adds the staff member unless already assigned.
     *
     * @return false when the staff member was already on this shift
     */
    public boolean assign(Long staffId, String note) {
        if (isAssigned(staffId)) {
            return false;
        }
        assignments.add(new StaffAssignment(staffId, LocalDateTime.now(), note));
        return true;
    }

    public boolean unassign(Long staffId) {
        return assignments.removeIf(a -> a.getStaffId().equals(staffId));
    }

    public boolean isActive() {
        return Boolean.TRUE.equals(active);
    }

    public Long getHomeId() {
        return home == null ? null : home.getId();
    }

    public Long getServiceId() {
        return service == null ? null : service.getId();
    }

    public Long getId() { return id; }
    public Home getHome() { return home; }
    public void setHome(Home home) { this.home = home; }
    public CareService getService() { return service; }
    public void setService(CareService service) { this.service = service; }
    public LocalDate getWorkDate() { return workDate; }
    public void setWorkDate(LocalDate workDate) { this.workDate = workDate; }
    public LocalTime getStartTime() { return startTime; }
    public void setStartTime(LocalTime startTime) { this.startTime = startTime; }
    public LocalTime getEndTime() { return endTime; }
    public void setEndTime(LocalTime endTime) { this.endTime = endTime; }
    public Integer getRequiredStaffCount() { return requiredStaffCount; }
    public void setRequiredStaffCount(Integer requiredStaffCount) { this.requiredStaffCount = requiredStaffCount; }
    public ShiftType getShiftType() { return shiftType; }
    public void setShiftType(ShiftType shiftType) { this.shiftType = shiftType; }
    public List<StaffAssignment> getAssignments() { return Collections.unmodifiableList(assignments); }
    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }
    public Boolean getActive() { return active; }
    public void setActive(Boolean active) { this.active = active; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public LocalDateTime getUpdatedAt() { return updatedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Shift other = (Shift) o;
        return id != null && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }
}
