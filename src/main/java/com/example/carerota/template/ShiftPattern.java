package com.example.carerota.template;

import com.example.carerota.careservice.CareService;
import com.example.carerota.shift.ShiftType;
import com.example.carerota.time.TimeInterval;
import com.example.carerota.time.TimeOfDay;
import jakarta.persistence.*;

import java.time.LocalTime;

/**
 * A shift stamp inside a weekly template: same shape as a shift but without date or staff.
 */
@Embeddable
public class ShiftPattern {

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "service_id", nullable = false)
    private CareService service;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "shift_type", nullable = false)
    private ShiftType shiftType;

    @Column(name = "required_staff_count", nullable = false)
    private Integer requiredStaffCount = 1;

    @Column(name = "notes")
    private String notes;

    protected ShiftPattern() {
    }

    public ShiftPattern(CareService service, LocalTime startTime, LocalTime endTime, ShiftType shiftType,
                        int requiredStaffCount, String notes) {
        this.service = service;
        this.startTime = startTime;
        this.endTime = endTime;
        this.shiftType = shiftType;
        this.requiredStaffCount = requiredStaffCount;
        this.notes = notes;
    }

    public TimeInterval time() {
        return new TimeInterval(TimeOfDay.of(startTime), TimeOfDay.of(endTime));
    }

    public double durationHours() {
        return time().durationHours();
    }

    public CareService getService() { return service; }
    public LocalTime getStartTime() { return startTime; }
    public LocalTime getEndTime() { return endTime; }
    public ShiftType getShiftType() { return shiftType; }
    public Integer getRequiredStaffCount() { return requiredStaffCount; }
    public String getNotes() { return notes; }
}
