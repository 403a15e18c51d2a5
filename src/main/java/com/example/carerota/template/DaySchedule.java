package com.example.carerota.template;

import com.example.carerota.time.Weekday;
import jakarta.persistence.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Entity
@Table(name = "day_schedules",
        uniqueConstraints = @UniqueConstraint(columnNames = {"template_id", "weekday"}))
public class DaySchedule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "template_id", nullable = false)
    private WeeklyScheduleTemplate template;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Weekday weekday;

    @Column(name = "is_active")
    private Boolean active = true;

    @ElementCollection
    @CollectionTable(name = "day_schedule_patterns", joinColumns = @JoinColumn(name = "day_schedule_id"))
    @OrderColumn(name = "position")
    private List<ShiftPattern> patterns = new ArrayList<>();

    protected DaySchedule() {
    }

    DaySchedule(WeeklyScheduleTemplate template, Weekday weekday) {
        this.template = template;
        this.weekday = weekday;
    }

    public boolean isActive() {
        return Boolean.TRUE.equals(active);
    }

    public void addPattern(ShiftPattern pattern) {
        patterns.add(pattern);
    }

    public ShiftPattern removePattern(int index) {
        if (index < 0 || index >= patterns.size()) {
            throw new IllegalArgumentException("No shift at position " + index + " on " + weekday.key());
        }
        return patterns.remove(index);
    }

    public Long getId() { return id; }
    public WeeklyScheduleTemplate getTemplate() { return template; }
    public Weekday getWeekday() { return weekday; }
    public Boolean getActive() { return active; }
    public void setActive(Boolean active) { this.active = active; }
    public List<ShiftPattern> getPatterns() { return Collections.unmodifiableList(patterns); }
}
