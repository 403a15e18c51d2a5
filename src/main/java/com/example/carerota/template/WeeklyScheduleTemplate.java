package com.example.carerota.template;

import com.example.carerota.home.Home;
import com.example.carerota.time.Weekday;
import jakarta.persistence.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Recurring per-weekday shift pattern of one home. A home has at most one template.
 */
@Entity
@Table(name = "weekly_schedule_templates")
public class WeeklyScheduleTemplate {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "home_id", nullable = false, unique = true)
    private Home home;

    @Column(name = "is_active")
    private Boolean active = true;

    @OneToMany(mappedBy = "template", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<DaySchedule> days = new ArrayList<>();

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    protected WeeklyScheduleTemplate() {
    }

    /**
     * Empty template with every day active and no shifts.
     */
    public static WeeklyScheduleTemplate createDefault(Home home) {
        WeeklyScheduleTemplate template = new WeeklyScheduleTemplate();
        template.home = home;
        for (Weekday weekday : Weekday.values()) {
            template.days.add(new DaySchedule(template, weekday));
        }
        return template;
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

    public Optional<DaySchedule> findDay(Weekday weekday) {
        return days.stream().filter(d -> d.getWeekday() == weekday).findFirst();
    }

    /**
     * The day's schedule, adding an active empty one if the row is missing.
     */
    public DaySchedule day(Weekday weekday) {
        return findDay(weekday)
                .orElseGet(() -> {
                    DaySchedule created = new DaySchedule(this, weekday);
                    days.add(created);
                    return created;
                });
    }

    public List<DaySchedule> orderedDays() {
        return days.stream().sorted(Comparator.comparing(DaySchedule::getWeekday)).toList();
    }

    public int totalWeeklyShifts() {
        return days.stream().filter(DaySchedule::isActive).mapToInt(d -> d.getPatterns().size()).sum();
    }

    public double totalWeeklyHours() {
        return days.stream()
                .filter(DaySchedule::isActive)
                .flatMap(d -> d.getPatterns().stream())
                .mapToDouble(ShiftPattern::durationHours)
                .sum();
    }

    public boolean isActive() {
        return Boolean.TRUE.equals(active);
    }

    public Long getId() { return id; }
    public Home getHome() { return home; }
    public Long getHomeId() { return home == null ? null : home.getId(); }
    public Boolean getActive() { return active; }
    public void setActive(Boolean active) { this.active = active; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public LocalDateTime getUpdatedAt() { return updatedAt; }
}
