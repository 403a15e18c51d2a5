package com.example.carerota.staff;

import com.example.carerota.home.Home;
import jakarta.persistence.*;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;

@Entity
@Table(name = "staff_members")
public class StaffMember {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    @NotBlank(message = "Staff name is required")
    @Size(max = 100, message = "Staff name must be at most 100 characters")
    private String name;

    @Email(message = "Email must be a valid address")
    @Column(unique = true)
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StaffRole role = StaffRole.SUPPORT_WORKER;

    @ManyToMany(fetch = FetchType.EAGER)
    @JoinTable(name = "staff_homes",
            joinColumns = @JoinColumn(name = "staff_id"),
            inverseJoinColumns = @JoinColumn(name = "home_id"))
    private Set<Home> homes = new HashSet<>();

    // per-person override of rota.conflict.daily-hour-limit
    @Column(name = "max_hours_per_day")
    private Integer maxHoursPerDay;

    @Column(name = "is_active")
    private Boolean active = true;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    protected StaffMember() {
    }

    public StaffMember(String name, String email, StaffRole role) {
        this.name = name;
        this.email = email;
        this.role = role;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public Set<Long> homeIds() {
        return homes.stream().map(Home::getId).collect(Collectors.toSet());
    }

    public Long getId() { return id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getEmail() { return email; }
    public void setEmail(String email) { this.email = email; }
    public StaffRole getRole() { return role; }
    public void setRole(StaffRole role) { this.role = role; }
    public Set<Home> getHomes() { return homes; }
    public void setHomes(Set<Home> homes) { this.homes = homes; }
    public Integer getMaxHoursPerDay() { return maxHoursPerDay; }
    public void setMaxHoursPerDay(Integer maxHoursPerDay) { this.maxHoursPerDay = maxHoursPerDay; }
    public Boolean getActive() { return active; }
    public void setActive(Boolean active) { this.active = active; }
    public LocalDateTime getCreatedAt() { return createdAt; }
}
