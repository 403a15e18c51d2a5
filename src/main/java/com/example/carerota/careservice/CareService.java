package com.example.carerota.careservice;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;

/**
 * A kind of care delivered at a home (personal care, medication round, ...).
 * Shifts and shift patterns are always attached to one.
 */
@Entity
@Table(name = "care_services")
public class CareService {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank(message = "Service name is required")
    @Column(nullable = false)
    private String name;

    @Column
    private String category;

    @Column(name = "is_active")
    private Boolean active = true;

    protected CareService() {
    }

    public CareService(String name, String category) {
        this.name = name;
        this.category = category;
    }

    public Long getId() { return id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }
    public Boolean getActive() { return active; }
    public void setActive(Boolean active) { this.active = active; }
}
