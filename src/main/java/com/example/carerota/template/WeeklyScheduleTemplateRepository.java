package com.example.carerota.template;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface WeeklyScheduleTemplateRepository extends JpaRepository<WeeklyScheduleTemplate, Long> {
    Optional<WeeklyScheduleTemplate> findByHome_Id(Long homeId);
}
