package com.example.carerota.careservice;

import org.springframework.data.jpa.repository.JpaRepository;

public interface CareServiceRepository extends JpaRepository<CareService, Long> {
}
