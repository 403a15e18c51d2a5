package com.example.carerota.home;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface HomeRepository extends JpaRepository<Home, Long> {

    List<Home> findByActiveTrue();
}
