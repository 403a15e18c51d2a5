package com.example.carerota.shift;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface ShiftRepository extends JpaRepository<Shift, Long> {

    /**
     * Shifts of a home in the date range, soft-deleted ones included.
     */
    List<Shift> findByHome_IdAndWorkDateBetweenOrderByWorkDateAscStartTimeAsc(Long homeId, LocalDate from, LocalDate to);

    /**
     * Active shifts the staff member is assigned to in the date range, across all homes.
     */
    @Query("SELECT DISTINCT s FROM Shift s JOIN s.assignments a " +
           "WHERE a.staffId = :staffId AND s.active = true AND s.workDate BETWEEN :from AND :to " +
           "ORDER BY s.workDate, s.startTime")
    List<Shift> findActiveAssignedToStaff(@Param("staffId") Long staffId,
                                          @Param("from") LocalDate from,
                                          @Param("to") LocalDate to);

    long countByHome_IdAndWorkDateBetween(Long homeId, LocalDate from, LocalDate to);
}
