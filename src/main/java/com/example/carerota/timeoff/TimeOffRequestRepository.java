package com.example.carerota.timeoff;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;

public interface TimeOffRequestRepository extends JpaRepository<TimeOffRequest, Long> {

    List<TimeOffRequest> findByStaffMember_IdOrderByStartDateDesc(Long staffId);

    /**
     * Requests in the given status whose [start, end] range intersects [from, to].
     */
    @Query("SELECT t FROM TimeOffRequest t WHERE t.staffMember.id = :staffId AND t.status = :status " +
           "AND t.startDate <= :to AND t.endDate >= :from ORDER BY t.startDate")
    List<TimeOffRequest> findIntersecting(@Param("staffId") Long staffId,
                                          @Param("status") TimeOffRequest.Status status,
                                          @Param("from") LocalDate from,
                                          @Param("to") LocalDate to);
}
