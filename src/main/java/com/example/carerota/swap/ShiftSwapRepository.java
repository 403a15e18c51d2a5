package com.example.carerota.swap;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ShiftSwapRepository extends JpaRepository<ShiftSwap, Long> {

    List<ShiftSwap> findByRequesterIdOrderByRequestedAtDesc(Long requesterId);

    List<ShiftSwap> findByTargetUserIdOrderByRequestedAtDesc(Long targetUserId);

    List<ShiftSwap> findByTargetUserIdAndStatusOrderByRequestedAtDesc(Long targetUserId, ShiftSwap.Status status);

    @Query("SELECT s FROM ShiftSwap s WHERE s.status = :status " +
           "AND (s.requesterShiftId IN :shiftIds OR s.targetShiftId IN :shiftIds)")
    List<ShiftSwap> findByStatusInvolvingShifts(@Param("status") ShiftSwap.Status status,
                                                @Param("shiftIds") List<Long> shiftIds);
}
