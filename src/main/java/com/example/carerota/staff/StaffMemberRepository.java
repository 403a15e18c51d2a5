package com.example.carerota.staff;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface StaffMemberRepository extends JpaRepository<StaffMember, Long> {

    /**
     * Staff with their home memberships loaded, for visibility checks.
     */
    @Query("SELECT DISTINCT s FROM StaffMember s LEFT JOIN FETCH s.homes WHERE s.id IN :ids")
    List<StaffMember> findWithHomesByIdIn(@Param("ids") Collection<Long> ids);
}
