package com.example.carerota.visibility;

import com.example.carerota.staff.StaffMember;
import com.example.carerota.staff.StaffRole;

import java.util.Set;

/**
 * Who is asking for a shift list. A null role sees nothing.
 */
public record Caller(StaffRole role, Set<Long> homeIds, Long userId) {

    public Caller {
        homeIds = homeIds == null ? Set.of() : Set.copyOf(homeIds);
    }

    public static Caller of(StaffMember staff) {
        return new Caller(staff.getRole(), staff.homeIds(), staff.getId());
    }
}
