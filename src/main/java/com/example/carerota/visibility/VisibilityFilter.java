package com.example.carerota.visibility;

import com.example.carerota.shift.Shift;
import com.example.carerota.shift.StaffAssignment;
import com.example.carerota.staff.StaffRole;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Narrows a shift list to what the caller's role may see.
 * <ul>
 *   <li>ADMIN, HOME_MANAGER: everything;</li>
 *   <li>SENIOR_STAFF: shifts with at least one assignee who shares a home with the caller;</li>
 *   <li>SUPPORT_WORKER: shifts the caller is assigned to.</li>
 * </ul>
 */
@Component
public class VisibilityFilter {

    @FunctionalInterface
    interface Rule {
        boolean visible(Shift shift, Caller caller, Function<Long, Set<Long>> staffHomes);
    }

    private final Map<StaffRole, Rule> rules = new EnumMap<>(StaffRole.class);

    public VisibilityFilter() {
        rules.put(StaffRole.ADMIN, (shift, caller, staffHomes) -> true);
        rules.put(StaffRole.HOME_MANAGER, (shift, caller, staffHomes) -> true);
        rules.put(StaffRole.SENIOR_STAFF, VisibilityFilter::sharesHomeWithAssignee);
        rules.put(StaffRole.SUPPORT_WORKER, (shift, caller, staffHomes) -> shift.isAssigned(caller.userId()));
        for (StaffRole role : StaffRole.values()) {
            if (!rules.containsKey(role)) {
                throw new IllegalStateException("No visibility rule for role " + role);
            }
        }
    }

    /**
     * @param staffHomes resolves a staff id to the ids of the homes they belong to
     */
    public List<Shift> filter(Collection<Shift> shifts, Caller caller, Function<Long, Set<Long>> staffHomes) {
        if (caller == null || caller.role() == null) {
            return Collections.emptyList();
        }
        Rule rule = rules.get(caller.role());
        return shifts.stream()
                .filter(shift -> rule.visible(shift, caller, staffHomes))
                .toList();
    }

    private static boolean sharesHomeWithAssignee(Shift shift, Caller caller, Function<Long, Set<Long>> staffHomes) {
        for (StaffAssignment assignment : shift.getAssignments()) {
            Set<Long> homes = staffHomes.apply(assignment.getStaffId());
            if (homes != null && !Collections.disjoint(homes, caller.homeIds())) {
                return true;
            }
        }
        return false;
    }
}
