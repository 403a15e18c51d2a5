package com.example.carerota.conflict;

import com.example.carerota.access.RotaDataAccess;
import com.example.carerota.config.RotaSettings;
import com.example.carerota.exception.ResourceNotFoundException;
import com.example.carerota.shift.Shift;
import com.example.carerota.shift.ShiftRepository;
import com.example.carerota.shift.StaffAssignment;
import com.example.carerota.staff.StaffMember;
import com.example.carerota.staff.StaffMemberRepository;
import com.example.carerota.time.OverlapDetector;
import com.example.carerota.time.ShiftInterval;
import com.example.carerota.time.TimeInterval;
import com.example.carerota.timeoff.TimeOffRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only conflict queries: overlap checks for a home, pre-flight evaluation of a
 * single assignment, and the consistency scan over existing assignments. The last
 * two go through the same {@link AssignmentConflictEvaluator} call.
 */
@Service
@Transactional(readOnly = true)
public class ConflictCheckService {

    private static final Logger logger = LoggerFactory.getLogger(ConflictCheckService.class);

    private final RotaDataAccess dataAccess;
    private final ShiftRepository shiftRepository;
    private final StaffMemberRepository staffRepository;
    private final OverlapDetector overlapDetector;
    private final AssignmentConflictEvaluator evaluator;
    private final RotaSettings settings;

    public ConflictCheckService(RotaDataAccess dataAccess,
                                ShiftRepository shiftRepository,
                                StaffMemberRepository staffRepository,
                                OverlapDetector overlapDetector,
                                AssignmentConflictEvaluator evaluator,
                                RotaSettings settings) {
        this.dataAccess = dataAccess;
        this.shiftRepository = shiftRepository;
        this.staffRepository = staffRepository;
        this.overlapDetector = overlapDetector;
        this.evaluator = evaluator;
        this.settings = settings;
    }

    /**
     * Whether the window overlaps any active shift of the home on the date or the
     * neighbouring dates. {@code excludeShiftId} skips the shift being edited.
     */
    public boolean checkOverlap(TimeInterval candidate, LocalDate date, Long homeId, Long excludeShiftId) {
        return !findOverlappingShifts(candidate, date, homeId, excludeShiftId).isEmpty();
    }

    public List<Shift> findOverlappingShifts(TimeInterval candidate, LocalDate date, Long homeId, Long excludeShiftId) {
        ShiftInterval interval = ShiftInterval.of(date, candidate);
        List<Shift> nearby = dataAccess.getShifts(homeId, date.minusDays(1), date.plusDays(1)).stream()
                .filter(Shift::isActive)
                .filter(s -> excludeShiftId == null || !excludeShiftId.equals(s.getId()))
                .toList();
        return overlapDetector.findOverlapping(interval, nearby, Shift::interval);
    }

    public ConflictResult evaluateAssignment(Long shiftId, Long userId) {
        Shift shift = shiftRepository.findById(shiftId)
                .orElseThrow(() -> new ResourceNotFoundException("Shift", shiftId));
        return evaluate(shift, userId);
    }

    /**
     * Evaluates against freshly loaded time off and shifts of the staff member.
     */
    public ConflictResult evaluate(Shift shift, Long userId) {
        return evaluate(shift, userId, null);
    }

    /**
     * Same as {@link #evaluate(Shift, Long)}, treating {@code releasedShiftId} as already
     * given up by the staff member. Used when checking one side of a swap.
     */
    public ConflictResult evaluate(Shift shift, Long userId, Long releasedShiftId) {
        StaffMember staff = staffRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("Staff member", userId));
        LocalDate date = shift.getWorkDate();
        List<Shift> current = dataAccess.getShiftsForStaff(userId, date.minusDays(1), date.plusDays(1)).stream()
                .filter(s -> releasedShiftId == null || !releasedShiftId.equals(s.getId()))
                .toList();
        AssignmentContext context = new AssignmentContext(
                dataAccess.getApprovedTimeOff(userId, date, date), current, dailyHourLimit(staff));
        ConflictResult result = evaluator.evaluate(shift, userId, context);
        if (result.isConflict()) {
            logger.debug("Assignment of staff {} to shift {} on {}: {}", userId, shift.getId(), date, result.type());
        }
        return result;
    }

    /**
     * Shifts in [from, to] the staff member could pick up: active, short of their
     * required headcount, in one of the staff member's homes, not already theirs, and
     * free of conflicts. {@code homeIds} narrows the homes further when given.
     */
    public List<Shift> findAvailableShifts(Long userId, LocalDate from, LocalDate to, Collection<Long> homeIds) {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("End date must not be before start date");
        }
        StaffMember staff = staffRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("Staff member", userId));
        Set<Long> homes = new TreeSet<>(staff.homeIds());
        if (homeIds != null && !homeIds.isEmpty()) {
            homes.retainAll(homeIds);
        }
        // one context covers the whole range; the evaluator matches by date
        AssignmentContext context = new AssignmentContext(
                dataAccess.getApprovedTimeOff(userId, from, to),
                dataAccess.getShiftsForStaff(userId, from.minusDays(1), to.plusDays(1)),
                dailyHourLimit(staff));

        List<Shift> available = new ArrayList<>();
        for (Long homeId : homes) {
            for (Shift shift : dataAccess.getShifts(homeId, from, to)) {
                if (!shift.isActive() || shift.isAssigned(userId) || !shift.needsStaff()) {
                    continue;
                }
                if (!evaluator.evaluate(shift, userId, context).isConflict()) {
                    available.add(shift);
                }
            }
        }
        available.sort(Comparator.comparing(Shift::getWorkDate).thenComparing(Shift::getStartTime));
        logger.debug("Staff {} can pick up {} shifts between {} and {}", userId, available.size(), from, to);
        return available;
    }

    /**
     * Re-evaluates every assignment on the home's active shifts in [from, to] and
     * returns the ones that would be refused today.
     */
    public List<ConflictReport> scanConflicts(Long homeId, LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("End date must not be before start date");
        }
        List<Shift> shifts = dataAccess.getShifts(homeId, from, to).stream()
                .filter(Shift::isActive)
                .toList();

        Map<Long, StaffContext> perStaff = new HashMap<>();
        List<ConflictReport> reports = new ArrayList<>();
        for (Shift shift : shifts) {
            for (StaffAssignment assignment : shift.getAssignments()) {
                Long staffId = assignment.getStaffId();
                StaffContext staffContext = perStaff.computeIfAbsent(staffId, id -> loadStaffContext(id, from, to));
                AssignmentContext context = new AssignmentContext(
                        staffContext.timeOff(), staffContext.shifts(), staffContext.limit());
                ConflictResult result = evaluator.evaluate(shift, staffId, context);
                if (result.isConflict()) {
                    reports.add(new ConflictReport(shift.getId(), homeId, shift.getWorkDate(),
                            shift.getStartTime(), shift.getEndTime(), staffId, staffContext.name(),
                            result.type(), result.message(), result.details()));
                }
            }
        }
        logger.debug("Scanned {} shifts of home {} from {} to {}: {} conflicts",
                shifts.size(), homeId, from, to, reports.size());
        return reports;
    }

    public double dailyHourLimit(StaffMember staff) {
        Integer own = staff.getMaxHoursPerDay();
        return own != null && own > 0 ? own : settings.getDefaultDailyHourLimit();
    }

    private StaffContext loadStaffContext(Long staffId, LocalDate from, LocalDate to) {
        StaffMember staff = staffRepository.findById(staffId).orElse(null);
        if (staff == null) {
            logger.warn("Shift assignment refers to unknown staff member {}", staffId);
        }
        List<TimeOffRequest> timeOff = dataAccess.getApprovedTimeOff(staffId, from, to);
        List<Shift> shifts = dataAccess.getShiftsForStaff(staffId, from.minusDays(1), to.plusDays(1));
        double limit = staff == null ? settings.getDefaultDailyHourLimit() : dailyHourLimit(staff);
        String name = staff == null ? null : staff.getName();
        return new StaffContext(name, timeOff, shifts, limit);
    }

    private record StaffContext(String name, List<TimeOffRequest> timeOff, List<Shift> shifts, double limit) {}
}
