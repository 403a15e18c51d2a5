package com.example.carerota.shift;

import com.example.carerota.careservice.CareService;
import com.example.carerota.careservice.CareServiceRepository;
import com.example.carerota.conflict.ConflictCheckService;
import com.example.carerota.conflict.ConflictResult;
import com.example.carerota.exception.AssignmentConflictException;
import com.example.carerota.exception.ResourceNotFoundException;
import com.example.carerota.home.Home;
import com.example.carerota.home.HomeRepository;
import com.example.carerota.staff.StaffMember;
import com.example.carerota.staff.StaffMemberRepository;
import com.example.carerota.time.TimeInterval;
import com.example.carerota.visibility.Caller;
import com.example.carerota.visibility.VisibilityFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Shift maintenance and staff assignment.
 * <p>
 * Assigning evaluates the candidate against the staff member's time off and other
 * shifts and commits only when there is no conflict. Evaluation and commit run
 * inside one transaction while holding the staff member's lock, so two concurrent
 * assignments of the same person cannot both pass the check, whatever their
 * dates or homes.
 */
@Service
public class ShiftAssignmentService {

    private static final Logger logger = LoggerFactory.getLogger(ShiftAssignmentService.class);

    private final ShiftRepository shiftRepository;
    private final HomeRepository homeRepository;
    private final CareServiceRepository careServiceRepository;
    private final StaffMemberRepository staffRepository;
    private final ConflictCheckService conflictCheckService;
    private final VisibilityFilter visibilityFilter;
    private final StaffLockRegistry staffLocks;
    private final TransactionTemplate transactionTemplate;

    public ShiftAssignmentService(ShiftRepository shiftRepository,
                                  HomeRepository homeRepository,
                                  CareServiceRepository careServiceRepository,
                                  StaffMemberRepository staffRepository,
                                  ConflictCheckService conflictCheckService,
                                  VisibilityFilter visibilityFilter,
                                  StaffLockRegistry staffLocks,
                                  PlatformTransactionManager transactionManager) {
        this.shiftRepository = shiftRepository;
        this.homeRepository = homeRepository;
        this.careServiceRepository = careServiceRepository;
        this.staffRepository = staffRepository;
        this.conflictCheckService = conflictCheckService;
        this.visibilityFilter = visibilityFilter;
        this.staffLocks = staffLocks;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Active shifts of the home in [from, to], narrowed to what the caller's role may see.
     */
    @Transactional(readOnly = true)
    public List<Shift> listShifts(Long homeId, LocalDate from, LocalDate to, Long callerId) {
        if (callerId == null) {
            throw new IllegalArgumentException("Caller is required");
        }
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("End date must not be before start date");
        }
        List<Shift> shifts = shiftRepository.findByHome_IdAndWorkDateBetweenOrderByWorkDateAscStartTimeAsc(homeId, from, to)
                .stream()
                .filter(Shift::isActive)
                .toList();
        StaffMember caller = staffRepository.findById(callerId)
                .orElseThrow(() -> new ResourceNotFoundException("Staff member", callerId));
        return visibilityFilter.filter(shifts, Caller.of(caller), staffHomes(shifts));
    }

    @Transactional(readOnly = true)
    public Shift getShift(Long shiftId) {
        return shiftRepository.findById(shiftId)
                .orElseThrow(() -> new ResourceNotFoundException("Shift", shiftId));
    }

    @Transactional
    public Shift createShift(ShiftCommand command) {
        if (command.homeId() == null) {
            throw new IllegalArgumentException("Home is required");
        }
        if (command.serviceId() == null) {
            throw new IllegalArgumentException("Service is required");
        }
        Home home = homeRepository.findById(command.homeId())
                .orElseThrow(() -> new ResourceNotFoundException("Home", command.homeId()));
        CareService service = careServiceRepository.findById(command.serviceId())
                .orElseThrow(() -> new ResourceNotFoundException("Service", command.serviceId()));
        TimeInterval time = TimeInterval.parse(command.startTime(), command.endTime());
        int staffCount = command.requiredStaffCount() == null ? 1 : command.requiredStaffCount();
        ShiftType type = command.shiftType() == null ? ShiftType.DAY : command.shiftType();

        Shift shift = new Shift(home, service, command.date(), time.start().toLocalTime(), time.end().toLocalTime(),
                type, staffCount);
        shift.setNotes(command.notes());
        ShiftValidator.validate(shift);
        Shift saved = shiftRepository.save(shift);
        logger.info("Created shift {} for home {} on {} {}", saved.getId(), home.getId(), saved.getWorkDate(), time);
        return saved;
    }

    /**
     * Updates times, headcount and notes. Existing assignments are kept; any conflict
     * the new times introduce shows up in the next conflict scan.
     */
    @Transactional
    public Shift updateShift(Long shiftId, ShiftUpdate update) {
        Shift shift = getShift(shiftId);
        if (update.startTime() != null || update.endTime() != null) {
            String start = update.startTime() != null ? update.startTime() : shift.getStartTime().toString();
            String end = update.endTime() != null ? update.endTime() : shift.getEndTime().toString();
            TimeInterval time = TimeInterval.parse(start, end);
            ShiftValidator.validateTimes(time.start().toLocalTime(), time.end().toLocalTime());
            shift.setStartTime(time.start().toLocalTime());
            shift.setEndTime(time.end().toLocalTime());
        }
        if (update.requiredStaffCount() != null) {
            ShiftValidator.validateStaffCount(update.requiredStaffCount());
            shift.setRequiredStaffCount(update.requiredStaffCount());
        }
        if (update.shiftType() != null) {
            shift.setShiftType(update.shiftType());
        }
        if (update.notes() != null) {
            shift.setNotes(update.notes());
        }
        logger.info("Updated shift {}", shiftId);
        return shiftRepository.save(shift);
    }

    /**
     * Soft delete keeps the row, so materializing the week again will not recreate it.
     */
    @Transactional
    public void deleteShift(Long shiftId, boolean hard) {
        Shift shift = getShift(shiftId);
        if (hard) {
            shiftRepository.delete(shift);
            logger.info("Deleted shift {}", shiftId);
        } else {
            shift.setActive(false);
            shiftRepository.save(shift);
            logger.info("Deactivated shift {}", shiftId);
        }
    }

    /**
     * Assigns the staff member to the shift, or throws {@link AssignmentConflictException}
     * carrying the first conflict found.
     */
    public Shift assign(Long shiftId, Long staffId, String note) {
        Shift shift = getShift(shiftId);
        if (!shift.isActive()) {
            throw new IllegalStateException("Shift " + shiftId + " has been deleted");
        }
        return staffLocks.withLocks(List.of(staffId),
                () -> transactionTemplate.execute(status -> assignLocked(shiftId, staffId, note)));
    }

    private Shift assignLocked(Long shiftId, Long staffId, String note) {
        // state may have changed while waiting for the lock
        Shift shift = getShift(shiftId);
        if (shift.isAssigned(staffId)) {
            throw new IllegalStateException("Staff member " + staffId + " is already assigned to shift " + shiftId);
        }
        ConflictResult result = conflictCheckService.evaluate(shift, staffId);
        if (result.isConflict()) {
            logger.warn("Refused assignment of staff {} to shift {}: {}", staffId, shiftId, result.message());
            throw new AssignmentConflictException(result);
        }
        shift.assign(staffId, note);
        Shift saved = shiftRepository.save(shift);
        logger.info("Assigned staff {} to shift {} on {} {}", staffId, shiftId, saved.getWorkDate(), saved.interval().time());
        return saved;
    }

    @Transactional
    public Shift unassign(Long shiftId, Long staffId) {
        Shift shift = getShift(shiftId);
        if (!shift.unassign(staffId)) {
            throw new ResourceNotFoundException("Assignment of staff " + staffId + " on shift", shiftId);
        }
        logger.info("Unassigned staff {} from shift {}", staffId, shiftId);
        return shiftRepository.save(shift);
    }

    private Function<Long, Set<Long>> staffHomes(List<Shift> shifts) {
        Set<Long> staffIds = new HashSet<>();
        for (Shift shift : shifts) {
            shift.getAssignments().forEach(a -> staffIds.add(a.getStaffId()));
        }
        if (staffIds.isEmpty()) {
            return id -> Set.of();
        }
        Map<Long, Set<Long>> homesByStaff = staffRepository.findWithHomesByIdIn(staffIds).stream()
                .collect(Collectors.toMap(StaffMember::getId, StaffMember::homeIds));
        return id -> homesByStaff.getOrDefault(id, Set.of());
    }

    public record ShiftCommand(Long homeId,
                               Long serviceId,
                               LocalDate date,
                               String startTime,
                               String endTime,
                               ShiftType shiftType,
                               Integer requiredStaffCount,
                               String notes) {}

    public record ShiftUpdate(String startTime,
                              String endTime,
                              ShiftType shiftType,
                              Integer requiredStaffCount,
                              String notes) {}
}
