package com.example.carerota.swap;

import com.example.carerota.config.RotaSettings;
import com.example.carerota.conflict.ConflictCheckService;
import com.example.carerota.conflict.ConflictResult;
import com.example.carerota.exception.AssignmentConflictException;
import com.example.carerota.exception.ResourceNotFoundException;
import com.example.carerota.shift.Shift;
import com.example.carerota.shift.ShiftRepository;
import com.example.carerota.shift.StaffAssignment;
import com.example.carerota.shift.StaffLockRegistry;
import com.example.carerota.staff.StaffMemberRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Shift swap requests between two staff members of the same home.
 * <p>
 * Both sides are checked for conflicts when the request is made and again on
 * approval, each side as if it had already given up its own shift. Approval holds
 * both staff members' locks while it re-checks and exchanges the assignments.
 */
@Service
public class ShiftSwapService {

    private static final Logger logger = LoggerFactory.getLogger(ShiftSwapService.class);

    public enum Direction { SENT, RECEIVED }

    private final ShiftSwapRepository swapRepository;
    private final ShiftRepository shiftRepository;
    private final StaffMemberRepository staffRepository;
    private final ConflictCheckService conflictCheckService;
    private final StaffLockRegistry staffLocks;
    private final RotaSettings settings;
    private final TransactionTemplate transactionTemplate;

    public ShiftSwapService(ShiftSwapRepository swapRepository,
                            ShiftRepository shiftRepository,
                            StaffMemberRepository staffRepository,
                            ConflictCheckService conflictCheckService,
                            StaffLockRegistry staffLocks,
                            RotaSettings settings,
                            PlatformTransactionManager transactionManager) {
        this.swapRepository = swapRepository;
        this.shiftRepository = shiftRepository;
        this.staffRepository = staffRepository;
        this.conflictCheckService = conflictCheckService;
        this.staffLocks = staffLocks;
        this.settings = settings;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Records a pending swap. When {@code targetUserId} is null the target shift must
     * have exactly one other assignee, who becomes the target.
     */
    @Transactional
    public ShiftSwap create(SwapCommand command) {
        Long requesterId = command.requesterId();
        if (!staffRepository.existsById(requesterId)) {
            throw new ResourceNotFoundException("Staff member", requesterId);
        }
        if (command.requesterShiftId().equals(command.targetShiftId())) {
            throw new IllegalArgumentException("A shift cannot be swapped with itself");
        }
        Shift requesterShift = activeShift(command.requesterShiftId());
        Shift targetShift = activeShift(command.targetShiftId());
        if (!requesterShift.getHomeId().equals(targetShift.getHomeId())) {
            throw new IllegalArgumentException("Both shifts must belong to the same home");
        }
        if (!requesterShift.isAssigned(requesterId)) {
            throw new IllegalArgumentException("Staff member " + requesterId + " is not assigned to shift "
                    + requesterShift.getId());
        }
        Long targetUserId = resolveTargetUser(targetShift, requesterId, command.targetUserId());
        if (targetShift.isAssigned(requesterId) || requesterShift.isAssigned(targetUserId)) {
            throw new IllegalStateException("Both staff members are already on one of the shifts");
        }
        List<ShiftSwap> open = swapRepository.findByStatusInvolvingShifts(ShiftSwap.Status.PENDING,
                List.of(requesterShift.getId(), targetShift.getId()));
        if (open.stream().anyMatch(s -> !s.isExpired())) {
            throw new IllegalStateException("One of the shifts already has a pending swap request");
        }

        checkBothSides(requesterShift, requesterId, targetShift, targetUserId);

        LocalDateTime now = LocalDateTime.now();
        ShiftSwap saved = swapRepository.save(new ShiftSwap(requesterShift.getHomeId(), requesterShift.getId(),
                targetShift.getId(), requesterId, targetUserId, command.message(), now,
                now.plusDays(settings.getSwapExpiryDays())));
        logger.info("Swap requested: id={}, staff {} shift {} <-> staff {} shift {}", saved.getId(),
                requesterId, requesterShift.getId(), targetUserId, targetShift.getId());
        return saved;
    }

    /**
     * Exchanges the two assignments, or throws {@link AssignmentConflictException} when
     * either side would now conflict. Only the target staff member may approve.
     */
    public ShiftSwap approve(Long swapId, Long responderId, String message) {
        ShiftSwap swap = getSwap(swapId);
        return staffLocks.withLocks(List.of(swap.getRequesterId(), swap.getTargetUserId()),
                () -> transactionTemplate.execute(status -> approveLocked(swapId, responderId, message)));
    }

    private ShiftSwap approveLocked(Long swapId, Long responderId, String message) {
        ShiftSwap swap = respondable(swapId, responderId);
        if (swap.getStatus() != ShiftSwap.Status.PENDING) {
            throw new IllegalStateException("Swap request " + swapId + " is already " + swap.getStatus());
        }
        if (swap.isExpired()) {
            throw new IllegalStateException("Swap request " + swapId + " has expired");
        }
        Long requesterId = swap.getRequesterId();
        Long targetUserId = swap.getTargetUserId();
        Shift requesterShift = activeShift(swap.getRequesterShiftId());
        Shift targetShift = activeShift(swap.getTargetShiftId());
        if (!requesterShift.isAssigned(requesterId) || !targetShift.isAssigned(targetUserId)) {
            throw new IllegalStateException("Assignments changed since swap request " + swapId + " was made");
        }

        checkBothSides(requesterShift, requesterId, targetShift, targetUserId);

        String note = "swap #" + swapId;
        requesterShift.unassign(requesterId);
        requesterShift.assign(targetUserId, note);
        targetShift.unassign(targetUserId);
        targetShift.assign(requesterId, note);
        shiftRepository.save(requesterShift);
        shiftRepository.save(targetShift);

        swap.decide(ShiftSwap.Status.APPROVED, message);
        logger.info("Swap approved: id={}, staff {} now on shift {}, staff {} now on shift {}", swapId,
                requesterId, targetShift.getId(), targetUserId, requesterShift.getId());
        return swapRepository.save(swap);
    }

    @Transactional
    public ShiftSwap reject(Long swapId, Long responderId, String message) {
        ShiftSwap swap = respondable(swapId, responderId);
        swap.decide(ShiftSwap.Status.REJECTED, message);
        logger.info("Swap rejected: id={}, by={}", swapId, responderId);
        return swapRepository.save(swap);
    }

    @Transactional
    public ShiftSwap cancel(Long swapId, Long requesterId) {
        ShiftSwap swap = getSwap(swapId);
        if (!swap.getRequesterId().equals(requesterId)) {
            throw new IllegalArgumentException("Only the requester can cancel swap request " + swapId);
        }
        swap.decide(ShiftSwap.Status.CANCELLED, null);
        logger.info("Swap cancelled: id={}", swapId);
        return swapRepository.save(swap);
    }

    @Transactional(readOnly = true)
    public ShiftSwap getSwap(Long swapId) {
        return swapRepository.findById(swapId)
                .orElseThrow(() -> new ResourceNotFoundException("Swap request", swapId));
    }

    /**
     * Swaps the staff member sent, received, or both when {@code direction} is null;
     * newest first.
     */
    @Transactional(readOnly = true)
    public List<ShiftSwap> forStaff(Long staffId, Direction direction) {
        List<ShiftSwap> swaps = new ArrayList<>();
        if (direction != Direction.RECEIVED) {
            swaps.addAll(swapRepository.findByRequesterIdOrderByRequestedAtDesc(staffId));
        }
        if (direction != Direction.SENT) {
            swaps.addAll(swapRepository.findByTargetUserIdOrderByRequestedAtDesc(staffId));
        }
        swaps.sort(Comparator.comparing(ShiftSwap::getRequestedAt).reversed());
        return swaps;
    }

    /**
     * Requests still waiting for this staff member's answer.
     */
    @Transactional(readOnly = true)
    public List<ShiftSwap> awaitingResponse(Long staffId) {
        return swapRepository.findByTargetUserIdAndStatusOrderByRequestedAtDesc(staffId, ShiftSwap.Status.PENDING)
                .stream()
                .filter(s -> !s.isExpired())
                .toList();
    }

    private void checkBothSides(Shift requesterShift, Long requesterId, Shift targetShift, Long targetUserId) {
        ConflictResult forRequester = conflictCheckService.evaluate(targetShift, requesterId, requesterShift.getId());
        if (forRequester.isConflict()) {
            logger.warn("Swap refused, staff {} cannot take shift {}: {}", requesterId, targetShift.getId(),
                    forRequester.message());
            throw new AssignmentConflictException(forRequester);
        }
        ConflictResult forTarget = conflictCheckService.evaluate(requesterShift, targetUserId, targetShift.getId());
        if (forTarget.isConflict()) {
            logger.warn("Swap refused, staff {} cannot take shift {}: {}", targetUserId, requesterShift.getId(),
                    forTarget.message());
            throw new AssignmentConflictException(forTarget);
        }
    }

    private Long resolveTargetUser(Shift targetShift, Long requesterId, Long targetUserId) {
        if (targetUserId != null) {
            if (!targetShift.isAssigned(targetUserId)) {
                throw new IllegalArgumentException("Staff member " + targetUserId + " is not assigned to shift "
                        + targetShift.getId());
            }
            return targetUserId;
        }
        List<Long> others = targetShift.getAssignments().stream()
                .map(StaffAssignment::getStaffId)
                .filter(id -> !id.equals(requesterId))
                .toList();
        if (others.size() != 1) {
            throw new IllegalArgumentException("Shift " + targetShift.getId()
                    + " needs a target staff member (" + others.size() + " assigned)");
        }
        return others.get(0);
    }

    private ShiftSwap respondable(Long swapId, Long responderId) {
        ShiftSwap swap = getSwap(swapId);
        if (!swap.getTargetUserId().equals(responderId)) {
            throw new IllegalArgumentException("Only the target staff member can respond to swap request " + swapId);
        }
        return swap;
    }

    private Shift activeShift(Long shiftId) {
        Shift shift = shiftRepository.findById(shiftId)
                .orElseThrow(() -> new ResourceNotFoundException("Shift", shiftId));
        if (!shift.isActive()) {
            throw new IllegalStateException("Shift " + shiftId + " has been deleted");
        }
        return shift;
    }

    public record SwapCommand(Long requesterId,
                              Long requesterShiftId,
                              Long targetShiftId,
                              Long targetUserId,
                              String message) {}
}
