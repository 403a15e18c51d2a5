package com.example.carerota.conflict;

import com.example.carerota.shift.Shift;
import com.example.carerota.time.OverlapDetector;
import com.example.carerota.time.ShiftInterval;
import com.example.carerota.timeoff.TimeOffRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Decides whether a staff member can take a shift. Checks run in a fixed order and
 * the first hit wins: approved time off, then an overlapping shift, then the daily
 * hour limit. Used both before committing an assignment and by the conflict scan.
 */
@Component
public class AssignmentConflictEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(AssignmentConflictEvaluator.class);

    private final OverlapDetector overlapDetector;

    public AssignmentConflictEvaluator(OverlapDetector overlapDetector) {
        this.overlapDetector = overlapDetector;
    }

    public ConflictResult evaluate(Shift shift, Long userId, AssignmentContext context) {
        LocalDate date = shift.getWorkDate();

        List<Long> timeOff = context.approvedTimeOff().stream()
                .filter(TimeOffRequest::isApproved)
                .filter(r -> r.covers(date))
                .map(TimeOffRequest::getId)
                .toList();
        if (!timeOff.isEmpty()) {
            logger.debug("Staff {} has time off {} on {}", userId, timeOff, date);
            return ConflictResult.timeOff(timeOff);
        }

        List<Shift> others = context.otherShiftsForUser().stream()
                .filter(s -> !isSameShift(s, shift))
                .filter(Shift::isActive)
                .toList();

        ShiftInterval candidate = shift.interval();
        List<Shift> overlapping = overlapDetector.findOverlapping(candidate, others, Shift::interval);
        if (!overlapping.isEmpty()) {
            Shift first = overlapping.get(0);
            logger.debug("Staff {} shift {} overlaps {}", userId, candidate, first.interval());
            return ConflictResult.overlappingShift(first.getId(), first.interval());
        }

        double attempted = candidate.durationHours() + others.stream()
                .filter(s -> date.equals(s.getWorkDate()))
                .mapToDouble(Shift::durationHours)
                .sum();
        if (attempted > context.dailyHourLimit()) {
            logger.debug("Staff {} would work {}h on {} (limit {}h)", userId, attempted, date, context.dailyHourLimit());
            return ConflictResult.maxHoursExceeded(attempted, context.dailyHourLimit());
        }
        return ConflictResult.none();
    }

    // unsaved candidates have no id and never match
    private static boolean isSameShift(Shift a, Shift b) {
        return a == b || (a.getId() != null && Objects.equals(a.getId(), b.getId()));
    }
}
