package com.example.carerota.time;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/**
 * Detects wall-clock overlap between dated shift windows, including shifts that
 * run past midnight.
 * <p>
 * Each interval is normalised to {@code [start, effectiveEnd)} relative to its own
 * date, where {@code effectiveEnd = end + 1440} for midnight-crossing shifts. Three
 * date relationships are then checked:
 * <ul>
 *   <li>same date: the normalised windows are compared directly;</li>
 *   <li>{@code a.date + 1 == b.date} and {@code a} crosses midnight: the part of
 *       {@code a} that spills into {@code b}'s day, {@code [0, a.end)}, is compared with
 *       {@code b}'s window;</li>
 *   <li>{@code a.date - 1 == b.date} and {@code b} crosses midnight: the same with the
 *       roles swapped.</li>
 * </ul>
 * Any other date distance can never overlap because no shift spans more than 24 hours.
 */
@Component
public class OverlapDetector {

    public boolean overlaps(ShiftInterval a, ShiftInterval b) {
        if (a.date().equals(b.date())) {
            return intersects(a.startMinutes(), a.effectiveEndMinutes(), b.startMinutes(), b.effectiveEndMinutes());
        }
        if (a.date().plusDays(1).equals(b.date())) {
            return a.crossesMidnight()
                    && intersects(0, a.endMinutes(), b.startMinutes(), b.effectiveEndMinutes());
        }
        if (a.date().minusDays(1).equals(b.date())) {
            return b.crossesMidnight()
                    && intersects(a.startMinutes(), a.effectiveEndMinutes(), 0, b.endMinutes());
        }
        return false;
    }

    public boolean anyOverlap(ShiftInterval candidate, Collection<ShiftInterval> existing) {
        return existing.stream().anyMatch(e -> overlaps(candidate, e));
    }

    /**
     * Returns every element of {@code existing} whose interval overlaps the candidate,
     * in iteration order.
     */
    public <T> List<T> findOverlapping(ShiftInterval candidate, Collection<T> existing,
                                       Function<T, ShiftInterval> intervalOf) {
        List<T> result = new ArrayList<>();
        for (T item : existing) {
            ShiftInterval interval = intervalOf.apply(item);
            if (interval != null && overlaps(candidate, interval)) {
                result.add(item);
            }
        }
        return result;
    }

    // half-open: touching endpoints do not overlap
    static boolean intersects(int aStart, int aEnd, int bStart, int bEnd) {
        return !(aEnd <= bStart || aStart >= bEnd);
    }
}
