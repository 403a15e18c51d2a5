package com.example.carerota.shift;

import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped locks keyed by staff member. A staff member's conflicts span neighbouring
 * dates and every home, so any change to their assignments holds their stripe for
 * the whole evaluate-and-commit step.
 */
@Component
public class StaffLockRegistry {

    private static final int STRIPES = 64;

    private final ReentrantLock[] locks = new ReentrantLock[STRIPES];

    public StaffLockRegistry() {
        for (int i = 0; i < STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    public ReentrantLock lockFor(Long staffId) {
        return locks[stripe(staffId)];
    }

    /**
     * Runs the action while holding the stripes of all given staff members. Stripes
     * are taken in ascending order so two callers locking the same pair cannot deadlock.
     */
    public <T> T withLocks(Collection<Long> staffIds, Supplier<T> action) {
        int[] stripes = staffIds.stream()
                .filter(Objects::nonNull)
                .mapToInt(this::stripe)
                .distinct()
                .sorted()
                .toArray();
        Deque<ReentrantLock> held = new ArrayDeque<>();
        try {
            for (int stripe : stripes) {
                locks[stripe].lock();
                held.push(locks[stripe]);
            }
            return action.get();
        } finally {
            while (!held.isEmpty()) {
                held.pop().unlock();
            }
        }
    }

    private int stripe(Long staffId) {
        return Math.floorMod(Objects.hashCode(staffId), STRIPES);
    }
}
