package com.example.carerota.shift;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StaffLockRegistryTest {

    private final StaffLockRegistry registry = new StaffLockRegistry();

    @Test
    void lockFor_dependsOnlyOnStaffMember() {
        assertThat(registry.lockFor(7L)).isSameAs(registry.lockFor(7L));
        assertThat(registry.lockFor(7L)).isNotSameAs(registry.lockFor(8L));
    }

    @Test
    void withLocks_holdsEveryStripeDuringAction() {
        ReentrantLock first = registry.lockFor(3L);
        ReentrantLock second = registry.lockFor(40L);

        boolean heldBoth = registry.withLocks(List.of(40L, 3L, 3L),
                () -> first.isHeldByCurrentThread() && second.isHeldByCurrentThread());

        assertThat(heldBoth).isTrue();
        assertThat(first.isLocked()).isFalse();
        assertThat(second.isLocked()).isFalse();
    }

    @Test
    void withLocks_releasesWhenActionFails() {
        ReentrantLock lock = registry.lockFor(5L);

        assertThatThrownBy(() -> registry.withLocks(List.of(5L), () -> {
            throw new IllegalStateException("refused");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(lock.isLocked()).isFalse();
    }
}
