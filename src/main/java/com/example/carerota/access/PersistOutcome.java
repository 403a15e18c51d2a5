package com.example.carerota.access;

import com.example.carerota.shift.Shift;

/**
 * Result of persisting one shift out of a batch.
 */
public record PersistOutcome(Shift shift, boolean persisted, String error) {

    public static PersistOutcome ok(Shift shift) {
        return new PersistOutcome(shift, true, null);
    }

    public static PersistOutcome failed(Shift shift, String error) {
        return new PersistOutcome(shift, false, error);
    }
}
