package com.example.carerota.shift;

/**
 * Staffing level of a shift, derived from assigned vs required headcount.
 */
public enum ShiftStatus {
    UNASSIGNED,
    UNDERSTAFFED,
    FULLY_STAFFED,
    OVERSTAFFED;

    public static ShiftStatus of(int assigned, int required) {
        if (assigned == 0) {
            return UNASSIGNED;
        }
        if (assigned < required) {
            return UNDERSTAFFED;
        }
        return assigned == required ? FULLY_STAFFED : OVERSTAFFED;
    }
}
