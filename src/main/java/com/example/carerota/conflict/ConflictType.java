package com.example.carerota.conflict;

public enum ConflictType {
    NONE,
    TIME_OFF,
    OVERLAPPING_SHIFT,
    MAX_HOURS_EXCEEDED
}
