package com.example.carerota.shift;

public enum ShiftType {
    MORNING,
    DAY,
    AFTERNOON,
    EVENING,
    NIGHT,
    OVERTIME,
    LONG_DAY,
    SPLIT
}
