package com.example.carerota.hours;

/**
 * One staff member's hours at a home over a week.
 */
public record StaffHours(Long userId,
                         String name,
                         int shiftCount,
                         double totalHours,
                         double breakHours,
                         double paidHours) {}
