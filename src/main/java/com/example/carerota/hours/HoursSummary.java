package com.example.carerota.hours;

import java.time.LocalDate;
import java.util.List;

/**
 * @param unassignedHours gross hours of shift slots nobody is assigned to
 */
public record HoursSummary(Long homeId,
                           LocalDate weekStart,
                           LocalDate weekEnd,
                           List<StaffHours> staff,
                           double totalHours,
                           double paidHours,
                           double unassignedHours) {}
