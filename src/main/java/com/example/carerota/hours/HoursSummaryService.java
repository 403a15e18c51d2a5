package com.example.carerota.hours;

import com.example.carerota.access.RotaDataAccess;
import com.example.carerota.exception.ResourceNotFoundException;
import com.example.carerota.home.HomeRepository;
import com.example.carerota.shift.Shift;
import com.example.carerota.shift.StaffAssignment;
import com.example.carerota.staff.StaffMember;
import com.example.carerota.staff.StaffMemberRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@Transactional(readOnly = true)
public class HoursSummaryService {

    private static final Logger logger = LoggerFactory.getLogger(HoursSummaryService.class);

    private final RotaDataAccess dataAccess;
    private final HomeRepository homeRepository;
    private final StaffMemberRepository staffRepository;

    public HoursSummaryService(RotaDataAccess dataAccess,
                               HomeRepository homeRepository,
                               StaffMemberRepository staffRepository) {
        this.dataAccess = dataAccess;
        this.homeRepository = homeRepository;
        this.staffRepository = staffRepository;
    }

    /**
     * Gross, break and paid hours per assigned staff member over the seven days from
     * {@code weekStart}, counting active shifts of the home only.
     */
    public HoursSummary weeklySummary(Long homeId, LocalDate weekStart) {
        if (!homeRepository.existsById(homeId)) {
            throw new ResourceNotFoundException("Home", homeId);
        }
        LocalDate weekEnd = weekStart.plusDays(6);
        List<Shift> shifts = dataAccess.getShifts(homeId, weekStart, weekEnd).stream()
                .filter(Shift::isActive)
                .toList();

        Map<Long, Accumulator> perStaff = new TreeMap<>();
        double unassigned = 0.0;
        for (Shift shift : shifts) {
            double hours = shift.durationHours();
            for (StaffAssignment assignment : shift.getAssignments()) {
                perStaff.computeIfAbsent(assignment.getStaffId(), id -> new Accumulator()).add(hours);
            }
            int open = shift.getRequiredStaffCount() - shift.getAssignments().size();
            if (open > 0) {
                unassigned += open * hours;
            }
        }

        Map<Long, String> names = staffRepository.findAllById(perStaff.keySet()).stream()
                .collect(Collectors.toMap(StaffMember::getId, StaffMember::getName));
        List<StaffHours> staff = new ArrayList<>();
        perStaff.forEach((id, acc) -> staff.add(new StaffHours(id, names.get(id), acc.shifts,
                acc.total, acc.breaks, acc.total - acc.breaks)));
        staff.sort(Comparator.comparing(StaffHours::paidHours).reversed()
                .thenComparing(StaffHours::userId));

        double total = sum(staff, StaffHours::totalHours);
        double paid = sum(staff, StaffHours::paidHours);
        logger.debug("Hours for home {} week {}: {} staff, {}h paid", homeId, weekStart, staff.size(), paid);
        return new HoursSummary(homeId, weekStart, weekEnd, staff, total, paid, unassigned);
    }

    private static double sum(List<StaffHours> staff, Function<StaffHours, Double> field) {
        return staff.stream().mapToDouble(field::apply).sum();
    }

    private static final class Accumulator {
        private int shifts;
        private double total;
        private double breaks;

        void add(double hours) {
            shifts++;
            total += hours;
            breaks += BreakRules.breakHours(hours);
        }
    }
}
