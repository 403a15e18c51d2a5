package com.example.carerota.shift;

import com.example.carerota.careservice.CareService;
import com.example.carerota.careservice.CareServiceRepository;
import com.example.carerota.conflict.ConflictType;
import com.example.carerota.exception.AssignmentConflictException;
import com.example.carerota.exception.InvalidTimeFormatException;
import com.example.carerota.exception.ResourceNotFoundException;
import com.example.carerota.home.Home;
import com.example.carerota.home.HomeRepository;
import com.example.carerota.staff.StaffMember;
import com.example.carerota.staff.StaffMemberRepository;
import com.example.carerota.staff.StaffRole;
import com.example.carerota.timeoff.TimeOffService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Transactional
class ShiftAssignmentServiceTest {

    private static final LocalDate DAY = LocalDate.of(2024, 4, 8);

    @Autowired
    private ShiftAssignmentService shiftService;

    @Autowired
    private ShiftRepository shiftRepository;

    @Autowired
    private HomeRepository homeRepository;

    @Autowired
    private CareServiceRepository careServiceRepository;

    @Autowired
    private StaffMemberRepository staffRepository;

    @Autowired
    private TimeOffService timeOffService;

    private Home home;
    private CareService service;
    private StaffMember worker;

    @BeforeEach
    void setUp() {
        home = homeRepository.save(new Home("Elm House"));
        service = careServiceRepository.save(new CareService("Residential", "care"));
        worker = new StaffMember("Robin", "robin@example.com", StaffRole.SUPPORT_WORKER);
        worker.getHomes().add(home);
        worker = staffRepository.save(worker);
    }

    @Test
    void createShift_parsesTimesAndDefaults() {
        Shift shift = shiftService.createShift(command(DAY, "22:00", "07:00"));

        assertThat(shift.getId()).isNotNull();
        assertThat(shift.getStartTime()).isEqualTo(LocalTime.of(22, 0));
        assertThat(shift.getShiftType()).isEqualTo(ShiftType.DAY);
        assertThat(shift.getRequiredStaffCount()).isEqualTo(1);
        assertThat(shift.durationHours()).isEqualTo(9.0);
        assertThat(shift.status()).isEqualTo(ShiftStatus.UNASSIGNED);
    }

    @Test
    void createShift_rejectsBadInput() {
        assertThatThrownBy(() -> shiftService.createShift(command(DAY, "24:00", "07:00")))
                .isInstanceOf(InvalidTimeFormatException.class);
        assertThatThrownBy(() -> shiftService.createShift(command(DAY, "09:00", "09:00")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("differ");
        assertThatThrownBy(() -> shiftService.createShift(new ShiftAssignmentService.ShiftCommand(
                -5L, service.getId(), DAY, "09:00", "17:00", null, null, null)))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void assign_commitsWhenThereIsNoConflict() {
        Shift shift = shiftService.createShift(command(DAY, "08:00", "16:00"));

        Shift assigned = shiftService.assign(shift.getId(), worker.getId(), "cover");

        assertThat(assigned.isAssigned(worker.getId())).isTrue();
        assertThat(assigned.getAssignments()).extracting(StaffAssignment::getNote).containsExactly("cover");
        assertThat(assigned.status()).isEqualTo(ShiftStatus.FULLY_STAFFED);
    }

    @Test
    void assign_refusesOverlappingShift() {
        Shift night = shiftService.createShift(command(DAY.minusDays(1), "21:00", "07:00"));
        Shift early = shiftService.createShift(command(DAY, "06:00", "14:00"));
        shiftService.assign(night.getId(), worker.getId(), null);

        assertThatThrownBy(() -> shiftService.assign(early.getId(), worker.getId(), null))
                .isInstanceOf(AssignmentConflictException.class)
                .satisfies(ex -> {
                    AssignmentConflictException conflict = (AssignmentConflictException) ex;
                    assertThat(conflict.getConflict().type()).isEqualTo(ConflictType.OVERLAPPING_SHIFT);
                    assertThat(conflict.getConflict().conflictingShiftId()).isEqualTo(night.getId());
                });
        assertThat(shiftRepository.findById(early.getId()).orElseThrow().isAssigned(worker.getId())).isFalse();
    }

    @Test
    void assign_refusesApprovedTimeOff() {
        Shift shift = shiftService.createShift(command(DAY, "08:00", "16:00"));
        Long request = timeOffService.submit(worker.getId(), DAY, DAY.plusDays(3), null, "holiday").getId();
        timeOffService.approve(request, null);

        assertThatThrownBy(() -> shiftService.assign(shift.getId(), worker.getId(), null))
                .isInstanceOf(AssignmentConflictException.class)
                .hasMessageContaining("time off");
    }

    @Test
    void assign_respectsPersonalDailyLimit() {
        worker.setMaxHoursPerDay(10);
        staffRepository.save(worker);
        Shift morning = shiftService.createShift(command(DAY, "06:00", "14:00"));
        Shift evening = shiftService.createShift(command(DAY, "15:00", "19:00"));
        shiftService.assign(morning.getId(), worker.getId(), null);

        assertThatThrownBy(() -> shiftService.assign(evening.getId(), worker.getId(), null))
                .isInstanceOf(AssignmentConflictException.class)
                .satisfies(ex -> assertThat(((AssignmentConflictException) ex).getConflict().type())
                        .isEqualTo(ConflictType.MAX_HOURS_EXCEEDED));
    }

    @Test
    void assign_twiceIsRejected() {
        Shift shift = shiftService.createShift(command(DAY, "08:00", "16:00"));
        shiftService.assign(shift.getId(), worker.getId(), null);

        assertThatThrownBy(() -> shiftService.assign(shift.getId(), worker.getId(), null))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void unassign_removesAssignment() {
        Shift shift = shiftService.createShift(command(DAY, "08:00", "16:00"));
        shiftService.assign(shift.getId(), worker.getId(), null);

        Shift updated = shiftService.unassign(shift.getId(), worker.getId());

        assertThat(updated.getAssignments()).isEmpty();
        assertThatThrownBy(() -> shiftService.unassign(shift.getId(), worker.getId()))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void listShifts_appliesCallerVisibility() {
        Shift mine = shiftService.createShift(command(DAY, "08:00", "16:00"));
        shiftService.createShift(command(DAY, "16:00", "22:00"));
        shiftService.assign(mine.getId(), worker.getId(), null);
        StaffMember manager = staffRepository.save(new StaffMember("Pat", "pat@example.com", StaffRole.HOME_MANAGER));

        List<Shift> forWorker = shiftService.listShifts(home.getId(), DAY, DAY, worker.getId());
        List<Shift> forManager = shiftService.listShifts(home.getId(), DAY, DAY, manager.getId());

        assertThat(forWorker).extracting(Shift::getId).containsExactly(mine.getId());
        assertThat(forManager).hasSize(2);
    }

    @Test
    void listShifts_requiresCaller() {
        shiftService.createShift(command(DAY, "08:00", "16:00"));

        assertThatThrownBy(() -> shiftService.listShifts(home.getId(), DAY, DAY, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Caller");
        assertThatThrownBy(() -> shiftService.listShifts(home.getId(), DAY, DAY, -1L))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void deleteShift_softByDefaultHardOnRequest() {
        StaffMember admin = staffRepository.save(new StaffMember("Jo", "jo@example.com", StaffRole.ADMIN));
        Shift soft = shiftService.createShift(command(DAY, "08:00", "16:00"));
        Shift hard = shiftService.createShift(command(DAY, "16:00", "22:00"));

        shiftService.deleteShift(soft.getId(), false);
        shiftService.deleteShift(hard.getId(), true);

        assertThat(shiftRepository.findById(soft.getId()).orElseThrow().isActive()).isFalse();
        assertThat(shiftRepository.findById(hard.getId())).isEmpty();
        assertThat(shiftService.listShifts(home.getId(), DAY, DAY, admin.getId())).isEmpty();
        assertThatThrownBy(() -> shiftService.assign(soft.getId(), worker.getId(), null))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void updateShift_changesTimesAndCount() {
        Shift shift = shiftService.createShift(command(DAY, "08:00", "16:00"));

        Shift updated = shiftService.updateShift(shift.getId(),
                new ShiftAssignmentService.ShiftUpdate(null, "18:00", null, 3, "extended"));

        assertThat(updated.getStartTime()).isEqualTo(LocalTime.of(8, 0));
        assertThat(updated.getEndTime()).isEqualTo(LocalTime.of(18, 0));
        assertThat(updated.getRequiredStaffCount()).isEqualTo(3);
        assertThat(updated.getNotes()).isEqualTo("extended");
    }

    private ShiftAssignmentService.ShiftCommand command(LocalDate date, String start, String end) {
        return new ShiftAssignmentService.ShiftCommand(home.getId(), service.getId(), date, start, end, null, null, null);
    }
}
