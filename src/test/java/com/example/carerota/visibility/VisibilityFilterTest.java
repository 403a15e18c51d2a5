package com.example.carerota.visibility;

import com.example.carerota.careservice.CareService;
import com.example.carerota.home.Home;
import com.example.carerota.shift.Shift;
import com.example.carerota.shift.ShiftType;
import com.example.carerota.staff.StaffRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class VisibilityFilterTest {

    private static final Long WORKER = 1L;
    private static final Long COLLEAGUE = 2L;
    private static final Long OUTSIDER = 3L;

    private final VisibilityFilter filter = new VisibilityFilter();

    private final Map<Long, Set<Long>> homesByStaff = Map.of(
            WORKER, Set.of(10L),
            COLLEAGUE, Set.of(10L, 11L),
            OUTSIDER, Set.of(12L));
    private final Function<Long, Set<Long>> staffHomes = id -> homesByStaff.getOrDefault(id, Set.of());

    private Shift s;
    private Shift t;
    private Shift open;

    @BeforeEach
    void setUp() {
        s = shift();
        s.assign(WORKER, null);
        t = shift();
        t.assign(OUTSIDER, null);
        open = shift();
    }

    @Test
    void supportWorkerSeesOnlyOwnShifts() {
        Caller caller = new Caller(StaffRole.SUPPORT_WORKER, Set.of(10L), WORKER);

        assertThat(filter.filter(List.of(s, t), caller, staffHomes)).containsExactly(s);
    }

    @Test
    void seniorStaffSeesShiftsOfColleaguesFromTheirHomes() {
        Caller caller = new Caller(StaffRole.SENIOR_STAFF, Set.of(11L), COLLEAGUE);

        assertThat(filter.filter(List.of(s, t, open), caller, staffHomes)).containsExactly(s);
    }

    @Test
    void managersAndAdminsSeeEverything() {
        List<Shift> all = List.of(s, t, open);

        assertThat(filter.filter(all, new Caller(StaffRole.HOME_MANAGER, Set.of(), 4L), staffHomes))
                .containsExactly(s, t, open);
        assertThat(filter.filter(all, new Caller(StaffRole.ADMIN, null, 5L), staffHomes))
                .containsExactly(s, t, open);
    }

    @Test
    void missingRoleSeesNothing() {
        assertThat(filter.filter(List.of(s, t), new Caller(null, Set.of(10L), WORKER), staffHomes)).isEmpty();
        assertThat(filter.filter(List.of(s, t), null, staffHomes)).isEmpty();
    }

    private Shift shift() {
        return new Shift(new Home("Oak House"), new CareService("Residential", "care"), LocalDate.of(2024, 1, 1),
                LocalTime.of(8, 0), LocalTime.of(16, 0), ShiftType.DAY, 1);
    }
}
