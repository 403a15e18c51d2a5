package com.example.carerota.swap;

import com.example.carerota.careservice.CareService;
import com.example.carerota.careservice.CareServiceRepository;
import com.example.carerota.home.Home;
import com.example.carerota.home.HomeRepository;
import com.example.carerota.shift.Shift;
import com.example.carerota.shift.ShiftRepository;
import com.example.carerota.shift.ShiftType;
import com.example.carerota.staff.StaffMember;
import com.example.carerota.staff.StaffMemberRepository;
import com.example.carerota.staff.StaffRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Transactional
class ShiftSwapControllerTest {

    private static final LocalDate DAY = LocalDate.of(2024, 11, 4);

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ShiftSwapService swapService;

    @Autowired
    private ShiftRepository shiftRepository;

    @Autowired
    private HomeRepository homeRepository;

    @Autowired
    private CareServiceRepository careServiceRepository;

    @Autowired
    private StaffMemberRepository staffRepository;

    private Home home;
    private CareService service;
    private StaffMember casey;
    private StaffMember devon;
    private Shift caseyShift;
    private Shift devonShift;

    @BeforeEach
    void setUp() {
        home = homeRepository.save(new Home("Maple Lodge"));
        service = careServiceRepository.save(new CareService("Residential", "care"));
        casey = staffRepository.save(new StaffMember("Casey", "casey@example.com", StaffRole.SUPPORT_WORKER));
        devon = staffRepository.save(new StaffMember("Devon", "devon@example.com", StaffRole.SENIOR_STAFF));
        caseyShift = assigned(DAY, "08:00", "16:00", casey);
        devonShift = assigned(DAY.plusDays(1), "20:00", "08:00", devon);
    }

    @Test
    void createThenApprove_swapsAssignments() throws Exception {
        String payload = """
            {"requesterId": %d, "requesterShiftId": %d, "targetShiftId": %d, "message": "family visit"}
            """.formatted(casey.getId(), caseyShift.getId(), devonShift.getId());

        mockMvc.perform(post("/api/shift-swaps")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.data.status").value("PENDING"))
            .andExpect(jsonPath("$.data.targetUserId").value(devon.getId().intValue()))
            .andExpect(jsonPath("$.data.requesterMessage").value("family visit"));

        Long swapId = swapService.awaitingResponse(devon.getId()).get(0).getId();

        mockMvc.perform(get("/api/shift-swaps/pending").param("userId", devon.getId().toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.length()").value(1));

        mockMvc.perform(put("/api/shift-swaps/{id}/approve", swapId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"responderId\": %d}".formatted(devon.getId())))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.status").value("APPROVED"));

        assertThat(shiftRepository.findById(devonShift.getId()).orElseThrow().isAssigned(casey.getId())).isTrue();
        assertThat(shiftRepository.findById(caseyShift.getId()).orElseThrow().isAssigned(devon.getId())).isTrue();

        mockMvc.perform(get("/api/shift-swaps")
                .param("userId", casey.getId().toString())
                .param("direction", "SENT"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[0].id").value(swapId.intValue()));
    }

    @Test
    void create_conflictReturns409WithType() throws Exception {
        assigned(DAY.plusDays(1), "18:00", "23:00", casey);
        String payload = """
            {"requesterId": %d, "requesterShiftId": %d, "targetShiftId": %d}
            """.formatted(casey.getId(), caseyShift.getId(), devonShift.getId());

        mockMvc.perform(post("/api/shift-swaps")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.conflictType").value("OVERLAPPING_SHIFT"));
    }

    @Test
    void approve_withoutResponderIsValidationError() throws Exception {
        ShiftSwap swap = swapService.create(new ShiftSwapService.SwapCommand(casey.getId(), caseyShift.getId(),
                devonShift.getId(), null, null));

        mockMvc.perform(put("/api/shift-swaps/{id}/approve", swap.getId())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.responderId").value("responderId is required"));

        mockMvc.perform(get("/api/shift-swaps/{id}", -1))
            .andExpect(status().isNotFound());
    }

    private Shift assigned(LocalDate date, String start, String end, StaffMember staff) {
        Shift shift = new Shift(home, service, date, LocalTime.parse(start), LocalTime.parse(end), ShiftType.DAY, 1);
        shift.assign(staff.getId(), null);
        return shiftRepository.save(shift);
    }
}
