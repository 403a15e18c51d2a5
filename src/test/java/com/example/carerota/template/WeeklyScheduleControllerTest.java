package com.example.carerota.template;

import com.example.carerota.careservice.CareService;
import com.example.carerota.careservice.CareServiceRepository;
import com.example.carerota.home.Home;
import com.example.carerota.home.HomeRepository;
import com.example.carerota.shift.ShiftRepository;
import com.example.carerota.time.Weekday;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Transactional
class WeeklyScheduleControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private WeeklyScheduleService weeklyScheduleService;

    @Autowired
    private HomeRepository homeRepository;

    @Autowired
    private CareServiceRepository careServiceRepository;

    @Autowired
    private ShiftRepository shiftRepository;

    private Home home;
    private CareService service;

    @BeforeEach
    void setUp() {
        home = homeRepository.save(new Home("Cedar View"));
        service = careServiceRepository.save(new CareService("Respite", "care"));
    }

    @Test
    void getByHome_createsDefaultTemplate() throws Exception {
        mockMvc.perform(get("/api/weekly-schedules/home/{homeId}", home.getId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.homeId").value(home.getId().intValue()))
            .andExpect(jsonPath("$.data.active").value(true))
            .andExpect(jsonPath("$.data.schedule.monday.active").value(true))
            .andExpect(jsonPath("$.data.schedule.sunday.shifts").isEmpty())
            .andExpect(jsonPath("$.data.totalWeeklyShifts").value(0));

        assertThat(weeklyScheduleService.findTemplate(home.getId())).isPresent();
    }

    @Test
    void getByHome_unknownHomeIsNotFound() throws Exception {
        mockMvc.perform(get("/api/weekly-schedules/home/{homeId}", 999_999L))
            .andExpect(status().isNotFound());
    }

    @Test
    void editTemplateAndGenerateWeek() throws Exception {
        Long templateId = weeklyScheduleService.getOrCreateTemplate(home.getId()).getId();
        String pattern = """
            {"serviceId": %d, "startTime": "20:00", "endTime": "08:00", "shiftType": "NIGHT", "requiredStaffCount": 2}
            """.formatted(service.getId());

        mockMvc.perform(post("/api/weekly-schedules/{id}/days/{day}/shifts", templateId, "monday")
                .contentType(MediaType.APPLICATION_JSON)
                .content(pattern))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.data.schedule.monday.shifts[0].startTime").value("20:00"))
            .andExpect(jsonPath("$.data.schedule.monday.shifts[0].durationHours").value(12.0))
            .andExpect(jsonPath("$.data.totalWeeklyHours").value(12.0));

        mockMvc.perform(get("/api/weekly-schedules/home/{homeId}/materialize", home.getId())
                .param("weekStart", "2024-01-01"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.length()").value(1))
            .andExpect(jsonPath("$.data[0].date").value("2024-01-01"));

        mockMvc.perform(post("/api/weekly-schedules/home/{homeId}/generate", home.getId())
                .param("weekStart", "2024-01-01"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.meta.created").value(1))
            .andExpect(jsonPath("$.meta.failed").value(0));

        mockMvc.perform(post("/api/weekly-schedules/home/{homeId}/generate", home.getId())
                .param("weekStart", "2024-01-01"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.meta.created").value(0))
            .andExpect(jsonPath("$.meta.skipped").value(1));

        LocalDate monday = LocalDate.of(2024, 1, 1);
        assertThat(shiftRepository.countByHome_IdAndWorkDateBetween(home.getId(), monday, monday.plusDays(6)))
                .isEqualTo(1);
    }

    @Test
    void toggleAndRemove() throws Exception {
        Long templateId = weeklyScheduleService.getOrCreateTemplate(home.getId()).getId();
        weeklyScheduleService.addPattern(templateId, Weekday.TUESDAY,
                new WeeklyScheduleService.PatternCommand(service.getId(), "08:00", "14:00", null, 1, null));

        mockMvc.perform(patch("/api/weekly-schedules/{id}/days/{day}/toggle", templateId, "tuesday"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.schedule.tuesday.active").value(false))
            .andExpect(jsonPath("$.data.totalWeeklyShifts").value(0));

        mockMvc.perform(delete("/api/weekly-schedules/{id}/days/{day}/shifts/{index}", templateId, "tuesday", 3))
            .andExpect(status().isBadRequest());

        mockMvc.perform(delete("/api/weekly-schedules/{id}/days/{day}/shifts/{index}", templateId, "tuesday", 0))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.schedule.tuesday.shifts").isEmpty());

        mockMvc.perform(patch("/api/weekly-schedules/{id}/days/{day}/toggle", templateId, "someday"))
            .andExpect(status().isBadRequest());
    }
}
