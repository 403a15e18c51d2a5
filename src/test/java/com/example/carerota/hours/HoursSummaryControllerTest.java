package com.example.carerota.hours;

import com.example.carerota.home.Home;
import com.example.carerota.home.HomeRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Transactional
class HoursSummaryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private HomeRepository homeRepository;

    @Test
    void summary_forEmptyWeek() throws Exception {
        Home home = homeRepository.save(new Home("Maple Lodge"));

        mockMvc.perform(get("/api/hours/summary")
                .param("homeId", home.getId().toString())
                .param("weekStart", "2024-06-03"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.weekEnd").value("2024-06-09"))
            .andExpect(jsonPath("$.data.staff").isEmpty())
            .andExpect(jsonPath("$.data.paidHours").value(0.0));
    }

    @Test
    void summary_requiresWeekStart() throws Exception {
        mockMvc.perform(get("/api/hours/summary").param("homeId", "1"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/hours/summary").param("homeId", "1").param("weekStart", "next monday"))
            .andExpect(status().isBadRequest());
    }
}
