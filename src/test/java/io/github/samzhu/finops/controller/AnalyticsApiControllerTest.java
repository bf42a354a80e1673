package io.github.samzhu.finops.controller;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import io.github.samzhu.finops.dto.AllocationMethod;
import io.github.samzhu.finops.dto.MethodRecommendation;
import io.github.samzhu.finops.service.AllocationAnalyticsService;

@WebMvcTest(AnalyticsApiController.class)
class AnalyticsApiControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AllocationAnalyticsService analyticsService;

    @Test
    void shouldUseDefaultLookbackForRecommendation() throws Exception {
        // Given
        when(analyticsService.recommendation(24)).thenReturn(
            new MethodRecommendation(AllocationMethod.PROPORTIONAL, "Balanced usage patterns", 0.0, 0.4, 0.2, 3));

        // When & Then
        mockMvc.perform(get("/api/v1/analytics/recommendation"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.method").value("proportional"))
            .andExpect(jsonPath("$.reason").value("Balanced usage patterns"))
            .andExpect(jsonPath("$.deviceCount").value(3));
    }

    @Test
    void shouldRejectHoursOutOfRange() throws Exception {
        mockMvc.perform(get("/api/v1/analytics/recommendation").param("hours", "0"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/v1/analytics/decay-weighted").param("hours", "745"))
            .andExpect(status().isBadRequest());

        verify(analyticsService, never()).recommendation(anyInt());
        verify(analyticsService, never()).decayWeighted(anyInt());
    }
}
