package io.github.samzhu.finops.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import io.github.samzhu.finops.document.AllocationRun;
import io.github.samzhu.finops.document.AllocationRun.RunStatus;
import io.github.samzhu.finops.dto.AllocationMethod;
import io.github.samzhu.finops.dto.CorrelationSummary;
import io.github.samzhu.finops.exception.SourceAccessDeniedException;
import io.github.samzhu.finops.repository.AllocatedCostRepository;
import io.github.samzhu.finops.repository.AllocationRunRepository;
import io.github.samzhu.finops.service.AllocationSettlementService;

@WebMvcTest(AllocationApiController.class)
class AllocationApiControllerTest {

    private static final Instant NOW = Instant.parse("2025-01-15T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AllocationSettlementService settlementService;

    @MockBean
    private AllocationRunRepository runRepository;

    @MockBean
    private AllocatedCostRepository allocatedCostRepository;

    @Test
    void shouldTriggerRunWithRequestedMethod() throws Exception {
        // Given
        when(settlementService.triggerRun(AllocationMethod.USAGE_BASED)).thenReturn(run(RunStatus.COMPLETED));

        // When & Then
        mockMvc.perform(post("/api/v1/allocations/runs").param("method", "usage-based"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("COMPLETED"))
            .andExpect(jsonPath("$.trigger").value("MANUAL"));
    }

    @Test
    void shouldRejectUnknownMethod() throws Exception {
        mockMvc.perform(post("/api/v1/allocations/runs").param("method", "random"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("unknown_allocation_method"))
            .andExpect(jsonPath("$.path").value("/api/v1/allocations/runs"));

        verify(settlementService, never()).triggerRun(any());
    }

    @Test
    void shouldReturnServiceUnavailableWhenSourceAccessDenied() throws Exception {
        // Given
        when(settlementService.triggerRun(null))
            .thenThrow(new SourceAccessDeniedException("billing-api", "403 FORBIDDEN", null));

        // When & Then
        mockMvc.perform(post("/api/v1/allocations/runs"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.status").value(503))
            .andExpect(jsonPath("$.error").value("source_access_denied"));
    }

    @Test
    void shouldReturnEmptyAllocationsForDate() throws Exception {
        // Given
        when(allocatedCostRepository.findByPartitionDateOrderByWindowStartAsc(LocalDate.of(2025, 1, 15)))
            .thenReturn(List.of());

        // When & Then
        mockMvc.perform(get("/api/v1/allocations").param("date", "2025-01-15"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.recordCount").value(0))
            .andExpect(jsonPath("$.totalAllocatedCost").value(0.0));
    }

    private static AllocationRun run(RunStatus status) {
        return new AllocationRun("run-1", status, "MANUAL", "usage-based", "Requested",
            NOW.minusSeconds(3600), NOW, 10, 2, 0, 1, 3, 0, 12.5,
            CorrelationSummary.empty(), null, NOW, 42);
    }
}
