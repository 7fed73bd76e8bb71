package com.dailyprojects.dispatch.api;

import com.dailyprojects.core.engine.ProjectOrchestrator;
import com.dailyprojects.core.health.HealthCheckService;
import com.dailyprojects.core.health.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthCheckService healthCheckService;

    @MockitoBean
    private ProjectOrchestrator orchestrator;

    @Test
    @DisplayName("GET /health reports DEGRADED components with 200")
    void degradedIsOk() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("cache", HealthStatus.Status.UP, "Cache store reachable", Map.of("provider", "redis")),
                new HealthStatus("llm", HealthStatus.Status.DEGRADED, "No API key configured", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DEGRADED"))
                .andExpect(jsonPath("$.components.cache.status").value("UP"))
                .andExpect(jsonPath("$.components.cache.metadata.provider").value("redis"))
                .andExpect(jsonPath("$.components.llm.status").value("DEGRADED"));

        // health is outside the rate-limited prefix
        verify(orchestrator, never()).admitRequest(any());
    }

    @Test
    @DisplayName("GET /health is UP when every component is")
    void allUp() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("cache", HealthStatus.Status.UP, "Cache store reachable", Map.of()),
                new HealthStatus("llm", HealthStatus.Status.UP, "API key configured", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }

    @Test
    @DisplayName("GET /health/live answers without checking dependencies")
    void live() throws Exception {
        mockMvc.perform(get("/api/v1/health/live"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("alive"))
                .andExpect(jsonPath("$.timestamp").exists());

        verifyNoInteractions(healthCheckService);
    }

    @Test
    @DisplayName("GET /health/ready is 200 when the cache answers")
    void ready() throws Exception {
        when(healthCheckService.checkReadiness()).thenReturn(
                new HealthStatus("cache", HealthStatus.Status.UP, "Cache store reachable", Map.of()));

        mockMvc.perform(get("/api/v1/health/ready"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ready"));
    }

    @Test
    @DisplayName("GET /health/ready is 503 when the cache does not answer")
    void notReady() throws Exception {
        when(healthCheckService.checkReadiness()).thenReturn(
                new HealthStatus("cache", HealthStatus.Status.DOWN, "Cache store did not answer ping", Map.of()));

        mockMvc.perform(get("/api/v1/health/ready"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("not_ready"))
                .andExpect(jsonPath("$.detail").value("Cache store did not answer ping"));
    }
}
