package com.dailyprojects.core.health;

import com.dailyprojects.core.cache.CacheProperties;
import com.dailyprojects.core.cache.CacheStore;
import com.dailyprojects.core.llm.LlmProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class HealthCheckServiceTest {

    private CacheStore cacheStore;
    private LlmProperties llmProperties;
    private HealthCheckService service;

    @BeforeEach
    void setUp() {
        cacheStore = mock(CacheStore.class);
        llmProperties = new LlmProperties();
        service = new HealthCheckService(cacheStore, new CacheProperties(), llmProperties);
    }

    private static HealthStatus find(List<HealthStatus> checks, String component) {
        return checks.stream().filter(s -> s.component().equals(component)).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("reachable cache and configured key are UP")
    void allUp() {
        when(cacheStore.ping()).thenReturn(true);
        llmProperties.setApiKey("sk-test");

        var checks = service.checkAll();

        assertEquals(2, checks.size());
        assertEquals(HealthStatus.Status.UP, find(checks, "cache").status());
        assertEquals(HealthStatus.Status.UP, find(checks, "llm").status());
        assertEquals("redis", find(checks, "cache").metadata().get("provider"));
    }

    @Test
    @DisplayName("failed ping and missing key are DEGRADED, not DOWN")
    void degraded() {
        when(cacheStore.ping()).thenReturn(false);

        var checks = service.checkAll();

        assertEquals(HealthStatus.Status.DEGRADED, find(checks, "cache").status());
        assertEquals(HealthStatus.Status.DEGRADED, find(checks, "llm").status());
    }

    @Test
    @DisplayName("exception from the store is reported as DEGRADED")
    void pingThrows() {
        when(cacheStore.ping()).thenThrow(new IllegalStateException("boom"));

        var cache = find(service.checkAll(), "cache");
        assertEquals(HealthStatus.Status.DEGRADED, cache.status());
        assertTrue(cache.detail().contains("boom"));
    }

    @Test
    @DisplayName("readiness is UP when the cache answers and ignores the llm")
    void readinessUp() {
        when(cacheStore.ping()).thenReturn(true);

        var ready = service.checkReadiness();
        assertEquals("cache", ready.component());
        assertEquals(HealthStatus.Status.UP, ready.status());
    }

    @Test
    @DisplayName("readiness is DOWN when the cache does not answer")
    void readinessDown() {
        when(cacheStore.ping()).thenReturn(false);
        assertEquals(HealthStatus.Status.DOWN, service.checkReadiness().status());

        when(cacheStore.ping()).thenThrow(new IllegalStateException("boom"));
        assertEquals(HealthStatus.Status.DOWN, service.checkReadiness().status());
    }
}
