package com.dailyprojects.dispatch.api;

import com.dailyprojects.core.engine.ProjectNotFoundException;
import com.dailyprojects.core.engine.ProjectOrchestrator;
import com.dailyprojects.core.engine.RequestValidationException;
import com.dailyprojects.core.generation.GenerationUnavailableException;
import com.dailyprojects.core.model.*;
import com.dailyprojects.core.ratelimit.RateDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ProjectController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ProjectControllerTest {

    private static final LocalDate DAY = LocalDate.of(2025, 9, 13);

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ProjectOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        when(orchestrator.admitRequest(any())).thenReturn(RateDecision.allow());
    }

    private static Project project(String id, ProjectSource source) {
        return new Project(id, "Habit Tracker", "Track daily habits.", DifficultyLevel.BEGINNER, "2-3 days",
                "Mobile App", List.of(new Technology("Flutter", TechnologyKind.MOBILE, "One codebase")),
                List.of("Check-ins", "Streaks"), Instant.parse("2025-09-13T08:00:00Z"), source);
    }

    // ── GET /api/v1/projects/daily ───────────────────────────────────

    @Test
    @DisplayName("GET /daily returns the batch in snake_case JSON")
    void getDaily() throws Exception {
        var batch = new DailyBatch(DAY, 2,
                List.of(project("2025-09-13-1", ProjectSource.AI), project("2025-09-13-2", ProjectSource.FALLBACK)),
                ProjectSource.AI, true);
        when(orchestrator.getDaily(DAY, 2, true)).thenReturn(batch);

        mockMvc.perform(get("/api/v1/projects/daily")
                        .param("count", "2")
                        .param("force_regenerate", "true")
                        .param("date", "2025-09-13"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.date").value("2025-09-13"))
                .andExpect(jsonPath("$.source").value("ai"))
                .andExpect(jsonPath("$.degraded").value(true))
                .andExpect(jsonPath("$.projects", hasSize(2)))
                .andExpect(jsonPath("$.projects[0].id").value("2025-09-13-1"))
                .andExpect(jsonPath("$.projects[0].difficulty").value("beginner"))
                .andExpect(jsonPath("$.projects[0].estimated_time").value("2-3 days"))
                .andExpect(jsonPath("$.projects[0].generated_at").value("2025-09-13T08:00:00Z"))
                .andExpect(jsonPath("$.projects[0].technologies[0].kind").value("mobile"))
                .andExpect(jsonPath("$.projects[1].source").value("fallback"));
    }

    @Test
    @DisplayName("GET /daily defaults to today and five projects")
    void getDailyDefaults() throws Exception {
        when(orchestrator.getDaily(isNull(), eq(5), eq(false)))
                .thenReturn(new DailyBatch(DAY, 5, List.of(), ProjectSource.AI, false));

        mockMvc.perform(get("/api/v1/projects/daily"))
                .andExpect(status().isOk());
        verify(orchestrator).getDaily(null, 5, false);
    }

    @Test
    @DisplayName("GET /daily with a bad date returns 400 naming the field")
    void getDailyBadDate() throws Exception {
        mockMvc.perform(get("/api/v1/projects/daily").param("date", "13/09/2025"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("date"));
        verify(orchestrator, never()).getDaily(any(), anyInt(), anyBoolean());
    }

    @Test
    @DisplayName("GET /daily with an out-of-range count returns 400")
    void getDailyBadCount() throws Exception {
        when(orchestrator.getDaily(any(), eq(11), anyBoolean()))
                .thenThrow(new RequestValidationException("count", "count must be between 1 and 10"));

        mockMvc.perform(get("/api/v1/projects/daily").param("count", "11"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("count must be between 1 and 10"))
                .andExpect(jsonPath("$.field").value("count"));
    }

    @Test
    @DisplayName("GET /daily with a non-numeric count returns 400")
    void getDailyNonNumericCount() throws Exception {
        mockMvc.perform(get("/api/v1/projects/daily").param("count", "many"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("count"));
    }

    // ── POST /api/v1/projects/generate ───────────────────────────────

    @Test
    @DisplayName("POST /generate maps preferences onto the request")
    void generate() throws Exception {
        when(orchestrator.generateCustom(any())).thenReturn(List.of(project("custom-20250913080000-1", ProjectSource.AI)));

        mockMvc.perform(post("/api/v1/projects/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"count": 1, "difficulty_preference": ["Advanced", "beginner"], "category_preference": "Games"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("custom-20250913080000-1"));

        ArgumentCaptor<GenerationRequest> captor = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(orchestrator).generateCustom(captor.capture());
        assertEquals(1, captor.getValue().count());
        assertEquals(Set.of(DifficultyLevel.ADVANCED, DifficultyLevel.BEGINNER), captor.getValue().difficultyPreference());
        assertEquals("Games", captor.getValue().categoryPreference());
    }

    @Test
    @DisplayName("POST /generate with an unknown difficulty returns 400")
    void generateBadDifficulty() throws Exception {
        mockMvc.perform(post("/api/v1/projects/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"difficulty_preference\": [\"expert\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("difficulty_preference"));
    }

    @Test
    @DisplayName("POST /generate with malformed JSON returns 400")
    void generateMalformedBody() throws Exception {
        mockMvc.perform(post("/api/v1/projects/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"count\": "))
                .andExpect(status().isBadRequest());
    }

    // ── Lookup, stats, cache, archive ────────────────────────────────

    @Test
    @DisplayName("GET /{id} returns the project or 404")
    void getById() throws Exception {
        when(orchestrator.getById("2025-09-13-1")).thenReturn(project("2025-09-13-1", ProjectSource.AI));
        when(orchestrator.getById("2025-09-13-9")).thenThrow(new ProjectNotFoundException("2025-09-13-9"));

        mockMvc.perform(get("/api/v1/projects/2025-09-13-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("Habit Tracker"));
        mockMvc.perform(get("/api/v1/projects/2025-09-13-9"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Project not found"));
    }

    @Test
    @DisplayName("GET /stats returns counters in snake_case")
    void stats() throws Exception {
        when(orchestrator.getStats()).thenReturn(new ProjectStats(10, 7, 3, 6, 2, 0.75, true));

        mockMvc.perform(get("/api/v1/projects/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_generated").value(10))
                .andExpect(jsonPath("$.cache_hit_ratio").value(0.75))
                .andExpect(jsonPath("$.cache_available").value(true));
    }

    @Test
    @DisplayName("DELETE /cache clears one date or everything")
    void clearCache() throws Exception {
        when(orchestrator.clearCache(DAY)).thenReturn(2L);
        when(orchestrator.clearCache(null)).thenReturn(5L);

        mockMvc.perform(delete("/api/v1/projects/cache").param("date", "2025-09-13"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.date").value("2025-09-13"))
                .andExpect(jsonPath("$.removed").value(2));
        mockMvc.perform(delete("/api/v1/projects/cache"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.date").value("all"))
                .andExpect(jsonPath("$.removed").value(5));
    }

    @Test
    @DisplayName("GET /archive defaults to seven days")
    void archive() throws Exception {
        when(orchestrator.getArchive(7)).thenReturn(List.of(
                new ArchiveEntry(DAY.minusDays(1), List.of(project("2025-09-12-1", ProjectSource.AI)), 5)));

        mockMvc.perform(get("/api/v1/projects/archive"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].date").value("2025-09-12"))
                .andExpect(jsonPath("$[0].total").value(5));
    }

    // ── Rate limiting ────────────────────────────────────────────────

    // ── Pool ─────────────────────────────────────────────────────────

    @Test
    @DisplayName("GET /pool/stats reports size and availability")
    void poolStats() throws Exception {
        when(orchestrator.getPoolStats()).thenReturn(PoolStats.of(12));

        mockMvc.perform(get("/api/v1/projects/pool/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pool_size").value(12))
                .andExpect(jsonPath("$.pool_available").value(true))
                .andExpect(jsonPath("$.cache_available").value(true));
    }

    @Test
    @DisplayName("GET /pool/random is not mistaken for a project id")
    void poolSample() throws Exception {
        when(orchestrator.samplePool(2)).thenReturn(List.of(project("pool-20250913080000-4", ProjectSource.AI)));

        mockMvc.perform(get("/api/v1/projects/pool/random").param("count", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").value("pool-20250913080000-4"));
        verify(orchestrator, never()).getById(any());
    }

    @Test
    @DisplayName("POST /pool/seed defaults to ten projects")
    void seedPool() throws Exception {
        when(orchestrator.seedPool(10)).thenReturn(new PoolSeedResult(10, 10, 9, 31));

        mockMvc.perform(post("/api/v1/projects/pool/seed"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.requested").value(10))
                .andExpect(jsonPath("$.projects_generated").value(10))
                .andExpect(jsonPath("$.projects_added").value(9))
                .andExpect(jsonPath("$.pool_size").value(31));
    }

    @Test
    @DisplayName("POST /pool/seed maps generation failures to 503 and exhausted quota to 429")
    void seedPoolUnavailable() throws Exception {
        when(orchestrator.seedPool(5))
                .thenThrow(new GenerationUnavailableException(
                        GenerationUnavailableException.Reason.TIMEOUT, "timed out", null))
                .thenThrow(new GenerationUnavailableException(
                        GenerationUnavailableException.Reason.QUOTA_EXHAUSTED, "402", null));

        mockMvc.perform(post("/api/v1/projects/pool/seed").param("count", "5"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value(containsString("temporarily unavailable")));
        mockMvc.perform(post("/api/v1/projects/pool/seed").param("count", "5"))
                .andExpect(status().isTooManyRequests());
    }

    @Test
    @DisplayName("POST /pool/seed with count 51 returns 400")
    void seedPoolValidation() throws Exception {
        when(orchestrator.seedPool(51)).thenThrow(
                new RequestValidationException("count", "count must be between 1 and 50"));

        mockMvc.perform(post("/api/v1/projects/pool/seed").param("count", "51"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("count"));
    }

    @Test
    @DisplayName("DELETE /pool reports the removed projects")
    void clearPool() throws Exception {
        when(orchestrator.clearPool()).thenReturn(7L);

        mockMvc.perform(delete("/api/v1/projects/pool"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(7));
    }

    @Test
    @DisplayName("rejected caller gets 429 with Retry-After")
    void rateLimited() throws Exception {
        when(orchestrator.admitRequest("203.0.113.7")).thenReturn(RateDecision.reject(42));

        mockMvc.perform(get("/api/v1/projects/daily").header("X-Forwarded-For", "203.0.113.7, 10.0.0.1"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "42"))
                .andExpect(jsonPath("$.retry_after").value(42));
        verify(orchestrator, never()).getDaily(any(), anyInt(), anyBoolean());
    }
}
