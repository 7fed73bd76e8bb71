package com.dailyprojects.dispatch.api;

import com.dailyprojects.core.engine.ProjectOrchestrator;
import com.dailyprojects.core.engine.RequestValidationException;
import com.dailyprojects.core.model.ArchiveEntry;
import com.dailyprojects.core.model.DailyBatch;
import com.dailyprojects.core.model.DifficultyLevel;
import com.dailyprojects.core.model.GenerationRequest;
import com.dailyprojects.core.model.PoolSeedResult;
import com.dailyprojects.core.model.PoolStats;
import com.dailyprojects.core.model.Project;
import com.dailyprojects.core.model.ProjectStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST controller for daily and custom project ideas.
 */
@RestController
@RequestMapping("/api/v1/projects")
public class ProjectController {

    private static final Logger log = LoggerFactory.getLogger(ProjectController.class);

    static final int DEFAULT_COUNT = 5;
    static final int DEFAULT_SEED_COUNT = 10;

    private final ProjectOrchestrator orchestrator;

    public ProjectController(ProjectOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * GET /api/v1/projects/daily — The batch for a date (today by default).
     */
    @GetMapping("/daily")
    public ResponseEntity<DailyBatch> getDaily(
            @RequestParam(defaultValue = "" + DEFAULT_COUNT) int count,
            @RequestParam(name = "force_regenerate", defaultValue = "false") boolean forceRegenerate,
            @RequestParam(required = false) String date) {
        LocalDate day = parseDate(date);
        log.info("Daily projects requested: date={}, count={}, force={}", day, count, forceRegenerate);
        return ResponseEntity.ok(orchestrator.getDaily(day, count, forceRegenerate));
    }

    /**
     * POST /api/v1/projects/generate — Projects for explicit preferences, not cached.
     */
    @PostMapping("/generate")
    public ResponseEntity<List<Project>> generate(@RequestBody(required = false) GenerateProjectsRequest body) {
        GenerateProjectsRequest request = body != null ? body : new GenerateProjectsRequest(null, null, null);
        var generationRequest = new GenerationRequest(
                request.count() != null ? request.count() : DEFAULT_COUNT,
                parseDifficulties(request.difficultyPreference()),
                request.categoryPreference(),
                false);
        log.info("Custom projects requested: count={}, difficulty={}, category={}",
                generationRequest.count(), generationRequest.difficultyPreference(),
                generationRequest.categoryPreference());
        return ResponseEntity.ok(orchestrator.generateCustom(generationRequest));
    }

    @GetMapping("/stats")
    public ResponseEntity<ProjectStats> stats() {
        return ResponseEntity.ok(orchestrator.getStats());
    }

    /**
     * DELETE /api/v1/projects/cache — Drops cached batches for one date, or all of them.
     */
    @DeleteMapping("/cache")
    public ResponseEntity<Map<String, Object>> clearCache(@RequestParam(required = false) String date) {
        LocalDate day = parseDate(date);
        long removed = orchestrator.clearCache(day);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("date", day != null ? day.toString() : "all");
        result.put("removed", removed);
        return ResponseEntity.ok(result);
    }

    @GetMapping("/archive")
    public ResponseEntity<List<ArchiveEntry>> archive(@RequestParam(defaultValue = "7") int days) {
        return ResponseEntity.ok(orchestrator.getArchive(days));
    }

    @GetMapping("/pool/stats")
    public ResponseEntity<PoolStats> poolStats() {
        return ResponseEntity.ok(orchestrator.getPoolStats());
    }

    @GetMapping("/pool/random")
    public ResponseEntity<List<Project>> poolSample(@RequestParam(defaultValue = "" + DEFAULT_COUNT) int count) {
        return ResponseEntity.ok(orchestrator.samplePool(count));
    }

    /**
     * POST /api/v1/projects/pool/seed — Generates up to 50 projects into the pool.
     */
    @PostMapping("/pool/seed")
    public ResponseEntity<PoolSeedResult> seedPool(
            @RequestParam(defaultValue = "" + DEFAULT_SEED_COUNT) int count) {
        log.info("Pool seeding requested: count={}", count);
        return ResponseEntity.ok(orchestrator.seedPool(count));
    }

    @DeleteMapping("/pool")
    public ResponseEntity<Map<String, Object>> clearPool() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("removed", orchestrator.clearPool());
        return ResponseEntity.ok(result);
    }

    @GetMapping("/{id}")
    public ResponseEntity<Project> getById(@PathVariable String id) {
        return ResponseEntity.ok(orchestrator.getById(id));
    }

    private static LocalDate parseDate(String date) {
        if (date == null || date.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(date.trim());
        } catch (DateTimeParseException e) {
            throw new RequestValidationException("date", "date must be in YYYY-MM-DD format");
        }
    }

    private static Set<DifficultyLevel> parseDifficulties(List<String> values) {
        if (values == null || values.isEmpty()) {
            return Set.of();
        }
        Set<DifficultyLevel> levels = EnumSet.noneOf(DifficultyLevel.class);
        for (String value : values) {
            levels.add(DifficultyLevel.parse(value).orElseThrow(() -> new RequestValidationException(
                    "difficulty_preference", "Unknown difficulty: " + value)));
        }
        return levels;
    }
}
