package com.dailyprojects.core.engine;

import com.dailyprojects.core.cache.CacheKeys;
import com.dailyprojects.core.cache.CacheProperties;
import com.dailyprojects.core.cache.CacheStore;
import com.dailyprojects.core.cache.CacheUnavailableException;
import com.dailyprojects.core.fallback.FallbackSelection;
import com.dailyprojects.core.fallback.TemplateFallbackProvider;
import com.dailyprojects.core.generation.GeneratedDraft;
import com.dailyprojects.core.generation.GenerationResult;
import com.dailyprojects.core.generation.GenerationUnavailableException;
import com.dailyprojects.core.generation.ProjectGenerationService;
import com.dailyprojects.core.logging.MdcContext;
import com.dailyprojects.core.metrics.DailyProjectsMetrics;
import com.dailyprojects.core.model.ArchiveEntry;
import com.dailyprojects.core.model.DailyBatch;
import com.dailyprojects.core.model.GenerationRequest;
import com.dailyprojects.core.model.PoolSeedResult;
import com.dailyprojects.core.model.PoolStats;
import com.dailyprojects.core.model.Project;
import com.dailyprojects.core.model.ProjectSource;
import com.dailyprojects.core.model.ProjectStats;
import com.dailyprojects.core.ratelimit.RateDecision;
import com.dailyprojects.core.ratelimit.RateLimiter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Entry point of the engine: serves daily batches from the cache, generates
 * them at most once per {@code (date, count)} and degrades to the template
 * catalog when generation or the cache is unavailable.
 * <p>
 * Concurrent cold requests for the same key are collapsed by a cache-held lock
 * carrying a random owner token. The holder generates and publishes the batch;
 * everyone else polls the batch key until it appears, the lock frees up (and
 * they take it over), or the poll budget runs out (and they get an uncached
 * template batch).
 * <p>
 * Model-written projects from published daily batches and from seeding are
 * also kept in a rolling pool, which can be sampled, inspected and cleared.
 */
@Service
public class ProjectOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ProjectOrchestrator.class);

    private static final Pattern DAILY_ID = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2})-(\\d+)$");
    private static final DateTimeFormatter ID_TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    static final int MAX_CATEGORY_LENGTH = 50;
    static final int MAX_ARCHIVE_DAYS = 30;
    static final int ARCHIVE_PREVIEW_SIZE = 3;
    static final int MAX_SEED_COUNT = 50;

    private final CacheStore cacheStore;
    private final ProjectGenerationService generationService;
    private final TemplateFallbackProvider fallbackProvider;
    private final RateLimiter rateLimiter;
    private final CacheProperties cacheProperties;
    private final EngineProperties engineProperties;
    private final DailyProjectsMetrics metrics;
    private final DailyBatchCodec codec;
    private final ProjectPool pool;
    private final Clock clock;

    public ProjectOrchestrator(CacheStore cacheStore,
                               ProjectGenerationService generationService,
                               TemplateFallbackProvider fallbackProvider,
                               RateLimiter rateLimiter,
                               CacheProperties cacheProperties,
                               EngineProperties engineProperties,
                               DailyProjectsMetrics metrics,
                               ObjectMapper objectMapper,
                               Clock clock) {
        this.cacheStore = cacheStore;
        this.generationService = generationService;
        this.fallbackProvider = fallbackProvider;
        this.rateLimiter = rateLimiter;
        this.cacheProperties = cacheProperties;
        this.engineProperties = engineProperties;
        this.metrics = metrics;
        this.codec = new DailyBatchCodec(objectMapper);
        this.pool = new ProjectPool(cacheStore, cacheProperties, objectMapper, clock);
        this.clock = clock;
    }

    // --- Daily batches ---

    /**
     * Returns the batch for {@code (date, count)}, generating and caching it on
     * a miss. A {@code null} date means today in the configured zone.
     */
    public DailyBatch getDaily(LocalDate date, int count, boolean forceRegenerate) {
        validateCount(count);
        LocalDate day = date != null ? date : today();
        MdcContext.setBatch(day, count);
        try {
            Instant requestStart = clock.instant();
            GenerationState state = GenerationState.IDLE;

            if (!forceRegenerate) {
                Optional<DailyBatch> cached = lookup(day, count);
                if (cached.isPresent()) {
                    transition(state, GenerationState.SERVED, "cache hit");
                    return cached.get();
                }
            }

            state = transition(state, GenerationState.GENERATING, forceRegenerate ? "forced" : "cache miss");
            DailyBatch batch = generateOnce(day, count, forceRegenerate, requestStart);
            transition(state, GenerationState.SERVED, batch.source() + " batch");
            return batch;
        } finally {
            MdcContext.clearBatch();
        }
    }

    private DailyBatch generateOnce(LocalDate day, int count, boolean forceRegenerate, Instant requestStart) {
        String lockKey = CacheKeys.dailyLock(day, count);
        String token = UUID.randomUUID().toString();
        try {
            if (cacheStore.setIfAbsent(lockKey, token, cacheProperties.getLockTtl())) {
                return generateHoldingLock(day, count, forceRegenerate, requestStart, lockKey, token);
            }
        } catch (CacheUnavailableException e) {
            log.warn("Cache unavailable while locking, generating without lock or write-back: {}", e.getMessage());
            return produce(day, count, false);
        }
        return awaitPublished(day, count, forceRegenerate, requestStart, lockKey, token);
    }

    private DailyBatch generateHoldingLock(LocalDate day, int count, boolean forceRegenerate,
                                           Instant requestStart, String lockKey, String token) {
        try {
            // The previous holder may have published between our read and our lock.
            Optional<DailyBatch> published = peek(day, count)
                    .filter(b -> isFresh(b, forceRegenerate, requestStart));
            if (published.isPresent()) {
                log.info("Batch was published while acquiring the lock, serving it");
                return published.get();
            }
            return produce(day, count, true);
        } finally {
            release(lockKey, token);
        }
    }

    private DailyBatch awaitPublished(LocalDate day, int count, boolean forceRegenerate,
                                      Instant requestStart, String lockKey, String token) {
        int attempts = cacheProperties.effectivePollAttempts();
        log.info("Generation in progress elsewhere, polling up to {} times", attempts);
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                Thread.sleep(cacheProperties.getPollInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for generation");
                break;
            }

            Optional<DailyBatch> published = peek(day, count)
                    .filter(b -> isFresh(b, forceRegenerate, requestStart));
            if (published.isPresent()) {
                metrics.recordLockWait("published");
                log.info("Picked up batch published by the lock holder after {} poll(s)", attempt);
                return published.get();
            }

            try {
                if (cacheStore.setIfAbsent(lockKey, token, cacheProperties.getLockTtl())) {
                    metrics.recordLockWait("took_over");
                    log.info("Lock released without a published batch, taking over generation");
                    return generateHoldingLock(day, count, forceRegenerate, requestStart, lockKey, token);
                }
            } catch (CacheUnavailableException e) {
                log.warn("Cache unavailable while waiting, generating without lock or write-back: {}", e.getMessage());
                return produce(day, count, false);
            }
        }

        metrics.recordLockWait("gave_up");
        log.warn("No batch published after {} poll(s), serving uncached templates", attempts);
        Instant generatedAt = clock.instant();
        DailyBatch batch = templateBatch(day, count, GenerationRequest.daily(count, forceRegenerate), generatedAt);
        recordGenerated(batch.projects());
        return batch;
    }

    /**
     * Generates a batch with the model, falling back to templates, and
     * optionally writes it back under its daily key.
     */
    private DailyBatch produce(LocalDate day, int count, boolean writeBack) {
        GenerationRequest request = GenerationRequest.daily(count, false);
        Instant generatedAt = clock.instant();
        long start = System.currentTimeMillis();

        DailyBatch batch;
        try {
            GenerationResult result = generationService.generate(request, day);
            batch = new DailyBatch(day, count, toProjects(result.drafts(), day.toString(), generatedAt),
                    ProjectSource.AI, result.degraded());
            metrics.recordGenerationDuration("ai", System.currentTimeMillis() - start);
            log.debug("Model wrote {} of {} project(s)", result.countFrom(ProjectSource.AI), count);
        } catch (GenerationUnavailableException e) {
            log.warn("Generation unavailable ({}), serving templates: {}", e.reason(), e.getMessage());
            metrics.recordFallback(e.reason().name().toLowerCase(Locale.ROOT));
            batch = templateBatch(day, count, request, generatedAt);
            metrics.recordGenerationDuration("fallback", System.currentTimeMillis() - start);
        }

        metrics.recordBatchGenerated(batch.source().value(), batch.degraded());
        recordGenerated(batch.projects());
        if (writeBack) {
            store(batch);
            if (batch.source() == ProjectSource.AI) {
                pool.add(batch.projects());
            }
        }
        log.info("Produced {} batch with {} project(s){}", batch.source().value(), batch.projects().size(),
                batch.degraded() ? " (degraded)" : "");
        return batch;
    }

    private DailyBatch templateBatch(LocalDate day, int count, GenerationRequest request, Instant generatedAt) {
        FallbackSelection selection = fallbackProvider.sample(count, request, day);
        List<GeneratedDraft> drafts = selection.drafts().stream()
                .map(d -> new GeneratedDraft(d, ProjectSource.FALLBACK))
                .toList();
        return new DailyBatch(day, count, toProjects(drafts, day.toString(), generatedAt),
                ProjectSource.FALLBACK, selection.widened());
    }

    private static List<Project> toProjects(List<GeneratedDraft> drafts, String idPrefix, Instant generatedAt) {
        List<Project> projects = new ArrayList<>(drafts.size());
        for (int i = 0; i < drafts.size(); i++) {
            GeneratedDraft generated = drafts.get(i);
            projects.add(Project.from(generated.draft(), idPrefix + "-" + (i + 1), generatedAt, generated.source()));
        }
        return projects;
    }

    private static boolean isFresh(DailyBatch batch, boolean forceRegenerate, Instant requestStart) {
        if (!forceRegenerate) {
            return true;
        }
        Instant generatedAt = batch.generatedAt();
        return generatedAt != null && !generatedAt.isBefore(requestStart);
    }

    private GenerationState transition(GenerationState from, GenerationState to, String reason) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException("Illegal transition " + from + " -> " + to);
        }
        log.debug("{} -> {} ({})", from, to, reason);
        return to;
    }

    // --- Cache access ---

    /** Reads the daily key and counts the lookup as a hit or miss. */
    private Optional<DailyBatch> lookup(LocalDate day, int count) {
        String key = CacheKeys.daily(day, count);
        Optional<String> raw;
        try {
            raw = cacheStore.get(key);
        } catch (CacheUnavailableException e) {
            log.warn("Cache unavailable on read: {}", e.getMessage());
            metrics.recordCacheLookup("unavailable");
            return Optional.empty();
        }
        Optional<DailyBatch> batch = raw.flatMap(json -> codec.decode(key, json, count));
        if (batch.isPresent()) {
            metrics.recordCacheLookup("hit");
            incrementStat(CacheKeys.STATS_CACHE_HITS, 1);
        } else {
            metrics.recordCacheLookup(raw.isPresent() ? "corrupt" : "miss");
            incrementStat(CacheKeys.STATS_CACHE_MISSES, 1);
        }
        return batch;
    }

    /** Reads the daily key without touching the counters. */
    private Optional<DailyBatch> peek(LocalDate day, int count) {
        String key = CacheKeys.daily(day, count);
        try {
            return cacheStore.get(key).flatMap(json -> codec.decode(key, json, count));
        } catch (CacheUnavailableException e) {
            log.debug("Cache unavailable on peek: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void store(DailyBatch batch) {
        var ttl = batch.source() == ProjectSource.AI
                ? cacheProperties.getDailyTtl()
                : cacheProperties.getFallbackTtl();
        try {
            cacheStore.set(CacheKeys.daily(batch.date(), batch.count()), codec.encode(batch), ttl);
        } catch (CacheUnavailableException e) {
            log.warn("Could not cache batch for {}: {}", batch.date(), e.getMessage());
        }
    }

    private void release(String lockKey, String token) {
        try {
            if (!cacheStore.compareAndDelete(lockKey, token)) {
                log.warn("Lock {} expired or was taken over before release", lockKey);
            }
        } catch (CacheUnavailableException e) {
            log.warn("Could not release lock {}, it will expire: {}", lockKey, e.getMessage());
        }
    }

    /** Cached batches for a date, largest count first. */
    private List<DailyBatch> cachedBatches(LocalDate date) {
        List<Integer> counts;
        try {
            counts = cacheStore.keys(CacheKeys.dailyPattern(date)).stream()
                    .map(CacheKeys::countOf)
                    .filter(c -> c > 0)
                    .sorted(Comparator.reverseOrder())
                    .toList();
        } catch (CacheUnavailableException e) {
            log.warn("Cache unavailable listing batches for {}: {}", date, e.getMessage());
            return List.of();
        }
        List<DailyBatch> batches = new ArrayList<>();
        for (int count : counts) {
            peek(date, count).ifPresent(batches::add);
        }
        return batches;
    }

    // --- Custom generation ---

    /**
     * Generates projects for explicit preferences. Bypasses the daily key and
     * the lock, and the result is not cached.
     */
    public List<Project> generateCustom(GenerationRequest request) {
        if (request == null) {
            throw new RequestValidationException("body", "Request body is required");
        }
        validateCount(request.count());
        if (request.hasCategoryPreference() && request.categoryPreference().length() > MAX_CATEGORY_LENGTH) {
            throw new RequestValidationException("category_preference",
                    "category_preference must be at most " + MAX_CATEGORY_LENGTH + " characters");
        }

        Instant generatedAt = clock.instant();
        LocalDate day = LocalDate.ofInstant(generatedAt, clock.getZone());
        String idPrefix = "custom-" + ID_TIMESTAMP_FORMAT.format(generatedAt.atZone(clock.getZone()));

        List<GeneratedDraft> drafts;
        try {
            GenerationResult result = generationService.generate(request, day);
            drafts = result.drafts();
            metrics.recordBatchGenerated(ProjectSource.AI.value(), result.degraded());
        } catch (GenerationUnavailableException e) {
            log.warn("Custom generation unavailable ({}), serving templates: {}", e.reason(), e.getMessage());
            metrics.recordFallback(e.reason().name().toLowerCase(Locale.ROOT));
            FallbackSelection selection = fallbackProvider.sample(request.count(), request, day);
            drafts = selection.drafts().stream()
                    .map(d -> new GeneratedDraft(d, ProjectSource.FALLBACK))
                    .toList();
            metrics.recordBatchGenerated(ProjectSource.FALLBACK.value(), selection.widened());
        }

        List<Project> projects = toProjects(drafts, idPrefix, generatedAt);
        recordGenerated(projects);
        return projects;
    }

    // --- Pool ---

    /**
     * Generates {@code count} projects (1..50) straight into the pool, in
     * chunks no larger than the daily maximum. Only model-written projects are
     * pooled. A chunk that fails after earlier chunks succeeded ends the seed
     * with what was collected.
     *
     * @throws GenerationUnavailableException when no chunk could be generated
     */
    public PoolSeedResult seedPool(int count) {
        if (count < 1 || count > MAX_SEED_COUNT) {
            throw new RequestValidationException("count", "count must be between 1 and " + MAX_SEED_COUNT);
        }
        Instant generatedAt = clock.instant();
        LocalDate day = LocalDate.ofInstant(generatedAt, clock.getZone());
        String idPrefix = "pool-" + ID_TIMESTAMP_FORMAT.format(generatedAt.atZone(clock.getZone()));
        int chunkSize = Math.max(1, engineProperties.getMaxCount());

        List<GeneratedDraft> drafts = new ArrayList<>(count);
        while (drafts.size() < count) {
            int chunk = Math.min(chunkSize, count - drafts.size());
            try {
                GenerationResult result = generationService.generate(GenerationRequest.daily(chunk, false), day);
                drafts.addAll(result.drafts());
                metrics.recordBatchGenerated(ProjectSource.AI.value(), result.degraded());
            } catch (GenerationUnavailableException e) {
                metrics.recordFallback(e.reason().name().toLowerCase(Locale.ROOT));
                if (drafts.isEmpty()) {
                    log.warn("Pool seeding failed ({}): {}", e.reason(), e.getMessage());
                    throw e;
                }
                log.warn("Pool seeding stopped after {} of {} project(s) ({}): {}",
                        drafts.size(), count, e.reason(), e.getMessage());
                break;
            }
        }

        List<Project> projects = toProjects(drafts, idPrefix, generatedAt);
        recordGenerated(projects);
        int added = pool.add(projects);
        long size = poolSizeOrZero();
        log.info("Seeded pool with {} of {} generated project(s), size now {}", added, projects.size(), size);
        return new PoolSeedResult(count, projects.size(), added, size);
    }

    public PoolStats getPoolStats() {
        try {
            return PoolStats.of(pool.size());
        } catch (CacheUnavailableException e) {
            log.warn("Cache unavailable reading pool size: {}", e.getMessage());
            return PoolStats.unavailable();
        }
    }

    /** Random pooled projects; fewer than {@code count} when the pool is small or unreachable. */
    public List<Project> samplePool(int count) {
        validateCount(count);
        try {
            return pool.sample(count);
        } catch (CacheUnavailableException e) {
            log.warn("Cache unavailable sampling the pool: {}", e.getMessage());
            return List.of();
        }
    }

    /** @return number of projects removed; 0 when the cache is unreachable */
    public long clearPool() {
        try {
            long removed = pool.clear();
            log.info("Cleared {} project(s) from the pool", removed);
            return removed;
        } catch (CacheUnavailableException e) {
            log.warn("Cache unavailable, pool not cleared: {}", e.getMessage());
            return 0;
        }
    }

    private long poolSizeOrZero() {
        try {
            return pool.size();
        } catch (CacheUnavailableException e) {
            log.debug("Pool size unavailable: {}", e.getMessage());
            return 0;
        }
    }

    // --- Lookup, stats, maintenance ---

    public Project getById(String id) {
        Matcher matcher = DAILY_ID.matcher(id != null ? id : "");
        if (!matcher.matches()) {
            throw new ProjectNotFoundException(id);
        }
        LocalDate date;
        try {
            date = LocalDate.parse(matcher.group(1));
        } catch (DateTimeParseException e) {
            throw new ProjectNotFoundException(id);
        }
        for (DailyBatch batch : cachedBatches(date)) {
            for (Project project : batch.projects()) {
                if (project.id().equals(id)) {
                    return project;
                }
            }
        }
        throw new ProjectNotFoundException(id);
    }

    public ProjectStats getStats() {
        try {
            long total = readStat(CacheKeys.STATS_TOTAL_GENERATED);
            long ai = readStat(CacheKeys.STATS_AI_SOURCED);
            long fallback = readStat(CacheKeys.STATS_FALLBACK_SOURCED);
            long hits = readStat(CacheKeys.STATS_CACHE_HITS);
            long misses = readStat(CacheKeys.STATS_CACHE_MISSES);
            long reads = hits + misses;
            double ratio = reads == 0 ? 0.0 : (double) hits / reads;
            return new ProjectStats(total, ai, fallback, hits, misses, ratio, true);
        } catch (CacheUnavailableException e) {
            log.warn("Cache unavailable reading stats: {}", e.getMessage());
            return ProjectStats.unavailable();
        }
    }

    /**
     * Deletes the cached batches for one date, or for every date when
     * {@code date} is null.
     *
     * @return number of keys removed; 0 when the cache is unreachable
     */
    public long clearCache(LocalDate date) {
        String pattern = date != null ? CacheKeys.dailyPattern(date) : CacheKeys.allDailyPattern();
        try {
            long removed = cacheStore.deletePattern(pattern);
            log.info("Cleared {} cached batch(es) matching {}", removed, pattern);
            return removed;
        } catch (CacheUnavailableException e) {
            log.warn("Cache unavailable, nothing cleared for {}: {}", pattern, e.getMessage());
            return 0;
        }
    }

    /**
     * Summaries of the cached batches of the previous {@code days} days (capped
     * at 30), newest first. Days without a cached batch are skipped.
     */
    public List<ArchiveEntry> getArchive(int days) {
        if (days < 1) {
            throw new RequestValidationException("days", "days must be at least 1");
        }
        int span = Math.min(days, MAX_ARCHIVE_DAYS);
        LocalDate today = today();
        List<ArchiveEntry> archive = new ArrayList<>();
        for (int i = 1; i <= span; i++) {
            LocalDate date = today.minusDays(i);
            List<DailyBatch> batches = cachedBatches(date);
            if (!batches.isEmpty()) {
                List<Project> projects = batches.get(0).projects();
                archive.add(new ArchiveEntry(date,
                        projects.subList(0, Math.min(ARCHIVE_PREVIEW_SIZE, projects.size())),
                        projects.size()));
            }
        }
        return archive;
    }

    public RateDecision admitRequest(String callerKey) {
        RateDecision decision = rateLimiter.admit(callerKey);
        metrics.recordRateLimitDecision(decision.allowed(), decision.degraded());
        return decision;
    }

    // --- Helpers ---

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    private void validateCount(int count) {
        int max = engineProperties.getMaxCount();
        if (count < 1 || count > max) {
            throw new RequestValidationException("count", "count must be between 1 and " + max);
        }
    }

    private void recordGenerated(List<Project> projects) {
        long ai = projects.stream().filter(p -> p.source() == ProjectSource.AI).count();
        incrementStat(CacheKeys.STATS_TOTAL_GENERATED, projects.size());
        incrementStat(CacheKeys.STATS_AI_SOURCED, ai);
        incrementStat(CacheKeys.STATS_FALLBACK_SOURCED, projects.size() - ai);
    }

    private void incrementStat(String key, long delta) {
        if (delta <= 0) {
            return;
        }
        try {
            cacheStore.increment(key, delta, cacheProperties.getStatsTtl());
        } catch (CacheUnavailableException e) {
            log.debug("Stat {} not recorded: {}", key, e.getMessage());
        }
    }

    private long readStat(String key) {
        return cacheStore.get(key).map(v -> {
            try {
                return Long.parseLong(v.trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring non-numeric stat {}={}", key, v);
                return 0L;
            }
        }).orElse(0L);
    }
}
