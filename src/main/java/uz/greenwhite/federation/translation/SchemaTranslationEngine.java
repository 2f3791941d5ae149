package uz.greenwhite.federation.translation;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uz.greenwhite.federation.config.TranslationProperties;
import uz.greenwhite.federation.error.FederationException;
import uz.greenwhite.federation.error.ValidationException;
import uz.greenwhite.federation.metrics.FederationMetrics;
import uz.greenwhite.federation.model.ComponentHealth;
import uz.greenwhite.federation.storage.TranslationRepository;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Translates payloads between schema versions, with content-addressed caching,
 * persisted translation records and per version pair history.
 */
@Slf4j
@Service
public class SchemaTranslationEngine {

    static final String CACHE_KEY_PREFIX = "schema_translation:";

    private final ProtocolTranslator protocolTranslator;
    private final TranslatorRegistry registry;
    private final TranslationCache cache;
    private final TranslationRepository repository;
    private final TranslationProperties properties;
    private final FederationMetrics metrics;
    private final Clock clock;

    private final AtomicLong totalTranslations = new AtomicLong();
    private final AtomicLong successfulTranslations = new AtomicLong();
    private final AtomicLong failedTranslations = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();
    private final AtomicLong totalDurationMs = new AtomicLong();

    public SchemaTranslationEngine(ProtocolTranslator protocolTranslator,
                                   TranslatorRegistry registry,
                                   TranslationCache cache,
                                   TranslationRepository repository,
                                   TranslationProperties properties,
                                   FederationMetrics metrics,
                                   Clock clock) {
        this.protocolTranslator = protocolTranslator;
        this.registry = registry;
        this.cache = cache;
        this.repository = repository;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    public SchemaTranslationResponse translateSchema(SchemaTranslationRequest request) {
        validate(request);
        totalTranslations.incrementAndGet();

        String key = cacheKey(request);
        SchemaTranslationRecord cached = cache.getIfPresent(key);
        if (cached != null) {
            return hit(cached);
        }

        AtomicBoolean computed = new AtomicBoolean(false);
        SchemaTranslationRecord record = cache.get(key, k -> {
            computed.set(true);
            return translate(k, request);
        });

        if (!computed.get()) {
            // another caller finished the same translation while we waited
            return hit(record);
        }
        return toResponse(record, false);
    }

    public Optional<SchemaTranslationRecord> getTranslation(UUID id) {
        return repository.findById(id);
    }

    public List<SchemaTranslationRecord> listTranslations(Predicate<SchemaTranslationRecord> filter) {
        return repository.findAll(filter == null ? r -> true : filter);
    }

    public List<TranslationPerformance> performance() {
        List<TranslationPerformance> result = new ArrayList<>();
        for (String pair : repository.historyPairs()) {
            List<TranslationHistoryRecord> entries = repository.history(pair);
            if (entries.isEmpty()) {
                continue;
            }
            long successful = entries.stream().filter(TranslationHistoryRecord::isSuccess).count();
            result.add(TranslationPerformance.builder()
                    .versionPair(pair)
                    .samples(entries.size())
                    .successful(successful)
                    .failed(entries.size() - successful)
                    .averageDurationMs(entries.stream().mapToLong(TranslationHistoryRecord::getDurationMs).average().orElse(0))
                    .maxDurationMs(entries.stream().mapToLong(TranslationHistoryRecord::getDurationMs).max().orElse(0))
                    .averageDataSize(entries.stream().mapToInt(TranslationHistoryRecord::getDataSize).average().orElse(0))
                    .build());
        }
        return result;
    }

    public void register(VersionTranslator translator) {
        registry.register(translator);
    }

    public long cacheSize() {
        return cache.size();
    }

    public ComponentHealth health() {
        long total = totalTranslations.get();
        long failed = failedTranslations.get();
        Map<String, Object> counters = new LinkedHashMap<>();
        counters.put("total_translations", total);
        counters.put("successful_translations", successfulTranslations.get());
        counters.put("failed_translations", failed);
        counters.put("cache_hits", cacheHits.get());
        counters.put("cache_misses", cacheMisses.get());
        counters.put("cache_size", cache.size());
        counters.put("supported_pairs", registry.supportedPairs());

        return ComponentHealth.builder()
                .component("schema_translator")
                .status(total > 0 && failed * 2 > total ? ComponentHealth.DEGRADED : ComponentHealth.HEALTHY)
                .successRate(ComponentHealth.successRate(total - failed, total))
                .counters(counters)
                .checkedAt(clock.instant())
                .build();
    }

    public Map<String, Number> metrics() {
        long computedCount = successfulTranslations.get();
        Map<String, Number> values = new LinkedHashMap<>();
        values.put("translation_total", totalTranslations.get());
        values.put("translation_successful_total", computedCount);
        values.put("translation_failed_total", failedTranslations.get());
        values.put("translation_cache_hits_total", cacheHits.get());
        values.put("translation_cache_misses_total", cacheMisses.get());
        values.put("translation_cache_size", cache.size());
        values.put("translation_average_duration_ms",
                computedCount > 0 ? (double) totalDurationMs.get() / computedCount : 0.0);
        return values;
    }

    private SchemaTranslationRecord translate(String key, SchemaTranslationRequest request) {
        cacheMisses.incrementAndGet();
        metrics.getTranslationCacheMiss().increment();

        String source = request.getSourceVersion();
        String target = request.getTargetVersion();
        int dataSize = request.getSourceData() == null ? 0 : request.getSourceData().toString().length();
        long start = System.nanoTime();

        try {
            TranslationResult result = protocolTranslator.translateWithDetails(request.getSourceData(), source, target);
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            SchemaTranslationRecord record = SchemaTranslationRecord.builder()
                    .id(UUID.randomUUID())
                    .cacheKey(key)
                    .sourceVersion(source)
                    .targetVersion(target)
                    .clientId(request.getClientId())
                    .translatedData(result.getData())
                    .translator(registry.find(source, target).map(VersionTranslator::name).orElse("identity"))
                    .mappedFields(result.getMappedFields())
                    .droppedFields(result.getDroppedFields())
                    .defaultedFields(result.getDefaultedFields())
                    .warnings(result.getWarnings())
                    .durationMs(durationMs)
                    .createdAt(clock.instant())
                    .build();

            repository.save(record);
            appendHistory(source, target, durationMs, true, null, dataSize);
            successfulTranslations.incrementAndGet();
            totalDurationMs.addAndGet(durationMs);
            metrics.getTranslationTimer().record(durationMs, TimeUnit.MILLISECONDS);

            log.info("Schema translated: {} -> {} id={} in {}ms (mapped={}, dropped={}, defaulted={})",
                    source, target, record.getId(), durationMs, result.getMappedFields().size(),
                    result.getDroppedFields().size(), result.getDefaultedFields().size());
            return record;

        } catch (FederationException e) {
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            failedTranslations.incrementAndGet();
            metrics.getTranslationFailure().increment();
            appendHistory(source, target, durationMs, false, e.getMessage(), dataSize);
            log.warn("Schema translation failed: {} -> {}: {}", source, target, e.getMessage());
            throw e;
        }
    }

    private SchemaTranslationResponse hit(SchemaTranslationRecord record) {
        cacheHits.incrementAndGet();
        metrics.getTranslationCacheHit().increment();
        log.debug("Translation cache hit: {} ({})", record.getId(), record.versionPair());
        return toResponse(record, true);
    }

    private void appendHistory(String source, String target, long durationMs,
                               boolean success, String error, int dataSize) {
        try {
            repository.appendHistory(TranslationHistoryRecord.builder()
                    .timestamp(clock.instant())
                    .sourceVersion(source)
                    .targetVersion(target)
                    .durationMs(durationMs)
                    .success(success)
                    .error(error)
                    .dataSize(dataSize)
                    .build(), properties.getHistoryLimit());
        } catch (RuntimeException e) {
            // best-effort
            log.error("Failed to record translation history for {} -> {}: {}", source, target, e.getMessage());
        }
    }

    private SchemaTranslationResponse toResponse(SchemaTranslationRecord record, boolean cached) {
        return SchemaTranslationResponse.builder()
                .translatedData(record.getTranslatedData())
                .metadata(TranslationMetadata.builder()
                        .translationId(record.getId())
                        .translator(record.getTranslator())
                        .mappedFields(record.getMappedFields())
                        .droppedFields(record.getDroppedFields())
                        .defaultedFields(record.getDefaultedFields())
                        .durationMs(record.getDurationMs())
                        .cached(cached)
                        .build())
                .warnings(record.getWarnings())
                .build();
    }

    private void validate(SchemaTranslationRequest request) {
        if (request == null) {
            throw new ValidationException("request", "Translation request is required");
        }
        if (request.getSourceVersion() == null || request.getSourceVersion().isBlank()) {
            throw new ValidationException("source_version", "Source version is required");
        }
        if (request.getTargetVersion() == null || request.getTargetVersion().isBlank()) {
            throw new ValidationException("target_version", "Target version is required");
        }
    }

    /**
     * SHA-256 over both versions, the serialized payload and the client id.
     * Identical inputs always produce the same key.
     */
    static String cacheKey(SchemaTranslationRequest request) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        JsonNode data = request.getSourceData();
        update(digest, request.getSourceVersion());
        update(digest, request.getTargetVersion());
        update(digest, data == null ? "null" : data.toString());
        update(digest, request.getClientId() == null ? "" : request.getClientId());
        return CACHE_KEY_PREFIX + HexFormat.of().formatHex(digest.digest());
    }

    private static void update(MessageDigest digest, String part) {
        digest.update(part.getBytes(StandardCharsets.UTF_8));
        digest.update((byte) 0);
    }
}
