package uz.greenwhite.federation.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;
import uz.greenwhite.federation.config.StorageProperties;
import uz.greenwhite.federation.translation.SchemaTranslationRecord;
import uz.greenwhite.federation.translation.TranslationHistoryRecord;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

@Slf4j
@Repository
@ConditionalOnProperty(name = "federation.storage.type", havingValue = "redis")
public class RedisTranslationRepository implements TranslationRepository {

    private static final String RECORD_PREFIX = "federation:translation:";
    private static final String INDEX_KEY = "federation:translation:ids";
    private static final String HISTORY_PREFIX = "federation:translation:history:";
    private static final String PAIRS_KEY = "federation:translation:history:pairs";

    private final StringRedisTemplate redisTemplate;
    private final RedisJson json;
    private final StorageProperties storageProperties;

    public RedisTranslationRepository(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                      StorageProperties storageProperties) {
        this.redisTemplate = redisTemplate;
        this.json = new RedisJson(objectMapper);
        this.storageProperties = storageProperties;
    }

    @Override
    public void save(SchemaTranslationRecord record) {
        String key = RECORD_PREFIX + record.getId();
        redisTemplate.opsForValue().set(key, json.write(record),
                storageProperties.getRedisTtlHours(), TimeUnit.HOURS);
        redisTemplate.opsForSet().add(INDEX_KEY, record.getId().toString());
        log.debug("Translation saved: {} ({})", key, record.versionPair());
    }

    @Override
    public Optional<SchemaTranslationRecord> findById(UUID id) {
        String value = redisTemplate.opsForValue().get(RECORD_PREFIX + id);
        return Optional.ofNullable(json.read(value, SchemaTranslationRecord.class));
    }

    @Override
    public List<SchemaTranslationRecord> findAll(Predicate<SchemaTranslationRecord> filter) {
        Set<String> ids = redisTemplate.opsForSet().members(INDEX_KEY);
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return ids.stream()
                .map(id -> {
                    Optional<SchemaTranslationRecord> record = findById(UUID.fromString(id));
                    if (record.isEmpty()) {
                        // expired by TTL
                        redisTemplate.opsForSet().remove(INDEX_KEY, id);
                    }
                    return record.orElse(null);
                })
                .filter(Objects::nonNull)
                .filter(filter)
                .sorted(Comparator.comparing(SchemaTranslationRecord::getCreatedAt).reversed())
                .toList();
    }

    @Override
    public void appendHistory(TranslationHistoryRecord record, int limit) {
        String key = HISTORY_PREFIX + record.versionPair();
        redisTemplate.opsForList().leftPush(key, json.write(record));
        redisTemplate.opsForList().trim(key, 0, limit - 1L);
        redisTemplate.opsForSet().add(PAIRS_KEY, record.versionPair());
    }

    @Override
    public List<TranslationHistoryRecord> history(String versionPair) {
        List<String> values = redisTemplate.opsForList().range(HISTORY_PREFIX + versionPair, 0, -1);
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .map(value -> json.read(value, TranslationHistoryRecord.class))
                .filter(Objects::nonNull)
                .toList();
    }

    @Override
    public Set<String> historyPairs() {
        Set<String> pairs = redisTemplate.opsForSet().members(PAIRS_KEY);
        return pairs == null ? Set.of() : new TreeSet<>(pairs);
    }
}
