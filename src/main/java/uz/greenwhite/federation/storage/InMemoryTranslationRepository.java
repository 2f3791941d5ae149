package uz.greenwhite.federation.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import uz.greenwhite.federation.translation.SchemaTranslationRecord;
import uz.greenwhite.federation.translation.TranslationHistoryRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

@Slf4j
@Repository
@ConditionalOnProperty(name = "federation.storage.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryTranslationRepository implements TranslationRepository {

    private final Map<UUID, SchemaTranslationRecord> records = new ConcurrentHashMap<>();
    private final Map<String, Deque<TranslationHistoryRecord>> history = new ConcurrentHashMap<>();

    @Override
    public void save(SchemaTranslationRecord record) {
        records.put(record.getId(), record);
    }

    @Override
    public Optional<SchemaTranslationRecord> findById(UUID id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public List<SchemaTranslationRecord> findAll(Predicate<SchemaTranslationRecord> filter) {
        return records.values().stream()
                .filter(filter)
                .sorted(Comparator.comparing(SchemaTranslationRecord::getCreatedAt).reversed())
                .toList();
    }

    @Override
    public void appendHistory(TranslationHistoryRecord record, int limit) {
        Deque<TranslationHistoryRecord> entries = history.computeIfAbsent(record.versionPair(), k -> new ArrayDeque<>());
        synchronized (entries) {
            entries.addFirst(record);
            while (entries.size() > limit) {
                entries.removeLast();
            }
        }
    }

    @Override
    public List<TranslationHistoryRecord> history(String versionPair) {
        Deque<TranslationHistoryRecord> entries = history.get(versionPair);
        if (entries == null) {
            return List.of();
        }
        synchronized (entries) {
            return new ArrayList<>(entries);
        }
    }

    @Override
    public Set<String> historyPairs() {
        return new TreeSet<>(history.keySet());
    }
}
