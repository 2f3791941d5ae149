package uz.greenwhite.federation.storage;

import uz.greenwhite.federation.translation.SchemaTranslationRecord;
import uz.greenwhite.federation.translation.TranslationHistoryRecord;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Durable store of completed translations and of per version pair history.
 */
public interface TranslationRepository {

    void save(SchemaTranslationRecord record);

    Optional<SchemaTranslationRecord> findById(UUID id);

    List<SchemaTranslationRecord> findAll(Predicate<SchemaTranslationRecord> filter);

    /**
     * Append a history record, keeping at most {@code limit} newest entries for its version pair.
     */
    void appendHistory(TranslationHistoryRecord record, int limit);

    /**
     * Newest first.
     */
    List<TranslationHistoryRecord> history(String versionPair);

    Set<String> historyPairs();
}
