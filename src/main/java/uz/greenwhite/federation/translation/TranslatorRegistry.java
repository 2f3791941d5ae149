package uz.greenwhite.federation.translation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uz.greenwhite.federation.error.SchemaTranslationFailedException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Version-pair keyed lookup of {@link VersionTranslator}s.
 * All translator beans are registered on startup; more can be added at runtime.
 */
@Slf4j
@Component
public class TranslatorRegistry {

    private final Map<String, VersionTranslator> translators = new ConcurrentHashMap<>();

    public TranslatorRegistry(List<VersionTranslator> translators) {
        translators.forEach(this::register);
        log.info("Translator registry initialized with: {}", supportedPairs());
    }

    public static String key(String sourceVersion, String targetVersion) {
        return sourceVersion + "->" + targetVersion;
    }

    public void register(VersionTranslator translator) {
        VersionTranslator previous = translators.put(translator.key(), translator);
        if (previous != null) {
            log.warn("Translator for {} replaced: {} -> {}", translator.key(), previous.name(), translator.name());
        } else {
            log.debug("Registered translator {} for {}", translator.name(), translator.key());
        }
    }

    public Optional<VersionTranslator> find(String sourceVersion, String targetVersion) {
        return Optional.ofNullable(translators.get(key(sourceVersion, targetVersion)));
    }

    public VersionTranslator require(String sourceVersion, String targetVersion) {
        return find(sourceVersion, targetVersion)
                .orElseThrow(() -> new SchemaTranslationFailedException(sourceVersion, targetVersion));
    }

    public Set<String> supportedPairs() {
        return new TreeSet<>(translators.keySet());
    }

    public int size() {
        return translators.size();
    }
}
