package uz.greenwhite.federation.translation;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uz.greenwhite.federation.config.TranslationProperties;

import java.time.Duration;
import java.util.function.Function;

/**
 * Bounded, expiring cache of completed translations keyed by content digest.
 * Eviction is owned entirely by Caffeine.
 */
@Slf4j
@Component
public class TranslationCache {

    private final Cache<String, SchemaTranslationRecord> cache;

    public TranslationCache(TranslationProperties properties) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(properties.getCacheMaxSize())
                .expireAfterWrite(Duration.ofMinutes(properties.getCacheTtlMinutes()))
                .build();
        log.info("Translation cache: maxSize={}, ttl={}m", properties.getCacheMaxSize(), properties.getCacheTtlMinutes());
    }

    public SchemaTranslationRecord getIfPresent(String key) {
        return cache.getIfPresent(key);
    }

    /**
     * Atomic per key: concurrent callers for the same key wait for a single computation.
     * Nothing is cached when {@code loader} throws.
     */
    public SchemaTranslationRecord get(String key, Function<String, SchemaTranslationRecord> loader) {
        return cache.get(key, loader);
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }
}
