package uz.greenwhite.federation.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "federation.translation")
public class TranslationProperties {

    /**
     * Cached translations expire this long after creation.
     * Default: 60 minutes
     */
    private long cacheTtlMinutes = 60;

    /**
     * Maximum number of cached translations.
     */
    private long cacheMaxSize = 10_000;

    /**
     * History records kept per version pair.
     */
    private int historyLimit = 1000;

    @PostConstruct
    public void validate() {
        if (cacheTtlMinutes <= 0 || cacheMaxSize <= 0 || historyLimit <= 0) {
            throw new IllegalArgumentException(
                    "federation.translation cache-ttl-minutes, cache-max-size and history-limit must be > 0");
        }
    }
}
