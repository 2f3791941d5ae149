package uz.greenwhite.federation.translation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A completed translation. Stored in the cache under {@code cacheKey}
 * and persisted for later lookup by id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchemaTranslationRecord {

    @JsonProperty("id")
    private UUID id;

    @JsonProperty("cache_key")
    private String cacheKey;

    @JsonProperty("source_version")
    private String sourceVersion;

    @JsonProperty("target_version")
    private String targetVersion;

    @JsonProperty("client_id")
    private String clientId;

    @JsonProperty("translated_data")
    private JsonNode translatedData;

    @JsonProperty("translator")
    private String translator;

    @JsonProperty("mapped_fields")
    private List<String> mappedFields;

    @JsonProperty("dropped_fields")
    private List<String> droppedFields;

    @JsonProperty("defaulted_fields")
    private List<String> defaultedFields;

    @JsonProperty("warnings")
    private List<String> warnings;

    @JsonProperty("duration_ms")
    private long durationMs;

    @JsonProperty("created_at")
    private Instant createdAt;

    public String versionPair() {
        return TranslatorRegistry.key(sourceVersion, targetVersion);
    }
}
