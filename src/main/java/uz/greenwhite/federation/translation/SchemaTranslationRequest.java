package uz.greenwhite.federation.translation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SchemaTranslationRequest {

    @JsonProperty("source_version")
    private String sourceVersion;

    @JsonProperty("target_version")
    private String targetVersion;

    @JsonProperty("source_data")
    private JsonNode sourceData;

    /**
     * Optional. Part of the cache key, so different clients never share a cached entry.
     */
    @JsonProperty("client_id")
    private String clientId;
}
