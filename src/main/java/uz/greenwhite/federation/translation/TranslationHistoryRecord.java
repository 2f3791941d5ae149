package uz.greenwhite.federation.translation;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TranslationHistoryRecord {

    @JsonProperty("timestamp")
    private Instant timestamp;

    @JsonProperty("source_version")
    private String sourceVersion;

    @JsonProperty("target_version")
    private String targetVersion;

    @JsonProperty("duration_ms")
    private long durationMs;

    @JsonProperty("success")
    private boolean success;

    @JsonProperty("error")
    private String error;

    @JsonProperty("data_size")
    private int dataSize;

    public String versionPair() {
        return TranslatorRegistry.key(sourceVersion, targetVersion);
    }
}
