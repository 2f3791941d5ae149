package uz.greenwhite.federation.translation;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TranslationMetadata {

    @JsonProperty("translation_id")
    private UUID translationId;

    @JsonProperty("translator")
    private String translator;

    @JsonProperty("mapped_fields")
    private List<String> mappedFields;

    @JsonProperty("dropped_fields")
    private List<String> droppedFields;

    @JsonProperty("defaulted_fields")
    private List<String> defaultedFields;

    @JsonProperty("duration_ms")
    private long durationMs;

    @JsonProperty("cached")
    private boolean cached;
}
