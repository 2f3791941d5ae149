package uz.greenwhite.federation.translation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchemaTranslationResponse {

    @JsonProperty("translated_data")
    private JsonNode translatedData;

    @JsonProperty("translation_metadata")
    private TranslationMetadata metadata;

    @JsonProperty("warnings")
    private List<String> warnings;
}
