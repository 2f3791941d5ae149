package uz.greenwhite.federation.translation;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TranslationResult {

    JsonNode data;

    @Singular
    List<String> mappedFields;

    @Singular
    List<String> droppedFields;

    @Singular
    List<String> defaultedFields;

    @Singular
    List<String> warnings;
}
