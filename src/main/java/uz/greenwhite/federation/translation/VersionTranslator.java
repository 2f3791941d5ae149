package uz.greenwhite.federation.translation;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Translates a payload shaped for one protocol version into the shape of another.
 * Implementations must be pure: the same input always yields the same result.
 */
public interface VersionTranslator {

    String name();

    String sourceVersion();

    String targetVersion();

    TranslationResult translate(JsonNode payload);

    default String key() {
        return TranslatorRegistry.key(sourceVersion(), targetVersion());
    }
}
