package uz.greenwhite.federation.translation;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uz.greenwhite.federation.error.FederationException;
import uz.greenwhite.federation.error.SchemaTranslationFailedException;

/**
 * Stateless payload translation used by the proxy.
 * Equal versions pass the payload through untouched.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProtocolTranslator {

    private final TranslatorRegistry registry;

    public JsonNode translate(JsonNode payload, String sourceVersion, String targetVersion) {
        return translateWithDetails(payload, sourceVersion, targetVersion).getData();
    }

    public TranslationResult translateWithDetails(JsonNode payload, String sourceVersion, String targetVersion) {
        if (sourceVersion.equals(targetVersion)) {
            return TranslationResult.builder().data(payload).build();
        }

        VersionTranslator translator = registry.require(sourceVersion, targetVersion);
        try {
            TranslationResult result = translator.translate(payload);
            if (!result.getWarnings().isEmpty()) {
                log.debug("Translation {} produced warnings: {}", translator.key(), result.getWarnings());
            }
            return result;
        } catch (FederationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SchemaTranslationFailedException(sourceVersion, targetVersion,
                    "translator " + translator.name() + " failed: " + e.getMessage());
        }
    }

    public boolean supports(String sourceVersion, String targetVersion) {
        return sourceVersion.equals(targetVersion) || registry.find(sourceVersion, targetVersion).isPresent();
    }
}
