package uz.greenwhite.federation.translation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Singular;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Rule-based translator for top-level object fields: rename, drop, or fill a default.
 * Fields without a rule are carried over unchanged.
 */
public class FieldMappingTranslator implements VersionTranslator {

    private final String name;
    private final String sourceVersion;
    private final String targetVersion;
    private final Map<String, String> renames;
    private final Set<String> drops;
    private final Map<String, JsonNode> defaults;

    @Builder
    public FieldMappingTranslator(String name, String sourceVersion, String targetVersion,
                                  @Singular("rename") Map<String, String> renames,
                                  @Singular("drop") Set<String> drops,
                                  @Singular("defaultValue") Map<String, JsonNode> defaults) {
        this.name = name;
        this.sourceVersion = sourceVersion;
        this.targetVersion = targetVersion;
        this.renames = new LinkedHashMap<>(renames);
        this.drops = new LinkedHashSet<>(drops);
        this.defaults = new LinkedHashMap<>(defaults);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String sourceVersion() {
        return sourceVersion;
    }

    @Override
    public String targetVersion() {
        return targetVersion;
    }

    @Override
    public TranslationResult translate(JsonNode payload) {
        TranslationResult.TranslationResultBuilder result = TranslationResult.builder();

        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            return result.data(payload).warning("Empty payload, nothing to translate").build();
        }
        if (!payload.isObject()) {
            return result.data(payload.deepCopy())
                    .warning("Non-object payload (" + payload.getNodeType() + ") passed through unchanged")
                    .build();
        }

        ObjectNode target = JsonNodeFactory.instance.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = payload.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String sourceName = field.getKey();

            if (drops.contains(sourceName)) {
                result.droppedField(sourceName);
                continue;
            }

            String targetName = renames.getOrDefault(sourceName, sourceName);
            if (target.has(targetName)) {
                result.warning("Field '" + targetName + "' overwritten by mapping from '" + sourceName + "'");
            }
            target.set(targetName, field.getValue().deepCopy());
            result.mappedField(targetName);
        }

        defaults.forEach((fieldName, value) -> {
            if (!target.has(fieldName)) {
                target.set(fieldName, value.deepCopy());
                result.defaultedField(fieldName);
            }
        });

        return result.data(target).build();
    }

    @Override
    public String toString() {
        return name + "[" + key() + "]";
    }
}
