package uz.greenwhite.federation.error;

import lombok.Getter;

import java.util.Map;

@Getter
public class SchemaTranslationFailedException extends FederationException {

    private final String sourceVersion;
    private final String targetVersion;

    public SchemaTranslationFailedException(String sourceVersion, String targetVersion) {
        this(sourceVersion, targetVersion,
                "No translator available for " + sourceVersion + " -> " + targetVersion);
    }

    public SchemaTranslationFailedException(String sourceVersion, String targetVersion, String reason) {
        super(ErrorKind.SCHEMA_TRANSLATION_FAILED, "Schema translation failed: " + reason,
                Map.of("sourceVersion", String.valueOf(sourceVersion),
                        "targetVersion", String.valueOf(targetVersion)), null);
        this.sourceVersion = sourceVersion;
        this.targetVersion = targetVersion;
    }
}
