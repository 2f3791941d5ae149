package uz.greenwhite.federation.translation;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Built-in translators between the legacy v1.0 tool-call envelope
 * ({@code tool, arguments, request_id, session}) and the v2.0 JSON-RPC envelope
 * ({@code jsonrpc, method, params, id}).
 */
@Configuration
public class McpTranslatorConfig {

    public static final String V1 = "v1.0";
    public static final String V2 = "v2.0";

    @Bean
    public VersionTranslator mcpV1ToV2Translator() {
        return FieldMappingTranslator.builder()
                .name("McpV1ToV2Translator")
                .sourceVersion(V1)
                .targetVersion(V2)
                .rename("tool", "method")
                .rename("arguments", "params")
                .rename("request_id", "id")
                .drop("session")
                .defaultValue("jsonrpc", JsonNodeFactory.instance.textNode("2.0"))
                .defaultValue("params", JsonNodeFactory.instance.objectNode())
                .build();
    }

    @Bean
    public VersionTranslator mcpV2ToV1Translator() {
        return FieldMappingTranslator.builder()
                .name("McpV2ToV1Translator")
                .sourceVersion(V2)
                .targetVersion(V1)
                .rename("method", "tool")
                .rename("params", "arguments")
                .rename("id", "request_id")
                .drop("jsonrpc")
                .defaultValue("arguments", JsonNodeFactory.instance.objectNode())
                .build();
    }
}
