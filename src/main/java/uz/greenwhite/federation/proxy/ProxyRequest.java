package uz.greenwhite.federation.proxy;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.springframework.http.HttpMethod;

import java.time.Duration;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class ProxyRequest {

    String serverId;

    /**
     * Provider-relative path including any query string, e.g. {@code /tools/list?limit=5}.
     */
    String path;

    @Builder.Default
    HttpMethod method = HttpMethod.POST;

    @Singular
    Map<String, String> headers;

    JsonNode body;

    /**
     * Per-call timeout; null means the configured request timeout.
     */
    Duration timeout;

    /**
     * Upper bound on HTTP attempts for this call; null means {@code federation.proxy.retry.max-attempts}.
     * Callers with their own retry loop pass 1.
     */
    Integer maxAttempts;

    /**
     * Protocol version the body is written in; null means header, routing rule, then default.
     */
    String sourceVersion;
}
