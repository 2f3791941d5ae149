package uz.greenwhite.federation.proxy;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class ProxyResponse {
    String serverId;
    int statusCode;
    Map<String, String> headers;
    JsonNode body;
    long latencyMs;
    int attempts;
}
