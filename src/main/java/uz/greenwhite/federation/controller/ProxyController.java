package uz.greenwhite.federation.controller;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;
import uz.greenwhite.federation.proxy.ConnectionPool;
import uz.greenwhite.federation.proxy.ConnectionSnapshot;
import uz.greenwhite.federation.proxy.ProxyRequest;
import uz.greenwhite.federation.proxy.ProxyResponse;
import uz.greenwhite.federation.proxy.ProxyService;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@RestController
@RequiredArgsConstructor
public class ProxyController {

    static final String PROXY_PREFIX = "/api/v1/proxy/";

    /**
     * Inbound headers that describe the inbound hop and must not be forwarded.
     */
    private static final Set<String> HOP_HEADERS = Set.of(
            "host", "content-length", "connection", "transfer-encoding", "keep-alive", "upgrade", "accept-encoding");

    private final ProxyService proxyService;
    private final ConnectionPool connectionPool;

    /**
     * Example: POST /api/v1/proxy/search-server/mcp/execute
     */
    @RequestMapping(value = "/api/v1/proxy/{serverId}/**",
            method = {RequestMethod.GET, RequestMethod.POST, RequestMethod.PUT, RequestMethod.DELETE})
    public ResponseEntity<JsonNode> proxy(@PathVariable String serverId,
                                          @RequestBody(required = false) JsonNode body,
                                          HttpServletRequest request) {
        String path = request.getRequestURI().substring((PROXY_PREFIX + serverId).length());
        if (request.getQueryString() != null) {
            path = path + "?" + request.getQueryString();
        }

        ProxyResponse response = proxyService.proxyRequest(ProxyRequest.builder()
                .serverId(serverId)
                .path(path)
                .method(HttpMethod.valueOf(request.getMethod()))
                .headers(forwardableHeaders(request))
                .body(body)
                .build());

        HttpHeaders headers = new HttpHeaders();
        response.getHeaders().forEach((name, value) -> {
            if (!HOP_HEADERS.contains(name.toLowerCase())) {
                headers.add(name, value);
            }
        });
        return ResponseEntity.status(response.getStatusCode()).headers(headers).body(response.getBody());
    }

    @GetMapping("/api/v1/connections")
    public ResponseEntity<List<ConnectionSnapshot>> listConnections() {
        return ResponseEntity.ok(connectionPool.snapshots());
    }

    /**
     * Body: {"server_id": "...", "url": "...", "protocol_version": "v2.0"}
     */
    @PostMapping("/api/v1/connections")
    public ResponseEntity<ConnectionSnapshot> registerConnection(@RequestBody Map<String, String> body) {
        return ResponseEntity.ok(connectionPool.register(
                body.get("server_id"), body.get("url"), body.get("protocol_version")).snapshot());
    }

    @DeleteMapping("/api/v1/connections/{serverId}")
    public ResponseEntity<Void> closeConnection(@PathVariable String serverId) {
        return connectionPool.close(serverId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    private static Map<String, String> forwardableHeaders(HttpServletRequest request) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            if (!HOP_HEADERS.contains(name.toLowerCase())) {
                headers.put(name, request.getHeader(name));
            }
        }
        return headers;
    }
}
