package uz.greenwhite.federation.proxy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import uz.greenwhite.federation.config.ProxyProperties;
import uz.greenwhite.federation.error.ExternalServiceException;
import uz.greenwhite.federation.metrics.FederationMetrics;
import uz.greenwhite.federation.model.ComponentHealth;
import uz.greenwhite.federation.translation.ProtocolTranslator;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Forwards requests to providers.
 *
 * Flow: resolve connection -> translate body -> circuit breaker permission ->
 * HTTP call with timeout and bounded retry -> record outcome on the connection,
 * the breaker and the aggregate stats.
 */
@Slf4j
@Service
public class ProxyService {

    private final WebClient webClient;
    private final ConnectionPool connectionPool;
    private final RequestRouter router;
    private final ProtocolTranslator protocolTranslator;
    private final ProxyProperties properties;
    private final FederationMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final ProxyStats stats = new ProxyStats();

    public ProxyService(WebClient providerWebClient,
                        ConnectionPool connectionPool,
                        RequestRouter router,
                        ProtocolTranslator protocolTranslator,
                        ProxyProperties properties,
                        FederationMetrics metrics,
                        ObjectMapper objectMapper,
                        Clock clock) {
        this.webClient = providerWebClient;
        this.connectionPool = connectionPool;
        this.router = router;
        this.protocolTranslator = protocolTranslator;
        this.properties = properties;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Blocking variant for servlet threads and workflow step workers.
     */
    public ProxyResponse proxyRequest(ProxyRequest request) {
        return forward(request).block();
    }

    /**
     * Failures surface as {@link ExternalServiceException} tagged with the server id,
     * or {@code SchemaTranslationFailedException} before anything is sent.
     */
    public Mono<ProxyResponse> forward(ProxyRequest request) {
        ServerConnection connection = connectionPool.getConnection(request.getServerId());
        String serverId = connection.getServerId();

        RoutingRule rule = router.route(request.getPath()).orElse(null);
        String sourceVersion = sourceVersion(request, rule);
        String targetVersion = connection.getProtocolVersion() != null
                ? connection.getProtocolVersion()
                : rule != null && rule.getTargetVersion() != null ? rule.getTargetVersion() : properties.getDefaultProtocolVersion();

        JsonNode body = request.getBody() == null
                ? null
                : protocolTranslator.translate(request.getBody(), sourceVersion, targetVersion);

        CircuitBreaker circuitBreaker = connectionPool.circuitBreaker(serverId);
        if (properties.getCircuitBreaker().isEnabled()) {
            try {
                circuitBreaker.acquirePermission();
            } catch (CallNotPermittedException ex) {
                log.warn("Circuit breaker [{}] OPEN, request blocked: {} {}",
                        circuitBreaker.getName(), request.getMethod(), request.getPath());
                metrics.getProxyCircuitBreakerOpen().increment();
                stats.record(false, 0);
                return Mono.error(new ExternalServiceException(serverId,
                        "circuit breaker is open, provider unavailable", 503, true, ex));
            }
        }

        Duration timeout = request.getTimeout() != null
                ? request.getTimeout()
                : Duration.ofMillis(properties.getRequestTimeoutMs());
        int maxAttempts = request.getMaxAttempts() != null
                ? Math.max(1, request.getMaxAttempts())
                : properties.getRetry().getMaxAttempts();
        String url = connection.getUrl() + (request.getPath() == null ? "" : request.getPath());
        AtomicInteger attempts = new AtomicInteger();
        long startTime = System.nanoTime();

        log.info("Proxying [{}]: {} {} ({} -> {})", serverId, request.getMethod(), url, sourceVersion, targetVersion);

        return Mono.defer(() -> {
                    attempts.incrementAndGet();
                    return send(request, url, body, targetVersion);
                })
                .timeout(timeout)
                .onErrorMap(ex -> toExternal(serverId, ex, timeout))
                .retryWhen(retrySpec(serverId, maxAttempts))
                .map(entity -> {
                    long latencyMs = elapsedMs(startTime);
                    onSuccess(connection, circuitBreaker, latencyMs);
                    log.info("Proxy response [{}]: status={}, time={}ms, attempts={}",
                            serverId, entity.getStatusCode().value(), latencyMs, attempts.get());
                    return ProxyResponse.builder()
                            .serverId(serverId)
                            .statusCode(entity.getStatusCode().value())
                            .headers(flatten(entity.getHeaders()))
                            .body(parseBody(entity.getBody()))
                            .latencyMs(latencyMs)
                            .attempts(attempts.get())
                            .build();
                })
                .doOnError(ExternalServiceException.class, ex -> {
                    long latencyMs = elapsedMs(startTime);
                    onFailure(connection, circuitBreaker, latencyMs, ex);
                    log.error("Proxy request failed [{}]: {} {} after {} attempt(s) -> {}",
                            serverId, request.getMethod(), url, attempts.get(), ex.getMessage());
                });
    }

    public ComponentHealth health() {
        ProxyStats.Snapshot snapshot = stats.snapshot();
        PoolStats pool = connectionPool.stats();

        Map<String, Object> counters = new LinkedHashMap<>();
        counters.put("total_requests", snapshot.getTotalRequests());
        counters.put("successful_requests", snapshot.getSuccessfulRequests());
        counters.put("failed_requests", snapshot.getFailedRequests());
        counters.put("average_latency_ms", snapshot.getAverageLatencyMs());
        counters.put("total_connections", pool.getTotalConnections());
        counters.put("active_connections", pool.getActiveConnections());
        counters.put("idle_connections", pool.getIdleConnections());
        counters.put("degraded_connections", pool.getDegradedConnections());
        counters.put("broken_connections", pool.getBrokenConnections());
        counters.put("pool_utilization", pool.getUtilization());

        double successRate = ComponentHealth.successRate(snapshot.getSuccessfulRequests(), snapshot.getTotalRequests());
        boolean degraded = pool.getBrokenConnections() > 0
                || (snapshot.getTotalRequests() > 0 && successRate < 50.0);

        return ComponentHealth.builder()
                .component("proxy")
                .status(degraded ? ComponentHealth.DEGRADED : ComponentHealth.HEALTHY)
                .successRate(successRate)
                .counters(counters)
                .checkedAt(clock.instant())
                .build();
    }

    public Map<String, Number> metrics() {
        ProxyStats.Snapshot snapshot = stats.snapshot();
        PoolStats pool = connectionPool.stats();

        Map<String, Number> values = new LinkedHashMap<>();
        values.put("proxy_requests_total", snapshot.getTotalRequests());
        values.put("proxy_requests_successful_total", snapshot.getSuccessfulRequests());
        values.put("proxy_requests_failed_total", snapshot.getFailedRequests());
        values.put("proxy_average_latency_ms", snapshot.getAverageLatencyMs());
        values.put("proxy_connections_active", pool.getActiveConnections());
        values.put("proxy_connections_idle", pool.getIdleConnections());
        values.put("proxy_connections_degraded", pool.getDegradedConnections());
        values.put("proxy_connections_broken", pool.getBrokenConnections());
        values.put("proxy_pool_utilization", pool.getUtilization());
        return values;
    }

    // ==================== HELPERS ====================

    private Mono<ResponseEntity<String>> send(ProxyRequest request, String url, JsonNode body, String targetVersion) {
        WebClient.RequestBodySpec spec = webClient
                .method(request.getMethod())
                .uri(url)
                .headers(h -> applyHeaders(h, request.getHeaders(), targetVersion));

        WebClient.RequestHeadersSpec<?> ready = body == null ? spec : spec.bodyValue(body);
        return ready.retrieve().toEntity(String.class);
    }

    private String sourceVersion(ProxyRequest request, RoutingRule rule) {
        if (request.getSourceVersion() != null) {
            return request.getSourceVersion();
        }
        String header = request.getHeaders().get(properties.getProtocolVersionHeader());
        if (header != null && !header.isBlank()) {
            return header;
        }
        if (rule != null && rule.getSourceVersion() != null) {
            return rule.getSourceVersion();
        }
        return properties.getDefaultProtocolVersion();
    }

    /**
     * Custom headers first, then the protocol version of the translated body,
     * then a default Content-Type if none was given.
     */
    private void applyHeaders(HttpHeaders httpHeaders, Map<String, String> customHeaders, String targetVersion) {
        customHeaders.forEach(httpHeaders::set);
        httpHeaders.set(properties.getProtocolVersionHeader(), targetVersion);
        if (httpHeaders.getContentType() == null) {
            httpHeaders.setContentType(MediaType.APPLICATION_JSON);
        }
    }

    private Retry retrySpec(String serverId, int maxAttempts) {
        ProxyProperties.Retry retry = properties.getRetry();
        return Retry.from(signals -> signals.flatMap(signal -> {
            Throwable failure = signal.failure();
            long retryNumber = signal.totalRetries() + 1;
            boolean retryable = failure instanceof ExternalServiceException ese && ese.isRetryable();
            if (!retryable || retryNumber >= maxAttempts) {
                return Mono.error(failure);
            }
            Duration delay = Backoff.delay((int) retryNumber, retry.getBaseDelayMs(), retry.getMaxDelayMs(),
                    retry.getBackoffMultiplier(), true, retry.isEnableJitter());
            metrics.getProxyRetry().increment();
            log.warn("Retrying [{}] in {}ms (retry {}/{}): {}",
                    serverId, delay.toMillis(), retryNumber, maxAttempts - 1, failure.getMessage());
            return Mono.delay(delay);
        }));
    }

    private Throwable toExternal(String serverId, Throwable ex, Duration timeout) {
        if (ex instanceof ExternalServiceException) {
            return ex;
        }
        if (ex instanceof TimeoutException) {
            metrics.getProxyTimeout().increment();
            return new ExternalServiceException(serverId,
                    "request timed out after " + timeout.toMillis() + "ms", 504, true, ex);
        }
        if (ex instanceof WebClientResponseException webEx) {
            int status = webEx.getStatusCode().value();
            return new ExternalServiceException(serverId,
                    "HTTP " + status + ": " + webEx.getStatusText(), status,
                    properties.getRetry().isRetryable(status), ex);
        }
        if (ex instanceof WebClientRequestException) {
            return new ExternalServiceException(serverId, "transport error: " + ex.getMessage(), 0, true, ex);
        }
        return new ExternalServiceException(serverId, ex.getMessage(), 0, false, ex);
    }

    private void onSuccess(ServerConnection connection, CircuitBreaker circuitBreaker, long latencyMs) {
        connectionPool.recordSuccess(connection, latencyMs);
        if (properties.getCircuitBreaker().isEnabled()) {
            circuitBreaker.onSuccess(latencyMs, TimeUnit.MILLISECONDS);
        }
        stats.record(true, latencyMs);
        metrics.getProxySuccess().increment();
        metrics.getProxyRequestTimer().record(latencyMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Client errors (4xx other than retryable ones) are the caller's fault and
     * do not count against the provider's health.
     */
    private void onFailure(ServerConnection connection, CircuitBreaker circuitBreaker,
                           long latencyMs, ExternalServiceException ex) {
        boolean providerFault = ex.getHttpStatus() == 0 || ex.getHttpStatus() >= 500 || ex.isRetryable();
        if (providerFault) {
            connectionPool.recordFailure(connection, latencyMs);
        } else {
            connectionPool.recordNeutral(connection, latencyMs);
        }
        if (properties.getCircuitBreaker().isEnabled()) {
            if (providerFault) {
                circuitBreaker.onError(latencyMs, TimeUnit.MILLISECONDS, ex);
            } else {
                circuitBreaker.onSuccess(latencyMs, TimeUnit.MILLISECONDS);
            }
        }
        stats.record(false, latencyMs);
        metrics.getProxyFailure().increment();
        metrics.getProxyRequestTimer().record(latencyMs, TimeUnit.MILLISECONDS);
    }

    private JsonNode parseBody(String body) {
        if (body == null || body.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Provider body is not JSON, returned as text");
            return TextNode.valueOf(body);
        }
    }

    private static Map<String, String> flatten(HttpHeaders headers) {
        Map<String, String> result = new LinkedHashMap<>();
        headers.forEach((name, values) -> result.put(name, String.join(",", values)));
        return result;
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
