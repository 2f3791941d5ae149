package uz.greenwhite.federation.ratelimit;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import uz.greenwhite.federation.config.RateLimitProperties;
import uz.greenwhite.federation.error.ErrorKind;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies admission control to every inbound request except the exempt paths.
 * Admitted requests always release their concurrent slot when the chain returns.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RateLimitFilter extends OncePerRequestFilter {

    static final String ANONYMOUS_CLIENT = "anonymous";

    private final RateLimiter rateLimiter;
    private final RateLimitProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return properties.getExemptPaths().stream().anyMatch(path::startsWith);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String clientId = resolveClientId(request);
        RateLimitDecision decision = rateLimiter.checkAndAdmit(clientId);

        if (!decision.isAdmitted()) {
            writeRejection(response, decision);
            return;
        }

        try {
            filterChain.doFilter(request, response);
        } finally {
            rateLimiter.recordCompletion(clientId);
        }
    }

    private String resolveClientId(HttpServletRequest request) {
        String clientId = request.getHeader(properties.getClientIdHeader());
        return clientId == null || clientId.isBlank() ? ANONYMOUS_CLIENT : clientId.trim();
    }

    private void writeRejection(HttpServletResponse response, RateLimitDecision decision) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("kind", ErrorKind.RATE_LIMITED);
        body.put("code", ErrorKind.RATE_LIMITED.getCode());
        body.put("message", "Rate limit exceeded: " + decision.getScope().name().toLowerCase()
                + " " + decision.getViolation().getCode());
        body.put("violation_type", decision.getViolation().getCode());
        body.put("scope", decision.getScope());
        body.put("current_usage", decision.getCurrentUsage());
        body.put("limit", decision.getLimit());
        body.put("retry_after", decision.getRetryAfterSeconds());
        body.put("timestamp", Instant.now().toString());

        response.setStatus(ErrorKind.RATE_LIMITED.getHttpStatus());
        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(decision.getRetryAfterSeconds()));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), body);
    }
}
