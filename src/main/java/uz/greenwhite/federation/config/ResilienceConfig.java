package uz.greenwhite.federation.config;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class ResilienceConfig {

    private final ProxyProperties proxyProperties;

    /**
     * One circuit breaker per provider is created lazily from this registry's default config.
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        ProxyProperties.CircuitBreaker cb = proxyProperties.getCircuitBreaker();

        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(cb.getFailureRateThreshold())
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(cb.getSlidingWindowSize())
                .minimumNumberOfCalls(Math.min(cb.getFailureThreshold(), cb.getSlidingWindowSize()))
                .waitDurationInOpenState(Duration.ofSeconds(cb.getOpenStateSeconds()))
                .permittedNumberOfCallsInHalfOpenState(cb.getHalfOpenMaxCalls())
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .build();

        log.info("Circuit breaker defaults: failureRate={}%, window={}, open={}s, halfOpen={}",
                cb.getFailureRateThreshold(), cb.getSlidingWindowSize(),
                cb.getOpenStateSeconds(), cb.getHalfOpenMaxCalls());

        return CircuitBreakerRegistry.of(config);
    }
}
