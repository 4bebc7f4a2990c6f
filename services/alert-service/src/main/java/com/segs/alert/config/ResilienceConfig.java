package com.segs.alert.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Resilience4j Configuration
 *
 * Outbound alert publication goes through a circuit breaker so that a dead
 * broker fails fast instead of piling up sends behind the alert store writes.
 */
@Configuration
@Slf4j
public class ResilienceConfig {

    public static final String ALERT_PUBLISHER = "alertPublisher";

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        log.info("Initializing Circuit Breaker Registry");

        CircuitBreakerConfig defaultConfig = CircuitBreakerConfig.custom()
            .failureRateThreshold(50)
            .slowCallRateThreshold(50)
            .slowCallDurationThreshold(Duration.ofSeconds(5))
            .permittedNumberOfCallsInHalfOpenState(5)
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(50)
            .minimumNumberOfCalls(10)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .automaticTransitionFromOpenToHalfOpenEnabled(true)
            .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(defaultConfig);

        registry.getEventPublisher().onEntryAdded(event -> {
            CircuitBreaker breaker = event.getAddedEntry();
            breaker.getEventPublisher().onStateTransition(transition ->
                log.warn("Circuit breaker {} changed state: {}",
                    breaker.getName(), transition.getStateTransition()));
        });
        return registry;
    }

    @Bean
    public CircuitBreaker alertPublisherCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(ALERT_PUBLISHER);
    }
}
