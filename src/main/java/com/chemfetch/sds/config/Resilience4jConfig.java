package com.chemfetch.sds.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * <h2>Resilience4j Configuration</h2>
 *
 * <p>
 * Exposes the Resilience4j registries and the two named policies used by the
 * outbound integrations: a retry for the JSON search API and a circuit
 * breaker guarding the remote document-processing service.
 * </p>
 */
@Configuration
public class Resilience4jConfig {

    /** Name of the retry wrapped around JSON search API calls. */
    public static final String SEARCH_BACKEND = "searchBackend";

    /** Name of the breaker wrapped around remote capability calls. */
    public static final String EXTRACTION_CAPABILITY = "extractionCapability";

    /**
     * Global {@link RetryRegistry}. Two attempts with a short pause: search
     * outages are usually quota errors that a retry does not cure.
     *
     * @return the retry registry
     */
    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(300))
                .build());
    }

    /**
     * Global {@link CircuitBreakerRegistry}.
     *
     * @return the circuit breaker registry
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        return CircuitBreakerRegistry.of(CircuitBreakerConfig.custom()
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .build());
    }

    /**
     * Retry policy applied to every JSON search API query.
     *
     * @param registry the global {@link RetryRegistry}
     * @return a {@link Retry} named {@value #SEARCH_BACKEND}
     */
    @Bean
    public Retry searchRetry(final RetryRegistry registry) {
        return registry.retry(SEARCH_BACKEND);
    }

    /**
     * Breaker for the remote extraction capability. While open, calls fail
     * fast and the coordinator falls back to placeholder metadata.
     *
     * @param registry the global {@link CircuitBreakerRegistry}
     * @return a {@link CircuitBreaker} named {@value #EXTRACTION_CAPABILITY}
     */
    @Bean
    public CircuitBreaker capabilityCircuitBreaker(final CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(EXTRACTION_CAPABILITY);
    }

}
