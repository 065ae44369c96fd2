package com.campus.payments.config;

import com.campus.payments.exception.GatewayRejectedException;
import com.campus.payments.exception.ReferenceNotFoundException;
import com.campus.payments.exception.ValidationException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for the Resilience4j circuit breakers around payment gateway calls.
 * <p>
 * One breaker per provider ("paystack", "stripe", "mock"), all sharing this default config.
 * Business outcomes (declined charges, unknown references) are ignored so that only
 * transport and provider-side failures count towards opening the circuit.
 * <p>
 * States:
 * - CLOSED: Normal operation, requests pass through
 * - OPEN: Provider is failing, requests fail fast with GatewayUnavailable
 * - HALF_OPEN: Testing if provider has recovered
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // Number of calls to record before calculating failure rate
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .permittedNumberOfCallsInHalfOpenState(3)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .ignoreExceptions(
                        GatewayRejectedException.class,
                        ReferenceNotFoundException.class,
                        ValidationException.class)
                .build();

        return CircuitBreakerRegistry.of(config);
    }
}
