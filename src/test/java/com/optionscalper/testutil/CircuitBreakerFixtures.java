package com.optionscalper.testutil;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import java.time.Duration;

/** Registry configured like {@code resilience4j.circuitbreaker.configs.default} in application.yml. */
public final class CircuitBreakerFixtures {

    private CircuitBreakerFixtures() {}

    public static CircuitBreakerConfig defaultConfig() {
        return CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(3)
                .minimumNumberOfCalls(3)
                .failureRateThreshold(100)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .permittedNumberOfCallsInHalfOpenState(1)
                .build();
    }

    public static CircuitBreakerRegistry registry() {
        return CircuitBreakerRegistry.of(defaultConfig());
    }
}
