package com.optionscalper.resilience;

import com.optionscalper.domain.enums.DegradationLevel;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.circuitbreaker.internal.CircuitBreakerStateMachine;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * One {@link ApiCircuitBreaker} per {@link ApiEndpoint}, so a degraded margins endpoint never
 * blocks position refreshes and vice versa.
 *
 * <p>Each endpoint maps to the registry instance of the same lowercase name
 * ({@code resilience4j.circuitbreaker.instances.positions}, ...). The instance is rebuilt on the
 * application {@link Clock} with the registry's configuration and put back into the registry, so
 * actuator and metrics still see it.
 */
@Component
public class ApiCircuitBreakers {

    private final Map<ApiEndpoint, ApiCircuitBreaker> breakers = new EnumMap<>(ApiEndpoint.class);

    public ApiCircuitBreakers(CircuitBreakerRegistry circuitBreakerRegistry, Clock clock) {
        for (ApiEndpoint endpoint : ApiEndpoint.values()) {
            String name = endpoint.name().toLowerCase();
            CircuitBreakerConfig config =
                    circuitBreakerRegistry.circuitBreaker(name).getCircuitBreakerConfig();
            CircuitBreaker circuitBreaker = new CircuitBreakerStateMachine(name, config, clock);
            circuitBreakerRegistry.replace(name, circuitBreaker);
            breakers.put(endpoint, new ApiCircuitBreaker(circuitBreaker, clock));
        }
    }

    public ApiCircuitBreaker get(ApiEndpoint endpoint) {
        return breakers.get(endpoint);
    }

    public List<ApiCircuitBreaker.Snapshot> snapshots() {
        return breakers.values().stream().map(ApiCircuitBreaker::snapshot).toList();
    }

    /** DEGRADED if any endpoint is blocked, PARTIAL if any is probing recovery, NONE otherwise. */
    public DegradationLevel degradationLevel() {
        boolean anyHalfOpen = false;
        for (ApiCircuitBreaker breaker : breakers.values()) {
            CircuitState state = breaker.getState();
            if (state == CircuitState.OPEN) {
                return DegradationLevel.DEGRADED;
            }
            if (state == CircuitState.HALF_OPEN) {
                anyHalfOpen = true;
            }
        }
        return anyHalfOpen ? DegradationLevel.PARTIAL : DegradationLevel.NONE;
    }
}
