package com.optionscalper.resilience;

import com.optionscalper.exception.TransientApiException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Circuit breaker for one upstream call category, backed by a Resilience4j {@link CircuitBreaker}.
 *
 * <p>The Resilience4j instance is configured as a count-based window of {@code N} calls with a 100%
 * failure-rate threshold, which trips after {@code N} consecutive failures. After the open-state wait
 * one trial call is permitted; its outcome closes or reopens the circuit.
 *
 * <p>The Kite REST services also carry Resilience4j rate limiting and retry. This breaker sits above
 * them and counts whole logical calls, so the threshold means "three failed refreshes", not
 * "three failed HTTP attempts".
 */
public class ApiCircuitBreaker {

    private static final Logger healthLog = LoggerFactory.getLogger("api-health");

    private final CircuitBreaker circuitBreaker;
    private final Clock clock;

    private volatile Instant lastFailureTime;

    public ApiCircuitBreaker(CircuitBreaker circuitBreaker, Clock clock) {
        this.circuitBreaker = circuitBreaker;
        this.clock = clock;
        circuitBreaker.getEventPublisher().onStateTransition(event -> healthLog.info(
                "Circuit '{}' {} (failures={})",
                event.getCircuitBreakerName(),
                event.getStateTransition(),
                getFailureCount()));
    }

    /** Acquires a call permission; in HALF_OPEN only the single trial caller gets one. */
    public boolean canExecute() {
        return circuitBreaker.tryAcquirePermission();
    }

    public void recordSuccess() {
        circuitBreaker.onSuccess(0, TimeUnit.NANOSECONDS);
    }

    public void recordFailure() {
        recordFailure(new TransientApiException("Call to '" + getName() + "' failed"));
    }

    public void recordFailure(Throwable cause) {
        lastFailureTime = clock.instant();
        circuitBreaker.onError(0, TimeUnit.NANOSECONDS, cause);
    }

    /**
     * Runs {@code action} through the breaker: blocked calls fail fast with
     * {@link TransientApiException}, outcomes are recorded, exceptions are rethrown unchanged.
     */
    public <T> T execute(Supplier<T> action) {
        if (!canExecute()) {
            throw new TransientApiException("Circuit '" + getName() + "' is open; call skipped");
        }
        try {
            T result = action.get();
            recordSuccess();
            return result;
        } catch (RuntimeException e) {
            recordFailure(e);
            throw e;
        }
    }

    public CircuitState getState() {
        switch (circuitBreaker.getState()) {
            case OPEN:
            case FORCED_OPEN:
                return CircuitState.OPEN;
            case HALF_OPEN:
                return CircuitState.HALF_OPEN;
            default:
                return CircuitState.CLOSED;
        }
    }

    /** Failed calls in the current window; reset when the circuit closes or goes half-open. */
    public int getFailureCount() {
        return circuitBreaker.getMetrics().getNumberOfFailedCalls();
    }

    public String getName() {
        return circuitBreaker.getName();
    }

    public Snapshot snapshot() {
        return new Snapshot(getName(), getState(), getFailureCount(), lastFailureTime);
    }

    public record Snapshot(String name, CircuitState state, int failureCount, Instant lastFailureTime) {}
}
