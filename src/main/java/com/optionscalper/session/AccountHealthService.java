package com.optionscalper.session;

import com.optionscalper.broker.BrokerGateway;
import com.optionscalper.domain.enums.DegradationLevel;
import com.optionscalper.domain.model.MarginSnapshot;
import com.optionscalper.domain.model.UserProfile;
import com.optionscalper.resilience.ApiCircuitBreaker;
import com.optionscalper.resilience.ApiCircuitBreakers;
import com.optionscalper.resilience.ApiEndpoint;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodically polls the account endpoints (profile, margins), each behind its own circuit breaker,
 * and keeps the last values that came back.
 *
 * <p>A failing endpoint never blanks the account view: callers keep getting the cached profile and
 * margins while {@link #getDegradationLevel()} reports how stale they may be.
 */
@Service
public class AccountHealthService {

    private static final Logger log = LoggerFactory.getLogger(AccountHealthService.class);
    private static final Logger healthLog = LoggerFactory.getLogger("api-health");

    private final BrokerGateway brokerGateway;
    private final ApiCircuitBreakers apiCircuitBreakers;
    private final Clock clock;

    private final AtomicReference<UserProfile> lastProfile = new AtomicReference<>();
    private final AtomicReference<MarginSnapshot> lastMargins = new AtomicReference<>();
    private final AtomicReference<Instant> lastSuccessAt = new AtomicReference<>();

    public AccountHealthService(BrokerGateway brokerGateway, ApiCircuitBreakers apiCircuitBreakers, Clock clock) {
        this.brokerGateway = brokerGateway;
        this.apiCircuitBreakers = apiCircuitBreakers;
        this.clock = clock;
    }

    @Scheduled(
            fixedRateString = "${scalper.account.health-check-interval-ms:10000}",
            initialDelayString = "${scalper.account.health-check-interval-ms:10000}")
    public void scheduledHealthCheck() {
        checkHealth();
    }

    /** One check of both endpoints. Skipped when every breaker is blocking calls. */
    public void checkHealth() {
        ApiCircuitBreaker profileBreaker = apiCircuitBreakers.get(ApiEndpoint.PROFILE);
        ApiCircuitBreaker marginsBreaker = apiCircuitBreakers.get(ApiEndpoint.MARGINS);
        boolean profileAllowed = profileBreaker.canExecute();
        boolean marginsAllowed = marginsBreaker.canExecute();
        if (!profileAllowed && !marginsAllowed) {
            healthLog.debug("Account health check skipped: all circuits open");
            return;
        }

        if (profileAllowed) {
            checkEndpoint(profileBreaker, "profile", () -> lastProfile.set(brokerGateway.getProfile()));
        }
        if (marginsAllowed) {
            checkEndpoint(marginsBreaker, "margins", () -> lastMargins.set(brokerGateway.getMargins()));
        }
    }

    public UserProfile getProfile() {
        return lastProfile.get();
    }

    public MarginSnapshot getMargins() {
        return lastMargins.get();
    }

    public Instant getLastSuccessAt() {
        return lastSuccessAt.get();
    }

    public DegradationLevel getDegradationLevel() {
        return apiCircuitBreakers.degradationLevel();
    }

    private void checkEndpoint(ApiCircuitBreaker breaker, String name, Runnable call) {
        try {
            call.run();
            breaker.recordSuccess();
            lastSuccessAt.set(clock.instant());
            healthLog.debug("Account {} call ok", name);
        } catch (RuntimeException e) {
            breaker.recordFailure(e);
            healthLog.warn("Account {} call failed: {}", name, e.getMessage());
            log.debug("Account {} call failed", name, e);
        }
    }
}
