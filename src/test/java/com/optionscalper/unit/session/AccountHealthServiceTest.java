package com.optionscalper.unit.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.optionscalper.broker.BrokerGateway;
import com.optionscalper.domain.enums.DegradationLevel;
import com.optionscalper.domain.model.MarginSnapshot;
import com.optionscalper.domain.model.UserProfile;
import com.optionscalper.exception.TransientApiException;
import com.optionscalper.resilience.ApiCircuitBreakers;
import com.optionscalper.resilience.ApiEndpoint;
import com.optionscalper.resilience.CircuitState;
import com.optionscalper.session.AccountHealthService;
import com.optionscalper.testutil.CircuitBreakerFixtures;
import com.optionscalper.testutil.MutableClock;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AccountHealthServiceTest {

    private static final Instant START = Instant.parse("2026-03-02T04:00:00Z");

    @Mock
    private BrokerGateway brokerGateway;

    private MutableClock clock;
    private ApiCircuitBreakers apiCircuitBreakers;
    private AccountHealthService accountHealthService;

    private final UserProfile profile =
            UserProfile.builder().userId("AB1234").userName("Trader").build();
    private final MarginSnapshot margins = MarginSnapshot.builder()
            .available(new BigDecimal("250000"))
            .utilised(new BigDecimal("18000"))
            .build();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        apiCircuitBreakers = new ApiCircuitBreakers(CircuitBreakerFixtures.registry(), clock);
        accountHealthService = new AccountHealthService(brokerGateway, apiCircuitBreakers, clock);
    }

    @Test
    @DisplayName("A healthy check caches profile and margins")
    void healthyCheck() {
        when(brokerGateway.getProfile()).thenReturn(profile);
        when(brokerGateway.getMargins()).thenReturn(margins);

        accountHealthService.checkHealth();

        assertThat(accountHealthService.getProfile()).isEqualTo(profile);
        assertThat(accountHealthService.getMargins()).isEqualTo(margins);
        assertThat(accountHealthService.getLastSuccessAt()).isEqualTo(START);
        assertThat(accountHealthService.getDegradationLevel()).isEqualTo(DegradationLevel.NONE);
    }

    @Test
    @DisplayName("Failing margins keep the cached value and degrade once the circuit opens")
    void failingMarginsKeepCache() {
        when(brokerGateway.getProfile()).thenReturn(profile);
        when(brokerGateway.getMargins())
                .thenReturn(margins)
                .thenThrow(new TransientApiException("Kite timeout"));

        for (int i = 0; i < 4; i++) {
            accountHealthService.checkHealth();
            clock.advance(Duration.ofSeconds(10));
        }

        assertThat(accountHealthService.getMargins()).isEqualTo(margins);
        assertThat(apiCircuitBreakers.get(ApiEndpoint.MARGINS).getState()).isEqualTo(CircuitState.OPEN);
        assertThat(accountHealthService.getDegradationLevel()).isEqualTo(DegradationLevel.DEGRADED);

        accountHealthService.checkHealth();

        verify(brokerGateway, times(4)).getMargins();
        verify(brokerGateway, times(5)).getProfile();
    }

    @Test
    @DisplayName("With every circuit open the check is skipped entirely")
    void allOpenSkips() {
        for (int i = 0; i < 3; i++) {
            apiCircuitBreakers.get(ApiEndpoint.PROFILE).recordFailure();
            apiCircuitBreakers.get(ApiEndpoint.MARGINS).recordFailure();
        }

        accountHealthService.checkHealth();

        verify(brokerGateway, never()).getProfile();
        verify(brokerGateway, never()).getMargins();
    }

    @Test
    @DisplayName("After the cooldown a successful trial closes the circuit again")
    void recoversAfterCooldown() {
        for (int i = 0; i < 3; i++) {
            apiCircuitBreakers.get(ApiEndpoint.MARGINS).recordFailure();
        }
        when(brokerGateway.getProfile()).thenReturn(profile);
        when(brokerGateway.getMargins()).thenReturn(margins);

        clock.advance(Duration.ofSeconds(31));
        accountHealthService.checkHealth();

        assertThat(apiCircuitBreakers.get(ApiEndpoint.MARGINS).getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(accountHealthService.getDegradationLevel()).isEqualTo(DegradationLevel.NONE);
    }
}
