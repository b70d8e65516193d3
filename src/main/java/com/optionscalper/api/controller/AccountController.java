package com.optionscalper.api.controller;

import com.optionscalper.api.dto.response.AccountHealthResponse;
import com.optionscalper.domain.model.UserProfile;
import com.optionscalper.resilience.ApiCircuitBreaker;
import com.optionscalper.resilience.ApiCircuitBreakers;
import com.optionscalper.session.AccountHealthService;
import com.optionscalper.streaming.ConnectionState;
import com.optionscalper.streaming.StreamingConnectionSupervisor;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Account and connectivity health.
 *
 * <ul>
 *   <li>GET /api/account/health -- cached profile/margins plus the degradation indicator</li>
 *   <li>GET /api/account/circuit-breakers -- state of every guarded endpoint</li>
 *   <li>GET /api/account/stream -- streaming connection state</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/account")
public class AccountController {

    private final AccountHealthService accountHealthService;
    private final ApiCircuitBreakers apiCircuitBreakers;
    private final StreamingConnectionSupervisor streamingConnectionSupervisor;

    public AccountController(
            AccountHealthService accountHealthService,
            ApiCircuitBreakers apiCircuitBreakers,
            StreamingConnectionSupervisor streamingConnectionSupervisor) {
        this.accountHealthService = accountHealthService;
        this.apiCircuitBreakers = apiCircuitBreakers;
        this.streamingConnectionSupervisor = streamingConnectionSupervisor;
    }

    @GetMapping("/health")
    public ResponseEntity<AccountHealthResponse> getHealth() {
        UserProfile profile = accountHealthService.getProfile();
        return ResponseEntity.ok(AccountHealthResponse.builder()
                .degradationLevel(accountHealthService.getDegradationLevel())
                .userId(profile != null ? profile.getUserId() : null)
                .margins(accountHealthService.getMargins())
                .lastSuccessAt(accountHealthService.getLastSuccessAt())
                .streamStatus(streamingConnectionSupervisor.getStatus())
                .circuitBreakers(apiCircuitBreakers.snapshots())
                .build());
    }

    @GetMapping("/circuit-breakers")
    public ResponseEntity<List<ApiCircuitBreaker.Snapshot>> getCircuitBreakers() {
        return ResponseEntity.ok(apiCircuitBreakers.snapshots());
    }

    @GetMapping("/stream")
    public ResponseEntity<ConnectionState.Snapshot> getStreamState() {
        return ResponseEntity.ok(streamingConnectionSupervisor.getState());
    }
}
