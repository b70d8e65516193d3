package com.optionscalper.api.dto.response;

import com.optionscalper.domain.enums.DegradationLevel;
import com.optionscalper.domain.model.MarginSnapshot;
import com.optionscalper.resilience.ApiCircuitBreaker;
import com.optionscalper.streaming.ConnectionStatus;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Account view with its degradation indicator. Profile and margins are the last values that came
 * back from the broker and may be stale while {@code degradationLevel} is not NONE.
 */
@Data
@Builder
public class AccountHealthResponse {

    private DegradationLevel degradationLevel;
    private String userId;
    private MarginSnapshot margins;
    private Instant lastSuccessAt;
    private ConnectionStatus streamStatus;
    private List<ApiCircuitBreaker.Snapshot> circuitBreakers;
}
