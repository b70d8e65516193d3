package com.optionscalper.api.dto.response;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class RefreshStatusResponse {

    private Instant lastRefreshAt;
    private boolean refreshInProgress;
    private int positionCount;
    private BigDecimal floatingPnl;
    private BigDecimal realizedPnlToday;
    private int closedTrades;
    private int winningTrades;
}
