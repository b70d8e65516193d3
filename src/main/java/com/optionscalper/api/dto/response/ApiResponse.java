package com.optionscalper.api.dto.response;

import com.optionscalper.domain.enums.TradingMode;
import java.time.Instant;
import lombok.Getter;

/**
 * Success envelope for every terminal REST response. Carries the trading mode the data came from,
 * so a client never mistakes paper positions or margins for live ones, and the server time the
 * response was built at.
 *
 * <p>Controllers return bare bodies; {@link com.optionscalper.config.ApiResponseAdvice} wraps them.
 */
@Getter
public class ApiResponse<T> {

    private final boolean success = true;
    private final TradingMode tradingMode;
    private final T data;
    private final Instant timestamp;

    private ApiResponse(TradingMode tradingMode, T data, Instant timestamp) {
        this.tradingMode = tradingMode;
        this.data = data;
        this.timestamp = timestamp;
    }

    public static <T> ApiResponse<T> of(TradingMode tradingMode, T data, Instant timestamp) {
        return new ApiResponse<>(tradingMode, data, timestamp);
    }
}
