package com.optionscalper.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Last-traded-price update for one instrument, as delivered by the streaming connection. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Tick {

    private long instrumentToken;
    private BigDecimal lastPrice;
    private Instant receivedAt;
}
