package com.optionscalper.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Equity segment margins: cash available for new trades and the amount already blocked. */
@Value
@Builder
public class MarginSnapshot {

    BigDecimal available;
    BigDecimal utilised;
}
