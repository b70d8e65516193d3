package com.optionscalper.domain.model;

import com.optionscalper.domain.enums.OptionType;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable description of a tradable instrument, created once when instrument metadata loads.
 *
 * <p>Contracts live in the {@link com.optionscalper.instrument.InstrumentRegistry} keyed by
 * instrument token; positions refer to them by token only.
 */
@Value
@Builder
public class Contract {

    String underlying;
    BigDecimal strike;
    OptionType optionType;
    LocalDate expiry;
    String tradingSymbol;
    long instrumentToken;
    int lotSize;
    String exchange;
}
