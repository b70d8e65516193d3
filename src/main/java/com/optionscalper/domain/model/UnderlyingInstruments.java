package com.optionscalper.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Option chain metadata for one underlying: lot/tick size, sorted expiries and strikes, and its contracts. */
@Value
@Builder
public class UnderlyingInstruments {

    int lotSize;
    BigDecimal tickSize;
    List<LocalDate> expiries;
    List<BigDecimal> strikes;
    List<Contract> instruments;
}
