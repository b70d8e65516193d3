package com.optionscalper.simulator;

import java.math.BigDecimal;
import java.util.Map;
import java.util.TreeMap;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** On-disk form of the paper ledger: {@code {balance, positions: {symbol: {...}}}}. */
@Data
@NoArgsConstructor
@AllArgsConstructor
class LedgerDocument {

    private BigDecimal balance;
    private Map<String, PaperPosition> positions = new TreeMap<>();
}
