package com.optionscalper.broker.mapper;

import com.optionscalper.domain.model.RawPosition;
import com.zerodhatech.models.Position;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Maps Kite SDK positions to {@link RawPosition}.
 *
 * <p>Kite's getPositions() returns a map with "day" and "net" lists; only "net" is the
 * account's actual holding. instrumentToken is a String in the SDK; averagePrice is a
 * primitive double, while lastPrice and unrealised are boxed Doubles.
 */
@Component
public class KitePositionMapper {

    public RawPosition toRawPosition(Position kitePosition) {
        if (kitePosition == null) {
            return null;
        }

        return RawPosition.builder()
                .tradingSymbol(kitePosition.tradingSymbol)
                .exchange(kitePosition.exchange)
                .product(kitePosition.product)
                .instrumentToken(parseInstrumentToken(kitePosition.instrumentToken))
                .quantity(kitePosition.netQuantity)
                .averagePrice(BigDecimal.valueOf(kitePosition.averagePrice))
                .lastPrice(toNullableBigDecimal(kitePosition.lastPrice))
                .pnl(toNullableBigDecimal(kitePosition.unrealised))
                .build();
    }

    public List<RawPosition> toNetPositions(Map<String, List<Position>> kitePositionsMap) {
        if (kitePositionsMap == null || kitePositionsMap.get("net") == null) {
            return List.of();
        }
        return kitePositionsMap.get("net").stream().map(this::toRawPosition).toList();
    }

    private Long parseInstrumentToken(String token) {
        if (token == null || token.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(token);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private BigDecimal toNullableBigDecimal(Double value) {
        return value != null ? BigDecimal.valueOf(value) : null;
    }
}
