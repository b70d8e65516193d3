package com.optionscalper.broker.mapper;

import com.optionscalper.domain.enums.OrderSide;
import com.optionscalper.domain.enums.OrderStatus;
import com.optionscalper.domain.enums.OrderType;
import com.optionscalper.domain.model.RawOrder;
import com.optionscalper.oms.OrderRequest;
import com.zerodhatech.kiteconnect.utils.Constants;
import com.zerodhatech.models.Order;
import com.zerodhatech.models.OrderParams;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Date;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Maps between Kite SDK order objects and the core's {@link RawOrder} / {@link OrderRequest}.
 *
 * <p>Kite SDK uses public fields and stores most numeric values as Strings (quantity, price,
 * filledQuantity, ...), so every conversion is manual and null-safe.
 */
@Component
public class KiteOrderMapper {

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    public RawOrder toRawOrder(Order kiteOrder) {
        if (kiteOrder == null) {
            return null;
        }

        return RawOrder.builder()
                .orderId(kiteOrder.orderId)
                .tradingSymbol(kiteOrder.tradingSymbol)
                .exchange(kiteOrder.exchange)
                .product(kiteOrder.product)
                .transactionType(mapTransactionType(kiteOrder.transactionType))
                .orderType(mapOrderType(kiteOrder.orderType))
                .quantity(parseInt(kiteOrder.quantity))
                .filledQuantity(parseInt(kiteOrder.filledQuantity))
                .price(parseBigDecimal(kiteOrder.price))
                .triggerPrice(parseBigDecimal(kiteOrder.triggerPrice))
                .averagePrice(parseBigDecimal(kiteOrder.averagePrice))
                .status(mapStatus(kiteOrder.status))
                .statusMessage(kiteOrder.statusMessage)
                .orderTimestamp(toLocalDateTime(kiteOrder.orderTimestamp))
                .build();
    }

    public List<RawOrder> toRawOrderList(List<Order> kiteOrders) {
        if (kiteOrders == null) {
            return List.of();
        }
        return kiteOrders.stream().map(this::toRawOrder).toList();
    }

    /** Builds Kite {@link OrderParams} for placement. Price only for LIMIT/SL, trigger only for SL/SL_M. */
    public OrderParams toOrderParams(OrderRequest request) {
        OrderParams params = new OrderParams();
        params.tradingsymbol = request.getTradingSymbol();
        params.exchange = request.getExchange() != null ? request.getExchange() : Constants.EXCHANGE_NFO;
        params.transactionType = request.getSide() == OrderSide.BUY
                ? Constants.TRANSACTION_TYPE_BUY
                : Constants.TRANSACTION_TYPE_SELL;
        params.orderType = mapToKiteOrderType(request.getOrderType());
        params.quantity = request.getQuantity();
        params.product = request.getProduct() != null ? request.getProduct() : Constants.PRODUCT_MIS;
        params.validity = Constants.VALIDITY_DAY;

        OrderType type = request.getOrderType();
        if (request.getPrice() != null && (type == OrderType.LIMIT || type == OrderType.SL)) {
            params.price = request.getPrice().doubleValue();
        }
        if (request.getTriggerPrice() != null && (type == OrderType.SL || type == OrderType.SL_M)) {
            params.triggerPrice = request.getTriggerPrice().doubleValue();
        }
        return params;
    }

    /** Params for modifyOrder: only the fields that are set. */
    public OrderParams toModifyParams(OrderRequest request) {
        OrderParams params = new OrderParams();
        if (request.getPrice() != null) {
            params.price = request.getPrice().doubleValue();
        }
        if (request.getTriggerPrice() != null) {
            params.triggerPrice = request.getTriggerPrice().doubleValue();
        }
        if (request.getQuantity() > 0) {
            params.quantity = request.getQuantity();
        }
        if (request.getOrderType() != null) {
            params.orderType = mapToKiteOrderType(request.getOrderType());
        }
        return params;
    }

    OrderSide mapTransactionType(String transactionType) {
        if (transactionType == null) {
            return null;
        }
        return switch (transactionType) {
            case "BUY" -> OrderSide.BUY;
            case "SELL" -> OrderSide.SELL;
            default -> null;
        };
    }

    OrderType mapOrderType(String kiteOrderType) {
        if (kiteOrderType == null) {
            return null;
        }
        return switch (kiteOrderType) {
            case "MARKET" -> OrderType.MARKET;
            case "LIMIT" -> OrderType.LIMIT;
            case "SL" -> OrderType.SL;
            case "SL-M" -> OrderType.SL_M;
            default -> null;
        };
    }

    /**
     * Kite statuses: OPEN, COMPLETE, CANCELLED, REJECTED, TRIGGER PENDING, AMO REQ RECEIVED,
     * plus transient ones (UPDATE, PUT ORDER REQ RECEIVED, VALIDATION PENDING, ...) that mean
     * the order is still working.
     */
    public OrderStatus mapStatus(String kiteStatus) {
        if (kiteStatus == null) {
            return OrderStatus.UNKNOWN;
        }
        return switch (kiteStatus) {
            case "OPEN", "UPDATE", "PUT ORDER REQ RECEIVED", "VALIDATION PENDING", "OPEN PENDING",
                    "MODIFY PENDING", "MODIFY VALIDATION PENDING" -> OrderStatus.OPEN;
            case "TRIGGER PENDING" -> OrderStatus.TRIGGER_PENDING;
            case "AMO REQ RECEIVED" -> OrderStatus.AMO_REQ_RECEIVED;
            case "COMPLETE" -> OrderStatus.COMPLETE;
            case "CANCELLED", "CANCEL PENDING" -> OrderStatus.CANCELLED;
            case "REJECTED" -> OrderStatus.REJECTED;
            default -> OrderStatus.UNKNOWN;
        };
    }

    String mapToKiteOrderType(OrderType type) {
        if (type == null) {
            return Constants.ORDER_TYPE_MARKET;
        }
        return switch (type) {
            case MARKET -> Constants.ORDER_TYPE_MARKET;
            case LIMIT -> Constants.ORDER_TYPE_LIMIT;
            case SL -> Constants.ORDER_TYPE_SL;
            case SL_M -> Constants.ORDER_TYPE_SLM;
        };
    }

    private int parseInt(String value) {
        if (value == null || value.isEmpty()) {
            return 0;
        }
        try {
            return (int) Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private BigDecimal parseBigDecimal(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private LocalDateTime toLocalDateTime(Date date) {
        if (date == null) {
            return null;
        }
        return LocalDateTime.ofInstant(date.toInstant(), IST);
    }
}
