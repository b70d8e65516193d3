package com.optionscalper.broker;

import com.optionscalper.broker.mapper.KiteOrderMapper;
import com.optionscalper.domain.enums.CancelResult;
import com.optionscalper.domain.model.RawOrder;
import com.optionscalper.exception.TransientApiException;
import com.optionscalper.oms.OrderRequest;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.models.Order;
import com.zerodhatech.models.OrderParams;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import io.github.resilience4j.retry.annotation.Retry;
import java.io.IOException;
import java.util.List;
import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Internal service that executes order operations against the Kite Connect API.
 *
 * <p>Implementation detail of {@link KiteBrokerGateway}; everything else goes through
 * {@link BrokerGateway} so that paper trading stays a drop-in replacement.
 *
 * <p>Resilience4j decorators:
 * <ul>
 *   <li><b>Rate limiter</b> ({@code kiteOrders}): 8 req/sec, under Kite's 10/sec order limit</li>
 *   <li><b>Retry</b> ({@code kiteApi}): reads only. Placement, modification and cancellation are never
 *       retried: a timed-out placement may still have reached the exchange.</li>
 * </ul>
 *
 * <p>Kite's checked exceptions are translated into the core's unchecked taxonomy by
 * {@link KiteExceptionTranslator}.
 */
@Service
@ConditionalOnProperty(name = "scalper.trading-mode", havingValue = "LIVE")
public class KiteOrderService {

    private static final Logger log = LoggerFactory.getLogger(KiteOrderService.class);

    private final KiteConnect kiteConnect;
    private final KiteOrderMapper kiteOrderMapper;

    public KiteOrderService(KiteConnect kiteConnect, KiteOrderMapper kiteOrderMapper) {
        this.kiteConnect = kiteConnect;
        this.kiteOrderMapper = kiteOrderMapper;
    }

    @RateLimiter(name = "kiteOrders")
    public String placeOrder(OrderRequest request) {
        OrderParams params = kiteOrderMapper.toOrderParams(request);
        try {
            Order kiteOrder = kiteConnect.placeOrder(params, request.getVariety());
            log.info(
                    "Order placed: orderId={} symbol={} side={} type={} qty={}",
                    kiteOrder.orderId,
                    request.getTradingSymbol(),
                    request.getSide(),
                    request.getOrderType(),
                    request.getQuantity());
            return kiteOrder.orderId;
        } catch (KiteException e) {
            log.error("Kite order placement failed for {}: {}", request.getTradingSymbol(), e.message);
            throw KiteExceptionTranslator.translate("Order placement", e);
        } catch (JSONException | IOException e) {
            log.error("Order placement error for {}", request.getTradingSymbol(), e);
            throw new TransientApiException("Order placement error: " + e.getMessage(), e);
        }
    }

    @RateLimiter(name = "kiteOrders")
    public void modifyOrder(String orderId, OrderRequest request) {
        OrderParams params = kiteOrderMapper.toModifyParams(request);
        try {
            kiteConnect.modifyOrder(orderId, params, request.getVariety());
            log.info("Order modified: orderId={} trigger={} price={}", orderId, params.triggerPrice, params.price);
        } catch (KiteException e) {
            log.error("Order modification failed for {}: {}", orderId, e.message);
            throw KiteExceptionTranslator.translate("Order modification", e);
        } catch (JSONException | IOException e) {
            log.error("Order modification error for {}", orderId, e);
            throw new TransientApiException("Order modification error: " + e.getMessage(), e);
        }
    }

    /**
     * Cancels an order. Kite refuses to cancel completed/cancelled/rejected orders with an
     * OrderException or InputException; those refusals are returned as values.
     */
    @RateLimiter(name = "kiteOrders")
    public CancelResult cancelOrder(String variety, String orderId) {
        try {
            kiteConnect.cancelOrder(orderId, variety);
            log.info("Order cancelled: orderId={}", orderId);
            return CancelResult.CANCELLED;
        } catch (KiteException e) {
            CancelResult result = KiteExceptionTranslator.toCancelResult(e);
            if (result != null) {
                log.info("Order {} not cancellable ({}): {}", orderId, result, e.message);
                return result;
            }
            log.error("Order cancellation failed for {}: {}", orderId, e.message);
            throw KiteExceptionTranslator.translate("Order cancellation", e);
        } catch (JSONException | IOException e) {
            log.error("Order cancellation error for {}", orderId, e);
            throw new TransientApiException("Order cancellation error: " + e.getMessage(), e);
        }
    }

    @RateLimiter(name = "kiteData")
    @Retry(name = "kiteApi")
    public List<RawOrder> getOrders() {
        try {
            return kiteOrderMapper.toRawOrderList(kiteConnect.getOrders());
        } catch (KiteException e) {
            log.error("Failed to fetch orders: {}", e.message);
            throw new TransientApiException("Failed to fetch orders: " + e.message, e);
        } catch (JSONException | IOException e) {
            log.error("Error fetching orders", e);
            throw new TransientApiException("Error fetching orders: " + e.getMessage(), e);
        }
    }
}
