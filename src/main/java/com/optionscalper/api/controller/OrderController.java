package com.optionscalper.api.controller;

import com.optionscalper.broker.BrokerGateway;
import com.optionscalper.domain.enums.CancelResult;
import com.optionscalper.domain.model.PendingOrder;
import com.optionscalper.exception.ResourceNotFoundException;
import com.optionscalper.oms.OrderRequest;
import com.optionscalper.position.PositionStore;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for working orders.
 *
 * <ul>
 *   <li>GET /api/orders/pending -- non-terminal orders from the last reconciliation</li>
 *   <li>DELETE /api/orders/{orderId} -- cancel a working order</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/orders")
public class OrderController {

    private static final Logger log = LoggerFactory.getLogger(OrderController.class);

    private final PositionStore positionStore;
    private final BrokerGateway brokerGateway;

    public OrderController(PositionStore positionStore, BrokerGateway brokerGateway) {
        this.positionStore = positionStore;
        this.brokerGateway = brokerGateway;
    }

    @GetMapping("/pending")
    public ResponseEntity<List<PendingOrder>> getPendingOrders() {
        return ResponseEntity.ok(positionStore.getPendingOrders());
    }

    /** ALREADY_TERMINAL is a normal answer (the order filled or was cancelled first); NOT_FOUND is a 404. */
    @DeleteMapping("/{orderId}")
    public ResponseEntity<Map<String, Object>> cancelOrder(@PathVariable String orderId) {
        log.info("Cancel requested for order {}", orderId);
        CancelResult result = brokerGateway.cancelOrder(OrderRequest.VARIETY_REGULAR, orderId);
        if (result == CancelResult.NOT_FOUND) {
            throw new ResourceNotFoundException("Order", orderId);
        }
        return ResponseEntity.ok(Map.of("orderId", orderId, "result", result));
    }
}
