package com.optionscalper.api.controller;

import com.optionscalper.api.dto.request.ProtectionRequest;
import com.optionscalper.api.dto.response.RefreshStatusResponse;
import com.optionscalper.domain.enums.RefreshOutcome;
import com.optionscalper.domain.model.Position;
import com.optionscalper.exception.ResourceNotFoundException;
import com.optionscalper.oms.OcoLegManager;
import com.optionscalper.position.PositionStore;
import com.optionscalper.reconciliation.ReconciliationScheduler;
import com.optionscalper.risk.ExitResult;
import com.optionscalper.risk.PositionExitService;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for open positions.
 *
 * <ul>
 *   <li>GET /api/positions -- positions held by the store</li>
 *   <li>GET /api/positions/{symbol} -- one position</li>
 *   <li>GET /api/positions/status -- refresh status and session stats</li>
 *   <li>POST /api/positions/refresh -- reconcile against the broker now</li>
 *   <li>PUT /api/positions/{symbol}/protection -- replace stop-loss / target / trailing distance</li>
 *   <li>DELETE /api/positions/{symbol} -- exit one position at market</li>
 *   <li>DELETE /api/positions -- exit all positions at market</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/positions")
public class PositionController {

    private static final Logger log = LoggerFactory.getLogger(PositionController.class);

    private final PositionStore positionStore;
    private final ReconciliationScheduler reconciliationScheduler;
    private final OcoLegManager ocoLegManager;
    private final PositionExitService positionExitService;

    public PositionController(
            PositionStore positionStore,
            ReconciliationScheduler reconciliationScheduler,
            OcoLegManager ocoLegManager,
            PositionExitService positionExitService) {
        this.positionStore = positionStore;
        this.reconciliationScheduler = reconciliationScheduler;
        this.ocoLegManager = ocoLegManager;
        this.positionExitService = positionExitService;
    }

    @GetMapping
    public ResponseEntity<List<Position>> listPositions() {
        return ResponseEntity.ok(positionStore.getAllPositions());
    }

    @GetMapping("/status")
    public ResponseEntity<RefreshStatusResponse> getStatus() {
        PositionStore.SessionStats stats = positionStore.getSessionStats();
        return ResponseEntity.ok(RefreshStatusResponse.builder()
                .lastRefreshAt(positionStore.getLastRefreshAt())
                .refreshInProgress(positionStore.isRefreshInProgress())
                .positionCount(positionStore.getAllPositions().size())
                .floatingPnl(positionStore.getTotalFloatingPnl())
                .realizedPnlToday(positionStore.getRealizedPnlToday())
                .closedTrades(stats.closedTrades())
                .winningTrades(stats.winningTrades())
                .build());
    }

    @GetMapping("/{symbol}")
    public ResponseEntity<Position> getPosition(@PathVariable String symbol) {
        return ResponseEntity.ok(findPosition(symbol));
    }

    @PostMapping("/refresh")
    public ResponseEntity<Map<String, RefreshOutcome>> refresh() {
        log.info("Manual position refresh triggered");
        return ResponseEntity.ok(Map.of("outcome", reconciliationScheduler.reconcile()));
    }

    @PutMapping("/{symbol}/protection")
    public ResponseEntity<Position> updateProtection(
            @PathVariable String symbol, @RequestBody ProtectionRequest protectionRequest) {
        findPosition(symbol);
        ocoLegManager.updateProtection(
                symbol,
                protectionRequest.getStopLoss(),
                protectionRequest.getTarget(),
                protectionRequest.getTrailingDistance());
        return ResponseEntity.ok(findPosition(symbol));
    }

    @DeleteMapping("/{symbol}")
    public ResponseEntity<ExitResult> exitPosition(@PathVariable String symbol) {
        log.info("Manual exit requested for {}", symbol);
        return ResponseEntity.ok(positionExitService.exitPosition(symbol));
    }

    @DeleteMapping
    public ResponseEntity<List<ExitResult>> exitAllPositions() {
        log.info("Exit all positions requested");
        return ResponseEntity.ok(positionExitService.exitAllPositions());
    }

    private Position findPosition(String symbol) {
        return positionStore.getPosition(symbol).orElseThrow(() -> new ResourceNotFoundException("Position", symbol));
    }
}
