package com.optionscalper.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.optionscalper.api.controller.PositionController;
import com.optionscalper.config.ApiResponseAdvice;
import com.optionscalper.config.ScalperProperties;
import com.optionscalper.domain.enums.RefreshOutcome;
import com.optionscalper.domain.model.Position;
import com.optionscalper.exception.GlobalExceptionHandler;
import com.optionscalper.oms.OcoLegManager;
import com.optionscalper.position.PositionStore;
import com.optionscalper.reconciliation.ReconciliationScheduler;
import com.optionscalper.risk.ExitResult;
import com.optionscalper.risk.PositionExitService;
import com.optionscalper.testutil.MutableClock;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class PositionControllerTest {

    private static final MutableClock CLOCK = new MutableClock(Instant.parse("2026-03-02T04:00:00Z"));

    private static final String SYMBOL = "NIFTY26MAR22000CE";

    private MockMvc mockMvc;

    @Mock
    private PositionStore positionStore;

    @Mock
    private ReconciliationScheduler reconciliationScheduler;

    @Mock
    private OcoLegManager ocoLegManager;

    @Mock
    private PositionExitService positionExitService;

    @BeforeEach
    void setUp() {
        PositionController controller =
                new PositionController(positionStore, reconciliationScheduler, ocoLegManager, positionExitService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiResponseAdvice(new ScalperProperties(), CLOCK), new GlobalExceptionHandler(CLOCK))
                .build();
    }

    private static Position position() {
        return Position.builder()
                .tradingSymbol(SYMBOL)
                .instrumentToken(12345L)
                .quantity(75)
                .averagePrice(new BigDecimal("100"))
                .lastPrice(new BigDecimal("104"))
                .pnl(new BigDecimal("300"))
                .stopLoss(new BigDecimal("90"))
                .build();
    }

    @Test
    @DisplayName("GET /api/positions lists held positions")
    void listPositions() throws Exception {
        when(positionStore.getAllPositions()).thenReturn(List.of(position()));

        mockMvc.perform(get("/api/positions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].tradingSymbol").value(SYMBOL))
                .andExpect(jsonPath("$.data[0].quantity").value(75))
                .andExpect(jsonPath("$.data[0].pnl").value(300));
    }

    @Test
    @DisplayName("GET /api/positions/{symbol} for an unknown symbol is a 404")
    void unknownPosition() throws Exception {
        when(positionStore.getPosition("GHOST")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/positions/GHOST"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.error.message").value("Position GHOST not found"))
                .andExpect(jsonPath("$.error.details.id").value("GHOST"));
    }

    @Test
    @DisplayName("GET /api/positions/status reports refresh state and session totals")
    void refreshStatusReturnsSessionTotals() throws Exception {
        when(positionStore.getSessionStats()).thenReturn(new PositionStore.SessionStats(4, 3));
        when(positionStore.getLastRefreshAt()).thenReturn(Instant.parse("2026-03-02T04:00:00Z"));
        when(positionStore.isRefreshInProgress()).thenReturn(false);
        when(positionStore.getAllPositions()).thenReturn(List.of(position()));
        when(positionStore.getTotalFloatingPnl()).thenReturn(new BigDecimal("300"));
        when(positionStore.getRealizedPnlToday()).thenReturn(new BigDecimal("-1250.50"));

        mockMvc.perform(get("/api/positions/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.positionCount").value(1))
                .andExpect(jsonPath("$.data.refreshInProgress").value(false))
                .andExpect(jsonPath("$.data.realizedPnlToday").value(-1250.50))
                .andExpect(jsonPath("$.data.closedTrades").value(4))
                .andExpect(jsonPath("$.data.winningTrades").value(3));
    }

    @Test
    @DisplayName("POST /api/positions/refresh runs a reconciliation pass")
    void refresh() throws Exception {
        when(reconciliationScheduler.reconcile()).thenReturn(RefreshOutcome.SKIPPED_CIRCUIT_OPEN);

        mockMvc.perform(post("/api/positions/refresh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.outcome").value("SKIPPED_CIRCUIT_OPEN"));
    }

    @Test
    @DisplayName("PUT /api/positions/{symbol}/protection replaces protection")
    void updateProtection() throws Exception {
        when(positionStore.getPosition(SYMBOL)).thenReturn(Optional.of(position()));

        mockMvc.perform(put("/api/positions/" + SYMBOL + "/protection")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"stopLoss\":95,\"target\":130,\"trailingDistance\":5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.tradingSymbol").value(SYMBOL));

        verify(ocoLegManager)
                .updateProtection(SYMBOL, new BigDecimal("95"), new BigDecimal("130"), new BigDecimal("5"));
    }

    @Test
    @DisplayName("PUT protection for an unknown symbol is a 404 and places nothing")
    void updateProtectionUnknown() throws Exception {
        when(positionStore.getPosition("GHOST")).thenReturn(Optional.empty());

        mockMvc.perform(put("/api/positions/GHOST/protection")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"stopLoss\":95}"))
                .andExpect(status().isNotFound());

        verify(ocoLegManager, never()).updateProtection(anyString(), any(), any(), any());
    }

    @Test
    @DisplayName("DELETE /api/positions/{symbol} exits at market")
    void exitPosition() throws Exception {
        when(positionExitService.exitPosition(SYMBOL))
                .thenReturn(new ExitResult(SYMBOL, ExitResult.Status.SUBMITTED, "240302000777", null));

        mockMvc.perform(delete("/api/positions/" + SYMBOL))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("SUBMITTED"))
                .andExpect(jsonPath("$.data.orderId").value("240302000777"));
    }

    @Test
    @DisplayName("DELETE /api/positions exits everything and returns per-position results")
    void exitAll() throws Exception {
        when(positionExitService.exitAllPositions())
                .thenReturn(List.of(
                        new ExitResult(SYMBOL, ExitResult.Status.SUBMITTED, "1", null),
                        new ExitResult("NIFTY26MAR22100CE", ExitResult.Status.FAILED, null, "Kite timeout")));

        mockMvc.perform(delete("/api/positions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.data[1].status").value("FAILED"))
                .andExpect(jsonPath("$.data[1].message").value("Kite timeout"));
    }
}
