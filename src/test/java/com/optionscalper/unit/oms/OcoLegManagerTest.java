package com.optionscalper.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.optionscalper.broker.BrokerGateway;
import com.optionscalper.domain.enums.CancelResult;
import com.optionscalper.domain.enums.OrderSide;
import com.optionscalper.domain.enums.OrderStatus;
import com.optionscalper.domain.enums.OrderType;
import com.optionscalper.domain.model.Position;
import com.optionscalper.domain.model.RawOrder;
import com.optionscalper.exception.RejectedOrderException;
import com.optionscalper.exception.TransientApiException;
import com.optionscalper.oms.OcoLegManager;
import com.optionscalper.oms.OrderRequest;
import com.optionscalper.position.PositionStore;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OcoLegManagerTest {

    private static final String SYMBOL = "NIFTY26MAR22000CE";

    @Mock
    private BrokerGateway brokerGateway;

    @Mock
    private PositionStore positionStore;

    private OcoLegManager ocoLegManager;

    @BeforeEach
    void setUp() {
        ocoLegManager = new OcoLegManager(brokerGateway, positionStore);
    }

    private static Position protectedPosition() {
        return Position.builder()
                .tradingSymbol(SYMBOL)
                .instrumentToken(1L)
                .quantity(75)
                .averagePrice(new BigDecimal("100"))
                .stopLoss(new BigDecimal("90"))
                .target(new BigDecimal("120"))
                .stopLossOrderId("sl-1")
                .targetOrderId("tg-1")
                .build();
    }

    private static RawOrder order(String id, OrderStatus status) {
        return RawOrder.builder().orderId(id).tradingSymbol(SYMBOL).status(status).build();
    }

    @Nested
    @DisplayName("reconcileLegs")
    class ReconcileLegs {

        @Test
        @DisplayName("Executed stop-loss leg cancels the working target leg and clears both ids")
        void stopLossCompleteCancelsTarget() {
            Position position = protectedPosition();
            when(positionStore.getAllPositions()).thenReturn(List.of(position));
            when(brokerGateway.cancelOrder(OrderRequest.VARIETY_REGULAR, "tg-1")).thenReturn(CancelResult.CANCELLED);

            ocoLegManager.reconcileLegs(List.of(order("sl-1", OrderStatus.COMPLETE), order("tg-1", OrderStatus.OPEN)));

            verify(brokerGateway).cancelOrder(OrderRequest.VARIETY_REGULAR, "tg-1");
            assertThat(position.getStopLossOrderId()).isNull();
            assertThat(position.getTargetOrderId()).isNull();
        }

        @Test
        @DisplayName("Executed target leg cancels the stop-loss leg")
        void targetCompleteCancelsStopLoss() {
            Position position = protectedPosition();
            when(positionStore.getAllPositions()).thenReturn(List.of(position));
            when(brokerGateway.cancelOrder(OrderRequest.VARIETY_REGULAR, "sl-1"))
                    .thenReturn(CancelResult.ALREADY_TERMINAL);

            ocoLegManager.reconcileLegs(
                    List.of(order("sl-1", OrderStatus.TRIGGER_PENDING), order("tg-1", OrderStatus.COMPLETE)));

            verify(brokerGateway).cancelOrder(OrderRequest.VARIETY_REGULAR, "sl-1");
            assertThat(position.hasProtectiveLegs()).isFalse();
        }

        @Test
        @DisplayName("An opposite leg already terminal is not cancelled again")
        void terminalOppositeLegNotCancelled() {
            Position position = protectedPosition();
            when(positionStore.getAllPositions()).thenReturn(List.of(position));

            ocoLegManager.reconcileLegs(
                    List.of(order("sl-1", OrderStatus.COMPLETE), order("tg-1", OrderStatus.CANCELLED)));

            verify(brokerGateway, never()).cancelOrder(anyString(), anyString());
            assertThat(position.hasProtectiveLegs()).isFalse();
        }

        @Test
        @DisplayName("Cancelled or rejected legs just have their id cleared")
        void deadLegsCleared() {
            Position position = protectedPosition();
            when(positionStore.getAllPositions()).thenReturn(List.of(position));

            ocoLegManager.reconcileLegs(
                    List.of(order("sl-1", OrderStatus.REJECTED), order("tg-1", OrderStatus.OPEN)));

            assertThat(position.getStopLossOrderId()).isNull();
            assertThat(position.getTargetOrderId()).isEqualTo("tg-1");
            verify(brokerGateway, never()).cancelOrder(anyString(), anyString());
        }

        @Test
        @DisplayName("A failed cancel is logged and the ids are still cleared for the next pass")
        void cancelFailureTolerated() {
            Position position = protectedPosition();
            when(positionStore.getAllPositions()).thenReturn(List.of(position));
            when(brokerGateway.cancelOrder(OrderRequest.VARIETY_REGULAR, "tg-1"))
                    .thenThrow(new TransientApiException("Kite timeout"));

            ocoLegManager.reconcileLegs(List.of(order("sl-1", OrderStatus.COMPLETE), order("tg-1", OrderStatus.OPEN)));

            assertThat(position.hasProtectiveLegs()).isFalse();
        }

        @Test
        @DisplayName("Both legs still working leaves everything alone")
        void bothWorking() {
            Position position = protectedPosition();
            when(positionStore.getAllPositions()).thenReturn(List.of(position));

            ocoLegManager.reconcileLegs(
                    List.of(order("sl-1", OrderStatus.TRIGGER_PENDING), order("tg-1", OrderStatus.OPEN)));

            assertThat(position.getStopLossOrderId()).isEqualTo("sl-1");
            assertThat(position.getTargetOrderId()).isEqualTo("tg-1");
        }
    }

    @Nested
    @DisplayName("placeBracketOrder")
    class PlaceBracketOrder {

        @Test
        @DisplayName("Places an SL-M stop leg and a LIMIT target leg on the exit side")
        void placesBothLegs() {
            Position position = protectedPosition();
            position.setStopLossOrderId(null);
            position.setTargetOrderId(null);
            when(brokerGateway.placeOrder(any())).thenReturn("sl-9", "tg-9");

            ocoLegManager.placeBracketOrder(position);

            ArgumentCaptor<OrderRequest> captor = ArgumentCaptor.forClass(OrderRequest.class);
            verify(brokerGateway, times(2)).placeOrder(captor.capture());
            OrderRequest stop = captor.getAllValues().get(0);
            OrderRequest target = captor.getAllValues().get(1);
            assertThat(stop.getOrderType()).isEqualTo(OrderType.SL_M);
            assertThat(stop.getSide()).isEqualTo(OrderSide.SELL);
            assertThat(stop.getTriggerPrice()).isEqualByComparingTo("90");
            assertThat(target.getOrderType()).isEqualTo(OrderType.LIMIT);
            assertThat(target.getPrice()).isEqualByComparingTo("120");
            assertThat(position.getStopLossOrderId()).isEqualTo("sl-9");
            assertThat(position.getTargetOrderId()).isEqualTo("tg-9");
        }

        @Test
        @DisplayName("A rejected stop leg does not prevent the target leg")
        void oneLegFails() {
            Position position = protectedPosition();
            position.setStopLossOrderId(null);
            position.setTargetOrderId(null);
            when(brokerGateway.placeOrder(any()))
                    .thenThrow(new RejectedOrderException("Trigger price out of range"))
                    .thenReturn("tg-9");

            ocoLegManager.placeBracketOrder(position);

            assertThat(position.getStopLossOrderId()).isNull();
            assertThat(position.getTargetOrderId()).isEqualTo("tg-9");
        }
    }

    @Nested
    @DisplayName("updateProtection")
    class UpdateProtection {

        @Test
        @DisplayName("Replaces legs and protective prices, clearing non-positive values")
        void replacesLegs() {
            Position position = protectedPosition();
            position.setTrailingStepsApplied(3);
            when(positionStore.getPosition(SYMBOL)).thenReturn(Optional.of(position));
            when(brokerGateway.cancelOrder(eq(OrderRequest.VARIETY_REGULAR), anyString()))
                    .thenReturn(CancelResult.CANCELLED);
            when(brokerGateway.placeOrder(any())).thenReturn("sl-2");

            ocoLegManager.updateProtection(SYMBOL, new BigDecimal("95"), BigDecimal.ZERO, new BigDecimal("2"));

            verify(brokerGateway).cancelOrder(OrderRequest.VARIETY_REGULAR, "sl-1");
            verify(brokerGateway).cancelOrder(OrderRequest.VARIETY_REGULAR, "tg-1");
            verify(brokerGateway, times(1)).placeOrder(any());
            assertThat(position.getStopLoss()).isEqualByComparingTo("95");
            assertThat(position.getTarget()).isNull();
            assertThat(position.getTrailingDistance()).isEqualByComparingTo("2");
            assertThat(position.getTrailingStepsApplied()).isZero();
            assertThat(position.getStopLossOrderId()).isEqualTo("sl-2");
            assertThat(position.getTargetOrderId()).isNull();
            verify(positionStore).publishPositionsChanged();
        }

        @Test
        @DisplayName("A position that has gone is logged and ignored")
        void missingPosition() {
            when(positionStore.getPosition(SYMBOL)).thenReturn(Optional.empty());

            ocoLegManager.updateProtection(SYMBOL, new BigDecimal("95"), null, null);

            verify(brokerGateway, never()).placeOrder(any());
            verify(positionStore, never()).publishPositionsChanged();
        }
    }

    @Test
    @DisplayName("syncStopLeg modifies the live stop-loss leg to the current stop")
    void syncStopLeg() {
        Position position = protectedPosition();
        position.setStopLoss(new BigDecimal("97.5"));

        ocoLegManager.syncStopLeg(position);

        ArgumentCaptor<OrderRequest> captor = ArgumentCaptor.forClass(OrderRequest.class);
        verify(brokerGateway).modifyOrder(eq("sl-1"), captor.capture());
        assertThat(captor.getValue().getTriggerPrice()).isEqualByComparingTo("97.5");
        assertThat(captor.getValue().getOrderType()).isEqualTo(OrderType.SL_M);
    }

    @Test
    @DisplayName("syncStopLeg without a live leg does nothing")
    void syncStopLegWithoutLeg() {
        Position position = protectedPosition();
        position.setStopLossOrderId(null);

        ocoLegManager.syncStopLeg(position);

        verify(brokerGateway, never()).modifyOrder(anyString(), any());
    }
}
