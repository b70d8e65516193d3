package com.optionscalper.unit.reconciliation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.optionscalper.domain.enums.RefreshOutcome;
import com.optionscalper.position.PositionStore;
import com.optionscalper.reconciliation.ReconciliationScheduler;
import com.optionscalper.streaming.StreamingConnectionSupervisor;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ReconciliationSchedulerTest {

    @Mock
    private PositionStore positionStore;

    @Mock
    private StreamingConnectionSupervisor streamingConnectionSupervisor;

    private ReconciliationScheduler reconciliationScheduler;

    @BeforeEach
    void setUp() {
        reconciliationScheduler = new ReconciliationScheduler(positionStore, streamingConnectionSupervisor);
    }

    @Test
    @DisplayName("A successful pass appends position tokens to the stream subscriptions")
    void subscribesAfterSuccess() {
        when(positionStore.refreshFromBroker()).thenReturn(RefreshOutcome.SUCCESS);
        when(positionStore.getContractTokens()).thenReturn(List.of(256265L, 260105L));

        RefreshOutcome outcome = reconciliationScheduler.reconcile();

        assertThat(outcome).isEqualTo(RefreshOutcome.SUCCESS);
        verify(streamingConnectionSupervisor).setSubscriptions(List.of(256265L, 260105L), true);
    }

    @Test
    @DisplayName("No tokens means no subscription call")
    void nothingToSubscribe() {
        when(positionStore.refreshFromBroker()).thenReturn(RefreshOutcome.SUCCESS);
        when(positionStore.getContractTokens()).thenReturn(List.of());

        reconciliationScheduler.reconcile();

        verify(streamingConnectionSupervisor, never()).setSubscriptions(anyList(), anyBoolean());
    }

    @Test
    @DisplayName("A failed or skipped pass leaves subscriptions alone")
    void failedPass() {
        when(positionStore.refreshFromBroker()).thenReturn(RefreshOutcome.FAILED);

        assertThat(reconciliationScheduler.reconcile()).isEqualTo(RefreshOutcome.FAILED);

        verify(positionStore, never()).getContractTokens();
        verify(streamingConnectionSupervisor, never()).setSubscriptions(anyList(), anyBoolean());
    }
}
