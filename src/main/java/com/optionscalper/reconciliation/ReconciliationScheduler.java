package com.optionscalper.reconciliation;

import com.optionscalper.domain.enums.RefreshOutcome;
import com.optionscalper.position.PositionStore;
import com.optionscalper.streaming.StreamingConnectionSupervisor;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Drives the periodic reconciliation against the broker and keeps the tick subscription in step
 * with the positions the store holds.
 *
 * <p>After every successful pass the store's contract tokens are appended to the streaming
 * subscription set, so a position opened elsewhere starts receiving ticks without a restart.
 */
@Service
public class ReconciliationScheduler {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationScheduler.class);

    private final PositionStore positionStore;
    private final StreamingConnectionSupervisor streamingConnectionSupervisor;

    public ReconciliationScheduler(
            PositionStore positionStore, StreamingConnectionSupervisor streamingConnectionSupervisor) {
        this.positionStore = positionStore;
        this.streamingConnectionSupervisor = streamingConnectionSupervisor;
    }

    @Scheduled(
            fixedRateString = "${scalper.reconciliation.interval-ms:5000}",
            initialDelayString = "${scalper.reconciliation.interval-ms:5000}")
    public void scheduledReconciliation() {
        reconcile();
    }

    public RefreshOutcome reconcile() {
        RefreshOutcome outcome = positionStore.refreshFromBroker();
        if (outcome == RefreshOutcome.SUCCESS) {
            List<Long> tokens = positionStore.getContractTokens();
            if (!tokens.isEmpty()) {
                streamingConnectionSupervisor.setSubscriptions(tokens, true);
            }
        } else {
            log.debug("Reconciliation pass ended with {}", outcome);
        }
        return outcome;
    }
}
