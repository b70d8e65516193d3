package com.optionscalper.recovery;

import com.optionscalper.domain.model.Position;
import com.optionscalper.position.PositionStore;
import com.optionscalper.streaming.StreamingConnectionSupervisor;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

/**
 * Orderly shutdown of the trading core.
 *
 * <p>Runs in a high {@link SmartLifecycle} phase so it stops before the schedulers and the web layer.
 * The streaming supervisor is stopped first (heartbeat and reconnect timers, transport). Open positions
 * are left as they are and only logged; no in-flight order call is cancelled.
 */
@Service
public class GracefulShutdownService implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownService.class);

    private final StreamingConnectionSupervisor streamingConnectionSupervisor;
    private final PositionStore positionStore;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public GracefulShutdownService(
            StreamingConnectionSupervisor streamingConnectionSupervisor, PositionStore positionStore) {
        this.streamingConnectionSupervisor = streamingConnectionSupervisor;
        this.positionStore = positionStore;
    }

    @Override
    public void start() {
        running.set(true);
    }

    @Override
    public void stop() {
        log.info("Graceful shutdown initiated...");
        try {
            streamingConnectionSupervisor.stop();

            List<Position> open = positionStore.getAllPositions();
            if (!open.isEmpty()) {
                log.warn(
                        "Shutting down with {} open position(s): {}. They stay open at the broker.",
                        open.size(),
                        open.stream().map(Position::getTradingSymbol).toList());
            }
            log.info("Graceful shutdown completed");
        } catch (RuntimeException e) {
            log.error("Error during graceful shutdown", e);
        } finally {
            running.set(false);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // Higher phase stops earlier
        return Integer.MAX_VALUE - 1;
    }
}
