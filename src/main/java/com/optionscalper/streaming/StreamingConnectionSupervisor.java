package com.optionscalper.streaming;

import com.optionscalper.config.ScalperProperties;
import com.optionscalper.domain.model.Tick;
import com.optionscalper.event.ConnectionStatusEvent;
import com.optionscalper.event.TickBatchEvent;
import com.optionscalper.exception.StaleConnectionException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Supervises the single market-data push connection.
 *
 * <p>State machine: DISCONNECTED -> CONNECTING -> CONNECTED -> (DISCONNECTED on close/error)
 * -> RECONNECTING after {@code reconnectDelay} -> CONNECTING. Reconnect attempts repeat at the
 * fixed delay until a connection opens or {@link #stop()} is called.
 *
 * <p>Transport callbacks never touch shared state directly. They are turned into {@link StreamEvent}s
 * on a bounded queue drained by one processor thread, which publishes a {@link TickBatchEvent} per
 * tick batch. Spring delivers that event synchronously, so each batch is fully processed by the paper
 * engine and the risk engine before the next one is taken off the queue. When the queue is full new
 * tick batches are dropped (the next batch supersedes them); lifecycle events are not dropped.
 *
 * <p>Heartbeat: every {@code heartbeatInterval} the supervisor checks that a tick arrived within
 * {@code staleAfter}. A silent connection is force-closed and the reconnect sequence starts
 * immediately, turning half-open sockets into ordinary disconnects.
 *
 * <p>Subscriptions are diffed: {@link #setSubscriptions(Collection, boolean)} only sends the tokens
 * that were added or removed. While disconnected the desired set is just stored and subscribed in full
 * when the next connection opens.
 */
@Component
public class StreamingConnectionSupervisor {

    private static final Logger log = LoggerFactory.getLogger(StreamingConnectionSupervisor.class);

    public static final String HEARTBEAT_TIMEOUT = "Heartbeat timeout";

    private final MarketDataTransport transport;
    private final TaskScheduler taskScheduler;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final Duration heartbeatInterval;
    private final Duration staleAfter;
    private final Duration reconnectDelay;
    private final BlockingQueue<StreamEvent> events;
    private final ConnectionState state = new ConnectionState();
    private final AtomicLong droppedTickBatches = new AtomicLong();

    private volatile ScheduledFuture<?> heartbeatTask;
    private volatile ScheduledFuture<?> reconnectTask;
    private volatile Thread processorThread;

    @Value("${scalper.streaming.auto-start:true}")
    private boolean autoStart = true;

    public StreamingConnectionSupervisor(
            MarketDataTransport transport,
            @Qualifier("streamTaskScheduler") TaskScheduler taskScheduler,
            ApplicationEventPublisher eventPublisher,
            Clock clock,
            ScalperProperties scalperProperties) {
        this.transport = transport;
        this.taskScheduler = taskScheduler;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        ScalperProperties.Streaming streaming = scalperProperties.getStreaming();
        this.heartbeatInterval = streaming.getHeartbeatInterval();
        this.staleAfter = streaming.getStaleAfter();
        this.reconnectDelay = streaming.getReconnectDelay();
        this.events = new ArrayBlockingQueue<>(streaming.getEventQueueCapacity());
        this.transport.setListener(new QueueingListener());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (autoStart) {
            start();
        }
    }

    /** Starts the processor thread and heartbeat timer, then opens the connection. */
    public void start() {
        synchronized (state) {
            if (state.isRunning()) {
                return;
            }
            state.setRunning(true);
        }
        Thread thread = new Thread(this::runProcessor, "stream-processor");
        thread.setDaemon(true);
        processorThread = thread;
        thread.start();
        heartbeatTask = taskScheduler.scheduleAtFixedRate(this::checkHeartbeat, heartbeatInterval);
        log.info(
                "Streaming supervisor started (heartbeat={}s, staleAfter={}s, reconnectDelay={}s)",
                heartbeatInterval.toSeconds(),
                staleAfter.toSeconds(),
                reconnectDelay.toSeconds());
        connect();
    }

    /**
     * Orderly shutdown: cancels heartbeat and reconnect timers, closes the transport and stops the
     * processor. Queued but unprocessed events are discarded.
     */
    public void stop() {
        synchronized (state) {
            if (!state.isRunning()) {
                return;
            }
            state.setRunning(false);
        }
        cancel(heartbeatTask);
        heartbeatTask = null;
        cancelReconnect();
        closeTransportQuietly();
        Thread thread = processorThread;
        if (thread != null) {
            thread.interrupt();
            processorThread = null;
        }
        events.clear();
        updateStatus(ConnectionStatus.DISCONNECTED, "Supervisor stopped");
        log.info("Streaming supervisor stopped");
    }

    /** Opens a new connection. Connection failures are queued as a close so the reconnect cycle takes over. */
    public void connect() {
        updateStatus(ConnectionStatus.CONNECTING, null);
        try {
            transport.connect();
        } catch (RuntimeException e) {
            log.warn("Market data connect failed: {}", e.getMessage());
            enqueueLifecycle(StreamEvent.closed("Connect failed: " + e.getMessage()));
        }
    }

    /**
     * Replaces (or, with {@code append}, extends) the desired subscription set and sends the diff.
     *
     * @param tokens instrument tokens wanted by the caller
     * @param append when true only additions are made and nothing is unsubscribed
     */
    public void setSubscriptions(Collection<Long> tokens, boolean append) {
        synchronized (state) {
            Set<Long> desired = state.getDesiredTokens();
            if (!append) {
                desired.clear();
            }
            desired.addAll(tokens);

            if (state.getStatus() != ConnectionStatus.CONNECTED) {
                log.debug("Not connected; stored {} desired tokens for the next connection", desired.size());
                return;
            }

            Set<Long> subscribed = state.getSubscribedTokens();
            List<Long> toAdd = new ArrayList<>();
            for (Long token : desired) {
                if (!subscribed.contains(token)) {
                    toAdd.add(token);
                }
            }
            List<Long> toRemove = new ArrayList<>();
            if (!append) {
                for (Long token : subscribed) {
                    if (!desired.contains(token)) {
                        toRemove.add(token);
                    }
                }
            }

            if (!toAdd.isEmpty()) {
                transport.subscribe(toAdd);
                subscribed.addAll(toAdd);
            }
            if (!toRemove.isEmpty()) {
                transport.unsubscribe(toRemove);
                toRemove.forEach(subscribed::remove);
            }
            if (!toAdd.isEmpty() || !toRemove.isEmpty()) {
                log.info("Subscriptions updated: +{} -{} (total {})", toAdd, toRemove, subscribed.size());
            }
        }
    }

    /**
     * Drains and handles every queued event on the calling thread. The processor thread uses the same
     * handling; this entry point exists for callers that drive the supervisor without starting it.
     */
    public void processQueuedEvents() {
        StreamEvent event;
        while ((event = events.poll()) != null) {
            handle(event);
        }
    }

    public ConnectionState.Snapshot getState() {
        return state.snapshot();
    }

    public ConnectionStatus getStatus() {
        return state.getStatus();
    }

    public long getDroppedTickBatches() {
        return droppedTickBatches.get();
    }

    /** Forces a reconnect when no tick arrived within the staleness window while connected. */
    public void checkHeartbeat() {
        if (state.getStatus() != ConnectionStatus.CONNECTED) {
            return;
        }
        synchronized (state) {
            if (state.getSubscribedTokens().isEmpty()) {
                return;
            }
        }
        Instant lastTickAt = state.getLastTickAt();
        if (lastTickAt == null) {
            return;
        }
        Duration silence = Duration.between(lastTickAt, clock.instant());
        if (silence.compareTo(staleAfter) > 0) {
            StaleConnectionException stale = new StaleConnectionException(silence);
            log.warn("{}; forcing reconnect", stale.getMessage());
            closeTransportQuietly();
            enqueueLifecycle(StreamEvent.closed(HEARTBEAT_TIMEOUT));
        }
    }

    public void attemptReconnect() {
        if (!state.isRunning() || state.getStatus() == ConnectionStatus.CONNECTED) {
            cancelReconnect();
            return;
        }
        int attempt = state.getReconnectAttempts() + 1;
        state.setReconnectAttempts(attempt);
        updateStatus(ConnectionStatus.RECONNECTING, "Attempt " + attempt);
        log.info("Reconnecting market data stream (attempt {})", attempt);
        closeTransportQuietly();
        connect();
    }

    private void runProcessor() {
        log.debug("Stream processor thread started");
        while (state.isRunning()) {
            try {
                StreamEvent event = events.poll(250, TimeUnit.MILLISECONDS);
                if (event != null) {
                    handle(event);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.debug("Stream processor thread exiting");
    }

    private void handle(StreamEvent event) {
        try {
            switch (event.getType()) {
                case CONNECTED -> onConnected();
                case TICKS -> onTicks(event.getTicks());
                case ERROR -> onError(event.getReason());
                case CLOSED -> onClosed(event.getReason());
            }
        } catch (RuntimeException e) {
            log.error("Error handling stream event {}: {}", event.getType(), e.getMessage(), e);
        }
    }

    private void onConnected() {
        cancelReconnect();
        synchronized (state) {
            state.setReconnectAttempts(0);
            state.setLastTickAt(clock.instant());
            state.setStatus(ConnectionStatus.CONNECTED);
            Set<Long> subscribed = state.getSubscribedTokens();
            subscribed.clear();
            if (!state.getDesiredTokens().isEmpty()) {
                List<Long> all = new ArrayList<>(state.getDesiredTokens());
                transport.subscribe(all);
                subscribed.addAll(all);
                log.info("Subscribed {} instruments on connect", all.size());
            }
        }
        log.info("Market data stream connected");
        eventPublisher.publishEvent(new ConnectionStatusEvent(this, ConnectionStatus.CONNECTED, null));
    }

    private void onTicks(List<Tick> ticks) {
        state.setLastTickAt(clock.instant());
        if (ticks.isEmpty()) {
            return;
        }
        eventPublisher.publishEvent(new TickBatchEvent(this, ticks));
    }

    private void onError(String message) {
        log.error("Market data stream error: {}", message);
        if (state.getStatus() == ConnectionStatus.CONNECTING || state.getStatus() == ConnectionStatus.RECONNECTING) {
            onClosed("Connect error: " + message);
        }
    }

    private void onClosed(String reason) {
        synchronized (state) {
            state.getSubscribedTokens().clear();
        }
        if (state.getStatus() != ConnectionStatus.DISCONNECTED) {
            log.warn("Market data stream closed: {}", reason);
            updateStatus(ConnectionStatus.DISCONNECTED, reason);
        }
        if (state.isRunning()) {
            scheduleReconnect();
        }
    }

    private void scheduleReconnect() {
        synchronized (state) {
            ScheduledFuture<?> existing = reconnectTask;
            if (existing != null && !existing.isDone()) {
                return;
            }
            reconnectTask = taskScheduler.scheduleWithFixedDelay(
                    this::attemptReconnect, clock.instant().plus(reconnectDelay), reconnectDelay);
        }
        log.info("Reconnect scheduled in {}s", reconnectDelay.toSeconds());
    }

    private void cancelReconnect() {
        synchronized (state) {
            cancel(reconnectTask);
            reconnectTask = null;
        }
    }

    private void updateStatus(ConnectionStatus status, String reason) {
        ConnectionStatus previous = state.getStatus();
        state.setStatus(status);
        if (previous != status) {
            eventPublisher.publishEvent(new ConnectionStatusEvent(this, status, reason));
        }
    }

    private void enqueueLifecycle(StreamEvent event) {
        try {
            if (!events.offer(event, 1, TimeUnit.SECONDS)) {
                log.error("Stream event queue full; lost lifecycle event {}", event.getType());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while queueing lifecycle event {}", event.getType());
        }
    }

    private void closeTransportQuietly() {
        try {
            transport.close();
        } catch (RuntimeException e) {
            log.warn("Error closing market data transport: {}", e.getMessage());
        }
    }

    private static void cancel(ScheduledFuture<?> future) {
        if (future != null) {
            future.cancel(false);
        }
    }

    /** Transport callbacks become queue sends. */
    private class QueueingListener implements TransportListener {

        @Override
        public void onConnected() {
            enqueueLifecycle(StreamEvent.connected());
        }

        @Override
        public void onTicks(List<Tick> ticks) {
            if (!events.offer(StreamEvent.ticks(ticks))) {
                long dropped = droppedTickBatches.incrementAndGet();
                log.warn("Stream event queue full; dropped tick batch of {} (total dropped {})", ticks.size(), dropped);
            }
        }

        @Override
        public void onError(String message) {
            enqueueLifecycle(StreamEvent.error(message));
        }

        @Override
        public void onClosed(String reason) {
            enqueueLifecycle(StreamEvent.closed(reason));
        }
    }
}
