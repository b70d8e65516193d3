package com.optionscalper.broker;

import com.optionscalper.config.KiteConfig;
import com.optionscalper.domain.model.Tick;
import com.optionscalper.streaming.MarketDataTransport;
import com.optionscalper.streaming.TransportListener;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.ticker.KiteTicker;
import com.zerodhatech.ticker.OnConnect;
import com.zerodhatech.ticker.OnDisconnect;
import com.zerodhatech.ticker.OnError;
import com.zerodhatech.ticker.OnTicks;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link MarketDataTransport} over the Kite WebSocket ticker.
 *
 * <p>A fresh {@link KiteTicker} is created for every {@link #connect()}; the SDK's own reconnection
 * is disabled because {@link com.optionscalper.streaming.StreamingConnectionSupervisor} owns the
 * reconnect cycle. Callbacks from a ticker that has since been replaced are ignored, so a late
 * "disconnected" from the old socket cannot tear down the new one.
 *
 * <p>Ticks are subscribed in LTP mode: the core only needs last traded price.
 */
@Component
public class KiteTickerTransport implements MarketDataTransport {

    private static final Logger log = LoggerFactory.getLogger(KiteTickerTransport.class);

    private final KiteConfig kiteConfig;

    private volatile TransportListener listener;
    private volatile KiteTicker kiteTicker;

    public KiteTickerTransport(KiteConfig kiteConfig) {
        this.kiteConfig = kiteConfig;
    }

    @Override
    public void setListener(TransportListener listener) {
        this.listener = listener;
    }

    @Override
    public void connect() {
        String accessToken = kiteConfig.getAccessToken();
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalStateException("No Kite access token configured (kite.access-token)");
        }
        KiteTicker ticker = createTicker(accessToken);
        ticker.setTryReconnection(false);
        registerCallbacks(ticker);
        kiteTicker = ticker;
        log.info("Connecting to Kite WebSocket...");
        ticker.connect();
    }

    @Override
    public void close() {
        KiteTicker ticker = kiteTicker;
        kiteTicker = null;
        if (ticker != null) {
            ticker.disconnect();
            log.info("Kite ticker disconnected");
        }
    }

    @Override
    public void subscribe(List<Long> tokens) {
        KiteTicker ticker = kiteTicker;
        if (ticker == null) {
            return;
        }
        ArrayList<Long> list = new ArrayList<>(tokens);
        ticker.subscribe(list);
        ticker.setMode(list, KiteTicker.modeLTP);
    }

    @Override
    public void unsubscribe(List<Long> tokens) {
        KiteTicker ticker = kiteTicker;
        if (ticker != null) {
            ticker.unsubscribe(new ArrayList<>(tokens));
        }
    }

    /** Creates a new KiteTicker instance (extracted for testability). */
    KiteTicker createTicker(String accessToken) {
        // KiteTicker constructor order: (accessToken, apiKey)
        return new KiteTicker(accessToken, kiteConfig.getApiKey());
    }

    private void registerCallbacks(KiteTicker ticker) {
        ticker.setOnConnectedListener(new OnConnect() {
            @Override
            public void onConnected() {
                if (isCurrent(ticker)) {
                    listener.onConnected();
                }
            }
        });

        ticker.setOnDisconnectedListener(new OnDisconnect() {
            @Override
            public void onDisconnected() {
                if (isCurrent(ticker)) {
                    listener.onClosed("Disconnected by server");
                }
            }
        });

        ticker.setOnTickerArrivalListener(new OnTicks() {
            @Override
            public void onTicks(ArrayList<com.zerodhatech.models.Tick> ticks) {
                if (isCurrent(ticker)) {
                    listener.onTicks(mapTicks(ticks));
                }
            }
        });

        ticker.setOnErrorListener(new OnError() {
            @Override
            public void onError(Exception exception) {
                if (isCurrent(ticker)) {
                    listener.onError(String.valueOf(exception.getMessage()));
                }
            }

            @Override
            public void onError(KiteException kiteException) {
                if (isCurrent(ticker)) {
                    listener.onError(kiteException.message);
                }
            }

            @Override
            public void onError(String error) {
                if (isCurrent(ticker)) {
                    listener.onError(error);
                }
            }
        });
    }

    private boolean isCurrent(KiteTicker ticker) {
        return listener != null && ticker == kiteTicker;
    }

    List<Tick> mapTicks(List<com.zerodhatech.models.Tick> kiteTicks) {
        Instant now = Instant.now();
        List<Tick> ticks = new ArrayList<>(kiteTicks.size());
        for (com.zerodhatech.models.Tick kiteTick : kiteTicks) {
            ticks.add(Tick.builder()
                    .instrumentToken(kiteTick.getInstrumentToken())
                    .lastPrice(BigDecimal.valueOf(kiteTick.getLastTradedPrice()))
                    .receivedAt(now)
                    .build());
        }
        return ticks;
    }
}
