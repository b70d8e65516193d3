package com.optionscalper.config;

import com.optionscalper.domain.enums.TradingMode;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime tuning for the trading core, bound from {@code scalper.*}.
 *
 * <p>Defaults match the terminal's historical behaviour: a 15s heartbeat declares the stream stale
 * after 30s of silence, reconnects every 5s. Circuit breakers are configured under
 * {@code resilience4j.circuitbreaker}.
 */
@ConfigurationProperties(prefix = "scalper")
@Getter
@Setter
public class ScalperProperties {

    /** PAPER (default) routes orders to the paper matching engine; LIVE routes them to Kite. */
    private TradingMode tradingMode = TradingMode.PAPER;

    private Reconciliation reconciliation = new Reconciliation();
    private Streaming streaming = new Streaming();
    private Paper paper = new Paper();
    private Account account = new Account();

    @Getter
    @Setter
    public static class Reconciliation {

        /** Cadence of the scheduled position/order refresh. */
        private long intervalMs = 5000;
    }

    @Getter
    @Setter
    public static class Streaming {

        private Duration heartbeatInterval = Duration.ofSeconds(15);
        private Duration staleAfter = Duration.ofSeconds(30);
        private Duration reconnectDelay = Duration.ofSeconds(5);

        /** Capacity of the callback-to-processor event queue. Ticks beyond it are dropped. */
        private int eventQueueCapacity = 1024;
    }

    @Getter
    @Setter
    public static class Paper {

        private BigDecimal startingBalance = BigDecimal.valueOf(100000);
        private Path ledgerFile = Path.of(System.getProperty("user.home"), ".options_scalper", "paper_account.json");
    }

    @Getter
    @Setter
    public static class Account {

        private long healthCheckIntervalMs = 10000;
    }
}
