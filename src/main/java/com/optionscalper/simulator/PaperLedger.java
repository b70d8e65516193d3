package com.optionscalper.simulator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.optionscalper.config.ScalperProperties;
import com.optionscalper.domain.enums.OrderSide;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Simulated account book: cash balance and net positions by trading symbol.
 *
 * <p>The whole book is rewritten to {@code scalper.paper.ledger-file} after every fill so a restart
 * resumes with the same positions and balance. Price marks are kept in memory and written with the
 * next fill. An unreadable file is logged and replaced by a fresh book.
 *
 * <p>Positions are netted with signed quantity (positive = long, negative = short). Adding to a
 * position re-averages its price; reducing it realizes P&L against the average price; a fill that
 * flips the sign opens the remainder at the fill price.
 */
@Component
@ConditionalOnProperty(name = "scalper.trading-mode", havingValue = "PAPER", matchIfMissing = true)
public class PaperLedger {

    private static final Logger log = LoggerFactory.getLogger(PaperLedger.class);

    private static final ObjectMapper OBJECT_MAPPER =
            new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Path ledgerFile;
    private final BigDecimal startingBalance;

    private BigDecimal balance;
    private final Map<String, PaperPosition> positions = new TreeMap<>();

    public PaperLedger(ScalperProperties scalperProperties) {
        this.ledgerFile = scalperProperties.getPaper().getLedgerFile();
        this.startingBalance = scalperProperties.getPaper().getStartingBalance();
        this.balance = startingBalance;
    }

    @PostConstruct
    public synchronized void load() {
        if (Files.exists(ledgerFile)) {
            try {
                LedgerDocument document = OBJECT_MAPPER.readValue(ledgerFile.toFile(), LedgerDocument.class);
                balance = document.getBalance() != null ? document.getBalance() : startingBalance;
                positions.clear();
                if (document.getPositions() != null) {
                    positions.putAll(document.getPositions());
                }
                log.info("Paper ledger loaded from {}: balance={}, positions={}", ledgerFile, balance, positions.size());
            } catch (IOException e) {
                log.error("Could not load paper ledger {}, starting fresh: {}", ledgerFile, e.getMessage());
            }
        }
        save();
    }

    /** Rewrites the ledger file in full. Write failures are logged; the in-memory book stays authoritative. */
    public synchronized void save() {
        try {
            Path parent = ledgerFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = ledgerFile.resolveSibling(ledgerFile.getFileName() + ".tmp");
            OBJECT_MAPPER.writeValue(tmp.toFile(), new LedgerDocument(balance, new TreeMap<>(positions)));
            Files.move(tmp, ledgerFile, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.error("Could not save paper ledger {}: {}", ledgerFile, e.getMessage());
        }
    }

    /**
     * Books a fill against the position and the cash balance.
     *
     * @return realized P&L if the fill reduced or closed a position, otherwise null
     */
    public synchronized BigDecimal applyFill(
            String tradingSymbol, String exchange, String product, OrderSide side, int quantity, BigDecimal price) {
        BigDecimal tradeValue = price.multiply(BigDecimal.valueOf(quantity));
        balance = side == OrderSide.BUY ? balance.subtract(tradeValue) : balance.add(tradeValue);

        PaperPosition position = positions.get(tradingSymbol);
        int previousQuantity = position != null ? position.getQuantity() : 0;
        int quantityChange = side == OrderSide.BUY ? quantity : -quantity;
        int newQuantity = previousQuantity + quantityChange;

        BigDecimal realizedPnl = null;
        if (position == null || previousQuantity == 0) {
            position = PaperPosition.builder()
                    .quantity(0)
                    .averagePrice(price)
                    .exchange(exchange)
                    .product(product)
                    .lastPrice(price)
                    .pnl(BigDecimal.ZERO)
                    .build();
            positions.put(tradingSymbol, position);
        } else if (Integer.signum(previousQuantity) == Integer.signum(quantityChange)) {
            BigDecimal notional = position.getAveragePrice()
                    .multiply(BigDecimal.valueOf(Math.abs(previousQuantity)))
                    .add(tradeValue);
            position.setAveragePrice(notional.divide(BigDecimal.valueOf(Math.abs(newQuantity)), 4, RoundingMode.HALF_UP));
        } else {
            int closedQuantity = Math.min(Math.abs(previousQuantity), quantity);
            BigDecimal perUnit = price.subtract(position.getAveragePrice());
            realizedPnl = perUnit.multiply(BigDecimal.valueOf(closedQuantity));
            if (previousQuantity < 0) {
                realizedPnl = realizedPnl.negate();
            }
            if (newQuantity != 0 && Integer.signum(newQuantity) != Integer.signum(previousQuantity)) {
                position.setAveragePrice(price);
            }
        }

        if (newQuantity == 0) {
            positions.remove(tradingSymbol);
        } else {
            position.setQuantity(newQuantity);
            position.setLastPrice(price);
            position.setPnl(unrealized(position));
        }
        return realizedPnl;
    }

    /** Updates last price and floating P&L of a held position; no-op for unknown symbols. */
    public synchronized void markPrice(String tradingSymbol, BigDecimal lastPrice) {
        PaperPosition position = positions.get(tradingSymbol);
        if (position != null) {
            position.setLastPrice(lastPrice);
            position.setPnl(unrealized(position));
        }
    }

    public synchronized BigDecimal getBalance() {
        return balance;
    }

    /** Notional tied up in open positions: the sum of |quantity x average price|. */
    public synchronized BigDecimal getUsedMargin() {
        return positions.values().stream()
                .map(p -> p.getAveragePrice().multiply(BigDecimal.valueOf(p.getQuantity())).abs())
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /** Copies of the held positions, keyed by trading symbol. */
    public synchronized Map<String, PaperPosition> getPositions() {
        Map<String, PaperPosition> copy = new LinkedHashMap<>();
        positions.forEach((symbol, p) -> copy.put(symbol, p.toBuilder().build()));
        return copy;
    }

    Path getLedgerFile() {
        return ledgerFile;
    }

    private static BigDecimal unrealized(PaperPosition position) {
        if (position.getLastPrice() == null || position.getAveragePrice() == null) {
            return BigDecimal.ZERO;
        }
        return position.getLastPrice()
                .subtract(position.getAveragePrice())
                .multiply(BigDecimal.valueOf(position.getQuantity()));
    }
}
