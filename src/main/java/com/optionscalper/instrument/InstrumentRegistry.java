package com.optionscalper.instrument;

import com.optionscalper.domain.model.Contract;
import com.optionscalper.domain.model.UnderlyingInstruments;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Contract arena: every known {@link Contract} keyed by instrument token, plus a
 * trading-symbol -> token index.
 *
 * <p>Populated once per session from the {@link InstrumentMetadataSource} and read-only for the
 * position store and the risk engine afterwards. A load failure leaves the registry empty: positions
 * still reconcile, but with placeholder contracts and no per-tick updates.
 */
@Component
public class InstrumentRegistry {

    private static final Logger log = LoggerFactory.getLogger(InstrumentRegistry.class);

    private final ObjectProvider<InstrumentMetadataSource> metadataSource;

    private final Map<Long, Contract> contractsByToken = new ConcurrentHashMap<>();
    private final Map<String, Long> tokensBySymbol = new ConcurrentHashMap<>();
    private final Map<String, UnderlyingInstruments> underlyings = new ConcurrentHashMap<>();

    public InstrumentRegistry(ObjectProvider<InstrumentMetadataSource> metadataSource) {
        this.metadataSource = metadataSource;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(1)
    public void loadOnStartup() {
        InstrumentMetadataSource source = metadataSource.getIfAvailable();
        if (source == null) {
            log.warn("No instrument metadata source configured; positions will use placeholder contracts");
            return;
        }
        try {
            load(source.load());
        } catch (RuntimeException e) {
            log.warn("Instrument metadata load failed, continuing without contracts: {}", e.getMessage());
        }
    }

    public void load(Map<String, UnderlyingInstruments> metadata) {
        contractsByToken.clear();
        tokensBySymbol.clear();
        underlyings.clear();
        underlyings.putAll(metadata);
        metadata.values().forEach(u -> u.getInstruments().forEach(this::register));
        log.info("Instrument registry loaded: {} underlyings, {} contracts", metadata.size(), contractsByToken.size());
    }

    public void register(Contract contract) {
        contractsByToken.put(contract.getInstrumentToken(), contract);
        tokensBySymbol.put(contract.getTradingSymbol(), contract.getInstrumentToken());
    }

    public Optional<Contract> getContract(long instrumentToken) {
        return Optional.ofNullable(contractsByToken.get(instrumentToken));
    }

    public Optional<Contract> findBySymbol(String tradingSymbol) {
        Long token = tokensBySymbol.get(tradingSymbol);
        return token != null ? Optional.ofNullable(contractsByToken.get(token)) : Optional.empty();
    }

    public Optional<UnderlyingInstruments> getUnderlying(String underlying) {
        return Optional.ofNullable(underlyings.get(underlying));
    }

    public int size() {
        return contractsByToken.size();
    }
}
