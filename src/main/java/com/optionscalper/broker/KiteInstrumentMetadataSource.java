package com.optionscalper.broker;

import com.optionscalper.domain.enums.OptionType;
import com.optionscalper.domain.model.Contract;
import com.optionscalper.domain.model.UnderlyingInstruments;
import com.optionscalper.exception.TransientApiException;
import com.optionscalper.instrument.InstrumentMetadataSource;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.models.Instrument;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds option-chain metadata from Kite's NFO instrument dump, grouped by underlying
 * (Kite's {@code name} field for derivatives). Only CE/PE contracts are kept.
 */
@Component
public class KiteInstrumentMetadataSource implements InstrumentMetadataSource {

    private static final Logger log = LoggerFactory.getLogger(KiteInstrumentMetadataSource.class);
    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");
    private static final String EXCHANGE = "NFO";

    private final KiteConnect kiteConnect;

    public KiteInstrumentMetadataSource(KiteConnect kiteConnect) {
        this.kiteConnect = kiteConnect;
    }

    @Override
    public Map<String, UnderlyingInstruments> load() {
        List<Instrument> kiteInstruments;
        try {
            kiteInstruments = kiteConnect.getInstruments(EXCHANGE);
        } catch (KiteException e) {
            throw new TransientApiException("Failed to download instruments: " + e.message, e);
        } catch (JSONException | IOException e) {
            throw new TransientApiException("Failed to download instruments: " + e.getMessage(), e);
        }
        log.info("Downloaded {} {} instruments from Kite API", kiteInstruments.size(), EXCHANGE);

        Map<String, List<Instrument>> byUnderlying = kiteInstruments.stream()
                .filter(i -> "CE".equals(i.instrument_type) || "PE".equals(i.instrument_type))
                .filter(i -> i.name != null)
                .collect(Collectors.groupingBy(i -> i.name, TreeMap::new, Collectors.toList()));

        Map<String, UnderlyingInstruments> result = new TreeMap<>();
        byUnderlying.forEach((underlying, instruments) -> result.put(underlying, toUnderlying(underlying, instruments)));
        return result;
    }

    private UnderlyingInstruments toUnderlying(String underlying, List<Instrument> instruments) {
        List<Contract> contracts = new ArrayList<>(instruments.size());
        for (Instrument instrument : instruments) {
            contracts.add(Contract.builder()
                    .underlying(underlying)
                    .strike(parseStrike(instrument.strike))
                    .optionType("CE".equals(instrument.instrument_type) ? OptionType.CALL : OptionType.PUT)
                    .expiry(toLocalDate(instrument.expiry))
                    .tradingSymbol(instrument.tradingsymbol)
                    .instrumentToken(instrument.instrument_token)
                    .lotSize(instrument.lot_size)
                    .exchange(instrument.exchange)
                    .build());
        }

        Instrument first = instruments.get(0);
        return UnderlyingInstruments.builder()
                .lotSize(first.lot_size)
                .tickSize(BigDecimal.valueOf(first.tick_size))
                .expiries(contracts.stream()
                        .map(Contract::getExpiry)
                        .filter(e -> e != null)
                        .distinct()
                        .sorted()
                        .toList())
                .strikes(contracts.stream()
                        .map(Contract::getStrike)
                        .filter(s -> s != null)
                        .distinct()
                        .sorted()
                        .toList())
                .instruments(contracts)
                .build();
    }

    private BigDecimal parseStrike(String strike) {
        if (strike == null || strike.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(strike);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private LocalDate toLocalDate(Date date) {
        return date != null ? date.toInstant().atZone(IST).toLocalDate() : null;
    }
}
