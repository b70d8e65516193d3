package com.optionscalper.instrument;

import com.optionscalper.domain.model.UnderlyingInstruments;
import java.util.Map;

/**
 * Supplier of option-chain metadata keyed by underlying symbol. Caching and retry of the
 * underlying download are the source's own business.
 */
public interface InstrumentMetadataSource {

    Map<String, UnderlyingInstruments> load();
}
