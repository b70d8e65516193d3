package com.optionscalper.streaming;

import com.optionscalper.domain.model.Tick;
import java.util.List;

public interface TransportListener {

    void onConnected();

    void onTicks(List<Tick> ticks);

    void onError(String message);

    void onClosed(String reason);
}
