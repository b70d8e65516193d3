package com.optionscalper.exception;

import java.time.Duration;

/** No tick arrived within the staleness window while the stream was nominally connected. */
public class StaleConnectionException extends BaseException {

    public StaleConnectionException(Duration silence) {
        super(ErrorCode.STALE_CONNECTION, "Heartbeat timeout: no ticks for " + silence.toSeconds() + "s");
    }
}
