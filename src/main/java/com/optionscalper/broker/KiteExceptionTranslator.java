package com.optionscalper.broker;

import com.optionscalper.domain.enums.CancelResult;
import com.optionscalper.exception.ApiException;
import com.optionscalper.exception.RejectedOrderException;
import com.optionscalper.exception.TransientApiException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.InputException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.OrderException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.PermissionException;

/**
 * Maps Kite SDK exceptions onto the core's exception taxonomy.
 *
 * <p>Input, order and permission errors are broker decisions: retrying cannot change them.
 * Network, token, data and general errors are treated as transient.
 */
final class KiteExceptionTranslator {

    private KiteExceptionTranslator() {}

    static ApiException translate(String operation, KiteException e) {
        String message = operation + " failed: " + e.message;
        if (e instanceof InputException || e instanceof OrderException || e instanceof PermissionException) {
            return new RejectedOrderException(message, e);
        }
        return new TransientApiException(message, e);
    }

    /**
     * Recognises Kite's cancel refusals for orders that cannot be cancelled any more.
     * Returns null when the error is a genuine failure.
     */
    static CancelResult toCancelResult(KiteException e) {
        String message = e.message != null ? e.message.toLowerCase() : "";
        if (message.contains("complete")
                || message.contains("cancelled")
                || message.contains("rejected")
                || message.contains("being processed")) {
            return CancelResult.ALREADY_TERMINAL;
        }
        if (message.contains("not found") || message.contains("invalid order")) {
            return CancelResult.NOT_FOUND;
        }
        return null;
    }
}
