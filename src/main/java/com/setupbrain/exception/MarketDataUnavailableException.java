package com.setupbrain.exception;

import java.util.Map;

/**
 * The market-data endpoint could not be reached or answered with a server error.
 * Unlike a malformed payload this is transient, so the adapter retries it.
 */
public class MarketDataUnavailableException extends DataException {

    public MarketDataUnavailableException(String message, Map<String, Object> details, Throwable cause) {
        super(message, details, cause);
    }
}
