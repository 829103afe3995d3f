package com.setupbrain.exception;

import java.util.Map;

/**
 * Raised when candle data for a (symbol, timeframe) cannot be turned into features:
 * the window is too short or malformed, or the market-data provider failed.
 * The cycle skips that pair and moves on.
 */
public class DataException extends BaseException {

    public DataException(String message) {
        super(ErrorCode.MARKET_DATA_ERROR, message);
    }

    public DataException(String message, Map<String, Object> details) {
        super(ErrorCode.MARKET_DATA_ERROR, message, details);
    }

    public DataException(String message, Throwable cause) {
        super(ErrorCode.MARKET_DATA_ERROR, message, cause);
    }

    public DataException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorCode.MARKET_DATA_ERROR, message, details, cause);
    }

    protected DataException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}
