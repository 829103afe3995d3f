package com.setupbrain.exception;

import java.util.Map;

public class InsufficientDataException extends DataException {

    public InsufficientDataException(String symbol, String timeframe, int available, int required) {
        super(
                ErrorCode.INSUFFICIENT_DATA,
                String.format(
                        "Insufficient candles for %s %s: have %d, need %d", symbol, timeframe, available, required),
                Map.of("symbol", symbol, "timeframe", timeframe, "available", available, "required", required));
    }
}
