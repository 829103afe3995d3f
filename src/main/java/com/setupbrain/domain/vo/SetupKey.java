package com.setupbrain.domain.vo;

import com.setupbrain.domain.enums.CandleInterval;
import com.setupbrain.domain.enums.SetupType;
import lombok.Value;

/** Identity of a setup: at most one live record exists per key. */
@Value
public class SetupKey {

    String symbol;
    CandleInterval timeframe;
    SetupType setupType;

    public static SetupKey of(String symbol, CandleInterval timeframe, SetupType setupType) {
        return new SetupKey(symbol, timeframe, setupType);
    }

    @Override
    public String toString() {
        return symbol + ":" + timeframe.getSuffix() + ":" + setupType.getStorageKey();
    }
}
