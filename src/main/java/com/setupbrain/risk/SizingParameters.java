package com.setupbrain.risk;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Fixed-fractional sizing inputs. Loaded from {@code brain.paper-trading.*}.
 */
@Value
@Builder
public class SizingParameters {

    /** Fraction of equity risked per trade, e.g. 0.01 = 1%. */
    @Builder.Default
    BigDecimal riskFraction = new BigDecimal("0.01");

    /** Target distance as a multiple of the stop distance. */
    @Builder.Default
    BigDecimal rewardMultiple = new BigDecimal("2.0");

    public void validate() {
        if (riskFraction.signum() <= 0 || riskFraction.compareTo(BigDecimal.ONE) >= 0) {
            throw new IllegalStateException("brain.paper-trading.risk-fraction must be in (0, 1), was " + riskFraction);
        }
        if (rewardMultiple.signum() <= 0) {
            throw new IllegalStateException("brain.paper-trading.reward-multiple must be positive, was " + rewardMultiple);
        }
    }
}
