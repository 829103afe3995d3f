package com.setupbrain.risk;

import com.setupbrain.domain.enums.TradeDirection;
import com.setupbrain.domain.vo.PositionPlan;
import com.setupbrain.exception.ComputationException;
import com.setupbrain.exception.InvalidStopException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Fixed-fractional position sizing.
 *
 * <pre>
 * risk   = equity * riskFraction
 * size   = risk / |entry - stop|
 * target = entry + direction * rewardMultiple * |entry - stop|
 * </pre>
 *
 * <p>Pure: no state, no I/O. A plan is only produced when the stop sits on the losing
 * side of the entry and the resulting target is a positive price.
 */
@Component
public class PositionSizer {

    static final int SIZE_SCALE = 8;
    static final int MONEY_SCALE = 2;

    private final SizingParameters sizingParameters;

    public PositionSizer(SizingParameters sizingParameters) {
        this.sizingParameters = sizingParameters;
    }

    /**
     * @throws InvalidStopException if entry equals stop, the stop is on the wrong side, a price
     *     is not positive, or the target would not be positive
     * @throws ComputationException if equity is not positive
     */
    public PositionPlan size(BigDecimal equity, TradeDirection direction, BigDecimal entry, BigDecimal stop) {
        if (equity == null || equity.signum() <= 0) {
            throw new ComputationException("Equity must be positive to size a position, was " + equity);
        }
        if (entry == null || stop == null || entry.signum() <= 0 || stop.signum() <= 0) {
            throw new InvalidStopException("Entry and stop must be positive prices", context(direction, entry, stop));
        }

        BigDecimal stopDistance = entry.subtract(stop).abs();
        if (stopDistance.signum() == 0) {
            throw new InvalidStopException("Entry equals stop, stop distance is zero", context(direction, entry, stop));
        }
        boolean stopOnLosingSide =
                direction == TradeDirection.LONG ? stop.compareTo(entry) < 0 : stop.compareTo(entry) > 0;
        if (!stopOnLosingSide) {
            throw new InvalidStopException(
                    String.format("Stop %s is on the wrong side of entry %s for %s", stop, entry, direction),
                    context(direction, entry, stop));
        }

        BigDecimal riskAmount = equity.multiply(sizingParameters.getRiskFraction());
        BigDecimal size = riskAmount.divide(stopDistance, SIZE_SCALE, RoundingMode.HALF_DOWN);
        BigDecimal rewardDistance = stopDistance.multiply(sizingParameters.getRewardMultiple());
        BigDecimal target = direction == TradeDirection.LONG ? entry.add(rewardDistance) : entry.subtract(rewardDistance);
        if (target.signum() <= 0) {
            throw new InvalidStopException(
                    "Target would not be a positive price: " + target.toPlainString(),
                    context(direction, entry, stop));
        }

        return PositionPlan.builder()
                .direction(direction)
                .entryPrice(entry)
                .stopLoss(stop)
                .takeProfit(target)
                .size(size.stripTrailingZeros())
                .riskAmount(riskAmount.setScale(MONEY_SCALE, RoundingMode.HALF_UP))
                .build();
    }

    private static Map<String, Object> context(TradeDirection direction, BigDecimal entry, BigDecimal stop) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("direction", String.valueOf(direction));
        context.put("entry", entry == null ? "null" : entry.toPlainString());
        context.put("stop", stop == null ? "null" : stop.toPlainString());
        return context;
    }
}
