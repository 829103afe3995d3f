package com.setupbrain.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.setupbrain.domain.enums.TradeDirection;
import com.setupbrain.domain.vo.PositionPlan;
import com.setupbrain.exception.ComputationException;
import com.setupbrain.exception.ErrorCode;
import com.setupbrain.exception.InvalidStopException;
import com.setupbrain.risk.PositionSizer;
import com.setupbrain.risk.SizingParameters;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for PositionSizer: 1% risk, 2R target.
 */
class PositionSizerTest {

    private static final BigDecimal EQUITY = new BigDecimal("100000");

    private PositionSizer positionSizer;

    @BeforeEach
    void setUp() {
        positionSizer = new PositionSizer(SizingParameters.builder().build());
    }

    @Nested
    @DisplayName("Sizing")
    class Sizing {

        @Test
        @DisplayName("long: risking 1000 over a 1000 stop distance buys 1 unit with a 2R target")
        void longPlan() {
            PositionPlan plan = positionSizer.size(
                    EQUITY, TradeDirection.LONG, new BigDecimal("50000"), new BigDecimal("49000"));

            assertThat(plan.getRiskAmount()).isEqualByComparingTo("1000");
            assertThat(plan.getSize()).isEqualByComparingTo("1");
            assertThat(plan.getStopLoss()).isEqualByComparingTo("49000");
            assertThat(plan.getTakeProfit()).isEqualByComparingTo("52000");
            assertThat(plan.getEntryPrice()).isEqualByComparingTo("50000");
        }

        @Test
        @DisplayName("short mirrors the target below entry")
        void shortPlan() {
            PositionPlan plan = positionSizer.size(
                    EQUITY, TradeDirection.SHORT, new BigDecimal("2000"), new BigDecimal("2100"));

            assertThat(plan.getSize()).isEqualByComparingTo("10");
            assertThat(plan.getTakeProfit()).isEqualByComparingTo("1800");
            assertThat(plan.getDirection()).isEqualTo(TradeDirection.SHORT);
        }

        @Test
        @DisplayName("fractional size keeps eight decimals")
        void fractionalSize() {
            PositionPlan plan =
                    positionSizer.size(EQUITY, TradeDirection.LONG, new BigDecimal("100"), new BigDecimal("97"));

            assertThat(plan.getSize()).isEqualByComparingTo("333.33333333");
        }

        @Test
        @DisplayName("risk is always the fixed fraction of equity")
        void riskIsFraction() {
            PositionPlan plan = positionSizer.size(
                    new BigDecimal("12345.67"), TradeDirection.LONG, new BigDecimal("10"), new BigDecimal("9"));

            assertThat(plan.getRiskAmount()).isEqualByComparingTo("123.46");
        }
    }

    @Nested
    @DisplayName("Invalid stops")
    class InvalidStops {

        @Test
        @DisplayName("stop equal to entry")
        void zeroDistance() {
            assertThatThrownBy(() -> positionSizer.size(
                            EQUITY, TradeDirection.LONG, new BigDecimal("100"), new BigDecimal("100.00")))
                    .isInstanceOf(InvalidStopException.class)
                    .hasMessageContaining("stop distance is zero");
        }

        @Test
        @DisplayName("long stop above entry")
        void longStopAbove() {
            assertThatThrownBy(() -> positionSizer.size(
                            EQUITY, TradeDirection.LONG, new BigDecimal("100"), new BigDecimal("105")))
                    .isInstanceOf(InvalidStopException.class)
                    .satisfies(e -> assertThat(((InvalidStopException) e).getErrorCode())
                            .isEqualTo(ErrorCode.INVALID_STOP));
        }

        @Test
        @DisplayName("short stop below entry")
        void shortStopBelow() {
            assertThatThrownBy(() -> positionSizer.size(
                            EQUITY, TradeDirection.SHORT, new BigDecimal("100"), new BigDecimal("95")))
                    .isInstanceOf(InvalidStopException.class);
        }

        @Test
        @DisplayName("short target that would go below zero")
        void negativeTarget() {
            assertThatThrownBy(() -> positionSizer.size(
                            EQUITY, TradeDirection.SHORT, new BigDecimal("10"), new BigDecimal("20")))
                    .isInstanceOf(InvalidStopException.class)
                    .hasMessageContaining("Target");
        }

        @Test
        @DisplayName("missing prices")
        void missingPrices() {
            assertThatThrownBy(() -> positionSizer.size(EQUITY, TradeDirection.LONG, null, new BigDecimal("1")))
                    .isInstanceOf(InvalidStopException.class);
        }

        @Test
        @DisplayName("non-positive equity is a computation error")
        void noEquity() {
            assertThatThrownBy(() -> positionSizer.size(
                            BigDecimal.ZERO, TradeDirection.LONG, new BigDecimal("100"), new BigDecimal("90")))
                    .isInstanceOf(ComputationException.class)
                    .isNotInstanceOf(InvalidStopException.class);
        }
    }
}
