package com.setupbrain.simulator;

import com.setupbrain.domain.enums.ExitReason;
import com.setupbrain.domain.enums.PaperCycleAction;
import com.setupbrain.domain.enums.TradeDirection;
import com.setupbrain.domain.model.ClosedTrade;
import com.setupbrain.domain.model.OpenPosition;
import com.setupbrain.domain.model.PaperAccount;
import com.setupbrain.domain.model.PaperCycleResult;
import com.setupbrain.domain.model.PaperTradingState;
import com.setupbrain.domain.vo.Decision;
import com.setupbrain.domain.vo.PositionPlan;
import com.setupbrain.exception.ComputationException;
import com.setupbrain.exception.DataException;
import com.setupbrain.exception.ErrorCode;
import com.setupbrain.exception.SimulationException;
import com.setupbrain.risk.PositionSizer;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Single-slot paper trading state machine.
 *
 * <p>Each cycle takes the current {@link PaperTradingState} and returns the next one:
 * <ul>
 *   <li>Flat: the highest-scoring FORMING decision (first wins on ties) is sized and
 *       opened. A decision the sizer refuses is skipped for the next best one.</li>
 *   <li>Open: the latest price is checked against the stop first, then the target.
 *       A hit closes the position and updates the account; otherwise the water
 *       marks move and the position stays open.</li>
 * </ul>
 *
 * <p>A cycle either opens or monitors, never both, so a position closed this cycle
 * is not replaced until the next one. There is never more than one open position.
 *
 * <p>P&L is directional: (exit - entry) * size for LONG, (entry - exit) * size for SHORT.
 */
@Component
public class PaperTradingEngine {

    private static final Logger log = LoggerFactory.getLogger(PaperTradingEngine.class);

    private static final int MONEY_SCALE = 2;
    private static final int PERCENT_SCALE = 4;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final PositionSizer positionSizer;

    public PaperTradingEngine(PositionSizer positionSizer) {
        this.positionSizer = positionSizer;
    }

    public PaperCycleResult runCycle(
            PaperTradingState state, List<Decision> decisions, PriceLookup priceLookup, Instant now) {
        if (state == null || state.getAccount() == null) {
            throw new SimulationException("Paper trading state has no account");
        }
        if (state.hasOpenPosition()) {
            return monitor(state, priceLookup, now);
        }
        return tryOpen(state, decisions, now);
    }

    /**
     * Closes the open position at {@code exitPrice} with reason MANUAL.
     *
     * @throws SimulationException if there is no open position or the price is not positive
     */
    public PaperCycleResult closeManually(PaperTradingState state, BigDecimal exitPrice, Instant now) {
        if (!state.hasOpenPosition()) {
            throw new SimulationException(ErrorCode.CONFLICT, "No open paper position to close");
        }
        if (exitPrice == null || exitPrice.signum() <= 0) {
            throw new SimulationException(ErrorCode.VALIDATION_ERROR, "Exit price must be positive, was " + exitPrice);
        }
        OpenPosition position = state.getPosition().withObservedPrice(exitPrice);
        return close(state.getAccount(), position, exitPrice, ExitReason.MANUAL, now);
    }

    // ---- Flat: open from the best qualifying decision ----

    private PaperCycleResult tryOpen(PaperTradingState state, List<Decision> decisions, Instant now) {
        List<Decision> qualifying = decisions == null
                ? List.of()
                : decisions.stream()
                        .filter(Decision::isForming)
                        .sorted(Comparator.comparingInt(Decision::getScore).reversed())
                        .toList();

        List<String> rejections = new ArrayList<>();
        for (Decision decision : qualifying) {
            PositionPlan plan;
            try {
                plan = positionSizer.size(
                        state.getAccount().getEquity(),
                        decision.getDirection(),
                        decision.getEntryPrice(),
                        decision.getStopPrice());
            } catch (ComputationException e) {
                log.warn("Sizing rejected decision {}: {}", decision.getDecisionId(), e.getMessage());
                rejections.add(decision.getDecisionId() + ": " + e.getMessage());
                continue;
            }

            OpenPosition position = open(state.getAccount(), decision, plan, now);
            log.info(
                    "Paper position opened: {} {} size={} entry={} stop={} target={} risk={}",
                    position.getDirection(),
                    position.getSymbol(),
                    position.getSize().toPlainString(),
                    position.getEntryPrice().toPlainString(),
                    position.getStopLoss().toPlainString(),
                    position.getTakeProfit().toPlainString(),
                    position.getRiskAmount().toPlainString());
            return PaperCycleResult.builder()
                    .state(state.withPosition(position))
                    .action(PaperCycleAction.OPENED)
                    .opened(position)
                    .sizingRejections(List.copyOf(rejections))
                    .build();
        }

        return PaperCycleResult.builder()
                .state(state)
                .action(PaperCycleAction.NONE)
                .sizingRejections(List.copyOf(rejections))
                .build();
    }

    private OpenPosition open(PaperAccount account, Decision decision, PositionPlan plan, Instant now) {
        return OpenPosition.builder()
                .id(UUID.randomUUID().toString())
                .symbol(decision.getSymbol())
                .timeframe(decision.getCandidate().getTimeframe().getSuffix())
                .setupType(decision.getCandidate().getSetupType())
                .direction(plan.getDirection())
                .entryPrice(plan.getEntryPrice())
                .size(plan.getSize())
                .stopLoss(plan.getStopLoss())
                .takeProfit(plan.getTakeProfit())
                .riskAmount(plan.getRiskAmount())
                .equityAtOpen(account.getEquity())
                .openedAt(now)
                .decisionId(decision.getDecisionId())
                .highWaterMark(plan.getEntryPrice())
                .lowWaterMark(plan.getEntryPrice())
                .build();
    }

    // ---- Open: monitor stop and target ----

    private PaperCycleResult monitor(PaperTradingState state, PriceLookup priceLookup, Instant now) {
        OpenPosition position = state.getPosition();
        BigDecimal price;
        try {
            price = priceLookup.latestPrice(position.getSymbol());
        } catch (DataException e) {
            log.warn("Latest price unavailable for {}, position stays open: {}", position.getSymbol(), e.getMessage());
            return PaperCycleResult.builder()
                    .state(state)
                    .action(PaperCycleAction.PRICE_UNAVAILABLE)
                    .build();
        }
        if (price == null || price.signum() <= 0) {
            log.warn("Invalid latest price {} for {}, position stays open", price, position.getSymbol());
            return PaperCycleResult.builder()
                    .state(state)
                    .action(PaperCycleAction.PRICE_UNAVAILABLE)
                    .build();
        }

        OpenPosition observed = position.withObservedPrice(price);
        if (observed.isStopHit(price)) {
            return close(state.getAccount(), observed, price, ExitReason.STOP, now);
        }
        if (observed.isTargetHit(price)) {
            return close(state.getAccount(), observed, price, ExitReason.TARGET, now);
        }

        log.debug(
                "Paper position {} {} held at {} (stop={}, target={})",
                observed.getDirection(),
                observed.getSymbol(),
                price.toPlainString(),
                observed.getStopLoss().toPlainString(),
                observed.getTakeProfit().toPlainString());
        return PaperCycleResult.builder()
                .state(state.withPosition(observed))
                .action(PaperCycleAction.HELD)
                .build();
    }

    private PaperCycleResult close(
            PaperAccount account, OpenPosition position, BigDecimal exitPrice, ExitReason exitReason, Instant now) {
        ClosedTrade closedTrade = toClosedTrade(position, exitPrice, exitReason, now);
        PaperAccount updated = account.applyClose(closedTrade.getPnl(), now);

        log.info(
                "Paper position closed: {} {} exit={} reason={} pnl={} equity={}",
                position.getDirection(),
                position.getSymbol(),
                exitPrice.toPlainString(),
                exitReason,
                closedTrade.getPnl().toPlainString(),
                updated.getEquity().toPlainString());
        return PaperCycleResult.builder()
                .state(PaperTradingState.flat(updated))
                .action(PaperCycleAction.CLOSED)
                .closed(closedTrade)
                .build();
    }

    ClosedTrade toClosedTrade(OpenPosition position, BigDecimal exitPrice, ExitReason exitReason, Instant now) {
        BigDecimal sign = BigDecimal.valueOf(position.getDirection().sign());
        BigDecimal entry = position.getEntryPrice();
        BigDecimal priceDiff = exitPrice.subtract(entry).multiply(sign);

        BigDecimal pnl = priceDiff.multiply(position.getSize()).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        BigDecimal pnlPercent = percentOf(priceDiff, entry);

        // Favourable excursion is toward the target, adverse toward the stop.
        boolean isLong = position.getDirection() == TradeDirection.LONG;
        BigDecimal favourable = isLong
                ? position.getHighWaterMark().subtract(entry)
                : entry.subtract(position.getLowWaterMark());
        BigDecimal adverse = isLong
                ? position.getLowWaterMark().subtract(entry)
                : entry.subtract(position.getHighWaterMark());

        return ClosedTrade.builder()
                .positionId(position.getId())
                .symbol(position.getSymbol())
                .timeframe(position.getTimeframe())
                .setupType(position.getSetupType())
                .direction(position.getDirection())
                .entryPrice(entry)
                .size(position.getSize())
                .stopLoss(position.getStopLoss())
                .takeProfit(position.getTakeProfit())
                .riskAmount(position.getRiskAmount())
                .equityAtOpen(position.getEquityAtOpen())
                .openedAt(position.getOpenedAt())
                .decisionId(position.getDecisionId())
                .exitPrice(exitPrice)
                .closedAt(now)
                .exitReason(exitReason)
                .pnl(pnl)
                .pnlPercent(pnlPercent)
                .durationMinutes(Math.max(0, Duration.between(position.getOpenedAt(), now).toMinutes()))
                .mfePercent(percentOf(favourable, entry))
                .maePercent(percentOf(adverse, entry))
                .build();
    }

    private static BigDecimal percentOf(BigDecimal amount, BigDecimal base) {
        return amount.multiply(HUNDRED).divide(base, PERCENT_SCALE, RoundingMode.HALF_UP);
    }
}
