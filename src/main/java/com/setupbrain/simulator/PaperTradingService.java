package com.setupbrain.simulator;

import com.setupbrain.config.PaperTradingConfig;
import com.setupbrain.domain.enums.PaperCycleAction;
import com.setupbrain.domain.model.ClosedTrade;
import com.setupbrain.domain.model.PaperCycleResult;
import com.setupbrain.domain.model.PaperTradingState;
import com.setupbrain.domain.vo.Decision;
import com.setupbrain.event.PaperTradeEvent;
import com.setupbrain.exception.ErrorCode;
import com.setupbrain.exception.ResourceNotFoundException;
import com.setupbrain.exception.SimulationException;
import com.setupbrain.marketdata.MarketDataProvider;
import com.setupbrain.observability.DecisionLogger;
import com.setupbrain.service.PaperLedgerService;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Runs the paper trading engine against the persisted ledger.
 *
 * <p>One cycle loads the account and open position, lets the {@link PaperTradingEngine}
 * open or monitor, writes the result back, then logs the transition and publishes a
 * {@link PaperTradeEvent} for notifications and metrics. Events are only published after
 * the ledger write succeeds.
 *
 * <p>Cycles and manual closes are serialized on {@code ledgerLock}: each one loads,
 * decides and saves the ledger without the other in between.
 *
 * <p>Exceptions propagate to the caller. The brain cycle runner treats anything thrown
 * from here as a non-fatal paper trading fault.
 */
@Service
public class PaperTradingService {

    private static final Logger log = LoggerFactory.getLogger(PaperTradingService.class);

    private final PaperTradingEngine paperTradingEngine;
    private final PaperLedgerService paperLedgerService;
    private final MarketDataProvider marketDataProvider;
    private final PaperTradingConfig paperTradingConfig;
    private final DecisionLogger decisionLogger;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;
    private final ReentrantLock ledgerLock = new ReentrantLock();

    @Autowired
    public PaperTradingService(
            PaperTradingEngine paperTradingEngine,
            PaperLedgerService paperLedgerService,
            MarketDataProvider marketDataProvider,
            PaperTradingConfig paperTradingConfig,
            DecisionLogger decisionLogger,
            ApplicationEventPublisher applicationEventPublisher) {
        this(
                paperTradingEngine,
                paperLedgerService,
                marketDataProvider,
                paperTradingConfig,
                decisionLogger,
                applicationEventPublisher,
                Clock.systemUTC());
    }

    public PaperTradingService(
            PaperTradingEngine paperTradingEngine,
            PaperLedgerService paperLedgerService,
            MarketDataProvider marketDataProvider,
            PaperTradingConfig paperTradingConfig,
            DecisionLogger decisionLogger,
            ApplicationEventPublisher applicationEventPublisher,
            Clock clock) {
        this.paperTradingEngine = paperTradingEngine;
        this.paperLedgerService = paperLedgerService;
        this.marketDataProvider = marketDataProvider;
        this.paperTradingConfig = paperTradingConfig;
        this.decisionLogger = decisionLogger;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    public boolean isEnabled() {
        return paperTradingConfig.isEnabled();
    }

    /**
     * Runs one paper trading cycle over this cycle's decisions. Blocks while a manual
     * close is being written.
     */
    public PaperCycleResult runCycle(List<Decision> decisions, long cycleNumber) {
        ledgerLock.lock();
        try {
            return runCycleLocked(decisions, cycleNumber);
        } finally {
            ledgerLock.unlock();
        }
    }

    /**
     * Closes the open position at {@code exitPrice}, or at the latest market price when
     * {@code exitPrice} is null. Waits for a running cycle to finish first.
     *
     * @throws ResourceNotFoundException if no position is open
     * @throws SimulationException if called from inside a running cycle
     */
    public ClosedTrade closeManually(BigDecimal exitPrice) {
        if (ledgerLock.isHeldByCurrentThread()) {
            throw new SimulationException(ErrorCode.CONFLICT, "Paper trading cycle in progress");
        }
        ledgerLock.lock();
        try {
            return closeManuallyLocked(exitPrice);
        } finally {
            ledgerLock.unlock();
        }
    }

    private PaperCycleResult runCycleLocked(List<Decision> decisions, long cycleNumber) {
        PaperTradingState state = paperLedgerService.loadState(paperTradingConfig.getInitialCapital());
        PaperCycleResult result =
                paperTradingEngine.runCycle(state, decisions, marketDataProvider::latestPrice, clock.instant());

        paperLedgerService.saveResult(result);

        for (String rejection : result.getSizingRejections()) {
            decisionLogger.logSizingRejected(rejection, cycleNumber);
        }
        publish(result, cycleNumber);

        log.info(
                "Paper cycle {}: {} (equity {})",
                cycleNumber,
                result.getAction(),
                result.getState().getAccount().getEquity().toPlainString());
        return result;
    }

    private ClosedTrade closeManuallyLocked(BigDecimal exitPrice) {
        PaperTradingState state = paperLedgerService.loadState(paperTradingConfig.getInitialCapital());
        if (!state.hasOpenPosition()) {
            throw new ResourceNotFoundException("Open paper position", "current");
        }
        BigDecimal price = exitPrice != null
                ? exitPrice
                : marketDataProvider.latestPrice(state.getPosition().getSymbol());

        Instant now = clock.instant();
        PaperCycleResult result = paperTradingEngine.closeManually(state, price, now);
        paperLedgerService.saveResult(result);
        publish(result, null);

        log.info("Paper position {} closed manually at {}", result.getClosed().getPositionId(), price.toPlainString());
        return result.getClosed();
    }

    public PaperTradingState getState() {
        return paperLedgerService.loadState(paperTradingConfig.getInitialCapital());
    }

    public List<ClosedTrade> getClosedTrades(int limit) {
        return paperLedgerService.findClosedTrades(limit);
    }

    public List<ClosedTrade> getClosedTrades(String symbol, int limit) {
        return paperLedgerService.findClosedTrades(symbol, limit);
    }

    private void publish(PaperCycleResult result, Long cycleNumber) {
        if (result.getAction() == PaperCycleAction.OPENED) {
            decisionLogger.logPaperTradeOpened(result.getOpened(), result.getState().getAccount(), cycleNumber);
            applicationEventPublisher.publishEvent(
                    PaperTradeEvent.opened(this, result.getOpened(), result.getState().getAccount()));
        } else if (result.getAction() == PaperCycleAction.CLOSED) {
            decisionLogger.logPaperTradeClosed(result.getClosed(), result.getState().getAccount(), cycleNumber);
            applicationEventPublisher.publishEvent(
                    PaperTradeEvent.closed(this, result.getClosed(), result.getState().getAccount()));
        }
    }
}
