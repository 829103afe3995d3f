package com.setupbrain.core.engine;

import com.setupbrain.config.UniverseConfig;
import com.setupbrain.decision.DecisionEngine;
import com.setupbrain.detect.SetupDetector;
import com.setupbrain.domain.enums.CandleInterval;
import com.setupbrain.domain.enums.PaperCycleAction;
import com.setupbrain.domain.model.Candle;
import com.setupbrain.domain.model.CycleSummary;
import com.setupbrain.domain.vo.Decision;
import com.setupbrain.domain.vo.FeatureSet;
import com.setupbrain.domain.vo.RecordingStats;
import com.setupbrain.domain.vo.SetupCandidate;
import com.setupbrain.exception.BaseException;
import com.setupbrain.exception.CycleInProgressException;
import com.setupbrain.exception.DataException;
import com.setupbrain.feature.FeatureEngine;
import com.setupbrain.marketdata.MarketDataProvider;
import com.setupbrain.notification.NotificationService;
import com.setupbrain.observability.CustomMetricsService;
import com.setupbrain.observability.DecisionLogger;
import com.setupbrain.recorder.SetupRecorder;
import com.setupbrain.repository.jpa.DecisionLogJpaRepository;
import com.setupbrain.simulator.PaperTradingService;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Runs one brain cycle: a full pass over every configured (symbol, timeframe).
 *
 * <p>Per pair: fetch candles, compute features, detect setups, score them and log every
 * decision. A pair whose candles are missing or malformed is logged and skipped. After
 * all pairs the setups are recorded and, when enabled, paper trading runs on the
 * cycle's decisions. The cycle ends with a CYCLE_COMPLETED log entry.
 *
 * <p>Paper trading sits behind a failure boundary: anything it throws is logged as a
 * non-fatal fault, recorded in the decision log and alerted, and the cycle still
 * completes. Only one cycle runs at a time; a second request fails with
 * {@link CycleInProgressException}.
 */
@Service
public class BrainCycleRunner {

    private static final Logger log = LoggerFactory.getLogger(BrainCycleRunner.class);

    private final UniverseConfig universeConfig;
    private final MarketDataProvider marketDataProvider;
    private final FeatureEngine featureEngine;
    private final SetupDetector setupDetector;
    private final DecisionEngine decisionEngine;
    private final SetupRecorder setupRecorder;
    private final PaperTradingService paperTradingService;
    private final DecisionLogger decisionLogger;
    private final DecisionLogJpaRepository decisionLogJpaRepository;
    private final CustomMetricsService customMetricsService;
    private final NotificationService notificationService;
    private final Clock clock;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private final AtomicLong cycleCounter = new AtomicLong(-1);

    @Autowired
    public BrainCycleRunner(
            UniverseConfig universeConfig,
            MarketDataProvider marketDataProvider,
            FeatureEngine featureEngine,
            SetupDetector setupDetector,
            DecisionEngine decisionEngine,
            SetupRecorder setupRecorder,
            PaperTradingService paperTradingService,
            DecisionLogger decisionLogger,
            DecisionLogJpaRepository decisionLogJpaRepository,
            CustomMetricsService customMetricsService,
            NotificationService notificationService) {
        this(
                universeConfig,
                marketDataProvider,
                featureEngine,
                setupDetector,
                decisionEngine,
                setupRecorder,
                paperTradingService,
                decisionLogger,
                decisionLogJpaRepository,
                customMetricsService,
                notificationService,
                Clock.systemUTC());
    }

    public BrainCycleRunner(
            UniverseConfig universeConfig,
            MarketDataProvider marketDataProvider,
            FeatureEngine featureEngine,
            SetupDetector setupDetector,
            DecisionEngine decisionEngine,
            SetupRecorder setupRecorder,
            PaperTradingService paperTradingService,
            DecisionLogger decisionLogger,
            DecisionLogJpaRepository decisionLogJpaRepository,
            CustomMetricsService customMetricsService,
            NotificationService notificationService,
            Clock clock) {
        this.universeConfig = universeConfig;
        this.marketDataProvider = marketDataProvider;
        this.featureEngine = featureEngine;
        this.setupDetector = setupDetector;
        this.decisionEngine = decisionEngine;
        this.setupRecorder = setupRecorder;
        this.paperTradingService = paperTradingService;
        this.decisionLogger = decisionLogger;
        this.decisionLogJpaRepository = decisionLogJpaRepository;
        this.customMetricsService = customMetricsService;
        this.notificationService = notificationService;
        this.clock = clock;
    }

    public CycleSummary runCycle() {
        if (!cycleLock.tryLock()) {
            throw new CycleInProgressException();
        }
        try {
            return doRunCycle(nextCycleNumber());
        } finally {
            cycleLock.unlock();
        }
    }

    public boolean isRunning() {
        return cycleLock.isLocked();
    }

    /** Number of the last cycle started, 0 before the first. */
    public long getLastCycleNumber() {
        return Math.max(0, cycleCounter.get());
    }

    private CycleSummary doRunCycle(long cycleNumber) {
        Instant startedAt = clock.instant();
        log.info(
                "Brain cycle {} started: {} symbols x {} timeframes",
                cycleNumber,
                universeConfig.getSymbols().size(),
                universeConfig.getIntervals().size());

        int pairsEvaluated = 0;
        int pairsSkipped = 0;
        List<SetupCandidate> candidates = new ArrayList<>();
        List<Decision> decisions = new ArrayList<>();

        for (String symbol : universeConfig.getSymbols()) {
            for (CandleInterval timeframe : universeConfig.getIntervals()) {
                FeatureSet features;
                try {
                    List<Candle> candles =
                            marketDataProvider.fetchCandles(symbol, timeframe, universeConfig.getOhlcLimit());
                    features = featureEngine.compute(symbol, timeframe, candles);
                } catch (DataException e) {
                    pairsSkipped++;
                    log.warn("Skipping {} {}: {}", symbol, timeframe.getSuffix(), e.getMessage());
                    decisionLogger.logFeaturesSkipped(symbol, timeframe.getSuffix(), e.getMessage(), cycleNumber);
                    continue;
                }
                pairsEvaluated++;

                List<SetupCandidate> detected = setupDetector.detect(features, startedAt);
                for (Decision decision : decisionEngine.decideAll(detected)) {
                    decisionLogger.logSetupDecision(decision, cycleNumber);
                    decisions.add(decision);
                }
                candidates.addAll(detected);
                log.debug("{} {}: {} candidates", symbol, timeframe.getSuffix(), detected.size());
            }
        }

        RecordingStats recordingStats = setupRecorder.record(candidates);
        if (recordingStats.getFailed() > 0) {
            decisionLogger.logRecordFailures(recordingStats.getFailed(), cycleNumber);
        }

        PaperCycleAction paperAction = null;
        boolean paperTradingFailed = false;
        if (paperTradingService.isEnabled()) {
            try {
                paperAction = paperTradingService.runCycle(decisions, cycleNumber).getAction();
            } catch (Exception e) {
                paperTradingFailed = true;
                handlePaperTradingFailure(e, cycleNumber);
            }
        }

        int forming = (int) decisions.stream().filter(Decision::isForming).count();
        CycleSummary summary = CycleSummary.builder()
                .cycleNumber(cycleNumber)
                .startedAt(startedAt)
                .finishedAt(clock.instant())
                .pairsEvaluated(pairsEvaluated)
                .pairsSkipped(pairsSkipped)
                .candidates(candidates.size())
                .forming(forming)
                .rejected(decisions.size() - forming)
                .recordingStats(recordingStats)
                .paperAction(paperAction)
                .paperTradingFailed(paperTradingFailed)
                .build();

        decisionLogger.logCycleSummary(summary);
        customMetricsService.recordCycle(summary);
        log.info(
                "Brain cycle {} completed: {} pairs, {} skipped, {} candidates, {} forming, records {}, paper {}",
                cycleNumber,
                pairsEvaluated,
                pairsSkipped,
                candidates.size(),
                forming,
                recordingStats,
                paperTradingFailed ? "FAILED" : paperAction);
        return summary;
    }

    private void handlePaperTradingFailure(Exception e, long cycleNumber) {
        log.error("Paper trading failed in cycle {} (non-fatal, cycle continues): {}", cycleNumber, e.getMessage(), e);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("exception", e.getClass().getSimpleName());
        if (e instanceof BaseException baseException) {
            details.put("errorCode", baseException.getErrorCode().getCode());
            details.putAll(baseException.getDetails());
        }
        decisionLogger.logPaperTradingFailure("Paper trading failed: " + e.getMessage(), details, cycleNumber);
        notificationService.notifyFailure(
                "Paper trading failed in cycle " + cycleNumber, e.getClass().getSimpleName() + ": " + e.getMessage());
    }

    private long nextCycleNumber() {
        if (cycleCounter.get() < 0) {
            cycleCounter.set(loadLastCycleNumber());
        }
        return cycleCounter.incrementAndGet();
    }

    private long loadLastCycleNumber() {
        try {
            Long last = decisionLogJpaRepository.findMaxCycleNumber();
            return last != null ? last : 0;
        } catch (RuntimeException e) {
            log.error("Could not read last cycle number, numbering restarts at 1: {}", e.getMessage());
            return 0;
        }
    }
}
