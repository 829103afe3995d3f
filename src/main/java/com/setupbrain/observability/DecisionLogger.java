package com.setupbrain.observability;

import com.setupbrain.domain.enums.DecisionOutcome;
import com.setupbrain.domain.enums.DecisionSeverity;
import com.setupbrain.domain.enums.DecisionSource;
import com.setupbrain.domain.enums.DecisionType;
import com.setupbrain.domain.model.ClosedTrade;
import com.setupbrain.domain.model.CycleSummary;
import com.setupbrain.domain.model.DecisionRecord;
import com.setupbrain.domain.model.OpenPosition;
import com.setupbrain.domain.model.PaperAccount;
import com.setupbrain.domain.vo.Decision;
import com.setupbrain.domain.vo.FeatureSet;
import com.setupbrain.domain.vo.SetupCandidate;
import com.setupbrain.event.DecisionLogEvent;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Structured log of everything the brain decides.
 *
 * <p>Every scored setup, skipped pair, paper trade transition and cycle summary becomes a
 * {@link DecisionRecord}. Each record is:
 * <ul>
 *   <li>kept in a ring buffer of the last {@value #RING_BUFFER_SIZE} entries, newest first</li>
 *   <li>published as a {@link DecisionLogEvent}</li>
 *   <li>queued on the {@link DecisionArchiveService} for the brain_logs table</li>
 * </ul>
 *
 * <p>The specialized methods set source, type, outcome and severity for each subsystem
 * and delegate to {@link #log}.
 */
@Service
public class DecisionLogger {

    private static final Logger logger = LoggerFactory.getLogger(DecisionLogger.class);

    static final int RING_BUFFER_SIZE = 1000;

    private final ApplicationEventPublisher applicationEventPublisher;
    private final DecisionArchiveService decisionArchiveService;

    private final ConcurrentLinkedDeque<DecisionRecord> ringBuffer = new ConcurrentLinkedDeque<>();

    public DecisionLogger(
            ApplicationEventPublisher applicationEventPublisher, DecisionArchiveService decisionArchiveService) {
        this.applicationEventPublisher = applicationEventPublisher;
        this.decisionArchiveService = decisionArchiveService;
    }

    // ---- Core logging method ----

    public DecisionRecord log(
            DecisionSource source,
            String sourceId,
            DecisionType decisionType,
            DecisionOutcome outcome,
            String reasoning,
            Map<String, Object> dataContext,
            DecisionSeverity severity,
            Long cycleNumber) {

        DecisionRecord decisionRecord = DecisionRecord.builder()
                .timestamp(LocalDateTime.now())
                .source(source)
                .sourceId(sourceId)
                .decisionType(decisionType)
                .outcome(outcome)
                .reasoning(reasoning)
                .dataContext(dataContext)
                .severity(severity)
                .sessionDate(LocalDate.now())
                .cycleNumber(cycleNumber)
                .build();

        persist(decisionRecord);
        return decisionRecord;
    }

    // ---- Brain cycle ----

    /**
     * Logs a scored setup with its justification, fired buckets and the feature values
     * it was scored from. FORMING decisions are INFO, rejections DEBUG; both reach brain_logs.
     */
    public void logSetupDecision(Decision decision, long cycleNumber) {
        SetupCandidate candidate = decision.getCandidate();
        FeatureSet features = candidate.getFeatures();

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("symbol", candidate.getSymbol());
        context.put("timeframe", candidate.getTimeframe().getSuffix());
        context.put("setupType", candidate.getSetupType().getStorageKey());
        context.put("confidence", candidate.getConfidence());
        context.put("tier", decision.getTier());
        context.put("score", decision.getScore());
        context.put("status", decision.getStatus());
        context.put("firedBuckets", decision.getFiredBuckets());
        context.put("direction", decision.getDirection());
        context.put("entryPrice", decision.getEntryPrice());
        context.put("stopPrice", decision.getStopPrice());
        if (features != null) {
            context.put("volatilityRatio", features.getVolatilityRatio());
            context.put("distanceFromFastMaPct", features.getDistanceFromFastMaPct());
            context.put("distanceFromSlowMaPct", features.getDistanceFromSlowMaPct());
            context.put("distanceFromHighPct", features.getDistanceFromHighPct());
            context.put("distanceFromLowPct", features.getDistanceFromLowPct());
        }

        log(
                DecisionSource.DECISION_ENGINE,
                decision.getDecisionId(),
                DecisionType.SETUP_SCORED,
                decision.isForming() ? DecisionOutcome.TRIGGERED : DecisionOutcome.REJECTED,
                decision.getJustification(),
                context,
                decision.isForming() ? DecisionSeverity.INFO : DecisionSeverity.DEBUG,
                cycleNumber);
    }

    /**
     * Logs a (symbol, timeframe) pair the feature engine could not process this cycle.
     */
    public void logFeaturesSkipped(String symbol, String timeframe, String reason, long cycleNumber) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("symbol", symbol);
        context.put("timeframe", timeframe);

        log(
                DecisionSource.FEATURE_ENGINE,
                symbol + ":" + timeframe,
                DecisionType.FEATURES_SKIPPED,
                DecisionOutcome.SKIPPED,
                reason,
                context,
                DecisionSeverity.WARNING,
                cycleNumber);
    }

    /**
     * Logs setup writes that failed this cycle. They are retried next cycle.
     */
    public void logRecordFailures(int failed, long cycleNumber) {
        log(
                DecisionSource.SETUP_RECORDER,
                null,
                DecisionType.SETUP_RECORD_FAILED,
                DecisionOutcome.FAILED,
                failed + " setup record write(s) failed, will retry next cycle",
                Map.of("failed", failed),
                DecisionSeverity.WARNING,
                cycleNumber);
    }

    public void logCycleSummary(CycleSummary summary) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("pairsEvaluated", summary.getPairsEvaluated());
        context.put("pairsSkipped", summary.getPairsSkipped());
        context.put("candidates", summary.getCandidates());
        context.put("forming", summary.getForming());
        context.put("rejected", summary.getRejected());
        if (summary.getRecordingStats() != null) {
            context.put("recordsCreated", summary.getRecordingStats().getCreated());
            context.put("recordsUpdated", summary.getRecordingStats().getUpdated());
            context.put("recordsSkipped", summary.getRecordingStats().getSkipped());
            context.put("recordsFailed", summary.getRecordingStats().getFailed());
        }
        context.put("paperAction", summary.getPaperAction());
        context.put("paperTradingFailed", summary.isPaperTradingFailed());
        context.put("startedAt", summary.getStartedAt());
        context.put("finishedAt", summary.getFinishedAt());

        String reasoning = String.format(
                "Cycle %d: %d pairs evaluated, %d skipped, %d candidates (%d forming, %d rejected)",
                summary.getCycleNumber(),
                summary.getPairsEvaluated(),
                summary.getPairsSkipped(),
                summary.getCandidates(),
                summary.getForming(),
                summary.getRejected());

        log(
                DecisionSource.BRAIN_CYCLE,
                "cycle-" + summary.getCycleNumber(),
                DecisionType.CYCLE_COMPLETED,
                DecisionOutcome.INFO,
                reasoning,
                context,
                summary.isPaperTradingFailed() ? DecisionSeverity.WARNING : DecisionSeverity.INFO,
                summary.getCycleNumber());
    }

    public void logHeartbeat(String reasoning) {
        log(
                DecisionSource.SCHEDULER,
                null,
                DecisionType.HEARTBEAT,
                DecisionOutcome.INFO,
                reasoning,
                null,
                DecisionSeverity.INFO,
                null);
    }

    // ---- Paper trading ----

    public void logPaperTradeOpened(OpenPosition position, PaperAccount account, Long cycleNumber) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("symbol", position.getSymbol());
        context.put("timeframe", position.getTimeframe());
        context.put("setupType", position.getSetupType().getStorageKey());
        context.put("direction", position.getDirection());
        context.put("entryPrice", position.getEntryPrice());
        context.put("size", position.getSize());
        context.put("stopLoss", position.getStopLoss());
        context.put("takeProfit", position.getTakeProfit());
        context.put("riskAmount", position.getRiskAmount());
        context.put("equity", account.getEquity());
        context.put("decisionId", position.getDecisionId());

        log(
                DecisionSource.PAPER_TRADING,
                position.getId(),
                DecisionType.PAPER_TRADE_OPENED,
                DecisionOutcome.TRIGGERED,
                String.format(
                        "Opened %s %s at %s, stop %s, target %s",
                        position.getDirection(),
                        position.getSymbol(),
                        position.getEntryPrice().toPlainString(),
                        position.getStopLoss().toPlainString(),
                        position.getTakeProfit().toPlainString()),
                context,
                DecisionSeverity.INFO,
                cycleNumber);
    }

    public void logPaperTradeClosed(ClosedTrade trade, PaperAccount account, Long cycleNumber) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("symbol", trade.getSymbol());
        context.put("direction", trade.getDirection());
        context.put("entryPrice", trade.getEntryPrice());
        context.put("exitPrice", trade.getExitPrice());
        context.put("exitReason", trade.getExitReason());
        context.put("pnl", trade.getPnl());
        context.put("pnlPercent", trade.getPnlPercent());
        context.put("rMultiple", trade.getRMultiple());
        context.put("mfePercent", trade.getMfePercent());
        context.put("maePercent", trade.getMaePercent());
        context.put("durationMinutes", trade.getDurationMinutes());
        context.put("equity", account.getEquity());
        context.put("decisionId", trade.getDecisionId());

        log(
                DecisionSource.PAPER_TRADING,
                trade.getPositionId(),
                DecisionType.PAPER_TRADE_CLOSED,
                trade.isWin() ? DecisionOutcome.TRIGGERED : DecisionOutcome.REJECTED,
                String.format(
                        "Closed %s %s at %s (%s), P&L %s",
                        trade.getDirection(),
                        trade.getSymbol(),
                        trade.getExitPrice().toPlainString(),
                        trade.getExitReason(),
                        trade.getPnl().toPlainString()),
                context,
                DecisionSeverity.INFO,
                cycleNumber);
    }

    public void logSizingRejected(String rejection, long cycleNumber) {
        log(
                DecisionSource.PAPER_TRADING,
                null,
                DecisionType.PAPER_SIZING_REJECTED,
                DecisionOutcome.REJECTED,
                rejection,
                null,
                DecisionSeverity.WARNING,
                cycleNumber);
    }

    public void logPaperTradingFailure(String reason, Map<String, Object> details, long cycleNumber) {
        log(
                DecisionSource.PAPER_TRADING,
                null,
                DecisionType.PAPER_TRADING_FAILED,
                DecisionOutcome.FAILED,
                reason,
                details,
                DecisionSeverity.CRITICAL,
                cycleNumber);
    }

    // ---- Ring buffer queries ----

    public List<DecisionRecord> getRecentDecisions(int count) {
        return ringBuffer.stream().limit(count).toList();
    }

    public List<DecisionRecord> getRecentDecisions(int count, DecisionSource source) {
        return ringBuffer.stream()
                .filter(r -> r.getSource() == source)
                .limit(count)
                .toList();
    }

    public List<DecisionRecord> getRecentDecisions(int count, DecisionSeverity minSeverity) {
        return ringBuffer.stream()
                .filter(r -> r.getSeverity().ordinal() >= minSeverity.ordinal())
                .limit(count)
                .toList();
    }

    public int getBufferSize() {
        return ringBuffer.size();
    }

    // ---- Internal ----

    private void persist(DecisionRecord decisionRecord) {
        ringBuffer.addFirst(decisionRecord);
        while (ringBuffer.size() > RING_BUFFER_SIZE) {
            ringBuffer.removeLast();
        }

        try {
            applicationEventPublisher.publishEvent(new DecisionLogEvent(this, decisionRecord));
        } catch (Exception e) {
            logger.error("Failed to publish DecisionLogEvent: {}", e.getMessage());
        }

        decisionArchiveService.queue(decisionRecord);
    }
}
