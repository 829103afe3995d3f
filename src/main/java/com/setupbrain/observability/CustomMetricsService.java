package com.setupbrain.observability;

import com.setupbrain.domain.model.CycleSummary;
import com.setupbrain.event.PaperTradeEvent;
import com.setupbrain.event.PaperTradeEventType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the brain's Micrometer metrics, exposed through the actuator.
 * <ul>
 *   <li><b>brain.cycles</b> (counter): completed brain cycles</li>
 *   <li><b>brain.cycle.failures</b> (counter): cycles aborted or with a paper trading fault</li>
 *   <li><b>brain.cycle.duration</b> (timer): wall time of a cycle</li>
 *   <li><b>brain.decisions</b> (counter, tag status): scored setups</li>
 *   <li><b>brain.pairs.skipped</b> (counter): pairs the feature engine could not process</li>
 *   <li><b>paper.trades.opened</b> (counter)</li>
 *   <li><b>paper.trades.closed</b> (counter, tag reason)</li>
 *   <li><b>paper.equity</b> (gauge): account equity after the last trade</li>
 * </ul>
 */
@Service
public class CustomMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter cyclesCounter;
    private final Counter cycleFailuresCounter;
    private final Counter pairsSkippedCounter;
    private final Counter formingCounter;
    private final Counter rejectedCounter;
    private final Counter tradesOpenedCounter;
    private final Timer cycleDurationTimer;

    private final AtomicReference<Double> paperEquity = new AtomicReference<>(0.0);

    public CustomMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.cyclesCounter = Counter.builder("brain.cycles")
                .description("Completed brain cycles")
                .register(meterRegistry);

        this.cycleFailuresCounter = Counter.builder("brain.cycle.failures")
                .description("Brain cycles that aborted or hit a paper trading fault")
                .register(meterRegistry);

        this.pairsSkippedCounter = Counter.builder("brain.pairs.skipped")
                .description("Symbol/timeframe pairs skipped for missing or malformed candles")
                .register(meterRegistry);

        this.formingCounter = Counter.builder("brain.decisions")
                .description("Scored setups by status")
                .tag("status", "FORMING")
                .register(meterRegistry);

        this.rejectedCounter = Counter.builder("brain.decisions")
                .description("Scored setups by status")
                .tag("status", "REJECT")
                .register(meterRegistry);

        this.tradesOpenedCounter = Counter.builder("paper.trades.opened")
                .description("Paper positions opened")
                .register(meterRegistry);

        this.cycleDurationTimer = Timer.builder("brain.cycle.duration")
                .description("Wall time of one brain cycle")
                .maximumExpectedValue(Duration.ofMinutes(5))
                .register(meterRegistry);

        meterRegistry.gauge("paper.equity", paperEquity, AtomicReference::get);
    }

    public void recordCycle(CycleSummary summary) {
        cyclesCounter.increment();
        pairsSkippedCounter.increment(summary.getPairsSkipped());
        formingCounter.increment(summary.getForming());
        rejectedCounter.increment(summary.getRejected());
        if (summary.isPaperTradingFailed()) {
            cycleFailuresCounter.increment();
        }
        if (summary.getStartedAt() != null && summary.getFinishedAt() != null) {
            cycleDurationTimer.record(Duration.between(summary.getStartedAt(), summary.getFinishedAt()));
        }
    }

    public void recordCycleFailure() {
        cycleFailuresCounter.increment();
    }

    @EventListener
    @Order(20)
    public void onPaperTradeEvent(PaperTradeEvent event) {
        if (event.getEventType() == PaperTradeEventType.OPENED) {
            tradesOpenedCounter.increment();
        } else {
            Counter.builder("paper.trades.closed")
                    .description("Paper positions closed by exit reason")
                    .tag("reason", event.getClosedTrade().getExitReason().name())
                    .register(meterRegistry)
                    .increment();
        }
        if (event.getAccount() != null) {
            paperEquity.set(event.getAccount().getEquity().doubleValue());
        }
    }
}
