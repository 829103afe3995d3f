package com.setupbrain.core.engine;

import com.setupbrain.config.UniverseConfig;
import com.setupbrain.domain.model.CycleSummary;
import com.setupbrain.exception.CycleInProgressException;
import com.setupbrain.notification.NotificationService;
import com.setupbrain.observability.CustomMetricsService;
import com.setupbrain.observability.DecisionLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Triggers a brain cycle on a fixed delay, so the next cycle starts only after the
 * previous one has finished.
 *
 * <p>A cycle that throws is logged, counted and alerted; the schedule keeps running.
 * Disabled with {@code brain.scheduler.enabled=false}.
 */
@Component
@ConditionalOnProperty(name = "brain.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class CycleScheduler {

    private static final Logger log = LoggerFactory.getLogger(CycleScheduler.class);

    private final BrainCycleRunner brainCycleRunner;
    private final DecisionLogger decisionLogger;
    private final CustomMetricsService customMetricsService;
    private final NotificationService notificationService;
    private final UniverseConfig universeConfig;

    public CycleScheduler(
            BrainCycleRunner brainCycleRunner,
            DecisionLogger decisionLogger,
            CustomMetricsService customMetricsService,
            NotificationService notificationService,
            UniverseConfig universeConfig) {
        this.brainCycleRunner = brainCycleRunner;
        this.decisionLogger = decisionLogger;
        this.customMetricsService = customMetricsService;
        this.notificationService = notificationService;
        this.universeConfig = universeConfig;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        String message = String.format(
                "Setup brain started: symbols=%s timeframes=%s",
                universeConfig.getSymbols(),
                universeConfig.getTimeframes());
        log.info(message);
        decisionLogger.logHeartbeat(message);
    }

    @Scheduled(
            fixedDelayString = "${brain.scheduler.cycle-interval-ms:900000}",
            initialDelayString = "${brain.scheduler.initial-delay-ms:10000}")
    public void runScheduledCycle() {
        try {
            CycleSummary summary = brainCycleRunner.runCycle();
            log.debug("Scheduled cycle {} finished", summary.getCycleNumber());
        } catch (CycleInProgressException e) {
            log.warn("Scheduled cycle skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Brain cycle failed: {}", e.getMessage(), e);
            customMetricsService.recordCycleFailure();
            notificationService.notifyFailure("Brain cycle failed", e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
