package com.setupbrain.recorder;

import com.setupbrain.domain.enums.CandleInterval;
import com.setupbrain.domain.enums.ConfidenceTier;
import com.setupbrain.domain.enums.RecordAction;
import com.setupbrain.domain.model.SetupRecord;
import com.setupbrain.domain.vo.RecordingStats;
import com.setupbrain.domain.vo.SetupCandidate;
import com.setupbrain.domain.vo.SetupKey;
import com.setupbrain.exception.PersistenceException;
import com.setupbrain.service.SetupRecordService;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Persists detected setups, writing only when something changed.
 *
 * <p>Keeps an in-memory map of setup identity to last written confidence, seeded once
 * from the setups_forming table. A candidate with a new identity is created, one whose
 * confidence moved is updated, and an unchanged one is skipped. The cache only changes
 * after a successful write, so a failed write is retried on the next cycle.
 */
@Component
public class SetupRecorder {

    private static final Logger log = LoggerFactory.getLogger(SetupRecorder.class);

    static final String STATUS_FORMING = "FORMING";
    static final String MARKET_CONTEXT_NORMAL = "NORMAL";

    private final SetupRecordService setupRecordService;

    private final Map<SetupKey, ConfidenceTier> lastKnown = new HashMap<>();
    private volatile boolean loaded = false;

    public SetupRecorder(SetupRecordService setupRecordService) {
        this.setupRecordService = setupRecordService;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        loadExisting();
    }

    /**
     * Seeds the cache from persisted records. Safe to call again; a failure leaves the
     * recorder unloaded so the next {@link #record} call retries. Rows with an unknown
     * timeframe are logged and skipped.
     *
     * @return number of identities loaded
     */
    public synchronized int loadExisting() {
        try {
            List<SetupRecord> records = setupRecordService.findAll();
            lastKnown.clear();
            for (SetupRecord setupRecord : records) {
                CandleInterval timeframe;
                try {
                    timeframe = CandleInterval.fromSuffix(setupRecord.getTimeframe());
                } catch (IllegalArgumentException e) {
                    log.warn(
                            "Skipping stored setup {} {} {} (id {}): {}",
                            setupRecord.getSymbol(),
                            setupRecord.getTimeframe(),
                            setupRecord.getSetupType(),
                            setupRecord.getId(),
                            e.getMessage());
                    continue;
                }
                lastKnown.put(
                        SetupKey.of(setupRecord.getSymbol(), timeframe, setupRecord.getSetupType()),
                        setupRecord.getConfidence());
            }
            loaded = true;
            log.info("Setup recorder loaded {} existing setup identities", lastKnown.size());
            return lastKnown.size();
        } catch (PersistenceException e) {
            log.error("Failed to load existing setup records, will retry next cycle: {}", e.getMessage(), e);
            return 0;
        }
    }

    /**
     * Creates, updates or skips each candidate against the cache and writes the changes.
     */
    public synchronized RecordingStats record(List<SetupCandidate> candidates) {
        if (!loaded) {
            loadExisting();
        }

        int created = 0;
        int updated = 0;
        int skipped = 0;
        int failed = 0;
        for (SetupCandidate candidate : candidates) {
            RecordAction action = classify(candidate);
            if (action == RecordAction.SKIP) {
                skipped++;
                continue;
            }

            try {
                setupRecordService.upsert(toRecord(candidate));
                lastKnown.put(candidate.getKey(), candidate.getConfidence());
                if (action == RecordAction.CREATE) {
                    created++;
                } else {
                    updated++;
                }
                log.info("Setup {} {}: confidence {}", action, candidate.getKey(), candidate.getConfidence());
            } catch (PersistenceException e) {
                failed++;
                log.error(
                        "Failed to {} setup {} (confidence {}), will retry next cycle: {} {}",
                        action,
                        candidate.getKey(),
                        candidate.getConfidence(),
                        e.getMessage(),
                        e.getDetails(),
                        e);
            }
        }

        RecordingStats stats = new RecordingStats(created, updated, skipped, failed);
        log.debug("Setup recording: {}", stats);
        return stats;
    }

    public synchronized RecordAction classify(SetupCandidate candidate) {
        ConfidenceTier known = lastKnown.get(candidate.getKey());
        if (known == null) {
            return RecordAction.CREATE;
        }
        return known == candidate.getConfidence() ? RecordAction.SKIP : RecordAction.UPDATE;
    }

    public synchronized Map<SetupKey, ConfidenceTier> snapshot() {
        return Collections.unmodifiableMap(new HashMap<>(lastKnown));
    }

    private static SetupRecord toRecord(SetupCandidate candidate) {
        return SetupRecord.builder()
                .symbol(candidate.getSymbol())
                .timeframe(candidate.getTimeframe().getSuffix())
                .setupType(candidate.getSetupType())
                .status(STATUS_FORMING)
                .confidence(candidate.getConfidence())
                .detectedAt(candidate.getDetectedAt())
                .context(candidate.getContext())
                .marketContext(MARKET_CONTEXT_NORMAL)
                .build();
    }
}
