package com.setupbrain.observability;

import com.setupbrain.domain.model.DecisionRecord;
import com.setupbrain.mapper.DecisionLogMapper;
import com.setupbrain.repository.jpa.DecisionLogJpaRepository;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Writes the decision log to the brain_logs table off the cycle thread.
 *
 * <p>Every record the {@link DecisionLogger} produces is archived, whatever its severity
 * or outcome: rejected setups are part of the cycle's history as much as forming ones.
 * Records are written in arrival order, at most {@value #MAX_BATCH_SIZE} per flush.
 *
 * <p>A failed batch is put back at the head of the queue. After {@value #FAILURE_THRESHOLD}
 * failures in a row writes pause for {@link #RECOVERY_WINDOW}; the first flush after the
 * window is a single trial batch.
 */
@Service
public class DecisionArchiveService {

    private static final Logger log = LoggerFactory.getLogger(DecisionArchiveService.class);

    static final int MAX_BATCH_SIZE = 200;
    static final int FAILURE_THRESHOLD = 3;
    static final Duration RECOVERY_WINDOW = Duration.ofMinutes(1);

    private final DecisionLogJpaRepository decisionLogJpaRepository;
    private final DecisionLogMapper decisionLogMapper;
    private final Clock clock;

    private final ConcurrentLinkedQueue<DecisionRecord> pending = new ConcurrentLinkedQueue<>();
    private final AtomicLong lastArchivedCycle = new AtomicLong(0);

    // Guarded by this.
    private int failuresInRow;
    private Instant pausedUntil;

    @Autowired
    public DecisionArchiveService(DecisionLogJpaRepository decisionLogJpaRepository, DecisionLogMapper decisionLogMapper) {
        this(decisionLogJpaRepository, decisionLogMapper, Clock.systemUTC());
    }

    public DecisionArchiveService(
            DecisionLogJpaRepository decisionLogJpaRepository, DecisionLogMapper decisionLogMapper, Clock clock) {
        this.decisionLogJpaRepository = decisionLogJpaRepository;
        this.decisionLogMapper = decisionLogMapper;
        this.clock = clock;
    }

    public void queue(DecisionRecord decisionRecord) {
        pending.add(decisionRecord);
    }

    /** Scheduled write of the next batch. Does nothing while writes are paused. */
    @Scheduled(fixedDelayString = "${brain.archive.flush-interval-ms:5000}")
    public synchronized void flush() {
        if (pending.isEmpty()) {
            return;
        }
        if (pausedUntil != null && clock.instant().isBefore(pausedUntil)) {
            log.debug("brain_logs writes paused until {}, {} records waiting", pausedUntil, pending.size());
            return;
        }
        writeNextBatch();
    }

    /**
     * Drains the queue on shutdown, ignoring any pause. Stops at the first failed batch.
     */
    @PreDestroy
    public synchronized void drainOnShutdown() {
        if (pending.isEmpty()) {
            return;
        }
        log.info("Writing {} decision records to brain_logs before shutdown", pending.size());
        while (!pending.isEmpty()) {
            if (!writeNextBatch()) {
                log.warn("{} decision records lost at shutdown", pending.size());
                return;
            }
        }
    }

    public int getPendingCount() {
        return pending.size();
    }

    public synchronized boolean isPaused() {
        return pausedUntil != null && clock.instant().isBefore(pausedUntil);
    }

    public synchronized int getFailuresInRow() {
        return failuresInRow;
    }

    /** Highest cycle number seen in a written batch, 0 before the first write. */
    public long getLastArchivedCycle() {
        return lastArchivedCycle.get();
    }

    private boolean writeNextBatch() {
        List<DecisionRecord> batch = new ArrayList<>(MAX_BATCH_SIZE);
        DecisionRecord next;
        while (batch.size() < MAX_BATCH_SIZE && (next = pending.poll()) != null) {
            batch.add(next);
        }
        if (batch.isEmpty()) {
            return true;
        }

        try {
            decisionLogJpaRepository.saveAll(decisionLogMapper.toEntityList(batch));
        } catch (RuntimeException e) {
            requeueAtHead(batch);
            recordFailure(batch.size(), e);
            return false;
        }

        if (pausedUntil != null) {
            log.info("brain_logs writes resumed");
        }
        failuresInRow = 0;
        pausedUntil = null;
        batch.stream()
                .map(DecisionRecord::getCycleNumber)
                .filter(cycle -> cycle != null)
                .forEach(cycle -> lastArchivedCycle.accumulateAndGet(cycle, Math::max));
        log.debug("Wrote {} decision records to brain_logs", batch.size());
        return true;
    }

    private void requeueAtHead(List<DecisionRecord> batch) {
        List<DecisionRecord> rest = new ArrayList<>(pending);
        pending.clear();
        pending.addAll(batch);
        pending.addAll(rest);
    }

    private void recordFailure(int batchSize, RuntimeException e) {
        failuresInRow++;
        log.error("brain_logs write of {} records failed ({} in a row): {}", batchSize, failuresInRow, e.getMessage());
        if (failuresInRow >= FAILURE_THRESHOLD) {
            pausedUntil = clock.instant().plus(RECOVERY_WINDOW);
            log.warn("Pausing brain_logs writes until {}, {} records waiting", pausedUntil, pending.size());
        }
    }
}
