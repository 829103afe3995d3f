package com.setupbrain.api.controller;

import com.setupbrain.domain.enums.DecisionSeverity;
import com.setupbrain.domain.enums.DecisionSource;
import com.setupbrain.domain.model.DecisionRecord;
import com.setupbrain.mapper.DecisionLogMapper;
import com.setupbrain.observability.DecisionArchiveService;
import com.setupbrain.observability.DecisionLogger;
import com.setupbrain.repository.jpa.DecisionLogJpaRepository;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the decision log.
 *
 * <p>Recent entries come from the in-memory ring buffer; per-cycle history comes from
 * the brain_logs table.
 */
@RestController
@RequestMapping("/api/decisions")
public class DecisionLogController {

    static final int MAX_RECENT = 1000;

    private final DecisionLogger decisionLogger;
    private final DecisionArchiveService decisionArchiveService;
    private final DecisionLogJpaRepository decisionLogJpaRepository;
    private final DecisionLogMapper decisionLogMapper;

    public DecisionLogController(
            DecisionLogger decisionLogger,
            DecisionArchiveService decisionArchiveService,
            DecisionLogJpaRepository decisionLogJpaRepository,
            DecisionLogMapper decisionLogMapper) {
        this.decisionLogger = decisionLogger;
        this.decisionArchiveService = decisionArchiveService;
        this.decisionLogJpaRepository = decisionLogJpaRepository;
        this.decisionLogMapper = decisionLogMapper;
    }

    /**
     * Latest entries, newest first. Filter by source or by minimum severity, not both;
     * source wins when both are given.
     */
    @GetMapping("/recent")
    public ResponseEntity<List<DecisionRecord>> getRecent(
            @RequestParam(defaultValue = "100") int count,
            @RequestParam(required = false) DecisionSource source,
            @RequestParam(required = false) DecisionSeverity minSeverity) {
        int limit = Math.max(1, Math.min(count, MAX_RECENT));
        if (source != null) {
            return ResponseEntity.ok(decisionLogger.getRecentDecisions(limit, source));
        }
        if (minSeverity != null) {
            return ResponseEntity.ok(decisionLogger.getRecentDecisions(limit, minSeverity));
        }
        return ResponseEntity.ok(decisionLogger.getRecentDecisions(limit));
    }

    /** Every persisted entry of one cycle, in the order it was logged. */
    @GetMapping("/cycle/{cycleNumber}")
    public ResponseEntity<List<DecisionRecord>> getCycle(@PathVariable long cycleNumber) {
        return ResponseEntity.ok(
                decisionLogMapper.toDomainList(decisionLogJpaRepository.findByCycleNumberOrderByTimestampAsc(cycleNumber)));
    }

    @GetMapping("/archive")
    public ResponseEntity<Map<String, Object>> getArchiveStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("pending", decisionArchiveService.getPendingCount());
        status.put("paused", decisionArchiveService.isPaused());
        status.put("failuresInRow", decisionArchiveService.getFailuresInRow());
        status.put("lastArchivedCycle", decisionArchiveService.getLastArchivedCycle());
        status.put("bufferSize", decisionLogger.getBufferSize());
        return ResponseEntity.ok(status);
    }
}
