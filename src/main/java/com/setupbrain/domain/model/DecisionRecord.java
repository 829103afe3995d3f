package com.setupbrain.domain.model;

import com.setupbrain.domain.enums.DecisionOutcome;
import com.setupbrain.domain.enums.DecisionSeverity;
import com.setupbrain.domain.enums.DecisionSource;
import com.setupbrain.domain.enums.DecisionType;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Domain model for a structured decision log entry.
 *
 * <p>Every scored setup, paper trade transition, skipped pair and cycle summary is
 * captured as a DecisionRecord. The DecisionLogger keeps the latest ones in a ring
 * buffer, publishes them as DecisionLogEvent, and queues them for the brain_logs table.
 */
@Data
@Builder
public class DecisionRecord {

    private Long id;

    private LocalDateTime timestamp;

    private DecisionSource source;

    /** Setup key, position ID or symbol -- whatever entity this decision relates to. */
    private String sourceId;

    private DecisionType decisionType;

    private DecisionOutcome outcome;

    /** Human-readable explanation of why this decision was made. */
    private String reasoning;

    /** Structured data snapshot at decision time. Serialized to JSON for persistence. */
    private Map<String, Object> dataContext;

    private DecisionSeverity severity;

    private LocalDate sessionDate;

    /** Brain cycle that produced the entry. Null for entries outside a cycle (heartbeat, manual close). */
    private Long cycleNumber;
}
