package com.setupbrain.entity;

import com.setupbrain.domain.enums.DecisionOutcome;
import com.setupbrain.domain.enums.DecisionSeverity;
import com.setupbrain.domain.enums.DecisionSource;
import com.setupbrain.domain.enums.DecisionType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the brain_logs table.
 *
 * <p>Persists every scored setup, skipped pair, paper trade transition and cycle
 * summary with its reasoning and a JSON snapshot of the data behind it. Written in
 * batches by {@code DecisionArchiveService}.
 */
@Entity
@Table(name = "brain_logs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DecisionLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "timestamp", nullable = false)
    private LocalDateTime timestamp;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, columnDefinition = "varchar(50)")
    private DecisionSource source;

    /** Setup key, position ID or symbol. */
    @Column(name = "source_id", length = 150)
    private String sourceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "decision_type", nullable = false, columnDefinition = "varchar(100)")
    private DecisionType decisionType;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, columnDefinition = "varchar(50)")
    private DecisionOutcome outcome;

    @Column(name = "reasoning", nullable = false, columnDefinition = "TEXT")
    private String reasoning;

    @Column(name = "data_context", columnDefinition = "TEXT")
    private String dataContext;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", columnDefinition = "varchar(50)")
    private DecisionSeverity severity;

    @Column(name = "session_date")
    private LocalDate sessionDate;

    @Column(name = "cycle_number")
    private Long cycleNumber;
}
