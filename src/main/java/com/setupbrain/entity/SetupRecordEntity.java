package com.setupbrain.entity;

import com.setupbrain.domain.enums.ConfidenceTier;
import com.setupbrain.domain.enums.SetupType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the setups_forming table.
 *
 * <p>One row per (symbol, timeframe, setup_type), enforced by a unique constraint.
 * The setup recorder inserts a row the first time a setup is seen and updates it
 * only when its confidence changes.
 */
@Entity
@Table(
        name = "setups_forming",
        uniqueConstraints =
                @UniqueConstraint(
                        name = "uk_setups_forming_identity",
                        columnNames = {"symbol", "timeframe", "setup_type"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SetupRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "symbol", nullable = false, length = 30)
    private String symbol;

    @Column(name = "timeframe", nullable = false, length = 10)
    private String timeframe;

    @Enumerated(EnumType.STRING)
    @Column(name = "setup_type", nullable = false, columnDefinition = "varchar(50)")
    private SetupType setupType;

    @Column(name = "status", nullable = false, length = 20)
    private String status;

    @Enumerated(EnumType.STRING)
    @Column(name = "confidence", nullable = false, columnDefinition = "varchar(20)")
    private ConfidenceTier confidence;

    @Column(name = "detected_at", nullable = false)
    private Instant detectedAt;

    @Column(name = "context", columnDefinition = "TEXT")
    private String context;

    @Column(name = "market_context", length = 30)
    private String marketContext;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
