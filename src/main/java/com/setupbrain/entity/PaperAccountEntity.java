package com.setupbrain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the paper_account table. Holds a single row with {@link #SINGLETON_ID}.
 */
@Entity
@Table(name = "paper_account")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PaperAccountEntity {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Column(name = "equity", nullable = false, precision = 20, scale = 8)
    private BigDecimal equity;

    @Column(name = "initial_capital", nullable = false, precision = 20, scale = 8)
    private BigDecimal initialCapital;

    @Column(name = "total_trades", nullable = false)
    private int totalTrades;

    @Column(name = "winning_trades", nullable = false)
    private int winningTrades;

    @Column(name = "losing_trades", nullable = false)
    private int losingTrades;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
