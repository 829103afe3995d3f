package com.setupbrain.entity;

import com.setupbrain.domain.enums.ExitReason;
import com.setupbrain.domain.enums.SetupType;
import com.setupbrain.domain.enums.TradeDirection;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
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
 * JPA entity for the paper_closed_trades table: the append-only history of completed
 * paper trades, including excursion statistics.
 */
@Entity
@Table(name = "paper_closed_trades")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ClosedTradeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "position_id", nullable = false, length = 36)
    private String positionId;

    @Column(name = "symbol", nullable = false, length = 30)
    private String symbol;

    @Column(name = "timeframe", length = 10)
    private String timeframe;

    @Enumerated(EnumType.STRING)
    @Column(name = "setup_type", columnDefinition = "varchar(50)")
    private SetupType setupType;

    @Enumerated(EnumType.STRING)
    @Column(name = "direction", nullable = false, columnDefinition = "varchar(10)")
    private TradeDirection direction;

    @Column(name = "entry_price", nullable = false, precision = 24, scale = 8)
    private BigDecimal entryPrice;

    @Column(name = "position_size", nullable = false, precision = 24, scale = 8)
    private BigDecimal positionSize;

    @Column(name = "stop_loss", nullable = false, precision = 24, scale = 8)
    private BigDecimal stopLoss;

    @Column(name = "take_profit", nullable = false, precision = 24, scale = 8)
    private BigDecimal takeProfit;

    @Column(name = "risk_amount", nullable = false, precision = 20, scale = 8)
    private BigDecimal riskAmount;

    @Column(name = "equity_at_open", nullable = false, precision = 20, scale = 8)
    private BigDecimal equityAtOpen;

    @Column(name = "opened_at", nullable = false)
    private Instant openedAt;

    @Column(name = "setup_id", length = 150)
    private String setupId;

    @Column(name = "exit_price", nullable = false, precision = 24, scale = 8)
    private BigDecimal exitPrice;

    @Column(name = "closed_at", nullable = false)
    private Instant closedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "exit_reason", nullable = false, columnDefinition = "varchar(20)")
    private ExitReason exitReason;

    @Column(name = "pnl", nullable = false, precision = 20, scale = 8)
    private BigDecimal pnl;

    @Column(name = "pnl_percent", precision = 12, scale = 4)
    private BigDecimal pnlPercent;

    @Column(name = "is_win", nullable = false)
    private boolean win;

    @Column(name = "duration_minutes")
    private long durationMinutes;

    @Column(name = "mfe_percent", precision = 12, scale = 4)
    private BigDecimal mfePercent;

    @Column(name = "mae_percent", precision = 12, scale = 4)
    private BigDecimal maePercent;
}
