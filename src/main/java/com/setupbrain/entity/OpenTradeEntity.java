package com.setupbrain.entity;

import com.setupbrain.domain.enums.SetupType;
import com.setupbrain.domain.enums.TradeDirection;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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
 * JPA entity for the paper_open_trades table. Holds at most one row: the open paper position.
 */
@Entity
@Table(name = "paper_open_trades")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OpenTradeEntity {

    /** Position ID (UUID) assigned when the position was opened. */
    @Id
    @Column(name = "id", length = 36)
    private String id;

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

    /** Decision that opened the position. */
    @Column(name = "setup_id", length = 150)
    private String setupId;

    @Column(name = "high_water_mark", precision = 24, scale = 8)
    private BigDecimal highWaterMark;

    @Column(name = "low_water_mark", precision = 24, scale = 8)
    private BigDecimal lowWaterMark;
}
