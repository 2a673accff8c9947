package com.marketscan.entity;

import com.marketscan.domain.enums.PositionSide;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the open_positions table. Keyed by symbol since at most one position per
 * symbol is open; the row is deleted when the position closes.
 */
@Entity
@Table(name = "open_positions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionEntity {

    @Id
    @Column(length = 50)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private PositionSide side;

    @Column(name = "entry_price", precision = 15, scale = 2)
    private BigDecimal entryPrice;

    private int quantity;

    @Column(name = "stop_loss", precision = 15, scale = 2)
    private BigDecimal stopLoss;

    @Column(name = "take_profit", precision = 15, scale = 2)
    private BigDecimal takeProfit;

    @Column(name = "trailing_peak", precision = 15, scale = 2)
    private BigDecimal trailingPeak;

    @Column(name = "opened_at")
    private LocalDateTime openedAt;

    @Column(name = "strategy_id", length = 36)
    private String strategyId;
}
