package com.marketscan.backtest;

import com.marketscan.domain.enums.ExitReason;
import com.marketscan.domain.enums.PositionSide;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/** One round trip of a backtest. */
public record BacktestTrade(
        PositionSide side,
        int quantity,
        LocalDateTime entryTime,
        BigDecimal entryPrice,
        LocalDateTime exitTime,
        BigDecimal exitPrice,
        BigDecimal pnl,
        ExitReason exitReason) {}
