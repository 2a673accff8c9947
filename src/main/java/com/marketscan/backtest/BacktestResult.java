package com.marketscan.backtest;

import com.marketscan.strategy.VoterKind;
import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of replaying one voter over a candle history. Percentages are 0 to 100; a position
 * still open on the last bar is reported but not counted in the P&L.
 */
public record BacktestResult(
        String symbol,
        VoterKind voterKind,
        int bars,
        int totalTrades,
        int winningTrades,
        int losingTrades,
        BigDecimal winRate,
        BigDecimal totalPnl,
        BigDecimal finalCapital,
        BigDecimal maxDrawdown,
        BigDecimal sharpeRatio,
        BigDecimal profitFactor,
        boolean positionOpenAtEnd,
        List<BacktestTrade> trades) {}
