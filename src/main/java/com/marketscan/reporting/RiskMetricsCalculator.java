package com.marketscan.reporting;

import com.marketscan.domain.model.RiskMetrics;
import com.marketscan.domain.model.Trade;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Computes performance metrics over the closed trades of a ledger.
 *
 * <p>The equity curve starts at the initial capital and steps by each closing trade's P&L in
 * time order. From it:
 * <ul>
 *   <li>win rate: share of closing trades with positive P&L, in percent</li>
 *   <li>profit factor: gross profit / gross loss (999.99 when there are no losses)</li>
 *   <li>max drawdown: largest fall from a running equity peak, in percent of that peak</li>
 *   <li>Sharpe ratio: mean / sample standard deviation of per-trade equity returns, scaled by sqrt(252)</li>
 * </ul>
 */
@Service
public class RiskMetricsCalculator {

    private static final Logger log = LoggerFactory.getLogger(RiskMetricsCalculator.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal NO_LOSS_PROFIT_FACTOR = BigDecimal.valueOf(999.99);
    private static final double TRADING_DAYS_PER_YEAR = 252.0;

    /**
     * @param closingTrades    trades that closed a position, any order
     * @param initialCapital   capital the equity curve starts from
     * @param capital          current equity
     * @param committedCapital cost of the currently open positions
     * @param dailyPnl         realised P&L today
     * @param dailyTrades      entries today across all symbols
     */
    public RiskMetrics calculate(
            List<Trade> closingTrades,
            BigDecimal initialCapital,
            BigDecimal capital,
            BigDecimal committedCapital,
            BigDecimal dailyPnl,
            int dailyTrades) {
        List<BigDecimal> pnls = closingTrades.stream()
                .filter(Trade::isClosing)
                .sorted((a, b) -> a.getTimestamp().compareTo(b.getTimestamp()))
                .map(Trade::getPnl)
                .toList();

        RiskMetrics.RiskMetricsBuilder builder = RiskMetrics.builder()
                .totalCapital(capital)
                .availableCapital(capital.subtract(committedCapital))
                .dailyPnl(dailyPnl)
                .dailyTrades(dailyTrades)
                .closedTrades(pnls.size());

        if (pnls.isEmpty()) {
            return builder.maxDrawdown(BigDecimal.ZERO)
                    .winRate(BigDecimal.ZERO)
                    .profitFactor(BigDecimal.ZERO)
                    .sharpeRatio(BigDecimal.ZERO)
                    .build();
        }

        List<BigDecimal> equityCurve = equityCurve(initialCapital, pnls);
        RiskMetrics metrics = builder.winRate(calculateWinRate(pnls))
                .profitFactor(calculateProfitFactor(pnls))
                .maxDrawdown(calculateMaxDrawdown(equityCurve))
                .sharpeRatio(calculateSharpeRatio(equityCurve))
                .build();
        log.debug(
                "Risk metrics over {} trades: winRate={} PF={} maxDD={}",
                pnls.size(),
                metrics.getWinRate(),
                metrics.getProfitFactor(),
                metrics.getMaxDrawdown());
        return metrics;
    }

    BigDecimal calculateWinRate(List<BigDecimal> pnls) {
        long wins = pnls.stream().filter(p -> p.signum() > 0).count();
        return BigDecimal.valueOf(wins)
                .divide(BigDecimal.valueOf(pnls.size()), 4, RoundingMode.HALF_UP)
                .multiply(HUNDRED)
                .setScale(2, RoundingMode.HALF_UP);
    }

    BigDecimal calculateProfitFactor(List<BigDecimal> pnls) {
        BigDecimal grossProfit =
                pnls.stream().filter(p -> p.signum() > 0).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal grossLoss = pnls.stream()
                .filter(p -> p.signum() < 0)
                .map(BigDecimal::abs)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (grossLoss.signum() > 0) {
            return grossProfit.divide(grossLoss, 2, RoundingMode.HALF_UP);
        }
        return grossProfit.signum() > 0 ? NO_LOSS_PROFIT_FACTOR : BigDecimal.ZERO;
    }

    /** Largest peak-to-trough fall of the equity curve, as a percentage of the peak. */
    BigDecimal calculateMaxDrawdown(List<BigDecimal> equityCurve) {
        BigDecimal peak = equityCurve.get(0);
        BigDecimal maxDrawdown = BigDecimal.ZERO;
        for (BigDecimal equity : equityCurve) {
            if (equity.compareTo(peak) > 0) {
                peak = equity;
            }
            if (peak.signum() > 0) {
                BigDecimal drawdown =
                        peak.subtract(equity).multiply(HUNDRED).divide(peak, 4, RoundingMode.HALF_UP);
                if (drawdown.compareTo(maxDrawdown) > 0) {
                    maxDrawdown = drawdown;
                }
            }
        }
        return maxDrawdown.setScale(2, RoundingMode.HALF_UP);
    }

    BigDecimal calculateSharpeRatio(List<BigDecimal> equityCurve) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < equityCurve.size(); i++) {
            double previous = equityCurve.get(i - 1).doubleValue();
            if (previous != 0) {
                returns.add(equityCurve.get(i).doubleValue() / previous - 1.0);
            }
        }
        if (returns.size() < 2) {
            return BigDecimal.ZERO;
        }

        double mean = returns.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        double variance = returns.stream()
                        .mapToDouble(r -> (r - mean) * (r - mean))
                        .sum()
                / (returns.size() - 1);
        double stdDev = Math.sqrt(variance);
        if (stdDev == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(mean / stdDev * Math.sqrt(TRADING_DAYS_PER_YEAR)).setScale(2, RoundingMode.HALF_UP);
    }

    private List<BigDecimal> equityCurve(BigDecimal initialCapital, List<BigDecimal> pnls) {
        List<BigDecimal> curve = new ArrayList<>(pnls.size() + 1);
        BigDecimal equity = initialCapital;
        curve.add(equity);
        for (BigDecimal pnl : pnls) {
            equity = equity.add(pnl);
            curve.add(equity);
        }
        return curve;
    }
}
