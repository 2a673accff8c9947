package com.marketscan.money;

import com.marketscan.domain.enums.ExitReason;
import com.marketscan.domain.enums.PositionSide;
import com.marketscan.domain.model.Position;
import com.marketscan.domain.model.PositionSizingContext;
import com.marketscan.exception.InsufficientDataException;
import com.marketscan.indicator.TechnicalIndicators;
import com.marketscan.strategy.Vote;
import com.marketscan.timeseries.Candle;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Sizing, protective levels and exit evaluation for paper positions.
 *
 * <p>Levels are ATR multiples around the entry: the stop sits {@code stopLossAtrMultiple}
 * ATRs against the position and the target {@code takeProfitAtrMultiple} ATRs in its favour.
 *
 * <p>Exit rules are checked in a fixed order: take-profit, stop-loss, then the trailing stop.
 * The trailing stop arms once the position has traded beyond its entry price and fires on a
 * {@code trailingStopPercentage} retrace from the best price seen.
 */
@Service
public class MoneyManager {

    private static final Logger log = LoggerFactory.getLogger(MoneyManager.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal ATR_FALLBACK_FRACTION = new BigDecimal("0.02");

    private final MoneyManagementConfig moneyManagementConfig;
    private final PositionSizerRegistry positionSizerRegistry;

    public MoneyManager(MoneyManagementConfig moneyManagementConfig, PositionSizerRegistry positionSizerRegistry) {
        this.moneyManagementConfig = moneyManagementConfig;
        this.positionSizerRegistry = positionSizerRegistry;
    }

    /**
     * Latest ATR of the window. Falls back to 2% of the last close when the window is too
     * short for the ATR period.
     */
    public BigDecimal currentAtr(List<Candle> candles) {
        BigDecimal lastClose = candles.get(candles.size() - 1).getClose();
        try {
            double atr = TechnicalIndicators.last(TechnicalIndicators.atr(candles, moneyManagementConfig.getAtrPeriod()));
            if (!Double.isNaN(atr) && atr > 0) {
                return BigDecimal.valueOf(atr).setScale(4, RoundingMode.HALF_UP);
            }
        } catch (InsufficientDataException e) {
            log.debug("ATR fallback for {}: {}", candles.get(0).getSymbol(), e.getMessage());
        }
        return lastClose.multiply(ATR_FALLBACK_FRACTION).setScale(4, RoundingMode.HALF_UP);
    }

    /**
     * Sizes an entry in the direction of the decision. HOLD never produces a plan.
     *
     * @throws IllegalArgumentException for a HOLD decision
     */
    public EntryPlan planEntry(
            String symbol,
            Vote decision,
            BigDecimal price,
            BigDecimal atr,
            BigDecimal capital,
            List<BigDecimal> closedTradePnls) {
        if (decision == Vote.HOLD) {
            throw new IllegalArgumentException("Cannot plan an entry for a HOLD decision");
        }
        PositionSide side = decision == Vote.BUY ? PositionSide.LONG : PositionSide.SHORT;

        PositionSizingContext context = PositionSizingContext.builder()
                .symbol(symbol)
                .capital(capital)
                .price(price)
                .atr(atr)
                .closedTradePnls(closedTradePnls)
                .build();
        int quantity = positionSizerRegistry
                .sizerFor(moneyManagementConfig.getSizingType())
                .calculateQuantity(context);

        return new EntryPlan(side, quantity, stopLoss(side, price, atr), takeProfit(side, price, atr));
    }

    public BigDecimal stopLoss(PositionSide side, BigDecimal entryPrice, BigDecimal atr) {
        BigDecimal distance = atr.multiply(moneyManagementConfig.getStopLossAtrMultiple());
        BigDecimal level = side == PositionSide.LONG ? entryPrice.subtract(distance) : entryPrice.add(distance);
        return level.setScale(2, RoundingMode.HALF_UP);
    }

    public BigDecimal takeProfit(PositionSide side, BigDecimal entryPrice, BigDecimal atr) {
        BigDecimal distance = atr.multiply(moneyManagementConfig.getTakeProfitAtrMultiple());
        BigDecimal level = side == PositionSide.LONG ? entryPrice.add(distance) : entryPrice.subtract(distance);
        return level.setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Evaluates the exit rules for a position at the latest price.
     *
     * <p>The returned position carries the advanced trailing peak even when an exit fires, so
     * callers always see the peak the decision was made against.
     */
    public ExitDecision evaluateExit(Position position, BigDecimal price) {
        Position tracked = advanceTrailingPeak(position, price);

        if (position.isLong()) {
            if (price.compareTo(position.getTakeProfit()) >= 0) {
                return new ExitDecision(tracked, ExitReason.TAKE_PROFIT);
            }
            if (price.compareTo(position.getStopLoss()) <= 0) {
                return new ExitDecision(tracked, ExitReason.STOP_LOSS);
            }
        } else {
            if (price.compareTo(position.getTakeProfit()) <= 0) {
                return new ExitDecision(tracked, ExitReason.TAKE_PROFIT);
            }
            if (price.compareTo(position.getStopLoss()) >= 0) {
                return new ExitDecision(tracked, ExitReason.STOP_LOSS);
            }
        }

        if (trailingStopHit(tracked, price)) {
            return new ExitDecision(tracked, ExitReason.TRAILING_STOP);
        }
        return new ExitDecision(tracked, null);
    }

    /** Moves the trailing peak to {@code price} if it is more favourable; never moves it back. */
    Position advanceTrailingPeak(Position position, BigDecimal price) {
        BigDecimal peak = position.getTrailingPeak() != null ? position.getTrailingPeak() : position.getEntryPrice();
        boolean improved = position.isLong() ? price.compareTo(peak) > 0 : price.compareTo(peak) < 0;
        if (improved) {
            return position.withTrailingPeak(price);
        }
        if (position.getTrailingPeak() == null) {
            return position.withTrailingPeak(peak);
        }
        return position;
    }

    private boolean trailingStopHit(Position position, BigDecimal price) {
        BigDecimal peak = position.getTrailingPeak();
        BigDecimal retrace = moneyManagementConfig.getTrailingStopPercentage().divide(HUNDRED);
        if (position.isLong()) {
            if (peak.compareTo(position.getEntryPrice()) <= 0) {
                return false;
            }
            BigDecimal trigger = peak.multiply(BigDecimal.ONE.subtract(retrace));
            return price.compareTo(trigger) <= 0;
        }
        if (peak.compareTo(position.getEntryPrice()) >= 0) {
            return false;
        }
        BigDecimal trigger = peak.multiply(BigDecimal.ONE.add(retrace));
        return price.compareTo(trigger) >= 0;
    }
}
