package com.marketscan.risk;

import com.marketscan.exception.RiskLimitExceededException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Pre-entry gate on daily loss and per-symbol entry count.
 *
 * <p>Checks (all evaluated, not short-circuited):
 * <ol>
 *   <li>Daily loss so far has reached {@code dailyLossPercentage} of the capital held at the
 *       start of the day</li>
 *   <li>The symbol has had {@code maxTradesPerSymbolPerDay} entries today</li>
 * </ol>
 *
 * <p>Only new entries are gated; closing an open position is always allowed.
 */
@Component
public class DailyRiskGate {

    private static final Logger log = LoggerFactory.getLogger(DailyRiskGate.class);

    private final RiskLimits riskLimits;

    public DailyRiskGate(RiskLimits riskLimits) {
        this.riskLimits = riskLimits;
    }

    public RiskValidationResult validate(String symbol, RiskState riskState) {
        List<RiskViolation> violations = new ArrayList<>();

        BigDecimal lossLimit = dailyLossLimit(riskState.getStartOfDayCapital());
        BigDecimal lossSoFar = riskState.getDailyLossSoFar();
        if (lossSoFar.compareTo(lossLimit) >= 0) {
            violations.add(RiskViolation.dailyLoss(lossLimit, lossSoFar));
        }

        int trades = riskState.getTradesToday(symbol);
        if (trades >= riskLimits.getMaxTradesPerSymbolPerDay()) {
            violations.add(RiskViolation.tradeCount(symbol, riskLimits.getMaxTradesPerSymbolPerDay(), trades));
        }

        if (violations.isEmpty()) {
            return RiskValidationResult.approved();
        }
        return RiskValidationResult.rejected(violations);
    }

    /**
     * Same checks as {@link #validate}, throwing on rejection.
     *
     * @throws RiskLimitExceededException carrying the violations as details
     */
    public void enforce(String symbol, RiskState riskState) {
        RiskValidationResult result = validate(symbol, riskState);
        if (result.isRejected()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("symbol", symbol);
            result.violations().forEach(v -> details.put(v.kind().name(), Map.of("limit", v.limit(), "actual", v.actual())));
            log.debug("Entry blocked for {}: {}", symbol, result.violations());
            throw new RiskLimitExceededException(
                    "Risk limits block new entries for " + symbol + ": " + result.violations(), details);
        }
    }

    BigDecimal dailyLossLimit(BigDecimal capital) {
        return capital.multiply(riskLimits.getDailyLossPercentage()).divide(BigDecimal.valueOf(100), 2, RoundingMode.HALF_UP);
    }
}
