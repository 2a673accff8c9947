package com.marketscan.money;

import com.marketscan.domain.enums.PositionSizingType;
import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for sizing and exits, loaded from application.yml.
 *
 * <p>Properties prefix: {@code marketscan.money.*}.
 *
 * <p>Defaults:
 * <ul>
 *   <li>sizingType: ATR_RISK</li>
 *   <li>riskPercentage: 2.0 (risk at most 2% of capital per trade)</li>
 *   <li>atrPeriod: 14</li>
 *   <li>stopLossAtrMultiple: 2, takeProfitAtrMultiple: 4</li>
 *   <li>trailingStopPercentage: 1.0 (exit on a 1% retrace from the peak)</li>
 *   <li>kellyMinTrades: 10 (closed trades before half-Kelly takes over from ATR sizing)</li>
 * </ul>
 */
@Data
@Component
@ConfigurationProperties(prefix = "marketscan.money")
public class MoneyManagementConfig {

    private PositionSizingType sizingType = PositionSizingType.ATR_RISK;
    private BigDecimal riskPercentage = new BigDecimal("2.0");
    private int atrPeriod = 14;
    private BigDecimal stopLossAtrMultiple = new BigDecimal("2");
    private BigDecimal takeProfitAtrMultiple = new BigDecimal("4");
    private BigDecimal trailingStopPercentage = new BigDecimal("1.0");
    private int kellyMinTrades = 10;
}
