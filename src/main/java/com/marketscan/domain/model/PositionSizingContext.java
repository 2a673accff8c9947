package com.marketscan.domain.model;

import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Inputs for a sizing decision.
 *
 * <p>{@code closedTradePnls} feeds the half-Kelly sizer; the ATR sizer ignores it.
 */
@Value
@Builder
public class PositionSizingContext {

    String symbol;
    BigDecimal capital;
    BigDecimal price;
    BigDecimal atr;

    @Builder.Default
    List<BigDecimal> closedTradePnls = List.of();
}
