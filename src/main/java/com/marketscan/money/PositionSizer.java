package com.marketscan.money;

import com.marketscan.domain.enums.PositionSizingType;
import com.marketscan.domain.model.PositionSizingContext;

/**
 * Calculates the number of shares for a new position.
 *
 * <p>Implementations never return more shares than the capital can buy at the current price.
 * Zero means the trade is suppressed.
 *
 * <p>Resolved by {@link PositionSizerRegistry} based on {@link PositionSizingType}.
 */
public interface PositionSizer {

    /**
     * @return number of shares, always {@code >= 0}
     */
    int calculateQuantity(PositionSizingContext positionSizingContext);

    PositionSizingType getType();
}
