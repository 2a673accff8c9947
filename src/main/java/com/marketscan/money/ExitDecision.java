package com.marketscan.money;

import com.marketscan.domain.enums.ExitReason;
import com.marketscan.domain.model.Position;

/**
 * Result of evaluating an open position against the latest price.
 *
 * @param position the position with its trailing peak advanced to the latest price where
 *                 that price was more favourable; the ledger stores it when no exit fires
 * @param reason   why the position must close, or null to keep holding
 */
public record ExitDecision(Position position, ExitReason reason) {

    public boolean shouldExit() {
        return reason != null;
    }
}
