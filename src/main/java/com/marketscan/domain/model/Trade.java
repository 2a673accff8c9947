package com.marketscan.domain.model;

import com.marketscan.domain.enums.OrderSide;
import com.marketscan.domain.enums.TradeStatus;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * One entry in the ledger's trade history.
 *
 * <p>Opening trades carry a null {@code pnl}; closing trades carry the realised P&L of the
 * position they closed. Status transitions produce a new instance.
 */
@Value
@Builder(toBuilder = true)
public class Trade {

    String id;
    String symbol;
    OrderSide side;
    int quantity;
    BigDecimal price;
    TradeStatus status;
    LocalDateTime timestamp;
    String strategyId;
    BigDecimal pnl;

    public boolean isClosing() {
        return pnl != null;
    }

    public Trade withStatus(TradeStatus newStatus) {
        return toBuilder().status(newStatus).build();
    }
}
